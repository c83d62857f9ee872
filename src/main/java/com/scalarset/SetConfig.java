package com.scalarset;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for a {@link ScalarSet}.
 * Uses builder pattern for flexible configuration.
 *
 * <p>The only setting is which element types the set accepts. Values are
 * never coerced between types, so {@code "100"} and {@code 100} are two
 * different elements.</p>
 */
public final class SetConfig {

    /**
     * Types a set may be configured to accept. All are immutable value types
     * with value-based equals and hashCode.
     */
    public static final Set<Class<?>> SCALAR_TYPES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        Integer.class, Long.class, Short.class, Byte.class,
        String.class, Character.class, Boolean.class,
        Double.class, Float.class)));

    // Default values
    public static final Set<Class<?>> DEFAULT_ACCEPTED_TYPES =
        Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(Integer.class, String.class)));

    private static final SetConfig DEFAULTS = new Builder().build();

    private final Set<Class<?>> acceptedTypes;

    private SetConfig(Builder builder) {
        this.acceptedTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.acceptedTypes));
    }

    /**
     * Element classes this set accepts.
     */
    public Set<Class<?>> getAcceptedTypes() {
        return acceptedTypes;
    }

    /**
     * Returns true if the element's exact class is accepted.
     *
     * @param element the candidate element
     * @throws NullPointerException if element is null
     */
    public boolean accepts(Object element) {
        return acceptedTypes.contains(element.getClass());
    }

    /**
     * Checks an element before it is inserted.
     *
     * @param element the candidate element
     * @return the element
     * @throws NullPointerException if element is null
     * @throws InvalidInputException if the element's type is not accepted
     */
    public Object validate(Object element) {
        if (element == null) {
            throw new NullPointerException("Null elements are not supported");
        }
        if (!accepts(element)) {
            throw InvalidInputException.notAnElement(element);
        }
        return element;
    }

    /**
     * Create a new builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Config accepting integers and strings.
     */
    public static SetConfig defaults() {
        return DEFAULTS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetConfig)) return false;
        return acceptedTypes.equals(((SetConfig) o).acceptedTypes);
    }

    @Override
    public int hashCode() {
        return acceptedTypes.hashCode();
    }

    @Override
    public String toString() {
        return acceptedTypes.stream()
            .map(Class::getSimpleName)
            .collect(Collectors.joining(", ", "SetConfig[acceptedTypes=", "]"));
    }

    public static class Builder {
        private final Set<Class<?>> acceptedTypes = new LinkedHashSet<>(DEFAULT_ACCEPTED_TYPES);

        /**
         * Adds an accepted element type.
         *
         * @throws IllegalArgumentException if the type is not one of {@link #SCALAR_TYPES}
         */
        public Builder accept(Class<?> type) {
            checkScalar(type);
            acceptedTypes.add(type);
            return this;
        }

        /**
         * Removes an accepted element type.
         */
        public Builder reject(Class<?> type) {
            acceptedTypes.remove(type);
            return this;
        }

        /**
         * Replaces the accepted element types.
         *
         * @throws IllegalArgumentException if any type is not one of {@link #SCALAR_TYPES}
         */
        public Builder acceptOnly(Class<?>... types) {
            for (Class<?> type : types) {
                checkScalar(type);
            }
            acceptedTypes.clear();
            acceptedTypes.addAll(Arrays.asList(types));
            return this;
        }

        public SetConfig build() {
            if (acceptedTypes.isEmpty()) {
                throw new IllegalArgumentException("At least one element type must be accepted");
            }
            return new SetConfig(this);
        }

        private static void checkScalar(Class<?> type) {
            if (type == null) {
                throw new IllegalArgumentException("Element type cannot be null");
            }
            if (!SCALAR_TYPES.contains(type)) {
                throw new IllegalArgumentException("Not a scalar element type: " + type.getName());
            }
        }
    }
}
