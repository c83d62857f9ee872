package com.scalarset;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * A mutable set of scalar values (integers and strings by default) with
 * insertion-order iteration and O(1) conversion to and from a
 * {@link KeyMapping}.
 *
 * <p>Membership is stored as the keys of a {@link LinkedHashMap}; the mapped
 * value is a marker that is never read. Bulk operations accept anything the
 * constructor accepts: another set, a key mapping, an {@link Iterable}, an
 * {@link Iterator} or an {@code Object[]}.</p>
 *
 * <p>Indexed access follows {@link IndexedAccess}:</p>
 * <pre>
 * ScalarSet set = new ScalarSet();
 * set.set(0, true);       // add
 * set.set(-900, true);
 * set.set(0, false);      // remove
 * set.get(-900);          // true
 * set.unset(-900);        // throws NotSupportedException
 * </pre>
 *
 * <p>Storage is copy-on-write: {@link #toArrayKeys()}, {@link #copyOf} and
 * {@link #iterator()} hand out the current map without copying it, and this
 * set copies the map before its next mutation.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class ScalarSet implements Iterable<Object>, IndexedAccess {

    private static final Boolean PRESENT = Boolean.TRUE;

    private final SetConfig config;
    private LinkedHashMap<Object, Boolean> entries;

    /** True while {@link #entries} is also referenced by a mapping, iterator or other set */
    private boolean shared;

    /**
     * Creates an empty set accepting integers and strings.
     */
    public ScalarSet() {
        this(SetConfig.defaults());
    }

    /**
     * Creates an empty set with the given config.
     */
    public ScalarSet(SetConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.entries = new LinkedHashMap<>();
    }

    /**
     * O(n) Creates a set from the given contents. A ScalarSet or KeyMapping is
     * copied together with its config; any other contents get a set accepting
     * integers and strings.
     *
     * @param contents a ScalarSet, KeyMapping, Iterable, Iterator or Object[]
     * @throws InvalidInputException if contents is none of those, or holds an element that is not accepted
     * @throws NullPointerException if contents or one of its elements is null
     */
    public ScalarSet(Object contents) {
        this(contents, configOf(contents));
    }

    /**
     * O(n) Creates a set from the given contents. Duplicates collapse to their first occurrence.
     *
     * @param contents a ScalarSet, KeyMapping, Iterable, Iterator or Object[]
     * @param config accepted element types
     * @throws InvalidInputException if contents is none of those, or holds an element that is not accepted
     * @throws NullPointerException if contents or one of its elements is null
     */
    public ScalarSet(Object contents, SetConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        LinkedHashMap<Object, Boolean> keys = toKeys(contents, true);
        if (contents instanceof ScalarSet && keys == ((ScalarSet) contents).entries) {
            ((ScalarSet) contents).shared = true;
            shared = true;
        } else if (contents instanceof KeyMapping) {
            shared = keys == ((KeyMapping) contents).entries();
        }
        this.entries = keys;
    }

    private ScalarSet(LinkedHashMap<Object, Boolean> entries, SetConfig config) {
        this.config = config;
        this.entries = entries;
        this.shared = true;
    }

    /**
     * O(1) Creates a set from a mapping produced by {@link #toArrayKeys()}.
     * The keys are not validated again. The new set has the config of the
     * set the mapping came from.
     */
    public static ScalarSet fromKeyMapping(KeyMapping mapping) {
        Objects.requireNonNull(mapping, "mapping must not be null");
        return new ScalarSet(mapping.entries(), mapping.config());
    }

    /**
     * O(1) Copies a set, keeping its config.
     */
    public static ScalarSet copyOf(ScalarSet other) {
        return fromKeyMapping(other.toArrayKeys());
    }

    /**
     * Returns the union of all inputs as a new set. The result accepts integers,
     * strings and every type accepted by an input ScalarSet or KeyMapping.
     *
     * @param inputs sets or sequences, each anything the constructor accepts
     */
    public static ScalarSet unionAll(Iterable<?> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        SetConfig.Builder builder = SetConfig.builder();
        for (Object input : inputs) {
            for (Class<?> type : configOf(input).getAcceptedTypes()) {
                builder.accept(type);
            }
        }
        ScalarSet union = new ScalarSet(builder.build());
        for (Object input : inputs) {
            union.addAll(input);
        }
        return union;
    }

    /**
     * Returns a new set holding the members of {@code a} that are also in {@code b},
     * in the order of {@code a}.
     */
    public static ScalarSet intersect(Object a, Object b) {
        ScalarSet result = a instanceof ScalarSet ? copyOf((ScalarSet) a) : new ScalarSet(a);
        result.retainAll(b);
        return result;
    }

    /**
     * @return the config deciding which element types this set accepts
     */
    public SetConfig getConfig() {
        return config;
    }

    /**
     * O(1) Adds the element, if not already present.
     *
     * @throws NullPointerException if e is null
     * @throws InvalidInputException if the element's type is not accepted
     */
    public void add(Object e) {
        config.validate(e);
        if (!entries.containsKey(e)) {
            mutableEntries().put(e, PRESENT);
        }
    }

    /**
     * O(1) Removes the element, if present.
     *
     * @throws NullPointerException if e is null
     */
    public void remove(Object e) {
        Objects.requireNonNull(e, "Null elements are not supported");
        if (entries.containsKey(e)) {
            mutableEntries().remove(e);
        }
    }

    /**
     * O(1) Returns true if the element is present.
     *
     * @throws NullPointerException if e is null
     */
    public boolean contains(Object e) {
        Objects.requireNonNull(e, "Null elements are not supported");
        return entries.containsKey(e);
    }

    /**
     * O(1)
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * O(1) Returns the number of elements.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Same as {@link #size()}.
     */
    public int count() {
        return size();
    }

    /**
     * O(1) Removes all elements.
     */
    public void clear() {
        entries = new LinkedHashMap<>();
        shared = false;
    }

    /**
     * O(n) Union. Adds every element of {@code other} not already present, in the order of {@code other}.
     *
     * @throws InvalidInputException if other cannot be used as a set
     */
    public void addAll(Object other) {
        if (other == this) {
            return;
        }
        LinkedHashMap<Object, Boolean> keys = toKeys(other, true);
        if (keys.isEmpty()) {
            return;
        }
        Map<Object, Boolean> target = mutableEntries();
        for (Object key : keys.keySet()) {
            target.put(key, PRESENT);
        }
    }

    /**
     * O(n) Difference. Removes every element of {@code other} from this set.
     *
     * @throws InvalidInputException if other cannot be used as a set
     */
    public void removeAll(Object other) {
        if (other == this) {
            clear();
            return;
        }
        LinkedHashMap<Object, Boolean> keys = toKeys(other, false);
        if (entries.isEmpty() || keys.isEmpty()) {
            return;
        }
        Map<Object, Boolean> target = mutableEntries();
        for (Object key : keys.keySet()) {
            target.remove(key);
        }
    }

    /**
     * O(n) Intersection. Removes every element that is not in {@code other}.
     *
     * @throws InvalidInputException if other cannot be used as a set
     */
    public void retainAll(Object other) {
        if (other == this) {
            return;
        }
        LinkedHashMap<Object, Boolean> keys = toKeys(other, false);
        if (entries.isEmpty()) {
            return;
        }
        mutableEntries().keySet().retainAll(keys.keySet());
    }

    /**
     * O(n) Returns true if every element of {@code other} is present.
     *
     * @throws InvalidInputException if other cannot be used as a set
     */
    public boolean containsAll(Object other) {
        if (other == this) {
            return true;
        }
        return entries.keySet().containsAll(toKeys(other, false).keySet());
    }

    /**
     * O(n) Returns true if {@code other} holds exactly the elements of this set, in any order.
     * Accepts anything the constructor accepts; any other value yields false.
     */
    public boolean sameElements(Object other) {
        if (other == this) {
            return true;
        }
        if (other == null) {
            return false;
        }
        LinkedHashMap<Object, Boolean> keys;
        try {
            keys = toKeys(other, false);
        } catch (InvalidInputException | NullPointerException e) {
            // not a set, or holds elements this set could never contain
            return false;
        }
        return sameKeys(keys);
    }

    /**
     * O(n) Two sets are equal when they hold the same elements, in any order
     * and regardless of their configs. Never throws. Anything that is not a
     * ScalarSet is unequal, so the comparison stays symmetric; to compare
     * against a sequence or a key mapping use {@link #sameElements(Object)}.
     *
     * @see #sameElements(Object)
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarSet)) return false;
        return sameKeys(((ScalarSet) o).entries);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Object key : entries.keySet()) {
            h += key.hashCode();
        }
        return h;
    }

    /**
     * O(n) Returns the elements in insertion order.
     */
    public Object[] toArray() {
        return entries.keySet().toArray();
    }

    /**
     * O(n) Returns the elements in insertion order as an unmodifiable list.
     */
    public List<Object> toList() {
        return List.copyOf(entries.keySet());
    }

    /**
     * O(1) Returns the elements as the keys of a mapping. Do not depend on the
     * marker values. {@code ScalarSet.fromKeyMapping(set.toArrayKeys())} is an
     * O(1) copy of {@code set}.
     */
    public KeyMapping toArrayKeys() {
        shared = true;
        return new KeyMapping(entries, config);
    }

    /**
     * Returns an iterator over a snapshot of the elements in insertion order,
     * with positions 0, 1, 2 ... n-1.
     */
    @Override
    public OrderedKeyIterator iterator() {
        shared = true;
        return new OrderedKeyIterator(entries);
    }

    /**
     * O(1) Same as {@link #contains(Object)}.
     */
    @Override
    public boolean get(Object key) {
        return contains(key);
    }

    /**
     * O(1) {@code true} adds the key, {@code false} removes it.
     */
    @Override
    public void set(Object key, boolean present) {
        if (present) {
            add(key);
        } else {
            remove(key);
        }
    }

    /**
     * @throws NotSupportedException always; use {@link #contains(Object)}
     * @deprecated ambiguous between "is non-null" and "is a member"
     */
    @Deprecated
    @Override
    public boolean exists(Object key) {
        throw new NotSupportedException(ScalarSet.class, IndexedOperation.EXISTS);
    }

    /**
     * @throws NotSupportedException always; use {@link #remove(Object)}
     * @deprecated ambiguous between "remove" and "set to false"
     */
    @Deprecated
    @Override
    public void unset(Object key) {
        throw new NotSupportedException(ScalarSet.class, IndexedOperation.UNSET);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Object key : entries.keySet()) {
            joiner.add(String.valueOf(key));
        }
        return joiner.toString();
    }

    private boolean sameKeys(Map<Object, Boolean> keys) {
        return entries.size() == keys.size() && entries.keySet().containsAll(keys.keySet());
    }

    /**
     * Returns storage that may be written, copying it first if it is shared.
     */
    private LinkedHashMap<Object, Boolean> mutableEntries() {
        if (shared) {
            entries = new LinkedHashMap<>(entries);
            shared = false;
        }
        return entries;
    }

    /**
     * Turns caller-supplied contents into a key-presence mapping. The result
     * may be the storage of another set or mapping and must not be written.
     *
     * @param inserting true if the keys will be added to this set, so each must pass this set's config;
     *                  otherwise any scalar key will do
     */
    private LinkedHashMap<Object, Boolean> toKeys(Object contents, boolean inserting) {
        Objects.requireNonNull(contents, "Set contents cannot be null");
        if (contents instanceof ScalarSet) {
            ScalarSet other = (ScalarSet) contents;
            return trusted(other.entries, other.config, inserting);
        } else if (contents instanceof KeyMapping) {
            KeyMapping mapping = (KeyMapping) contents;
            return trusted(mapping.entries(), mapping.config(), inserting);
        } else if (contents instanceof Iterable) {
            return collect(((Iterable<?>) contents).iterator(), inserting);
        } else if (contents instanceof Iterator) {
            return collect((Iterator<?>) contents, inserting);
        } else if (contents instanceof Object[]) {
            return collect(Arrays.asList((Object[]) contents).iterator(), inserting);
        } else {
            throw InvalidInputException.notASet(contents);
        }
    }

    /**
     * Config a copy of the contents should carry: the source's own for a set or
     * mapping, the defaults for anything else.
     */
    private static SetConfig configOf(Object contents) {
        if (contents instanceof ScalarSet) {
            return ((ScalarSet) contents).config;
        } else if (contents instanceof KeyMapping) {
            return ((KeyMapping) contents).config();
        }
        return SetConfig.defaults();
    }

    private LinkedHashMap<Object, Boolean> trusted(LinkedHashMap<Object, Boolean> keys, SetConfig origin,
                                                   boolean inserting) {
        if (!inserting || origin.equals(config)) {
            return keys;
        }
        return collect(keys.keySet().iterator(), true);
    }

    private LinkedHashMap<Object, Boolean> collect(Iterator<?> values, boolean inserting) {
        LinkedHashMap<Object, Boolean> keys = new LinkedHashMap<>();
        while (values.hasNext()) {
            Object value = values.next();
            keys.put(inserting ? config.validate(value) : requireScalar(value), PRESENT);
        }
        return keys;
    }

    private static Object requireScalar(Object value) {
        Objects.requireNonNull(value, "Null elements are not supported");
        if (!SetConfig.SCALAR_TYPES.contains(value.getClass())) {
            throw InvalidInputException.notAnElement(value);
        }
        return value;
    }
}
