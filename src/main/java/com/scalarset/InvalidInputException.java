package com.scalarset;

/**
 * Thrown when a caller-supplied value cannot be turned into set members:
 * the value is not a sequence, set or key mapping, or one of its elements
 * has a type the set does not accept.
 *
 * The message always names the concrete type of the rejected value.
 */
public class InvalidInputException extends IllegalArgumentException {

    /** Class of the value that was rejected */
    private final Class<?> rejectedType;

    /**
     * @param message descriptive message naming the rejected type
     * @param rejectedType class of the rejected value
     */
    public InvalidInputException(String message, Class<?> rejectedType) {
        super(message);
        this.rejectedType = rejectedType;
    }

    /**
     * Creates the exception for a value that cannot be used as set contents.
     */
    static InvalidInputException notASet(Object value) {
        Class<?> type = value.getClass();
        return new InvalidInputException("Cannot use a '" + type.getTypeName() + "' as a set", type);
    }

    /**
     * Creates the exception for an element whose type the set does not accept.
     */
    static InvalidInputException notAnElement(Object element) {
        Class<?> type = element.getClass();
        return new InvalidInputException("Cannot use a '" + type.getTypeName() + "' as a set element", type);
    }

    /**
     * @return the class of the rejected value
     */
    public Class<?> getRejectedType() {
        return rejectedType;
    }
}
