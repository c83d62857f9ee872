package com.scalarset;

/**
 * Thrown when a caller uses one of the disabled indexed-access variants
 * ({@link IndexedOperation#EXISTS} or {@link IndexedOperation#UNSET}).
 *
 * Example usage:
 * <pre>
 * try {
 *     set.unset("a");
 * } catch (NotSupportedException e) {
 *     // use set.remove("a") or set.set("a", false) instead
 *     System.err.println(e.getOperation() + " rejected");
 * }
 * </pre>
 */
public class NotSupportedException extends UnsupportedOperationException {

    /** The indexed-access variant that was rejected */
    private final IndexedOperation operation;

    /**
     * Creates a new NotSupportedException for the given operation.
     *
     * @param owner the class whose method was called
     * @param operation the rejected variant
     */
    public NotSupportedException(Class<?> owner, IndexedOperation operation) {
        super(owner.getSimpleName() + "." + operation.getMethodName() + " is not supported");
        this.operation = operation;
    }

    /**
     * @return the rejected indexed-access variant
     */
    public IndexedOperation getOperation() {
        return operation;
    }
}
