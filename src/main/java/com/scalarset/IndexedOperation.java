package com.scalarset;

/**
 * The four variants of indexed access on a {@link ScalarSet}.
 *
 * Only {@link #GET} and {@link #SET} are implemented. The other two are
 * terminal variants that always fail with a {@link NotSupportedException}:
 * - EXISTS would be ambiguous between "is non-null" and "is a member"
 * - UNSET would be ambiguous between "remove" and "set to false"
 */
public enum IndexedOperation {
    /**
     * Membership probe: returns true iff the key is a member.
     */
    GET("get", true),

    /**
     * Conditional write: true adds the key, false removes it.
     */
    SET("set", true),

    /**
     * Existence check. Always rejected.
     */
    EXISTS("exists", false),

    /**
     * Deletion. Always rejected.
     */
    UNSET("unset", false);

    private final String methodName;
    private final boolean supported;

    IndexedOperation(String methodName, boolean supported) {
        this.methodName = methodName;
        this.supported = supported;
    }

    /**
     * @return the name of the {@link IndexedAccess} method for this variant
     */
    public String getMethodName() {
        return methodName;
    }

    /**
     * @return true if a {@link ScalarSet} implements this variant
     */
    public boolean isSupported() {
        return supported;
    }
}
