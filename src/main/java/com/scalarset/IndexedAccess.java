package com.scalarset;

/**
 * Array-like access keyed by element.
 *
 * <pre>
 *     set.get(e)          same as  set.contains(e)
 *     set.set(e, true)    same as  set.add(e)
 *     set.set(e, false)   same as  set.remove(e)
 *     set.exists(e)       throws NotSupportedException
 *     set.unset(e)        throws NotSupportedException
 * </pre>
 *
 * @see IndexedOperation
 */
public interface IndexedAccess {

    /**
     * @param key the element to probe
     * @return true iff the key is a member (not the element itself)
     */
    boolean get(Object key);

    /**
     * @param key the element to write
     * @param present true to add the key, false to remove it
     */
    void set(Object key, boolean present);

    /**
     * @throws NotSupportedException always
     */
    boolean exists(Object key);

    /**
     * @throws NotSupportedException always
     */
    void unset(Object key);
}
