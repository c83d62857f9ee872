package com.scalarset;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Iterates the keys of a key-presence mapping as values, paired with a
 * synthetic position 0, 1, 2 ... n-1.
 *
 * <p>The iterator reads a snapshot: the owning set copies its storage before
 * the next mutation, so changes made after this iterator was created are not
 * visible here. The sequence can be replayed from the start with
 * {@link #restart()}.</p>
 *
 * <p>Besides the {@link Iterator} methods, the cursor can be driven directly:</p>
 * <pre>
 * for (it.restart(); it.valid(); it.advance()) {
 *     System.out.println(it.position() + " => " + it.current());
 * }
 * </pre>
 */
public class OrderedKeyIterator implements Iterator<Object> {

    private final Map<Object, ?> snapshot;
    private Iterator<Object> keys;
    private Object current;
    private boolean valid;
    private int position;

    OrderedKeyIterator(Map<Object, ?> snapshot) {
        this.snapshot = snapshot;
        restart();
    }

    /**
     * Moves the cursor back to the first entry and resets the position to 0.
     */
    public void restart() {
        keys = snapshot.keySet().iterator();
        position = 0;
        step();
    }

    /**
     * @return true while the cursor is on an entry
     */
    public boolean valid() {
        return valid;
    }

    /**
     * @return the element at the cursor
     * @throws NoSuchElementException if the iterator is exhausted
     */
    public Object current() {
        if (!valid) {
            throw new NoSuchElementException();
        }
        return current;
    }

    /**
     * Moves the cursor one entry forward. No-op once exhausted.
     */
    public void advance() {
        if (!valid) {
            return;
        }
        position++;
        step();
    }

    /**
     * @return the 0-based position of the cursor, independent of the element
     */
    public int position() {
        return position;
    }

    @Override
    public boolean hasNext() {
        return valid;
    }

    @Override
    public Object next() {
        Object element = current();
        advance();
        return element;
    }

    private void step() {
        valid = keys.hasNext();
        current = valid ? keys.next() : null;
    }
}
