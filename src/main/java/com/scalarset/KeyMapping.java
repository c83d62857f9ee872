package com.scalarset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The key-presence mapping behind a {@link ScalarSet}: each element is a key,
 * and the value is a marker that carries no meaning.
 *
 * <p>Instances are only created by {@link ScalarSet#toArrayKeys()}, so every
 * mapping holds keys that already passed a set's validation. That is what lets
 * {@link ScalarSet#fromKeyMapping(KeyMapping)} adopt one in O(1) without
 * checking each key.</p>
 *
 * <p>The mapping shares storage with the set that produced it. Whichever side
 * is mutated first copies the storage, so neither sees the other's later
 * changes.</p>
 */
public final class KeyMapping {

    private final LinkedHashMap<Object, Boolean> entries;
    private final SetConfig config;

    KeyMapping(LinkedHashMap<Object, Boolean> entries, SetConfig config) {
        this.entries = entries;
        this.config = config;
    }

    LinkedHashMap<Object, Boolean> entries() {
        return entries;
    }

    SetConfig config() {
        return config;
    }

    /**
     * Read-only view of the mapping. Do not depend on the marker values.
     */
    public Map<Object, Boolean> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public boolean containsKey(Object key) {
        return key != null && entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }
}
