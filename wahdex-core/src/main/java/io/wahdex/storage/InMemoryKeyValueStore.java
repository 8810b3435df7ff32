package io.wahdex.storage;

import java.util.Arrays;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed {@link KeyValueStore}.
 * <p>
 * Reads are lock-free; each write replaces a single entry atomically.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentSkipListMap<byte[], byte[]> entries = new ConcurrentSkipListMap<>(Arrays::compareUnsigned);

    @Override
    public byte[] get(byte[] key) {
        requireKey(key);
        var value = entries.get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public void put(byte[] key, byte[] value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        entries.put(key.clone(), value.clone());
    }

    @Override
    public void delete(byte[] key) {
        requireKey(key);
        entries.remove(key);
    }

    @Override
    public void clearRange(byte[] from, byte[] to) {
        requireKey(from);
        requireKey(to);
        if (Arrays.compareUnsigned(from, to) >= 0) {
            return;
        }
        entries.subMap(from, true, to, false).clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static void requireKey(byte[] key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
    }
}
