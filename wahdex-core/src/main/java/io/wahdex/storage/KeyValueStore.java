package io.wahdex.storage;

/**
 * Ordered byte-key, byte-value store that bitmaps are persisted in.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Keys are ordered by unsigned lexicographic byte comparison.</li>
 *   <li>Values are opaque; the store never interprets them.</li>
 *   <li>Arrays passed in or handed out are never shared with the store's internal state.</li>
 * </ul>
 */
public interface KeyValueStore {
    /**
     * @return the value stored under key, or null if absent
     */
    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    /**
     * Remove a key. No-op when absent.
     */
    void delete(byte[] key);

    /**
     * Remove every key in {@code [from, to)}.
     */
    void clearRange(byte[] from, byte[] to);

    int size();
}
