package io.wahdex.storage;

/**
 * Converts values to and from the bytes stored under a key.
 *
 * @param <T> value type
 */
public interface ValueSerializer<T> {
    byte[] serialize(T value);

    /**
     * @param bytes        stored bytes, or null if the key is absent
     * @param missingValue value to return when bytes is null
     */
    T deserialize(byte[] bytes, T missingValue);
}
