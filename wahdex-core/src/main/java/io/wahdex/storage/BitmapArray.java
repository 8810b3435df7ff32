package io.wahdex.storage;

import io.wahdex.core.BitmapFormatException;
import io.wahdex.core.WahdexConfiguration;
import io.wahdex.kernel.CompressedBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sparse array of values stored in a {@link KeyValueStore}, one key per index.
 * <p>
 * Keys are the 8-byte big-endian index, so store order matches index order.
 * Absent entries read as the serializer's missing value. The array assumes it is the
 * only user of the store's non-negative key range.
 *
 * @param <T> element type
 */
public final class BitmapArray<T> {
    private static final Logger LOG = LoggerFactory.getLogger(BitmapArray.class);
    private static final int KEY_SIZE = Long.BYTES;

    private final KeyValueStore store;
    private final ValueSerializer<T> serializer;
    private final WahdexConfiguration configuration;

    public BitmapArray(KeyValueStore store, ValueSerializer<T> serializer) {
        this(store, serializer, WahdexConfiguration.defaults());
    }

    public BitmapArray(KeyValueStore store, ValueSerializer<T> serializer, WahdexConfiguration configuration) {
        this.store = Objects.requireNonNull(store, "store");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * Array of compressed bitmaps.
     */
    public static BitmapArray<CompressedBitmap> ofBitmaps(KeyValueStore store, WahdexConfiguration configuration) {
        return new BitmapArray<>(store, CompressedBitmapSerializer.INSTANCE, configuration);
    }

    /**
     * @return the stored value, or null when absent
     * @throws BitmapFormatException if the stored bytes cannot be decoded
     */
    public T get(long index) {
        return get(index, null);
    }

    public T get(long index, T missingValue) {
        var bytes = store.get(key(index));
        T value;
        try {
            value = serializer.deserialize(bytes, missingValue);
        } catch (BitmapFormatException e) {
            LOG.warn("Corrupted value at index {} ({} bytes): {}", index, bytes.length, e.getMessage());
            throw e;
        }
        if (configuration.canonicalizeOnRead() && value instanceof CompressedBitmap bitmap && bytes != null) {
            @SuppressWarnings("unchecked")
            var canonical = (T) bitmap.toBuilder().build();
            return canonical;
        }
        return value;
    }

    public void set(long index, T value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        var key = key(index);
        var bytes = serializer.serialize(value);
        if (bytes.length == 0 && configuration.clearEmptyValues()) {
            store.delete(key);
            return;
        }
        store.put(key, bytes);
    }

    public void clear(long index) {
        store.delete(key(index));
    }

    /**
     * Remove every element of the array.
     */
    public void clear() {
        // non-negative indexes all encode below 0x80
        store.clearRange(new byte[KEY_SIZE], new byte[] {(byte) 0x80});
        LOG.debug("Cleared bitmap array");
    }

    static byte[] key(long index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        var key = new byte[KEY_SIZE];
        for (var i = KEY_SIZE - 1; i >= 0; i--) {
            key[i] = (byte) index;
            index >>>= 8;
        }
        return key;
    }
}
