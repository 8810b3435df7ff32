package io.wahdex.index;

import io.wahdex.kernel.CompressedBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bitmap index from a value to the set of documents holding it.
 * <p>
 * Each key maps to an immutable {@link CompressedBitmap} of document ids. Writers
 * replace the bitmap through {@link ConcurrentHashMap#compute}, so concurrent readers
 * always see a complete bitmap. Keys whose bitmap becomes empty are dropped.
 *
 * @param <K> indexed value type
 */
public final class BitmapIndex<K> {
    private static final Logger LOG = LoggerFactory.getLogger(BitmapIndex.class);

    private final ConcurrentHashMap<K, CompressedBitmap> index = new ConcurrentHashMap<>();

    public void add(K key, int doc) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (doc < 0) {
            throw new IllegalArgumentException("doc must be non-negative: " + doc);
        }
        index.compute(key, (ignored, existing) -> {
            var builder = existing == null ? CompressedBitmap.EMPTY.toBuilder() : existing.toBuilder();
            return builder.set(doc).build();
        });
    }

    public void remove(K key, int doc) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (doc < 0) {
            throw new IllegalArgumentException("doc must be non-negative: " + doc);
        }
        index.computeIfPresent(key, (ignored, existing) -> {
            var updated = existing.toBuilder().clear(doc).build();
            return updated.isEmpty() ? null : updated;
        });
    }

    /**
     * Remove all documents for the given key.
     */
    public void removeAll(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (index.remove(key) != null) {
            LOG.debug("Removed key {}", key);
        }
    }

    public void clear() {
        index.clear();
        LOG.debug("Cleared bitmap index");
    }

    public CompressedBitmap lookup(K key) {
        if (key == null) {
            return CompressedBitmap.EMPTY;
        }
        var bitmap = index.get(key);
        return bitmap == null ? CompressedBitmap.EMPTY : bitmap;
    }

    /**
     * Documents holding every one of the keys.
     */
    public CompressedBitmap lookupAll(Collection<K> keys) {
        if (keys == null || keys.isEmpty()) {
            return CompressedBitmap.EMPTY;
        }
        CompressedBitmap result = null;
        for (var key : keys) {
            var bitmap = lookup(key);
            if (bitmap.isEmpty()) {
                return CompressedBitmap.EMPTY;
            }
            result = result == null ? bitmap : result.and(bitmap);
            if (result.isEmpty()) {
                return CompressedBitmap.EMPTY;
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("AND over {} keys matched {}", keys.size(), result.bounds());
        }
        return result;
    }

    /**
     * Documents holding at least one of the keys.
     */
    public CompressedBitmap lookupAny(Collection<K> keys) {
        if (keys == null || keys.isEmpty()) {
            return CompressedBitmap.EMPTY;
        }
        var builder = CompressedBitmap.EMPTY.toBuilder();
        for (var key : keys) {
            builder.or(lookup(key));
        }
        var result = builder.build();
        if (LOG.isDebugEnabled()) {
            LOG.debug("OR over {} keys matched {}", keys.size(), result.bounds());
        }
        return result;
    }

    public Set<K> keys() {
        return Set.copyOf(index.keySet());
    }

    public int size() {
        return index.size();
    }

    /**
     * Snapshot of the index entries.
     */
    public Map<K, CompressedBitmap> entries() {
        return new HashMap<>(index);
    }
}
