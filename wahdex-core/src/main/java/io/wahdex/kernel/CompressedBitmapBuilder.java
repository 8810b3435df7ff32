package io.wahdex.kernel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.wahdex.kernel.CompressedWord.BITS_PER_WORD;

/**
 * Mutable working copy of a compressed bitmap.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Single writer: not safe for concurrent use without external synchronization.</li>
 *   <li>Words are kept in canonical form after every operation, so building the same
 *       logical bit vector always yields the same bytes.</li>
 *   <li>Setting bits past the current end appends in amortized O(1); any other update
 *       is one O(words) merge pass.</li>
 *   <li>{@link #build()} hands the result off and seals the builder; later mutations
 *       throw {@link IllegalStateException}.</li>
 * </ul>
 */
public final class CompressedBitmapBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(CompressedBitmapBuilder.class);

    private WordWriter words;
    private boolean built;

    public CompressedBitmapBuilder() {
        this.words = new WordWriter();
    }

    /**
     * Start from the words of an existing bitmap.
     */
    public CompressedBitmapBuilder(CompressedBitmap source) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        this.words = new WordWriter(source.count());
        for (var word : source) {
            words.append(word);
        }
        words.trimTrailingZeroes();
    }

    public CompressedBitmapBuilder set(int bit) {
        checkBit(bit);
        setRange(bit, bit);
        return this;
    }

    public CompressedBitmapBuilder clear(int bit) {
        checkBit(bit);
        clearRange(bit, bit);
        return this;
    }

    /**
     * Set the bits from {@code from} (inclusive) to {@code to} (exclusive).
     */
    public CompressedBitmapBuilder set(int from, int to) {
        checkRange(from, to);
        if (from < to) {
            setRange(from, to - 1);
        }
        return this;
    }

    /**
     * Clear the bits from {@code from} (inclusive) to {@code to} (exclusive).
     */
    public CompressedBitmapBuilder clear(int from, int to) {
        checkRange(from, to);
        if (from < to) {
            clearRange(from, to - 1);
        }
        return this;
    }

    public CompressedBitmapBuilder and(CompressedBitmap other) {
        return merge(other, BitOperation.AND);
    }

    public CompressedBitmapBuilder or(CompressedBitmap other) {
        return merge(other, BitOperation.OR);
    }

    public CompressedBitmapBuilder xor(CompressedBitmap other) {
        return merge(other, BitOperation.XOR);
    }

    public CompressedBitmapBuilder andNot(CompressedBitmap other) {
        return merge(other, BitOperation.AND_NOT);
    }

    /**
     * Complement the bits in {@code [0, length)}; every bit at or above {@code length} ends up cleared.
     */
    public CompressedBitmapBuilder not(int length) {
        ensureOpen();
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        var range = new WordWriter();
        if (length > 0) {
            range.appendRange(0, length - 1);
        }
        var out = new WordWriter(words.size() + 2);
        out.merge(new WordCursor(range.iterator()), new WordCursor(words.iterator()), BitOperation.AND_NOT);
        replace(out);
        return this;
    }

    /**
     * Test a bit of the working copy.
     */
    public boolean get(int bit) {
        if (bit < 0) {
            return false;
        }
        long p = 0;
        var iter = words.iterator();
        while (iter.hasNext()) {
            var word = iter.next();
            long n = p + word.span();
            if (n > bit) {
                if (word.isLiteral()) {
                    return (word.literalBits() & (1 << (int) (bit - p))) != 0;
                }
                return word.fillBit() == 1;
            }
            p = n;
        }
        return false;
    }

    public boolean isEmpty() {
        return words.size() == 0;
    }

    /**
     * Number of words the built bitmap will hold, header excluded.
     */
    public int wordCount() {
        return words.size();
    }

    /**
     * Seal the builder and return the bitmap.
     *
     * @return the new bitmap; {@link CompressedBitmap#EMPTY} if no bit is set
     */
    public CompressedBitmap build() {
        ensureOpen();
        built = true;
        if (words.size() == 0) {
            LOG.debug("Built empty compressed bitmap");
            return CompressedBitmap.EMPTY;
        }
        var buffer = words.toByteArray(CompressedBitmap.HEADER_SIZE);
        var bounds = CompressedBitmapBounds.compute(buffer, CompressedBitmap.HEADER_SIZE,
                Math.toIntExact(words.chunks()));
        if (bounds.isEmpty()) {
            return CompressedBitmap.EMPTY;
        }
        ByteWords.write(buffer, 0, bounds.highest());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Built compressed bitmap: {} words, bounds {}", words.size(), bounds);
        }
        return new CompressedBitmap(buffer, bounds);
    }

    private void setRange(int first, int last) {
        ensureOpen();
        long firstChunk = first / BITS_PER_WORD;
        long end = words.chunks();
        if (firstChunk >= end) {
            words.appendRange(first, last);
            return;
        }
        if (firstChunk == end - 1) {
            long lastChunk = last / BITS_PER_WORD;
            int top = lastChunk == firstChunk ? last % BITS_PER_WORD : BITS_PER_WORD - 1;
            if (words.orLastChunk(WordWriter.mask(first % BITS_PER_WORD, top))) {
                if (lastChunk > firstChunk) {
                    words.appendRange((int) (end * BITS_PER_WORD), last);
                }
                return;
            }
        }
        mergeRange(first, last, BitOperation.OR);
    }

    private void clearRange(int first, int last) {
        ensureOpen();
        long firstChunk = first / BITS_PER_WORD;
        long end = words.chunks();
        if (firstChunk >= end) {
            return;
        }
        if (firstChunk == end - 1 && last / BITS_PER_WORD == firstChunk
                && words.andLastChunk(~WordWriter.mask(first % BITS_PER_WORD, last % BITS_PER_WORD))) {
            return;
        }
        mergeRange(first, last, BitOperation.AND_NOT);
    }

    private void mergeRange(int first, int last, BitOperation operation) {
        var range = new WordWriter();
        range.appendRange(first, last);
        var out = new WordWriter(words.size() + 3);
        out.merge(new WordCursor(words.iterator()), new WordCursor(range.iterator()), operation);
        replace(out);
    }

    private CompressedBitmapBuilder merge(CompressedBitmap other, BitOperation operation) {
        ensureOpen();
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        var out = new WordWriter(words.size() + other.count());
        out.merge(new WordCursor(words.iterator()), new WordCursor(other.iterator()), operation);
        replace(out);
        return this;
    }

    private void replace(WordWriter merged) {
        merged.trimTrailingZeroes();
        words = merged;
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("builder already built; start a new one with CompressedBitmap.toBuilder()");
        }
    }

    private static void checkBit(int bit) {
        if (bit < 0) {
            throw new IllegalArgumentException("bit offset must be non-negative: " + bit);
        }
    }

    private static void checkRange(int from, int to) {
        if (from < 0) {
            throw new IllegalArgumentException("from must be non-negative: " + from);
        }
        if (to < from) {
            throw new IllegalArgumentException("to " + to + " below from " + from);
        }
    }
}
