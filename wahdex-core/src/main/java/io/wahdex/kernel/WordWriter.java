package io.wahdex.kernel;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static io.wahdex.kernel.CompressedWord.ALL_ONES;
import static io.wahdex.kernel.CompressedWord.ALL_ZEROES;
import static io.wahdex.kernel.CompressedWord.BITS_PER_WORD;
import static io.wahdex.kernel.CompressedWord.COUNT_MASK;
import static io.wahdex.kernel.CompressedWord.LITERAL_MASK;
import static io.wahdex.kernel.CompressedWord.MAX_FILL_COUNT;
import static io.wahdex.kernel.CompressedWord.TYPE_MASK;

/**
 * Append-only emitter of canonical word sequences.
 * <p>
 * <b>Canonical form:</b>
 * <ul>
 *   <li>a uniform 31-bit chunk is always a fill, never a literal;</li>
 *   <li>adjacent fills of the same value are merged, up to the maximum run length;</li>
 *   <li>no fill of length 0;</li>
 *   <li>zero chunks are held back until something non-zero follows them, so the
 *       sequence never ends with zeroes.</li>
 * </ul>
 * Not thread-safe.
 */
final class WordWriter {
    private static final int DEFAULT_CAPACITY = 16;

    private int[] words;
    private int size;
    private long chunks;
    private long pendingZeroes;

    WordWriter() {
        this(DEFAULT_CAPACITY);
    }

    WordWriter(int initialCapacity) {
        this.words = new int[Math.max(DEFAULT_CAPACITY, initialCapacity)];
    }

    /**
     * Number of words written so far.
     */
    int size() {
        return size;
    }

    /**
     * Number of 31-bit chunks covered by the written words, not counting held-back zeroes.
     */
    long chunks() {
        return chunks;
    }

    int wordAt(int index) {
        return words[index];
    }

    void append(CompressedWord word) {
        if (word.isLiteral()) {
            appendLiteral(word.literalBits());
        } else {
            appendFill(word.fillBit(), word.fillCount());
        }
    }

    void appendLiteral(int bits) {
        bits &= LITERAL_MASK;
        if (bits == ALL_ZEROES) {
            pendingZeroes++;
            return;
        }
        if (bits == ALL_ONES) {
            appendFill(1, 1);
            return;
        }
        flushZeroes();
        push(bits);
        chunks++;
    }

    void appendFill(int bit, long count) {
        if (count <= 0) {
            return;
        }
        if (bit == 0) {
            pendingZeroes += count;
            return;
        }
        flushZeroes();
        emitFill(1, count);
    }

    /**
     * Set bits in the last covered chunk, if that can be done in place.
     *
     * @return false when the last chunk is not held by a literal or a one fill
     */
    boolean orLastChunk(int bits) {
        if (size == 0 || pendingZeroes != 0) {
            return false;
        }
        int last = words[size - 1];
        if ((last & TYPE_MASK) != 0) {
            return isOneFill(last);
        }
        int merged = last | (bits & LITERAL_MASK);
        if (merged == ALL_ONES) {
            size--;
            chunks--;
            emitFill(1, 1);
        } else {
            words[size - 1] = merged;
        }
        return true;
    }

    /**
     * Keep only {@code bits} in the last covered chunk, if it is held by a literal.
     *
     * @return false when the last chunk is not held by a literal
     */
    boolean andLastChunk(int bits) {
        if (size == 0 || pendingZeroes != 0) {
            return false;
        }
        int last = words[size - 1];
        if ((last & TYPE_MASK) != 0) {
            return false;
        }
        int kept = last & bits & LITERAL_MASK;
        if (kept != ALL_ZEROES) {
            words[size - 1] = kept;
            return true;
        }
        size--;
        chunks--;
        if (size > 0 && (words[size - 1] & TYPE_MASK) != 0 && !isOneFill(words[size - 1])) {
            chunks -= words[size - 1] & COUNT_MASK;
            size--;
        }
        return true;
    }

    /**
     * Forget held-back zeroes; they carry no information at the end of a bitmap.
     */
    void trimTrailingZeroes() {
        pendingZeroes = 0;
    }

    /**
     * Iterator over a snapshot of the written words.
     */
    Iterator<CompressedWord> iterator() {
        var snapshot = words;
        var count = size;
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < count;
            }

            @Override
            public CompressedWord next() {
                if (index >= count) {
                    throw new NoSuchElementException();
                }
                return CompressedWord.decode(snapshot[index++]);
            }
        };
    }

    /**
     * Merge two sequences chunk by chunk into this writer.
     */
    void merge(WordCursor left, WordCursor right, BitOperation operation) {
        while (!operation.stopsWhen(left.exhausted(), right.exhausted())) {
            if (left.onRun() && right.onRun()) {
                long run = Math.min(left.run(), right.run());
                appendFill(operation.apply(left.fillBit(), right.fillBit()) & 1, run);
                left.skip(run);
                right.skip(run);
            } else {
                appendLiteral(operation.apply(left.chunk(), right.chunk()));
                left.skip(1);
                right.skip(1);
            }
        }
    }

    /**
     * Append the bits {@code [first, last]} after the covered chunks.
     * The range must start at or after {@code chunks() * 31}.
     */
    void appendRange(int first, int last) {
        long firstChunk = first / BITS_PER_WORD;
        long lastChunk = last / BITS_PER_WORD;
        int firstOffset = first % BITS_PER_WORD;
        int lastOffset = last % BITS_PER_WORD;
        if (firstChunk < chunks + pendingZeroes) {
            throw new IllegalStateException("range starts inside the covered span: " + first);
        }
        appendFill(0, firstChunk - chunks - pendingZeroes);
        if (firstChunk == lastChunk) {
            appendLiteral(mask(firstOffset, lastOffset));
            return;
        }
        appendLiteral(mask(firstOffset, BITS_PER_WORD - 1));
        appendFill(1, lastChunk - firstChunk - 1);
        appendLiteral(mask(0, lastOffset));
    }

    /**
     * Serialize the words after a {@code headerSize}-byte gap.
     */
    byte[] toByteArray(int headerSize) {
        var buffer = new byte[headerSize + size * 4];
        for (var i = 0; i < size; i++) {
            ByteWords.write(buffer, headerSize + i * 4, words[i]);
        }
        return buffer;
    }

    /**
     * Literal bits {@code lo..hi} (inclusive, both in 0..30) set.
     */
    static int mask(int lo, int hi) {
        return (ALL_ONES >>> (BITS_PER_WORD - 1 - hi)) & (ALL_ONES << lo);
    }

    private void flushZeroes() {
        if (pendingZeroes > 0) {
            var count = pendingZeroes;
            pendingZeroes = 0;
            emitFill(0, count);
        }
    }

    private void emitFill(int bit, long count) {
        chunks += count;
        if (size > 0) {
            int last = words[size - 1];
            if ((last & TYPE_MASK) != 0 && ((last >>> 30) & 1) == bit) {
                int existing = last & COUNT_MASK;
                long added = Math.min(count, (long) MAX_FILL_COUNT - existing);
                if (added > 0) {
                    words[size - 1] = CompressedWord.encodeFill(bit, existing + (int) added);
                    count -= added;
                }
            }
        }
        while (count > 0) {
            int run = (int) Math.min(count, MAX_FILL_COUNT);
            push(CompressedWord.encodeFill(bit, run));
            count -= run;
        }
    }

    private void push(int word) {
        if (size == words.length) {
            words = Arrays.copyOf(words, words.length * 2);
        }
        words[size++] = word;
    }

    private static boolean isOneFill(int word) {
        return (word & TYPE_MASK) != 0 && (word & CompressedWord.FILL_BIT_MASK) != 0;
    }
}
