package io.wahdex.kernel;

import io.wahdex.core.BitmapFormatException;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Immutable word-aligned hybrid compressed bit vector.
 * <p>
 * <b>Layout</b> (little-endian):
 * <pre>
 * empty:     0 bytes
 * non-empty: int32 header (highest set bit) followed by N &gt;= 1 data words
 * </pre>
 * <b>Contract:</b>
 * <ul>
 *   <li>Never mutated after construction; safe to share between threads.</li>
 *   <li>The bounds are computed once and cached.</li>
 *   <li>Changes go through {@link #toBuilder()}, which produces a new bitmap.</li>
 *   <li>Bits outside the bounds test as {@code false}; that is not an error.</li>
 * </ul>
 */
public final class CompressedBitmap implements Iterable<CompressedWord> {
    static final int HEADER_SIZE = 4;
    static final int MIN_SIZE = 8;

    /**
     * Header value of a word sequence that holds no set bit.
     */
    public static final int HEADER_NO_BITS = -1;

    private static final byte[] NO_DATA = new byte[0];

    public static final CompressedBitmap EMPTY = new CompressedBitmap(NO_DATA, BitRange.empty());

    private final byte[] data;
    private final BitRange bounds;

    /**
     * Decode a stored value. The array is copied.
     *
     * @param data serialized bitmap
     * @throws IllegalArgumentException if data is null
     * @throws BitmapFormatException    if data is not a valid compressed bitmap
     */
    public CompressedBitmap(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data required");
        }
        if ((data.length & 3) != 0) {
            throw new BitmapFormatException("A compressed bitmap size must be a multiple of 4 bytes: " + data.length);
        }
        if (data.length > 0 && data.length < MIN_SIZE) {
            throw new BitmapFormatException("A compressed bitmap must either be empty, or at least 8 bytes long: "
                    + data.length);
        }
        var computed = CompressedBitmapBounds.compute(data);
        if (computed.isEmpty()) {
            this.data = NO_DATA;
            this.bounds = BitRange.empty();
        } else {
            this.data = data.clone();
            this.bounds = computed;
        }
    }

    /**
     * Wrap a buffer whose bounds are already known. The array is not copied and
     * must not be modified afterwards.
     */
    CompressedBitmap(byte[] data, BitRange bounds) {
        if (data == null) {
            throw new IllegalArgumentException("data required");
        }
        if (bounds == null) {
            throw new IllegalArgumentException("bounds required");
        }
        if (data.length == 0) {
            this.data = NO_DATA;
            this.bounds = BitRange.empty();
        } else {
            if ((data.length & 3) != 0) {
                throw new BitmapFormatException("A compressed bitmap size must be a multiple of 4 bytes: "
                        + data.length);
            }
            if (data.length < HEADER_SIZE) {
                throw new BitmapFormatException("A compressed bitmap must be at least 4 bytes long: " + data.length);
            }
            this.data = data;
            this.bounds = bounds;
        }
    }

    /**
     * Gets a copy of the serialized bitmap.
     */
    public byte[] toByteArray() {
        return data.length == 0 ? NO_DATA : data.clone();
    }

    /**
     * Backing buffer. Must not be modified.
     */
    byte[] data() {
        return data;
    }

    public CompressedBitmapBuilder toBuilder() {
        return new CompressedBitmapBuilder(this);
    }

    public BitRange bounds() {
        return bounds;
    }

    public boolean isEmpty() {
        return bounds.isEmpty();
    }

    /**
     * Number of data words, header excluded.
     */
    public int count() {
        return data.length == 0 ? 0 : (data.length >> 2) - 1;
    }

    /**
     * Test if the specified bit is set.
     * <p>
     * O(1) outside the bounds, otherwise a walk over the words.
     *
     * @param bitOffset offset of the bit to test
     * @return true if the bit is set; false otherwise, including outside the bitmap
     */
    public boolean test(int bitOffset) {
        if (!bounds.contains(bitOffset)) {
            return false;
        }
        long p = 0;
        for (var word : this) {
            long n = p + word.span();
            if (n > bitOffset) {
                if (word.isLiteral()) {
                    return (word.literalBits() & (1 << (int) (bitOffset - p))) != 0;
                }
                return word.fillBit() == 1;
            }
            p = n;
        }
        return false;
    }

    /**
     * Count the number of bits set to 1 in this bitmap.
     */
    public long countBits() {
        long count = 0;
        for (var word : this) {
            count += word.countBits();
        }
        return count;
    }

    /**
     * Enumerate the positions of set bits in ascending order.
     */
    public IntEnumerator enumerator() {
        var words = iterator();
        return new IntEnumerator() {
            private long base;
            private long literalBase;
            private int literal;
            private long runNext;
            private long runEnd;
            private long next = advance();

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public int nextInt() {
                if (next < 0) {
                    throw new NoSuchElementException();
                }
                var value = (int) next;
                next = advance();
                return value;
            }

            private long advance() {
                while (true) {
                    if (runNext < runEnd) {
                        return runNext++;
                    }
                    if (literal != 0) {
                        var bit = Integer.numberOfTrailingZeros(literal);
                        literal &= literal - 1;
                        return literalBase + bit;
                    }
                    if (!words.hasNext()) {
                        return -1L;
                    }
                    var word = words.next();
                    var start = base;
                    base += word.span();
                    if (word.isLiteral()) {
                        literal = word.literalBits();
                        literalBase = start;
                    } else if (word.fillBit() == 1) {
                        runNext = start;
                        runEnd = base;
                    }
                }
            }
        };
    }

    /**
     * Positions of all set bits in ascending order.
     */
    public int[] toIntArray() {
        var result = new int[Math.toIntExact(countBits())];
        var e = enumerator();
        var i = 0;
        while (e.hasNext()) {
            result[i++] = e.nextInt();
        }
        return result;
    }

    public CompressedBitmap and(CompressedBitmap other) {
        return toBuilder().and(other).build();
    }

    public CompressedBitmap or(CompressedBitmap other) {
        return toBuilder().or(other).build();
    }

    public CompressedBitmap xor(CompressedBitmap other) {
        return toBuilder().xor(other).build();
    }

    public CompressedBitmap andNot(CompressedBitmap other) {
        return toBuilder().andNot(other).build();
    }

    /**
     * Human-readable decode of the words, for diagnostics only.
     */
    public String dump() {
        return WordAlignHybridEncoder.dumpCompressed(data).toString();
    }

    /**
     * A new, non-restartable cursor over the data words.
     */
    @Override
    public CompressedBitmapIterator iterator() {
        return new CompressedBitmapIterator(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(data, ((CompressedBitmap) obj).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "CompressedBitmap{words=" + count() + ", bounds=" + bounds + "}";
    }
}
