package io.wahdex.kernel;

/**
 * A single 32-bit word of a word-aligned hybrid bitmap.
 * <p>
 * Layout:
 * <ul>
 *   <li>Literal: bit 31 = 0, bits 0..30 hold a 31-bit chunk of the bit vector.</li>
 *   <li>Fill: bit 31 = 1, bit 30 = fill value, bits 0..29 = number of uniform 31-bit chunks.</li>
 * </ul>
 * Every word spans {@code fillCount() * 31} bits; a literal has a fill count of 1.
 */
public record CompressedWord(int raw) {
    public static final int BITS_PER_WORD = 31;
    public static final int NO_BIT = -1;

    static final int TYPE_MASK = 0x8000_0000;
    static final int FILL_BIT_MASK = 0x4000_0000;
    static final int LITERAL_MASK = 0x7FFF_FFFF;
    static final int COUNT_MASK = 0x3FFF_FFFF;
    static final int MAX_FILL_COUNT = COUNT_MASK;

    static final int ALL_ONES = LITERAL_MASK;
    static final int ALL_ZEROES = 0;

    public static CompressedWord decode(int raw) {
        return new CompressedWord(raw);
    }

    public static CompressedWord literal(int bits) {
        if ((bits & TYPE_MASK) != 0) {
            throw new IllegalArgumentException("literal uses bit 31: 0x" + Integer.toHexString(bits));
        }
        return new CompressedWord(bits);
    }

    public static CompressedWord fill(int bit, int count) {
        if (bit != 0 && bit != 1) {
            throw new IllegalArgumentException("fill bit must be 0 or 1: " + bit);
        }
        if (count < 1 || count > MAX_FILL_COUNT) {
            throw new IllegalArgumentException("fill count out of range: " + count);
        }
        return new CompressedWord(encodeFill(bit, count));
    }

    static int encodeFill(int bit, int count) {
        return TYPE_MASK | (bit << 30) | count;
    }

    public int encode() {
        return raw;
    }

    public boolean isLiteral() {
        return (raw & TYPE_MASK) == 0;
    }

    public boolean isFill() {
        return (raw & TYPE_MASK) != 0;
    }

    /**
     * @return fill value (0 or 1); 0 for literals
     */
    public int fillBit() {
        return isLiteral() ? 0 : (raw & FILL_BIT_MASK) >>> 30;
    }

    public int fillCount() {
        return isLiteral() ? 1 : raw & COUNT_MASK;
    }

    public int literalBits() {
        return raw & LITERAL_MASK;
    }

    /**
     * Number of bits covered by this word.
     */
    public long span() {
        return (long) fillCount() * BITS_PER_WORD;
    }

    /**
     * Position (0..30) of the highest set bit in this word's local chunk.
     * A fill of ones reports the top of its last chunk.
     *
     * @return local bit position, or {@link #NO_BIT} if no bit is set
     */
    public int highestBit() {
        if (isLiteral()) {
            int bits = literalBits();
            return bits == 0 ? NO_BIT : 31 - Integer.numberOfLeadingZeros(bits);
        }
        return fillBit() == 1 ? BITS_PER_WORD - 1 : NO_BIT;
    }

    /**
     * Position (0..30) of the lowest set bit in this word's local chunk.
     *
     * @return local bit position, or {@link #NO_BIT} if no bit is set
     */
    public int lowestBit() {
        if (isLiteral()) {
            int bits = literalBits();
            return bits == 0 ? NO_BIT : Integer.numberOfTrailingZeros(bits);
        }
        return fillBit() == 1 ? 0 : NO_BIT;
    }

    public long countBits() {
        if (isLiteral()) {
            return Integer.bitCount(literalBits());
        }
        return fillBit() == 1 ? span() : 0L;
    }

    @Override
    public String toString() {
        if (isLiteral()) {
            return "Literal{0x" + String.format("%08X", literalBits()) + "}";
        }
        return "Fill{bit=" + fillBit() + ", count=" + fillCount() + "}";
    }
}
