package io.wahdex.kernel;

/**
 * Closed interval {@code [lowest, highest]} of bit positions, or the empty range.
 * <p>
 * The empty range is a distinct value, not a pair of magic integers: asking it for
 * a bound is an error.
 */
public final class BitRange {
    private static final BitRange EMPTY = new BitRange(0, -1, true);

    private final int lowest;
    private final int highest;
    private final boolean empty;

    private BitRange(int lowest, int highest, boolean empty) {
        this.lowest = lowest;
        this.highest = highest;
        this.empty = empty;
    }

    public static BitRange of(int lowest, int highest) {
        if (lowest < 0) {
            throw new IllegalArgumentException("lowest must be non-negative: " + lowest);
        }
        if (highest < lowest) {
            throw new IllegalArgumentException("highest " + highest + " below lowest " + lowest);
        }
        return new BitRange(lowest, highest, false);
    }

    public static BitRange empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return empty;
    }

    public int lowest() {
        if (empty) {
            throw new IllegalStateException("empty range has no lowest bit");
        }
        return lowest;
    }

    public int highest() {
        if (empty) {
            throw new IllegalStateException("empty range has no highest bit");
        }
        return highest;
    }

    public boolean contains(int bit) {
        return !empty && bit >= lowest && bit <= highest;
    }

    /**
     * Number of positions in the range; 0 when empty.
     */
    public long length() {
        return empty ? 0L : (long) highest - lowest + 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        BitRange other = (BitRange) obj;
        if (empty || other.empty) {
            return empty == other.empty;
        }
        return lowest == other.lowest && highest == other.highest;
    }

    @Override
    public int hashCode() {
        return empty ? 0 : 31 * lowest + highest + 1;
    }

    @Override
    public String toString() {
        return empty ? "BitRange{empty}" : "BitRange{" + lowest + ".." + highest + "}";
    }
}
