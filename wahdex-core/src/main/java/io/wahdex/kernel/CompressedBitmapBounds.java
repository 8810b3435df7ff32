package io.wahdex.kernel;

import io.wahdex.core.BitmapFormatException;

import static io.wahdex.kernel.CompressedWord.BITS_PER_WORD;
import static io.wahdex.kernel.CompressedWord.NO_BIT;

/**
 * Computes the {@link BitRange} of a bitmap buffer.
 * <p>
 * Two shapes are supported:
 * <ul>
 *   <li>finished buffer: the highest bit is read from the header;</li>
 *   <li>in-progress buffer: the header is not written yet, the highest bit is derived
 *       from the number of 31-bit chunks covered and the trailing word.</li>
 * </ul>
 * The lowest bit is always found by scanning the leading words. For a finished buffer
 * the header must also match the last set bit of the words.
 * Any value that cannot be a bit position is reported as corruption.
 */
public final class CompressedBitmapBounds {

    private CompressedBitmapBounds() {
    }

    /**
     * Bounds of a finished buffer (header followed by data words).
     *
     * @throws BitmapFormatException if the buffer shape or header is invalid
     */
    public static BitRange compute(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data required");
        }
        int count = data.length;
        if ((count & 3) != 0) {
            throw new BitmapFormatException("Bitmap buffer size must be a multiple of 4 bytes: " + count);
        }
        if (count == 0) {
            return BitRange.empty();
        }
        if (count < CompressedBitmap.MIN_SIZE) {
            throw new BitmapFormatException("Bitmap buffer size is too small: " + count);
        }

        int highest = ByteWords.read(data, 0);
        long lowest = scanLowest(data, CompressedBitmap.HEADER_SIZE, count - CompressedBitmap.HEADER_SIZE);
        if (highest < 0) {
            if (highest != CompressedBitmap.HEADER_NO_BITS) {
                throw new BitmapFormatException("Corrupted bitmap buffer (highest bit underflow): " + highest);
            }
            if (lowest != NO_BIT) {
                throw new BitmapFormatException("Corrupted bitmap buffer (no-bits header but bit " + lowest + " is set)");
            }
            return BitRange.empty();
        }
        if (lowest == NO_BIT) {
            throw new BitmapFormatException("Corrupted bitmap buffer (highest bit " + highest + " but no bit is set)");
        }
        long last = scanHighest(data, CompressedBitmap.HEADER_SIZE, count - CompressedBitmap.HEADER_SIZE);
        if (last != highest) {
            throw new BitmapFormatException("Corrupted bitmap buffer (header says highest bit " + highest
                    + " but the words end at bit " + last + ")");
        }
        return toRange(lowest, highest);
    }

    /**
     * Bounds of a buffer whose header has not been written yet.
     *
     * @param buffer bytes holding the words from {@code offset} to the end
     * @param offset first byte of the first word
     * @param words  number of uncompressed 31-bit words covered by the sequence
     * @throws BitmapFormatException if the derived bounds are not valid bit positions
     */
    public static BitRange compute(byte[] buffer, int offset, int words) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer required");
        }
        if (words < 0) {
            throw new IllegalArgumentException("words must be non-negative: " + words);
        }
        int length = buffer.length - offset;
        if (words == 0 || length == 0) {
            return BitRange.empty();
        }

        long highest = (long) words * BITS_PER_WORD - 1;
        var last = CompressedWord.decode(ByteWords.read(buffer, buffer.length - 4));
        if (last.isLiteral()) {
            int top = last.highestBit();
            if (top >= 0) {
                highest += top - (BITS_PER_WORD - 1);
            }
        }
        if (highest > Integer.MAX_VALUE) {
            throw new BitmapFormatException("Corrupted bitmap buffer (highest bit overflow): " + highest);
        }

        long lowest = scanLowest(buffer, offset, length);
        if (lowest == NO_BIT) {
            return BitRange.empty();
        }
        return toRange(lowest, (int) highest);
    }

    /**
     * Scan leading words for the first set bit.
     *
     * @return absolute bit position, or {@link CompressedWord#NO_BIT} if no bit is set
     */
    static long scanLowest(byte[] buffer, int offset, int length) {
        long lowest = 0;
        var iter = new CompressedBitmapIterator(buffer, offset, length);
        while (iter.hasNext()) {
            var word = iter.next();
            if (word.isLiteral()) {
                int first = word.lowestBit();
                if (first == NO_BIT) {
                    // all zeroes, legal but not canonical
                    lowest += BITS_PER_WORD;
                    continue;
                }
                return checkLowest(lowest + first);
            }
            if (word.fillBit() == 1) {
                return checkLowest(lowest);
            }
            lowest += word.span();
        }
        return NO_BIT;
    }

    /**
     * Walk every word for the last set bit.
     *
     * @return absolute bit position, or {@link CompressedWord#NO_BIT} if no bit is set
     */
    static long scanHighest(byte[] buffer, int offset, int length) {
        long highest = NO_BIT;
        long p = 0;
        var iter = new CompressedBitmapIterator(buffer, offset, length);
        while (iter.hasNext()) {
            var word = iter.next();
            int top = word.highestBit();
            if (top != NO_BIT) {
                highest = word.isLiteral() ? p + top : p + word.span() - 1;
            }
            p += word.span();
        }
        return highest;
    }

    private static long checkLowest(long lowest) {
        if (lowest > Integer.MAX_VALUE) {
            throw new BitmapFormatException("Corrupted bitmap buffer (lowest bit overflow): " + lowest);
        }
        return lowest;
    }

    private static BitRange toRange(long lowest, int highest) {
        if (lowest < 0) {
            throw new BitmapFormatException("Corrupted bitmap buffer (lowest bit underflow): " + lowest);
        }
        if (lowest > highest) {
            throw new BitmapFormatException("Corrupted bitmap buffer (lowest bit " + lowest
                    + " above highest bit " + highest + ")");
        }
        return BitRange.of((int) lowest, highest);
    }
}
