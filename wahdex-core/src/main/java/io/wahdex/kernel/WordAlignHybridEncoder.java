package io.wahdex.kernel;

import java.util.Arrays;
import java.util.BitSet;

import static io.wahdex.kernel.CompressedWord.BITS_PER_WORD;

/**
 * Conversions between uncompressed bit vectors and {@link CompressedBitmap}.
 */
public final class WordAlignHybridEncoder {

    private WordAlignHybridEncoder() {
    }

    /**
     * Compress a set of bit positions. Order and duplicates do not matter.
     */
    public static CompressedBitmap compress(int... positions) {
        if (positions == null) {
            throw new IllegalArgumentException("positions required");
        }
        var sorted = positions.clone();
        Arrays.sort(sorted);
        var builder = new CompressedBitmapBuilder();
        for (var position : sorted) {
            builder.set(position);
        }
        return builder.build();
    }

    public static CompressedBitmap compress(BitSet bits) {
        if (bits == null) {
            throw new IllegalArgumentException("bits required");
        }
        var builder = new CompressedBitmapBuilder();
        var from = bits.nextSetBit(0);
        while (from >= 0) {
            var to = bits.nextClearBit(from);
            builder.set(from, to);
            from = to == Integer.MAX_VALUE ? -1 : bits.nextSetBit(to);
        }
        return builder.build();
    }

    /**
     * Expand a bitmap into a {@link BitSet}.
     * Set bits at or above {@link Integer#MAX_VALUE} cannot be represented and are dropped.
     */
    public static BitSet decompress(CompressedBitmap bitmap) {
        if (bitmap == null) {
            throw new IllegalArgumentException("bitmap required");
        }
        var bits = new BitSet();
        long p = 0;
        for (var word : bitmap) {
            long n = p + word.span();
            if (word.isLiteral()) {
                var literal = word.literalBits();
                while (literal != 0) {
                    long position = p + Integer.numberOfTrailingZeros(literal);
                    if (position >= Integer.MAX_VALUE) {
                        break;
                    }
                    bits.set((int) position);
                    literal &= literal - 1;
                }
            } else if (word.fillBit() == 1 && p < Integer.MAX_VALUE) {
                bits.set((int) p, (int) Math.min(n, Integer.MAX_VALUE));
            }
            p = n;
        }
        return bits;
    }

    /**
     * Describe every word of a serialized bitmap.
     */
    public static StringBuilder dumpCompressed(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data required");
        }
        var sb = new StringBuilder();
        if (data.length == 0) {
            return sb.append("Compressed bitmap: empty\n");
        }
        if (data.length < CompressedBitmap.HEADER_SIZE || (data.length & 3) != 0) {
            return sb.append("Compressed bitmap: malformed, ").append(data.length).append(" bytes\n");
        }
        var wordCount = (data.length - CompressedBitmap.HEADER_SIZE) >> 2;
        sb.append("Compressed bitmap: ").append(wordCount).append(" words, highest bit ")
                .append(ByteWords.read(data, 0)).append('\n');
        long p = 0;
        var index = 0;
        for (var iter = new CompressedBitmapIterator(data); iter.hasNext(); index++) {
            var word = iter.next();
            sb.append(String.format("[%d] @%d ", index, p));
            if (word.isLiteral()) {
                sb.append(String.format("LITERAL 0x%08X ", word.literalBits()));
                for (var bit = 0; bit < BITS_PER_WORD; bit++) {
                    sb.append((word.literalBits() & (1 << bit)) != 0 ? '1' : '.');
                }
            } else {
                sb.append("FILL ").append(word.fillBit()).append(" x ").append(word.fillCount());
            }
            sb.append('\n');
            p += word.span();
        }
        return sb;
    }
}
