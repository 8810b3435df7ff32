package io.wahdex.kernel;

import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static io.wahdex.kernel.BitmapBytes.bitmap;
import static io.wahdex.kernel.BitmapBytes.fill;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordAlignHybridEncoderTest {

    @Test
    void compressIgnoresOrderAndDuplicates() {
        var bitmap = WordAlignHybridEncoder.compress(5, 1, 5, 3);

        assertThat(bitmap.toByteArray()).isEqualTo(bitmap(5, 0b101010));
    }

    @Test
    void compressNothingIsEmpty() {
        assertThat(WordAlignHybridEncoder.compress()).isSameAs(CompressedBitmap.EMPTY);
        assertThat(WordAlignHybridEncoder.compress(new BitSet())).isSameAs(CompressedBitmap.EMPTY);
    }

    @Test
    void compressBitSetUsesFills() {
        var bits = new BitSet();
        bits.set(31, 124);
        bits.set(200);

        var bitmap = WordAlignHybridEncoder.compress(bits);

        assertThat(bitmap.toByteArray()).isEqualTo(bitmap(200, fill(0, 1), fill(1, 3), fill(0, 2), 1 << 14));
    }

    @Test
    void decompressRestoresBits() {
        var bits = new BitSet();
        bits.set(0, 50);
        bits.set(77);
        bits.set(1000, 1100);

        var restored = WordAlignHybridEncoder.decompress(WordAlignHybridEncoder.compress(bits));

        assertThat(restored).isEqualTo(bits);
    }

    @Test
    void decompressEmpty() {
        assertThat(WordAlignHybridEncoder.decompress(CompressedBitmap.EMPTY).isEmpty()).isTrue();
    }

    @Test
    void decompressDropsBitsPastIntRange() {
        // 69273667 zero chunks end at bit 2147483677, past Integer.MAX_VALUE
        var data = bitmap(Integer.MAX_VALUE, fill(0, 69_273_667), 0b1001, fill(1, 2));
        var bitmap = new CompressedBitmap(data, BitRange.of(Integer.MAX_VALUE, Integer.MAX_VALUE));

        assertThat(WordAlignHybridEncoder.decompress(bitmap).isEmpty()).isTrue();
    }

    @Test
    void dumpOfEmptyAndMalformedBuffers() {
        assertThat(WordAlignHybridEncoder.dumpCompressed(new byte[0]).toString()).contains("empty");
        assertThat(WordAlignHybridEncoder.dumpCompressed(new byte[6]).toString()).contains("malformed");
    }

    @Test
    void dumpHasOneLinePerWord() {
        var dump = WordAlignHybridEncoder.dumpCompressed(bitmap(200, fill(0, 1), fill(1, 3), fill(0, 2), 1 << 14))
                .toString();

        assertThat(dump.lines()).hasSize(5);
        assertThat(dump).contains("[2] @124 FILL 0 x 2");
        assertThat(dump).contains("[3] @186 LITERAL 0x00004000 ..............1");
    }

    @Test
    void rejectsNullInputs() {
        assertThatThrownBy(() -> WordAlignHybridEncoder.compress((int[]) null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WordAlignHybridEncoder.compress((BitSet) null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WordAlignHybridEncoder.decompress(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
