package io.wahdex.storage;

import io.wahdex.core.BitmapFormatException;
import io.wahdex.core.WahdexConfiguration;
import io.wahdex.kernel.CompressedBitmap;
import io.wahdex.kernel.WordAlignHybridEncoder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitmapArrayTest {

    @Test
    void setThenGetRoundTrips() {
        var array = BitmapArray.ofBitmaps(new InMemoryKeyValueStore(), WahdexConfiguration.defaults());
        var bitmap = WordAlignHybridEncoder.compress(3, 70, 4000);

        array.set(12, bitmap);

        assertThat(array.get(12)).isEqualTo(bitmap);
        assertThat(array.get(12).test(70)).isTrue();
    }

    @Test
    void missingIndexReadsAsDefault() {
        var array = BitmapArray.ofBitmaps(new InMemoryKeyValueStore(), WahdexConfiguration.defaults());

        assertThat(array.get(5)).isNull();
        assertThat(array.get(5, CompressedBitmap.EMPTY)).isSameAs(CompressedBitmap.EMPTY);
    }

    @Test
    void emptyBitmapClearsKeyByDefault() {
        var store = new InMemoryKeyValueStore();
        var array = BitmapArray.ofBitmaps(store, WahdexConfiguration.defaults());
        array.set(1, WordAlignHybridEncoder.compress(1));

        array.set(1, CompressedBitmap.EMPTY);

        assertThat(store.size()).isZero();
        assertThat(array.get(1)).isNull();
    }

    @Test
    void emptyBitmapIsStoredWhenConfigured() {
        var store = new InMemoryKeyValueStore();
        var config = WahdexConfiguration.builder().clearEmptyValues(false).build();
        var array = BitmapArray.ofBitmaps(store, config);

        array.set(1, CompressedBitmap.EMPTY);

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get(BitmapArray.key(1))).isEmpty();
        assertThat(array.get(1)).isSameAs(CompressedBitmap.EMPTY);
    }

    @Test
    void corruptedValueFailsLoudly() {
        var store = new InMemoryKeyValueStore();
        var array = BitmapArray.ofBitmaps(store, WahdexConfiguration.defaults());
        store.put(BitmapArray.key(3), new byte[5]);

        assertThatThrownBy(() -> array.get(3)).isInstanceOf(BitmapFormatException.class);
    }

    @Test
    void canonicalizesOnReadWhenConfigured() {
        var store = new InMemoryKeyValueStore();
        var config = WahdexConfiguration.builder().canonicalizeOnRead(true).build();
        var array = BitmapArray.ofBitmaps(store, config);
        // header 34, zero literal, literal with bit 3
        store.put(BitmapArray.key(0), new byte[] {34, 0, 0, 0, 0, 0, 0, 0, 8, 0, 0, 0});

        var bitmap = array.get(0);

        assertThat(bitmap.toIntArray()).containsExactly(34);
        assertThat(bitmap).isEqualTo(WordAlignHybridEncoder.compress(34));
    }

    @Test
    void keysFollowIndexOrder() {
        assertThat(Arrays.compareUnsigned(BitmapArray.key(1), BitmapArray.key(256))).isNegative();
        assertThat(Arrays.compareUnsigned(BitmapArray.key(255), BitmapArray.key(256))).isNegative();
        assertThat(BitmapArray.key(Long.MAX_VALUE)[0]).isEqualTo((byte) 0x7F);
    }

    @Test
    void rejectsNegativeIndex() {
        var array = BitmapArray.ofBitmaps(new InMemoryKeyValueStore(), WahdexConfiguration.defaults());

        assertThatThrownBy(() -> array.get(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> array.set(-1, CompressedBitmap.EMPTY)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clearRemovesEverything() {
        var store = new InMemoryKeyValueStore();
        var array = BitmapArray.ofBitmaps(store, WahdexConfiguration.defaults());
        array.set(0, WordAlignHybridEncoder.compress(1));
        array.set(Long.MAX_VALUE, WordAlignHybridEncoder.compress(2));
        array.set(7, WordAlignHybridEncoder.compress(3));

        array.clear(7);
        assertThat(store.size()).isEqualTo(2);

        array.clear();
        assertThat(store.size()).isZero();
    }

    @Test
    void worksWithAnySerializer() {
        ValueSerializer<String> utf8 = new ValueSerializer<>() {
            @Override
            public byte[] serialize(String value) {
                return value.getBytes(java.nio.charset.StandardCharsets.UTF_8);
            }

            @Override
            public String deserialize(byte[] bytes, String missingValue) {
                return bytes == null ? missingValue : new String(bytes, java.nio.charset.StandardCharsets.UTF_8);
            }
        };
        var array = new BitmapArray<>(new InMemoryKeyValueStore(), utf8);

        array.set(2, "two");

        assertThat(array.get(2)).isEqualTo("two");
        assertThat(array.get(3, "none")).isEqualTo("none");
    }
}
