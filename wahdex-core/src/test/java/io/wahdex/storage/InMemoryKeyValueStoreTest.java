package io.wahdex.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryKeyValueStoreTest {

    @Test
    void putThenGet() {
        var store = new InMemoryKeyValueStore();

        store.put(new byte[] {1}, new byte[] {10, 20});

        assertThat(store.get(new byte[] {1})).containsExactly(10, 20);
        assertThat(store.get(new byte[] {2})).isNull();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void storesAndReturnsCopies() {
        var store = new InMemoryKeyValueStore();
        var key = new byte[] {1};
        var value = new byte[] {10};

        store.put(key, value);
        value[0] = 99;
        key[0] = 2;
        store.get(new byte[] {1})[0] = 77;

        assertThat(store.get(new byte[] {1})).containsExactly(10);
    }

    @Test
    void deleteRemovesKey() {
        var store = new InMemoryKeyValueStore();
        store.put(new byte[] {1}, new byte[0]);

        store.delete(new byte[] {1});
        store.delete(new byte[] {1});

        assertThat(store.size()).isZero();
    }

    @Test
    void clearRangeUsesUnsignedOrder() {
        var store = new InMemoryKeyValueStore();
        store.put(new byte[] {0x01}, new byte[0]);
        store.put(new byte[] {0x7F, 0x00}, new byte[0]);
        store.put(new byte[] {(byte) 0x80}, new byte[0]);
        store.put(new byte[] {(byte) 0xFF}, new byte[0]);

        store.clearRange(new byte[] {0x00}, new byte[] {(byte) 0x80});

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get(new byte[] {(byte) 0x80})).isNotNull();
        assertThat(store.get(new byte[] {(byte) 0xFF})).isNotNull();
    }

    @Test
    void invertedRangeClearsNothing() {
        var store = new InMemoryKeyValueStore();
        store.put(new byte[] {5}, new byte[0]);

        store.clearRange(new byte[] {9}, new byte[] {1});

        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void rejectsNulls() {
        var store = new InMemoryKeyValueStore();

        assertThatThrownBy(() -> store.get(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.put(new byte[] {1}, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.delete(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
