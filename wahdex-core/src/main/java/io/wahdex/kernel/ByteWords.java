package io.wahdex.kernel;

/**
 * Little-endian 32-bit access to bitmap buffers.
 */
final class ByteWords {

    private ByteWords() {
    }

    static int read(byte[] buffer, int offset) {
        return (buffer[offset] & 0xFF)
                | (buffer[offset + 1] & 0xFF) << 8
                | (buffer[offset + 2] & 0xFF) << 16
                | (buffer[offset + 3] & 0xFF) << 24;
    }

    static void write(byte[] buffer, int offset, int value) {
        buffer[offset] = (byte) value;
        buffer[offset + 1] = (byte) (value >>> 8);
        buffer[offset + 2] = (byte) (value >>> 16);
        buffer[offset + 3] = (byte) (value >>> 24);
    }
}
