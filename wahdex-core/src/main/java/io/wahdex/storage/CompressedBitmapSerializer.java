package io.wahdex.storage;

import io.wahdex.kernel.CompressedBitmap;

public final class CompressedBitmapSerializer implements ValueSerializer<CompressedBitmap> {
    public static final CompressedBitmapSerializer INSTANCE = new CompressedBitmapSerializer();

    private CompressedBitmapSerializer() {
    }

    @Override
    public byte[] serialize(CompressedBitmap value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        return value.toByteArray();
    }

    /**
     * @throws io.wahdex.core.BitmapFormatException if the bytes are not a valid bitmap
     */
    @Override
    public CompressedBitmap deserialize(byte[] bytes, CompressedBitmap missingValue) {
        if (bytes == null) {
            return missingValue;
        }
        return bytes.length == 0 ? CompressedBitmap.EMPTY : new CompressedBitmap(bytes);
    }
}
