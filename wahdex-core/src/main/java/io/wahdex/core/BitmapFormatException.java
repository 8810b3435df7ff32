package io.wahdex.core;

/**
 * Thrown when a byte buffer is not a valid compressed bitmap.
 * <p>
 * Raised at construction or at the first operation that observes the corruption.
 * The stored value is unusable: there is no partial decode.
 */
public class BitmapFormatException extends WahdexException {

    public BitmapFormatException(String message) {
        super(message);
    }
}
