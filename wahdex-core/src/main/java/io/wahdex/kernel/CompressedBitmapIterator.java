package io.wahdex.kernel;

import io.wahdex.core.BitmapFormatException;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only cursor decoding a byte region into {@link CompressedWord}s.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>One word per 4-byte group, in buffer order.</li>
 *   <li>Not restartable: once exhausted, a new iterator must be created.</li>
 *   <li>The region length must be a multiple of 4; checked at construction.</li>
 *   <li>The buffer is read in place and must not change while iterating.</li>
 * </ul>
 */
public final class CompressedBitmapIterator implements Iterator<CompressedWord> {
    private final byte[] buffer;
    private final int end;
    private int position;

    /**
     * Iterate the data words of a finished bitmap buffer, skipping its header.
     */
    public CompressedBitmapIterator(byte[] data) {
        this(data, data == null || data.length == 0 ? 0 : CompressedBitmap.HEADER_SIZE,
                data == null || data.length == 0 ? 0 : data.length - CompressedBitmap.HEADER_SIZE);
    }

    /**
     * Iterate a raw word region with no header.
     *
     * @param buffer backing bytes
     * @param offset first byte of the first word
     * @param length region length in bytes
     */
    public CompressedBitmapIterator(byte[] buffer, int offset, int length) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer required");
        }
        if (offset < 0 || length < 0 || offset > buffer.length - length) {
            throw new IllegalArgumentException("region [" + offset + ", +" + length
                    + ") outside buffer of " + buffer.length + " bytes");
        }
        if ((length & 3) != 0) {
            throw new BitmapFormatException("word region size must be a multiple of 4 bytes: " + length);
        }
        this.buffer = buffer;
        this.position = offset;
        this.end = offset + length;
    }

    @Override
    public boolean hasNext() {
        return position < end;
    }

    @Override
    public CompressedWord next() {
        if (position >= end) {
            throw new NoSuchElementException();
        }
        int raw = ByteWords.read(buffer, position);
        position += 4;
        return CompressedWord.decode(raw);
    }

    /**
     * Number of words not yet returned.
     */
    public int remaining() {
        return (end - position) >> 2;
    }
}
