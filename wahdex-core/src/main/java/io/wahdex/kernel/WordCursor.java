package io.wahdex.kernel;

import java.util.Iterator;

import static io.wahdex.kernel.CompressedWord.ALL_ONES;
import static io.wahdex.kernel.CompressedWord.ALL_ZEROES;

/**
 * Chunk-granular reader over a word sequence.
 * <p>
 * A fill word can be consumed partially, which is what lets two sequences with
 * different run boundaries be walked in lock-step. Once the underlying words are
 * exhausted the cursor reads as an endless run of zeroes.
 */
final class WordCursor {
    private final Iterator<CompressedWord> words;
    private boolean exhausted;
    private boolean literal;
    private int literalBits;
    private int fillBit;
    private long remaining;

    WordCursor(Iterator<CompressedWord> words) {
        this.words = words;
        nextWord();
    }

    boolean exhausted() {
        return exhausted;
    }

    /**
     * @return true when positioned on a uniform run (a fill, or the zero tail)
     */
    boolean onRun() {
        return exhausted || !literal;
    }

    int fillBit() {
        return exhausted ? 0 : fillBit;
    }

    /**
     * Chunks left in the current run; unbounded once exhausted.
     */
    long run() {
        return exhausted ? Long.MAX_VALUE : remaining;
    }

    /**
     * The current 31-bit chunk.
     */
    int chunk() {
        if (exhausted) {
            return ALL_ZEROES;
        }
        if (literal) {
            return literalBits;
        }
        return fillBit == 1 ? ALL_ONES : ALL_ZEROES;
    }

    void skip(long chunks) {
        while (chunks > 0 && !exhausted) {
            long take = Math.min(chunks, remaining);
            remaining -= take;
            chunks -= take;
            if (remaining == 0) {
                nextWord();
            }
        }
    }

    private void nextWord() {
        while (words.hasNext()) {
            var word = words.next();
            literal = word.isLiteral();
            literalBits = word.literalBits();
            fillBit = word.fillBit();
            remaining = word.fillCount();
            if (remaining > 0) {
                return;
            }
            // fill of length 0 in a foreign buffer covers nothing
        }
        exhausted = true;
        remaining = 0;
    }
}
