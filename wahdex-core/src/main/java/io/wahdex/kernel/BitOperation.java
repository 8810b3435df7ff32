package io.wahdex.kernel;

/**
 * Boolean operator applied chunk by chunk when merging two bitmaps.
 */
public enum BitOperation {
    AND {
        @Override
        int apply(int left, int right) {
            return left & right;
        }

        @Override
        boolean stopsWhen(boolean leftExhausted, boolean rightExhausted) {
            return leftExhausted || rightExhausted;
        }
    },
    OR {
        @Override
        int apply(int left, int right) {
            return left | right;
        }
    },
    XOR {
        @Override
        int apply(int left, int right) {
            return left ^ right;
        }
    },
    AND_NOT {
        @Override
        int apply(int left, int right) {
            return left & ~right;
        }

        @Override
        boolean stopsWhen(boolean leftExhausted, boolean rightExhausted) {
            return leftExhausted;
        }
    };

    /**
     * Combine two operands; callers mask the result to the width they need.
     */
    abstract int apply(int left, int right);

    /**
     * Whether the rest of the output is known to be all zeroes.
     */
    boolean stopsWhen(boolean leftExhausted, boolean rightExhausted) {
        return leftExhausted && rightExhausted;
    }
}
