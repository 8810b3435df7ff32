package io.wahdex.kernel;

/**
 * Primitive, forward-only enumerator over int values.
 */
public interface IntEnumerator {
    boolean hasNext();

    /**
     * @throws java.util.NoSuchElementException if the enumerator is exhausted
     */
    int nextInt();
}
