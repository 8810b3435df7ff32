package io.wahdex.core;

/**
 * Immutable configuration for the bitmap storage layer.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * WahdexConfiguration config = WahdexConfiguration.builder()
 *     .clearEmptyValues(false)
 *     .canonicalizeOnRead(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.wahdex.storage.BitmapArray
 */
public final class WahdexConfiguration {

    private static final WahdexConfiguration DEFAULTS = builder().build();

    private final boolean clearEmptyValues;
    private final boolean canonicalizeOnRead;

    private WahdexConfiguration(Builder builder) {
        this.clearEmptyValues = builder.clearEmptyValues;
        this.canonicalizeOnRead = builder.canonicalizeOnRead;
    }

    /**
     * Create a new builder for WahdexConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static WahdexConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check if storing an empty value deletes the key instead.
     *
     * @return true if empty values clear the key (default: true)
     */
    public boolean clearEmptyValues() {
        return clearEmptyValues;
    }

    /**
     * Check if loaded bitmaps are re-encoded into canonical form.
     *
     * @return true if values are canonicalized on read (default: false)
     */
    public boolean canonicalizeOnRead() {
        return canonicalizeOnRead;
    }

    @Override
    public String toString() {
        return "WahdexConfiguration{clearEmptyValues=" + clearEmptyValues
                + ", canonicalizeOnRead=" + canonicalizeOnRead + "}";
    }

    /**
     * Builder for WahdexConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static final class Builder {
        private boolean clearEmptyValues = true;
        private boolean canonicalizeOnRead = false;

        private Builder() {
        }

        /**
         * Enable or disable deleting keys whose serialized value is empty.
         * When disabled, a zero-length value is written under the key.
         *
         * @param clearEmptyValues true to delete the key (default: true)
         * @return this builder for method chaining
         */
        public Builder clearEmptyValues(boolean clearEmptyValues) {
            this.clearEmptyValues = clearEmptyValues;
            return this;
        }

        /**
         * Enable or disable re-encoding of bitmaps read from storage.
         * Values written by other encoders may carry literal words for uniform chunks
         * or leading zero literals; canonicalizing makes them byte-comparable.
         *
         * @param canonicalizeOnRead true to re-encode on read (default: false)
         * @return this builder for method chaining
         */
        public Builder canonicalizeOnRead(boolean canonicalizeOnRead) {
            this.canonicalizeOnRead = canonicalizeOnRead;
            return this;
        }

        /**
         * Build the immutable WahdexConfiguration.
         *
         * @return a new WahdexConfiguration instance
         */
        public WahdexConfiguration build() {
            return new WahdexConfiguration(this);
        }
    }
}
