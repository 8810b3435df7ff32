package io.wahdex.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WahdexConfigurationTest {

    @Test
    void defaults() {
        var config = WahdexConfiguration.defaults();

        assertThat(config.clearEmptyValues()).isTrue();
        assertThat(config.canonicalizeOnRead()).isFalse();
    }

    @Test
    void builderOverridesDefaults() {
        var config = WahdexConfiguration.builder()
                .clearEmptyValues(false)
                .canonicalizeOnRead(true)
                .build();

        assertThat(config.clearEmptyValues()).isFalse();
        assertThat(config.canonicalizeOnRead()).isTrue();
        assertThat(config).hasToString("WahdexConfiguration{clearEmptyValues=false, canonicalizeOnRead=true}");
    }

    @Test
    void formatExceptionIsWahdexException() {
        var e = new BitmapFormatException("bad");

        assertThat(e).isInstanceOf(WahdexException.class).hasMessage("bad");
    }
}
