package io.rxbackend.core;

import io.reactivex.rxjava3.core.BackpressureStrategy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterOptionsTest {

    @Test
    void defaultsBufferUnbounded() {
        AdapterOptions options = AdapterOptions.defaults();

        assertThat(options.backpressure()).isEqualTo(BackpressureStrategy.BUFFER);
        assertThat(options.bufferCapacity()).isZero();
    }

    @Test
    void parsesProperties() {
        Properties properties = new Properties();
        properties.setProperty(AdapterOptions.BACKPRESSURE, " latest ");
        properties.setProperty(AdapterOptions.BUFFER_CAPACITY, "64");

        AdapterOptions options = AdapterOptions.fromProperties(properties);

        assertThat(options.backpressure()).isEqualTo(BackpressureStrategy.LATEST);
        assertThat(options.bufferCapacity()).isEqualTo(64);
    }

    @Test
    void blankValuesKeepDefaults() {
        Properties properties = new Properties();
        properties.setProperty(AdapterOptions.BACKPRESSURE, "  ");

        assertThat(AdapterOptions.fromProperties(properties).backpressure()).isEqualTo(BackpressureStrategy.BUFFER);
    }

    @Test
    void rejectsUnknownStrategy() {
        Properties properties = new Properties();
        properties.setProperty(AdapterOptions.BACKPRESSURE, "sometimes");

        assertThatThrownBy(() -> AdapterOptions.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(AdapterOptions.BACKPRESSURE);
    }

    @Test
    void rejectsNegativeCapacity() {
        Properties properties = new Properties();
        properties.setProperty(AdapterOptions.BUFFER_CAPACITY, "-1");

        assertThatThrownBy(() -> AdapterOptions.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadsClasspathResource() {
        AdapterOptions options = AdapterOptions.load();

        assertThat(options.backpressure()).isEqualTo(BackpressureStrategy.BUFFER);
        assertThat(options.bufferCapacity()).isEqualTo(128);
    }
}
