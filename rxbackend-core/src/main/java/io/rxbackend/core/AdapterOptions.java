package io.rxbackend.core;

import io.reactivex.rxjava3.core.BackpressureStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for turning listener streams into backpressured publishers.
 *
 * <p>Vendor listeners push without regard to demand. When such a stream is exposed as a
 * {@code Flowable}, {@code Flux} or {@code Flow.Publisher}, these options decide what happens to
 * events the consumer has not requested yet.
 *
 * <p>Properties (all optional):
 * <ul>
 *   <li>{@value #BACKPRESSURE} - one of {@link BackpressureStrategy}, default {@code BUFFER}</li>
 *   <li>{@value #BUFFER_CAPACITY} - bound for {@code BUFFER}, {@code 0} for unbounded (default)</li>
 * </ul>
 */
public final class AdapterOptions {

    public static final String BACKPRESSURE = "rxbackend.backpressure";
    public static final String BUFFER_CAPACITY = "rxbackend.buffer-capacity";

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "rxbackend.properties";

    private static final AdapterOptions DEFAULTS = builder().build();

    private final BackpressureStrategy backpressure;
    private final int bufferCapacity;

    private AdapterOptions(Builder builder) {
        this.backpressure = builder.backpressure;
        this.bufferCapacity = builder.bufferCapacity;
    }

    public static AdapterOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #RESOURCE} from the context class loader, falling back to defaults when absent.
     */
    public static AdapterOptions load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = AdapterOptions.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return DEFAULTS;
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Builds options from {@code properties}; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static AdapterOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String strategy = trimmed(properties.getProperty(BACKPRESSURE));
        if (strategy != null) {
            try {
                builder.backpressure(BackpressureStrategy.valueOf(strategy.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown " + BACKPRESSURE + ": " + strategy, e);
            }
        }
        String capacity = trimmed(properties.getProperty(BUFFER_CAPACITY));
        if (capacity != null) {
            try {
                builder.bufferCapacity(Integer.parseInt(capacity));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + BUFFER_CAPACITY + ": " + capacity, e);
            }
        }
        return builder.build();
    }

    public BackpressureStrategy backpressure() {
        return backpressure;
    }

    /**
     * Buffer bound applied with {@link BackpressureStrategy#BUFFER}; {@code 0} means unbounded.
     */
    public int bufferCapacity() {
        return bufferCapacity;
    }

    private static String trimmed(String value) {
        if (value == null) return null;
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    public static final class Builder {
        private BackpressureStrategy backpressure = BackpressureStrategy.BUFFER;
        private int bufferCapacity;

        private Builder() {}

        public Builder backpressure(BackpressureStrategy backpressure) {
            this.backpressure = Objects.requireNonNull(backpressure, "backpressure");
            return this;
        }

        public Builder bufferCapacity(int bufferCapacity) {
            if (bufferCapacity < 0) {
                throw new IllegalArgumentException("bufferCapacity must be >= 0");
            }
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public AdapterOptions build() {
            return new AdapterOptions(this);
        }
    }
}
