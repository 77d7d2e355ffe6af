package com.trace.registry.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Caller-supplied trace configuration carried through the registry unchanged.
 *
 * <p>The registry never interprets option values. It only compares two option bags
 * for structural equality when deciding whether a stopped trace may be advanced, so
 * values should have meaningful {@code equals}/{@code hashCode}.</p>
 *
 * <p>Options are fixed once built. {@link List}, {@link Set} and {@link Map} values are
 * copied into unmodifiable collections (which rejects null elements); other values, and
 * collections nested inside them, must be immutable.</p>
 *
 * <pre>
 * TraceOptions options = TraceOptions.builder()
 *     .option("outputFormat", "speedscope")
 *     .option("outputDirectory", "/tmp/profiles")
 *     .build();
 * </pre>
 */
public final class TraceOptions {

    private static final TraceOptions EMPTY = new TraceOptions(Map.of());

    private final Map<String, Object> values;

    private TraceOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static TraceOptions empty() {
        return EMPTY;
    }

    /**
     * Creates options from an existing map. Entry order is preserved.
     */
    public static TraceOptions of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        values.forEach(builder::option);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceOptions that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TraceOptions" + values;
    }

    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder option(String key, Object value) {
            Objects.requireNonNull(key, "option key must not be null");
            Objects.requireNonNull(value, "option value must not be null for key: " + key);
            values.put(key, immutableCopy(value));
            return this;
        }

        private static Object immutableCopy(Object value) {
            if (value instanceof List<?> list) {
                return List.copyOf(list);
            }
            if (value instanceof Set<?> set) {
                return Set.copyOf(set);
            }
            if (value instanceof Map<?, ?> map) {
                return Map.copyOf(map);
            }
            return value;
        }

        public TraceOptions build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new TraceOptions(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
