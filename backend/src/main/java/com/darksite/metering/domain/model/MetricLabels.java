package com.darksite.metering.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Ordered, immutable set of label pairs attached to a metric record.
 *
 * Keys are unique; insertion order is kept so the exposition text is stable.
 * Equality is order-sensitive.
 */
public final class MetricLabels {

    private static final MetricLabels EMPTY = new MetricLabels(new LinkedHashMap<>());

    private final Map<String, String> pairs;

    private MetricLabels(LinkedHashMap<String, String> pairs) {
        this.pairs = Collections.unmodifiableMap(pairs);
    }

    public static MetricLabels empty() {
        return EMPTY;
    }

    /**
     * Builds labels from alternating key/value arguments.
     */
    public static MetricLabels of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Labels need key/value pairs, got " + keyValues.length + " arguments");
        }
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(Objects.requireNonNull(keyValues[i], "label key"),
                    Objects.requireNonNullElse(keyValues[i + 1], ""));
        }
        return new MetricLabels(map);
    }

    /**
     * Returns a copy with the label set; an existing key keeps its position.
     */
    public MetricLabels with(String key, String value) {
        var map = new LinkedHashMap<>(pairs);
        map.put(key, Objects.requireNonNullElse(value, ""));
        return new MetricLabels(map);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(pairs.get(key));
    }

    public boolean contains(String key) {
        return pairs.containsKey(key);
    }

    public void forEach(BiConsumer<String, String> action) {
        pairs.forEach(action);
    }

    public Map<String, String> asMap() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetricLabels that = (MetricLabels) o;
        return pairs.equals(that.pairs)
                && pairs.keySet().stream().toList().equals(that.pairs.keySet().stream().toList());
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    @Override
    public String toString() {
        return pairs.toString();
    }
}
