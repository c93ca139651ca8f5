package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Dimensional key identifying one slice of a metric, e.g. {@code merchant=acme, channel=web}.
 *
 * Dimensions are kept sorted by name, so two cohorts built from the same pairs in any
 * order are equal and hash alike. Serialized to JSON as a flat object of dimension to value.
 */
public final class Cohort implements Comparable<Cohort> {

    private static final Comparator<Dimension> ORDER =
            Comparator.comparing(Dimension::name).thenComparing(Dimension::value);

    private static final String RESERVED = ",=|";

    private static final Cohort GLOBAL = new Cohort(Collections.emptyList());

    private final List<Dimension> dimensions;
    private final String key;

    public record Dimension(String name, String value) {
        public Dimension {
            Objects.requireNonNull(name, "Dimension name must not be null");
            Objects.requireNonNull(value, "Dimension value must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Dimension name must not be blank");
            }
            checkNoReserved("name", name);
            checkNoReserved("value", value);
        }

        // The key form joins pairs with ',' and '=' and storage keys add '|'
        private static void checkNoReserved(String field, String text) {
            for (int i = 0; i < text.length(); i++) {
                if (RESERVED.indexOf(text.charAt(i)) >= 0) {
                    throw new IllegalArgumentException("Dimension " + field + " '" + text
                            + "' must not contain any of " + RESERVED);
                }
            }
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }

    private Cohort(List<Dimension> dimensions) {
        List<Dimension> sorted = new ArrayList<>(dimensions);
        sorted.sort(ORDER);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).name().equals(sorted.get(i - 1).name())) {
                throw new IllegalArgumentException("Duplicate cohort dimension: " + sorted.get(i).name());
            }
        }
        this.dimensions = Collections.unmodifiableList(sorted);
        this.key = sorted.stream().map(Dimension::toString).collect(Collectors.joining(","));
    }

    /**
     * The cohort with no dimensions: the metric taken as a whole.
     */
    public static Cohort global() {
        return GLOBAL;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Cohort of(Map<String, String> dimensions) {
        Objects.requireNonNull(dimensions, "Cohort dimensions must not be null");
        if (dimensions.isEmpty()) return GLOBAL;
        List<Dimension> list = new ArrayList<>(dimensions.size());
        dimensions.forEach((name, value) -> list.add(new Dimension(name, value)));
        return new Cohort(list);
    }

    /**
     * Build a cohort from alternating name/value arguments:
     * {@code Cohort.of("merchant", "acme", "channel", "web")}.
     */
    public static Cohort of(String... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Cohort pairs must be name/value alternating, got "
                    + nameValuePairs.length + " arguments");
        }
        List<Dimension> list = new ArrayList<>(nameValuePairs.length / 2);
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            list.add(new Dimension(nameValuePairs[i], nameValuePairs[i + 1]));
        }
        return list.isEmpty() ? GLOBAL : new Cohort(list);
    }

    /**
     * Parse the {@link #key()} form back into a cohort ({@code "channel=web,merchant=acme"}).
     * A blank string yields the global cohort.
     */
    public static Cohort parse(String key) {
        if (key == null || key.isBlank()) return GLOBAL;
        List<Dimension> list = new ArrayList<>();
        for (String part : key.split(",")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed cohort pair '" + part + "' in: " + key);
            }
            list.add(new Dimension(part.substring(0, eq).trim(), part.substring(eq + 1).trim()));
        }
        return new Cohort(list);
    }

    public List<Dimension> dimensions() {
        return dimensions;
    }

    /**
     * Stable string form, dimensions sorted by name: {@code channel=web,merchant=acme}.
     */
    public String key() {
        return key;
    }

    public boolean isGlobal() {
        return dimensions.isEmpty();
    }

    @JsonValue
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (Dimension d : dimensions) {
            map.put(d.name(), d.value());
        }
        return map;
    }

    @Override
    public int compareTo(Cohort other) {
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cohort other)) return false;
        return dimensions.equals(other.dimensions);
    }

    @Override
    public int hashCode() {
        return dimensions.hashCode();
    }

    @Override
    public String toString() {
        return isGlobal() ? "<global>" : key;
    }
}
