package com.phillippitts.anomalyguard.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identity of a metric series: metric name plus its tag set.
 *
 * <p>Tags are kept sorted so two keys built from the same tags in a different order are equal
 * and render the same canonical form {@code name{k1=v1,k2=v2}}.
 *
 * @param name metric name (must not be blank)
 * @param tags tag set, copied and sorted by tag name
 */
public record SeriesKey(String name, SortedMap<String, String> tags) {

    public SeriesKey {
        Objects.requireNonNull(name, "Series name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Series name must not be blank");
        }
        tags = tags == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(tags));
    }

    public static SeriesKey of(String name) {
        return new SeriesKey(name, null);
    }

    public static SeriesKey of(String name, Map<String, String> tags) {
        return new SeriesKey(name, tags == null ? null : new TreeMap<>(tags));
    }

    /**
     * Canonical string form, stable across tag insertion order.
     */
    public String canonical() {
        if (tags.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        boolean first = true;
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(tag.getKey()).append('=').append(tag.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return canonical();
    }
}
