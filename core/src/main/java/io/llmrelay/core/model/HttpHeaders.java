package io.llmrelay.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable multi-value header collection.
 *
 * <p>
 * Names are stored lowercase (RFC 9110 §5.1) in first-seen order, and every
 * lookup lowercases its argument, so callers may use any casing. Values keep
 * their order; repeated headers such as {@code set-cookie} stay separate.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(Map.of());

    private final Map<String, List<String>> values;

    private HttpHeaders(Map<String, List<String>> values) {
        this.values = values;
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    /** One value per name. */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> multi = new LinkedHashMap<>();
        singleValue.forEach((name, value) -> multi.put(name, List.of(value)));
        return ofMulti(multi);
    }

    /**
     * Any number of values per name. Names differing only in case are merged
     * in encounter order; names with no values are dropped.
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> merged = new LinkedHashMap<>();
        multiValue.forEach((name, list) -> {
            if (name != null && list != null && !list.isEmpty()) {
                merged.computeIfAbsent(normalize(name), k -> new ArrayList<>()).addAll(list);
            }
        });
        return freeze(merged);
    }

    /** First value of {@code name}, or {@code null}. */
    public String first(String name) {
        List<String> list = values.get(normalize(name));
        return list != null ? list.get(0) : null;
    }

    /** Every value of {@code name}; empty when absent. */
    public List<String> all(String name) {
        return values.getOrDefault(normalize(name), List.of());
    }

    public boolean contains(String name) {
        return values.containsKey(normalize(name));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Lowercase names in first-seen order. */
    public Set<String> names() {
        return values.keySet();
    }

    /** Copy in which {@code name} has exactly one value, {@code value}. */
    public HttpHeaders with(String name, String value) {
        Map<String, List<String>> copy = new LinkedHashMap<>(values);
        copy.put(normalize(name), List.of(value));
        return freeze(copy);
    }

    /** Copy without the headers whose lowercase name matches {@code nameFilter}. */
    public HttpHeaders without(Predicate<String> nameFilter) {
        Map<String, List<String>> copy = new LinkedHashMap<>(values);
        copy.keySet().removeIf(nameFilter);
        return freeze(copy);
    }

    /** Unmodifiable name → values view, lowercase names. */
    public Map<String, List<String>> toMultiValueMap() {
        return values;
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static HttpHeaders freeze(Map<String, List<String>> map) {
        if (map.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        map.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
        return new HttpHeaders(Collections.unmodifiableMap(frozen));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + values.keySet();
    }
}
