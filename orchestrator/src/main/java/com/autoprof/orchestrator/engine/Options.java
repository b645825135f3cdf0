package com.autoprof.orchestrator.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable string-keyed options for one job or one batch.
 *
 * In a batch, a value is either a scalar shared by every image or a
 * {@link List} holding one entry per image. The engine reads only
 * {@value #IMAGE_FILE}, {@value #NAME} and {@value #N_PROCS}; every other key
 * is passed through to the steps untouched.
 */
public final class Options {

    public static final String IMAGE_FILE = "image_file";
    public static final String NAME       = "name";
    public static final String N_PROCS    = "n_procs";

    private static final Options EMPTY = new Options(Map.of());

    private final Map<String, Object> values;

    private Options(Map<String, ?> values) {
        // LinkedHashMap keeps the caller's key order and tolerates null values.
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Options of(Map<String, ?> values) {
        return values == null || values.isEmpty() ? EMPTY : new Options(values);
    }

    public static Options empty() {
        return EMPTY;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /** The value when it is a string, otherwise empty. */
    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    /**
     * Integer view of a numeric or numeric-string value.
     *
     * @throws IllegalArgumentException if the value is present but not a number
     */
    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + key + "' must be an integer, got: " + value, e);
        }
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /** True when at least one value is list-valued, i.e. must be broadcast per image. */
    public boolean hasListValues() {
        return values.values().stream().anyMatch(v -> v instanceof List);
    }

    // ------------------------------------------------------------------
    // Derivation
    // ------------------------------------------------------------------

    /** A copy with {@code key} set to {@code value}; this instance is unchanged. */
    public Options with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(key, value);
        return new Options(next);
    }

    @Override
    public String toString() {
        return "Options" + values;
    }
}
