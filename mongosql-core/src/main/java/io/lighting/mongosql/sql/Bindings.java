package io.lighting.mongosql.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameter values for one compilation: named values for {@code :name} markers and
 * an ordered list for {@code ?} markers. {@code null} values are allowed and count
 * as present.
 */
public final class Bindings {
    private static final Bindings EMPTY = new Bindings(Map.of(), List.of());

    private final Map<String, Object> named;
    private final List<Object> positional;

    private Bindings(Map<String, Object> named, List<Object> positional) {
        this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(String name, Object value, Object... more) {
        Objects.requireNonNull(name, "name");
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(name, value);
        if (more.length % 2 != 0) {
            throw new IllegalArgumentException("Bindings must be name/value pairs");
        }
        for (int i = 0; i < more.length; i += 2) {
            Object key = more[i];
            if (!(key instanceof String keyName)) {
                throw new IllegalArgumentException("Binding name must be a String");
            }
            if (entries.containsKey(keyName)) {
                throw new IllegalArgumentException("Duplicate binding: " + keyName);
            }
            entries.put(keyName, more[i + 1]);
        }
        return new Bindings(entries, List.of());
    }

    public static Bindings of(Map<String, ?> named) {
        Objects.requireNonNull(named, "named");
        return new Bindings(new LinkedHashMap<>(named), List.of());
    }

    public static Bindings positional(Object... values) {
        Objects.requireNonNull(values, "values");
        return new Bindings(Map.of(), Arrays.asList(values));
    }

    public static Bindings positional(List<?> values) {
        Objects.requireNonNull(values, "values");
        return new Bindings(Map.of(), new ArrayList<>(values));
    }

    /**
     * Returns a copy with the same named values and {@code values} as the
     * positional list.
     */
    public Bindings withPositional(List<?> values) {
        Objects.requireNonNull(values, "values");
        return new Bindings(named, new ArrayList<>(values));
    }

    public Bindings withPositional(Object... values) {
        Objects.requireNonNull(values, "values");
        return withPositional(Arrays.asList(values));
    }

    public boolean contains(String name) {
        return named.containsKey(name);
    }

    public Map<String, Object> named() {
        return named;
    }

    public List<Object> positional() {
        return positional;
    }

    public boolean isEmpty() {
        return named.isEmpty() && positional.isEmpty();
    }
}
