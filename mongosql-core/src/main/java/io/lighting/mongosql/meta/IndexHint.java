package io.lighting.mongosql.meta;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Index declared for a table. Carried for the execution layer; the compiler never
 * creates indexes.
 *
 * @param keys   field to direction ({@code 1} or {@code -1}), in key order
 * @param unique whether the index enforces uniqueness
 */
public record IndexHint(Map<String, Integer> keys, boolean unique) {
    public IndexHint {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Index keys must not be empty");
        }
        for (Map.Entry<String, Integer> entry : keys.entrySet()) {
            Integer direction = entry.getValue();
            if (direction == null || (direction != 1 && direction != -1)) {
                throw new IllegalArgumentException(
                    "Index direction for " + entry.getKey() + " must be 1 or -1"
                );
            }
        }
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    public static IndexHint ascending(String field) {
        return new IndexHint(Map.of(field, 1), false);
    }

    public static IndexHint unique(String field) {
        return new IndexHint(Map.of(field, 1), true);
    }
}
