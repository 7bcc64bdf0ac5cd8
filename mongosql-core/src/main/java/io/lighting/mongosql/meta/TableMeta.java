package io.lighting.mongosql.meta;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry entry for one logical table.
 *
 * @param name       logical table name used in statements
 * @param collection backing collection
 * @param fieldMap   logical column name to stored field name; unmapped columns keep
 *                   their name
 * @param indexes    index hints for the execution layer
 */
public record TableMeta(
    String name,
    String collection,
    Map<String, String> fieldMap,
    List<IndexHint> indexes
) {
    public TableMeta {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(collection, "collection");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
        fieldMap = fieldMap == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fieldMap));
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
    }

    public static TableMeta of(String name, String collection) {
        return new TableMeta(name, collection, Map.of(), List.of());
    }

    /**
     * The stored field for {@code column}.
     */
    public String field(String column) {
        return fieldMap.getOrDefault(column, column);
    }
}
