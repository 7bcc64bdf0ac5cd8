package io.lighting.mongosql.meta;

import io.lighting.mongosql.error.UnresolvedTableException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only, case-insensitive table registry built once through {@link #builder()}.
 */
public final class DefaultTableRegistry implements TableRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultTableRegistry.class);

    private final Map<String, TableMeta> tables;

    private DefaultTableRegistry(Map<String, TableMeta> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TableMeta resolve(String name) {
        Objects.requireNonNull(name, "name");
        TableMeta meta = tables.get(key(name));
        if (meta == null) {
            throw new UnresolvedTableException(name);
        }
        return meta;
    }

    public boolean contains(String name) {
        return name != null && tables.containsKey(key(name));
    }

    public Collection<TableMeta> tables() {
        return tables.values();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, TableMeta> tables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, String collection) {
            return register(TableMeta.of(name, collection));
        }

        public Builder register(String name, String collection, Map<String, String> fieldMap) {
            return register(new TableMeta(name, collection, fieldMap, List.of()));
        }

        public Builder register(TableMeta meta) {
            Objects.requireNonNull(meta, "meta");
            String key = key(meta.name());
            if (tables.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate table: " + meta.name());
            }
            tables.put(key, meta);
            return this;
        }

        public DefaultTableRegistry build() {
            if (LOGGER.isDebugEnabled()) {
                List<String> mappings = new ArrayList<>(tables.size());
                for (TableMeta meta : tables.values()) {
                    mappings.add(meta.name() + "->" + meta.collection());
                }
                LOGGER.debug("Registered {} table(s): {}", tables.size(), mappings);
            }
            return new DefaultTableRegistry(tables);
        }
    }
}
