package io.lighting.mongosql.starter;

import io.lighting.mongosql.meta.DefaultTableRegistry;
import io.lighting.mongosql.meta.IndexHint;
import io.lighting.mongosql.meta.TableMeta;
import io.lighting.mongosql.observe.CompileLog;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for MongoSQL.
 * <p>
 * Configure these properties under the "mongosql" prefix in application.yml:
 * <pre>{@code
 * mongosql:
 *   tables:
 *     users:
 *       collection: app_users
 *       field-map:
 *         userId: _id
 *       indexes:
 *         - keys:
 *             email: 1
 *           unique: true
 *   log:
 *     enabled: true
 *     include-elapsed: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "mongosql")
public class MongoSqlProperties {

    private Map<String, TableProperties> tables = new LinkedHashMap<>();

    private LogProperties log = new LogProperties();

    public Map<String, TableProperties> getTables() {
        return tables;
    }

    public void setTables(Map<String, TableProperties> tables) {
        this.tables = tables;
    }

    public LogProperties getLog() {
        return log;
    }

    public void setLog(LogProperties log) {
        this.log = log;
    }

    public DefaultTableRegistry buildTableRegistry() {
        DefaultTableRegistry.Builder builder = DefaultTableRegistry.builder();
        tables.forEach((name, table) -> builder.register(table.toMeta(name)));
        return builder.build();
    }

    public static class TableProperties {
        /**
         * Backing collection; defaults to the table name.
         */
        private String collection;
        private Map<String, String> fieldMap = new LinkedHashMap<>();
        private List<IndexProperties> indexes = new ArrayList<>();

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public Map<String, String> getFieldMap() {
            return fieldMap;
        }

        public void setFieldMap(Map<String, String> fieldMap) {
            this.fieldMap = fieldMap;
        }

        public List<IndexProperties> getIndexes() {
            return indexes;
        }

        public void setIndexes(List<IndexProperties> indexes) {
            this.indexes = indexes;
        }

        TableMeta toMeta(String name) {
            String target = collection == null || collection.isBlank() ? name : collection;
            List<IndexHint> hints = new ArrayList<>(indexes.size());
            for (IndexProperties index : indexes) {
                hints.add(new IndexHint(index.getKeys(), index.isUnique()));
            }
            return new TableMeta(name, target, fieldMap, hints);
        }
    }

    public static class IndexProperties {
        private Map<String, Integer> keys = new LinkedHashMap<>();
        private boolean unique = false;

        public Map<String, Integer> getKeys() {
            return keys;
        }

        public void setKeys(Map<String, Integer> keys) {
            this.keys = keys;
        }

        public boolean isUnique() {
            return unique;
        }

        public void setUnique(boolean unique) {
            this.unique = unique;
        }
    }

    public static class LogProperties {
        private boolean enabled = true;
        private boolean includeElapsed = false;
        private boolean includeParameters = false;
        private String prefix = "MQL:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public boolean isIncludeParameters() {
            return includeParameters;
        }

        public void setIncludeParameters(boolean includeParameters) {
            this.includeParameters = includeParameters;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public CompileLog build(Consumer<String> logger) {
            if (!enabled) {
                return null;
            }
            return CompileLog.builder()
                .includeElapsed(includeElapsed)
                .includeParameters(includeParameters)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }
}
