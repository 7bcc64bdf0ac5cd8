package io.lighting.mongosql.sql.compile;

import io.lighting.mongosql.error.UnresolvedTableException;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.meta.TableMeta;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.sql.ast.Expr;
import io.lighting.mongosql.sql.ast.Join;
import io.lighting.mongosql.sql.ast.TableRef;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tables visible to a statement and the document paths their columns map to.
 * <p>
 * Columns of the primary table live at the top level of each document; columns of
 * a joined table live under the join alias, where {@code $unwind} leaves them.
 */
final class QueryScope {
    private final TableRef primary;
    private final TableMeta primaryMeta;
    private final Map<String, JoinedTable> joined;
    private final boolean joinsVisible;

    private QueryScope(TableRef primary, TableMeta primaryMeta, Map<String, JoinedTable> joined, boolean joinsVisible) {
        this.primary = primary;
        this.primaryMeta = primaryMeta;
        this.joined = joined;
        this.joinsVisible = joinsVisible;
    }

    static QueryScope of(TableRegistry registry, TableRef primary, List<Join> joins) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(primary, "primary");
        TableMeta primaryMeta = registry.resolve(primary.tableName());
        Map<String, JoinedTable> joined = new LinkedHashMap<>();
        for (Join join : joins) {
            TableMeta meta = registry.resolve(join.table().tableName());
            String key = key(join.table().reference());
            if (joined.containsKey(key) || key.equals(key(primary.reference()))) {
                throw new UnsupportedFeatureException("Duplicate table alias: " + join.table().reference());
            }
            joined.put(key, new JoinedTable(join.table(), meta));
        }
        return new QueryScope(primary, primaryMeta, joined, true);
    }

    static QueryScope of(TableRegistry registry, TableRef primary) {
        return of(registry, primary, List.of());
    }

    /**
     * The same tables, but columns of joined tables are rejected. Used for the
     * {@code WHERE} filter, which runs before any lookup.
     */
    QueryScope primaryOnly() {
        return new QueryScope(primary, primaryMeta, joined, false);
    }

    TableMeta primaryMeta() {
        return primaryMeta;
    }

    TableMeta joinedMeta(TableRef table) {
        return joined.get(key(table.reference())).meta();
    }

    boolean isJoinAlias(String qualifier) {
        return qualifier != null && joined.containsKey(key(qualifier));
    }

    /**
     * Document path of {@code column}, with the table's field map applied.
     */
    String field(Expr.Column column) {
        Objects.requireNonNull(column, "column");
        String qualifier = column.table();
        if (qualifier == null || isPrimary(qualifier)) {
            return primaryMeta.field(column.name());
        }
        JoinedTable table = joined.get(key(qualifier));
        if (table == null) {
            throw new UnresolvedTableException(qualifier, "Unknown table or alias: " + qualifier);
        }
        if (!joinsVisible) {
            throw new UnsupportedFeatureException(
                "Column " + column + " belongs to joined table " + qualifier
                    + " and cannot be filtered before the join"
            );
        }
        return table.ref().reference() + "." + table.meta().field(column.name());
    }

    private boolean isPrimary(String qualifier) {
        return qualifier.equalsIgnoreCase(primary.tableName())
            || (primary.alias() != null && qualifier.equalsIgnoreCase(primary.alias()));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private record JoinedTable(TableRef ref, TableMeta meta) {
    }
}
