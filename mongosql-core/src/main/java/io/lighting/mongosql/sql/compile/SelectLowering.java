package io.lighting.mongosql.sql.compile;

import io.lighting.mongosql.command.SelectCommand;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.meta.TableMeta;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.sql.ParameterBinder;
import io.lighting.mongosql.sql.ast.Expr;
import io.lighting.mongosql.sql.ast.Join;
import io.lighting.mongosql.sql.ast.JoinType;
import io.lighting.mongosql.sql.ast.OrderItem;
import io.lighting.mongosql.sql.ast.SelectItem;
import io.lighting.mongosql.sql.ast.SelectStmt;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bson.Document;

/**
 * Lowers a SELECT into an aggregation pipeline. Stages are always emitted in this
 * order: {@code $match}, {@code $lookup}/{@code $unwind} per join, {@code $group}
 * with its {@code $match} for HAVING, {@code $project}, {@code $sort},
 * {@code $skip}, {@code $limit}.
 */
final class SelectLowering {
    private final TableRegistry tables;
    private final FunctionRegistry functions;

    SelectLowering(TableRegistry tables, FunctionRegistry functions) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    LoweredSelect lower(SelectStmt stmt, ParameterBinder binder) {
        Objects.requireNonNull(stmt, "stmt");
        Objects.requireNonNull(binder, "binder");
        QueryScope scope = QueryScope.of(tables, stmt.from(), stmt.joins());
        ExpressionCompiler compiler = new ExpressionCompiler(scope, binder, functions);
        List<Document> pipeline = new ArrayList<>();

        if (stmt.where() != null) {
            pipeline.add(new Document("$match", FilterBuilder.forScope(scope, binder).build(stmt.where())));
        }
        for (Join join : stmt.joins()) {
            appendJoin(join, scope, pipeline);
        }

        Projection projection;
        if (isAggregating(stmt)) {
            projection = appendGrouping(stmt, scope, compiler, binder, pipeline);
        } else {
            if (stmt.having() != null) {
                throw new UnsupportedFeatureException("HAVING requires GROUP BY or an aggregate in the select list");
            }
            projection = appendProjection(stmt, compiler, pipeline);
        }

        if (!stmt.orderBy().isEmpty()) {
            Document sort = new Document();
            for (OrderItem item : stmt.orderBy()) {
                String key = sortKey(item.expr(), projection, scope);
                // a repeated key cannot change the order set by its first occurrence
                if (!sort.containsKey(key)) {
                    sort.append(key, item.direction().mongoValue());
                }
            }
            pipeline.add(new Document("$sort", sort));
        }
        if (stmt.offset() != null) {
            pipeline.add(new Document("$skip", stmt.offset()));
        }
        if (stmt.limit() != null) {
            pipeline.add(new Document("$limit", stmt.limit()));
        }
        String collection = scope.primaryMeta().collection();
        return new LoweredSelect(new SelectCommand(collection, pipeline), projection.outputs());
    }

    private void appendJoin(Join join, QueryScope scope, List<Document> pipeline) {
        String alias = join.table().reference();
        Expr.Column local;
        Expr.Column foreign;
        if (qualifiedBy(join.right(), alias)) {
            local = join.left();
            foreign = join.right();
        } else if (qualifiedBy(join.left(), alias)) {
            local = join.right();
            foreign = join.left();
        } else if (!join.right().isQualified()) {
            // unqualified right side belongs to the joined table
            local = join.left();
            foreign = join.right();
        } else {
            throw new UnsupportedFeatureException(
                "Join condition on " + alias + " must reference a column of " + alias
            );
        }
        if (qualifiedBy(local, alias)) {
            throw new UnsupportedFeatureException(
                "Join condition on " + alias + " compares two columns of the same table"
            );
        }
        TableMeta joined = scope.joinedMeta(join.table());
        Document lookup = new Document("from", joined.collection())
            .append("localField", scope.field(local))
            .append("foreignField", joined.field(foreign.name()))
            .append("as", alias);
        pipeline.add(new Document("$lookup", lookup));
        Document unwind = new Document("path", "$" + alias)
            .append("preserveNullAndEmptyArrays", join.type() == JoinType.LEFT);
        pipeline.add(new Document("$unwind", unwind));
    }

    private static boolean qualifiedBy(Expr.Column column, String alias) {
        return column.table() != null && column.table().equalsIgnoreCase(alias);
    }

    private static boolean isAggregating(SelectStmt stmt) {
        if (!stmt.groupBy().isEmpty()) {
            return true;
        }
        for (SelectItem item : stmt.columns()) {
            if (item.expr() instanceof Expr.Call call && call.isAggregate()) {
                return true;
            }
        }
        return false;
    }

    private Projection appendGrouping(
        SelectStmt stmt,
        QueryScope scope,
        ExpressionCompiler compiler,
        ParameterBinder binder,
        List<Document> pipeline
    ) {
        Map<String, String> keysByField = groupKeys(stmt, scope);

        Document group = new Document("_id", null);
        if (!keysByField.isEmpty()) {
            Document id = new Document();
            keysByField.forEach((field, key) -> id.append(key, "$" + field));
            group.put("_id", id);
        }

        Document project = new Document();
        Map<Document, String> aggregateOutputs = new LinkedHashMap<>();
        Map<String, String> aliasTargets = new LinkedHashMap<>();
        List<String> outputs = new ArrayList<>();
        Set<String> projectedKeys = new HashSet<>();
        for (SelectItem item : stmt.columns()) {
            Expr expr = item.expr();
            if (expr instanceof Expr.Call call && call.isAggregate()) {
                String output = item.alias() != null ? item.alias() : call.name().toLowerCase(Locale.ROOT);
                if ("_id".equals(output)) {
                    throw new UnsupportedFeatureException("Aggregate output name _id is reserved for the group key");
                }
                if (keysByField.containsValue(output)) {
                    throw new UnsupportedFeatureException(
                        "Aggregate output name " + output + " collides with a GROUP BY key"
                    );
                }
                Document accumulator = compiler.compileAccumulator(call);
                addOutput(outputs, output);
                group.append(output, accumulator);
                project.append(output, 1);
                aggregateOutputs.putIfAbsent(accumulator, output);
                aliasTargets.put(output, output);
            } else if (expr instanceof Expr.Column column) {
                String key = keysByField.get(scope.field(column));
                if (key == null) {
                    throw new UnsupportedFeatureException(
                        "Column " + column + " must appear in GROUP BY or be used in an aggregate"
                    );
                }
                String output = item.alias() != null ? item.alias() : key;
                addOutput(outputs, output);
                project.append(output, "$_id." + key);
                projectedKeys.add(key);
                aliasTargets.put(output, "_id." + key);
            } else if (expr instanceof Expr.Wildcard) {
                throw new UnsupportedFeatureException("'*' cannot be selected in an aggregating query");
            } else {
                throw new UnsupportedFeatureException(
                    "Select item must be a GROUP BY column or an aggregate in an aggregating query: " + expr
                );
            }
        }
        pipeline.add(new Document("$group", group));

        if (stmt.having() != null) {
            FilterBuilder having = new FilterBuilder(
                expr -> havingField(expr, scope, compiler, keysByField, aggregateOutputs, aliasTargets),
                binder
            );
            pipeline.add(new Document("$match", having.build(stmt.having())));
        }

        // group keys missing from the select list are still flattened out of _id
        for (String key : keysByField.values()) {
            if (projectedKeys.contains(key)) {
                continue;
            }
            if (project.containsKey(key)) {
                throw new UnsupportedFeatureException("Select output " + key + " collides with a GROUP BY key");
            }
            project.append(key, "$_id." + key);
        }
        if (!project.containsKey("_id")) {
            project.append("_id", 0);
        }
        pipeline.add(new Document("$project", project));
        return new Projection(outputs, stmt.columns(), true);
    }

    /**
     * Key name under {@code _id} per resolved field path, in GROUP BY order. A select
     * alias names the key; otherwise the column name does, prefixed with its
     * qualifier when two grouped columns share that name.
     */
    private static Map<String, String> groupKeys(SelectStmt stmt, QueryScope scope) {
        Map<String, Expr.Column> columnsByField = new LinkedHashMap<>();
        for (Expr.Column column : stmt.groupBy()) {
            columnsByField.putIfAbsent(scope.field(column), column);
        }
        Map<String, String> aliases = new LinkedHashMap<>();
        Map<String, Integer> nameCounts = new HashMap<>();
        columnsByField.forEach((field, column) -> {
            String alias = groupKeyAlias(field, stmt, scope);
            if (alias != null) {
                aliases.put(field, alias);
            }
            nameCounts.merge(alias != null ? alias : column.name(), 1, Integer::sum);
        });

        Map<String, String> keysByField = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        columnsByField.forEach((field, column) -> {
            String key = aliases.get(field);
            if (key == null) {
                key = column.name();
                if (nameCounts.get(key) > 1 && column.isQualified()) {
                    key = column.table() + "_" + column.name();
                }
            }
            if (!used.add(key)) {
                throw new UnsupportedFeatureException("Ambiguous GROUP BY key name: " + key);
            }
            keysByField.put(field, key);
        });
        return keysByField;
    }

    private static String groupKeyAlias(String field, SelectStmt stmt, QueryScope scope) {
        for (SelectItem item : stmt.columns()) {
            if (item.alias() != null
                && item.expr() instanceof Expr.Column selected
                && scope.field(selected).equals(field)) {
                return item.alias();
            }
        }
        return null;
    }

    /**
     * Field a HAVING operand reads after {@code $group}: group keys live under
     * {@code _id}, aggregates under their output name.
     */
    private static String havingField(
        Expr expr,
        QueryScope scope,
        ExpressionCompiler compiler,
        Map<String, String> keysByField,
        Map<Document, String> aggregateOutputs,
        Map<String, String> aliasTargets
    ) {
        if (expr instanceof Expr.Call call && call.isAggregate()) {
            String output = aggregateOutputs.get(compiler.compileAccumulator(call));
            if (output == null) {
                throw new UnsupportedFeatureException(
                    "HAVING can only use aggregates that are also selected: " + call.name() + call.args()
                );
            }
            return output;
        }
        if (expr instanceof Expr.Column column) {
            if (!column.isQualified() && aliasTargets.containsKey(column.name())) {
                return aliasTargets.get(column.name());
            }
            String key = keysByField.get(scope.field(column));
            if (key == null) {
                throw new UnsupportedFeatureException(
                    "HAVING can only reference GROUP BY columns and selected aggregates: " + column
                );
            }
            return "_id." + key;
        }
        return null;
    }

    private Projection appendProjection(SelectStmt stmt, ExpressionCompiler compiler, List<Document> pipeline) {
        if (stmt.isSelectAll()) {
            return new Projection(List.of(), stmt.columns(), false);
        }
        Document project = new Document();
        List<String> outputs = new ArrayList<>();
        List<SelectItem> columns = stmt.columns();
        for (int i = 0; i < columns.size(); i++) {
            SelectItem item = columns.get(i);
            if (item.expr() instanceof Expr.Wildcard) {
                throw new UnsupportedFeatureException("'*' cannot be mixed with other select items");
            }
            String output = outputName(item, i);
            addOutput(outputs, output);
            project.append(output, compiler.compileProjection(item.expr()));
        }
        if (!project.containsKey("_id")) {
            project.append("_id", 0);
        }
        pipeline.add(new Document("$project", project));
        return new Projection(outputs, columns, true);
    }

    private static String outputName(SelectItem item, int index) {
        if (item.alias() != null) {
            return item.alias();
        }
        if (item.expr() instanceof Expr.Column column) {
            return column.name();
        }
        if (item.expr() instanceof Expr.Call call) {
            return call.name().toLowerCase(Locale.ROOT);
        }
        return "expr" + (index + 1);
    }

    private static void addOutput(List<String> outputs, String output) {
        if (outputs.contains(output)) {
            throw new UnsupportedFeatureException("Duplicate output name in select list: " + output);
        }
        outputs.add(output);
    }

    private static String sortKey(Expr expr, Projection projection, QueryScope scope) {
        if (!projection.projected()) {
            if (expr instanceof Expr.Column column) {
                return scope.field(column);
            }
            throw new UnsupportedFeatureException("ORDER BY supports columns only when selecting *: " + expr);
        }
        if (expr instanceof Expr.Column column && !column.isQualified() && projection.outputs().contains(column.name())) {
            List<SelectItem> items = projection.items();
            for (int i = 0; i < items.size(); i++) {
                if (column.name().equals(items.get(i).alias())) {
                    return projection.outputs().get(i);
                }
            }
        }
        List<SelectItem> items = projection.items();
        for (int i = 0; i < items.size(); i++) {
            Expr selected = items.get(i).expr();
            if (selected.equals(expr) || sameColumn(selected, expr, scope)) {
                return projection.outputs().get(i);
            }
        }
        if (expr instanceof Expr.Column column && !column.isQualified() && projection.outputs().contains(column.name())) {
            return column.name();
        }
        throw new UnsupportedFeatureException("ORDER BY " + expr + " is not part of the select list");
    }

    private static boolean sameColumn(Expr selected, Expr ordered, QueryScope scope) {
        return selected instanceof Expr.Column left
            && ordered instanceof Expr.Column right
            && scope.field(left).equals(scope.field(right));
    }

    /**
     * Output of a lowered SELECT: the command and the names of the projected
     * fields, in select-list order (empty for {@code SELECT *}).
     */
    record LoweredSelect(SelectCommand command, List<String> outputs) {
        LoweredSelect {
            Objects.requireNonNull(command, "command");
            outputs = List.copyOf(outputs);
        }
    }

    private record Projection(List<String> outputs, List<SelectItem> items, boolean projected) {
    }
}
