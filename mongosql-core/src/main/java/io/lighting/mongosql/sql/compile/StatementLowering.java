package io.lighting.mongosql.sql.compile;

import io.lighting.mongosql.command.CompiledCommand;
import io.lighting.mongosql.command.DeleteCommand;
import io.lighting.mongosql.command.InsertCommand;
import io.lighting.mongosql.command.SelectCommand;
import io.lighting.mongosql.command.TransactionCommand;
import io.lighting.mongosql.command.UpdateCommand;
import io.lighting.mongosql.error.ParseException;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.meta.TableMeta;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.sql.ParameterBinder;
import io.lighting.mongosql.sql.ast.Assignment;
import io.lighting.mongosql.sql.ast.DeleteStmt;
import io.lighting.mongosql.sql.ast.Expr;
import io.lighting.mongosql.sql.ast.InsertStmt;
import io.lighting.mongosql.sql.ast.SelectStmt;
import io.lighting.mongosql.sql.ast.Stmt;
import io.lighting.mongosql.sql.ast.TransactionStmt;
import io.lighting.mongosql.sql.ast.UpdateStmt;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

final class StatementLowering {
    private final TableRegistry tables;
    private final SelectLowering selects;

    StatementLowering(TableRegistry tables, FunctionRegistry functions) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.selects = new SelectLowering(tables, functions);
    }

    CompiledCommand lower(Stmt stmt, ParameterBinder binder) {
        Objects.requireNonNull(stmt, "stmt");
        Objects.requireNonNull(binder, "binder");
        if (stmt instanceof SelectStmt selectStmt) {
            return selects.lower(selectStmt, binder).command();
        } else if (stmt instanceof InsertStmt insertStmt) {
            return lowerInsert(insertStmt, binder);
        } else if (stmt instanceof UpdateStmt updateStmt) {
            return lowerUpdate(updateStmt, binder);
        } else if (stmt instanceof DeleteStmt deleteStmt) {
            return lowerDelete(deleteStmt, binder);
        } else if (stmt instanceof TransactionStmt transactionStmt) {
            return new TransactionCommand(transactionStmt.directive());
        }
        throw new IllegalArgumentException("Unsupported statement: " + stmt.getClass().getSimpleName());
    }

    private InsertCommand lowerInsert(InsertStmt stmt, ParameterBinder binder) {
        TableMeta target = tables.resolve(stmt.into().tableName());
        if (stmt.hasSelect()) {
            return InsertCommand.fromSelect(target.collection(), lowerInsertSource(stmt, target, binder));
        }
        List<Document> documents = new ArrayList<>(stmt.rows().size());
        for (List<Expr> row : stmt.rows()) {
            documents.add(stmt.columns().isEmpty() ? wholeDocument(row, binder) : rowDocument(stmt, row, target, binder));
        }
        return InsertCommand.ofDocuments(target.collection(), documents);
    }

    private static Document rowDocument(InsertStmt stmt, List<Expr> row, TableMeta target, ParameterBinder binder) {
        Document document = new Document();
        for (int i = 0; i < stmt.columns().size(); i++) {
            Expr value = row.get(i);
            requireValue(binder, value, "INSERT value for " + stmt.columns().get(i));
            document.append(target.field(stmt.columns().get(i)), binder.bind(value));
        }
        return document;
    }

    /**
     * A row without a column list is a single value holding the whole document,
     * e.g. {@code INSERT INTO users VALUES (:user)}.
     */
    private static Document wholeDocument(List<Expr> row, ParameterBinder binder) {
        if (row.size() != 1) {
            throw new UnsupportedFeatureException(
                "INSERT without a column list takes one document value per row, got " + row.size()
            );
        }
        Expr value = row.get(0);
        requireValue(binder, value, "INSERT document");
        Object bound = binder.bind(value);
        if (!(bound instanceof Map<?, ?> map)) {
            throw new UnsupportedFeatureException(
                "INSERT without a column list needs a document value, got "
                    + (bound == null ? "null" : bound.getClass().getSimpleName())
            );
        }
        Document document = new Document();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            document.append(String.valueOf(entry.getKey()), entry.getValue());
        }
        return document;
    }

    private SelectCommand lowerInsertSource(InsertStmt stmt, TableMeta target, ParameterBinder binder) {
        SelectLowering.LoweredSelect source = selects.lower(stmt.select(), binder);
        List<String> columns = stmt.columns();
        if (columns.isEmpty()) {
            return source.command();
        }
        List<String> outputs = source.outputs();
        if (outputs.isEmpty()) {
            throw new UnsupportedFeatureException("INSERT with a column list cannot take SELECT *");
        }
        if (outputs.size() != columns.size()) {
            throw new ParseException(String.format(
                "INSERT declares %d columns but SELECT produces %d",
                columns.size(),
                outputs.size()
            ));
        }
        Document rename = new Document();
        for (int i = 0; i < columns.size(); i++) {
            rename.append(target.field(columns.get(i)), "$" + outputs.get(i));
        }
        if (!rename.containsKey("_id")) {
            rename.append("_id", 0);
        }
        return source.command().withStage(new Document("$project", rename));
    }

    private UpdateCommand lowerUpdate(UpdateStmt stmt, ParameterBinder binder) {
        QueryScope scope = QueryScope.of(tables, stmt.table());
        TableMeta meta = scope.primaryMeta();
        Document assignments = new Document();
        for (Assignment assignment : stmt.assignments()) {
            requireValue(binder, assignment.value(), "SET " + assignment.column());
            assignments.append(meta.field(assignment.column()), binder.bind(assignment.value()));
        }
        Document filter = FilterBuilder.forScope(scope, binder).build(stmt.where());
        return new UpdateCommand(meta.collection(), filter, assignments);
    }

    private DeleteCommand lowerDelete(DeleteStmt stmt, ParameterBinder binder) {
        QueryScope scope = QueryScope.of(tables, stmt.from());
        Document filter = FilterBuilder.forScope(scope, binder).build(stmt.where());
        return new DeleteCommand(scope.primaryMeta().collection(), filter);
    }

    private static void requireValue(ParameterBinder binder, Expr expr, String context) {
        if (!binder.isValue(expr)) {
            throw new UnsupportedFeatureException(context + " must be a literal or parameter, found " + expr);
        }
    }
}
