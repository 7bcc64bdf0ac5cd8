package io.lighting.mongosql.sql.compile;

import io.lighting.mongosql.command.CompiledCommand;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.sql.Bindings;
import io.lighting.mongosql.sql.ParameterBinder;
import io.lighting.mongosql.sql.ast.Stmt;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import io.lighting.mongosql.sql.parser.SqlParser;
import java.util.Objects;

/**
 * Parses and lowers statements. Holds no per-call state and can be shared.
 */
public final class SqlCompiler {
    private final StatementLowering lowering;

    public SqlCompiler(TableRegistry tables, FunctionRegistry functions) {
        this.lowering = new StatementLowering(
            Objects.requireNonNull(tables, "tables"),
            Objects.requireNonNull(functions, "functions")
        );
    }

    public CompiledCommand compile(String sql, Bindings bindings) {
        Objects.requireNonNull(sql, "sql");
        return lower(SqlParser.parse(sql), bindings);
    }

    public CompiledCommand lower(Stmt stmt, Bindings bindings) {
        Objects.requireNonNull(stmt, "stmt");
        Objects.requireNonNull(bindings, "bindings");
        return lowering.lower(stmt, new ParameterBinder(bindings));
    }
}
