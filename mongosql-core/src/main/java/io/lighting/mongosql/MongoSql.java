package io.lighting.mongosql;

import io.lighting.mongosql.command.CompiledCommand;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.observe.CompileObserver;
import io.lighting.mongosql.sql.Bindings;
import io.lighting.mongosql.sql.ast.Stmt;
import io.lighting.mongosql.sql.compile.SqlCompiler;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import io.lighting.mongosql.sql.parser.SqlParser;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: compiles SQL-like statements into MongoDB commands.
 * <p>
 * Immutable once built; one instance can serve any number of threads.
 */
public final class MongoSql {
    private final SqlCompiler compiler;
    private final TableRegistry tableRegistry;
    private final FunctionRegistry functionRegistry;
    private final List<CompileObserver> observers;

    private MongoSql(
        SqlCompiler compiler,
        TableRegistry tableRegistry,
        FunctionRegistry functionRegistry,
        List<CompileObserver> observers
    ) {
        this.compiler = compiler;
        this.tableRegistry = tableRegistry;
        this.functionRegistry = functionRegistry;
        this.observers = observers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Stmt parse(String sql) {
        Objects.requireNonNull(sql, "sql");
        return SqlParser.parse(sql);
    }

    public CompiledCommand compile(String sql) {
        return compile(sql, Bindings.empty());
    }

    public CompiledCommand compile(String sql, Map<String, ?> named) {
        Objects.requireNonNull(named, "named");
        return compile(sql, Bindings.of(named));
    }

    public CompiledCommand compile(String sql, Map<String, ?> named, List<?> positional) {
        Objects.requireNonNull(named, "named");
        Objects.requireNonNull(positional, "positional");
        return compile(sql, Bindings.of(named).withPositional(positional));
    }

    public CompiledCommand compile(String sql, Bindings bindings) {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(bindings, "bindings");
        for (CompileObserver observer : observers) {
            observer.beforeCompile(sql, bindings);
        }
        long start = System.nanoTime();
        CompiledCommand command;
        try {
            command = compiler.compile(sql, bindings);
        } catch (RuntimeException ex) {
            long elapsed = System.nanoTime() - start;
            for (CompileObserver observer : observers) {
                observer.onCompileError(sql, bindings, ex, elapsed);
            }
            throw ex;
        }
        long elapsed = System.nanoTime() - start;
        for (CompileObserver observer : observers) {
            observer.afterCompile(sql, bindings, command, elapsed);
        }
        return command;
    }

    public SqlCompiler compiler() {
        return compiler;
    }

    public TableRegistry tableRegistry() {
        return tableRegistry;
    }

    public FunctionRegistry functionRegistry() {
        return functionRegistry;
    }

    public List<CompileObserver> observers() {
        return observers;
    }

    public static final class Builder {
        private TableRegistry tableRegistry;
        private FunctionRegistry functionRegistry = FunctionRegistry.standard();
        private List<CompileObserver> observers = List.of();

        private Builder() {
        }

        public Builder tableRegistry(TableRegistry tableRegistry) {
            this.tableRegistry = Objects.requireNonNull(tableRegistry, "tableRegistry");
            return this;
        }

        // 函数表：默认 LOWER/UPPER/CONCAT/COALESCE/ABS/ROUND，可通过 DefaultFunctionRegistry.builder() 扩展。
        public Builder functionRegistry(FunctionRegistry functionRegistry) {
            this.functionRegistry = Objects.requireNonNull(functionRegistry, "functionRegistry");
            return this;
        }

        public Builder observers(List<CompileObserver> observers) {
            this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
            return this;
        }

        public MongoSql build() {
            Objects.requireNonNull(tableRegistry, "tableRegistry");
            SqlCompiler compiler = new SqlCompiler(tableRegistry, functionRegistry);
            return new MongoSql(compiler, tableRegistry, functionRegistry, observers);
        }
    }
}
