package io.lighting.mongosql.sql.compile;

import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.sql.ParameterBinder;
import io.lighting.mongosql.sql.ast.AggregateFunction;
import io.lighting.mongosql.sql.ast.Expr;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.bson.Document;

/**
 * Lowers expressions to aggregation expressions: columns become {@code $path}
 * references, arithmetic becomes {@code $add}/{@code $subtract}/..., scalar calls go
 * through the {@link FunctionRegistry}.
 */
final class ExpressionCompiler {
    private final QueryScope scope;
    private final ParameterBinder binder;
    private final FunctionRegistry functions;

    ExpressionCompiler(QueryScope scope, ParameterBinder binder, FunctionRegistry functions) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    /**
     * Compiles a projection value. Constants are wrapped in {@code $literal} so the
     * projection does not read them as inclusion flags or field paths.
     */
    Object compileProjection(Expr expr) {
        if (binder.isValue(expr)) {
            return new Document("$literal", binder.bind(expr));
        }
        return compile(expr);
    }

    Object compile(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        if (expr instanceof Expr.Column column) {
            return "$" + scope.field(column);
        }
        if (binder.isValue(expr)) {
            return literal(binder.bind(expr));
        }
        if (expr instanceof Expr.Binary binary) {
            return compileArithmetic(binary);
        }
        if (expr instanceof Expr.Unary unary && unary.op() == Expr.UnaryOp.NEG) {
            return new Document("$multiply", Arrays.asList(compile(unary.operand()), -1));
        }
        if (expr instanceof Expr.Call call) {
            if (call.isAggregate()) {
                throw new UnsupportedFeatureException(
                    "Aggregate " + call.name() + " is only allowed as a select item of an aggregating query"
                );
            }
            List<Object> args = new ArrayList<>(call.args().size());
            for (Expr arg : call.args()) {
                if (arg instanceof Expr.Wildcard) {
                    throw new UnsupportedFeatureException("'*' is not a valid argument of " + call.name());
                }
                args.add(compile(arg));
            }
            return functions.lower(call.name(), args);
        }
        if (expr instanceof Expr.Wildcard) {
            throw new UnsupportedFeatureException("'*' cannot be mixed with other select items");
        }
        throw new UnsupportedFeatureException("Unsupported expression in projection: " + describe(expr));
    }

    /**
     * Compiles an aggregate select item into a {@code $group} accumulator.
     */
    Document compileAccumulator(Expr.Call call) {
        AggregateFunction function = AggregateFunction.of(call.name());
        if (function == null) {
            throw new UnsupportedFeatureException(call.name() + " is not an aggregate function");
        }
        List<Expr> args = call.args();
        if (function == AggregateFunction.COUNT) {
            if (args.isEmpty() || (args.size() == 1 && args.get(0) instanceof Expr.Wildcard)) {
                return new Document("$sum", 1);
            }
            requireSingleArgument(call);
            Document present = new Document("$gt", Arrays.asList(compileAggregateArgument(call), null));
            return new Document("$sum", new Document("$cond", Arrays.asList(present, 1, 0)));
        }
        requireSingleArgument(call);
        String operator = "$" + function.name().toLowerCase(Locale.ROOT);
        return new Document(operator, compileAggregateArgument(call));
    }

    private Object compileAggregateArgument(Expr.Call call) {
        Expr arg = call.args().get(0);
        if (arg instanceof Expr.Wildcard) {
            throw new UnsupportedFeatureException("'*' is only valid in COUNT(*), not in " + call.name());
        }
        return compile(arg);
    }

    private static void requireSingleArgument(Expr.Call call) {
        if (call.args().size() != 1) {
            throw new UnsupportedFeatureException(
                "Aggregate " + call.name() + " takes 1 argument, got " + call.args().size()
            );
        }
    }

    private Object compileArithmetic(Expr.Binary binary) {
        String operator = switch (binary.op()) {
            case ADD -> "$add";
            case SUB -> "$subtract";
            case MUL -> "$multiply";
            case DIV -> "$divide";
            default -> throw new UnsupportedFeatureException(
                "Operator " + binary.op().symbol() + " is not supported in projections"
            );
        };
        return new Document(operator, Arrays.asList(compile(binary.left()), compile(binary.right())));
    }

    private static Object literal(Object value) {
        if (value instanceof String text && text.startsWith("$")) {
            return new Document("$literal", text);
        }
        return value;
    }

    private static String describe(Expr expr) {
        return expr.getClass().getSimpleName();
    }
}
