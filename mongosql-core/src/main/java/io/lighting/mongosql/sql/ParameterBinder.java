package io.lighting.mongosql.sql;

import io.lighting.mongosql.error.BindingException;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.sql.ast.Expr;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Resolves value expressions against the {@link Bindings} of a single compilation.
 * Not shared between compilations.
 */
public final class ParameterBinder {
    private final Bindings bindings;
    private int consumed;

    public ParameterBinder(Bindings bindings) {
        this.bindings = Objects.requireNonNull(bindings, "bindings");
    }

    public Object bind(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        if (expr instanceof Expr.NumberLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.StringLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.BooleanLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.NullLiteral) {
            return null;
        }
        if (expr instanceof Expr.PositionalParam param) {
            return bindPositional(param.ordinal());
        }
        if (expr instanceof Expr.NamedParam param) {
            if (!bindings.contains(param.name())) {
                throw BindingException.missingNamed(param.name());
            }
            return bindings.named().get(param.name());
        }
        if (expr instanceof Expr.ArrayLiteral array) {
            List<Object> values = new ArrayList<>(array.items().size());
            for (Expr item : array.items()) {
                values.add(bind(item));
            }
            return values;
        }
        if (expr instanceof Expr.Between between) {
            return Arrays.asList(bind(between.from()), bind(between.to()));
        }
        if (expr instanceof Expr.Unary unary && unary.op() == Expr.UnaryOp.NEG) {
            Object value = bind(unary.operand());
            if (value instanceof Number number) {
                return Numbers.negate(number);
            }
            throw new UnsupportedFeatureException("Unary minus needs a numeric value, got " + describe(value));
        }
        throw new UnsupportedFeatureException("Expected a literal or parameter but found " + expr);
    }

    public boolean isValue(Expr expr) {
        if (expr instanceof Expr.Unary unary) {
            return unary.op() == Expr.UnaryOp.NEG && isValue(unary.operand());
        }
        return expr instanceof Expr.NumberLiteral
            || expr instanceof Expr.StringLiteral
            || expr instanceof Expr.BooleanLiteral
            || expr instanceof Expr.NullLiteral
            || expr instanceof Expr.PositionalParam
            || expr instanceof Expr.NamedParam;
    }

    /**
     * Number of positional values read so far, counting each distinct marker once.
     */
    public int consumed() {
        return consumed;
    }

    private Object bindPositional(int ordinal) {
        List<Object> values = bindings.positional();
        if (ordinal >= values.size()) {
            throw BindingException.missingPositional(ordinal, values.size());
        }
        consumed = Math.max(consumed, ordinal + 1);
        return values.get(ordinal);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
