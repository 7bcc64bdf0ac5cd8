package io.lighting.mongosql.sql.compile;

import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.sql.ParameterBinder;
import io.lighting.mongosql.sql.ast.Expr;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Builds query filters ({@code $match} bodies, update and delete selectors) from
 * boolean expressions.
 */
final class FilterBuilder {
    private static final String REGEX_METACHARACTERS = "\\^$.|?*+()[]{}";

    private final FieldResolver fields;
    private final ParameterBinder binder;

    FilterBuilder(FieldResolver fields, ParameterBinder binder) {
        this.fields = Objects.requireNonNull(fields, "fields");
        this.binder = Objects.requireNonNull(binder, "binder");
    }

    /**
     * Filter over the primary table of {@code scope}.
     */
    static FilterBuilder forScope(QueryScope scope, ParameterBinder binder) {
        QueryScope primary = scope.primaryOnly();
        return new FilterBuilder(
            expr -> expr instanceof Expr.Column column ? primary.field(column) : null,
            binder
        );
    }

    /**
     * Returns the filter for {@code where}; {@code null} yields the empty filter.
     */
    Document build(Expr where) {
        if (where == null) {
            return new Document();
        }
        return predicate(where);
    }

    private Document predicate(Expr expr) {
        if (expr instanceof Expr.Binary binary) {
            return switch (binary.op()) {
                case AND -> new Document("$and", flatten(binary, Expr.BinaryOp.AND));
                case OR -> new Document("$or", flatten(binary, Expr.BinaryOp.OR));
                case EQ -> comparison(binary, "$eq");
                case NE -> comparison(binary, "$ne");
                case GT -> comparison(binary, "$gt");
                case GE -> comparison(binary, "$gte");
                case LT -> comparison(binary, "$lt");
                case LE -> comparison(binary, "$lte");
                case IN -> membership(binary, "$in");
                case NOT_IN -> membership(binary, "$nin");
                case LIKE -> like(binary);
                case IS -> fieldPredicate(requireField(binary.left(), binary), new Document("$eq", null));
                case IS_NOT -> fieldPredicate(requireField(binary.left(), binary), new Document("$ne", null));
                case BETWEEN -> between(binary);
                default -> throw new UnsupportedFeatureException(
                    "Operator " + binary.op().symbol() + " is not supported in filters"
                );
            };
        }
        if (expr instanceof Expr.Unary unary && unary.op() == Expr.UnaryOp.NOT) {
            List<Document> negated = new ArrayList<>();
            negated.add(predicate(unary.operand()));
            return new Document("$nor", negated);
        }
        throw new UnsupportedFeatureException("Expression is not a filter predicate: " + expr);
    }

    private List<Document> flatten(Expr.Binary binary, Expr.BinaryOp op) {
        List<Document> parts = new ArrayList<>();
        collect(binary, op, parts);
        return parts;
    }

    private void collect(Expr expr, Expr.BinaryOp op, List<Document> parts) {
        if (expr instanceof Expr.Binary binary && binary.op() == op) {
            collect(binary.left(), op, parts);
            collect(binary.right(), op, parts);
        } else {
            parts.add(predicate(expr));
        }
    }

    private Document comparison(Expr.Binary binary, String operator) {
        String left = fields.resolve(binary.left());
        String right = fields.resolve(binary.right());
        if (left != null && right != null) {
            throw new UnsupportedFeatureException(
                "Field-to-field comparison is not supported: " + binary.left() + " " + binary.op().symbol()
                    + " " + binary.right()
            );
        }
        if (left != null) {
            return fieldPredicate(left, new Document(operator, value(binary.right(), binary)));
        }
        if (right != null) {
            // written value-first, e.g. 5 < age
            return fieldPredicate(right, new Document(mirror(operator), value(binary.left(), binary)));
        }
        throw new UnsupportedFeatureException(
            "Comparison needs a column on one side: " + binary.left() + " " + binary.op().symbol() + " " + binary.right()
        );
    }

    private Document membership(Expr.Binary binary, String operator) {
        String field = requireField(binary.left(), binary);
        Object bound = binder.bind(binary.right());
        return fieldPredicate(field, new Document(operator, asList(bound)));
    }

    private Document like(Expr.Binary binary) {
        String field = requireField(binary.left(), binary);
        Object pattern = value(binary.right(), binary);
        if (!(pattern instanceof String text)) {
            throw new UnsupportedFeatureException("LIKE pattern must be a string for " + field);
        }
        Document regex = new Document("$regex", likeToRegex(text)).append("$options", "i");
        return fieldPredicate(field, regex);
    }

    private Document between(Expr.Binary binary) {
        String field = requireField(binary.left(), binary);
        if (!(binary.right() instanceof Expr.Between range)) {
            throw new UnsupportedFeatureException("BETWEEN needs a range on " + field);
        }
        Document bounds = new Document("$gte", value(range.from(), binary))
            .append("$lte", value(range.to(), binary));
        return fieldPredicate(field, bounds);
    }

    private Object value(Expr expr, Expr.Binary context) {
        if (!binder.isValue(expr)) {
            throw new UnsupportedFeatureException(
                "Filter operand must be a literal or parameter in: " + context.left() + " "
                    + context.op().symbol() + " " + context.right()
            );
        }
        return binder.bind(expr);
    }

    private String requireField(Expr expr, Expr.Binary context) {
        String field = fields.resolve(expr);
        if (field == null) {
            throw new UnsupportedFeatureException(
                "Left side of " + context.op().symbol() + " must be a column, found " + expr
            );
        }
        return field;
    }

    private static Document fieldPredicate(String field, Document condition) {
        return new Document(field, condition);
    }

    private static String mirror(String operator) {
        return switch (operator) {
            case "$gt" -> "$lt";
            case "$gte" -> "$lte";
            case "$lt" -> "$gt";
            case "$lte" -> "$gte";
            default -> operator;
        };
    }

    private static List<Object> asList(Object value) {
        List<Object> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            values.addAll(collection);
        } else if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                values.add(Array.get(value, i));
            }
        } else {
            values.add(value);
        }
        return values;
    }

    /**
     * Anchored, case-insensitive regex for a LIKE pattern: {@code %} matches any run,
     * {@code _} any single character, everything else literally.
     */
    static String likeToRegex(String pattern) {
        StringBuilder regex = new StringBuilder(pattern.length() + 8);
        regex.append('^');
        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);
            if (ch == '%') {
                regex.append(".*");
            } else if (ch == '_') {
                regex.append('.');
            } else if (REGEX_METACHARACTERS.indexOf(ch) >= 0) {
                regex.append('\\').append(ch);
            } else {
                regex.append(ch);
            }
        }
        regex.append('$');
        return regex.toString();
    }

    /**
     * Maps an operand to the document field it reads, or {@code null} when the
     * operand is not a field reference.
     */
    @FunctionalInterface
    interface FieldResolver {
        String resolve(Expr expr);
    }
}
