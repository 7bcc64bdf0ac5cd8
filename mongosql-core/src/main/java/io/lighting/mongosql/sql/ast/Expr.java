package io.lighting.mongosql.sql.ast;

import java.util.List;
import java.util.Objects;

public sealed interface Expr permits
    Expr.Column, Expr.NumberLiteral, Expr.StringLiteral, Expr.BooleanLiteral, Expr.NullLiteral,
    Expr.PositionalParam, Expr.NamedParam, Expr.ArrayLiteral, Expr.Between,
    Expr.Binary, Expr.Unary, Expr.Call, Expr.Wildcard {

    record Column(String table, String name) implements Expr {
        public Column {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
        }

        public Column(String name) {
            this(null, name);
        }

        public boolean isQualified() {
            return table != null;
        }

        /**
         * Same column, comparing the qualifier case-insensitively and the field name
         * exactly (document fields are case-sensitive).
         */
        public boolean sameAs(Column other) {
            if (!name.equals(other.name)) {
                return false;
            }
            if (table == null || other.table == null) {
                return table == other.table;
            }
            return table.equalsIgnoreCase(other.table);
        }

        @Override
        public String toString() {
            return table == null ? name : table + "." + name;
        }
    }

    record NumberLiteral(Number value) implements Expr {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record StringLiteral(String value) implements Expr {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record BooleanLiteral(boolean value) implements Expr {
    }

    record NullLiteral() implements Expr {
    }

    /**
     * A {@code ?} marker.
     *
     * @param ordinal zero-based position among all {@code ?} markers of the statement, in
     *                source order
     */
    record PositionalParam(int ordinal) implements Expr {
        public PositionalParam {
            if (ordinal < 0) {
                throw new IllegalArgumentException("ordinal must be >= 0");
            }
        }
    }

    record NamedParam(String name) implements Expr {
        public NamedParam {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
        }
    }

    record ArrayLiteral(List<Expr> items) implements Expr {
        public ArrayLiteral {
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }
    }

    record Between(Expr from, Expr to) implements Expr {
        public Between {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Call(String name, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(args, "args");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            args = List.copyOf(args);
        }

        public boolean isAggregate() {
            return AggregateFunction.isAggregate(name);
        }
    }

    record Wildcard() implements Expr {
    }

    enum BinaryOp {
        OR("OR"),
        AND("AND"),
        EQ("="),
        NE("<>"),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<="),
        IN("IN"),
        NOT_IN("NOT IN"),
        LIKE("LIKE"),
        IS("IS"),
        IS_NOT("IS NOT"),
        BETWEEN("BETWEEN"),
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum UnaryOp { NOT, NEG }
}
