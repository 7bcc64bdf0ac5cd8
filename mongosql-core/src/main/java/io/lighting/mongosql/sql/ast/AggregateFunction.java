package io.lighting.mongosql.sql.ast;

import java.util.Locale;

public enum AggregateFunction {
    COUNT, SUM, AVG, MIN, MAX;

    public static boolean isAggregate(String name) {
        return of(name) != null;
    }

    /**
     * Returns the aggregate named {@code name} (any case), or {@code null} for scalar
     * function names.
     */
    public static AggregateFunction of(String name) {
        String normalized = name.toUpperCase(Locale.ROOT);
        for (AggregateFunction function : values()) {
            if (function.name().equals(normalized)) {
                return function;
            }
        }
        return null;
    }
}
