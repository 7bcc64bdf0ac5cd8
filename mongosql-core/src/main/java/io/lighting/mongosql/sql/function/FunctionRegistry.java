package io.lighting.mongosql.sql.function;

import java.util.List;

public interface FunctionRegistry {
    boolean contains(String name);

    /**
     * Lowers a call to {@code name}.
     *
     * @throws io.lighting.mongosql.error.UnsupportedFeatureException when the name is
     *         unknown or the argument count does not fit
     */
    Object lower(String name, List<Object> args);

    static FunctionRegistry standard() {
        return DefaultFunctionRegistry.STANDARD;
    }
}
