package io.lighting.mongosql.sql.function;

import java.util.List;

/**
 * Turns a scalar call into an aggregation expression. Arguments arrive already
 * compiled (field paths, literals, nested operator documents).
 */
@FunctionalInterface
public interface FunctionLowering {
    Object lower(String name, List<Object> args);
}
