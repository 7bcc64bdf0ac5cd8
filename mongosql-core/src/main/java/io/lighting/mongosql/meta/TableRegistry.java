package io.lighting.mongosql.meta;

/**
 * Table metadata consumed by the compiler.
 */
@FunctionalInterface
public interface TableRegistry {
    /**
     * Resolves a logical table name, ignoring case.
     *
     * @throws io.lighting.mongosql.error.UnresolvedTableException when no table is
     *         registered under {@code name}
     */
    TableMeta resolve(String name);
}
