package io.lighting.mongosql.sql.function;

import io.lighting.mongosql.error.UnsupportedFeatureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

public final class DefaultFunctionRegistry implements FunctionRegistry {
    static final DefaultFunctionRegistry STANDARD = standardBuilder().build();

    private final Map<String, FunctionLowering> lowerings;

    private DefaultFunctionRegistry(Map<String, FunctionLowering> lowerings) {
        this.lowerings = Collections.unmodifiableMap(new LinkedHashMap<>(lowerings));
    }

    /**
     * Starts from the standard functions: {@code LOWER}, {@code UPPER},
     * {@code CONCAT}, {@code COALESCE}, {@code ABS} and {@code ROUND}.
     */
    public static Builder builder() {
        return standardBuilder();
    }

    public static Builder emptyBuilder() {
        return new Builder(Map.of());
    }

    public Builder toBuilder() {
        return new Builder(lowerings);
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name");
        return lowerings.containsKey(normalize(name));
    }

    @Override
    public Object lower(String name, List<Object> args) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");
        FunctionLowering lowering = lowerings.get(normalize(name));
        if (lowering == null) {
            throw new UnsupportedFeatureException("Unsupported function: " + name);
        }
        return lowering.lower(normalize(name), args);
    }

    public List<String> names() {
        return List.copyOf(lowerings.keySet());
    }

    private static Builder standardBuilder() {
        return new Builder(Map.of())
            .register("LOWER", unary("$toLower"))
            .register("UPPER", unary("$toUpper"))
            .register("ABS", unary("$abs"))
            .register("CONCAT", (name, args) -> {
                if (args.isEmpty()) {
                    throw arity(name, "at least 1", args.size());
                }
                return new Document("$concat", new ArrayList<>(args));
            })
            .register("COALESCE", (name, args) -> {
                requireArgs(name, args, 1, 2);
                Object fallback = args.size() > 1 ? args.get(1) : null;
                return new Document("$ifNull", Arrays.asList(args.get(0), fallback));
            })
            .register("ROUND", (name, args) -> {
                requireArgs(name, args, 1, 2);
                Object places = args.size() > 1 ? args.get(1) : 0;
                return new Document("$round", Arrays.asList(args.get(0), places));
            });
    }

    private static FunctionLowering unary(String operator) {
        return (name, args) -> {
            requireArgs(name, args, 1, 1);
            return new Document(operator, args.get(0));
        };
    }

    private static void requireArgs(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw arity(name, expected, args.size());
        }
    }

    private static UnsupportedFeatureException arity(String name, String expected, int actual) {
        return new UnsupportedFeatureException(
            "Function " + name + " takes " + expected + " argument(s), got " + actual
        );
    }

    private static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, FunctionLowering> lowerings;

        private Builder(Map<String, FunctionLowering> lowerings) {
            this.lowerings = new LinkedHashMap<>(lowerings);
        }

        public Builder register(String name, FunctionLowering lowering) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(lowering, "lowering");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            lowerings.put(normalize(name), lowering);
            return this;
        }

        /**
         * Maps {@code name} to a one-argument aggregation operator, for example
         * {@code register("LENGTH", "$strLenCP")}.
         */
        public Builder register(String name, String operator) {
            Objects.requireNonNull(operator, "operator");
            return register(name, unary(operator));
        }

        public DefaultFunctionRegistry build() {
            return new DefaultFunctionRegistry(lowerings);
        }
    }
}
