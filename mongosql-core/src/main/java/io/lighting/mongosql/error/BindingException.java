package io.lighting.mongosql.error;

public class BindingException extends MongoSqlException {
    private final String parameter;

    public BindingException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public static BindingException missingNamed(String name) {
        return new BindingException(":" + name, "Missing named parameter :" + name);
    }

    public static BindingException missingPositional(int ordinal, int supplied) {
        return new BindingException(
            "?" + (ordinal + 1),
            "Positional parameter #" + (ordinal + 1) + " has no value (" + supplied + " supplied)"
        );
    }

    /**
     * The parameter as written in the statement: {@code :name} or {@code ?n}
     * (1-based).
     */
    public String parameter() {
        return parameter;
    }
}
