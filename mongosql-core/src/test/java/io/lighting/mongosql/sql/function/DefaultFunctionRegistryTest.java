package io.lighting.mongosql.sql.function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.mongosql.error.UnsupportedFeatureException;
import java.util.Arrays;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class DefaultFunctionRegistryTest {
    private final FunctionRegistry registry = FunctionRegistry.standard();

    @Test
    void lowersStandardFunctions() {
        assertEquals(new Document("$toLower", "$name"), registry.lower("lower", List.of("$name")));
        assertEquals(new Document("$toUpper", "$name"), registry.lower("UPPER", List.of("$name")));
        assertEquals(new Document("$abs", "$delta"), registry.lower("ABS", List.of("$delta")));
        assertEquals(
            new Document("$concat", List.of("$first", " ", "$last")),
            registry.lower("CONCAT", List.of("$first", " ", "$last"))
        );
    }

    @Test
    void coalesceDefaultsToNull() {
        assertEquals(new Document("$ifNull", Arrays.asList("$nick", null)), registry.lower("COALESCE", List.of("$nick")));
        assertEquals(
            new Document("$ifNull", List.of("$nick", "$name")),
            registry.lower("COALESCE", List.of("$nick", "$name"))
        );
    }

    @Test
    void roundDefaultsToZeroPlaces() {
        assertEquals(new Document("$round", List.of("$price", 0)), registry.lower("ROUND", List.of("$price")));
        assertEquals(new Document("$round", List.of("$price", 2)), registry.lower("ROUND", List.of("$price", 2)));
    }

    @Test
    void rejectsWrongArity() {
        assertThrows(UnsupportedFeatureException.class, () -> registry.lower("LOWER", List.of()));
        assertThrows(UnsupportedFeatureException.class, () -> registry.lower("ROUND", List.of("$a", 1, 2)));
        assertThrows(UnsupportedFeatureException.class, () -> registry.lower("CONCAT", List.of()));
    }

    @Test
    void rejectsUnknownFunction() {
        assertFalse(registry.contains("SOUNDEX"));
        UnsupportedFeatureException error = assertThrows(
            UnsupportedFeatureException.class,
            () -> registry.lower("SOUNDEX", List.of("$name"))
        );
        assertEquals("Unsupported function: SOUNDEX", error.getMessage());
    }

    @Test
    void builderExtendsWithoutTouchingStandard() {
        DefaultFunctionRegistry extended = DefaultFunctionRegistry.builder()
            .register("length", "$strLenCP")
            .register("TRIM", (name, args) -> new Document("$trim", new Document("input", args.get(0))))
            .build();
        assertEquals(new Document("$strLenCP", "$name"), extended.lower("LENGTH", List.of("$name")));
        assertEquals(new Document("$trim", new Document("input", "$name")), extended.lower("trim", List.of("$name")));
        assertTrue(extended.contains("LOWER"));
        assertFalse(registry.contains("LENGTH"));

        DefaultFunctionRegistry copy = extended.toBuilder().register("REVERSE", "$reverseArray").build();
        assertTrue(copy.contains("REVERSE"));
        assertFalse(extended.contains("REVERSE"));
    }

    @Test
    void emptyBuilderHasNoFunctions() {
        assertTrue(DefaultFunctionRegistry.emptyBuilder().build().names().isEmpty());
    }
}
