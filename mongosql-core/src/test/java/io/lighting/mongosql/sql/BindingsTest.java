package io.lighting.mongosql.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BindingsTest {
    @Test
    void ofCollectsNamedPairs() {
        Bindings bindings = Bindings.of("id", 1, "name", "mongo");
        assertEquals(Map.of("id", 1, "name", "mongo"), bindings.named());
        assertTrue(bindings.contains("id"));
        assertTrue(bindings.positional().isEmpty());
    }

    @Test
    void explicitNullIsPresent() {
        Map<String, Object> named = new HashMap<>();
        named.put("deletedAt", null);
        Bindings bindings = Bindings.of(named);
        assertTrue(bindings.contains("deletedAt"));
        assertNull(bindings.named().get("deletedAt"));
    }

    @Test
    void withPositionalKeepsNamedValues() {
        Bindings bindings = Bindings.of("city", "Oslo").withPositional(1, null, "x");
        assertEquals("Oslo", bindings.named().get("city"));
        assertEquals(Arrays.asList(1, null, "x"), bindings.positional());
    }

    @Test
    void positionalFactoriesAgree() {
        assertEquals(Bindings.positional(1, 2).positional(), Bindings.positional(List.of(1, 2)).positional());
        assertFalse(Bindings.positional(1).isEmpty());
        assertTrue(Bindings.empty().isEmpty());
    }

    @Test
    void oddPairsThrow() {
        assertThrows(IllegalArgumentException.class, () -> Bindings.of("id", 1, "name"));
    }

    @Test
    void duplicateNamesThrow() {
        assertThrows(IllegalArgumentException.class, () -> Bindings.of("id", 1, "id", 2));
    }

    @Test
    void nonStringKeyThrows() {
        assertThrows(IllegalArgumentException.class, () -> Bindings.of("id", 1, 2, "x"));
    }
}
