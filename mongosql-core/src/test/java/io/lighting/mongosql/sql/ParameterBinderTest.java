package io.lighting.mongosql.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.mongosql.error.BindingException;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.sql.ast.Expr;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParameterBinderTest {

    @Test
    void literalsPassThrough() {
        ParameterBinder binder = new ParameterBinder(Bindings.empty());
        assertEquals(5, binder.bind(new Expr.NumberLiteral(5)));
        assertEquals("x", binder.bind(new Expr.StringLiteral("x")));
        assertEquals(true, binder.bind(new Expr.BooleanLiteral(true)));
        assertNull(binder.bind(new Expr.NullLiteral()));
    }

    @Test
    void positionalBindsByOrdinalRegardlessOfOrder() {
        ParameterBinder binder = new ParameterBinder(Bindings.positional("first", "second", "third"));
        assertEquals("third", binder.bind(new Expr.PositionalParam(2)));
        assertEquals("first", binder.bind(new Expr.PositionalParam(0)));
        assertEquals(3, binder.consumed());
    }

    @Test
    void exhaustedPositionalListFails() {
        ParameterBinder binder = new ParameterBinder(Bindings.positional(1));
        assertEquals(1, binder.bind(new Expr.PositionalParam(0)));
        BindingException error = assertThrows(BindingException.class, () -> binder.bind(new Expr.PositionalParam(1)));
        assertEquals("?2", error.parameter());
        assertEquals("Positional parameter #2 has no value (1 supplied)", error.getMessage());
    }

    @Test
    void namedParametersRequirePresence() {
        Map<String, Object> named = new HashMap<>();
        named.put("nothing", null);
        ParameterBinder binder = new ParameterBinder(Bindings.of(named));
        assertNull(binder.bind(new Expr.NamedParam("nothing")));
        BindingException error = assertThrows(BindingException.class, () -> binder.bind(new Expr.NamedParam("missing")));
        assertEquals(":missing", error.parameter());
    }

    @Test
    void arraysAndRangesBindComponentWise() {
        ParameterBinder binder = new ParameterBinder(Bindings.of("low", 3).withPositional(9));
        Object array = binder.bind(new Expr.ArrayLiteral(List.of(new Expr.NumberLiteral(1), new Expr.PositionalParam(0))));
        assertEquals(List.of(1, 9), array);
        Object range = binder.bind(new Expr.Between(new Expr.NamedParam("low"), new Expr.NullLiteral()));
        assertEquals(Arrays.asList(3, null), range);
    }

    @Test
    void negationAppliesToBoundNumbers() {
        ParameterBinder binder = new ParameterBinder(Bindings.of("n", 7L, "s", "x"));
        assertEquals(-7, binder.bind(new Expr.Unary(Expr.UnaryOp.NEG, new Expr.NamedParam("n"))));
        assertThrows(
            UnsupportedFeatureException.class,
            () -> binder.bind(new Expr.Unary(Expr.UnaryOp.NEG, new Expr.NamedParam("s")))
        );
    }

    @Test
    void columnsAreNotValues() {
        ParameterBinder binder = new ParameterBinder(Bindings.empty());
        assertThrows(UnsupportedFeatureException.class, () -> binder.bind(new Expr.Column("age")));
    }
}
