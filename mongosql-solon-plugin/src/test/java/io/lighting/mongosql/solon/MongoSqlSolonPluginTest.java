package io.lighting.mongosql.solon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.mongosql.MongoSql;
import io.lighting.mongosql.command.DeleteCommand;
import io.lighting.mongosql.meta.DefaultTableRegistry;
import io.lighting.mongosql.observe.CompileLog;
import io.lighting.mongosql.observe.CompileObserver;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class MongoSqlSolonPluginTest {
    private final MongoSqlSolonPlugin.MongoSqlConfiguration configuration =
        new MongoSqlSolonPlugin.MongoSqlConfiguration();

    @Test
    void wiresFacadeFromApplicationTables() {
        FunctionRegistry functions = configuration.functionRegistry();
        List<CompileObserver> observers = configuration.compileObservers();
        MongoSql mongoSql = configuration.mongoSql(
            DefaultTableRegistry.builder().register("users", "app_users").build(),
            functions,
            observers
        );

        DeleteCommand command = assertInstanceOf(
            DeleteCommand.class,
            mongoSql.compile("DELETE FROM users WHERE id = :id", Map.of("id", 7))
        );

        assertEquals("app_users", command.collection());
        assertEquals(new Document("id", new Document("$eq", 7)), command.filter());
        assertTrue(functions.contains("LOWER"));
        assertEquals(1, observers.size());
        assertInstanceOf(CompileLog.class, observers.get(0));
    }
}
