package io.lighting.mongosql.solon;

import io.lighting.mongosql.MongoSql;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.observe.CompileLog;
import io.lighting.mongosql.observe.CompileObserver;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import java.util.ArrayList;
import java.util.List;
import org.noear.solon.annotation.Bean;
import org.noear.solon.annotation.Configuration;
import org.noear.solon.annotation.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MongoSQL auto-configuration for Solon framework.
 * <p>
 * The application supplies a {@link TableRegistry} bean; the plugin contributes the
 * function registry, the compile log and the {@link MongoSql} facade.
 * <p>
 * Usage:
 * <pre>{@code
 * @Bean
 * public TableRegistry tableRegistry() {
 *     return DefaultTableRegistry.builder().register("users", "app_users").build();
 * }
 *
 * @Inject
 * MongoSql mongoSql;
 * }</pre>
 */
public class MongoSqlSolonPlugin {

    /**
     * Configuration class for MongoSQL beans.
     */
    @Configuration
    public static class MongoSqlConfiguration {
        private static final Logger LOGGER = LoggerFactory.getLogger(MongoSqlSolonPlugin.class);

        @Bean
        public FunctionRegistry functionRegistry() {
            return FunctionRegistry.standard();
        }

        @Bean
        public List<CompileObserver> compileObservers() {
            CompileLog compileLog = CompileLog.builder()
                .includeElapsed(true)
                .prefix("MQL:")
                .sink(LOGGER::info)
                .build();

            List<CompileObserver> observers = new ArrayList<>();
            observers.add(compileLog);
            return observers;
        }

        @Bean
        public MongoSql mongoSql(
            @Inject TableRegistry tableRegistry,
            FunctionRegistry functionRegistry,
            List<CompileObserver> observers
        ) {
            return MongoSql.builder()
                .tableRegistry(tableRegistry)
                .functionRegistry(functionRegistry)
                .observers(observers)
                .build();
        }
    }
}
