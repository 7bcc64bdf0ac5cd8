package io.lighting.mongosql.starter;

import io.lighting.mongosql.MongoSql;
import io.lighting.mongosql.meta.DefaultTableRegistry;
import io.lighting.mongosql.meta.TableRegistry;
import io.lighting.mongosql.observe.CompileLog;
import io.lighting.mongosql.observe.CompileObserver;
import io.lighting.mongosql.sql.function.FunctionRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(MongoSql.class)
@EnableConfigurationProperties(MongoSqlProperties.class)
public class MongoSqlAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoSqlAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TableRegistry tableRegistry(MongoSqlProperties properties) {
        DefaultTableRegistry registry = properties.buildTableRegistry();
        LOGGER.info("MongoSQL table registry initialized with {} table(s)", registry.tables().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public List<CompileObserver> compileObservers(MongoSqlProperties properties) {
        CompileLog compileLog = properties.getLog().build(LOGGER::info);
        if (compileLog == null) {
            return List.of();
        }
        List<CompileObserver> observers = new ArrayList<>();
        observers.add(compileLog);
        return observers;
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoSql mongoSql(
        TableRegistry tableRegistry,
        FunctionRegistry functionRegistry,
        List<CompileObserver> compileObservers
    ) {
        return MongoSql.builder()
            .tableRegistry(tableRegistry)
            .functionRegistry(functionRegistry)
            .observers(compileObservers)
            .build();
    }
}
