package com.taskledger.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.memory.DualStoreResolver;
import com.taskledger.core.memory.InMemoryKeyValueStore;
import com.taskledger.core.memory.JdbcKeyValueStore;
import com.taskledger.core.memory.KeyValueStore;
import com.taskledger.core.persistence.InMemoryPlanProgressRepository;
import com.taskledger.core.persistence.InMemoryTaskPlanRepository;
import com.taskledger.core.persistence.InMemoryTaskTestRepository;
import com.taskledger.core.persistence.JdbcPlanProgressRepository;
import com.taskledger.core.persistence.JdbcTaskPlanRepository;
import com.taskledger.core.persistence.JdbcTaskTestRepository;
import com.taskledger.core.persistence.PlanProgressRepository;
import com.taskledger.core.persistence.SchemaInitializer;
import com.taskledger.core.persistence.TaskPlanRepository;
import com.taskledger.core.persistence.TaskTestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Optional;

/**
 * Wires the ledger stores.
 * <p>
 * When a {@link DataSource} is available the PostgreSQL implementations are used and the
 * schema is created on first use. Otherwise process-local stores are used; they are fine for
 * development and tests but lose everything on restart and are not shared between workers.
 */
@Configuration
@EnableConfigurationProperties(TaskLedgerProperties.class)
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    private SchemaInitializer schemaInitializer;

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyValueStore durableKeyValueStore(Optional<DataSource> dataSource, ObjectMapper objectMapper, Clock clock) {
        if (dataSource.isPresent()) {
            log.info("Configuring JDBC key-value store (PostgreSQL)");
            schema(dataSource.get()).createTables();
            return new JdbcKeyValueStore(dataSource.get(), objectMapper, clock);
        }
        log.info("No DataSource available; using in-memory key-value store (state will not persist across restarts)");
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    public TaskPlanRepository taskPlanRepository(Optional<DataSource> dataSource, ObjectMapper objectMapper, Clock clock) {
        if (dataSource.isPresent()) {
            schema(dataSource.get()).createTables();
            return new JdbcTaskPlanRepository(dataSource.get(), objectMapper);
        }
        return new InMemoryTaskPlanRepository(clock);
    }

    @Bean
    public TaskTestRepository taskTestRepository(Optional<DataSource> dataSource, ObjectMapper objectMapper, Clock clock) {
        if (dataSource.isPresent()) {
            schema(dataSource.get()).createTables();
            return new JdbcTaskTestRepository(dataSource.get(), objectMapper);
        }
        return new InMemoryTaskTestRepository(clock);
    }

    @Bean
    public PlanProgressRepository planProgressRepository(Optional<DataSource> dataSource, Clock clock) {
        if (dataSource.isPresent()) {
            schema(dataSource.get()).createTables();
            return new JdbcPlanProgressRepository(dataSource.get());
        }
        return new InMemoryPlanProgressRepository(clock);
    }

    @Bean
    public DualStoreResolver dualStoreResolver(@Qualifier("durableKeyValueStore") KeyValueStore durableKeyValueStore,
                                               TaskLedgerProperties properties) {
        boolean forceDurable = properties.getStore().isForceDurable();
        if (forceDurable) {
            log.info("Caller-supplied stores will be ignored; all memory goes to the durable store");
        }
        return new DualStoreResolver(durableKeyValueStore, forceDurable);
    }

    private synchronized SchemaInitializer schema(DataSource dataSource) {
        if (schemaInitializer == null) {
            schemaInitializer = new SchemaInitializer(dataSource);
        }
        return schemaInitializer;
    }
}
