package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Optional;

/**
 * Provides the {@link BaseCheckpointSaver} shared by the planning and execution graphs:
 * a {@link JdbcCheckpointSaver} when a {@link DataSource} is configured, otherwise a
 * {@link MemorySaver}.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public BaseCheckpointSaver checkpointSaver(Optional<DataSource> dataSource, ObjectMapper objectMapper) {
        if (dataSource.isPresent()) {
            log.info("Configuring JDBC checkpoint saver (PostgreSQL)");
            var saver = new JdbcCheckpointSaver(dataSource.get(), objectMapper);
            saver.createTables();
            return saver;
        }
        log.info("No DataSource available; using in-memory checkpoint saver (state will not persist across restarts)");
        return new MemorySaver();
    }
}
