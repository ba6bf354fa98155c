package com.trellis.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * With {@code trellis.checkpoint.store=jdbc} a {@link JdbcCheckpointStore} is created
 * over the application {@link DataSource}. Otherwise an {@link InMemoryCheckpointStore}
 * is used as a fallback, suitable for development and testing but not durable
 * across restarts.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    /**
     * JDBC-backed store. Creates the required tables on startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "trellis.checkpoint", name = "store", havingValue = "jdbc")
    public CheckpointStore jdbcCheckpointStore(DataSource dataSource, ObjectMapper objectMapper) {
        log.info("Configuring JDBC checkpoint store");
        var store = new JdbcCheckpointStore(dataSource, objectMapper);
        store.initialize();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore memoryCheckpointStore() {
        log.info("Using in-memory checkpoint store (state will not persist across restarts)");
        return new InMemoryCheckpointStore();
    }
}
