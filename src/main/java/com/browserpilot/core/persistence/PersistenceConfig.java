package com.browserpilot.core.persistence;

import com.browserpilot.core.config.AgentProperties;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link TaskStateStore}.
 * <p>
 * With {@code browserpilot.persistence.jdbc-url} set, suspended sessions are kept in
 * PostgreSQL and survive restarts. Otherwise they live in memory for the life of the
 * process.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public TaskStateStore taskStateStore(AgentProperties properties) {
        var persistence = properties.getPersistence();
        if (!persistence.isJdbcConfigured()) {
            log.info("No session database configured; suspended sessions will not survive a restart");
            return new InMemoryTaskStateStore();
        }
        log.info("Configuring JDBC session store (PostgreSQL)");
        var dataSource = new PGSimpleDataSource();
        dataSource.setUrl(persistence.getJdbcUrl());
        if (!persistence.getUsername().isBlank()) dataSource.setUser(persistence.getUsername());
        if (!persistence.getPassword().isBlank()) dataSource.setPassword(persistence.getPassword());
        var store = new JdbcTaskStateStore(dataSource);
        store.createTables();
        return store;
    }
}
