package com.agentos.core.cost;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Provides the {@link CostStore}: a {@link JdbcCostStore} when a database is configured,
 * otherwise an {@link InMemoryCostStore} whose spend does not outlive the process.
 */
@Configuration
public class CostStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CostStoreConfig.class);

    @Bean
    public CostStore costStore(ObjectProvider<JdbcTemplate> jdbcTemplate) {
        JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
        if (jdbc == null) {
            log.info("No DataSource available; model spend is kept in memory only");
            return new InMemoryCostStore();
        }
        log.info("Configuring JDBC cost store");
        var store = new JdbcCostStore(jdbc);
        store.createTables();
        return store;
    }
}
