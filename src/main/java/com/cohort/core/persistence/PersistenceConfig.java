package com.cohort.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Wires the schema initializer and the clock shared by all repositories.
 * <p>
 * The {@link DataSource} itself comes from Spring Boot's auto-configuration:
 * an embedded H2 database in PostgreSQL mode by default, PostgreSQL when
 * {@code spring.datasource.url} points at one.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public SchemaInitializer schemaInitializer(DataSource dataSource) {
        log.info("Configuring JDBC persistence");
        var initializer = new SchemaInitializer(dataSource);
        initializer.createTables();
        return initializer;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
