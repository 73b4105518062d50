package com.cohort.core.testsupport;

import com.cohort.core.persistence.SchemaInitializer;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Fresh in-memory H2 database (PostgreSQL mode) with the Cohort schema applied.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static DataSource create() {
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        new SchemaInitializer(dataSource).createTables();
        return dataSource;
    }
}
