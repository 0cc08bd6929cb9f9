package com.personstore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.sqlite.JDBC;

import javax.sql.DataSource;

/**
 * Non-pooled SQLite data source for the person store.
 * File mode opens a new connection per statement. In-memory mode keeps one
 * connection open for the life of the context, since the database dies with it.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Bean
    public DataSource dataSource(StoreConfig storeConfig) {
        String url = storeConfig.jdbcUrl();
        log.info("Person store using {}", url);
        return createDataSource(url);
    }

    public static DataSource createDataSource(String url) {
        if (StoreConfig.IN_MEMORY_URL.equals(url)) {
            SingleConnectionDataSource dataSource = new SingleConnectionDataSource(url, true);
            dataSource.setDriverClassName(JDBC.class.getName());
            return dataSource;
        }
        DriverManagerDataSource dataSource = new DriverManagerDataSource(url);
        dataSource.setDriverClassName(JDBC.class.getName());
        return dataSource;
    }
}
