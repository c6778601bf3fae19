package com.example.conservation.etl.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configures the analytics store DataSource. Spring Batch keeps its job repository in the same store.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties storeDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean(name = "storeDataSource")
    @Primary
    @ConfigurationProperties("spring.datasource.hikari") // Hikari specific props
    public HikariDataSource storeDataSource(DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
    }
}
