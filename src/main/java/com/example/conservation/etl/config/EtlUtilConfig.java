package com.example.conservation.etl.config;

import com.example.conservation.etl.conform.TypeCoercer;
import com.example.conservation.etl.load.JdbcTypeHandler;
import com.example.conservation.etl.load.StoreLoader;
import com.example.conservation.etl.reader.FilingLabelStrategy;
import com.example.conservation.etl.reader.LabelProximityStrategy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Configuration for utility beans used in the ETL process.
 */
@Configuration
public class EtlUtilConfig {

    /** Rows per JDBC batch when loading. */
    static final int LOAD_BATCH_SIZE = 500;

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Provides a singleton bean for handling JDBC type conversions.
     * @return An instance of JdbcTypeHandler.
     */
    @Bean
    public JdbcTypeHandler jdbcTypeHandler() {
        return new JdbcTypeHandler();
    }

    @Bean
    public TypeCoercer typeCoercer(ObjectMapper objectMapper) {
        return new TypeCoercer(objectMapper);
    }

    @Bean
    public FilingLabelStrategy filingLabelStrategy() {
        return new LabelProximityStrategy();
    }

    @Bean
    public StoreLoader storeLoader(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                   JdbcTypeHandler jdbcTypeHandler, EtlProperties properties) {
        return new StoreLoader(jdbcTemplate, transactionManager, jdbcTypeHandler, properties.getLoadTimeout(), LOAD_BATCH_SIZE);
    }

    /**
     * Pool for parallel dimension extraction.
     */
    @Bean(name = "readerTaskExecutor")
    public ThreadPoolTaskExecutor readerTaskExecutor(EtlProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getParallelReads());
        executor.setMaxPoolSize(properties.getParallelReads());
        executor.setThreadNamePrefix("etl-reader-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
