package com.example.conservation.etl;

import com.example.conservation.etl.config.EtlProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application class for the conservation analytics ETL.
 * The process exit code reflects the run status (0 success, 3 degraded, 4 failed).
 */
@SpringBootApplication
@EnableConfigurationProperties(EtlProperties.class)
public class EtlApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EtlApplication.class, args)));
    }

}
