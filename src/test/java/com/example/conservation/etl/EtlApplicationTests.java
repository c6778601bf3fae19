package com.example.conservation.etl;

import com.example.conservation.etl.config.BatchConfig;
import com.example.conservation.etl.service.RunCoordinator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.Job;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context smoke test on an in-memory store; the job is not launched.
 */
@SpringBootTest(properties = {
        "spring.batch.job.enabled=false",
        "spring.datasource.url=jdbc:h2:mem:context-test;DB_CLOSE_DELAY=-1"
})
@DisplayName("EtlApplication Tests")
class EtlApplicationTests {

    @Autowired
    private Job conservationEtlJob;

    @Autowired
    private RunCoordinator coordinator;

    @Autowired
    private DataSource dataSource;

    @Test
    @DisplayName("Should wire the job, the coordinator and the store")
    void testContextLoads() {
        assertEquals(BatchConfig.JOB_NAME, conservationEtlJob.getName());
        assertNotNull(dataSource);
        assertNull(coordinator.getLastReport());
        assertFalse(coordinator.isCancellationRequested());
    }
}
