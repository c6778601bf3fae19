package com.example.conservation.etl.service;

import com.example.conservation.etl.model.RunReport;
import com.example.conservation.etl.model.RunStatus;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Process exit code of the last run: 0 success, 3 degraded, 4 failed or no run.
 */
@Component
public class RunExitCodeGenerator implements ExitCodeGenerator {

    public static final int DEGRADED = 3;
    public static final int FAILED = 4;

    private final RunCoordinator coordinator;

    public RunExitCodeGenerator(RunCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public int getExitCode() {
        return exitCodeFor(coordinator.getLastReport());
    }

    public static int exitCodeFor(RunReport report) {
        if (report == null) {
            return FAILED;
        }
        RunStatus status = report.getStatus();
        switch (status) {
            case SUCCESS:
                return 0;
            case DEGRADED:
                return DEGRADED;
            default:
                return FAILED;
        }
    }
}
