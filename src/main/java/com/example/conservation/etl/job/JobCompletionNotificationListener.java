package com.example.conservation.etl.job;

import com.example.conservation.etl.model.RunReport;
import com.example.conservation.etl.model.RunStatus;
import com.example.conservation.etl.service.RunCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;

/**
 * Logs job start and finish and carries the run status into the job's exit status:
 * a degraded run completes with exit code {@code DEGRADED}, a failed run with {@code FAILED}.
 */
public class JobCompletionNotificationListener implements JobExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(JobCompletionNotificationListener.class);

    public static final String DEGRADED_EXIT_CODE = "DEGRADED";

    private final RunCoordinator coordinator;

    public JobCompletionNotificationListener(RunCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("JOB '{}' STARTING, execution {}", jobExecution.getJobInstance().getJobName(), jobExecution.getId());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        String jobName = jobExecution.getJobInstance().getJobName();
        BatchStatus status = jobExecution.getStatus();

        log.info("JOB '{}' FINISHED with Status: [{}]", jobName, status);

        if (status == BatchStatus.COMPLETED) {
            RunReport report = coordinator.getLastReport();
            if (report != null && report.getStatus() == RunStatus.DEGRADED) {
                log.warn("Job '{}' completed with a degraded run {}", jobName, report.getRunId());
                jobExecution.setExitStatus(new ExitStatus(DEGRADED_EXIT_CODE, "Run " + report.getRunId() + " degraded"));
            } else if (report != null && report.getStatus() == RunStatus.FAILED) {
                log.error("Job '{}' completed but run {} failed", jobName, report.getRunId());
                jobExecution.setExitStatus(ExitStatus.FAILED.addExitDescription(
                        report.getFatalError() == null ? "No entity succeeded" : report.getFatalError()));
            } else {
                log.info("Job '{}' completed successfully.", jobName);
            }
        } else if (status == BatchStatus.FAILED) {
            log.error("Job '{}' failed. Review logs for details. Parameters: {}", jobName, jobExecution.getJobParameters());
            jobExecution.getAllFailureExceptions().forEach(
                ex -> log.error("Failure Exception in Job '{}': {}", jobName, ex.getMessage(), ex)
            );
        } else {
            log.warn("Job '{}' finished with status: {}", jobName, status);
        }
    }
}
