package com.example.conservation.etl.job;

import com.example.conservation.etl.model.RunReport;
import com.example.conservation.etl.service.RunCoordinator;
import com.example.conservation.etl.service.RunReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Publishes the report of the run that the pipeline step just finished.
 */
@Component
public class PublishRunReportTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(PublishRunReportTasklet.class);

    private final RunCoordinator coordinator;
    private final RunReportPublisher publisher;

    public PublishRunReportTasklet(RunCoordinator coordinator, RunReportPublisher publisher) {
        this.coordinator = coordinator;
        this.publisher = publisher;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        RunReport report = coordinator.getLastReport();
        if (report == null) {
            log.error("No run report available for job execution {}",
                    chunkContext.getStepContext().getStepExecution().getJobExecutionId());
            throw new IllegalStateException("Pipeline step finished without producing a run report");
        }
        Path written = publisher.publish(report);
        log.info("Run report {} published to {}", report.getRunId(), written);
        contribution.incrementWriteCount(1);
        return RepeatStatus.FINISHED;
    }
}
