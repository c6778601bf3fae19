package com.example.conservation.etl.job;

import com.example.conservation.etl.model.EntityOutcome;
import com.example.conservation.etl.model.RunReport;
import com.example.conservation.etl.service.RunCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.StoppableTasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

/**
 * Runs the whole pipeline as a single tasklet. Stopping the job execution cancels the run.
 */
@Component
public class RunPipelineTasklet implements StoppableTasklet {

    private static final Logger log = LoggerFactory.getLogger(RunPipelineTasklet.class);

    public static final String RUN_ID_KEY = "runId";
    public static final String RUN_STATUS_KEY = "runStatus";

    private final RunCoordinator coordinator;

    public RunPipelineTasklet(RunCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        log.info("Executing RunPipelineTasklet for job execution {}",
                chunkContext.getStepContext().getStepExecution().getJobExecutionId());

        RunReport report = coordinator.run();

        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution().getJobExecution().getExecutionContext();
        jobContext.putString(RUN_ID_KEY, report.getRunId());
        jobContext.putString(RUN_STATUS_KEY, report.getStatus().getLabel());

        long loaded = report.getEntities().stream().mapToLong(EntityOutcome::getLoaded).sum();
        contribution.incrementWriteCount(loaded);
        contribution.setExitStatus(new ExitStatus(report.getStatus().name()));
        return RepeatStatus.FINISHED;
    }

    @Override
    public void stop() {
        log.warn("Stop requested for the running pipeline");
        coordinator.requestCancellation();
    }
}
