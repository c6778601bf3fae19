package com.example.conservation.etl.config;

import com.example.conservation.etl.job.JobCompletionNotificationListener;
import com.example.conservation.etl.job.PublishRunReportTasklet;
import com.example.conservation.etl.job.RunPipelineTasklet;
import com.example.conservation.etl.service.RunCoordinator;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * The conservation ETL job: one tasklet step running the pipeline, then one publishing the
 * run report. The JobRepository, JobLauncher and job launching at startup are auto-configured
 * by Spring Boot on the primary DataSource.
 */
@Configuration
public class BatchConfig {

    public static final String JOB_NAME = "conservationEtlJob";

    @Bean
    public Step runPipelineStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                RunPipelineTasklet tasklet) {
        // Each entity load manages its own transaction; the step transaction only covers step metadata.
        return new StepBuilder(JOB_NAME + "_RUN_PIPELINE_step", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Step publishRunReportStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                     PublishRunReportTasklet tasklet) {
        return new StepBuilder(JOB_NAME + "_PUBLISH_REPORT_step", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Job conservationEtlJob(JobRepository jobRepository, Step runPipelineStep, Step publishRunReportStep,
                                  RunCoordinator coordinator) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .incrementer(new RunIdIncrementer())
                .listener(new JobCompletionNotificationListener(coordinator))
                .start(runPipelineStep)
                .next(publishRunReportStep)
                .build();
    }
}
