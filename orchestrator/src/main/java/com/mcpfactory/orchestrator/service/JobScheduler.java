package com.mcpfactory.orchestrator.service;

import com.mcpfactory.orchestrator.config.FactoryProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs submitted jobs on a fixed worker pool.
 *
 * One worker drives one job from start to finish; many jobs run side by side.
 * The pool size ({@code mcpfactory.jobs.workers}) caps how many interpreter
 * calls and external builds are in flight at once.
 */
@Component
@Profile("!standalone")
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ExecutorService workers;
    private final JobStateMachine stateMachine;

    public JobScheduler(JobStateMachine stateMachine, FactoryProperties props) {
        this.stateMachine = stateMachine;
        this.workers      = Executors.newFixedThreadPool(
                props.getJobs().getWorkers(), new CustomizableThreadFactory("job-worker-"));
    }

    /** Queue the job and return immediately. */
    public void dispatch(String jobId) {
        try {
            workers.execute(() -> {
                try {
                    stateMachine.run(jobId);
                } catch (Throwable e) {
                    log.error("Unhandled error in worker for job {}: {}", jobId, e.getMessage(), e);
                    stateMachine.markInternalFailure(jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Job {} could not be dispatched: worker pool is shut down", jobId);
            stateMachine.markInternalFailure(jobId);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Job workers still busy after 30s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
