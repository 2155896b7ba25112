package com.mcpfactory.orchestrator.service;

import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.PipelineStage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Invokes one stage and normalizes whatever happens into a {@link StageResult}.
 *
 * Never retries and never touches the JobRecord; deciding what a failure
 * means for the job is {@link JobStateMachine}'s concern.
 *
 * Metrics:
 *   mcpfactory.stage.duration{stage}
 *   mcpfactory.stage.calls{stage, status=success|failure}
 */
@Component
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final MeterRegistry meterRegistry;

    public StageRunner(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <T> StageResult<T> run(PipelineStage stage, JobRecord job, StageCall<T> call) {
        String stageTag = stage.wireName();
        log.info("Job {} stage {} started", job.id(), stageTag);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            T output = call.call();
            log.info("Job {} stage {} finished", job.id(), stageTag);
            return StageResult.success(output);
        } catch (Exception e) {
            status = "failure";
            String message = describe(e);
            log.debug("Job {} stage {} threw {}", job.id(), stageTag, e.getClass().getName(), e);
            return StageResult.failure(message, e);
        } finally {
            sample.stop(meterRegistry.timer("mcpfactory.stage.duration", "stage", stageTag));
            meterRegistry.counter("mcpfactory.stage.calls",
                    "stage", stageTag, "status", status).increment();
        }
    }

    // Message of the exception, or its simple class name when there is none.
    static String describe(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
