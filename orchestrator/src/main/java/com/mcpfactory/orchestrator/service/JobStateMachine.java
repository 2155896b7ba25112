package com.mcpfactory.orchestrator.service;

import com.mcpfactory.orchestrator.config.FactoryProperties;
import com.mcpfactory.orchestrator.generator.GeneratedServer;
import com.mcpfactory.orchestrator.generator.ServerGenerator;
import com.mcpfactory.orchestrator.interpret.ServerSpec;
import com.mcpfactory.orchestrator.interpret.SpecInterpretationException;
import com.mcpfactory.orchestrator.interpret.SpecInterpreter;
import com.mcpfactory.orchestrator.model.FailureKind;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.JobStatus;
import com.mcpfactory.orchestrator.model.PipelineResult;
import com.mcpfactory.orchestrator.model.PipelineStage;
import com.mcpfactory.orchestrator.packaging.PackageOptions;
import com.mcpfactory.orchestrator.packaging.PackageResult;
import com.mcpfactory.orchestrator.packaging.ServerPackager;
import com.mcpfactory.orchestrator.registry.RegistrationRequest;
import com.mcpfactory.orchestrator.registry.RegistrationResult;
import com.mcpfactory.orchestrator.registry.ServerRegistry;
import com.mcpfactory.orchestrator.store.JobNotFoundException;
import com.mcpfactory.orchestrator.store.JobStore;
import com.mcpfactory.orchestrator.validation.ServerValidator;
import com.mcpfactory.orchestrator.validation.ValidationFailedException;
import com.mcpfactory.orchestrator.validation.ValidationIssue;
import com.mcpfactory.orchestrator.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drives one job through INTERPRET → GENERATE → VALIDATE → PACKAGE → REGISTER.
 *
 * Runs on a worker thread owned by {@link JobScheduler}. Each stage's
 * JobRecord update is written to the store before the next stage starts, so
 * a status reader only ever sees one stage in flight.
 *
 * Failure handling:
 *   - VALIDATE errors with no fatal category are tolerated and carried
 *     forward as warnings
 *   - fatal VALIDATE errors fail the job with kind COMPLIANCE; only the
 *     fatal ones are recorded on the job
 *   - any other stage failure fails the job with kind COLLABORATOR
 *   - an Error from a stage, or an exception outside the stages, fails
 *     the job with kind INTERNAL
 *
 * Nothing is retried. A retry is a new submission.
 */
@Component
@Profile("!standalone")
public class JobStateMachine {

    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);

    static final String INTERNAL_ERROR  = "Internal error while processing job";
    static final String INVALID_SPEC    = "Interpreter failed to produce a valid spec";

    private final JobStore           store;
    private final StageRunner        runner;
    private final FailureClassifier  classifier;
    private final SpecInterpreter    interpreter;
    private final ServerGenerator    generator;
    private final ServerValidator    validator;
    private final ServerPackager     packager;
    private final ServerRegistry     registry;
    private final FactoryProperties  props;

    public JobStateMachine(JobStore store,
                           StageRunner runner,
                           FailureClassifier classifier,
                           SpecInterpreter interpreter,
                           ServerGenerator generator,
                           ServerValidator validator,
                           ServerPackager packager,
                           ServerRegistry registry,
                           FactoryProperties props) {
        this.store       = store;
        this.runner      = runner;
        this.classifier  = classifier;
        this.interpreter = interpreter;
        this.generator   = generator;
        this.validator   = validator;
        this.packager    = packager;
        this.registry    = registry;
        this.props       = props;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run a queued job until it is COMPLETE or FAILED. Never throws.
     */
    public void run(String jobId) {
        MDC.put("jobId", jobId);
        try {
            JobRecord job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            job = save(job.start());
            log.info("Job {} running", jobId);

            RunOutputs outputs = new RunOutputs();
            while (job.status() == JobStatus.RUNNING) {
                job = advance(job, outputs);
            }

            if (job.status() == JobStatus.COMPLETE) {
                log.info("Job {} complete ({} warning(s))", jobId, job.result().warnings().size());
            }
        } catch (RuntimeException | Error e) {
            log.error("Unhandled error while processing job {}: {}", jobId, e.getMessage(), e);
            markInternalFailure(jobId);
        } finally {
            MDC.remove("stage");
            MDC.remove("jobId");
        }
    }

    /**
     * Fail a job that is not yet terminal with kind INTERNAL. Used when the
     * run itself breaks or the job could not be dispatched at all.
     */
    public void markInternalFailure(String jobId) {
        store.get(jobId)
             .filter(job -> !job.isTerminal())
             .ifPresent(job -> {
                 try {
                     store.update(jobId, job.fail(FailureKind.INTERNAL, INTERNAL_ERROR, Instant.now()));
                 } catch (RuntimeException e) {
                     log.error("Could not mark job {} as failed: {}", jobId, e.getMessage(), e);
                 }
             });
    }

    // ------------------------------------------------------------------
    // One stage
    // ------------------------------------------------------------------

    private JobRecord advance(JobRecord job, RunOutputs outputs) {
        PipelineStage stage = job.currentStage();
        MDC.put("stage", stage.wireName());

        StageResult<?> outcome = runner.run(stage, job, () -> execute(stage, job, outputs));
        if (outcome.success()) {
            return stage.isLast()
                    ? save(job.complete(buildResult(outputs), Instant.now()))
                    : save(job.advance(stage));
        }

        if (outcome.cause() instanceof ValidationFailedException failed) {
            ValidationReport report = failed.report();
            if (!classifier.isFatal(report)) {
                log.warn("Job {} continuing past {} non-fatal validation error(s): {}",
                        job.id(), report.errors().size(), report.errorSummary());
                outputs.tolerate(report.errors());
                outputs.tolerate(report.warnings());
                return save(job.advance(stage));
            }
            String fatal = classifier.fatalErrors(report).stream()
                    .map(ValidationIssue::format)
                    .collect(Collectors.joining("; ", "Validation failed: ", ""));
            log.error("Job {} failed validation: {}", job.id(), report.errorSummary());
            return save(job.fail(FailureKind.COMPLIANCE, fatal, Instant.now()));
        }

        log.error("Job {} failed at {}: {}", job.id(), stage.wireName(), outcome.error());
        return save(job.fail(FailureKind.COLLABORATOR, outcome.error(), Instant.now()));
    }

    private Object execute(PipelineStage stage, JobRecord job, RunOutputs outputs) {
        return switch (stage) {
            case INTERPRET -> interpret(job, outputs);
            case GENERATE  -> generate(outputs);
            case VALIDATE  -> validate(outputs);
            case PACKAGE   -> pack(job, outputs);
            case REGISTER  -> register(outputs);
            case DONE      -> throw new IllegalStateException("Job " + job.id() + " has no stage left to run");
        };
    }

    // ------------------------------------------------------------------
    // Stage bodies
    // ------------------------------------------------------------------

    private ServerSpec interpret(JobRecord job, RunOutputs outputs) {
        ServerSpec spec = interpreter.interpret(job.description(), job.options().runtime());
        if (spec == null || spec.name() == null || spec.name().isBlank()) {
            throw new SpecInterpretationException(INVALID_SPEC);
        }
        outputs.spec = spec;
        return spec;
    }

    private GeneratedServer generate(RunOutputs outputs) {
        GeneratedServer server = generator.generate(outputs.spec, Path.of(props.getOutputDir()));
        outputs.server = server;
        return server;
    }

    private ValidationReport validate(RunOutputs outputs) {
        ValidationReport report = validator.validate(outputs.server.serverDir());
        if (!report.valid()) {
            throw new ValidationFailedException(report);
        }
        outputs.tolerate(report.warnings());
        return report;
    }

    private PackageResult pack(JobRecord job, RunOutputs outputs) {
        PackageOptions options = new PackageOptions(job.options().docker(), Path.of(props.getPackageDir()));
        PackageResult result = packager.pack(outputs.server.serverDir(), options);
        outputs.packaged = result;
        outputs.warnings.addAll(result.warnings());
        return result;
    }

    private RegistrationResult register(RunOutputs outputs) {
        ServerSpec spec = outputs.spec;
        PackageResult pkg = outputs.packaged;
        RegistrationResult result = registry.registerOrUpdate(new RegistrationRequest(
                spec.name(),
                spec.version(),
                spec.description(),
                spec,
                pkg.packagePath(),
                pkg.dockerImage(),
                pkg.clientConfig()));
        outputs.registration = result;
        return result;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineResult buildResult(RunOutputs outputs) {
        return new PipelineResult(
                outputs.spec.name(),
                outputs.spec.description(),
                outputs.server.serverDir().toString(),
                outputs.packaged.packagePath(),
                outputs.packaged.dockerImage(),
                outputs.spec,
                outputs.registration,
                PipelineStage.PIPELINE,
                outputs.warnings);
    }

    private JobRecord save(JobRecord job) {
        store.update(job.id(), job);
        return job;
    }

    /** Stage outputs of a single run; confined to the worker thread. */
    private static final class RunOutputs {
        ServerSpec         spec;
        GeneratedServer    server;
        PackageResult      packaged;
        RegistrationResult registration;
        final List<String> warnings = new ArrayList<>();

        void tolerate(List<ValidationIssue> issues) {
            issues.forEach(issue -> warnings.add(issue.format()));
        }
    }
}
