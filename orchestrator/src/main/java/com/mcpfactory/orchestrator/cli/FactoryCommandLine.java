package com.mcpfactory.orchestrator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.api.dto.JobResponse;
import com.mcpfactory.orchestrator.model.FailureKind;
import com.mcpfactory.orchestrator.model.JobRecord;
import com.mcpfactory.orchestrator.model.JobStatus;
import com.mcpfactory.orchestrator.service.InvalidSubmissionException;
import com.mcpfactory.orchestrator.service.JobService;
import com.mcpfactory.orchestrator.validation.ServerValidator;
import com.mcpfactory.orchestrator.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Command-line front end, active under the {@code cli} profile.
 *
 * <pre>
 *   validate &lt;serverDir&gt; [--json]
 *   generate &lt;description...&gt; [--runtime=typescript] [--docker]
 * </pre>
 *
 * Exit codes: 0 success, 1 bad usage / validation failed / job failed,
 * 2 internal error.
 */
@Component
@Profile("cli")
public class FactoryCommandLine implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(FactoryCommandLine.class);

    public static final int OK             = 0;
    public static final int USER_ERROR     = 1;
    public static final int INTERNAL_ERROR = 2;

    private static final long POLL_INTERVAL_MS = 500;

    private final Supplier<JobService> jobService;
    private final ServerValidator      validator;
    private final ObjectMapper         objectMapper;
    private final PrintStream          out;

    private int exitCode = OK;

    /** The job service is absent under the {@code standalone} profile, which only runs validate. */
    @Autowired
    public FactoryCommandLine(ObjectProvider<JobService> jobService, ServerValidator validator,
                              ObjectMapper objectMapper) {
        this(jobService::getObject, validator, objectMapper, System.out);
    }

    FactoryCommandLine(JobService jobService, ServerValidator validator,
                       ObjectMapper objectMapper, PrintStream out) {
        this(() -> jobService, validator, objectMapper, out);
    }

    private FactoryCommandLine(Supplier<JobService> jobService, ServerValidator validator,
                               ObjectMapper objectMapper, PrintStream out) {
        this.jobService   = jobService;
        this.validator    = validator;
        this.objectMapper = objectMapper;
        this.out          = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            usage();
            exitCode = USER_ERROR;
            return;
        }

        List<String> rest = positional.subList(1, positional.size());
        try {
            exitCode = switch (positional.get(0)) {
                case "validate" -> validate(rest, args.containsOption("json"));
                case "generate" -> generate(rest, optionValue(args, "runtime"), args.containsOption("docker"));
                default -> {
                    out.println("Unknown command: " + positional.get(0));
                    usage();
                    yield USER_ERROR;
                }
            };
        } catch (InvalidSubmissionException e) {
            out.println("Error: " + e.getMessage());
            exitCode = USER_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            exitCode = INTERNAL_ERROR;
        } catch (RuntimeException e) {
            log.error("Command failed: {}", e.getMessage(), e);
            out.println("Internal error: " + e.getMessage());
            exitCode = INTERNAL_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    private int validate(List<String> rest, boolean json) {
        if (rest.size() != 1) {
            out.println("Usage: validate <serverDir> [--json]");
            return USER_ERROR;
        }

        ValidationReport report = validator.validate(Path.of(rest.get(0)));
        if (json) {
            out.println(toJson(report));
        } else {
            out.println(report.valid() ? "Validation passed" : "Validation failed");
            report.errors().forEach(issue -> out.println("  error   " + issue.format()));
            report.warnings().forEach(issue -> out.println("  warning " + issue.format()));
        }
        return report.valid() ? OK : USER_ERROR;
    }

    private int generate(List<String> rest, String runtime, boolean docker) throws InterruptedException {
        String description = String.join(" ", rest);
        String jobId = jobService.get().submit(description, runtime, docker ? Boolean.TRUE : null);
        out.println("Job " + jobId + " submitted");

        JobRecord job = awaitTerminal(jobId);
        out.println(toJson(JobResponse.from(job)));

        if (job.status() == JobStatus.COMPLETE) {
            for (String warning : job.result().warnings()) {
                out.println("  warning " + warning);
            }
            return OK;
        }
        return job.failureKind() == FailureKind.INTERNAL ? INTERNAL_ERROR : USER_ERROR;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobRecord awaitTerminal(String jobId) throws InterruptedException {
        while (true) {
            JobRecord job = jobService.get().find(jobId)
                    .orElseThrow(() -> new IllegalStateException("Job " + jobId + " disappeared"));
            if (job.isTerminal()) {
                return job;
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render output: " + e.getOriginalMessage(), e);
        }
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    private void usage() {
        out.println("""
                Usage:
                  validate <serverDir> [--json]
                  generate <description...> [--runtime=typescript] [--docker]""");
    }
}
