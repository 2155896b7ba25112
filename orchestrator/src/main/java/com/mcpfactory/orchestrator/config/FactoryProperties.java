package com.mcpfactory.orchestrator.config;

import com.mcpfactory.orchestrator.validation.IssueCategory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "mcpfactory")
public class FactoryProperties {
    @NotBlank
    private String outputDir = "/opt/mcp-factory/output";
    @NotBlank
    private String packageDir = "/opt/mcp-factory/packages";
    @NotNull
    private Jobs jobs = new Jobs();
    @NotNull
    private Validation validation = new Validation();
    @NotNull
    private Commands commands = new Commands();
    @NotNull
    private Packaging packaging = new Packaging();

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getPackageDir() {
        return packageDir;
    }

    public void setPackageDir(String packageDir) {
        this.packageDir = packageDir;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Commands getCommands() {
        return commands;
    }

    public void setCommands(Commands commands) {
        this.commands = commands;
    }

    public Packaging getPackaging() {
        return packaging;
    }

    public void setPackaging(Packaging packaging) {
        this.packaging = packaging;
    }

    public static class Jobs {
        @Min(1)
        private int workers = 4;
        @NotNull
        private Duration retention = Duration.ofHours(24);
        @Min(1000)
        private long sweepIntervalMs = 600_000;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }

    public static class Validation {
        // Issue categories that stop the pipeline at VALIDATE. Anything else is a warning.
        @NotNull
        private List<IssueCategory> fatalCategories = new ArrayList<>(List.of(
                IssueCategory.FILESYSTEM,
                IssueCategory.TYPESCRIPT,
                IssueCategory.PROTOCOL));

        public List<IssueCategory> getFatalCategories() {
            return fatalCategories;
        }

        public void setFatalCategories(List<IssueCategory> fatalCategories) {
            this.fatalCategories = fatalCategories;
        }
    }

    public static class Commands {
        @NotNull
        private Duration timeout = Duration.ofSeconds(120);
        @NotNull
        private Duration typecheckTimeout = Duration.ofSeconds(60);
        @NotNull
        private Duration lintTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration buildTimeout = Duration.ofSeconds(300);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getTypecheckTimeout() {
            return typecheckTimeout;
        }

        public void setTypecheckTimeout(Duration typecheckTimeout) {
            this.typecheckTimeout = typecheckTimeout;
        }

        public Duration getLintTimeout() {
            return lintTimeout;
        }

        public void setLintTimeout(Duration lintTimeout) {
            this.lintTimeout = lintTimeout;
        }

        public Duration getBuildTimeout() {
            return buildTimeout;
        }

        public void setBuildTimeout(Duration buildTimeout) {
            this.buildTimeout = buildTimeout;
        }
    }

    public static class Packaging {
        private boolean docker = false;

        public boolean isDocker() {
            return docker;
        }

        public void setDocker(boolean docker) {
            this.docker = docker;
        }
    }
}
