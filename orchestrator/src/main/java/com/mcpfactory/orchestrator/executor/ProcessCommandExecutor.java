package com.mcpfactory.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}.
 *
 * Output goes to temp files rather than pipes so a chatty tool can never
 * block on a full pipe buffer while we wait for it.
 */
@Component
public class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    // Grace period for a destroyed process to actually exit.
    private static final long KILL_WAIT_SECONDS = 5;

    @Override
    public ExecutionResult run(List<String> command, Path workingDir, Duration timeout) {
        String cmd = String.join(" ", command);
        log.debug("Running '{}' in {} (timeout {} ms)", cmd, workingDir, timeout.toMillis());

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        long started = System.nanoTime();
        try {
            stdoutFile = Files.createTempFile("mcpfactory-", ".out");
            stderrFile = Files.createTempFile("mcpfactory-", ".err");

            process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                killTree(process);
                process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
                log.warn("'{}' timed out after {} ms and was killed", cmd, timeout.toMillis());
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            int exitCode = finished ? process.exitValue() : -1;
            log.debug("'{}' finished with exit code {} in {} ms", cmd, exitCode, elapsed.toMillis());

            return new ExecutionResult(
                    exitCode,
                    Files.readString(stdoutFile, StandardCharsets.UTF_8),
                    Files.readString(stderrFile, StandardCharsets.UTF_8),
                    elapsed,
                    !finished);

        } catch (IOException e) {
            throw new ExecutorException("Failed to run '" + cmd + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            if (process != null) killTree(process);
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while running '" + cmd + "'", e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    // Descendants first; once the parent dies they are re-parented out of reach.
    private static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
