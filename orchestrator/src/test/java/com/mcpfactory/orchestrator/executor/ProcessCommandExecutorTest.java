package com.mcpfactory.orchestrator.executor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs real processes through /bin/sh.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private final ProcessCommandExecutor executor = new ProcessCommandExecutor();

    @TempDir Path dir;

    @Test
    void run_capturesExitCodeAndBothStreams() {
        ExecutionResult result = executor.run(sh("echo out; echo err 1>&2; exit 3"), dir, TIMEOUT);

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("out\n");
        assertThat(result.stderr()).isEqualTo("err\n");
        assertThat(result.timedOut()).isFalse();
    }

    @Test
    void run_usesWorkingDirectory() throws Exception {
        Files.writeString(dir.resolve("marker.txt"), "here");

        ExecutionResult result = executor.run(sh("cat marker.txt"), dir, TIMEOUT);

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("here");
    }

    @Test
    void run_timeout_killsProcess() {
        ExecutionResult result = executor.run(sh("sleep 30"), dir, Duration.ofMillis(300));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(result.elapsed()).isLessThan(Duration.ofSeconds(15));
    }

    @Test
    void run_timeout_killsChildProcessesToo() throws Exception {
        ExecutionResult result = executor.run(sh("sleep 41.75; echo late"), dir, Duration.ofMillis(500));

        assertThat(result.timedOut()).isTrue();
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (survivors("sleep 41.75") > 0 && System.nanoTime() < deadline) {
            Thread.sleep(100);
        }
        assertThat(survivors("sleep 41.75")).isZero();
    }

    @Test
    void run_unknownBinary_throwsExecutorException() {
        assertThatThrownBy(() -> executor.run(List.of("definitely-not-a-real-binary-42"), dir, TIMEOUT))
                .isInstanceOf(ExecutorException.class)
                .hasMessageContaining("definitely-not-a-real-binary-42");
    }

    @Test
    void runChecked_nonZeroExit_carriesToolOutput() {
        assertThatThrownBy(() -> executor.runChecked(sh("echo 'npm ERR! missing script' 1>&2; exit 1"), dir, TIMEOUT))
                .isInstanceOf(ExecutorException.class)
                .hasMessageContaining("failed with exit code 1")
                .hasMessageContaining("npm ERR! missing script");
    }

    @Test
    void runChecked_success_returnsResult() {
        assertThat(executor.runChecked(sh("echo ok"), dir, TIMEOUT).stdout()).isEqualTo("ok\n");
    }

    private static long survivors(String commandLine) {
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .filter(p -> p.info().commandLine().map(c -> c.contains(commandLine)).orElse(false))
                .count();
    }

    private static List<String> sh(String script) {
        return List.of("sh", "-c", script);
    }
}
