package com.storyloop.core.engine;

import com.storyloop.core.model.FailureType;
import com.storyloop.core.model.Task;
import com.storyloop.core.state.StateFiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessWorkerLauncherTest {

    @TempDir
    Path tempDir;

    private final StateFiles stateFiles = new StateFiles();

    @Nested
    @DisplayName("exit code interpretation")
    class Interpretation {

        private final ProcessWorkerLauncher launcher = new ProcessWorkerLauncher(List.of("agent"), stateFiles);

        @Test
        void exitCodesMapToFailureTypes() {
            assertTrue(WorkerResult.fromExitCode(0, Duration.ZERO).succeeded());
            assertEquals(FailureType.TIMEOUT, WorkerResult.fromExitCode(124, Duration.ZERO).failureType());
            assertEquals(FailureType.RESOURCE_EXHAUSTION, WorkerResult.fromExitCode(137, Duration.ZERO).failureType());
            assertEquals(FailureType.UNKNOWN, WorkerResult.fromExitCode(2, Duration.ZERO).failureType());
        }

        @Test
        void resultFileRefinesFailure() throws Exception {
            Path result = tempDir.resolve("result.json");
            Files.writeString(result, "{\"failure_type\":\"logic_error\",\"message\":\"3 tests failing\"}");

            WorkerResult interpreted = launcher.interpret(1, Duration.ofSeconds(4), result);

            assertEquals(FailureType.LOGIC_ERROR, interpreted.failureType());
            assertEquals("3 tests failing", interpreted.message());
            assertEquals(1, interpreted.exitCode());
        }

        @Test
        void resultFileIsIgnoredOnSuccess() throws Exception {
            Path result = tempDir.resolve("result.json");
            Files.writeString(result, "{\"failure_type\":\"bug\"}");

            assertTrue(launcher.interpret(0, Duration.ZERO, result).succeeded());
        }

        @Test
        void unreadableResultFileFallsBackToExitCode() throws Exception {
            Path result = tempDir.resolve("result.json");
            Files.writeString(result, "not json");

            assertEquals(FailureType.TIMEOUT, launcher.interpret(124, Duration.ZERO, result).failureType());
            assertEquals(FailureType.UNKNOWN, launcher.interpret(9, Duration.ZERO, tempDir.resolve("none.json")).failureType());
        }

        @Test
        void emptyCommandIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new ProcessWorkerLauncher(List.of(), stateFiles));
        }
    }

    @Nested
    @DisplayName("process launch")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class Launch {

        private WorkerRequest request(Path workspace) {
            Task task = Task.of("US-007", 1, List.of(), Set.of());
            Path workerDir = tempDir.resolve("workers/US-007-a0");
            return new WorkerRequest("run-1", task, "US-007-a0", 0, workspace,
                    workerDir.resolve("heartbeat.json"), workerDir);
        }

        @Test
        @DisplayName("agent receives the task id and environment, output goes to worker.log")
        void launchPassesTaskAndEnvironment() throws Exception {
            Path workspace = Files.createDirectories(tempDir.resolve("ws"));
            var launcher = new ProcessWorkerLauncher(List.of("sh", "-c",
                    "echo \"task=$0 attempt=$STORYLOOP_ATTEMPT run=$STORYLOOP_RUN_ID\""), stateFiles);

            WorkerHandle handle = launcher.launch(request(workspace));
            WorkerResult result = handle.completion().get(10, TimeUnit.SECONDS);

            assertTrue(result.succeeded());
            assertTrue(handle.pid().isPresent());
            String log = Files.readString(tempDir.resolve("workers/US-007-a0/worker.log"));
            assertTrue(log.contains("task=US-007 attempt=0 run=run-1"), log);
        }

        @Test
        @DisplayName("a failing agent can classify its failure through the result file")
        void failingAgentWritesResultFile() throws Exception {
            Path workspace = Files.createDirectories(tempDir.resolve("ws"));
            var launcher = new ProcessWorkerLauncher(List.of("sh", "-c",
                    "printf '{\"failure_type\":\"quality_gate_failure\",\"message\":\"lint\"}' > \"$STORYLOOP_RESULT_FILE\"; exit 1"),
                    stateFiles);

            WorkerResult result = launcher.launch(request(workspace)).completion().get(10, TimeUnit.SECONDS);

            assertEquals(FailureType.QUALITY_GATE_FAILURE, result.failureType());
            assertEquals("lint", result.message());
        }

        @Test
        void destroyStopsLongRunningAgent() throws Exception {
            Path workspace = Files.createDirectories(tempDir.resolve("ws"));
            var launcher = new ProcessWorkerLauncher(List.of("sh", "-c", "sleep 30"), stateFiles);

            WorkerHandle handle = launcher.launch(request(workspace));
            handle.destroy();
            WorkerResult result = handle.completion().get(10, TimeUnit.SECONDS);

            assertFalse(result.succeeded());
        }

        @Test
        void missingExecutableFailsToLaunch() throws Exception {
            Path workspace = Files.createDirectories(tempDir.resolve("ws"));
            var launcher = new ProcessWorkerLauncher(List.of("/nonexistent/storyloop-agent"), stateFiles);

            assertThrows(IllegalStateException.class, () -> launcher.launch(request(workspace)));
        }
    }
}
