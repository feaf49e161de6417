package com.storyloop.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storyloop.core.model.FailureType;
import com.storyloop.core.state.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the coding agent as a local OS process inside the worker's worktree.
 *
 * <p>The agent is invoked as {@code <command...> <taskId>} with these environment variables:
 * <ul>
 *   <li>{@code STORYLOOP_RUN_ID}, {@code STORYLOOP_TASK_ID}, {@code STORYLOOP_WORKER_ID},
 *       {@code STORYLOOP_ATTEMPT}</li>
 *   <li>{@code STORYLOOP_HEARTBEAT_FILE}: heartbeat record to rewrite periodically</li>
 *   <li>{@code STORYLOOP_RESULT_FILE}: optional {@code {"failure_type": ..., "message": ...}}
 *       written on failure to classify it more precisely than the exit code</li>
 * </ul>
 * Output goes to {@code worker.log} in the worker directory.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    static final String LOG_FILE = "worker.log";
    static final String RESULT_FILE = "result.json";

    private final List<String> command;
    private final StateFiles stateFiles;

    public ProcessWorkerLauncher(List<String> command, StateFiles stateFiles) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("agent command must not be empty");
        }
        this.command = List.copyOf(command);
        this.stateFiles = stateFiles;
    }

    @Override
    public WorkerHandle launch(WorkerRequest request) {
        List<String> argv = new ArrayList<>(command);
        argv.add(request.task().id());

        Path logFile = request.workerDir().resolve(LOG_FILE);
        Path resultFile = request.workerDir().resolve(RESULT_FILE);
        try {
            Files.createDirectories(request.workerDir());
            Files.deleteIfExists(resultFile);

            ProcessBuilder builder = new ProcessBuilder(argv)
                    .directory(request.workspace().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            Map<String, String> env = builder.environment();
            env.put("STORYLOOP_RUN_ID", String.valueOf(request.runId()));
            env.put("STORYLOOP_TASK_ID", request.task().id());
            env.put("STORYLOOP_TASK_TITLE", request.task().title());
            env.put("STORYLOOP_WORKER_ID", request.workerId());
            env.put("STORYLOOP_ATTEMPT", String.valueOf(request.attempt()));
            env.put("STORYLOOP_HEARTBEAT_FILE", request.heartbeatFile().toAbsolutePath().toString());
            env.put("STORYLOOP_RESULT_FILE", resultFile.toAbsolutePath().toString());

            long startNanos = System.nanoTime();
            Process process = builder.start();
            log.info("Launched worker {} (pid {}) for {}: {}", request.workerId(), process.pid(),
                    request.task().id(), String.join(" ", argv));

            CompletableFuture<WorkerResult> completion = process.onExit().thenApply(p -> {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                return interpret(p.exitValue(), elapsed, resultFile);
            });
            return new ProcessHandleAdapter(process, completion);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to launch worker " + request.workerId() + ": " + e.getMessage(), e);
        }
    }

    WorkerResult interpret(int exitCode, Duration elapsed, Path resultFile) {
        WorkerResult byExit = WorkerResult.fromExitCode(exitCode, elapsed);
        if (byExit.succeeded()) {
            return byExit;
        }
        try {
            Optional<ReportedFailure> reported = stateFiles.read(resultFile, ReportedFailure.class);
            if (reported.isPresent() && reported.get().failureType() != null) {
                ReportedFailure r = reported.get();
                return new WorkerResult(exitCode, elapsed, FailureType.fromCode(r.failureType()),
                        r.message() != null ? r.message() : byExit.message());
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable result file {}: {}", resultFile, e.getMessage());
        }
        return byExit;
    }

    record ReportedFailure(
        @JsonProperty("failure_type") String failureType,
        @JsonProperty("message") String message
    ) {
    }

    private static final class ProcessHandleAdapter implements WorkerHandle {

        private final Process process;
        private final CompletableFuture<WorkerResult> completion;

        ProcessHandleAdapter(Process process, CompletableFuture<WorkerResult> completion) {
            this.process = process;
            this.completion = completion;
        }

        @Override
        public Optional<Long> pid() {
            return Optional.of(process.pid());
        }

        @Override
        public CompletableFuture<WorkerResult> completion() {
            return completion;
        }

        @Override
        public void destroy() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
