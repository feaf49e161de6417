package com.storyloop.core.engine;

import com.storyloop.core.events.EventBus;
import com.storyloop.core.graph.DependencyGraph;
import com.storyloop.core.health.HealthMonitor;
import com.storyloop.core.health.WorkerHealth;
import com.storyloop.core.health.WorkerStats;
import com.storyloop.core.logging.MdcContext;
import com.storyloop.core.merge.MergeController;
import com.storyloop.core.merge.MergeException;
import com.storyloop.core.merge.MergeResult;
import com.storyloop.core.merge.WorkerWorkspace;
import com.storyloop.core.metrics.LoopMetrics;
import com.storyloop.core.model.ExecutionPlan;
import com.storyloop.core.model.FailureType;
import com.storyloop.core.model.RunReport;
import com.storyloop.core.model.Task;
import com.storyloop.core.model.TaskOutcome;
import com.storyloop.core.model.Wave;
import com.storyloop.core.retry.RetryDecision;
import com.storyloop.core.retry.RetryHandler;
import com.storyloop.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a task list end to end: plan, dispatch each wave's workers concurrently, supervise
 * them through heartbeats, retry transient failures, then merge successes back one at a time
 * in priority order before moving to the next wave.
 *
 * <p>The control loop itself is single-threaded. Only worker supervision runs on the pool,
 * bounded by {@code maxParallel}. Retry and merge decisions are made by calling
 * {@link RetryHandler} and {@link MergeController} directly; lifecycle events are published
 * on the {@link EventBus} for observers.
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    /**
     * @param hungGrace      how long a worker may stay HUNG before it is reclaimed
     * @param incompleteOnly exclude tasks already marked complete
     */
    public record Settings(
        String baseBranch,
        int maxParallel,
        Duration workerTimeout,
        Duration checkInterval,
        Duration hungGrace,
        boolean incompleteOnly
    ) {
        public Settings {
            if (maxParallel < 1) {
                throw new IllegalArgumentException("maxParallel must be >= 1");
            }
        }
    }

    private final TaskScheduler scheduler;
    private final MergeController mergeController;
    private final HealthMonitor healthMonitor;
    private final RetryHandler retryHandler;
    private final EventBus eventBus;
    private final WorkerLauncher launcher;
    private final LoopMetrics metrics;
    private final Settings settings;
    private final Sleeper sleeper;
    private final Clock clock;

    public BatchOrchestrator(TaskScheduler scheduler, MergeController mergeController, HealthMonitor healthMonitor,
                             RetryHandler retryHandler, EventBus eventBus, WorkerLauncher launcher,
                             LoopMetrics metrics, Settings settings, Sleeper sleeper, Clock clock) {
        this.scheduler = scheduler;
        this.mergeController = mergeController;
        this.healthMonitor = healthMonitor;
        this.retryHandler = retryHandler;
        this.eventBus = eventBus;
        this.launcher = launcher;
        this.metrics = metrics;
        this.settings = settings;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public Settings settings() {
        return settings;
    }

    /**
     * Executes every schedulable task.
     *
     * @throws com.storyloop.core.graph.GraphException on unknown references or cycles,
     *                                                 before any worker is dispatched
     */
    public RunReport run(List<Task> tasks) {
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
        Instant started = clock.instant();
        MdcContext.setRun(runId);
        try {
            long planStart = System.currentTimeMillis();
            DependencyGraph graph = DependencyGraph.build(tasks);
            Set<String> subset = graph.ids(settings.incompleteOnly());
            List<Wave> waves = scheduler.computeWaves(graph, subset);
            ExecutionPlan plan = graph.executionPlan(subset);
            if (metrics != null) {
                metrics.recordPlanningDuration(System.currentTimeMillis() - planStart);
            }
            log.info("Run {}: {} task(s) in {} batch(es), {} wave(s)",
                    runId, plan.totalTasks(), plan.sequentialSteps(), waves.size());
            emit("run.started", runId, null, Map.of(
                    "total_tasks", plan.totalTasks(),
                    "batches", plan.sequentialSteps(),
                    "waves", waves.size(),
                    "max_parallelism", plan.maxParallelism()));

            Map<String, TaskOutcome> outcomes = new LinkedHashMap<>();
            for (Wave wave : waves) {
                executeWave(runId, graph, subset, wave, outcomes);
            }

            RunReport report = new RunReport(runId, plan, waves, outcomes,
                    Duration.between(started, clock.instant()));
            log.info("Run {} finished: {} merged, {} failed, {} merge conflict(s), {} skipped",
                    runId, report.mergedIds().size(),
                    report.idsWith(TaskOutcome.Status.FAILED).size(),
                    report.idsWith(TaskOutcome.Status.MERGE_CONFLICT).size(),
                    report.idsWith(TaskOutcome.Status.SKIPPED_DEPENDENCY_FAILED).size());
            emit("run.completed", runId, null, Map.of(
                    "merged", report.mergedIds().size(),
                    "failed", report.idsWith(TaskOutcome.Status.FAILED).size(),
                    "merge_conflicts", report.idsWith(TaskOutcome.Status.MERGE_CONFLICT).size(),
                    "skipped", report.idsWith(TaskOutcome.Status.SKIPPED_DEPENDENCY_FAILED).size(),
                    "elapsed_seconds", report.elapsed().toSeconds()));
            if (metrics != null) {
                metrics.recordRunResult(report.allMerged());
            }
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // WAVE EXECUTION
    // ══════════════════════════════════════════════════════════════════════════

    private void executeWave(String runId, DependencyGraph graph, Set<String> subset, Wave wave,
                             Map<String, TaskOutcome> outcomes) {
        MdcContext.setBatch(runId, wave.label());

        List<Task> runnable = new ArrayList<>();
        for (String id : wave.taskIds()) {
            List<String> blocked = graph.dependenciesOf(id).stream()
                    .filter(subset::contains)
                    .filter(dep -> outcomes.get(dep) == null || !outcomes.get(dep).merged())
                    .toList();
            if (blocked.isEmpty()) {
                runnable.add(graph.task(id));
            } else {
                log.warn("Skipping {}: dependencies not merged {}", id, blocked);
                outcomes.put(id, new TaskOutcome(id, TaskOutcome.Status.SKIPPED_DEPENDENCY_FAILED, 0,
                        "dependencies not merged: " + blocked));
                emit("story.skipped", runId, id, Map.of("blocked_by", blocked));
            }
        }
        if (runnable.isEmpty()) {
            return;
        }

        mergeController.requireDisjoint(runnable);
        String mode = wave.isSequential() ? "sequential" : "parallel";
        log.info("Wave {} starting ({}): {}", wave.label(), mode, runnable.stream().map(Task::id).toList());
        emit("batch.started", runId, null, Map.of(
                "batch", wave.batchNumber(),
                "wave", wave.label(),
                "mode", mode,
                "tasks", runnable.stream().map(Task::id).toList()));
        if (metrics != null) {
            metrics.recordWaveExecution(runnable.size(), mode);
        }

        var ready = new ConcurrentHashMap<String, WorkerWorkspace>();
        var attempts = new LinkedHashMap<String, AttemptResult>();
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(settings.maxParallel(), runnable.size()), workerThreads());
        try {
            var futures = new LinkedHashMap<String, CompletableFuture<AttemptResult>>();
            for (Task task : runnable) {
                futures.put(task.id(), CompletableFuture.supplyAsync(() -> {
                    MdcContext.setBatch(runId, wave.label());
                    try {
                        return executeTask(runId, task, ready);
                    } finally {
                        MdcContext.clear();
                    }
                }, executor));
            }
            for (var entry : futures.entrySet()) {
                try {
                    attempts.put(entry.getKey(), entry.getValue().join());
                } catch (CompletionException e) {
                    log.error("Unexpected error collecting result for {}", entry.getKey(), e);
                    attempts.put(entry.getKey(), AttemptResult.failed(1, "coordinator error: " + e.getMessage()));
                }
            }

            // Merge serially, in wave (priority) order
            for (Task task : runnable) {
                AttemptResult attempt = attempts.get(task.id());
                if (!attempt.succeeded()) {
                    outcomes.put(task.id(), new TaskOutcome(task.id(), TaskOutcome.Status.FAILED,
                            attempt.attempts(), attempt.detail()));
                    continue;
                }
                outcomes.put(task.id(), merge(runId, task, attempt.attempts()));
            }
        } finally {
            ready.values().forEach(WorkerWorkspace::close);
            shutdown(executor);
        }

        long merged = runnable.stream().filter(t -> outcomes.get(t.id()).merged()).count();
        log.info("Wave {} complete: {}/{} merged", wave.label(), merged, runnable.size());
        emit("batch.completed", runId, null, Map.of(
                "batch", wave.batchNumber(),
                "wave", wave.label(),
                "merged", merged,
                "total", runnable.size()));
    }

    private TaskOutcome merge(String runId, Task task, int attempts) {
        try {
            MergeResult result = mergeController.mergeBack(task, settings.baseBranch());
            emit("story.merged", runId, task.id(), Map.of(
                    "commit", String.valueOf(result.commit()),
                    "files", result.filesMerged()));
            return new TaskOutcome(task.id(), TaskOutcome.Status.MERGED, attempts, result.commit());
        } catch (MergeException e) {
            emit("story.merge_failed", runId, task.id(), Map.of(
                    "error", String.valueOf(e.getMessage()),
                    "conflicting_files", e.getConflictingFiles()));
            return new TaskOutcome(task.id(), TaskOutcome.Status.MERGE_CONFLICT, attempts, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Merge of {} failed: {}", task.id(), e.getMessage(), e);
            emit("story.merge_failed", runId, task.id(), Map.of("error", String.valueOf(e.getMessage())));
            return new TaskOutcome(task.id(), TaskOutcome.Status.FAILED, attempts, "merge error: " + e.getMessage());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // TASK ATTEMPTS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Runs attempts until one succeeds or a retry is denied. A successful attempt leaves its
     * workspace in {@code ready} for the merge phase; every other workspace is released here.
     */
    AttemptResult executeTask(String runId, Task task, Map<String, WorkerWorkspace> ready) {
        int attempt = 0;
        while (true) {
            String workerId = task.id() + "-a" + attempt;
            MdcContext.setWorker(runId, task.id(), workerId);
            long startMs = System.currentTimeMillis();
            WorkerResult result;
            boolean interrupted = false;
            WorkerWorkspace workspace = null;
            try {
                workspace = mergeController.createWorker(task, settings.baseBranch());
                log.info("Dispatching {} attempt {} as {}", task.id(), attempt, workerId);
                emit("story.started", runId, task.id(), Map.of(
                        "worker_id", workerId,
                        "attempt", attempt,
                        "title", task.title()));
                result = supervise(runId, task, workerId, attempt, workspace);
                if (result.succeeded()) {
                    mergeController.commitPending(workspace, "storyloop: " + task.id() + " " + task.title());
                    ready.put(task.id(), workspace);
                    workspace = null;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                result = WorkerResult.failure(FailureType.COORDINATOR_ERROR,
                        Duration.ofMillis(System.currentTimeMillis() - startMs), "interrupted");
            } catch (RuntimeException e) {
                log.error("Infrastructure error running {}: {}", task.id(), e.getMessage(), e);
                result = WorkerResult.failure(FailureType.COORDINATOR_ERROR,
                        Duration.ofMillis(System.currentTimeMillis() - startMs), String.valueOf(e.getMessage()));
            } finally {
                if (workspace != null) {
                    workspace.close();
                }
                forgetHeartbeat(workerId);
                MdcContext.clearWorker();
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (result.succeeded()) {
                retryHandler.resetRetryCount(task.id());
                if (metrics != null) {
                    metrics.recordTaskExecution("completed", elapsedMs);
                }
                log.info("{} completed in {}s", task.id(), elapsedMs / 1000);
                emit("story.completed", runId, task.id(), Map.of(
                        "attempt", attempt,
                        "elapsed_seconds", result.elapsed().toSeconds()));
                return AttemptResult.succeeded(attempt + 1);
            }

            if (metrics != null) {
                metrics.recordTaskExecution("failed", elapsedMs);
            }
            log.warn("{} attempt {} failed ({}): {}", task.id(), attempt,
                    result.failureType().code(), result.message());
            emit("story.failed", runId, task.id(), Map.of(
                    "attempt", attempt,
                    "failure_type", result.failureType().code(),
                    "exit_code", result.exitCode(),
                    "message", String.valueOf(result.message())));

            if (interrupted) {
                retryHandler.recordNoRetry(runId, task.id(), result.failureType(), attempt,
                        result.message(), "run interrupted");
                return AttemptResult.failed(attempt + 1, "interrupted");
            }
            RetryDecision decision = retryHandler.shouldRetry(runId, task.id(), result.failureType(),
                    attempt, result.message());
            if (!decision.shouldRetry()) {
                return AttemptResult.failed(attempt + 1, result.failureType().code() + ": " + decision.reason());
            }

            emit("story.retrying", runId, task.id(), Map.of(
                    "attempt", attempt + 1,
                    "backoff_seconds", decision.backoff().toSeconds(),
                    "reason", decision.reason()));
            try {
                sleeper.sleep(decision.backoff());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted during backoff for {}", task.id());
                return AttemptResult.failed(attempt + 1, "interrupted");
            }
            attempt++;
        }
    }

    /**
     * Launches the worker and waits for it, checking its heartbeat every {@code checkInterval}.
     * DEAD workers, workers HUNG past the grace period and workers over the timeout are
     * destroyed and their workspace reclaimed.
     */
    WorkerResult supervise(String runId, Task task, String workerId, int attempt, WorkerWorkspace workspace)
            throws InterruptedException {
        WorkerRequest request = new WorkerRequest(runId, task, workerId, attempt, workspace.path(),
                healthMonitor.heartbeatFile(workerId), healthMonitor.workerDir(workerId));
        WorkerHandle handle = launcher.launch(request);
        healthMonitor.writeHeartbeat(workerId, task.id(), attempt,
                handle.pid().map(WorkerStats::withPid).orElse(WorkerStats.empty()));

        Instant started = clock.instant();
        Instant hungSince = null;
        while (true) {
            try {
                return handle.completion().get(settings.checkInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.trace("{} still running", workerId);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return WorkerResult.failure(FailureType.COORDINATOR_ERROR,
                        Duration.between(started, clock.instant()), String.valueOf(cause.getMessage()));
            } catch (InterruptedException e) {
                handle.destroy();
                throw e;
            }

            Instant now = clock.instant();
            Duration elapsed = Duration.between(started, now);
            if (elapsed.compareTo(settings.workerTimeout()) >= 0) {
                log.warn("{} exceeded timeout of {}s", workerId, settings.workerTimeout().toSeconds());
                return reclaim(handle, task, elapsed, "worker exceeded timeout of "
                        + settings.workerTimeout().toSeconds() + "s");
            }
            if (handle.completion().isDone()) {
                continue;
            }

            WorkerHealth health = healthMonitor.check(workerId);
            switch (health.status()) {
                case DEAD -> {
                    emit("worker.dead", runId, task.id(), Map.of(
                            "worker_id", workerId, "reason", health.reason()));
                    return reclaim(handle, task, elapsed, "worker dead: " + health.reason());
                }
                case HUNG -> {
                    if (hungSince == null) {
                        hungSince = now;
                        emit("worker.hung", runId, task.id(), Map.of(
                                "worker_id", workerId, "reason", health.reason()));
                    } else if (Duration.between(hungSince, now).compareTo(settings.hungGrace()) >= 0) {
                        return reclaim(handle, task, elapsed, "worker hung past grace period: " + health.reason());
                    }
                }
                default -> hungSince = null;
            }
        }
    }

    private WorkerResult reclaim(WorkerHandle handle, Task task, Duration elapsed, String message) {
        handle.destroy();
        mergeController.reclaim(task.id());
        return WorkerResult.failure(FailureType.TIMEOUT, elapsed, message);
    }

    private void forgetHeartbeat(String workerId) {
        try {
            healthMonitor.forget(workerId);
        } catch (UncheckedIOException e) {
            log.warn("Could not remove heartbeat of {}: {}", workerId, e.getMessage());
        }
    }

    private void emit(String type, String runId, String taskId, Map<String, Object> data) {
        eventBus.emit(type, data, runId, taskId, true);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "storyloop-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    record AttemptResult(boolean succeeded, int attempts, String detail) {

        static AttemptResult succeeded(int attempts) {
            return new AttemptResult(true, attempts, "completed");
        }

        static AttemptResult failed(int attempts, String detail) {
            return new AttemptResult(false, attempts, detail);
        }
    }
}
