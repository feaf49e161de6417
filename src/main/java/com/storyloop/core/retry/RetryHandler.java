package com.storyloop.core.retry;

import com.storyloop.core.metrics.LoopMetrics;
import com.storyloop.core.model.FailureType;
import com.storyloop.core.state.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a failed attempt is retried and how long to back off first.
 *
 * <p>Transient failure categories are retried until the attempt ceiling; defect categories
 * are never retried. Every decision, granted or denied, is appended to the retry log. The
 * per-task retry count lives in memory only and is cleared by {@link #resetRetryCount}.
 */
public class RetryHandler {

    private static final Logger log = LoggerFactory.getLogger(RetryHandler.class);

    static final String MAX_RETRIES_EXCEEDED = "maximum retries exceeded";
    static final String MANUAL_INTERVENTION = "requires manual intervention";

    private static final int RECENT_LIMIT = 10;

    private final RetryPolicy policy;
    private final Path retryLog;
    private final StateFiles stateFiles;
    private final Clock clock;
    private final LoopMetrics metrics;

    private final ConcurrentHashMap<String, Integer> retryCounts = new ConcurrentHashMap<>();

    public RetryHandler(RetryPolicy policy, Path retryLog, StateFiles stateFiles, Clock clock, LoopMetrics metrics) {
        this.policy = policy;
        this.retryLog = retryLog;
        this.stateFiles = stateFiles;
        this.clock = clock;
        this.metrics = metrics;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryDecision shouldRetry(String taskId, FailureType failureType, int attempt) {
        return shouldRetry(null, taskId, failureType, attempt, null);
    }

    /** Accepts a failure code such as {@code "timeout"}; unrecognised codes are UNKNOWN. */
    public RetryDecision shouldRetry(String taskId, String failureCode, int attempt) {
        return shouldRetry(null, taskId, FailureType.fromCode(failureCode), attempt, null);
    }

    /**
     * @param attempt zero-based number of the attempt that just failed
     */
    public RetryDecision shouldRetry(String runId, String taskId, FailureType failureType,
                                     int attempt, String errorMessage) {
        int count = retryCount(taskId);
        int remaining = Math.max(0, policy.maxRetries() - Math.max(attempt, count));

        RetryDecision decision;
        if (attempt >= policy.maxRetries() || count >= policy.maxRetries()) {
            decision = RetryDecision.deny(MAX_RETRIES_EXCEEDED + " (" + Math.max(attempt, count)
                    + "/" + policy.maxRetries() + ")", 0);
        } else if (!failureType.isTransient()) {
            decision = RetryDecision.deny("failure type '" + failureType.code() + "' " + MANUAL_INTERVENTION,
                    remaining);
        } else {
            Duration backoff = policy.backoff(attempt);
            retryCounts.merge(taskId, 1, Integer::sum);
            decision = new RetryDecision(true, "retrying " + failureType.code() + " failure after "
                    + backoff.toSeconds() + "s", backoff, remaining - 1);
        }

        if (decision.shouldRetry()) {
            log.info("Retry granted for {} (attempt {}, {}): backoff {}s",
                    taskId, attempt, failureType.code(), decision.backoff().toSeconds());
        } else {
            log.warn("Retry denied for {} (attempt {}, {}): {}",
                    taskId, attempt, failureType.code(), decision.reason());
        }
        append(runId, taskId, attempt, failureType, errorMessage, decision.backoff(),
                decision.shouldRetry(), decision.reason());
        if (metrics != null) {
            metrics.recordRetryDecision(failureType.code(), decision.shouldRetry());
        }
        return decision;
    }

    /**
     * Same as {@link #shouldRetry(String, String, FailureType, int, String)} but throws when denied.
     *
     * @throws RetryExhaustedException if no retry is granted
     */
    public RetryDecision requireRetry(String runId, String taskId, FailureType failureType,
                                      int attempt, String errorMessage) {
        RetryDecision decision = shouldRetry(runId, taskId, failureType, attempt, errorMessage);
        if (!decision.shouldRetry()) {
            throw new RetryExhaustedException(taskId, failureType, decision.reason());
        }
        return decision;
    }

    /**
     * Logs a denial decided by the caller. The retry count is not touched.
     */
    public void recordNoRetry(String runId, String taskId, FailureType failureType, int attempt,
                              String errorMessage, String reason) {
        log.info("Recording no-retry for {} (attempt {}, {}): {}", taskId, attempt, failureType.code(), reason);
        append(runId, taskId, attempt, failureType, errorMessage, Duration.ZERO, false, reason);
    }

    /** Clears the retry count after an independent success. */
    public void resetRetryCount(String taskId) {
        if (retryCounts.remove(taskId) != null) {
            log.debug("Reset retry count for {}", taskId);
        }
    }

    public int retryCount(String taskId) {
        return retryCounts.getOrDefault(taskId, 0);
    }

    /** Aggregates the retry log. */
    public RetryStats stats() {
        List<RetryRecord> records = stateFiles.readLines(retryLog, RetryRecord.class);
        Map<String, Integer> byTask = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        int total = 0;
        for (RetryRecord record : records) {
            if (!record.willRetry()) {
                continue;
            }
            total++;
            byTask.merge(record.taskId(), 1, Integer::sum);
            byType.merge(record.failureType(), 1, Integer::sum);
        }
        List<RetryRecord> recent = new ArrayList<>(
                records.subList(Math.max(0, records.size() - RECENT_LIMIT), records.size()));
        Collections.reverse(recent);
        return new RetryStats(total, byTask, byType, recent);
    }

    /** Retry log records for one task, oldest first. */
    public List<RetryRecord> history(String taskId) {
        return stateFiles.readLines(retryLog, RetryRecord.class).stream()
                .filter(r -> taskId.equals(r.taskId()))
                .toList();
    }

    private void append(String runId, String taskId, int attempt, FailureType failureType,
                        String errorMessage, Duration backoff, boolean willRetry, String reason) {
        stateFiles.appendLine(retryLog, new RetryRecord(clock.instant(), runId, taskId, attempt,
                failureType.code(), errorMessage, backoff.toMillis() / 1000.0, willRetry, reason));
    }
}
