package com.storyloop.core.health;

import com.storyloop.core.metrics.LoopMetrics;
import com.storyloop.core.state.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Supervises worker liveness through heartbeat files.
 *
 * <p>Classification is a pure function of heartbeat age and, when a pid is recorded and the
 * platform can tell, process liveness. A dead process wins over age. When liveness cannot be
 * determined the age thresholds alone decide. Each heartbeat is owned by one worker, so reads
 * and writes need no locking beyond the atomic rename.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    static final String HEARTBEAT_FILE = "heartbeat.json";

    private final Path workersDir;
    private final Path healthLog;
    private final Duration hungThreshold;
    private final Duration deadThreshold;
    private final ProcessProbe processProbe;
    private final StateFiles stateFiles;
    private final Clock clock;
    private final LoopMetrics metrics;

    public HealthMonitor(Path workersDir, Path healthLog, Duration hungThreshold, Duration deadThreshold,
                         ProcessProbe processProbe, StateFiles stateFiles, Clock clock, LoopMetrics metrics) {
        if (deadThreshold.compareTo(hungThreshold) <= 0) {
            throw new IllegalArgumentException("dead threshold must exceed hung threshold");
        }
        this.workersDir = workersDir;
        this.healthLog = healthLog;
        this.hungThreshold = hungThreshold;
        this.deadThreshold = deadThreshold;
        this.processProbe = processProbe;
        this.stateFiles = stateFiles;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Classifies a heartbeat.
     *
     * @param age     heartbeat age; negative ages (clock skew) count as zero
     * @param running process liveness, empty if unknown
     */
    public static WorkerStatus classify(Duration age, Optional<Boolean> running,
                                        Duration hungThreshold, Duration deadThreshold) {
        if (running.isPresent() && !running.get()) {
            return WorkerStatus.DEAD;
        }
        Duration effective = age.isNegative() ? Duration.ZERO : age;
        if (effective.compareTo(deadThreshold) >= 0) {
            return WorkerStatus.DEAD;
        }
        if (effective.compareTo(hungThreshold) >= 0) {
            return WorkerStatus.HUNG;
        }
        return WorkerStatus.HEALTHY;
    }

    public WorkerStatus classify(Duration age, Optional<Boolean> running) {
        return classify(age, running, hungThreshold, deadThreshold);
    }

    public Path heartbeatFile(String workerId) {
        return workersDir.resolve(workerId).resolve(HEARTBEAT_FILE);
    }

    public Path workerDir(String workerId) {
        return workersDir.resolve(workerId);
    }

    /**
     * Replaces the worker's heartbeat record via temp file and rename.
     */
    public Heartbeat writeHeartbeat(String workerId, String taskId, int iteration, WorkerStats stats) {
        Heartbeat heartbeat = new Heartbeat(clock.instant(), workerId, taskId, iteration,
                stats.memoryMb(), stats.externalCalls(), stats.context());
        stateFiles.writeAtomically(heartbeatFile(workerId), heartbeat);
        log.debug("Heartbeat written for {} (task {}, iteration {})", workerId, taskId, iteration);
        return heartbeat;
    }

    /** Memory of this JVM, for heartbeats written in-process. */
    public static double currentMemoryMb() {
        var heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        return heap.getUsed() / (1024.0 * 1024.0);
    }

    /**
     * Reads the worker's latest heartbeat and classifies it. Every non-HEALTHY result is
     * appended to the health log.
     */
    public WorkerHealth check(String workerId) {
        WorkerHealth health = evaluate(workerId);
        if (metrics != null) {
            metrics.recordHealthClassification(health.status().name());
        }
        if (health.status() != WorkerStatus.HEALTHY) {
            if (health.status().isUnhealthy()) {
                log.warn("Worker {} is {} ({})", workerId, health.status(), health.reason());
            } else {
                log.debug("Worker {} is {} ({})", workerId, health.status(), health.reason());
            }
            appendEvent(health);
        }
        return health;
    }

    /** Checks every worker that has a heartbeat record, keyed by worker id. */
    public Map<String, WorkerHealth> checkAll() {
        Map<String, WorkerHealth> results = new TreeMap<>();
        for (String workerId : knownWorkers()) {
            results.put(workerId, check(workerId));
        }
        return results;
    }

    public List<WorkerHealth> unhealthyWorkers() {
        return checkAll().values().stream()
                .filter(h -> h.status().isUnhealthy())
                .toList();
    }

    /** Counts workers by status without writing health events. */
    public HealthSummary summary() {
        int healthy = 0;
        int hung = 0;
        int dead = 0;
        int unknown = 0;
        List<String> workers = knownWorkers();
        for (String workerId : workers) {
            switch (evaluate(workerId).status()) {
                case HEALTHY -> healthy++;
                case HUNG -> hung++;
                case DEAD -> dead++;
                case UNKNOWN -> unknown++;
            }
        }
        return new HealthSummary(workers.size(), healthy, hung, dead, unknown);
    }

    /**
     * Deletes heartbeat records older than {@code maxAgeHours}, regardless of status.
     * Unreadable records are aged by file modification time.
     *
     * @return worker ids whose records were removed
     */
    public List<String> cleanup(double maxAgeHours) {
        Instant cutoff = clock.instant().minusSeconds((long) (maxAgeHours * 3600));
        List<String> removed = new ArrayList<>();
        for (String workerId : knownWorkers()) {
            Path file = heartbeatFile(workerId);
            Instant timestamp;
            try {
                timestamp = readHeartbeat(workerId).map(Heartbeat::timestamp)
                        .orElse(Instant.ofEpochMilli(file.toFile().lastModified()));
            } catch (HeartbeatException e) {
                log.debug("Aging unreadable heartbeat {} by mtime: {}", file, e.getMessage());
                timestamp = Instant.ofEpochMilli(file.toFile().lastModified());
            }
            if (timestamp.isBefore(cutoff)) {
                forget(workerId);
                removed.add(workerId);
            }
        }
        if (!removed.isEmpty()) {
            log.info("Removed {} stale heartbeat record(s): {}", removed.size(), removed);
        }
        return removed;
    }

    /**
     * Removes the worker's heartbeat record, and its directory when nothing else is in it.
     */
    public void forget(String workerId) {
        try {
            Files.deleteIfExists(heartbeatFile(workerId));
            Path dir = workerDir(workerId);
            String[] rest = dir.toFile().list();
            if (rest != null && rest.length == 0) {
                Files.deleteIfExists(dir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove heartbeat for " + workerId, e);
        }
    }

    Optional<Heartbeat> readHeartbeat(String workerId) {
        Path file = heartbeatFile(workerId);
        try {
            return stateFiles.read(file, Heartbeat.class);
        } catch (IOException e) {
            throw new HeartbeatException("Unreadable heartbeat " + file + ": " + e.getMessage(), e);
        }
    }

    private WorkerHealth evaluate(String workerId) {
        Optional<Heartbeat> record;
        try {
            record = readHeartbeat(workerId);
        } catch (HeartbeatException e) {
            return WorkerHealth.unknown(workerId, e.getMessage());
        }
        if (record.isEmpty()) {
            return WorkerHealth.unknown(workerId, "no heartbeat record");
        }

        Heartbeat heartbeat = record.get();
        if (heartbeat.timestamp() == null) {
            return WorkerHealth.unknown(workerId, "heartbeat has no timestamp");
        }
        Duration age = Duration.between(heartbeat.timestamp(), clock.instant());
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        Optional<Boolean> running = heartbeat.pid().flatMap(processProbe::isRunning);
        WorkerStatus status = classify(age, running);

        String reason;
        if (running.isPresent() && !running.get()) {
            reason = "process " + heartbeat.pid().orElse(-1L) + " not running";
        } else {
            reason = "last heartbeat " + age.toSeconds() + "s ago";
        }
        return new WorkerHealth(workerId, status, age, heartbeat, reason);
    }

    private void appendEvent(WorkerHealth health) {
        stateFiles.appendLine(healthLog, HealthEvent.of(clock.instant(), health));
    }

    private List<String> knownWorkers() {
        File[] dirs = workersDir.toFile().listFiles(File::isDirectory);
        if (dirs == null) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (File dir : dirs) {
            if (new File(dir, HEARTBEAT_FILE).isFile()) {
                ids.add(dir.getName());
            }
        }
        ids.sort(null);
        return ids;
    }
}
