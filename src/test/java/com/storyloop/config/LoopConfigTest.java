package com.storyloop.config;

import com.storyloop.core.engine.BatchOrchestrator;
import com.storyloop.core.events.EventBus;
import com.storyloop.core.health.HealthMonitor;
import com.storyloop.core.health.WorkerHealthIndicator;
import com.storyloop.core.merge.MergeController;
import com.storyloop.core.metrics.LoopMetrics;
import com.storyloop.core.retry.RetryHandler;
import com.storyloop.core.scheduler.TaskScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoopConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var properties = new LoopProperties();

        assertEquals(".storyloop", properties.getStateDir());
        assertEquals("main", properties.getBaseBranch());
        assertTrue(properties.getGraph().isIncompleteOnly());
        assertEquals(3, properties.getWorkers().getMaxParallel());
        assertEquals(Duration.ofMinutes(30), properties.getWorkers().timeout());
        assertEquals(Duration.ofSeconds(120), properties.getHealth().hungThreshold());
        assertEquals(Duration.ofSeconds(300), properties.getHealth().deadThreshold());
        assertEquals(3, properties.getRetry().getMaxRetries());
        assertEquals(60, properties.getRetry().getBaseBackoffSeconds());
        assertEquals(2.0, properties.getRetry().getBackoffMultiplier());
        assertEquals(Duration.ofSeconds(30), properties.getMerge().lockTimeout());
        assertEquals(1000, properties.getEvents().getHistoryCapacity());
    }

    @Test
    @DisplayName("storyloop.* properties bind with relaxed names")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "storyloop.base-branch", "develop",
                "storyloop.workers.max-parallel", "8",
                "storyloop.workers.agent-command[0]", "bash",
                "storyloop.workers.agent-command[1]", "run-agent.sh",
                "storyloop.health.hung-threshold-seconds", "90",
                "storyloop.retry.backoff-multiplier", "1.5"));

        LoopProperties properties = new Binder(source).bind("storyloop", LoopProperties.class).get();

        assertEquals("develop", properties.getBaseBranch());
        assertEquals(8, properties.getWorkers().getMaxParallel());
        assertEquals(List.of("bash", "run-agent.sh"), properties.getWorkers().getAgentCommand());
        assertEquals(Duration.ofSeconds(90), properties.getHealth().hungThreshold());
        assertEquals(1.5, properties.getRetry().getBackoffMultiplier());
        assertEquals(300, properties.getHealth().getDeadThresholdSeconds());
    }

    @Test
    @DisplayName("engine components are wired from properties")
    void contextWiring() {
        new ApplicationContextRunner()
                .withUserConfiguration(LoopConfig.class, LoopMetrics.class, TaskScheduler.class,
                        WorkerHealthIndicator.class)
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues(
                        "storyloop.state-dir=" + tempDir.resolve("state"),
                        "storyloop.repo-path=" + tempDir,
                        "storyloop.workers.max-parallel=5",
                        "storyloop.events.history-capacity=10")
                .run(context -> {
                    assertNotNull(context.getBean(MergeController.class));
                    assertNotNull(context.getBean(HealthMonitor.class));
                    assertNotNull(context.getBean(RetryHandler.class));
                    assertNotNull(context.getBean(EventBus.class));
                    assertNotNull(context.getBean(WorkerHealthIndicator.class));

                    BatchOrchestrator orchestrator = context.getBean(BatchOrchestrator.class);
                    assertEquals(5, orchestrator.settings().maxParallel());
                    assertEquals("main", orchestrator.settings().baseBranch());

                    HealthMonitor monitor = context.getBean(HealthMonitor.class);
                    assertEquals(tempDir.resolve("state").resolve("workers").resolve("w1").resolve("heartbeat.json"),
                            monitor.heartbeatFile("w1"));
                });
    }
}
