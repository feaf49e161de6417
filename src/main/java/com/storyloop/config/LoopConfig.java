package com.storyloop.config;

import com.storyloop.core.engine.BatchOrchestrator;
import com.storyloop.core.engine.ProcessWorkerLauncher;
import com.storyloop.core.engine.Sleeper;
import com.storyloop.core.engine.WorkerLauncher;
import com.storyloop.core.events.EventBus;
import com.storyloop.core.health.HealthMonitor;
import com.storyloop.core.health.ProcessHandleProbe;
import com.storyloop.core.merge.BaseRefLock;
import com.storyloop.core.merge.GitWorkspaceManager;
import com.storyloop.core.merge.MergeController;
import com.storyloop.core.metrics.LoopMetrics;
import com.storyloop.core.retry.RetryHandler;
import com.storyloop.core.retry.RetryPolicy;
import com.storyloop.core.scheduler.TaskScheduler;
import com.storyloop.core.state.StateFiles;
import com.storyloop.prd.PrdTaskSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the engine components from {@link LoopProperties}. State files all live under
 * {@code storyloop.state-dir}.
 */
@Configuration
@EnableConfigurationProperties(LoopProperties.class)
public class LoopConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StateFiles stateFiles() {
        return new StateFiles();
    }

    @Bean
    public PrdTaskSource prdTaskSource(StateFiles stateFiles) {
        return new PrdTaskSource(stateFiles.mapper());
    }

    @Bean
    public GitWorkspaceManager gitWorkspaceManager(LoopProperties properties) {
        return new GitWorkspaceManager(Path.of(properties.getRepoPath()));
    }

    @Bean
    public MergeController mergeController(GitWorkspaceManager git, LoopProperties properties,
                                           LoopMetrics metrics, Clock clock) {
        Path stateDir = properties.stateDirPath();
        return new MergeController(git, new BaseRefLock(stateDir.resolve("locks")),
                stateDir.resolve("worktrees"), properties.getWorkers().getBranchPrefix(),
                properties.getMerge().lockTimeout(), metrics, clock);
    }

    @Bean
    public HealthMonitor healthMonitor(LoopProperties properties, StateFiles stateFiles,
                                       LoopMetrics metrics, Clock clock) {
        Path stateDir = properties.stateDirPath();
        LoopProperties.Health health = properties.getHealth();
        return new HealthMonitor(stateDir.resolve("workers"), stateDir.resolve("health.jsonl"),
                health.hungThreshold(), health.deadThreshold(), new ProcessHandleProbe(),
                stateFiles, clock, metrics);
    }

    @Bean
    public RetryHandler retryHandler(LoopProperties properties, StateFiles stateFiles,
                                     LoopMetrics metrics, Clock clock) {
        LoopProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getMaxRetries(),
                Duration.ofSeconds(retry.getBaseBackoffSeconds()), retry.getBackoffMultiplier());
        return new RetryHandler(policy, properties.stateDirPath().resolve("retries.jsonl"),
                stateFiles, clock, metrics);
    }

    @Bean(destroyMethod = "close")
    public EventBus eventBus(LoopProperties properties, Clock clock) {
        return new EventBus(properties.getEvents().getHistoryCapacity(), clock);
    }

    @Bean
    public WorkerLauncher workerLauncher(LoopProperties properties, StateFiles stateFiles) {
        return new ProcessWorkerLauncher(properties.getWorkers().getAgentCommand(), stateFiles);
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(TaskScheduler scheduler, MergeController mergeController,
                                               HealthMonitor healthMonitor, RetryHandler retryHandler,
                                               EventBus eventBus, WorkerLauncher launcher,
                                               LoopMetrics metrics, LoopProperties properties, Clock clock) {
        LoopProperties.Workers workers = properties.getWorkers();
        var settings = new BatchOrchestrator.Settings(properties.getBaseBranch(), workers.getMaxParallel(),
                workers.timeout(), properties.getHealth().checkInterval(), workers.hungGrace(),
                properties.getGraph().isIncompleteOnly());
        return new BatchOrchestrator(scheduler, mergeController, healthMonitor, retryHandler, eventBus,
                launcher, metrics, settings, Sleeper.SYSTEM, clock);
    }
}
