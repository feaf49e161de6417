package com.storyloop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration bound from {@code storyloop.*}.
 */
@ConfigurationProperties(prefix = "storyloop")
public class LoopProperties {

    /** Directory holding heartbeats, logs, locks and worktrees */
    private String stateDir = ".storyloop";

    /** Branch that completed work is merged into */
    private String baseBranch = "main";

    /** Repository the worktrees are created from */
    private String repoPath = ".";

    private Graph graph = new Graph();
    private Workers workers = new Workers();
    private Health health = new Health();
    private Retry retry = new Retry();
    private Merge merge = new Merge();
    private Events events = new Events();

    public Path stateDirPath() {
        return Path.of(stateDir);
    }

    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public String getBaseBranch() { return baseBranch; }
    public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
    public String getRepoPath() { return repoPath; }
    public void setRepoPath(String repoPath) { this.repoPath = repoPath; }
    public Graph getGraph() { return graph; }
    public void setGraph(Graph graph) { this.graph = graph; }
    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Merge getMerge() { return merge; }
    public void setMerge(Merge merge) { this.merge = merge; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    public static class Graph {
        /** Leave stories already marked as passing out of planning */
        private boolean incompleteOnly = true;

        public boolean isIncompleteOnly() { return incompleteOnly; }
        public void setIncompleteOnly(boolean incompleteOnly) { this.incompleteOnly = incompleteOnly; }
    }

    public static class Workers {
        private int maxParallel = 3;
        private int timeoutSeconds = 1800;
        /** Agent executable and leading arguments; the task id is appended */
        private List<String> agentCommand = new ArrayList<>(List.of("claude-loop-worker"));
        private String branchPrefix = "worker/";
        private int hungGraceSeconds = 60;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public List<String> getAgentCommand() { return agentCommand; }
        public void setAgentCommand(List<String> agentCommand) { this.agentCommand = agentCommand; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public int getHungGraceSeconds() { return hungGraceSeconds; }
        public void setHungGraceSeconds(int hungGraceSeconds) { this.hungGraceSeconds = hungGraceSeconds; }

        public Duration timeout() { return Duration.ofSeconds(timeoutSeconds); }
        public Duration hungGrace() { return Duration.ofSeconds(hungGraceSeconds); }
    }

    public static class Health {
        /** Expected heartbeat period; informational for agents */
        private int heartbeatIntervalSeconds = 30;
        private int hungThresholdSeconds = 120;
        private int deadThresholdSeconds = 300;
        private int checkIntervalSeconds = 15;

        public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
        public void setHeartbeatIntervalSeconds(int heartbeatIntervalSeconds) { this.heartbeatIntervalSeconds = heartbeatIntervalSeconds; }
        public int getHungThresholdSeconds() { return hungThresholdSeconds; }
        public void setHungThresholdSeconds(int hungThresholdSeconds) { this.hungThresholdSeconds = hungThresholdSeconds; }
        public int getDeadThresholdSeconds() { return deadThresholdSeconds; }
        public void setDeadThresholdSeconds(int deadThresholdSeconds) { this.deadThresholdSeconds = deadThresholdSeconds; }
        public int getCheckIntervalSeconds() { return checkIntervalSeconds; }
        public void setCheckIntervalSeconds(int checkIntervalSeconds) { this.checkIntervalSeconds = checkIntervalSeconds; }

        public Duration hungThreshold() { return Duration.ofSeconds(hungThresholdSeconds); }
        public Duration deadThreshold() { return Duration.ofSeconds(deadThresholdSeconds); }
        public Duration checkInterval() { return Duration.ofSeconds(checkIntervalSeconds); }
    }

    public static class Retry {
        private int maxRetries = 3;
        private int baseBackoffSeconds = 60;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getBaseBackoffSeconds() { return baseBackoffSeconds; }
        public void setBaseBackoffSeconds(int baseBackoffSeconds) { this.baseBackoffSeconds = baseBackoffSeconds; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    public static class Merge {
        private int lockTimeoutSeconds = 30;

        public int getLockTimeoutSeconds() { return lockTimeoutSeconds; }
        public void setLockTimeoutSeconds(int lockTimeoutSeconds) { this.lockTimeoutSeconds = lockTimeoutSeconds; }

        public Duration lockTimeout() { return Duration.ofSeconds(lockTimeoutSeconds); }
    }

    public static class Events {
        private int historyCapacity = 1000;

        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
    }
}
