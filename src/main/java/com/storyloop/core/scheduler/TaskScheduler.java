package com.storyloop.core.scheduler;

import com.storyloop.core.graph.DependencyGraph;
import com.storyloop.core.merge.ConflictCheck;
import com.storyloop.core.merge.MergeController;
import com.storyloop.core.model.Task;
import com.storyloop.core.model.Wave;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Computes the full dispatch sequence: dependency batches from the graph, each split by
 * file scope into one parallel wave plus trailing single-task waves.
 *
 * <p>Dependency ordering always wins over file-scope splitting. A task never moves out of
 * its own graph batch, and every wave of batch N comes before any wave of batch N+1, so a
 * dependent can never be dispatched alongside or ahead of its prerequisite.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final MergeController mergeController;

    public TaskScheduler(MergeController mergeController) {
        this.mergeController = mergeController;
    }

    /**
     * @param graph  built dependency graph
     * @param subset task ids to schedule
     * @return waves in dispatch order; empty if the subset is empty
     * @throws com.storyloop.core.graph.GraphException if the subset contains a cycle
     */
    public List<Wave> computeWaves(DependencyGraph graph, Set<String> subset) {
        graph.requireAcyclic(subset);
        List<List<String>> batches = graph.parallelBatches(subset);

        log.info("computeWaves: {} tasks in {} dependency batch(es)", subset.size(), batches.size());

        List<Wave> waves = new ArrayList<>();
        for (int i = 0; i < batches.size(); i++) {
            List<Task> members = batches.get(i).stream().map(graph::task).toList();
            ConflictCheck check = mergeController.checkConflicts(members);
            List<Wave> split = check.waves(i + 1);
            if (check.hasConflicts()) {
                log.info("  batch {} split into {} wave(s) due to {} file-scope conflict(s)",
                        i + 1, split.size(), check.conflicts().size());
            }
            waves.addAll(split);
        }
        return waves;
    }
}
