package com.storyloop.dispatch.cli;

import com.storyloop.core.retry.RetryHandler;
import com.storyloop.core.retry.RetryRecord;
import com.storyloop.core.retry.RetryStats;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: storyloop retries
 * <p>
 * Summarises the retry log, or lists the decisions for one task.
 */
@Command(name = "retries", mixinStandardHelpOptions = true, description = "Show retry statistics")
@Component
public class RetriesCommand implements Runnable {

    @Option(names = "--task", description = "Show the retry history of one task")
    private String taskId;

    private final RetryHandler retryHandler;

    public RetriesCommand(RetryHandler retryHandler) {
        this.retryHandler = retryHandler;
    }

    @Override
    public void run() {
        if (taskId != null) {
            List<RetryRecord> records = retryHandler.history(taskId);
            if (records.isEmpty()) {
                ConsoleOutput.info("No retry decisions recorded for " + taskId);
                return;
            }
            records.forEach(RetriesCommand::print);
            return;
        }

        RetryStats stats = retryHandler.stats();
        ConsoleOutput.info("Total retries: " + stats.totalRetries());
        stats.byTask().forEach((task, count) -> System.out.println("    " + task + ": " + count));
        if (!stats.byFailureType().isEmpty()) {
            ConsoleOutput.info("By failure type:");
            stats.byFailureType().forEach((type, count) -> System.out.println("    " + type + ": " + count));
        }
        if (!stats.recent().isEmpty()) {
            ConsoleOutput.info("Recent decisions:");
            stats.recent().forEach(RetriesCommand::print);
        }
    }

    private static void print(RetryRecord record) {
        String line = record.timestamp() + " " + record.taskId() + " attempt " + record.attempt()
                + " [" + record.failureType() + "] " + record.reason();
        if (record.willRetry()) {
            ConsoleOutput.success(line);
        } else {
            ConsoleOutput.error(line);
        }
    }
}
