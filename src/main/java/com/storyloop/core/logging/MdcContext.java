package com.storyloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing storyloop-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String WORKER_ID = "workerId";
    public static final String BATCH_NUMBER = "batchNumber";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setBatch(String runId, String batchLabel) {
        MDC.put(RUN_ID, runId);
        MDC.put(BATCH_NUMBER, batchLabel);
    }

    public static void setWorker(String runId, String taskId, String workerId) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
        MDC.put(WORKER_ID, workerId);
    }

    /** Clears task and worker keys, keeping run and batch for the surrounding loop. */
    public static void clearWorker() {
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
        MDC.remove(BATCH_NUMBER);
    }
}
