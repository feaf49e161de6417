package com.storyloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A group of tasks dispatched concurrently. Each graph batch yields one parallel wave
 * of file-scope-disjoint members followed by one single-task wave per member that had
 * to be pulled out because of a conflict.
 *
 * @param batchNumber 1-based graph batch this wave belongs to
 * @param subBatch    0 for the parallel wave, 1..n for the trailing sequential waves
 * @param taskIds     members in priority order
 */
public record Wave(int batchNumber, int subBatch, List<String> taskIds) implements Serializable {

    public Wave {
        taskIds = List.copyOf(taskIds);
    }

    public boolean isSequential() {
        return subBatch > 0;
    }

    public String label() {
        return subBatch == 0 ? String.valueOf(batchNumber) : batchNumber + "." + subBatch;
    }
}
