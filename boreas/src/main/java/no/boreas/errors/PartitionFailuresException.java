package no.boreas.errors;

import java.util.List;

/**
 * Raised by a pipeline after all of its partitions ran and at least one failed.
 * The first partition failure is attached as the cause.
 */
public class PartitionFailuresException extends IngestException {
    private final List<String> failedPartitions;

    public PartitionFailuresException(String pipeline, List<String> failedPartitions, Throwable firstCause) {
        super(pipeline + ": " + failedPartitions.size() + " partition(s) failed " + failedPartitions, firstCause);
        this.failedPartitions = List.copyOf(failedPartitions);
    }

    public List<String> failedPartitions() {
        return failedPartitions;
    }
}
