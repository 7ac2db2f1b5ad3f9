package no.boreas.pipeline;

/**
 * Result of one partition task within one pipeline run.
 */
public record PartitionOutcome(String taskName, String partitionId, long rowsLoaded, Exception error) {
    public boolean success() {
        return error == null;
    }
}
