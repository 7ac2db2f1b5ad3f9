package no.boreas.pipeline;

import no.boreas.partition.GeoPartition;

/**
 * Binds one partition to the work that fetches and loads its data. Built by an
 * explicit factory per partition, never by a closure over a loop variable.
 */
public record PartitionTask(String name, GeoPartition partition, Work work) {

    /**
     * Fetch/normalize/load for one partition; returns the number of rows loaded.
     */
    @FunctionalInterface
    public interface Work {
        long run(String runId) throws Exception;
    }
}
