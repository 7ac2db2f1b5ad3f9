package no.boreas.pipeline;

/**
 * One named ingestion pipeline.
 */
public interface Pipeline {
    String name();

    /**
     * Runs the pipeline under {@code runId} and returns the number of rows loaded.
     */
    long run(String runId) throws Exception;
}
