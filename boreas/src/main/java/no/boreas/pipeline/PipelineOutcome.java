package no.boreas.pipeline;

/**
 * How one pipeline ended: rows loaded on success, the cause on failure.
 */
public record PipelineOutcome(String name, String runId, long rowsLoaded, long elapsedMs, Exception error) {
    public boolean success() {
        return error == null;
    }
}
