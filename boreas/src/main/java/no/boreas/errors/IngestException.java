package no.boreas.errors;

/**
 * Base type for every domain failure raised while ingesting data.
 *
 * <p>
 * Fetch- and parse-level failures are not recovered where they occur; they travel
 * up to partition scope and from there to pipeline scope, where they are recorded.
 * </p>
 */
public class IngestException extends Exception {
    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
