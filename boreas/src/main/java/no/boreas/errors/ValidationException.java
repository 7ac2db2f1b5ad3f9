package no.boreas.errors;

/**
 * Malformed configuration or invocation, detected at startup.
 */
public class ValidationException extends IngestException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
