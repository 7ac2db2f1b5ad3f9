package no.boreas.errors;

/**
 * Upstream payload is missing expected structure or has the wrong shape.
 */
public class ApiFormatException extends IngestException {
    public ApiFormatException(String message) {
        super(message);
    }

    public ApiFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
