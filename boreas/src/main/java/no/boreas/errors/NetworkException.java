package no.boreas.errors;

/**
 * Transport failure, timeout or non-2xx response from an upstream API.
 */
public class NetworkException extends IngestException {
    private final Integer httpStatus;

    public NetworkException(String message, Integer httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }

    /**
     * Status code of the failed response, or null when no response arrived.
     */
    public Integer httpStatus() {
        return httpStatus;
    }
}
