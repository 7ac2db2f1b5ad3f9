package no.boreas.errors;

/**
 * Incoming rows conflict with the existing table schema (column type change,
 * missing key column). Never coerced.
 */
public class SchemaViolationException extends IngestException {
    public SchemaViolationException(String message) {
        super(message);
    }
}
