package dev.devanks.energy.ingestor.exception;

/**
 * The source rejected the request or returned something unusable. Retrying will not help.
 */
public class PermanentSourceException extends IngestionException {
    public PermanentSourceException(String message) {
        super(message);
    }

    public PermanentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
