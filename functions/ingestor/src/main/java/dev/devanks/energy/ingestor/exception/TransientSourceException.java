package dev.devanks.energy.ingestor.exception;

/**
 * Rate limiting or a network failure at the telemetry source. Worth retrying after a backoff.
 */
public class TransientSourceException extends IngestionException {
    public TransientSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
