package dev.devanks.energy.common.exception;

/**
 * Raised when the time-series store cannot complete a read or write.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
