package dev.factories.error;

/**
 * Base type for every failure the orchestration engine reports to its callers.
 */
public class FactoryException extends RuntimeException {

    public FactoryException(String message) {
        super(message);
    }

    public FactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
