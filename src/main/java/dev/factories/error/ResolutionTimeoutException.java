package dev.factories.error;

/**
 * An endpoint or placement did not become available within the allotted time.
 */
public class ResolutionTimeoutException extends FactoryException {

    public ResolutionTimeoutException(String message) {
        super(message);
    }

    public ResolutionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
