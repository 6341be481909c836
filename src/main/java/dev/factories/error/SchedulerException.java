package dev.factories.error;

/**
 * The external scheduler could not be reached, rejected a request,
 * or answered with something that could not be understood.
 */
public class SchedulerException extends FactoryException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
