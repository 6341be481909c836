package dev.factories.error;

import java.util.List;

/**
 * A multi-part deploy or teardown where some, but not all, parts succeeded.
 * Every part was attempted before this is thrown.
 */
public class PartialFailureException extends FactoryException {

    private final List<String> succeeded;
    private final List<String> failed;

    public PartialFailureException(String message, List<String> succeeded, List<String> failed) {
        this(message, succeeded, failed, null);
    }

    public PartialFailureException(String message, List<String> succeeded, List<String> failed, Throwable cause) {
        super("%s (succeeded: %s, failed: %s)".formatted(message, succeeded, failed), cause);
        this.succeeded = List.copyOf(succeeded);
        this.failed = List.copyOf(failed);
    }

    public List<String> succeeded() { return succeeded; }
    public List<String> failed() { return failed; }
}
