package dev.factories.scheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws IOException when the command cannot be started or does not finish within {@code timeout}
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException;
}
