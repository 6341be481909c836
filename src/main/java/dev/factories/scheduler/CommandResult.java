package dev.factories.scheduler;

/**
 * Outcome of an external command.
 */
public record CommandResult(
    int exitCode,
    String stdout,
    String stderr
) {
    public boolean succeeded() {
        return exitCode == 0;
    }
}
