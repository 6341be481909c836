package dev.factories.scheduler;

import dev.factories.error.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link SchedulerGateway} driving SLURM through {@code sbatch}, {@code scancel} and {@code squeue}.
 */
public final class SlurmGateway implements SchedulerGateway {

    private static final Logger log = LoggerFactory.getLogger(SlurmGateway.class);

    private static final Pattern HANDLE = Pattern.compile("\\d+(_\\d+)?");
    private static final List<String> GONE_MARKERS = List.of(
        "invalid job id", "already completed", "has already finished");

    private final CommandRunner runner;
    private final Duration commandTimeout;
    private final Path scriptDirectory;

    /**
     * @param scriptDirectory where batch scripts are staged before submission; null for the system temp dir
     */
    public SlurmGateway(CommandRunner runner, Duration commandTimeout, Path scriptDirectory) {
        this.runner = runner;
        this.commandTimeout = commandTimeout;
        this.scriptDirectory = scriptDirectory;
    }

    @Override
    public String submit(JobDescription job) {
        String script = BatchScriptBuilder.build(job);
        Path scriptFile = null;
        try {
            scriptFile = scriptDirectory == null
                ? Files.createTempFile("ai-factories-", ".sh")
                : Files.createTempFile(Files.createDirectories(scriptDirectory), "ai-factories-", ".sh");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);

            CommandResult result = runner.run(List.of("sbatch", scriptFile.toString()), commandTimeout);
            if (!result.succeeded()) {
                throw new SchedulerException("Job submission failed for %s: %s"
                    .formatted(job.jobName(), describe(result)));
            }
            String handle = parseHandle(result.stdout());
            log.info("Submitted {} as job {}", job.jobName(), handle);
            return handle;
        } catch (IOException e) {
            throw new SchedulerException("Could not run sbatch for " + job.jobName() + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(scriptFile);
        }
    }

    @Override
    public boolean cancel(String handle) {
        CommandResult result = execute(List.of("scancel", handle));
        if (result.succeeded() && !reportsGone(result)) {
            log.info("Cancelled job {}", handle);
            return true;
        }
        if (reportsGone(result)) {
            log.debug("Job {} already gone: {}", handle, describe(result));
            return false;
        }
        throw new SchedulerException("Failed to cancel job %s: %s".formatted(handle, describe(result)));
    }

    @Override
    public JobStatus queryStatus(String handle) {
        CommandResult result = execute(List.of("squeue", "-j", handle, "--format=%T,%N", "--noheader"));
        if (!result.succeeded()) {
            if (reportsGone(result)) {
                return JobStatus.gone();
            }
            throw new SchedulerException("Failed to query job %s: %s".formatted(handle, describe(result)));
        }

        String output = Objects.toString(result.stdout(), "").strip();
        if (output.isEmpty()) {
            return JobStatus.gone();
        }
        String[] parts = output.lines().findFirst().orElse("").split(",", 2);
        JobState state = SchedulerStates.map(parts[0]);
        if (state == JobState.UNKNOWN) {
            log.debug("Job {} reported unrecognised state '{}'", handle, parts[0]);
        }
        String node = parts.length > 1 ? parts[1].trim() : null;
        return new JobStatus(state, node == null || node.isEmpty() ? null : node);
    }

    @Override
    public String getName() {
        return "slurm";
    }

    private CommandResult execute(List<String> command) {
        try {
            return runner.run(command, commandTimeout);
        } catch (IOException e) {
            throw new SchedulerException("Could not run %s: %s".formatted(command.get(0), e.getMessage()), e);
        }
    }

    private static String parseHandle(String stdout) {
        String trimmed = stdout == null ? "" : stdout.strip();
        if (trimmed.isEmpty()) {
            throw new SchedulerException("Unexpected empty response from sbatch");
        }
        String[] tokens = trimmed.split("\\s+");
        String handle = tokens[tokens.length - 1];
        if (!HANDLE.matcher(handle).matches()) {
            throw new SchedulerException("Malformed job handle in sbatch response: " + trimmed);
        }
        return handle;
    }

    private static boolean reportsGone(CommandResult result) {
        String text = (Objects.toString(result.stderr(), "") + " " + Objects.toString(result.stdout(), ""))
            .toLowerCase(Locale.ROOT);
        return GONE_MARKERS.stream().anyMatch(text::contains);
    }

    private static String describe(CommandResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().strip();
        return stderr.isEmpty() ? "exit code " + result.exitCode() : stderr;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete batch script {}", file, e);
        }
    }
}
