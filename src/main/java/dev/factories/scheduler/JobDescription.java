package dev.factories.scheduler;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the scheduler needs to run one job, independent of its submission syntax.
 *
 * @param jobName          scheduler job name
 * @param account          nullable; omitted from the submission when absent
 * @param gpuCount         zero for CPU-only jobs
 * @param workingDirectory absolute directory the command starts in
 * @param env              variables exported before the command, in order
 * @param modules          environment modules loaded before the command
 * @param command          shell text to run; may span several lines
 * @param outputLog        nullable; scheduler default when absent
 * @param banner           identifying key/values echoed into the job log
 */
public record JobDescription(
    String jobName,
    String timeLimit,
    String partition,
    String account,
    String qos,
    int nodes,
    int cpuCores,
    int memoryGb,
    int gpuCount,
    Path workingDirectory,
    Map<String, String> env,
    List<String> modules,
    String command,
    Path outputLog,
    Map<String, String> banner
) {
    public JobDescription {
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        modules = modules == null ? List.of() : List.copyOf(modules);
        banner = banner == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(banner));
    }
}
