package dev.factories.scheduler;

import java.util.Map;

/**
 * Renders a {@link JobDescription} as an sbatch script.
 */
public final class BatchScriptBuilder {

    private static final String RULE = "=========================================";

    private BatchScriptBuilder() {}

    public static String build(JobDescription job) {
        var sb = new StringBuilder();
        sb.append("#!/bin/bash -l\n\n");
        sb.append(buildDirectives(job));
        sb.append('\n');
        sb.append(buildBanner(job));
        sb.append('\n');
        sb.append("cd ").append(quote(job.workingDirectory().toString())).append("\n\n");

        if (!job.modules().isEmpty()) {
            sb.append("source /usr/share/lmod/lmod/init/bash\n");
            for (String module : job.modules()) {
                sb.append("module load ").append(module).append('\n');
            }
            sb.append('\n');
        }

        for (Map.Entry<String, String> entry : job.env().entrySet()) {
            sb.append("export ").append(entry.getKey()).append('=')
                .append(quote(entry.getValue())).append('\n');
        }
        if (!job.env().isEmpty()) {
            sb.append('\n');
        }

        sb.append(job.command().strip()).append("\n\n");
        sb.append("EXIT_CODE=$?\n\n");
        sb.append("echo \"").append(RULE).append("\"\n");
        sb.append("echo \"Job exited with code $EXIT_CODE\"\n");
        sb.append("echo \"").append(RULE).append("\"\n\n");
        sb.append("exit $EXIT_CODE\n");
        return sb.toString();
    }

    private static String buildDirectives(JobDescription job) {
        var sb = new StringBuilder();
        directive(sb, "job-name", job.jobName());
        if (job.outputLog() != null) {
            directive(sb, "output", job.outputLog().toString());
            directive(sb, "error", job.outputLog().toString());
        }
        directive(sb, "time", job.timeLimit());
        directive(sb, "qos", job.qos());
        directive(sb, "partition", job.partition());
        if (job.account() != null && !job.account().isBlank()) {
            directive(sb, "account", job.account());
        }
        directive(sb, "nodes", String.valueOf(job.nodes()));
        directive(sb, "ntasks", "1");
        directive(sb, "cpus-per-task", String.valueOf(job.cpuCores()));
        directive(sb, "mem", job.memoryGb() + "G");
        if (job.gpuCount() > 0) {
            directive(sb, "gres", "gpu:" + job.gpuCount());
        }
        return sb.toString();
    }

    private static String buildBanner(JobDescription job) {
        var sb = new StringBuilder();
        sb.append("echo \"").append(RULE).append("\"\n");
        sb.append("echo \"Date     = $(date)\"\n");
        sb.append("echo \"Hostname = $(hostname -s)\"\n");
        sb.append("echo \"Job ID   = $SLURM_JOB_ID\"\n");
        job.banner().forEach((key, value) ->
            sb.append("echo \"").append(key).append(" = ").append(escape(value)).append("\"\n"));
        sb.append("echo \"").append(RULE).append("\"\n");
        return sb.toString();
    }

    private static void directive(StringBuilder sb, String name, String value) {
        if (value != null && !value.isBlank()) {
            sb.append("#SBATCH --").append(name).append('=').append(value).append('\n');
        }
    }

    private static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    // Double-quoted shell text stays literal: no expansion or command substitution.
    private static String escape(String value) {
        return value.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("$", "\\$")
            .replace("`", "\\`");
    }
}
