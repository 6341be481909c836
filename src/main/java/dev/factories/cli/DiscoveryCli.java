package dev.factories.cli;

import dev.factories.model.DiscoveryRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code ai-factories discovery ...}: inspect and repair published service locations.
 */
@Command(name = "discovery", mixinStandardHelpOptions = true, description = "Manage service discovery records")
public class DiscoveryCli {

    @ParentCommand
    private FactoriesCli parent;

    @Command(name = "list", description = "Show published services")
    int list() {
        List<DiscoveryRecord> records = parent.manager().listDiscovered();
        if (records.isEmpty()) {
            parent.out().println("No services published");
            return 0;
        }
        for (DiscoveryRecord record : records) {
            String ports = record.ports().stream().map(String::valueOf).collect(Collectors.joining(","));
            parent.out().printf("%-24s job %-10s %s:%s%n", record.serviceName(), record.jobId(),
                record.node() == null ? "?" : record.node(), ports.isEmpty() ? "?" : ports);
        }
        return 0;
    }

    @Command(name = "clear", description = "Remove a service's record")
    int clear(@Parameters(paramLabel = "SERVICE") String service) {
        boolean removed = parent.manager().clearDiscovered(service);
        parent.out().println(removed ? "Cleared " + service : "No record for " + service);
        return 0;
    }

    @Command(name = "update", description = "Re-read a service's node from the scheduler")
    int update(
        @Parameters(paramLabel = "SERVICE") String service,
        @Option(names = "--job", description = "Job id, when no record exists yet") String jobId
    ) {
        DiscoveryRecord record = parent.manager().updateDiscovery(service, jobId);
        parent.out().printf("%s -> %s %s (job %s)%n", record.serviceName(), record.node(), record.ports(),
            record.jobId());
        return 0;
    }
}
