package dev.factories.engine;

import dev.factories.discovery.DiscoveryStore;
import dev.factories.error.ResolutionTimeoutException;
import dev.factories.error.SchedulerException;
import dev.factories.model.DiscoveryRecord;
import dev.factories.model.TargetSpec;
import dev.factories.scheduler.JobState;
import dev.factories.scheduler.JobStatus;
import dev.factories.scheduler.SchedulerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns a {@link TargetSpec} into a connectable {@code host:port}.
 * <p>
 * Sources are tried in order: the target's direct endpoint, a complete
 * discovery record, then polling the scheduler for the target's job until it
 * runs on a node. Polling is bounded by a caller-supplied timeout; nothing is
 * ever guessed.
 */
public final class EndpointResolver {

    private static final Logger log = LoggerFactory.getLogger(EndpointResolver.class);

    private final SchedulerGateway gateway;
    private final DiscoveryStore discovery;
    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;

    public EndpointResolver(SchedulerGateway gateway, DiscoveryStore discovery, Duration interval,
                            Clock clock, Sleeper sleeper) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        this.gateway = gateway;
        this.discovery = discovery;
        this.interval = interval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * @throws ResolutionTimeoutException if no source yields an endpoint within {@code timeout}
     */
    public ResolvedEndpoint resolve(TargetSpec target, Duration timeout) {
        if (target.hasEndpoint()) {
            log.debug("Target {} uses configured endpoint {}", target.name(), target.endpoint());
            return new ResolvedEndpoint(target.name(), target.endpoint(), ResolvedEndpoint.Source.DIRECT);
        }

        Optional<DiscoveryRecord> record = discovery.lookup(target.discoveryKey());
        if (record.isPresent()) {
            Optional<String> endpoint = record.get().endpoint(target.port());
            if (endpoint.isPresent()) {
                log.debug("Target {} discovered at {} (job {})", target.name(), endpoint.get(), record.get().jobId());
                return new ResolvedEndpoint(target.name(), endpoint.get(), ResolvedEndpoint.Source.DISCOVERY);
            }
            log.debug("Discovery record for {} is incomplete, ignoring it", target.discoveryKey());
        }

        if (!target.hasJobHandle()) {
            throw new ResolutionTimeoutException(
                "Target '%s' has no endpoint, is not discoverable as '%s' and has no job to poll"
                    .formatted(target.name(), target.discoveryKey()));
        }

        Placement placement = awaitPlacement(target.jobHandle(), timeout);
        String hostPort = placement.node() + ":" + target.port();
        log.info("Target {} resolved to {} via job {}", target.name(), hostPort, placement.handle());
        return new ResolvedEndpoint(target.name(), hostPort, ResolvedEndpoint.Source.SCHEDULER);
    }

    /**
     * Poll the scheduler until the job runs on a node.
     *
     * @throws ResolutionTimeoutException on timeout, interruption, or when the
     *         job ends before it was ever placed
     */
    public Placement awaitPlacement(String handle, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        JobState lastState = null;
        int attempts = 0;

        while (true) {
            attempts++;
            try {
                JobStatus status = gateway.queryStatus(handle);
                if (status.state() != lastState) {
                    log.info("Job {} is {}{}", handle, status.state(),
                        status.hasNode() ? " on " + status.node() : "");
                    lastState = status.state();
                }
                if (status.isPlaced()) {
                    return new Placement(handle, status.node());
                }
                if (status.state().isTerminal()) {
                    throw new ResolutionTimeoutException(
                        "Job %s reached %s before it was placed".formatted(handle, status.state()));
                }
            } catch (SchedulerException e) {
                log.warn("Status query for job {} failed (attempt {}): {}", handle, attempts, e.getMessage());
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new ResolutionTimeoutException("Job %s was not placed within %s (last state: %s, %d polls)"
                    .formatted(handle, timeout, lastState == null ? "unknown" : lastState, attempts));
            }
            pause(handle, remaining.compareTo(interval) < 0 ? remaining : interval);
        }
    }

    private void pause(String handle, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionTimeoutException("Interrupted while waiting for job " + handle, e);
        }
    }
}
