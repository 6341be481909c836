package dev.factories.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.factories.error.FactoryException;
import dev.factories.model.DiscoveryRecord;
import dev.factories.util.AtomicFiles;
import dev.factories.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed registry of service locations shared between processes:
 * one {@code <service>.json} per service in a single directory.
 * <p>
 * The directory is created on first write. Writes replace the whole file;
 * the last writer for a service wins. There is no locking, so a single writer
 * per service at a time is assumed.
 */
public final class DiscoveryStore {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper = Mappers.documentMapper();

    public DiscoveryStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path pathFor(String serviceName) {
        if (!isValidServiceName(serviceName)) {
            throw new FactoryException("Invalid service name: " + serviceName);
        }
        return directory.resolve(serviceName + SUFFIX);
    }

    /**
     * Whether {@code serviceName} maps to a file directly inside the discovery directory.
     */
    public static boolean isValidServiceName(String serviceName) {
        return serviceName != null && !serviceName.isBlank()
            && !serviceName.contains("/") && !serviceName.contains("\\") && !serviceName.contains("..");
    }

    public void publish(DiscoveryRecord record) {
        Path file = pathFor(record.serviceName());
        var document = new DiscoveryFile(record.serviceName(), record.jobId(), record.node(),
            record.ports(), record.instanceId(), record.updatedAt());
        try {
            AtomicFiles.write(file, mapper.writeValueAsBytes(document));
        } catch (IOException e) {
            throw new FactoryException("Failed to write discovery record for " + record.serviceName(), e);
        }
        log.info("Published {} -> {} {} (job {})", record.serviceName(), record.node(), record.ports(), record.jobId());
    }

    /**
     * Read the record for a service. A missing or unreadable file is reported as absent.
     */
    public Optional<DiscoveryRecord> lookup(String serviceName) {
        Path file = pathFor(serviceName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            DiscoveryFile document = mapper.readValue(file.toFile(), DiscoveryFile.class);
            String name = document.serviceName() == null ? serviceName : document.serviceName();
            return Optional.of(new DiscoveryRecord(name, document.jobId(), document.node(),
                document.ports(), document.instanceId(), document.updatedAt()));
        } catch (IOException e) {
            log.warn("Ignoring unreadable discovery file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean clear(String serviceName) {
        try {
            boolean deleted = Files.deleteIfExists(pathFor(serviceName));
            if (deleted) {
                log.info("Cleared discovery record for {}", serviceName);
            }
            return deleted;
        } catch (IOException e) {
            throw new FactoryException("Failed to clear discovery record for " + serviceName, e);
        }
    }

    public List<String> listServices() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new FactoryException("Failed to list discovery directory " + directory, e);
        }
    }

    /** On-disk shape of a discovery file. */
    record DiscoveryFile(
        String serviceName,
        String jobId,
        String node,
        List<Integer> ports,
        String instanceId,
        Instant updatedAt
    ) {}
}
