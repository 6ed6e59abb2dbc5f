package io.datajob4j.internal.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.datajob4j.JobRegistry;
import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job registry kept as one JSON array in a file.
 *
 * <p>Every call reads the whole file under a lock; mutations rewrite it through a temp file and an atomic move.
 * Records that fail validation are skipped on read but written back untouched, so a hand edit is never lost.
 * A file that is not a JSON array raises {@link RegistryException} rather than being overwritten.
 */
public class FileJobRegistry implements JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(FileJobRegistry.class);

    private static final String NAME_FIELD = "job_name";

    private final Path path;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public FileJobRegistry(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() {
        return path;
    }

    @Override
    public List<JobDefinition> findAll() {
        lock.lock();
        try {
            List<JobDefinition> jobs = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (JsonNode node : load()) {
                JobDefinition job = toJob(node);
                if (job == null) {
                    continue;
                }
                if (!seen.add(job.name())) {
                    log.warn("datajob registry has a duplicate record, keeping the first name={} path={}", job.name(), path);
                    continue;
                }
                jobs.add(job);
            }
            return jobs;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobDefinition> find(String name) {
        Objects.requireNonNull(name, "name must not be null");
        lock.lock();
        try {
            ArrayNode nodes = load();
            int idx = indexOf(nodes, name);
            return idx < 0 ? Optional.empty() : Optional.ofNullable(toJob(nodes.get(idx)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String name) {
        Objects.requireNonNull(name, "name must not be null");
        lock.lock();
        try {
            return indexOf(load(), name) >= 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean insert(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            ArrayNode nodes = load();
            if (indexOf(nodes, job.name()) >= 0) {
                return false;
            }
            nodes.add(objectMapper.valueToTree(job));
            store(nodes);
            log.debug("datajob registry inserted name={}", job.name());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean save(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.lock();
        try {
            ArrayNode nodes = load();
            JsonNode node = objectMapper.valueToTree(job);
            int idx = indexOf(nodes, job.name());
            if (idx >= 0) {
                nodes.set(idx, node);
            } else {
                nodes.add(node);
            }
            store(nodes);
            log.debug("datajob registry saved name={} created={}", job.name(), idx < 0);
            return idx < 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        lock.lock();
        try {
            ArrayNode nodes = load();
            int idx = indexOf(nodes, name);
            if (idx < 0) {
                return false;
            }
            nodes.remove(idx);
            store(nodes);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean updateLastRun(String name, Instant lastRun) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(lastRun, "lastRun must not be null");
        lock.lock();
        try {
            ArrayNode nodes = load();
            int idx = indexOf(nodes, name);
            if (idx < 0) {
                return false;
            }
            ((ObjectNode) nodes.get(idx)).set("last_run", objectMapper.valueToTree(lastRun));
            store(nodes);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private ArrayNode load() {
        try {
            if (!Files.exists(path) || Files.size(path) == 0) {
                return objectMapper.createArrayNode();
            }
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || root.isMissingNode()) {
                return objectMapper.createArrayNode();
            }
            if (!root.isArray()) {
                throw new RegistryException("Job registry " + path + " must contain a JSON array, found " + root.getNodeType());
            }
            return (ArrayNode) root;
        } catch (IOException e) {
            throw new RegistryException("Failed to read job registry " + path + ": " + e.getMessage(), e);
        }
    }

    private void store(ArrayNode nodes) {
        try {
            Path dir = path.getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), nodes);
                try {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new RegistryException("Failed to write job registry " + path + ": " + e.getMessage(), e);
        }
    }

    private JobDefinition toJob(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, JobDefinition.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("datajob registry record skipped name={} path={} msg={}",
                    node.path(NAME_FIELD).asText("?"), path, e.getMessage());
            return null;
        }
    }

    private static int indexOf(ArrayNode nodes, String name) {
        String wanted = name.trim();
        for (int i = 0; i < nodes.size(); i++) {
            if (wanted.equals(nodes.get(i).path(NAME_FIELD).asText("").trim())) {
                return i;
            }
        }
        return -1;
    }
}
