package com.migratorx.workflow.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CheckpointState} persisted as a JSON document.
 *
 * <p>The file is loaded once at construction (a missing file is created empty) and rewritten
 * synchronously on every {@link #set} and {@link #markCompleted}: the new content goes to a
 * sibling temp file which is then moved over the original, so a crash never leaves a truncated
 * document behind. A write that cannot be persisted is rolled back in memory as well, so the
 * instance never reports a checkpoint the file does not hold.
 *
 * <pre>
 * {
 *   "values" : { "replica_upgrade:mysql-replica-1:stopped" : true },
 *   "completed" : [ "preflight" ]
 * }
 * </pre>
 *
 * <p>There is no lease or lock across processes: two invocations sharing the same file overwrite
 * each other's checkpoints.
 */
public final class FileCheckpointState implements CheckpointState {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointState.class);

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<CheckpointKey, Object> values = new LinkedHashMap<>();
    private final Set<String> completed = new LinkedHashSet<>();

    /**
     * Opens (or creates) the state file.
     *
     * @throws StateStoreException if the file exists but cannot be read or parsed, or cannot be
     *     created
     */
    public FileCheckpointState(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("state path is required");
        }
        this.path = path.toAbsolutePath();
        load();
    }

    @Override
    public Optional<Object> get(CheckpointKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(values.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(CheckpointKey key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        Object scalar = CheckpointState.requireScalar(value);
        lock.lock();
        try {
            boolean existed = values.containsKey(key);
            Object previous = values.put(key, scalar);
            try {
                persist();
            } catch (StateStoreException e) {
                if (existed) {
                    values.put(key, previous);
                } else {
                    values.remove(key);
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markCompleted(String stepName) {
        InMemoryCheckpointState.requireStepName(stepName);
        lock.lock();
        try {
            boolean added = completed.add(stepName);
            try {
                persist();
            } catch (StateStoreException e) {
                if (added) {
                    completed.remove(stepName);
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isCompleted(String stepName) {
        lock.lock();
        try {
            return completed.contains(stepName);
        } finally {
            lock.unlock();
        }
    }

    public Path path() {
        return path;
    }

    private void load() {
        if (Files.notExists(path)) {
            log.info("Creating new checkpoint state at {}", path);
            persist();
            return;
        }
        try {
            if (Files.size(path) == 0) {
                return;
            }
            StateDocument document = MAPPER.readValue(path.toFile(), StateDocument.class);
            if (document.values() != null) {
                document.values().forEach((k, v) -> values.put(CheckpointKey.decode(k), v));
            }
            if (document.completed() != null) {
                completed.addAll(document.completed());
            }
            log.debug("Loaded {} checkpoints and {} completed steps from {}",
                    values.size(), completed.size(), path);
        } catch (IOException | IllegalArgumentException e) {
            throw new StateStoreException("Failed to load checkpoint state from " + path, e);
        }
    }

    private void persist() {
        Map<String, Object> encoded = new LinkedHashMap<>();
        values.forEach((k, v) -> encoded.put(k.encode(), v));
        StateDocument document = new StateDocument(encoded, new ArrayList<>(completed));
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discard(temp);
            throw new StateStoreException("Failed to persist checkpoint state to " + path, e);
        }
    }

    private static void discard(Path temp) {
        if (!Files.isRegularFile(temp)) {
            return;
        }
        try {
            Files.delete(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}", temp, e);
        }
    }

    /**
     * On-disk layout.
     *
     * @param values    encoded checkpoint key to scalar value
     * @param completed completed step names in completion order
     */
    record StateDocument(Map<String, Object> values, List<String> completed) {}
}
