package com.verlumen.curvestream.checkpoint;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.curvestream.model.SequenceId;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the last delivered event id in a small JSON file: {@code {"last_id": "<id>"}}.
 *
 * <p>The file is created, along with missing parent directories, when it does not exist. Reads and
 * writes share one lock, and writes replace the file atomically, so a reader never sees a partial
 * file.
 */
final class FileCheckpointStore implements CheckpointStore {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private static final String LAST_ID_KEY = "last_id";

    private final Path path;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();
    private long lastWriteNanos;
    private boolean hasWritten;

    private FileCheckpointStore(Path path, Ticker ticker) {
        this.path = path;
        this.ticker = ticker;
    }

    /**
     * Opens the checkpoint file at {@code path}, creating it if absent.
     *
     * @throws CheckpointException if the path exists but is not a regular file, if it lacks read or
     *     write permission, or if it cannot be created
     */
    static FileCheckpointStore open(Path path) {
        return open(path, Ticker.systemTicker());
    }

    @VisibleForTesting
    static FileCheckpointStore open(Path path, Ticker ticker) {
        checkNotNull(path, "path");
        FileCheckpointStore store = new FileCheckpointStore(path.toAbsolutePath(), ticker);
        store.setUp();
        return store;
    }

    Path path() {
        return path;
    }

    @Override
    public Optional<SequenceId> read() {
        lock.lock();
        try {
            return readUnlocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean write(SequenceId id, Duration minInterval) {
        checkNotNull(id, "id");
        lock.lock();
        try {
            long now = ticker.read();
            if (!minInterval.isZero()
                    && hasWritten
                    && now - lastWriteNanos < minInterval.toNanos()) {
                logger.atFinest().log("Skipping checkpoint write of %s, last write was too recent", id);
                return false;
            }
            Optional<SequenceId> current = readUnlocked();
            if (current.isPresent() && current.get().compareTo(id) > 0) {
                logger.atFine().log("Kept checkpoint %s, newer than %s", current.get(), id);
                return false;
            }
            replaceContents(id);
            lastWriteNanos = now;
            hasWritten = true;
            logger.atFine().log("Wrote checkpoint %s to %s", id, path);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void setUp() {
        if (Files.exists(path)) {
            if (!Files.isRegularFile(path)) {
                throw new CheckpointException(
                    String.format("Checkpoint path '%s' exists but it is not a file", path));
            }
            if (!Files.isReadable(path)) {
                throw new CheckpointException(
                    String.format("Missing read-access to checkpoint file: '%s'", path));
            }
            if (!Files.isWritable(path)) {
                throw new CheckpointException(
                    String.format("Missing write-access to checkpoint file: '%s'", path));
            }
            logger.atInfo().log("Using checkpoint file %s, last id: %s", path, read().orElse(null));
            return;
        }

        Path parent = path.getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CheckpointException(
                String.format("Failed to create parent directory '%s' for checkpoint file", parent), e);
        }
        if (!Files.isWritable(parent)) {
            throw new CheckpointException(
                String.format(
                    "Checkpoint file '%s' does not exist and missing write-access to parent directory: '%s'",
                    path, parent));
        }
        JsonObject empty = new JsonObject();
        empty.addProperty(LAST_ID_KEY, "");
        try {
            Files.writeString(path, empty.toString(), UTF_8);
        } catch (IOException e) {
            throw new CheckpointException(
                String.format("Failed to create checkpoint file '%s'", path), e);
        }
        logger.atInfo().log("Created checkpoint file %s", path);
    }

    private Optional<SequenceId> readUnlocked() {
        String contents;
        try {
            contents = Files.readString(path, UTF_8);
        } catch (IOException e) {
            throw new CheckpointException(
                String.format("Failed to read checkpoint file '%s'", path), e);
        }
        if (contents.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonElement root = JsonParser.parseString(contents);
            if (!root.isJsonObject() || !root.getAsJsonObject().has(LAST_ID_KEY)) {
                logger.atWarning().log("Ignoring checkpoint file %s without '%s'", path, LAST_ID_KEY);
                return Optional.empty();
            }
            JsonElement lastId = root.getAsJsonObject().get(LAST_ID_KEY);
            if (lastId.isJsonNull() || lastId.getAsString().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(SequenceId.parse(lastId.getAsString()));
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
            logger.atWarning().withCause(e).log("Ignoring unreadable checkpoint file %s", path);
            return Optional.empty();
        }
    }

    private void replaceContents(SequenceId id) {
        JsonObject contents = new JsonObject();
        contents.addProperty(LAST_ID_KEY, id.toString());
        Path temporary = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.writeString(temporary, contents.toString(), UTF_8);
            try {
                Files.move(
                    temporary,
                    path,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.atFine().log("Atomic move not supported for %s, replacing in place", path);
                Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CheckpointException(
                String.format("Failed to write checkpoint file '%s'", path), e);
        }
    }
}
