package com.verlumen.curvestream.checkpoint;

import com.verlumen.curvestream.model.SequenceId;
import java.time.Duration;
import java.util.Optional;

/**
 * Durable store for the id of the last delivered event.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface CheckpointStore {
    /** Returns the stored id, or empty if nothing has been stored yet. */
    Optional<SequenceId> read();

    /**
     * Stores the id unless it is older than the stored one.
     *
     * <p>Writes are coalesced: the call is skipped when less than {@code minInterval} has passed
     * since the last successful write. A zero interval forces the write.
     *
     * @return true if the id was written
     * @throws CheckpointException if the underlying storage fails
     */
    boolean write(SequenceId id, Duration minInterval);
}
