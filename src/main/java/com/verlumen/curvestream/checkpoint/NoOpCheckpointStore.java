package com.verlumen.curvestream.checkpoint;

import com.verlumen.curvestream.model.SequenceId;
import java.time.Duration;
import java.util.Optional;

/** Used when no checkpoint file is configured. Remembers nothing. */
final class NoOpCheckpointStore implements CheckpointStore {
    @Override
    public Optional<SequenceId> read() {
        return Optional.empty();
    }

    @Override
    public boolean write(SequenceId id, Duration minInterval) {
        return false;
    }
}
