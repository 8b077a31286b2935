package com.verlumen.curvestream.checkpoint;

/** Thrown when the checkpoint file cannot be used, for example for missing permissions. */
public class CheckpointException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
