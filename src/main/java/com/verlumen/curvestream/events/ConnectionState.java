package com.verlumen.curvestream.events;

/** Lifecycle of the stream connection. */
public enum ConnectionState {
  /** Not connected and not trying to connect. */
  DISCONNECTED,
  /** Attempting to connect, or waiting between attempts. */
  CONNECTING,
  CONNECTED,
  /** {@code close()} is in progress. */
  CLOSING
}
