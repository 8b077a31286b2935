package com.verlumen.curvestream.events;

import java.util.Optional;

/** Read-only view of the connection, for the consumer side. */
interface ConnectionStatus {
  ConnectionState state();

  /** Why the connection last dropped, if it ever did. */
  Optional<ConnectionEvent> lastEvent();
}
