package com.verlumen.curvestream.events;

import com.google.inject.Singleton;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** The last {@code filter.set} message sent, kept verbatim so it can be replayed. */
@Singleton
final class Subscription {
  private final AtomicReference<String> latestFilterMessage = new AtomicReference<>();

  Optional<String> latest() {
    return Optional.ofNullable(latestFilterMessage.get());
  }

  void remember(String filterMessage) {
    latestFilterMessage.set(filterMessage);
  }
}
