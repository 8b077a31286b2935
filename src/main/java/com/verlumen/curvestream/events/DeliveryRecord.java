package com.verlumen.curvestream.events;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.verlumen.curvestream.model.CurveEvent;
import java.util.Optional;

/**
 * One item handed to the consumer. The {@link #kind()} tells which payload accessor is valid;
 * {@code TIMEOUT} records carry no payload.
 */
@AutoValue
public abstract class DeliveryRecord {
  private static final DeliveryRecord TIMEOUT = create(MessageKind.TIMEOUT, Optional.empty());

  public abstract MessageKind kind();

  abstract Optional<Object> payload();

  static DeliveryRecord ofEvent(CurveEvent event) {
    return create(MessageKind.EVENT, Optional.of(checkNotNull(event)));
  }

  static DeliveryRecord ofInfo(InfoNotice info) {
    return create(MessageKind.INFO, Optional.of(checkNotNull(info)));
  }

  static DeliveryRecord ofFilters(FilterListReply filters) {
    return create(MessageKind.FILTERS, Optional.of(checkNotNull(filters)));
  }

  static DeliveryRecord ofError(ErrorNotice error) {
    return create(MessageKind.ERROR, Optional.of(checkNotNull(error)));
  }

  static DeliveryRecord timeout() {
    return TIMEOUT;
  }

  static DeliveryRecord disconnected(ConnectionEvent event) {
    return create(MessageKind.DISCONNECTED, Optional.of(checkNotNull(event)));
  }

  public CurveEvent event() {
    return payloadAs(MessageKind.EVENT, CurveEvent.class);
  }

  public InfoNotice info() {
    return payloadAs(MessageKind.INFO, InfoNotice.class);
  }

  public FilterListReply filters() {
    return payloadAs(MessageKind.FILTERS, FilterListReply.class);
  }

  public ErrorNotice error() {
    return payloadAs(MessageKind.ERROR, ErrorNotice.class);
  }

  public ConnectionEvent disconnect() {
    return payloadAs(MessageKind.DISCONNECTED, ConnectionEvent.class);
  }

  private <T> T payloadAs(MessageKind expected, Class<T> type) {
    checkState(kind() == expected, "Record is %s, not %s", kind(), expected);
    return type.cast(payload().get());
  }

  private static DeliveryRecord create(MessageKind kind, Optional<Object> payload) {
    return new AutoValue_DeliveryRecord(kind, payload);
  }
}
