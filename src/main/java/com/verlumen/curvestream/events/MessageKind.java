package com.verlumen.curvestream.events;

/**
 * Describes the payload of a {@link DeliveryRecord}.
 *
 * <ul>
 *   <li>{@code EVENT}: a {@link com.verlumen.curvestream.model.CurveEvent}
 *   <li>{@code INFO}: an {@link InfoNotice} from the server or the client
 *   <li>{@code FILTERS}: a {@link FilterListReply} with the active filters
 *   <li>{@code ERROR}: an {@link ErrorNotice}, sent by the server or made from an unreadable
 *       message
 *   <li>{@code TIMEOUT}: nothing arrived in time; no payload
 *   <li>{@code DISCONNECTED}: a {@link ConnectionEvent} describing why the connection dropped
 * </ul>
 */
public enum MessageKind {
  EVENT,
  INFO,
  FILTERS,
  ERROR,
  TIMEOUT,
  DISCONNECTED;

  /** Whether records of this kind are made locally rather than received from the server. */
  public boolean isSynthetic() {
    return this == TIMEOUT || this == DISCONNECTED;
  }
}
