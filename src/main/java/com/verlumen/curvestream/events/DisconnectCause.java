package com.verlumen.curvestream.events;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Why a connection attempt failed or an open connection dropped. Close codes follow RFC 6455,
 * section 7.4.
 */
public enum DisconnectCause {
  NORMAL(1000),
  GOING_AWAY(1001),
  PROTOCOL_ERROR(1002),
  UNSUPPORTED_DATA(1003),
  NO_STATUS(1005),
  ABNORMAL(1006),
  INVALID_PAYLOAD(1007),
  POLICY_VIOLATION(1008),
  PAYLOAD_TOO_LARGE(1009),
  MANDATORY_EXTENSION(1010),
  SERVER_ERROR(1011),
  SERVICE_RESTART(1012),
  TRY_AGAIN_LATER(1013),
  BAD_GATEWAY(1014),
  TLS_HANDSHAKE(1015),
  TIMEOUT,
  CONNECTION_REFUSED,
  /** The handshake was answered with an HTTP 4xx status, for example for a bad API key. */
  HTTP_CLIENT_ERROR,
  /** The handshake was answered with an HTTP 5xx status. */
  HTTP_SERVER_ERROR,
  UNKNOWN;

  private static final int NO_CLOSE_CODE = -1;
  private static final ImmutableMap<Integer, DisconnectCause> BY_CLOSE_CODE =
      Stream.of(values())
          .filter(cause -> cause.closeCode != NO_CLOSE_CODE)
          .collect(toImmutableMap(cause -> cause.closeCode, Function.identity()));

  private final int closeCode;

  DisconnectCause() {
    this(NO_CLOSE_CODE);
  }

  DisconnectCause(int closeCode) {
    this.closeCode = closeCode;
  }

  /** The WebSocket close code for this cause, if it has one. */
  public OptionalInt closeCode() {
    return closeCode == NO_CLOSE_CODE ? OptionalInt.empty() : OptionalInt.of(closeCode);
  }

  public static Optional<DisconnectCause> fromCloseCode(int closeCode) {
    return Optional.ofNullable(BY_CLOSE_CODE.get(closeCode));
  }

  public static DisconnectCause fromHttpStatus(int status) {
    if (status >= 400 && status < 500) {
      return HTTP_CLIENT_ERROR;
    }
    if (status >= 500 && status < 600) {
      return HTTP_SERVER_ERROR;
    }
    return UNKNOWN;
  }
}
