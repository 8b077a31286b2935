package com.verlumen.curvestream.events;

import com.google.common.base.Throwables;
import java.io.IOException;
import java.net.ConnectException;
import java.net.ProtocolException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocketHandshakeException;
import java.util.OptionalInt;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLHandshakeException;

/**
 * Describes why the connection is down.
 *
 * @param cause category of the failure
 * @param statusCode WebSocket close code or HTTP status, when one is known
 * @param message human readable detail
 */
public record ConnectionEvent(DisconnectCause cause, OptionalInt statusCode, String message) {
  private static final int NORMAL_CLOSURE = 1000;
  // RFC 6455, section 7.1.5: no status code in the close frame.
  private static final int NO_STATUS_RECEIVED = 1005;

  static ConnectionEvent notConnected() {
    return new ConnectionEvent(
        DisconnectCause.NORMAL, OptionalInt.of(NORMAL_CLOSURE), "Not connected to the server");
  }

  static ConnectionEvent closedByUser() {
    return new ConnectionEvent(
        DisconnectCause.NORMAL, OptionalInt.of(NORMAL_CLOSURE), "Connection closed by user");
  }

  /** An event for a close frame received from, or sent to, the server. */
  static ConnectionEvent fromClose(int statusCode, String reason) {
    int code = statusCode <= 0 ? NO_STATUS_RECEIVED : statusCode;
    DisconnectCause cause = DisconnectCause.fromCloseCode(code).orElse(DisconnectCause.UNKNOWN);
    String message = reason == null || reason.isEmpty() ? cause.name() : reason;
    return new ConnectionEvent(cause, OptionalInt.of(code), message);
  }

  /** An event for a transport failure, during the handshake or on an open connection. */
  static ConnectionEvent fromError(Throwable error) {
    Throwable cause = unwrap(error);
    String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    if (cause instanceof WebSocketHandshakeException) {
      int status = ((WebSocketHandshakeException) cause).getResponse().statusCode();
      return new ConnectionEvent(
          DisconnectCause.fromHttpStatus(status),
          OptionalInt.of(status),
          String.format("Handshake rejected with HTTP status %d", status));
    }
    if (cause instanceof TimeoutException
        || cause instanceof HttpTimeoutException
        || cause instanceof SocketTimeoutException) {
      return new ConnectionEvent(DisconnectCause.TIMEOUT, OptionalInt.empty(), message);
    }
    if (cause instanceof ConnectException) {
      return new ConnectionEvent(DisconnectCause.CONNECTION_REFUSED, OptionalInt.empty(), message);
    }
    if (cause instanceof SSLHandshakeException) {
      return new ConnectionEvent(
          DisconnectCause.TLS_HANDSHAKE,
          DisconnectCause.TLS_HANDSHAKE.closeCode(),
          message);
    }
    if (cause instanceof ProtocolException) {
      return new ConnectionEvent(
          DisconnectCause.PROTOCOL_ERROR,
          DisconnectCause.PROTOCOL_ERROR.closeCode(),
          message);
    }
    if (cause instanceof IOException) {
      // No close frame was received.
      return new ConnectionEvent(
          DisconnectCause.ABNORMAL, DisconnectCause.ABNORMAL.closeCode(), message);
    }
    return new ConnectionEvent(DisconnectCause.UNKNOWN, OptionalInt.empty(), message);
  }

  /** The same failure, reported once no more attempts will be made. */
  ConnectionEvent retriesExhausted(int attempts) {
    return new ConnectionEvent(
        cause,
        statusCode,
        String.format("Retries exhausted after %d attempt(s), last error: %s", attempts, message));
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current == null ? Throwables.getRootCause(error) : current;
  }
}
