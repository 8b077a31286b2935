package com.verlumen.curvestream.events;

/** Thrown by {@link MessageParser} when an inbound message cannot be read. */
final class MessageParseException extends Exception {
  private static final long serialVersionUID = 1L;

  MessageParseException(String message) {
    super(message);
  }

  MessageParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
