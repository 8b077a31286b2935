package com.verlumen.curvestream.events;

/** Sends text frames over the open connection. */
interface MessageSender {
  /**
   * @throws IllegalStateException if there is no open connection, or the frame could not be sent
   */
  void send(String message);
}
