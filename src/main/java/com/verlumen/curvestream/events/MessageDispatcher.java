package com.verlumen.curvestream.events;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.curvestream.checkpoint.CheckpointException;
import com.verlumen.curvestream.checkpoint.CheckpointStore;
import com.verlumen.curvestream.model.SequenceId;

/**
 * Handles each inbound text frame: parses it, queues exactly one record for the consumer and, for
 * events, moves the watermark and checkpoint forward.
 */
final class MessageDispatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final MessageParser parser;
  private final DeliveryQueue queue;
  private final Watermark watermark;
  private final CheckpointStore checkpointStore;
  private final EventStreamConfig config;

  @Inject
  MessageDispatcher(
      MessageParser parser,
      DeliveryQueue queue,
      Watermark watermark,
      CheckpointStore checkpointStore,
      EventStreamConfig config) {
    this.parser = parser;
    this.queue = queue;
    this.watermark = watermark;
    this.checkpointStore = checkpointStore;
    this.config = config;
  }

  /** Never throws; unreadable frames become {@link MessageKind#ERROR} records. */
  void dispatch(String text) {
    logger.atFiner().log("Received: %s", text);
    DeliveryRecord record;
    try {
      record = parser.parse(text);
    } catch (MessageParseException e) {
      logger.atWarning().log("Failed to parse message: %s", e.getMessage());
      record = DeliveryRecord.ofError(new ErrorNotice(text, e.getMessage()));
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Unexpected failure while parsing message");
      record = DeliveryRecord.ofError(new ErrorNotice(text, String.valueOf(e)));
    }
    if (record.kind() == MessageKind.EVENT) {
      checkpoint(watermark.advance(record.event().id()));
    }
    queue.put(record);
  }

  private void checkpoint(SequenceId id) {
    try {
      checkpointStore.write(id, config.checkpointWriteInterval());
    } catch (CheckpointException e) {
      logger.atWarning().withCause(e).log("Failed to checkpoint %s", id);
    }
  }
}
