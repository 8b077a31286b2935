package com.verlumen.curvestream.events;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.verlumen.curvestream.filters.FilterSpec;
import com.verlumen.curvestream.filters.FilterSpecs;
import com.verlumen.curvestream.filters.FilterValidationException;
import java.util.List;
import java.util.Optional;

/** Builds and sends the {@code filter.set} and {@code filter.get} requests. */
final class SubscriptionController {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  static final String FILTER_SET = "filter.set";
  static final String FILTER_GET = "filter.get";

  private final MessageSender sender;
  private final Subscription subscription;
  private final Watermark watermark;

  @Inject
  SubscriptionController(MessageSender sender, Subscription subscription, Watermark watermark) {
    this.sender = sender;
    this.subscription = subscription;
    this.watermark = watermark;
  }

  /**
   * Validates {@code filters}, remembers the resulting message for replay after reconnects and
   * sends it.
   *
   * @param fillResumeId include the id of the last delivered event, when there is one, so the
   *     server resends what came after it
   * @throws FilterValidationException listing every problem of every filter
   * @throws IllegalStateException if the connection is not open
   */
  void subscribe(
      List<? extends FilterSpec> filters, Optional<String> requestId, boolean fillResumeId) {
    checkNotNull(filters, "filters");
    FilterSpecs.checkValid(filters);
    JsonObject message = new JsonObject();
    message.addProperty(MessageParser.TYPE_KEY, FILTER_SET);
    requestId.ifPresent(id -> message.addProperty("id", id));
    if (fillResumeId) {
      watermark.get().ifPresent(lastId -> message.addProperty("last_id", lastId.toString()));
    }
    JsonArray serialized = new JsonArray();
    ImmutableList.copyOf(filters).forEach(filter -> serialized.add(filter.toJson()));
    message.add("filters", serialized);

    String text = message.toString();
    subscription.remember(text);
    logger.atInfo().log("Subscribing with %d filter(s)", filters.size());
    sender.send(text);
  }

  /**
   * Asks the server for the active filters. The answer arrives as a {@link MessageKind#FILTERS}
   * record.
   *
   * @throws IllegalStateException if the connection is not open
   */
  void requestActiveFilters(Optional<String> requestId) {
    JsonObject message = new JsonObject();
    message.addProperty(MessageParser.TYPE_KEY, FILTER_GET);
    requestId.ifPresent(id -> message.addProperty("id", id));
    sender.send(message.toString());
  }
}
