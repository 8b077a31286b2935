package com.verlumen.curvestream.events;

import com.google.common.collect.ImmutableList;
import com.verlumen.curvestream.filters.FilterSpec;
import java.util.Optional;

/**
 * The filters active on the stream, as reported by the server.
 *
 * @param requestId id of the request this answers, when the request carried one
 */
public record FilterListReply(Optional<String> requestId, ImmutableList<FilterSpec> filters) {}
