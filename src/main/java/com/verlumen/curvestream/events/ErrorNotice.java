package com.verlumen.curvestream.events;

/**
 * An error reported by the server, or a message that could not be read.
 *
 * @param rawText the message exactly as received
 * @param reason what went wrong
 */
public record ErrorNotice(String rawText, String reason) {}
