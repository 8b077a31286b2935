package com.verlumen.curvestream.events;

/** An informative text message. */
public record InfoNotice(String message) {}
