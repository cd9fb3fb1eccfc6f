package com.bottery.telegram.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Platform-neutral inbound text message.
 *
 * <p>{@code raw} keeps the whole source update for traceability; {@code timestamp} is in epoch
 * seconds, as delivered by the platform.
 */
public record Message(
    long id, String platform, String text, ChatUser user, long timestamp, JsonNode raw) {}
