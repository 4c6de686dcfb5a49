package com.gnovoa.matchfeed.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Envelope shared by every live update.
 *
 * <p>The same shape travels over the broker channel and down to viewers, so the hub never needs
 * to know which payload it is carrying.
 *
 * @param type payload discriminator
 * @param matchId match the update belongs to (fan-out key)
 * @param timestamp time assigned by the publisher
 * @param data type-specific payload
 */
public record MatchMessage(
        MessageType type,
        long matchId,
        Instant timestamp,
        JsonNode data
) {}
