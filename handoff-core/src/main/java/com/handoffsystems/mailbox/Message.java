package com.handoffsystems.mailbox;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable message exchanged through a {@link ConversationMailbox}.
 * Empty text is allowed; validating content is up to the participants.
 *
 * @param text the message body
 * @param timestamp when the message was sent
 * @param origin which side sent it
 */
public record Message(String text, Instant timestamp, Origin origin) {

    public Message {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(origin, "origin cannot be null");
    }

    /**
     * Gets the direction this message travels in.
     *
     * @return the delivery direction
     */
    public Direction direction() {
        return Direction.from(origin);
    }
}
