package com.handoffsystems.mailbox;

import java.util.Objects;

/**
 * One of the two delivery directions of a conversation mailbox.
 * Each direction has its own FIFO channel.
 */
public enum Direction {
    AUTOMATED_TO_MANUAL(Origin.AUTOMATED),
    MANUAL_TO_AUTOMATED(Origin.MANUAL);

    private final Origin sender;

    Direction(Origin sender) {
        this.sender = sender;
    }

    /**
     * Gets the origin of every message travelling in this direction.
     *
     * @return the sending side
     */
    public Origin sender() {
        return sender;
    }

    /**
     * Gets the direction a message from the given origin travels in.
     *
     * @param origin the sending side
     * @return the matching direction
     * @throws NullPointerException if origin is null
     */
    public static Direction from(Origin origin) {
        switch (Objects.requireNonNull(origin, "origin cannot be null")) {
            case AUTOMATED:
                return AUTOMATED_TO_MANUAL;
            case MANUAL:
                return MANUAL_TO_AUTOMATED;
            default:
                throw new IllegalArgumentException("Unknown origin: " + origin);
        }
    }
}
