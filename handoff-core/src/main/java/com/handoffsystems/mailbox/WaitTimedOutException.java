package com.handoffsystems.mailbox;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Thrown when a wait on a conversation mailbox elapses before a message arrives.
 * A timed-out wait consumes nothing and leaves the mailbox unchanged.
 */
public class WaitTimedOutException extends TimeoutException {

    private final Direction direction;
    private final Duration timeout;

    public WaitTimedOutException(Direction direction, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting on " + direction);
        this.direction = direction;
        this.timeout = timeout;
    }

    /**
     * Gets the direction that was waited on.
     *
     * @return the direction
     */
    public Direction getDirection() {
        return direction;
    }

    /**
     * Gets the timeout the caller asked for.
     *
     * @return the requested timeout
     */
    public Duration getTimeout() {
        return timeout;
    }
}
