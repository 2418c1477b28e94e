package com.handoffsystems.mailbox;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of a mailbox wait: either the delivered message or a timeout.
 * Sealed so callers can handle both outcomes exhaustively.
 */
public sealed interface WaitOutcome permits WaitOutcome.Delivered, WaitOutcome.TimedOut {

    /**
     * A message was dequeued for the caller.
     */
    record Delivered(Message message) implements WaitOutcome {
        public Delivered {
            Objects.requireNonNull(message, "message cannot be null");
        }

        @Override
        public boolean isDelivered() {
            return true;
        }

        @Override
        public Message getOrThrow() {
            return message;
        }
    }

    /**
     * The wait elapsed with nothing consumed.
     */
    record TimedOut(Direction direction, Duration timeout) implements WaitOutcome {
        public TimedOut {
            Objects.requireNonNull(direction, "direction cannot be null");
            Objects.requireNonNull(timeout, "timeout cannot be null");
        }

        @Override
        public boolean isDelivered() {
            return false;
        }

        @Override
        public Message getOrThrow() throws WaitTimedOutException {
            throw new WaitTimedOutException(direction, timeout);
        }
    }

    boolean isDelivered();

    Message getOrThrow() throws WaitTimedOutException;

    static WaitOutcome delivered(Message message) {
        return new Delivered(message);
    }

    static WaitOutcome timedOut(Direction direction, Duration timeout) {
        return new TimedOut(direction, timeout);
    }

    default Optional<Message> asOptional() {
        if (this instanceof Delivered delivered) {
            return Optional.of(delivered.message());
        }
        return Optional.empty();
    }

    default <U> U fold(Function<Message, U> onDelivered, Function<TimedOut, U> onTimedOut) {
        if (this instanceof Delivered delivered) {
            return onDelivered.apply(delivered.message());
        }
        return onTimedOut.apply((TimedOut) this);
    }

    default void ifDelivered(Consumer<Message> consumer) {
        if (this instanceof Delivered delivered) {
            consumer.accept(delivered.message());
        }
    }

    default void ifTimedOut(Consumer<TimedOut> consumer) {
        if (this instanceof TimedOut timedOut) {
            consumer.accept(timedOut);
        }
    }
}
