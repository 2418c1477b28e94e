package com.handoffsystems.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default conversation mailbox built from two {@link DirectionalChannel}s and one history log.
 *
 * <p>Every send runs "stamp, append to history, enqueue" under a single send lock, so
 * history order is the global call order of the two send operations and a message is in
 * history before any consumer can dequeue it. Waiters only ever take their channel's lock.
 *
 * <p>History is unbounded for the lifetime of the mailbox. Implementations that need a
 * retention policy should provide their own {@link ConversationMailbox}.
 */
public class DefaultConversationMailbox implements ConversationMailbox {
    private static final Logger logger = LoggerFactory.getLogger(DefaultConversationMailbox.class);

    private final Clock clock;
    private final Map<Direction, DirectionalChannel> channels;
    private final List<Message> history = new ArrayList<>();
    private final ReentrantLock sendLock = new ReentrantLock();
    private volatile boolean active;

    /**
     * Creates a mailbox that timestamps messages with the system UTC clock.
     */
    public DefaultConversationMailbox() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a mailbox that timestamps messages with the given clock.
     *
     * @param clock the timestamp source
     */
    public DefaultConversationMailbox(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.channels = new EnumMap<>(Direction.class);
        for (Direction direction : Direction.values()) {
            this.channels.put(direction, new DirectionalChannel(direction));
        }
    }

    @Override
    public Message sendFromAutomated(String text) {
        return send(text, Origin.AUTOMATED);
    }

    @Override
    public Message sendFromManual(String text) {
        return send(text, Origin.MANUAL);
    }

    @Override
    public Message waitForManualReply(Duration timeout) throws WaitTimedOutException, InterruptedException {
        return receive(Direction.MANUAL_TO_AUTOMATED, timeout);
    }

    @Override
    public Message waitForManualReply() throws InterruptedException {
        return channel(Direction.MANUAL_TO_AUTOMATED).dequeue();
    }

    @Override
    public Message waitForAutomatedMessage(Duration timeout) throws WaitTimedOutException, InterruptedException {
        return receive(Direction.AUTOMATED_TO_MANUAL, timeout);
    }

    @Override
    public Message waitForAutomatedMessage() throws InterruptedException {
        return channel(Direction.AUTOMATED_TO_MANUAL).dequeue();
    }

    @Override
    public List<Message> getHistory() {
        sendLock.lock();
        try {
            return List.copyOf(history);
        } finally {
            sendLock.unlock();
        }
    }

    @Override
    public int pendingCount(Direction direction) {
        return channel(direction).size();
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void endConversation() {
        active = false;
        logger.debug("Conversation marked as ended after {} messages", historySize());
    }

    private Message send(String text, Origin origin) {
        Objects.requireNonNull(text, "text cannot be null");
        Direction direction = Direction.from(origin);
        Message message;
        sendLock.lock();
        try {
            message = new Message(text, clock.instant(), origin);
            history.add(message);
            channel(direction).enqueue(message);
            active = true;
        } finally {
            sendLock.unlock();
        }
        logger.debug("Sent {} message on {} ({} chars)", origin, direction, text.length());
        return message;
    }

    private Message receive(Direction direction, Duration timeout) throws WaitTimedOutException, InterruptedException {
        try {
            Message message = channel(direction).dequeue(timeout);
            logger.debug("Delivered {} message on {}", message.origin(), direction);
            return message;
        } catch (WaitTimedOutException e) {
            logger.debug("Wait on {} timed out after {} ms", direction, timeout.toMillis());
            throw e;
        }
    }

    private DirectionalChannel channel(Direction direction) {
        return channels.get(Objects.requireNonNull(direction, "direction cannot be null"));
    }

    private int historySize() {
        sendLock.lock();
        try {
            return history.size();
        } finally {
            sendLock.unlock();
        }
    }
}
