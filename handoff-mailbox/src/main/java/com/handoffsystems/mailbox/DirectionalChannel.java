package com.handoffsystems.mailbox;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO channel for one direction of a conversation.
 *
 * <p>Consumers park on a {@link Condition} and re-check the queue every time they wake,
 * so a signal only means "look again", never "a message is yours". A consumer that finds
 * the queue empty after waking waits again with whatever time it has left.
 *
 * Characteristics:
 * - enqueue never blocks (beyond the short critical section)
 * - strict FIFO across any number of producers and consumers
 * - a timed-out or interrupted consumer takes nothing and disturbs no other consumer
 */
public class DirectionalChannel {

    private final Direction direction;
    private final ArrayDeque<Message> pending = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private int waiters;

    public DirectionalChannel(Direction direction) {
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
    }

    /**
     * Appends a message and wakes one parked consumer.
     *
     * @param message the message to deliver
     */
    public void enqueue(Message message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            pending.addLast(message);
            if (waiters > 0) {
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest message, waiting up to the given timeout for one to arrive.
     *
     * @param timeout how long to wait; zero or negative checks once without waiting
     * @return the oldest pending message
     * @throws WaitTimedOutException if the channel stayed empty for the whole timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public Message dequeue(Duration timeout) throws WaitTimedOutException, InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long nanos = toNanos(timeout);
        lock.lockInterruptibly();
        try {
            // Predicate first: a signal that lands as the timeout expires still delivers.
            while (pending.isEmpty()) {
                if (nanos <= 0L) {
                    throw new WaitTimedOutException(direction, timeout);
                }
                waiters++;
                try {
                    nanos = notEmpty.awaitNanos(nanos);
                } finally {
                    waiters--;
                }
            }
            return pending.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest message, waiting as long as it takes for one to arrive.
     *
     * @return the oldest pending message
     * @throws InterruptedException if interrupted while waiting
     */
    public Message dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty()) {
                waiters++;
                try {
                    notEmpty.await();
                } finally {
                    waiters--;
                }
            }
            return pending.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest message if there is one.
     *
     * @return the oldest pending message, or null if the channel is empty
     */
    public Message poll() {
        lock.lock();
        try {
            return pending.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of consumers currently parked on this channel.
     *
     * @return parked consumer count
     */
    public int waiterCount() {
        lock.lock();
        try {
            return waiters;
        } finally {
            lock.unlock();
        }
    }

    private static long toNanos(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return 0L;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
