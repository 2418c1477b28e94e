package com.handoffsystems.mailbox;

import java.time.Duration;
import java.util.List;

/**
 * Bidirectional handoff between the automated and the manual side of one conversation.
 * Each direction is a FIFO channel; every message sent in either direction is also
 * appended to a single history ordered by send call order.
 *
 * <p>Sends never block. Waits block the calling thread only, never while holding a lock
 * another participant needs. One instance serves one logical conversation and is shared
 * by reference with every participant.
 */
public interface ConversationMailbox {

    /**
     * Posts a message from the automated side to the manual side.
     *
     * @param text the message text, may be empty
     * @return the message as recorded in history
     */
    Message sendFromAutomated(String text);

    /**
     * Posts a message from the manual side to the automated side.
     *
     * @param text the message text, may be empty
     * @return the message as recorded in history
     */
    Message sendFromManual(String text);

    /**
     * Waits for the next reply from the manual side.
     *
     * @param timeout how long to wait; zero or negative checks once without waiting
     * @return the oldest undelivered manual message
     * @throws WaitTimedOutException if no message arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    Message waitForManualReply(Duration timeout) throws WaitTimedOutException, InterruptedException;

    /**
     * Waits, without a time limit, for the next reply from the manual side.
     *
     * @return the oldest undelivered manual message
     * @throws InterruptedException if interrupted while waiting
     */
    Message waitForManualReply() throws InterruptedException;

    /**
     * Waits for the next message from the automated side.
     *
     * @param timeout how long to wait; zero or negative checks once without waiting
     * @return the oldest undelivered automated message
     * @throws WaitTimedOutException if no message arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    Message waitForAutomatedMessage(Duration timeout) throws WaitTimedOutException, InterruptedException;

    /**
     * Waits, without a time limit, for the next message from the automated side.
     *
     * @return the oldest undelivered automated message
     * @throws InterruptedException if interrupted while waiting
     */
    Message waitForAutomatedMessage() throws InterruptedException;

    /**
     * Same as {@link #waitForManualReply(Duration)} but reports a timeout as a value.
     */
    default WaitOutcome awaitManualReply(Duration timeout) throws InterruptedException {
        try {
            return WaitOutcome.delivered(waitForManualReply(timeout));
        } catch (WaitTimedOutException e) {
            return WaitOutcome.timedOut(e.getDirection(), e.getTimeout());
        }
    }

    /**
     * Same as {@link #waitForAutomatedMessage(Duration)} but reports a timeout as a value.
     */
    default WaitOutcome awaitAutomatedMessage(Duration timeout) throws InterruptedException {
        try {
            return WaitOutcome.delivered(waitForAutomatedMessage(timeout));
        } catch (WaitTimedOutException e) {
            return WaitOutcome.timedOut(e.getDirection(), e.getTimeout());
        }
    }

    /**
     * Returns a snapshot of every message sent so far, in send order.
     * The snapshot is immutable and unaffected by later sends.
     *
     * @return the conversation history
     */
    List<Message> getHistory();

    /**
     * Returns the number of messages sent but not yet delivered in the given direction.
     *
     * @param direction the direction to inspect
     * @return the pending count
     */
    int pendingCount(Direction direction);

    /**
     * Returns true once a message has been sent and {@link #endConversation()} has not
     * been called since. Observational only; it never gates sends or waits.
     *
     * @return whether the conversation is active
     */
    boolean isActive();

    /**
     * Marks the conversation as ended. History and pending messages are kept.
     */
    void endConversation();
}
