package com.handoffsystems.participant;

import com.handoffsystems.mailbox.ConversationMailbox;
import com.handoffsystems.mailbox.Message;
import com.handoffsystems.mailbox.Origin;
import com.handoffsystems.mailbox.WaitOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Text-in, text-out operations the negotiation logic uses to talk to customer service
 * through a {@link ConversationMailbox}. Also counts what was sent and received.
 */
public class AutomatedSideTools {
    private static final Logger logger = LoggerFactory.getLogger(AutomatedSideTools.class);

    static final int RECENT_ENTRIES = 6;
    static final int MAX_PREVIEW_CHARS = 100;

    private final ConversationMailbox mailbox;
    private final AtomicInteger messagesSent = new AtomicInteger();
    private final AtomicInteger responsesReceived = new AtomicInteger();

    public AutomatedSideTools(ConversationMailbox mailbox) {
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox cannot be null");
    }

    /**
     * Sends a message to customer service.
     *
     * @param text the message
     * @return a confirmation line
     */
    public String sendMessage(String text) {
        mailbox.sendFromAutomated(text);
        messagesSent.incrementAndGet();
        return "Message sent to CS: '" + text + "'";
    }

    /**
     * Waits for the next customer service reply.
     *
     * @param timeout how long to wait
     * @return the reply, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Message> receiveReply(Duration timeout) throws InterruptedException {
        return awaitReply(timeout).asOptional();
    }

    /**
     * Waits for the next customer service reply and describes the result as text.
     *
     * @param timeoutSeconds how long to wait, in seconds
     * @return {@code CS Response: '...'} or a timeout notice
     * @throws InterruptedException if interrupted while waiting
     */
    public String waitForReply(double timeoutSeconds) throws InterruptedException {
        Duration timeout = Duration.ofNanos(Math.round(timeoutSeconds * 1_000_000_000d));
        return awaitReply(timeout).fold(
                reply -> "CS Response: '" + reply.text() + "'",
                timedOut -> "Timeout: No response from CS after " + timeoutSeconds + " seconds");
    }

    private WaitOutcome awaitReply(Duration timeout) throws InterruptedException {
        WaitOutcome outcome = mailbox.awaitManualReply(timeout);
        outcome.ifDelivered(reply -> responsesReceived.incrementAndGet());
        outcome.ifTimedOut(t -> logger.info("No reply from customer service within {} ms", t.timeout().toMillis()));
        return outcome;
    }

    /**
     * Summarizes the conversation so far: counts per side and the most recent entries.
     *
     * @return a progress report
     */
    public String analyzeProgress() {
        List<Message> history = mailbox.getHistory();
        if (history.isEmpty()) {
            return "No conversation history yet. Negotiation has not started.";
        }

        long fromAgent = history.stream().filter(m -> m.origin() == Origin.AUTOMATED).count();
        long fromCs = history.size() - fromAgent;

        StringBuilder sb = new StringBuilder();
        sb.append("Negotiation Progress Analysis:\n");
        sb.append("- Total exchanges: ").append(history.size()).append('\n');
        sb.append("- Messages from agent (customer): ").append(fromAgent).append('\n');
        sb.append("- Messages from CS: ").append(fromCs).append('\n');
        sb.append("- Messages sent: ").append(messagesSent.get()).append('\n');
        sb.append("- Responses received: ").append(responsesReceived.get()).append('\n');
        sb.append('\n');
        sb.append("Recent conversation:");

        List<Message> recent = history.subList(Math.max(0, history.size() - RECENT_ENTRIES), history.size());
        for (Message entry : recent) {
            sb.append("\n  ").append(entry.origin().name()).append(": ").append(preview(entry.text()));
        }
        return sb.toString();
    }

    public int getMessagesSent() {
        return messagesSent.get();
    }

    public int getResponsesReceived() {
        return responsesReceived.get();
    }

    private static String preview(String text) {
        if (text.length() <= MAX_PREVIEW_CHARS) {
            return text;
        }
        return text.substring(0, MAX_PREVIEW_CHARS) + "...";
    }
}
