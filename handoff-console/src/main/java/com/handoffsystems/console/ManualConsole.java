package com.handoffsystems.console;

import com.handoffsystems.mailbox.ConversationMailbox;
import com.handoffsystems.mailbox.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Interactive loop for the human playing the manual side of a conversation.
 *
 * <p>The console waits for the next automated message, shows it, and reads a reply.
 * While replying, {@code /history} prints the conversation so far and {@code /quit}
 * leaves the loop. End of input also ends the session.
 */
public class ManualConsole {
    private static final Logger logger = LoggerFactory.getLogger(ManualConsole.class);

    static final String HISTORY_COMMAND = "/history";
    static final String QUIT_COMMAND = "/quit";
    private static final String RULE = "=".repeat(70);
    private static final String SEPARATOR = "-".repeat(70);

    private final ConversationMailbox mailbox;
    private final ConsoleConfig config;
    private final BufferedReader in;
    private final PrintStream out;
    private final HistoryRenderer renderer;
    private volatile boolean running;

    public ManualConsole(ConversationMailbox mailbox, ConsoleConfig config, BufferedReader in, PrintStream out) {
        this(mailbox, config, in, out, new HistoryRenderer());
    }

    ManualConsole(ConversationMailbox mailbox, ConsoleConfig config, BufferedReader in, PrintStream out,
                  HistoryRenderer renderer) {
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.in = Objects.requireNonNull(in, "in cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.renderer = renderer;
    }

    /**
     * Runs the console until the user quits, input ends, or {@link #stop()} is called.
     * A stop request is noticed the next time a wait times out.
     *
     * @throws IOException if reading input fails
     * @throws InterruptedException if interrupted while waiting for a message
     */
    public void run() throws IOException, InterruptedException {
        running = true;
        printHeader();
        out.println("[Ready] Waiting for the other side to start the conversation...");
        out.println();
        logger.info("Manual console started with wait timeout {}", config.getWaitTimeout());

        try {
            while (running) {
                Optional<Message> incoming = mailbox.awaitAutomatedMessage(config.getWaitTimeout()).asOptional();
                if (incoming.isEmpty()) {
                    logger.info("No automated message within {}", config.getWaitTimeout());
                    if (running) {
                        out.println();
                        out.println("[Timeout] No message received. Still waiting...");
                    }
                    continue;
                }

                showIncoming(incoming.get());

                if (!readAndSendReply()) {
                    break;
                }
                out.println();
                out.println("[Waiting for next message...]");
                out.println();
            }
        } finally {
            running = false;
            out.println();
            out.println("Console session ended.");
            out.println("Conversation history is kept in the mailbox.");
            out.println();
            logger.info("Manual console stopped after {} messages", mailbox.getHistory().size());
        }
    }

    /**
     * Asks the loop to finish.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    private void printHeader() {
        out.println();
        out.println(RULE);
        out.println("  CUSTOMER SERVICE CONSOLE");
        out.println(RULE);
        out.println();
        out.println("You are answering as customer service.");
        out.println("Wait for customer messages and respond appropriately.");
        out.println();
        out.println("Commands:");
        out.println("  " + HISTORY_COMMAND + "  - Show conversation history");
        out.println("  " + QUIT_COMMAND + "     - Exit the console");
        out.println(RULE);
        out.println();
    }

    private void showIncoming(Message message) {
        out.println(SEPARATOR);
        out.println();
        out.println("CUSTOMER: " + message.text());
        out.println();
        out.println(SEPARATOR);
    }

    /**
     * Prompts until a reply is sent or the session ends.
     *
     * @return true if a reply was sent, false if the session should end
     */
    private boolean readAndSendReply() throws IOException {
        while (true) {
            out.println();
            out.print("YOU (customer service): ");
            out.flush();

            String line = in.readLine();
            if (line == null) {
                logger.info("Console input closed");
                running = false;
                return false;
            }

            String reply = line.strip();
            if (QUIT_COMMAND.equalsIgnoreCase(reply)) {
                out.println();
                out.println("[Exiting console...]");
                running = false;
                return false;
            }
            if (HISTORY_COMMAND.equalsIgnoreCase(reply)) {
                out.print(renderer.render(mailbox.getHistory()));
                continue;
            }
            if (reply.isEmpty()) {
                out.println("  Please enter a response or use " + QUIT_COMMAND + " to exit");
                continue;
            }

            mailbox.sendFromManual(reply);
            out.println("  Response sent");
            return true;
        }
    }
}
