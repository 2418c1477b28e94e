package com.handoffsystems.participant;

import com.handoffsystems.console.ConsoleConfig;
import com.handoffsystems.mailbox.ConversationMailbox;
import com.handoffsystems.mailbox.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stand-in for the negotiation agent: plays a fixed script against the manual side.
 *
 * <p>Each line is sent, then the participant waits for a reply before moving on.
 * It gives up after the configured number of consecutive reply timeouts and always
 * ends the conversation when it finishes.
 */
public class ScriptedParticipant implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ScriptedParticipant.class);

    static final String DEFAULT_SCRIPT_RESOURCE = "/scripts/default-script.txt";

    private final ConversationMailbox mailbox;
    private final AutomatedSideTools tools;
    private final ConsoleConfig config;
    private final List<String> script;
    private volatile boolean stopped;
    private volatile boolean completed;

    public ScriptedParticipant(ConversationMailbox mailbox, ConsoleConfig config, List<String> script) {
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox cannot be null");
        this.tools = new AutomatedSideTools(mailbox);
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.script = List.copyOf(script);
    }

    /**
     * Loads the script named by the configuration, or the bundled one.
     * Blank lines and lines starting with {@code #} are skipped.
     *
     * @param config the console configuration
     * @return the scripted lines
     * @throws UncheckedIOException if the script cannot be read
     */
    public static List<String> loadScript(ConsoleConfig config) {
        Optional<Path> path = config.getScriptPath();
        try {
            if (path.isPresent()) {
                logger.info("Loading script from {}", path.get());
                return parse(Files.readAllLines(path.get(), StandardCharsets.UTF_8));
            }
            try (InputStream stream = ScriptedParticipant.class.getResourceAsStream(DEFAULT_SCRIPT_RESOURCE)) {
                if (stream == null) {
                    throw new IllegalStateException("Bundled script not found: " + DEFAULT_SCRIPT_RESOURCE);
                }
                BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
                return parse(reader.lines().collect(Collectors.toList()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read script " + path.map(Path::toString).orElse(DEFAULT_SCRIPT_RESOURCE), e);
        }
    }

    static List<String> parse(List<String> lines) {
        return lines.stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toList());
    }

    @Override
    public void run() {
        logger.info("Scripted participant starting with {} lines", script.size());
        int consecutiveTimeouts = 0;
        try {
            for (String line : script) {
                if (stopped) {
                    break;
                }
                String confirmation = tools.sendMessage(line);
                logger.debug("{}", confirmation);

                Optional<Message> reply = Optional.empty();
                while (!stopped && reply.isEmpty()) {
                    reply = tools.receiveReply(config.getReplyTimeout());
                    if (reply.isEmpty()) {
                        consecutiveTimeouts++;
                        if (consecutiveTimeouts >= config.getMaxConsecutiveTimeouts()) {
                            logger.warn("Giving up after {} consecutive reply timeouts", consecutiveTimeouts);
                            return;
                        }
                    }
                }
                reply.ifPresent(r -> logger.info("Reply received: {}", r.text()));
                consecutiveTimeouts = 0;
            }
            completed = !stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Scripted participant interrupted");
        } finally {
            mailbox.endConversation();
            logger.info("Scripted participant finished.\n{}", tools.analyzeProgress());
        }
    }

    public void stop() {
        stopped = true;
    }

    /**
     * Returns true if every scripted line was sent and answered.
     *
     * @return whether the script ran to completion
     */
    public boolean isCompleted() {
        return completed;
    }

    public AutomatedSideTools tools() {
        return tools;
    }
}
