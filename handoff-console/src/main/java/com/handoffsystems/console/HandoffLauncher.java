package com.handoffsystems.console;

import com.handoffsystems.mailbox.ConversationMailbox;
import com.handoffsystems.mailbox.DefaultConversationMailbox;
import com.handoffsystems.participant.ScriptedParticipant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Runs a demo conversation: a scripted automated participant on a background thread
 * and the manual console on the main thread, both sharing one mailbox.
 */
public class HandoffLauncher {
    private static final Logger logger = LoggerFactory.getLogger(HandoffLauncher.class);

    public static void main(String[] args) {
        ConsoleConfig config = ConsoleConfig.fromSystemProperties();
        logger.info("Starting handoff demo with {}", config);

        ConversationMailbox mailbox = new DefaultConversationMailbox();
        ScriptedParticipant participant = new ScriptedParticipant(mailbox, config, ScriptedParticipant.loadScript(config));
        Thread participantThread = new Thread(participant, "automated-participant");
        participantThread.setDaemon(true);
        participantThread.start();

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ManualConsole console = new ManualConsole(mailbox, config, in, System.out);
        int status = 0;
        try {
            console.run();
        } catch (IOException e) {
            logger.error("Console input failed", e);
            status = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Console interrupted");
        } finally {
            participant.stop();
            participantThread.interrupt();
        }

        if (status != 0) {
            System.exit(status);
        }
    }
}
