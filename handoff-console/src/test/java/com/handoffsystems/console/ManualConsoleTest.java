package com.handoffsystems.console;

import com.handoffsystems.mailbox.ConversationMailbox;
import com.handoffsystems.mailbox.DefaultConversationMailbox;
import com.handoffsystems.mailbox.Direction;
import com.handoffsystems.mailbox.Message;
import com.handoffsystems.mailbox.Origin;
import com.handoffsystems.mailbox.WaitOutcome;
import com.handoffsystems.test.AsyncAssertion;
import com.handoffsystems.test.MailboxInspector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the manual-side console loop.
 */
class ManualConsoleTest {

    @Mock
    private ConversationMailbox mailbox;

    private ConsoleConfig config;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        config = ConsoleConfig.builder().waitTimeout(Duration.ofMillis(100)).build();
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private static Message automated(String text) {
        return new Message(text, Instant.parse("2024-05-01T10:00:00Z"), Origin.AUTOMATED);
    }

    private ManualConsole console(String input) {
        return new ManualConsole(mailbox, config, new BufferedReader(new StringReader(input)), out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testReplyIsSentThenQuit() throws Exception {
        when(mailbox.awaitAutomatedMessage(any()))
            .thenReturn(WaitOutcome.delivered(automated("My blender arrived broken")))
            .thenReturn(WaitOutcome.delivered(automated("Thanks")));

        console("A replacement is on its way\n/quit\n").run();

        verify(mailbox).sendFromManual("A replacement is on its way");
        verify(mailbox, times(2)).awaitAutomatedMessage(Duration.ofMillis(100));
        assertTrue(output().contains("CUSTOMER: My blender arrived broken"));
        assertTrue(output().contains("CUSTOMER: Thanks"));
        assertTrue(output().contains("[Exiting console...]"));
    }

    @Test
    void testQuitIsCaseInsensitive() throws Exception {
        when(mailbox.awaitAutomatedMessage(any())).thenReturn(WaitOutcome.delivered(automated("Hello")));

        ManualConsole console = console("/QUIT\n");
        console.run();

        verify(mailbox, never()).sendFromManual(anyString());
        assertFalse(console.isRunning());
    }

    @Test
    void testBlankInputIsRejectedAndHistoryIsShown() throws Exception {
        when(mailbox.awaitAutomatedMessage(any())).thenReturn(WaitOutcome.delivered(automated("Hello")));
        when(mailbox.getHistory()).thenReturn(List.of(automated("Hello")));

        console("   \n/history\nHi there\n").run();

        String text = output();
        assertTrue(text.contains("Please enter a response or use /quit to exit"));
        assertTrue(text.contains("[1] AUTOMATED – 2024-05-01T10:00:00Z\n  Hello"));
        verify(mailbox).sendFromManual("Hi there");
        verify(mailbox, never()).sendFromManual("");
    }

    @Test
    void testTimeoutKeepsWaiting() throws Exception {
        when(mailbox.awaitAutomatedMessage(any()))
            .thenReturn(WaitOutcome.timedOut(Direction.AUTOMATED_TO_MANUAL, Duration.ofMillis(100)))
            .thenReturn(WaitOutcome.delivered(automated("Finally")));

        console("/quit\n").run();

        assertTrue(output().contains("[Timeout] No message received. Still waiting..."));
        assertTrue(output().contains("CUSTOMER: Finally"));
    }

    @Test
    void testEndOfInputEndsSession() throws Exception {
        when(mailbox.awaitAutomatedMessage(any())).thenReturn(WaitOutcome.delivered(automated("Anyone there?")));

        console("").run();

        verify(mailbox, never()).sendFromManual(anyString());
        assertTrue(output().contains("Console session ended."));
    }

    @Test
    @Timeout(10)
    void testConversationWithRealMailbox() throws Exception {
        DefaultConversationMailbox real = new DefaultConversationMailbox();
        MailboxInspector inspector = MailboxInspector.of(real);
        ManualConsole console = new ManualConsole(real, config,
            new BufferedReader(new StringReader("We can refund you today.\n")), out);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread consoleThread = new Thread(() -> {
            try {
                console.run();
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "manual-console");
        consoleThread.start();

        real.sendFromAutomated("Can I get a refund?");
        assertEquals("We can refund you today.", real.waitForManualReply(Duration.ofSeconds(5)).text());

        // Console input is exhausted, so the next message ends the session
        real.sendFromAutomated("Great, thanks");
        consoleThread.join(5000);

        assertFalse(consoleThread.isAlive());
        assertNull(failure.get());
        assertEquals(List.of(Origin.AUTOMATED, Origin.MANUAL, Origin.AUTOMATED), inspector.historyOrigins());
        assertEquals(0, inspector.pending(Direction.AUTOMATED_TO_MANUAL));
    }

    @Test
    @Timeout(10)
    void testStopEndsIdleConsole() throws Exception {
        DefaultConversationMailbox real = new DefaultConversationMailbox();
        ManualConsole console = new ManualConsole(real, config, new BufferedReader(new StringReader("")), out);

        Thread consoleThread = new Thread(() -> {
            try {
                console.run();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }, "manual-console");
        consoleThread.start();

        AsyncAssertion.eventually(console::isRunning, Duration.ofSeconds(2));
        AsyncAssertion.eventually(() -> output().contains("[Timeout]"), Duration.ofSeconds(2));
        console.stop();
        consoleThread.join(2000);

        assertFalse(consoleThread.isAlive());
        assertTrue(real.getHistory().isEmpty());
    }

    @Test
    @Timeout(10)
    void testZeroWaitTimeoutPropertyDoesNotSpin() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(ConsoleConfig.WAIT_TIMEOUT_PROPERTY, "0");
        ConsoleConfig zeroConfig = ConsoleConfig.fromProperties(properties);
        DefaultConversationMailbox real = new DefaultConversationMailbox();
        ManualConsole console = new ManualConsole(real, zeroConfig, new BufferedReader(new StringReader("")), out);

        Thread consoleThread = new Thread(() -> {
            try {
                console.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }, "manual-console");
        consoleThread.start();

        AsyncAssertion.eventually(console::isRunning, Duration.ofSeconds(2));
        Thread.sleep(200);
        console.stop();
        consoleThread.interrupt();
        consoleThread.join(2000);

        assertFalse(consoleThread.isAlive());
        assertEquals(ConsoleConfig.DEFAULT_WAIT_TIMEOUT, zeroConfig.getWaitTimeout());
        assertFalse(output().contains("[Timeout]"));
    }
}
