package com.handoffsystems.console;

import com.handoffsystems.mailbox.Message;

import java.util.List;

/**
 * Renders conversation history as a numbered list for the console.
 * Each entry is {@code [index] ROLE – timestamp} followed by the text, every line indented.
 */
public class HistoryRenderer {

    static final String EMPTY = "[No conversation history yet]";
    private static final String RULE = "=".repeat(70);

    public String render(List<Message> history) {
        StringBuilder sb = new StringBuilder();
        if (history.isEmpty()) {
            sb.append('\n').append(EMPTY).append("\n\n");
            return sb.toString();
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append("  CONVERSATION HISTORY\n");
        sb.append(RULE).append('\n');
        int index = 1;
        for (Message message : history) {
            sb.append('\n').append(entry(index++, message)).append('\n');
        }
        sb.append('\n').append(RULE).append("\n\n");
        return sb.toString();
    }

    String entry(int index, Message message) {
        return "[" + index + "] " + message.origin().name() + " – " + message.timestamp()
                + "\n  " + message.text().replace("\n", "\n  ");
    }
}
