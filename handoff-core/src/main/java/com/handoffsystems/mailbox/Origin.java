package com.handoffsystems.mailbox;

/**
 * The participant that produced a {@link Message}.
 */
public enum Origin {
    /**
     * The automated side (the negotiation agent).
     */
    AUTOMATED,

    /**
     * The manual side (a human at the console).
     */
    MANUAL
}
