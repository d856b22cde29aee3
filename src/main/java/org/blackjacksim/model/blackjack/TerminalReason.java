package org.blackjacksim.model.blackjack;

public enum TerminalReason {
    HAND_LIMIT_REACHED,
    BANKRUPT,
    // the house bankroll could not cover the next bet
    TABLE_LIMIT_REACHED
}
