package org.blackjacksim.model.blackjack;

/**
 * Best total of a hand; {@code soft} means an ace is currently counted as 11.
 */
public record HandValue(int total, boolean soft) {
}
