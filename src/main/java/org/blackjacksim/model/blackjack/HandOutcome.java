package org.blackjacksim.model.blackjack;

public enum HandOutcome { BLACKJACK, WIN, PUSH, LOSE, SURRENDER }
