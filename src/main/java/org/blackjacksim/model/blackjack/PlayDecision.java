package org.blackjacksim.model.blackjack;

public enum PlayDecision { HIT, STAND, DOUBLE, SPLIT, SURRENDER }
