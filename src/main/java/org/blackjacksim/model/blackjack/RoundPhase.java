package org.blackjacksim.model.blackjack;

public enum RoundPhase {
    BET_PLACED, INITIAL_DEAL, INSURANCE_OFFER, PLAYER_TURN, DEALER_TURN, SETTLEMENT, DONE
}
