package org.blackjacksim.exception;

import lombok.Getter;

@Getter
public class InsufficientFundsException extends SimulationException {
    private final double requested;
    private final double available;

    public InsufficientFundsException(double requested, double available) {
        super("Insufficient funds: requested " + requested + ", available " + available);
        this.requested = requested;
        this.available = available;
    }
}
