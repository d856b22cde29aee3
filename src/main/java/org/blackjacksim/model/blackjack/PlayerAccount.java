package org.blackjacksim.model.blackjack;

import lombok.Getter;
import org.blackjacksim.exception.InsufficientFundsException;

/**
 * Player bankroll for one run. Bets are debited when placed and the stake plus winnings credited at settlement.
 */
@Getter
public class PlayerAccount {
    private final double startingBalance;
    private double balance;
    private double totalWagered = 0;

    public PlayerAccount(double startingBalance) {
        this.startingBalance = startingBalance;
        this.balance = startingBalance;
    }

    public void debit(double amount) {
        if (amount <= 0) throw new IllegalArgumentException("Debit must be positive: " + amount);
        if (amount > balance) throw new InsufficientFundsException(amount, balance);
        balance -= amount;
        totalWagered += amount;
    }

    public void credit(double amount) {
        if (amount < 0) throw new IllegalArgumentException("Credit must not be negative: " + amount);
        balance += amount;
    }

    public boolean canCover(double amount) {
        return amount <= balance;
    }

    public double net() {
        return balance - startingBalance;
    }
}
