package org.blackjacksim.model.blackjack;

import lombok.Getter;
import org.blackjacksim.model.blackjack.rules.TableRules;

/**
 * House bankroll. Pays player winnings and collects lost stakes.
 */
@Getter
public class TableBank {
    private double balance;

    public TableBank(double startingBalance) {
        this.balance = startingBalance;
    }

    public static TableBank unlimited() {
        return new TableBank(Double.MAX_VALUE);
    }

    /** A round only starts when the bank can pay the worst case the rules allow for its bet. */
    public boolean canCover(double bet, TableRules rules) {
        return balance >= rules.maxPayout(bet);
    }

    public void pay(double amount) {
        balance -= amount;
    }

    public void collect(double amount) {
        balance += amount;
    }
}
