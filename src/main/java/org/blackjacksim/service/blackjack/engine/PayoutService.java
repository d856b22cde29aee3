package org.blackjacksim.service.blackjack.engine;

import lombok.RequiredArgsConstructor;
import org.blackjacksim.model.blackjack.Hand;
import org.blackjacksim.model.blackjack.HandOutcome;
import org.blackjacksim.model.blackjack.PlayerAccount;
import org.blackjacksim.model.blackjack.TableBank;
import org.blackjacksim.model.blackjack.rules.PayoutRules;
import org.blackjacksim.model.blackjack.rules.TableRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves money between the player account and the table bank once a round is decided.
 */
@RequiredArgsConstructor
public class PayoutService {
    private final PlayerAccount account;
    private final TableBank bank;
    private final TableRules rules;

    public List<HandOutcome> computeAndPay(List<Hand> hands, Hand dealer) {
        List<HandOutcome> outcomes = new ArrayList<>(hands.size());
        for (Hand h : hands) {
            var o = PayoutRules.compute(h, dealer, rules);
            apply(o, h.getBet());
            outcomes.add(o.outcome());
        }
        return outcomes;
    }

    /**
     * Insurance is a side bet, settled on its own before the hand continues.
     */
    public double payInsurance(double insuranceBet, Hand dealer) {
        var o = PayoutRules.insurance(insuranceBet, dealer);
        return apply(o, insuranceBet);
    }

    private double apply(PayoutRules.Outcome o, double bet) {
        if (o.credit() > 0) account.credit(o.credit());
        double net = o.net(bet);
        if (net > 0) bank.pay(net);
        else bank.collect(-net);
        return net;
    }
}
