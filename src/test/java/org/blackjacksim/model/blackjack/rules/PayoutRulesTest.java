package org.blackjacksim.model.blackjack.rules;

import org.blackjacksim.model.blackjack.Hand;
import org.blackjacksim.model.blackjack.HandOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.blackjacksim.model.blackjack.Cards.card;

class PayoutRulesTest {

    private final TableRules rules = TableRules.defaults();

    private static Hand player(double bet, String... codes) {
        Hand h = Hand.player(bet);
        for (String c : codes) h.addCard(card(c));
        return h;
    }

    private static Hand dealer(String... codes) {
        Hand h = Hand.dealer();
        for (String c : codes) h.addCard(card(c));
        return h;
    }

    @Test
    void compute_naturalAgainstTwentyOne_paysThreeToTwo() {
        var o = PayoutRules.compute(player(10, "AH", "KS"), dealer("TD", "7C", "4H"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.BLACKJACK);
        assertThat(o.net(10)).isEqualTo(15.0);
    }

    @Test
    void compute_bothNaturals_push() {
        var o = PayoutRules.compute(player(10, "AH", "KS"), dealer("AD", "KC"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.PUSH);
        assertThat(o.net(10)).isZero();
    }

    @Test
    void compute_surrender_returnsHalf() {
        Hand h = player(10, "TH", "6S");
        h.surrender();

        var o = PayoutRules.compute(h, dealer("TD", "9C"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.SURRENDER);
        assertThat(o.net(10)).isEqualTo(-5.0);
    }

    @Test
    void compute_playerBustLosesEvenIfDealerBusts() {
        var o = PayoutRules.compute(player(10, "TH", "6S", "9D"), dealer("TD", "6C", "KH"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.LOSE);
        assertThat(o.credit()).isZero();
    }

    @Test
    void compute_dealerBust_paysEvenMoney() {
        var o = PayoutRules.compute(player(10, "TH", "2S"), dealer("TD", "6C", "KH"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.WIN);
        assertThat(o.credit()).isEqualTo(20.0);
    }

    @Test
    void compute_dealerNaturalBeatsTwentyOne() {
        var o = PayoutRules.compute(player(10, "7H", "7S", "7D"), dealer("AD", "QC"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.LOSE);
    }

    @Test
    void compute_equalTotals_push() {
        var o = PayoutRules.compute(player(10, "TH", "8S"), dealer("9D", "9C"), rules);

        assertThat(o.outcome()).isEqualTo(HandOutcome.PUSH);
        assertThat(o.credit()).isEqualTo(10.0);
    }

    @Test
    void compute_doubledBetPaysOnDoubledAmount() {
        Hand h = player(10, "6H", "5S");
        h.doubleDown();
        h.addCard(card("TD"));

        var o = PayoutRules.compute(h, dealer("TC", "8C"), rules);

        assertThat(o.net(h.getBet())).isEqualTo(20.0);
    }

    @Test
    void insurance_paysTwoToOneOnDealerNatural() {
        assertThat(PayoutRules.insurance(5, dealer("AD", "KC")).net(5)).isEqualTo(10.0);
        assertThat(PayoutRules.insurance(5, dealer("AD", "7C")).net(5)).isEqualTo(-5.0);
    }
}
