package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;
import org.blackjacksim.model.blackjack.rules.TableRules;
import org.blackjacksim.service.blackjack.engine.CountSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.blackjacksim.model.blackjack.Cards.card;
import static org.blackjacksim.model.blackjack.Cards.hand;

class CountingStrategyTest {

    private final BettingPolicy betting = new MarginBettingPolicy(2.0, 1);

    private static CountSnapshot snapshot(int running, double decksRemaining) {
        return new CountSnapshot(running, running / decksRemaining, decksRemaining, 6);
    }

    @Test
    void normalizedCount_balancedSystemIsTrueCount() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);

        assertThat(hiLo.normalizedCount(snapshot(8, 4))).isEqualTo(2.0);
    }

    @Test
    void normalizedCount_levelTwoIsHalved() {
        CountingStrategy halves = new CountingStrategy(CountingSystem.WONG_HALVES, betting);

        assertThat(halves.normalizedCount(snapshot(8, 4))).isEqualTo(1.0);
    }

    @Test
    void normalizedCount_unbalancedSystemRemovesDealtImbalance() {
        CountingStrategy ko = new CountingStrategy(CountingSystem.KO, betting);

        // two decks dealt at +4 each is a neutral KO count
        assertThat(ko.normalizedCount(snapshot(8, 4))).isEqualTo(0.0);
    }

    @Test
    void betAmount_followsPolicyOnNormalizedCount() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);

        assertThat(hiLo.betAmount(snapshot(16, 4), TableRules.defaults(), 500)).isEqualTo(35.0);
        assertThat(hiLo.betAmount(snapshot(-8, 4), TableRules.defaults(), 500)).isEqualTo(5.0);
    }

    @Test
    void playDecision_deviationOverridesBasicStrategy() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);
        HandView sixteen = HandView.of(hand("TH", "6S"), false, true, false);

        assertThat(hiLo.playDecision(sixteen, card("KD"), snapshot(4, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.STAND);
        assertThat(hiLo.playDecision(sixteen, card("KD"), snapshot(-4, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.HIT);
    }

    @Test
    void playDecision_withoutDeviationsUsesBasicStrategyOnly() {
        CountingStrategy plain = new CountingStrategy("plain", CountingSystem.HI_LO, betting,
                DeviationTable.none(), Double.MAX_VALUE);
        HandView sixteen = HandView.of(hand("TH", "6S"), false, true, false);

        assertThat(plain.playDecision(sixteen, card("KD"), snapshot(20, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.HIT);
        assertThat(plain.insuranceDecision(snapshot(100, 1))).isFalse();
    }

    @Test
    void insuranceDecision_fromIndexThree() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);

        assertThat(hiLo.insuranceDecision(snapshot(12, 4))).isTrue();
        assertThat(hiLo.insuranceDecision(snapshot(11, 4))).isFalse();
    }

    @Test
    void cardWeight_delegatesToSystem() {
        CountingStrategy omega = new CountingStrategy(CountingSystem.OMEGA_II, betting);

        assertThat(omega.cardWeight(card("5H"))).isEqualTo(2);
        assertThat(omega.name()).isEqualTo("Omega II");
    }

    @Test
    void playDecision_splittablePairIgnoresTotalDeviations() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);
        HandView eights = HandView.of(hand("8H", "8S"), true, true, false);
        HandView sixes = HandView.of(hand("6H", "6S"), true, true, false);

        assertThat(hiLo.playDecision(eights, card("TD"), snapshot(0, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.SPLIT);
        assertThat(hiLo.playDecision(eights, card("TD"), snapshot(12, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.SPLIT);
        assertThat(hiLo.playDecision(sixes, card("3C"), snapshot(12, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.SPLIT);
    }

    @Test
    void playDecision_splittablePairIsNotSurrendered() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);
        HandView eights = HandView.of(hand("8H", "8S"), true, true, true);

        assertThat(hiLo.playDecision(eights, card("TD"), snapshot(12, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.SPLIT);
    }

    @Test
    void playDecision_pairThatCannotSplitPlaysAsHardTotal() {
        CountingStrategy hiLo = new CountingStrategy(CountingSystem.HI_LO, betting);
        HandView eights = HandView.of(hand("8H", "8S"), false, true, false);

        assertThat(hiLo.playDecision(eights, card("TD"), snapshot(0, 4), TableRules.defaults()))
                .isEqualTo(PlayDecision.STAND);
    }
}
