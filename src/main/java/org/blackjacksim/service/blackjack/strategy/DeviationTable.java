package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;

import java.util.List;
import java.util.Optional;

import static org.blackjacksim.model.blackjack.PlayDecision.*;
import static org.blackjacksim.service.blackjack.strategy.Deviation.Kind.*;

/**
 * Ordered list of deviations; the first one that matches and is legal wins.
 */
public final class DeviationTable {

    /** Hi-Lo insurance index. */
    public static final double INSURANCE_INDEX = 3.0;

    private static final List<Deviation> ILLUSTRIOUS_18_AND_FAB_4 = List.of(
            // surrender
            Deviation.above(Deviation.Kind.SURRENDER, 14, 10, 3, PlayDecision.SURRENDER),
            Deviation.above(Deviation.Kind.SURRENDER, 15, 10, 0, PlayDecision.SURRENDER),
            Deviation.above(Deviation.Kind.SURRENDER, 15, 9, 2, PlayDecision.SURRENDER),
            Deviation.above(Deviation.Kind.SURRENDER, 15, 1, 1, PlayDecision.SURRENDER),
            // pairs
            Deviation.above(PAIR, 20, 5, 5, SPLIT),
            Deviation.above(PAIR, 20, 6, 4, SPLIT),
            // hard totals
            Deviation.above(HARD, 16, 10, 0, STAND),
            Deviation.above(HARD, 15, 10, 4, STAND),
            Deviation.above(HARD, 10, 10, 4, DOUBLE),
            Deviation.above(HARD, 12, 3, 2, STAND),
            Deviation.above(HARD, 12, 2, 3, STAND),
            Deviation.above(HARD, 11, 1, 1, DOUBLE),
            Deviation.above(HARD, 9, 2, 1, DOUBLE),
            Deviation.above(HARD, 10, 1, 4, DOUBLE),
            Deviation.above(HARD, 9, 7, 3, DOUBLE),
            Deviation.above(HARD, 16, 9, 5, STAND),
            Deviation.below(HARD, 13, 2, -1, HIT),
            Deviation.below(HARD, 12, 4, -1, HIT),
            Deviation.below(HARD, 12, 5, -2, HIT),
            Deviation.below(HARD, 12, 6, -1, HIT),
            Deviation.below(HARD, 13, 3, -2, HIT)
    );

    private static final DeviationTable NONE = new DeviationTable(List.of());
    private static final DeviationTable STANDARD = new DeviationTable(ILLUSTRIOUS_18_AND_FAB_4);

    private final List<Deviation> deviations;

    public DeviationTable(List<Deviation> deviations) {
        this.deviations = List.copyOf(deviations);
    }

    public static DeviationTable none() {
        return NONE;
    }

    public static DeviationTable illustrious18() {
        return STANDARD;
    }

    public Optional<PlayDecision> find(HandView hand, int dealerUp, double trueCount) {
        for (Deviation d : deviations) {
            if (d.matches(hand, dealerUp, trueCount) && hand.allows(d.play())) return Optional.of(d.play());
        }
        return Optional.empty();
    }

    public int size() {
        return deviations.size();
    }
}
