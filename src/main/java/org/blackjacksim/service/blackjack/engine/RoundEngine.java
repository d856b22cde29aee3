package org.blackjacksim.service.blackjack.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.exception.InsufficientFundsException;
import org.blackjacksim.model.blackjack.*;
import org.blackjacksim.model.blackjack.rules.DealerRules;
import org.blackjacksim.model.blackjack.rules.DealingRules;
import org.blackjacksim.model.blackjack.rules.HandRules;
import org.blackjacksim.model.blackjack.rules.TableRules;
import org.blackjacksim.service.blackjack.strategy.Strategy;

import java.util.*;

/**
 * Plays single rounds for one run:
 * bet, initial deal, insurance, player hands (splits queued), dealer, settlement.
 * Every object it touches belongs to that run only.
 */
@Slf4j
public class RoundEngine {
    private final Shoe shoe;
    private final CountTracker count;
    private final Strategy strategy;
    private final TableRules rules;
    private final PlayerAccount account;
    private final TableBank bank;
    private final PayoutService payouts;

    @Getter
    private RoundPhase phase = RoundPhase.DONE;

    public RoundEngine(Shoe shoe, CountTracker count, Strategy strategy, TableRules rules,
                       PlayerAccount account, TableBank bank) {
        this.shoe = shoe;
        this.count = count;
        this.strategy = strategy;
        this.rules = rules;
        this.account = account;
        this.bank = bank;
        this.payouts = new PayoutService(account, bank, rules);
    }

    public RoundResult playRound() {
        phase = RoundPhase.BET_PLACED;
        if (!account.canCover(rules.getMinBet())) {
            phase = RoundPhase.DONE;
            return RoundResult.stopped(TerminalReason.BANKRUPT);
        }
        double bet = clampBet(strategy.betAmount(count.snapshot(), rules, account.getBalance()));
        if (!bank.canCover(bet, rules)) {
            phase = RoundPhase.DONE;
            return RoundResult.stopped(TerminalReason.TABLE_LIMIT_REACHED);
        }
        try {
            account.debit(bet);
        } catch (InsufficientFundsException ex) {
            phase = RoundPhase.DONE;
            return RoundResult.stopped(TerminalReason.BANKRUPT);
        }
        double startBalance = account.getBalance() + bet;

        phase = RoundPhase.INITIAL_DEAL;
        Hand player = Hand.player(bet);
        Hand dealer = Hand.dealer();
        DealingRules.dealInitial(shoe, player, dealer, count::observe);
        Card up = dealer.upcard();

        if (up.isAce() && rules.isAllowInsurance()) {
            phase = RoundPhase.INSURANCE_OFFER;
            offerInsurance(bet, dealer);
        }

        List<Hand> hands;
        boolean holeRevealed = false;
        if ((up.isAce() || up.value() == 10) && dealer.isBlackjack()) {
            // dealer peeks: nobody plays against a natural
            revealHole(dealer);
            holeRevealed = true;
            hands = List.of(player);
        } else if (player.isBlackjack()) {
            hands = List.of(player);
        } else {
            phase = RoundPhase.PLAYER_TURN;
            hands = playHands(player, up);

            phase = RoundPhase.DEALER_TURN;
            if (hands.stream().anyMatch(h -> !h.isBust() && !h.isSurrendered())) {
                revealHole(dealer);
                holeRevealed = true;
                while (DealerRules.shouldHit(dealer, rules)) draw(dealer);
            }
        }

        phase = RoundPhase.SETTLEMENT;
        if (!holeRevealed) revealHole(dealer);
        List<HandOutcome> outcomes = payouts.computeAndPay(hands, dealer);
        int blackjacks = (int) outcomes.stream().filter(o -> o == HandOutcome.BLACKJACK).count();

        phase = RoundPhase.DONE;
        return new RoundResult(null, outcomes, blackjacks, account.getBalance() - startBalance);
    }

    private double clampBet(double requested) {
        double min = rules.getMinBet();
        double bet = requested;
        if (Double.isNaN(bet) || bet < min) bet = min;
        if (bet > account.getBalance()) bet = account.getBalance();
        if (bet != requested) {
            log.debug("[{}] bet {} clamped to {}", strategy.name(), requested, bet);
        }
        return bet;
    }

    private void offerInsurance(double bet, Hand dealer) {
        double insurance = bet / 2;
        if (!account.canCover(insurance) || !strategy.insuranceDecision(count.snapshot())) return;
        account.debit(insurance);
        payouts.payInsurance(insurance, dealer);
    }

    /**
     * Split hands go to the front of the queue so they are played right after the hand they came from.
     */
    private List<Hand> playHands(Hand first, Card up) {
        Deque<Hand> pending = new ArrayDeque<>();
        pending.push(first);
        List<Hand> done = new ArrayList<>();
        int handsInRound = 1;

        while (!pending.isEmpty()) {
            Hand h = pending.pop();
            while (!h.isFinished()) {
                if (h.bestTotal() == 21) { h.stand(); break; }

                HandView view = HandRules.view(h, handsInRound, rules, account);
                PlayDecision requested = strategy.playDecision(view, up, count.snapshot(), rules);
                PlayDecision decision = HandRules.normalize(requested, view);
                if (decision != requested) {
                    log.debug("[{}] illegal play {} on {} replaced by STAND", strategy.name(), requested, h);
                }

                switch (decision) {
                    case HIT -> draw(h);
                    case STAND -> h.stand();
                    case DOUBLE -> {
                        account.debit(h.getBet());
                        h.doubleDown();
                        draw(h);
                        h.stand();
                    }
                    case SPLIT -> {
                        boolean aces = h.getCards().get(0).isAce();
                        account.debit(h.getBet());
                        Hand other = h.split();
                        handsInRound++;
                        draw(h);
                        draw(other);
                        if (aces && rules.isSplitAcesOneCard()) {
                            h.stand();
                            other.stand();
                        }
                        pending.push(other);
                    }
                    case SURRENDER -> h.surrender();
                }
            }
            done.add(h);
        }
        return done;
    }

    private void draw(Hand h) {
        Card c = shoe.dealOne();
        h.addCard(c);
        count.observe(c);
    }

    private void revealHole(Hand dealer) {
        count.observe(DealingRules.holeCard(dealer));
    }
}
