package org.blackjacksim.service.blackjack.simulation;

import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.config.SimulationConfig;
import org.blackjacksim.model.blackjack.*;
import org.blackjacksim.model.blackjack.rules.TableRules;
import org.blackjacksim.service.blackjack.engine.CountTracker;
import org.blackjacksim.service.blackjack.engine.RoundEngine;
import org.blackjacksim.service.blackjack.engine.RoundResult;
import org.blackjacksim.service.blackjack.strategy.Strategy;

import java.util.Random;

/**
 * Plays one run of a strategy: rounds on a private shoe and account until the hand limit
 * or until the player can no longer cover the minimum bet.
 */
@Slf4j
public class SimulationRunner {
    private final Strategy strategy;
    private final SimulationConfig config;
    private final int runIndex;
    private final long seed;

    public SimulationRunner(Strategy strategy, SimulationConfig config, int runIndex, long seed) {
        this.strategy = strategy;
        this.config = config;
        this.runIndex = runIndex;
        this.seed = seed;
    }

    public SimulationResult run() {
        TableRules rules = config.tableRules();
        Shoe shoe = Shoe.build(rules.getNumDecks(), rules.getPenetration(), new Random(seed));
        CountTracker count = new CountTracker(shoe, strategy::cardWeight);
        PlayerAccount account = new PlayerAccount(config.getPlayerBalance());
        TableBank bank = new TableBank(rules.getTableBalance());
        RoundEngine engine = new RoundEngine(shoe, count, strategy, rules, account, bank);

        int hands = 0, wins = 0, pushes = 0, losses = 0, blackjacks = 0;
        TerminalReason reason = TerminalReason.HAND_LIMIT_REACHED;
        while (hands < config.getMaxHands()) {
            if (shoe.needsReshuffle()) shoe.reshuffle();
            RoundResult r = engine.playRound();
            if (!r.played()) {
                reason = r.stopReason();
                break;
            }
            hands++;
            wins += r.wins();
            pushes += r.pushes();
            losses += r.losses();
            blackjacks += r.playerBlackjacks();
        }

        log.debug("[{}#{}] {} after {} hands, balance {} -> {}", strategy.name(), runIndex, reason, hands,
                account.getStartingBalance(), account.getBalance());
        return SimulationResult.builder()
                .strategy(strategy.name())
                .runIndex(runIndex)
                .seed(seed)
                .startingBalance(account.getStartingBalance())
                .endingBalance(account.getBalance())
                .handsPlayed(hands)
                .terminalReason(reason)
                .wins(wins)
                .pushes(pushes)
                .losses(losses)
                .playerBlackjacks(blackjacks)
                .totalWagered(account.getTotalWagered())
                .build();
    }
}
