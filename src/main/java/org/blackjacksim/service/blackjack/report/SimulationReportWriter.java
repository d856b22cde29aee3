package org.blackjacksim.service.blackjack.report;

import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.exception.SimulationException;
import org.blackjacksim.model.blackjack.AggregateStats;
import org.blackjacksim.model.blackjack.SimulationResult;
import org.blackjacksim.service.blackjack.simulation.SimulationReport;
import org.springframework.stereotype.Component;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Plain-text rendering of a batch: one line per run (when present) then one block per strategy.
 */
@Slf4j
@Component
public class SimulationReportWriter {

    /** Writes to {@code outputFile}, or to standard output when it is null or blank. */
    public void write(SimulationReport report, String outputFile) {
        if (outputFile == null || outputFile.isBlank()) {
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            write(report, out);
            out.flush();
            return;
        }
        Path path = Path.of(outputFile);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(report, w);
        } catch (IOException e) {
            throw new SimulationException("Cannot write report to " + path, e);
        }
        log.info("Report written to {}", path.toAbsolutePath());
    }

    public void write(SimulationReport report, Writer writer) {
        PrintWriter out = writer instanceof PrintWriter ? (PrintWriter) writer : new PrintWriter(writer);
        for (SimulationResult r : report.getResults()) {
            out.println(runLine(r));
        }
        if (!report.getResults().isEmpty()) out.println();

        for (AggregateStats s : report.getStats().values()) {
            out.println(summaryBlock(s));
        }
        out.println(String.format(Locale.ROOT, "Runs: %d requested, %d aggregated, %d excluded (%d ms)",
                report.getRequestedRuns(), report.getAggregatedRuns(), report.failureCount(),
                report.getElapsedMillis()));
        for (String f : report.getFailures()) {
            out.println("  excluded " + f);
        }
        out.flush();
    }

    String runLine(SimulationResult r) {
        return String.format(Locale.ROOT,
                "[%s #%d] hands=%d end=%s start=%.2f final=%.2f net=%+.2f W/P/L=%d/%d/%d",
                r.getStrategy(), r.getRunIndex(), r.getHandsPlayed(), r.getTerminalReason(),
                r.getStartingBalance(), r.getEndingBalance(), r.netProfit(),
                r.getWins(), r.getPushes(), r.getLosses());
    }

    String summaryBlock(AggregateStats s) {
        return String.format(Locale.ROOT,
                "=== %s ===%n"
                        + "  runs              %d/%d (early endings %d)%n"
                        + "  total net profit  %+.2f%n"
                        + "  mean net profit   %+.2f%n"
                        + "  profit/unit bet   %+.4f%n"
                        + "  win/push/loss     %.2f%% / %.2f%% / %.2f%%%n"
                        + "  avg hands         %.1f%n"
                        + "  avg net per hand  %+.4f%n"
                        + "  blackjacks        %d",
                s.getStrategy(), s.getAggregatedRuns(), s.getRequestedRuns(), s.getEarlyEndings(),
                s.getTotalNetProfit(), s.getMeanNetProfit(), s.getProfitPerUnitBet(),
                s.getWinRate() * 100, s.getPushRate() * 100, s.getLossRate() * 100,
                s.getAverageHandsSurvived(), s.getAverageWinningsPerHand(), s.getPlayerBlackjacks());
    }
}
