package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.domain.enums.KnockoutStage;
import com.royal.kotracker.domain.model.FileKnockoutReport;
import com.royal.kotracker.domain.model.Hand;
import com.royal.kotracker.domain.model.HandKnockoutResult;
import com.royal.kotracker.domain.model.StageKnockouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the tournament-level fields of a file report: tournament id, start time,
 * Hero's stack on entering the final table, and the final-table knockout breakdown.
 * 
 * A final-table hand is one played at the final table size with a big blind at or above
 * the minimum. Those hands are split into stages by the number of players seated; the
 * early stage is six players or more. The hand just before the first final-table hand
 * is the pre-final-table hand when it was played at a smaller table.
 */
@Component
public class TournamentSummarizer {
    
    private static final Logger log = LoggerFactory.getLogger(TournamentSummarizer.class);
    
    private static final Pattern TOURNAMENT_IN_FILE_NAME = Pattern.compile("Tournament #(\\d+)");
    
    /**
     * @param report Report to fill in
     * @param chronological Hands of the file, oldest first
     * @param settings Hero name, final table size and minimum big blind
     */
    public void summarize(FileKnockoutReport report, List<Hand> chronological, TrackerSettings settings) {
        report.setTournamentId(resolveTournamentId(report.getPath(), chronological));
        
        chronological.stream()
                .map(Hand::getTimestamp)
                .filter(Objects::nonNull)
                .findFirst()
                .ifPresent(report::setStartTime);
        
        String hero = settings.getHero();
        for (Hand hand : chronological) {
            if (isFinalTableHand(hand, settings) && hand.isSeated(hero)) {
                long stack = hand.stackOf(hero);
                report.setReachedFinalTable(true);
                report.setFinalTableInitialStack(stack);
                report.setFinalTableInitialStackBb(hand.getBb() > 0 ? (double) stack / hand.getBb() : null);
                log.debug("Tournament {}: first final table hand {}, hero stack {}", 
                        report.getTournamentId(), hand.getHandId(), stack);
                break;
            }
        }
        
        classifyHands(report, settings);
    }
    
    /**
     * Flag the final-table and pre-final-table hands of the report and total their knockouts
     * @param report Report whose hand results are in chronological order
     * @param settings Final table size and minimum big blind
     */
    void classifyHands(FileKnockoutReport report, TrackerSettings settings) {
        List<HandKnockoutResult> results = report.getHands();
        int firstFinal = -1;
        for (int i = 0; i < results.size(); i++) {
            HandKnockoutResult result = results.get(i);
            if (!isFinalTableHand(result.getTableSize(), result.getBb(), settings)) {
                continue;
            }
            if (firstFinal < 0) {
                firstFinal = i;
            }
            result.setFinalTable(true);
            report.setFinalTableKnockouts(report.getFinalTableKnockouts() + result.getKnockouts());
            
            int players = result.getPlayersCount();
            if (players >= KnockoutStage.SIX_TO_NINE.getMinPlayers() && players <= settings.getFinalTableSize()) {
                result.setEarlyFinalTable(true);
                report.setEarlyFinalTableKnockouts(report.getEarlyFinalTableKnockouts() + result.getKnockouts());
            }
            KnockoutStage.of(players).ifPresent(stage -> {
                result.setStage(stage);
                report.getStages().computeIfAbsent(stage, s -> new StageKnockouts()).add(result);
            });
        }
        
        if (firstFinal > 0) {
            HandKnockoutResult before = results.get(firstFinal - 1);
            if (before.getTableSize() > 0 && before.getTableSize() < settings.getFinalTableSize()) {
                before.setPreFinalTable(true);
                report.setPreFinalTableKnockouts(before.getKnockouts());
            }
        }
    }
    
    public boolean isFinalTableHand(Hand hand, TrackerSettings settings) {
        return isFinalTableHand(hand.getTableSize(), hand.getBb(), settings);
    }
    
    private boolean isFinalTableHand(int tableSize, long bb, TrackerSettings settings) {
        return tableSize == settings.getFinalTableSize() && bb >= settings.getMinBigBlind();
    }
    
    private String resolveTournamentId(String path, List<Hand> hands) {
        for (Hand hand : hands) {
            if (hand.getTournamentId() != null) {
                return hand.getTournamentId();
            }
        }
        if (path != null) {
            Path fileName = Path.of(path).getFileName();
            Matcher m = TOURNAMENT_IN_FILE_NAME.matcher(fileName != null ? fileName.toString() : path);
            if (m.find()) {
                return m.group(1);
            }
        }
        log.debug("No tournament id found for {}", path);
        return null;
    }
}
