package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.domain.model.FileKnockoutReport;
import com.royal.kotracker.domain.model.Hand;
import com.royal.kotracker.domain.model.HandKnockoutResult;
import com.royal.kotracker.domain.model.HandRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the whole pipeline over the lines of one file:
 * split -> parse -> replay oldest first -> eliminations -> knockouts.
 */
@Service
public class HandHistoryFileProcessor {
    
    private static final Logger log = LoggerFactory.getLogger(HandHistoryFileProcessor.class);
    
    private final HandSplitter handSplitter;
    private final HandRecordParser handRecordParser;
    private final EliminationTracker eliminationTracker;
    private final KnockoutAttributor knockoutAttributor;
    private final TournamentSummarizer tournamentSummarizer;
    private final MetricsService metricsService;
    
    public HandHistoryFileProcessor(HandSplitter handSplitter,
                                    HandRecordParser handRecordParser,
                                    EliminationTracker eliminationTracker,
                                    KnockoutAttributor knockoutAttributor,
                                    TournamentSummarizer tournamentSummarizer,
                                    MetricsService metricsService) {
        this.handSplitter = handSplitter;
        this.handRecordParser = handRecordParser;
        this.eliminationTracker = eliminationTracker;
        this.knockoutAttributor = knockoutAttributor;
        this.tournamentSummarizer = tournamentSummarizer;
        this.metricsService = metricsService;
    }
    
    /**
     * Count Hero's knockouts in one file
     * @param path File path, used for reporting and as a tournament id fallback
     * @param lines Every line of the file
     * @param settings Run settings
     */
    public FileKnockoutReport process(String path, List<String> lines, TrackerSettings settings) {
        FileKnockoutReport report = FileKnockoutReport.empty(path);
        
        List<Hand> hands = parseHands(path, lines, report);
        // Files are written newest hand first
        Collections.reverse(hands);
        
        List<List<String>> eliminated = eliminationTracker.eliminatedPerHand(hands, settings.getFinalHandRule());
        for (int i = 0; i < hands.size(); i++) {
            Hand hand = hands.get(i);
            List<String> busted = eliminated.get(i);
            busted.remove(settings.getHero());
            HandKnockoutResult result = knockoutAttributor.attribute(hand, busted, settings);
            
            report.getHands().add(result);
            report.setKnockouts(report.getKnockouts() + result.getKnockouts());
            report.setAttempts(report.getAttempts() + result.getAttempts());
            metricsService.recordEliminations(busted.size());
        }
        
        tournamentSummarizer.summarize(report, hands, settings);
        metricsService.recordKnockouts(report.getKnockouts());
        
        log.debug("{}: {} hands, {} skipped, {} KO(s), {} attempt(s)", 
                path, report.getHandsParsed(), report.getHandsSkipped(), report.getKnockouts(), report.getAttempts());
        return report;
    }
    
    /**
     * Parse every hand in file order; a hand that fails to parse is logged and left out
     */
    private List<Hand> parseHands(String path, List<String> lines, FileKnockoutReport report) {
        List<HandRange> ranges = handSplitter.split(lines);
        List<Hand> hands = new ArrayList<>(ranges.size());
        for (HandRange range : ranges) {
            try {
                hands.add(handRecordParser.parse(lines, range).getHand());
            } catch (RuntimeException e) {
                report.setHandsSkipped(report.getHandsSkipped() + 1);
                metricsService.recordHandSkipped();
                log.warn("{}: skipping hand at line {}: {}", path, range.getStart() + 1, e.getMessage(), e);
            }
        }
        report.setHandsParsed(hands.size());
        metricsService.recordHandsParsed(hands.size());
        return hands;
    }
}
