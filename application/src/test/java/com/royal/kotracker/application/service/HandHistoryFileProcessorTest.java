package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.domain.enums.FinalHandRule;
import com.royal.kotracker.domain.enums.KnockoutStage;
import com.royal.kotracker.domain.model.FileKnockoutReport;
import com.royal.kotracker.domain.model.HandKnockoutResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandHistoryFileProcessorTest {
    
    private SimpleMeterRegistry meterRegistry;
    private HandHistoryFileProcessor fileProcessor;
    private TrackerSettings settings;
    
    @BeforeEach
    void setUp() {
        settings = TrackerSettings.defaults();
        meterRegistry = new SimpleMeterRegistry();
        SidePotEngine sidePotEngine = new SidePotEngine();
        fileProcessor = new HandHistoryFileProcessor(
                new HandSplitter(),
                new HandRecordParser(sidePotEngine, settings),
                new EliminationTracker(),
                new KnockoutAttributor(),
                new TournamentSummarizer(),
                new MetricsService(meterRegistry));
    }
    
    @Test
    void testSingleHandKnockout() {
        FileKnockoutReport report = process("single-knockout.txt", settings);
        
        assertEquals(1, report.getHandsParsed());
        assertEquals(1, report.getKnockouts());
        assertEquals(1, report.getAttempts());
        assertEquals("100", report.getTournamentId());
    }
    
    @Test
    void testLowBlindHandIsFiltered() {
        FileKnockoutReport report = process("single-knockout-low-blinds.txt", settings);
        
        assertEquals(1, report.getHandsParsed());
        assertEquals(0, report.getKnockouts());
    }
    
    @Test
    void testFilesAreReplayedOldestFirst() {
        FileKnockoutReport report = process("tournament-555.txt", settings);
        
        assertEquals(2, report.getHandsParsed());
        assertEquals(1, report.getKnockouts());
        assertEquals(1, report.getAttempts());
        assertEquals("HA", report.getHands().get(0).getHandId());
        assertEquals(List.of("Villain"), report.getHands().get(0).getEliminated());
        assertEquals("Villain", report.getHands().get(0).getCredits().get(0).getEliminatedPlayer());
        // Hero is never reported as eliminated
        assertTrue(report.getHands().get(1).getEliminated().isEmpty());
    }
    
    @Test
    void testTournamentSummaryIsFilled() {
        FileKnockoutReport report = process("tournament-555.txt", settings);
        
        assertEquals("555", report.getTournamentId());
        assertEquals(LocalDateTime.of(2025, 2, 1, 10, 0), report.getStartTime());
        assertTrue(report.isReachedFinalTable());
        assertEquals(1000L, report.getFinalTableInitialStack().longValue());
        assertEquals(5.0, report.getFinalTableInitialStackBb().doubleValue(), 0.0001);
    }
    
    @Test
    void testBlindsWithTrailingAnteAreFiltered() {
        List<String> lines = new ArrayList<>(HandHistoryFixtures.load("single-knockout.txt"));
        lines.set(0, "Poker Hand #HD1: Tournament #100, Bounty Hunters Hold'em No Limit - Level2 (25/50/5) - 2025/01/01 12:00:00");
        
        FileKnockoutReport report = fileProcessor.process("single-knockout-ante.txt", lines, settings);
        
        assertEquals(1, report.getHandsParsed());
        assertEquals(50L, report.getHands().get(0).getBb());
        assertEquals(0, report.getKnockouts());
        assertEquals(0, report.getAttempts());
    }
    
    @Test
    void testFinalTableHandsAreStaged() {
        FileKnockoutReport report = process("tournament-555.txt", settings);
        
        HandKnockoutResult first = report.getHands().get(0);
        assertTrue(first.isFinalTable());
        assertFalse(first.isEarlyFinalTable());
        assertEquals(3, first.getPlayersCount());
        assertEquals(KnockoutStage.TWO_TO_THREE, first.getStage());
        assertEquals(1000L, first.getHeroStack().longValue());
        assertEquals(1, report.getFinalTableKnockouts());
        assertEquals(0, report.getEarlyFinalTableKnockouts());
        assertEquals(0, report.getPreFinalTableKnockouts());
        assertEquals(2, report.getStages().get(KnockoutStage.TWO_TO_THREE).getHands());
        assertEquals(1, report.getStages().get(KnockoutStage.TWO_TO_THREE).getKnockouts());
        assertEquals(1, report.getStages().get(KnockoutStage.TWO_TO_THREE).getAttempts());
        assertFalse(report.getStages().containsKey(KnockoutStage.SIX_TO_NINE));
    }
    
    @Test
    void testKnockoutJustBeforeFinalTable() {
        FileKnockoutReport report = process("pre-final-table.txt", settings);
        
        assertEquals(2, report.getHandsParsed());
        assertEquals(1, report.getKnockouts());
        assertEquals(1, report.getPreFinalTableKnockouts());
        assertEquals(0, report.getFinalTableKnockouts());
        assertTrue(report.getHands().get(0).isPreFinalTable());
        assertFalse(report.getHands().get(0).isFinalTable());
        assertEquals(5, report.getHands().get(0).getTableSize());
        assertTrue(report.getHands().get(1).isFinalTable());
        assertEquals(1500L, report.getFinalTableInitialStack().longValue());
        assertEquals(7.5, report.getFinalTableInitialStackBb().doubleValue(), 0.0001);
    }
    
    @Test
    void testAnteAndRaiseAllInKnockout() {
        FileKnockoutReport report = process("ante-raise-allin.txt", settings);
        
        assertEquals(2, report.getHandsParsed());
        assertEquals(1, report.getKnockouts());
        assertEquals(1, report.getAttempts());
    }
    
    @Test
    void testUncoveredBigStackIsNotCredited() {
        FileKnockoutReport report = process("multiway-side-pot.txt", settings);
        
        assertEquals(1, report.getKnockouts());
        assertEquals(1, report.getAttempts());
        assertEquals(List.of("ShortStack", "BigStack"), report.getHands().get(0).getEliminated());
        assertEquals("ShortStack", report.getHands().get(0).getCredits().get(0).getEliminatedPlayer());
    }
    
    @Test
    void testNoKnockoutWhenHeroBusts() {
        FileKnockoutReport report = process("hero-loses.txt", settings);
        
        assertEquals(0, report.getKnockouts());
        assertTrue(report.getHands().get(0).getEliminated().isEmpty());
    }
    
    @Test
    void testFinalStackRuleOnLastHand() {
        TrackerSettings finalStack = settings.toBuilder().finalHandRule(FinalHandRule.FINAL_STACK).build();
        
        FileKnockoutReport report = process("single-knockout.txt", finalStack);
        
        assertEquals(1, report.getKnockouts());
    }
    
    @Test
    void testHeroNameIsConfigurable() {
        List<String> lines = new ArrayList<>();
        for (String line : HandHistoryFixtures.load("single-knockout.txt")) {
            lines.add(line.replace("Hero", "Maverick"));
        }
        
        assertEquals(0, fileProcessor.process("renamed.txt", lines, settings).getKnockouts());
        assertEquals(1, fileProcessor.process("renamed.txt", lines, 
                settings.toBuilder().hero("Maverick").build()).getKnockouts());
    }
    
    @Test
    void testEmptyFile() {
        FileKnockoutReport report = fileProcessor.process("empty.txt", Collections.emptyList(), settings);
        
        assertEquals(0, report.getHandsParsed());
        assertEquals(0, report.getKnockouts());
        assertTrue(report.getHands().isEmpty());
    }
    
    @Test
    void testMetricsAreRecorded() {
        process("tournament-555.txt", settings);
        
        assertEquals(2.0, meterRegistry.get("hands.parsed").counter().count());
        assertEquals(1.0, meterRegistry.get("knockouts.credited").counter().count());
    }
    
    private FileKnockoutReport process(String fixture, TrackerSettings runSettings) {
        return fileProcessor.process(fixture, HandHistoryFixtures.load(fixture), runSettings);
    }
}
