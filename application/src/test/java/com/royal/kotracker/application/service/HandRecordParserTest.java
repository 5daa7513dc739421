package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.domain.model.Hand;
import com.royal.kotracker.domain.model.HandRange;
import com.royal.kotracker.domain.model.ParsedHand;
import com.royal.kotracker.domain.model.Pot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HandRecordParserTest {
    
    private HandSplitter handSplitter;
    private HandRecordParser handRecordParser;
    
    @BeforeEach
    void setUp() {
        handSplitter = new HandSplitter();
        handRecordParser = new HandRecordParser(new SidePotEngine(), TrackerSettings.defaults());
    }
    
    @Test
    void testAntesBlindsAndRaiseDeltas() {
        List<String> lines = HandHistoryFixtures.load("ante-raise-allin.txt");
        HandRange range = handSplitter.split(lines).get(1);
        
        Hand hand = handRecordParser.parse(lines, range).getHand();
        
        assertEquals("GG1234567890", hand.getHandId());
        assertEquals("206881959", hand.getTournamentId());
        assertEquals(LocalDateTime.of(2025, 1, 1, 16, 38, 15), hand.getTimestamp());
        assertEquals(9, hand.getTableSize());
        assertEquals(400L, hand.getBb());
        
        assertEquals(15000L, hand.stackOf("Hero"));
        assertEquals(5401L, hand.stackOf("Victim"));
        assertEquals(5401L, hand.contributionOf("Hero"));
        assertEquals(5401L, hand.contributionOf("Victim"));
        assertEquals(480L, hand.contributionOf("Player3"));
        assertEquals(11522L, hand.collectedBy("Hero"));
    }
    
    @Test
    void testPotsConserveContributedChips() {
        List<String> lines = HandHistoryFixtures.load("ante-raise-allin.txt");
        
        Hand hand = handRecordParser.parse(lines, handSplitter.split(lines).get(1)).getHand();
        
        assertEquals(2, hand.getPots().size());
        assertEquals(hand.getTotalContributed(), hand.getTotalPotSize());
        
        Pot main = hand.getPots().get(0);
        assertEquals(1440L, main.getSize());
        assertEquals(Set.of("Hero", "Victim", "Player3"), main.getEligible());
        
        Pot side = hand.getPots().get(1);
        assertEquals(9842L, side.getSize());
        assertEquals(Set.of("Hero", "Victim"), side.getEligible());
        assertTrue(side.isWonBy("Hero"));
    }
    
    @Test
    void testUncalledBetIsRefunded() {
        List<String> lines = Arrays.asList(
                "Poker Hand #U1: Tournament #7, Hold'em No Limit - Level3(50/100) - 2025/03/01 09:00:00",
                "Table '7 1' 6-max Seat #1 is the button",
                "Seat 1: Hero (3,000 in chips)",
                "Seat 2: Villain (2,000 in chips)",
                "Hero: posts small blind 50",
                "Villain: posts big blind 100",
                "*** HOLE CARDS ***",
                "Hero: raises 2,000 to 2,100",
                "Villain: folds",
                "Uncalled bet (2,000) returned to Hero",
                "Hero collected 200 from pot");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(6, hand.getTableSize());
        assertEquals(100L, hand.contributionOf("Hero"));
        assertEquals(100L, hand.contributionOf("Villain"));
        assertEquals(1, hand.getPots().size());
        assertEquals(200L, hand.getPots().get(0).getSize());
        assertEquals(Set.of("Hero"), hand.getPots().get(0).getWinners());
    }
    
    @Test
    void testFullyReturnedPostNetsToZero() {
        List<String> lines = Arrays.asList(
                "Poker Hand #U2: Tournament #7, Hold'em No Limit - Level3(50/100) - 2025/03/01 09:05:00",
                "Seat 1: Hero (3,000 in chips)",
                "Seat 2: Villain (2,000 in chips)",
                "Hero: posts big blind 100",
                "*** HOLE CARDS ***",
                "Villain: folds",
                "Uncalled bet (100) returned to Hero");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(0L, hand.contributionOf("Hero"));
        assertEquals(0L, hand.getTotalContributed());
        assertTrue(hand.getPots().isEmpty());
        assertEquals(hand.getTotalContributed(), hand.getTotalPotSize());
    }
    
    @Test
    void testReturnedPostLeavesOnlyAntes() {
        List<String> lines = Arrays.asList(
                "Poker Hand #U4: Tournament #7, Hold'em No Limit - Level3(50/100) - 2025/03/01 09:07:00",
                "Seat 1: Hero (3,000 in chips)",
                "Seat 2: Villain (2,000 in chips)",
                "Hero: posts the ante 10",
                "Villain: posts the ante 10",
                "Hero: posts big blind 100",
                "*** HOLE CARDS ***",
                "Villain: folds",
                "Uncalled bet (100) returned to Hero",
                "Hero collected 20 from pot");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(10L, hand.contributionOf("Hero"));
        assertEquals(10L, hand.contributionOf("Villain"));
        assertEquals(1, hand.getPots().size());
        assertEquals(20L, hand.getPots().get(0).getSize());
        assertEquals(Set.of("Hero"), hand.getPots().get(0).getWinners());
        assertEquals(hand.getTotalContributed(), hand.getTotalPotSize());
    }
    
    @Test
    void testFoldedSmallBlindWithUncalledBigBlind() {
        List<String> lines = Arrays.asList(
                "Poker Hand #U3: Tournament #7, Hold'em No Limit - Level3(50/100) - 2025/03/01 09:06:00",
                "Seat 1: Hero (3,000 in chips)",
                "Seat 2: Villain (2,000 in chips)",
                "Hero: posts small blind 50",
                "Villain: posts big blind 100",
                "*** HOLE CARDS ***",
                "Hero: folds",
                "Uncalled bet (50) returned to Villain",
                "Villain collected 100 from pot");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(50L, hand.contributionOf("Hero"));
        assertEquals(50L, hand.contributionOf("Villain"));
        assertEquals(1, hand.getPots().size());
        assertEquals(100L, hand.getPots().get(0).getSize());
        assertEquals(hand.getTotalContributed(), hand.getTotalPotSize());
    }
    
    @Test
    void testRaiseDeltaIsTakenPerStreet() {
        List<String> lines = Arrays.asList(
                "Poker Hand #S1: Tournament #7, Hold'em No Limit - Level3(50/100)",
                "Seat 1: Hero (5000 in chips)",
                "Seat 2: Villain (5000 in chips)",
                "Hero: posts ante 10",
                "Villain: posts ante 10",
                "Hero: posts small blind 50",
                "Villain: posts big blind 100",
                "*** HOLE CARDS ***",
                "Hero: raises 200 to 300",
                "Villain: calls 200",
                "*** FLOP *** [2c 5d 8s]",
                "Villain: bets 200",
                "Hero: raises 400 to 600",
                "Villain: calls 400",
                "*** TURN *** [2c 5d 8s] [Kd]",
                "Hero: checks",
                "Villain: checks",
                "Hero collected 1820 from pot");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(910L, hand.contributionOf("Hero"));
        assertEquals(910L, hand.contributionOf("Villain"));
        assertEquals(1820L, hand.getTotalPotSize());
    }
    
    @Test
    void testCollectedFromSeveralPotsIsSummed() {
        List<String> lines = Arrays.asList(
                "Poker Hand #C1: Tournament #7, Hold'em No Limit - Level3(50/100)",
                "Seat 1: Hero (3000 in chips)",
                "Seat 2: Short (300 in chips)",
                "Seat 3: Mid (800 in chips)",
                "*** HOLE CARDS ***",
                "Short: bets 300 and is all-in",
                "Mid: calls 800 and is all-in",
                "Hero: calls 800",
                "*** SHOWDOWN ***",
                "Hero collected 1,000 from side pot",
                "Hero collected 900 from main pot");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(1900L, hand.collectedBy("Hero"));
        assertEquals(1900L, hand.getTotalPotSize());
        assertTrue(hand.getPots().stream().allMatch(pot -> pot.isWonBy("Hero")));
    }
    
    @Test
    void testBlankLineEndsTheRecord() {
        List<String> lines = Arrays.asList(
                "Poker Hand #B1: Tournament #7, Hold'em No Limit - Level3(50/100)",
                "Seat 1: Hero (3000 in chips)",
                "Seat 2: Villain (2000 in chips)",
                "*** HOLE CARDS ***",
                "Hero: bets 100",
                "",
                "",
                "Villain: calls 100");
        
        ParsedHand parsed = handRecordParser.parse(lines, new HandRange(0, lines.size()));
        
        assertEquals(7, parsed.getNextIndex());
        assertEquals(100L, parsed.getHand().contributionOf("Hero"));
        assertEquals(0L, parsed.getHand().contributionOf("Villain"));
    }
    
    @Test
    void testDuplicateSeatNamesAreRecorded() {
        List<String> lines = Arrays.asList(
                "Poker Hand #D1: Tournament #7, Hold'em No Limit - Level3(50/100)",
                "Seat 1: Hero (3000 in chips)",
                "Seat 2: Hero (2000 in chips)",
                "*** HOLE CARDS ***");
        
        Hand hand = handRecordParser.parse(lines, new HandRange(0, lines.size())).getHand();
        
        assertEquals(Set.of("Hero"), hand.getDuplicateSeatNames());
        assertEquals(3000L, hand.stackOf("Hero"));
        assertTrue(hand.getPots().isEmpty());
    }
    
    @Test
    void testBigBlindExtraction() {
        assertEquals(400L, handRecordParser.extractBigBlind(
                "Poker Hand #1: Tournament #1, Hold'em No Limit - Level10(200/400) - 2025/01/01 16:38:15"));
        assertEquals(2000L, handRecordParser.extractBigBlind(
                "Poker Hand #1: Tournament #1, Hold'em No Limit - Level7(1,000/2,000(250)) - 2025/01/01 16:38:15"));
        assertEquals(400L, handRecordParser.extractBigBlind(
                "Poker Hand #1: Tournament #1, Hold'em 200/400 - 2025/01/01 16:38:15"));
        assertEquals(50L, handRecordParser.extractBigBlind(
                "Poker Hand #1: Tournament #1, Level5 (25/50/5) - 2025/01/01 10:00:00"));
        assertEquals(1000L, handRecordParser.extractBigBlind(
                "Poker Hand #1: Tournament #1, Hold'em No Limit - 2025/01/01 16:38:15 - 500/1,000/100"));
    }
    
    @Test
    void testDateIsNotMistakenForBlinds() {
        assertEquals(TrackerSettings.DEFAULT_MIN_BB, handRecordParser.extractBigBlind(
                "Poker Hand #1: Tournament #1, Hold'em No Limit - 2025/01/01 16:38:15"));
    }
    
    @Test
    void testMissingBigBlindFallsBackToConfiguredMinimum() {
        TrackerSettings settings = TrackerSettings.builder().minBigBlind(250).build();
        HandRecordParser parser = new HandRecordParser(new SidePotEngine(), settings);
        
        assertEquals(250L, parser.extractBigBlind("Poker Hand #1: Tournament #1, Hold'em No Limit"));
    }
}
