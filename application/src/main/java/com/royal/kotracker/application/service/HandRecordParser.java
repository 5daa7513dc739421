package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.application.util.ChipParser;
import com.royal.kotracker.domain.enums.ActionType;
import com.royal.kotracker.domain.model.Hand;
import com.royal.kotracker.domain.model.HandRange;
import com.royal.kotracker.domain.model.ParsedHand;
import com.royal.kotracker.domain.model.Pot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the line range of one hand record into a {@link Hand}.
 * 
 * Contributions are accumulated per player from posts, bets, calls, all-ins and raise deltas,
 * minus uncalled bets returned. "raises X to Y" is a street total, so the delta is taken
 * against what the player committed on the current street; antes are dead money.
 * Collected amounts are summed across every pot a player took.
 * Pots are built and settled by the {@link SidePotEngine} before the hand is returned.
 */
@Component
public class HandRecordParser {
    
    private static final Logger log = LoggerFactory.getLogger(HandRecordParser.class);
    
    private static final Pattern HEADER = Pattern.compile(
            "^Poker Hand #(?<handId>[^:\\s]+)(?::\\s*Tournament #(?<tournamentId>\\d+))?");
    private static final Pattern BLINDS_PAREN = Pattern.compile(
            "\\(([\\d,]+(?:\\.\\d+)?)/([\\d,]+(?:\\.\\d+)?)\\)");
    private static final Pattern BLINDS = Pattern.compile(
            "(?<![\\d/])([\\d,]+(?:\\.\\d+)?)/([\\d,]+(?:\\.\\d+)?)(?!\\d)");
    private static final Pattern TIMESTAMP = Pattern.compile("(\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2})");
    private static final Pattern TABLE = Pattern.compile("^Table '[^']*' (\\d+)-max");
    private static final Pattern SEAT = Pattern.compile("^Seat \\d+: (.+?) \\(.*?([\\d,]+) in chips");
    private static final Pattern ACTION = Pattern.compile(
            "^(?<player>[^:]+): (?<action>posts|bets|calls|raises|all-in|checks|folds)\\b(?<rest>.*)$");
    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d,]*)");
    private static final Pattern RAISE_TO = Pattern.compile("raises [\\d,]+ to ([\\d,]+)");
    private static final Pattern UNCALLED = Pattern.compile("^Uncalled bet \\(([\\d,]+)\\) returned to (.+)$");
    private static final Pattern STREET = Pattern.compile("^\\*\\*\\* (?:FIRST |SECOND )?(?:FLOP|TURN|RIVER) \\*\\*\\*");
    private static final Pattern ANTE = Pattern.compile("\\bante\\b");
    private static final Pattern COLLECTED = Pattern.compile(
            "^(.+?) collected ([\\d,]+) from (?:the )?(?:main |side )?pot");
    
    private static final String HOLE_CARDS_MARKER = "*** HOLE";
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");
    
    private final SidePotEngine sidePotEngine;
    private final TrackerSettings settings;
    
    public HandRecordParser(SidePotEngine sidePotEngine, TrackerSettings settings) {
        this.sidePotEngine = sidePotEngine;
        this.settings = settings;
    }
    
    /**
     * Parse one hand
     * @param lines All lines of the file
     * @param range Line range of the hand, as produced by {@link HandSplitter}
     * @return The hand with its pots settled, and the index where scanning stopped
     */
    public ParsedHand parse(List<String> lines, HandRange range) {
        int end = Math.min(range.getEnd(), lines.size());
        int i = range.getStart();
        String header = lines.get(i);
        
        Hand.HandBuilder hand = Hand.builder().bb(extractBigBlind(header));
        String handId = null;
        Matcher headerMatcher = HEADER.matcher(header);
        if (headerMatcher.find()) {
            handId = headerMatcher.group("handId");
            hand.handId(handId);
            hand.tournamentId(headerMatcher.group("tournamentId"));
        }
        hand.timestamp(extractTimestamp(header));
        
        ChipAccumulator chips = new ChipAccumulator();
        Map<String, Long> seats = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        
        // Seat listing, plus antes and blinds posted before the hole cards
        i++;
        while (i < end && !lines.get(i).startsWith(HOLE_CARDS_MARKER)) {
            String line = lines.get(i).strip();
            Matcher seat = SEAT.matcher(line);
            Matcher table = TABLE.matcher(line);
            if (seat.find()) {
                String player = ChipParser.name(seat.group(1));
                if (seats.containsKey(player)) {
                    duplicates.add(player);
                    log.warn("Hand {}: player name '{}' appears on more than one seat", handId, player);
                } else {
                    seats.put(player, ChipParser.parse(seat.group(2)));
                }
            } else if (table.find()) {
                hand.tableSize((int) ChipParser.parse(table.group(1)));
            } else {
                chips.apply(line);
            }
            i++;
        }
        
        // Action section, up to the blank line that ends the record
        while (i < end && !lines.get(i).isBlank()) {
            chips.apply(lines.get(i).strip());
            i++;
        }
        while (i < end && lines.get(i).isBlank()) {
            i++;
        }
        
        List<Pot> pots = sidePotEngine.assignWinners(sidePotEngine.buildPots(chips.contrib), chips.collects);
        
        Hand parsed = hand
                .seats(seats)
                .contrib(chips.contrib)
                .collects(chips.collects)
                .pots(pots)
                .duplicateSeatNames(duplicates)
                .build();
        
        log.debug("Parsed hand {}: {} seats, bb={}, contributed={}, pots={}", 
                parsed.getHandId(), seats.size(), parsed.getBb(), parsed.getTotalContributed(), pots.size());
        return new ParsedHand(parsed, i);
    }
    
    /**
     * Big blind from the "sb/bb" pair of the header, or the configured minimum when absent.
     * The date is taken out first; a trailing "/ante" after the pair is allowed.
     */
    long extractBigBlind(String header) {
        String blinds = TIMESTAMP.matcher(header).replaceAll(" ");
        Matcher m = BLINDS_PAREN.matcher(blinds);
        if (!m.find()) {
            m = BLINDS.matcher(blinds);
            if (!m.find()) {
                return settings.getMinBigBlind();
            }
        }
        long bb = ChipParser.parse(m.group(2));
        return bb > 0 ? bb : settings.getMinBigBlind();
    }
    
    private LocalDateTime extractTimestamp(String header) {
        Matcher m = TIMESTAMP.matcher(header);
        if (!m.find()) {
            return null;
        }
        try {
            return LocalDateTime.parse(m.group(1), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable hand timestamp '{}'", m.group(1));
            return null;
        }
    }
    
    /**
     * Per-hand contribution and collected totals, plus chips committed on the current street
     */
    private static final class ChipAccumulator {
        private final Map<String, Long> contrib = new LinkedHashMap<>();
        private final Map<String, Long> committed = new LinkedHashMap<>();
        private final Map<String, Long> collects = new LinkedHashMap<>();
        
        void apply(String line) {
            if (STREET.matcher(line).find()) {
                committed.clear();
                return;
            }
            Matcher uncalled = UNCALLED.matcher(line);
            if (uncalled.find()) {
                add(ChipParser.name(uncalled.group(2)), -ChipParser.parse(uncalled.group(1)));
                return;
            }
            Matcher action = ACTION.matcher(line);
            if (action.find()) {
                applyAction(line, ChipParser.name(action.group("player")), 
                        ActionType.fromVerb(action.group("action")), action.group("rest"));
                return;
            }
            Matcher collected = COLLECTED.matcher(line);
            if (collected.find()) {
                collects.merge(ChipParser.name(collected.group(1)), ChipParser.parse(collected.group(2)), Long::sum);
            }
        }
        
        private void applyAction(String line, String player, ActionType type, String rest) {
            if (type.addsStatedAmount()) {
                Matcher amount = AMOUNT.matcher(rest);
                long chips = amount.find() ? ChipParser.parse(amount.group(1)) : 0L;
                if (type == ActionType.POSTS && ANTE.matcher(rest).find()) {
                    contrib.merge(player, chips, Long::sum);
                } else {
                    add(player, chips);
                }
            } else if (type == ActionType.RAISES) {
                Matcher raiseTo = RAISE_TO.matcher(line);
                if (raiseTo.find()) {
                    long total = ChipParser.parse(raiseTo.group(1));
                    add(player, total - committed.getOrDefault(player, 0L));
                } else {
                    log.warn("Raise without a 'to' amount: {}", line);
                }
            }
        }
        
        private void add(String player, long amount) {
            contrib.merge(player, amount, Long::sum);
            committed.merge(player, amount, Long::sum);
        }
    }
}
