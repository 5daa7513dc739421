package com.royal.kotracker.application.service;

import com.royal.kotracker.domain.model.TournamentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Hero's finish from a tournament summary file.
 * 
 * The buy-in is taken from the first money amount of the title line, not from the
 * "Buy-in" line, which splits it into prize pool and bounty parts.
 */
@Component
public class TournamentSummaryParser {
    
    private static final Logger log = LoggerFactory.getLogger(TournamentSummaryParser.class);
    
    private static final Pattern TITLE = Pattern.compile("^Tournament #(\\d+)");
    private static final Pattern TOURNAMENT_IN_FILE_NAME = Pattern.compile("Tournament #(\\d+)");
    private static final Pattern BUY_IN = Pattern.compile("[$€]([\\d,]+(?:\\.\\d+)?)");
    private static final Pattern PLACE = Pattern.compile("You finished the tournament in (\\d+)(?:st|nd|rd|th) place");
    private static final Pattern PAYOUT = Pattern.compile("You received a total of [$€]?([\\d,]+(?:\\.\\d+)?)");
    private static final Pattern STARTED = Pattern.compile(
            "Tournament started (\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2})");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");
    
    /**
     * A summary file opens with a "Tournament #" title line; hand histories open with "Poker Hand #"
     */
    public boolean isSummary(List<String> lines) {
        return TITLE.matcher(firstNonBlank(lines)).find();
    }
    
    /**
     * Parse one summary file
     * @param path File path, also used for the tournament id when the title has none
     * @param lines Every line of the file
     * @return Hero's result; place, payout, buy-in or start time are null when not stated
     */
    public TournamentResult parse(String path, List<String> lines) {
        TournamentResult.TournamentResultBuilder result = TournamentResult.builder().path(path);
        
        String title = firstNonBlank(lines);
        Matcher id = TITLE.matcher(title);
        if (id.find()) {
            result.tournamentId(id.group(1));
        } else {
            result.tournamentId(tournamentIdFromPath(path));
        }
        Matcher buyIn = BUY_IN.matcher(title);
        if (buyIn.find()) {
            result.buyIn(money(buyIn.group(1)));
        }
        
        for (String line : lines) {
            Matcher place = PLACE.matcher(line);
            if (place.find()) {
                result.place(Integer.valueOf(place.group(1)));
                continue;
            }
            Matcher payout = PAYOUT.matcher(line);
            if (payout.find()) {
                result.payout(money(payout.group(1)));
                continue;
            }
            Matcher started = STARTED.matcher(line);
            if (started.find()) {
                result.startTime(timestamp(started.group(1)));
            }
        }
        
        TournamentResult parsed = result.build();
        log.debug("Summary {}: tournament {}, place {}, payout {}, buy-in {}", 
                path, parsed.getTournamentId(), parsed.getPlace(), parsed.getPayout(), parsed.getBuyIn());
        return parsed;
    }
    
    private String firstNonBlank(List<String> lines) {
        for (String line : lines) {
            if (!line.isBlank()) {
                return line.strip();
            }
        }
        return "";
    }
    
    private String tournamentIdFromPath(String path) {
        if (path == null) {
            return null;
        }
        Path fileName = Path.of(path).getFileName();
        Matcher m = TOURNAMENT_IN_FILE_NAME.matcher(fileName != null ? fileName.toString() : path);
        return m.find() ? m.group(1) : null;
    }
    
    private BigDecimal money(String raw) {
        return new BigDecimal(raw.replace(",", ""));
    }
    
    private LocalDateTime timestamp(String raw) {
        try {
            return LocalDateTime.parse(raw, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable summary start time '{}'", raw);
            return null;
        }
    }
}
