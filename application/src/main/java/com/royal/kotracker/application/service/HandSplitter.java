package com.royal.kotracker.application.service;

import com.royal.kotracker.domain.model.HandRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits the lines of a hand history file into per-hand line ranges.
 * A hand runs from its start marker up to the line before the next marker (or end of file).
 */
@Component
public class HandSplitter {
    
    private static final Logger log = LoggerFactory.getLogger(HandSplitter.class);
    
    static final Pattern HAND_START = Pattern.compile("^Poker Hand #");
    
    public boolean isHandStart(String line) {
        return line != null && HAND_START.matcher(line).find();
    }
    
    /**
     * Indices of every hand-start marker, in file order
     */
    public List<Integer> findHandStarts(List<String> lines) {
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (isHandStart(lines.get(i))) {
                starts.add(i);
            }
        }
        return starts;
    }
    
    /**
     * Line ranges of every hand, in file order (newest hand first for GG exports)
     */
    public List<HandRange> split(List<String> lines) {
        List<Integer> starts = findHandStarts(lines);
        List<HandRange> ranges = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : lines.size();
            ranges.add(new HandRange(starts.get(i), end));
        }
        if (ranges.isEmpty() && !lines.isEmpty()) {
            log.debug("No hand-start markers found in {} lines", lines.size());
        }
        return ranges;
    }
}
