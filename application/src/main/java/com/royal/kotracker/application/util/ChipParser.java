package com.royal.kotracker.application.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses chip amounts as printed in hand records ("1,500", "2,000.00", "80").
 * Thousands separators are stripped and fractional parts dropped.
 * Anything unparseable is treated as zero chips.
 */
public final class ChipParser {
    
    private static final Logger log = LoggerFactory.getLogger(ChipParser.class);
    
    private ChipParser() {
    }
    
    public static long parse(String raw) {
        if (raw == null) {
            return 0L;
        }
        String normalized = raw.trim().replace(",", "");
        int dot = normalized.indexOf('.');
        if (dot >= 0) {
            normalized = normalized.substring(0, dot);
        }
        if (normalized.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(normalized);
        } catch (NumberFormatException e) {
            log.debug("Unparseable chip amount '{}', using 0", raw);
            return 0L;
        }
    }
    
    /**
     * Player names are compared after trimming surrounding whitespace
     */
    public static String name(String raw) {
        return raw == null ? "" : raw.trim();
    }
}
