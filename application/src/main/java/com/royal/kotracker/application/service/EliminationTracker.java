package com.royal.kotracker.application.service;

import com.royal.kotracker.domain.enums.FinalHandRule;
import com.royal.kotracker.domain.model.Hand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects which seats busted in a hand.
 * 
 * Hand histories never flag bust-outs explicitly: a seat counts as eliminated when it is
 * missing from the next hand. The last recorded hand has no successor, so the
 * {@link FinalHandRule} decides instead.
 */
@Component
public class EliminationTracker {
    
    private static final Logger log = LoggerFactory.getLogger(EliminationTracker.class);
    
    /**
     * Eliminated seats of {@code current}, in seating order
     * @param current Hand being examined
     * @param next The chronologically following hand, or null when current is the last one
     * @param finalHandRule Rule applied when there is no following hand
     */
    public List<String> eliminated(Hand current, Hand next, FinalHandRule finalHandRule) {
        List<String> eliminated = new ArrayList<>();
        if (next != null) {
            for (String player : current.getSeats().keySet()) {
                if (!next.isSeated(player)) {
                    eliminated.add(player);
                }
            }
        } else if (finalHandRule == FinalHandRule.FINAL_STACK) {
            for (Map.Entry<String, Long> entry : current.getFinalStacks().entrySet()) {
                if (entry.getValue() <= 0) {
                    eliminated.add(entry.getKey());
                }
            }
        } else {
            for (String player : current.getSeats().keySet()) {
                if (!current.getCollects().containsKey(player)) {
                    eliminated.add(player);
                }
            }
        }
        
        if (!eliminated.isEmpty()) {
            log.debug("Hand {}: eliminated {}{}", current.getHandId(), eliminated, 
                    next == null ? " (last hand, rule " + finalHandRule + ")" : "");
        }
        return eliminated;
    }
    
    /**
     * Eliminated seats for every hand of a chronologically ordered list
     */
    public List<List<String>> eliminatedPerHand(List<Hand> chronological, FinalHandRule finalHandRule) {
        List<List<String>> result = new ArrayList<>(chronological.size());
        for (int i = 0; i < chronological.size(); i++) {
            Hand next = i + 1 < chronological.size() ? chronological.get(i + 1) : null;
            result.add(eliminated(chronological.get(i), next, finalHandRule));
        }
        return result;
    }
}
