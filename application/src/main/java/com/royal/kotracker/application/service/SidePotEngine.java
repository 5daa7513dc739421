package com.royal.kotracker.application.service;

import com.royal.kotracker.domain.model.Pot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Side-pot ladder construction and winner assignment.
 * 
 * Pots are built from the distinct positive contribution levels; each level forms a pot
 * contested by every player who put in at least that much. Winners are then found by
 * draining each player's collected total against the pots, most exclusive pot first.
 */
@Component
public class SidePotEngine {
    
    private static final Logger log = LoggerFactory.getLogger(SidePotEngine.class);
    
    /**
     * Build the pot ladder, main pot first
     * @param contrib Net chips committed per player
     * @return Pots in ascending level order, winners empty
     */
    public List<Pot> buildPots(Map<String, Long> contrib) {
        SortedSet<Long> levels = new TreeSet<>();
        contrib.values().stream().filter(v -> v > 0).forEach(levels::add);
        
        List<Pot> pots = new ArrayList<>(levels.size());
        long previous = 0;
        for (long level : levels) {
            SortedSet<String> eligible = new TreeSet<>();
            contrib.forEach((player, amount) -> {
                if (amount >= level) {
                    eligible.add(player);
                }
            });
            pots.add(Pot.builder()
                    .level(level)
                    .size((level - previous) * eligible.size())
                    .eligible(eligible)
                    .build());
            previous = level;
        }
        return pots;
    }
    
    /**
     * Settle the pots against what each player collected.
     * 
     * Pots are visited by ascending eligible-set size (the most exclusive pot first), and the
     * eligible players of each pot in lexicographic order. Each player gives
     * min(remaining collected, remaining pot) to the pot and becomes a winner when that is positive.
     * A pot left with chips nobody collected goes to its lexicographically first eligible player.
     * 
     * @param pots Pots as returned by {@link #buildPots(Map)}
     * @param collects Chips collected per player
     * @return The same pots, in the same order, with winners filled in
     */
    public List<Pot> assignWinners(List<Pot> pots, Map<String, Long> collects) {
        Map<String, Long> remaining = new HashMap<>(collects);
        Pot[] settled = new Pot[pots.size()];
        
        List<Integer> byExclusivity = new ArrayList<>(pots.size());
        for (int i = 0; i < pots.size(); i++) {
            byExclusivity.add(i);
        }
        byExclusivity.sort(Comparator.comparingInt(i -> pots.get(i).getEligible().size()));
        
        for (int index : byExclusivity) {
            Pot pot = pots.get(index);
            Pot.PotBuilder result = pot.toBuilder().clearWinners();
            SortedSet<String> eligible = new TreeSet<>(pot.getEligible());
            long left = pot.getSize();
            
            for (String player : eligible) {
                long take = Math.min(remaining.getOrDefault(player, 0L), left);
                if (take > 0) {
                    result.winner(player);
                    remaining.merge(player, -take, Long::sum);
                    left -= take;
                }
            }
            
            if (left > 0 && !eligible.isEmpty()) {
                result.winner(eligible.first());
                log.debug("Pot at level {} has {} chips nobody collected, assigned to {}", 
                        pot.getLevel(), left, eligible.first());
            }
            settled[index] = result.build();
        }
        
        return Arrays.asList(settled);
    }
}
