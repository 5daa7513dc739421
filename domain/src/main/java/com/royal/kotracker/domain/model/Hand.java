package com.royal.kotracker.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One played-out hand as reconstructed from its text record.
 * Seats keep the order in which they were printed.
 */
@Value
@Builder(toBuilder = true)
public class Hand {
    String handId;
    String tournamentId;
    LocalDateTime timestamp;
    int tableSize;
    long bb;
    @Singular
    Map<String, Long> seats;
    @Singular("contribution")
    Map<String, Long> contrib;
    @Singular("collected")
    Map<String, Long> collects;
    @Singular
    List<Pot> pots;
    @Singular
    Set<String> duplicateSeatNames;
    
    public boolean isSeated(String player) {
        return seats.containsKey(player);
    }
    
    public long stackOf(String player) {
        return seats.getOrDefault(player, 0L);
    }
    
    public long contributionOf(String player) {
        return contrib.getOrDefault(player, 0L);
    }
    
    public long collectedBy(String player) {
        return collects.getOrDefault(player, 0L);
    }
    
    public long getTotalContributed() {
        return contrib.values().stream().mapToLong(Long::longValue).sum();
    }
    
    public long getTotalPotSize() {
        return pots.stream().mapToLong(Pot::getSize).sum();
    }
    
    /**
     * Stack left to each seat after the hand: start - contributed + collected
     */
    public Map<String, Long> getFinalStacks() {
        Map<String, Long> finalStacks = new LinkedHashMap<>();
        seats.forEach((player, stack) ->
                finalStacks.put(player, stack - contributionOf(player) + collectedBy(player)));
        return finalStacks;
    }
    
    /**
     * Seats that put their whole starting stack in
     */
    public Set<String> getAllInPlayers() {
        Set<String> allIn = new LinkedHashSet<>();
        seats.forEach((player, stack) -> {
            if (stack > 0 && contributionOf(player) >= stack) {
                allIn.add(player);
            }
        });
        return allIn;
    }
}
