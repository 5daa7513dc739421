package com.royal.kotracker.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * One level of the side-pot ladder.
 * Eligible players contributed at least {@code level} chips; winners are filled in
 * once collected amounts have been matched against the ladder.
 */
@Value
@Builder(toBuilder = true)
public class Pot {
    long level;
    long size;
    @Singular("eligiblePlayer")
    Set<String> eligible;
    @Singular
    Set<String> winners;
    
    public boolean isEligible(String player) {
        return eligible.contains(player);
    }
    
    public boolean isWonBy(String player) {
        return winners.contains(player);
    }
}
