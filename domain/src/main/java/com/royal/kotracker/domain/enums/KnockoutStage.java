package com.royal.kotracker.domain.enums;

import java.util.Optional;

/**
 * Final-table stage by the number of players seated in the hand
 */
public enum KnockoutStage {
    SIX_TO_NINE(6, 9),
    FOUR_TO_FIVE(4, 5),
    TWO_TO_THREE(2, 3);
    
    private final int minPlayers;
    private final int maxPlayers;
    
    KnockoutStage(int minPlayers, int maxPlayers) {
        this.minPlayers = minPlayers;
        this.maxPlayers = maxPlayers;
    }
    
    public int getMinPlayers() {
        return minPlayers;
    }
    
    public int getMaxPlayers() {
        return maxPlayers;
    }
    
    public static Optional<KnockoutStage> of(int players) {
        for (KnockoutStage stage : values()) {
            if (players >= stage.minPlayers && players <= stage.maxPlayers) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
