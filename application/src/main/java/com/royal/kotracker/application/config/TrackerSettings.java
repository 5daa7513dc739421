package com.royal.kotracker.application.config;

import com.royal.kotracker.domain.enums.FinalHandRule;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable run settings, passed explicitly into the components that need them
 */
@Value
@Builder(toBuilder = true)
public class TrackerSettings {
    
    public static final String DEFAULT_HERO = "Hero";
    public static final long DEFAULT_MIN_BB = 100L;
    public static final int DEFAULT_FINAL_TABLE_SIZE = 9;
    
    @Builder.Default
    String hero = DEFAULT_HERO;
    @Builder.Default
    long minBigBlind = DEFAULT_MIN_BB;
    boolean diagnostics;
    @Builder.Default
    int finalTableSize = DEFAULT_FINAL_TABLE_SIZE;
    @Builder.Default
    FinalHandRule finalHandRule = FinalHandRule.COLLECTS;
    @Builder.Default
    int parallelism = 1;
    
    public static TrackerSettings defaults() {
        return TrackerSettings.builder().build();
    }
}
