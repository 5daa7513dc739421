package com.royal.kotracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trace of one knockout credited to Hero: who busted and through which pot
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnockoutCredit {
    private String handId;
    private String eliminatedPlayer;
    private long eliminatedStack;
    private long heroStack;
    private long potLevel;
    private long potSize;
    private int potEligibleCount;
}
