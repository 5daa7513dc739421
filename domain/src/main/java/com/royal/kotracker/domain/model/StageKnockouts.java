package com.royal.kotracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final-table hands, knockouts and attempts within one stage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageKnockouts {
    private int hands;
    private int knockouts;
    private int attempts;
    
    public void add(HandKnockoutResult result) {
        hands++;
        knockouts += result.getKnockouts();
        attempts += result.getAttempts();
    }
    
    public void add(StageKnockouts other) {
        hands += other.hands;
        knockouts += other.knockouts;
        attempts += other.attempts;
    }
}
