package com.royal.kotracker.domain.model;

import com.royal.kotracker.domain.enums.KnockoutStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Knockout totals across every processed file, plus Hero's results from any
 * tournament summary files found among the inputs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionKnockoutReport {
    private String hero;
    private long minBigBlind;
    @Builder.Default
    private List<FileKnockoutReport> files = new ArrayList<>();
    private int totalKnockouts;
    private int totalAttempts;
    private int finalTablesReached;
    private int totalFinalTableKnockouts;
    private int totalEarlyFinalTableKnockouts;
    private int totalPreFinalTableKnockouts;
    @Builder.Default
    private Map<KnockoutStage, StageKnockouts> stages = new EnumMap<>(KnockoutStage.class);
    @Builder.Default
    private List<TournamentResult> results = new ArrayList<>();
    private BigDecimal totalBuyIn;
    private BigDecimal totalPayout;
    
    public List<FileKnockoutReport> filesWithKnockouts() {
        return files.stream().filter(f -> f.getKnockouts() > 0).toList();
    }
}
