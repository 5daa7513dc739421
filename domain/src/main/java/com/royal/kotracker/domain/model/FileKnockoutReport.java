package com.royal.kotracker.domain.model;

import com.royal.kotracker.domain.enums.KnockoutStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Knockout totals and tournament summary for one hand history file.
 * A tournament summary file is carried through processing as a report with
 * {@code summaryFile} set and only {@code result} filled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileKnockoutReport {
    private String path;
    private String tournamentId;
    private LocalDateTime startTime;
    private int handsParsed;
    private int handsSkipped;
    private int knockouts;
    private int attempts;
    private boolean reachedFinalTable;
    private Long finalTableInitialStack;
    private Double finalTableInitialStackBb;
    private int finalTableKnockouts;
    private int earlyFinalTableKnockouts;
    private int preFinalTableKnockouts;
    @Builder.Default
    private Map<KnockoutStage, StageKnockouts> stages = new EnumMap<>(KnockoutStage.class);
    private TournamentResult result;
    private boolean summaryFile;
    @Builder.Default
    private List<HandKnockoutResult> hands = new ArrayList<>();
    
    public static FileKnockoutReport empty(String path) {
        return FileKnockoutReport.builder().path(path).build();
    }
    
    public static FileKnockoutReport summary(TournamentResult result) {
        return FileKnockoutReport.builder()
                .path(result.getPath())
                .tournamentId(result.getTournamentId())
                .startTime(result.getStartTime())
                .result(result)
                .summaryFile(true)
                .build();
    }
}
