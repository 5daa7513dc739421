package com.royal.kotracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Hero's finish in one tournament, read from its summary file.
 * Fields the summary does not state are left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentResult {
    private String path;
    private String tournamentId;
    private LocalDateTime startTime;
    private Integer place;
    private BigDecimal buyIn;
    private BigDecimal payout;
}
