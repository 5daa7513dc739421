package com.royal.kotracker.domain.model;

import com.royal.kotracker.domain.enums.KnockoutStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Knockout outcome of a single hand, with the table shape it was played at.
 * The final-table fields are filled once the whole file has been replayed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandKnockoutResult {
    private String handId;
    private int tableSize;
    private int playersCount;
    private long bb;
    private Long heroStack;
    @Builder.Default
    private List<String> eliminated = new ArrayList<>();
    private int knockouts;
    private int attempts;
    @Builder.Default
    private List<KnockoutCredit> credits = new ArrayList<>();
    private boolean finalTable;
    private boolean earlyFinalTable;
    private boolean preFinalTable;
    private KnockoutStage stage;
    
    public static HandKnockoutResult none(String handId, List<String> eliminated) {
        return HandKnockoutResult.builder()
                .handId(handId)
                .eliminated(new ArrayList<>(eliminated))
                .build();
    }
    
    public void addCredit(KnockoutCredit credit) {
        credits.add(credit);
        knockouts++;
    }
}
