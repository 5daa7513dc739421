package com.royal.kotracker.domain.enums;

import java.util.Locale;

/**
 * Player actions recognised in the action section of a hand record
 */
public enum ActionType {
    POSTS(true),
    BETS(true),
    CALLS(true),
    RAISES(false),
    ALL_IN(true),
    CHECKS(false),
    FOLDS(false);
    
    private final boolean addsStatedAmount;
    
    ActionType(boolean addsStatedAmount) {
        this.addsStatedAmount = addsStatedAmount;
    }
    
    /**
     * True when the amount printed after the verb is added to the contribution as is
     */
    public boolean addsStatedAmount() {
        return addsStatedAmount;
    }
    
    public static ActionType fromVerb(String verb) {
        return valueOf(verb.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
