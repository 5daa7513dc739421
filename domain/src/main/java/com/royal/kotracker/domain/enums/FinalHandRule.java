package com.royal.kotracker.domain.enums;

/**
 * How eliminations are decided for the last recorded hand of a file,
 * where there is no following hand to compare seats against.
 */
public enum FinalHandRule {
    COLLECTS,     // Seat collected nothing this hand
    FINAL_STACK   // Seat ended the hand with zero chips
}
