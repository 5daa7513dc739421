package com.royal.kotracker.domain.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionTypeTest {
    
    @Test
    void testFromVerb() {
        assertEquals(ActionType.ALL_IN, ActionType.fromVerb("all-in"));
        assertEquals(ActionType.RAISES, ActionType.fromVerb("raises"));
        assertEquals(ActionType.POSTS, ActionType.fromVerb(" posts "));
    }
    
    @Test
    void testRaiseAmountIsNotAddedAsStated() {
        assertFalse(ActionType.RAISES.addsStatedAmount());
        assertTrue(ActionType.CALLS.addsStatedAmount());
        assertFalse(ActionType.FOLDS.addsStatedAmount());
    }
    
    @Test
    void testUnknownVerb() {
        assertThrows(IllegalArgumentException.class, () -> ActionType.fromVerb("shows"));
    }
}
