package com.royal.kotracker.domain.model;

import lombok.Value;

/**
 * A parsed hand together with the line index where scanning stopped
 */
@Value
public class ParsedHand {
    Hand hand;
    int nextIndex;
}
