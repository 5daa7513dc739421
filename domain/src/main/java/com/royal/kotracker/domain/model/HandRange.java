package com.royal.kotracker.domain.model;

import lombok.Value;

/**
 * Line range [start, end) of one hand record within a file
 */
@Value
public class HandRange {
    int start;
    int end;
    
    public int length() {
        return end - start;
    }
}
