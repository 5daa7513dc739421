package com.royal.kotracker.domain.report;

import com.royal.kotracker.domain.model.SessionKnockoutReport;

/**
 * Receives the finished session report.
 * Implementations decide where it goes (log, JSON file, ...).
 */
public interface KnockoutReportPublisher {
    
    void publish(SessionKnockoutReport report);
    
    /**
     * Whether this publisher is active under the current configuration
     */
    default boolean isEnabled() {
        return true;
    }
}
