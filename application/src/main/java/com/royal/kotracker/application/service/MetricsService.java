package com.royal.kotracker.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording tracker metrics
 */
@Service
public class MetricsService {
    
    private final MeterRegistry meterRegistry;
    
    // Counters
    private final Counter filesProcessedCounter;
    private final Counter handsParsedCounter;
    private final Counter handsSkippedCounter;
    private final Counter eliminationsCounter;
    private final Counter knockoutsCounter;
    private final Counter summariesParsedCounter;
    
    // Timers
    private final Timer fileProcessingTimer;
    
    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.filesProcessedCounter = Counter.builder("files.processed")
                .description("Total number of hand history files processed")
                .register(meterRegistry);
        
        this.handsParsedCounter = Counter.builder("hands.parsed")
                .description("Total number of hands parsed")
                .register(meterRegistry);
        
        this.handsSkippedCounter = Counter.builder("hands.skipped")
                .description("Hands that failed to parse and were skipped")
                .register(meterRegistry);
        
        this.eliminationsCounter = Counter.builder("eliminations.detected")
                .description("Total number of eliminated seats detected")
                .register(meterRegistry);
        
        this.knockoutsCounter = Counter.builder("knockouts.credited")
                .description("Total number of knockouts credited to Hero")
                .register(meterRegistry);
        
        this.summariesParsedCounter = Counter.builder("summaries.parsed")
                .description("Tournament summary files read")
                .register(meterRegistry);
        
        this.fileProcessingTimer = Timer.builder("file.processing.time")
                .description("Time to process one hand history file")
                .register(meterRegistry);
    }
    
    public void recordFileProcessed() {
        filesProcessedCounter.increment();
    }
    
    public void recordHandsParsed(int count) {
        handsParsedCounter.increment(count);
    }
    
    public void recordHandSkipped() {
        handsSkippedCounter.increment();
    }
    
    public void recordEliminations(int count) {
        eliminationsCounter.increment(count);
    }
    
    public void recordKnockouts(int count) {
        knockoutsCounter.increment(count);
    }
    
    public void recordSummaryParsed() {
        summariesParsedCounter.increment();
    }
    
    public Timer.Sample startFileProcessing() {
        return Timer.start(meterRegistry);
    }
    
    public void recordFileProcessing(Timer.Sample sample) {
        sample.stop(fileProcessingTimer);
    }
}
