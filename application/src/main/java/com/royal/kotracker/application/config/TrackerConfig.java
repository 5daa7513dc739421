package com.royal.kotracker.application.config;

import com.royal.kotracker.domain.enums.FinalHandRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Builds the run settings from application properties.
 * Command-line options are mapped onto the same app.tracker.* keys by the runner.
 */
@Configuration
public class TrackerConfig {
    
    private static final Logger log = LoggerFactory.getLogger(TrackerConfig.class);
    
    @Bean
    public TrackerSettings trackerSettings(
            @Value("${app.tracker.hero:Hero}") String hero,
            @Value("${app.tracker.min-bb:100}") String minBigBlind,
            @Value("${app.tracker.diagnostics:false}") boolean diagnostics,
            @Value("${app.tracker.final-table-size:9}") int finalTableSize,
            @Value("${app.tracker.final-hand-rule:COLLECTS}") FinalHandRule finalHandRule,
            @Value("${app.tracker.parallelism:1}") int parallelism) {
        TrackerSettings settings = TrackerSettings.builder()
                .hero(hero.trim())
                .minBigBlind(parseMinBigBlind(minBigBlind))
                .diagnostics(diagnostics)
                .finalTableSize(finalTableSize)
                .finalHandRule(finalHandRule)
                .parallelism(Math.max(1, parallelism))
                .build();
        log.info("Tracker settings: hero={}, minBb={}, diagnostics={}, finalHandRule={}, parallelism={}",
                settings.getHero(), settings.getMinBigBlind(), settings.isDiagnostics(),
                settings.getFinalHandRule(), settings.getParallelism());
        return settings;
    }
    
    /**
     * Minimum big blind as a chip count. Fractional values are accepted and rounded up,
     * since a hand's big blind is always whole chips: "50.5" keeps 51 and above.
     */
    static long parseMinBigBlind(String raw) {
        try {
            return new BigDecimal(raw.trim().replace(",", "")).setScale(0, RoundingMode.CEILING).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid app.tracker.min-bb '" + raw + "'", e);
        }
    }
}
