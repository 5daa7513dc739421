package com.royal.kotracker.cli;

import com.royal.kotracker.application.service.KnockoutAggregationService;
import com.royal.kotracker.domain.model.SessionKnockoutReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Runs one knockout count over the positional input paths.
 * Exit code 1 when no input is given, none of it holds hand histories, or an input
 * directory cannot be read.
 */
@Component
public class KnockoutTrackerRunner implements ApplicationRunner, ExitCodeGenerator {
    
    private static final Logger log = LoggerFactory.getLogger(KnockoutTrackerRunner.class);
    
    private final KnockoutAggregationService aggregationService;
    private int exitCode;
    private SessionKnockoutReport lastReport;
    
    public KnockoutTrackerRunner(KnockoutAggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        List<String> inputs = args.getNonOptionArgs();
        if (inputs.isEmpty()) {
            log.error(CommandLineOptions.USAGE);
            exitCode = 1;
            return;
        }
        
        try {
            lastReport = aggregationService.countKnockouts(inputs);
            exitCode = 0;
        } catch (IllegalStateException e) {
            log.error(e.getMessage());
            exitCode = 1;
        } catch (UncheckedIOException e) {
            log.error("Cannot read input {}: {}", inputs, e.getMessage());
            log.error(CommandLineOptions.USAGE);
            exitCode = 1;
        }
    }
    
    @Override
    public int getExitCode() {
        return exitCode;
    }
    
    public SessionKnockoutReport getLastReport() {
        return lastReport;
    }
}
