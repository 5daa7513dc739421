package com.royal.kotracker.application.service;

import com.royal.kotracker.application.config.TrackerSettings;
import com.royal.kotracker.domain.model.FileKnockoutReport;
import com.royal.kotracker.domain.model.SessionKnockoutReport;
import com.royal.kotracker.domain.model.StageKnockouts;
import com.royal.kotracker.domain.model.TournamentResult;
import com.royal.kotracker.domain.report.KnockoutReportPublisher;
import com.royal.kotracker.domain.source.HandHistorySource;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Counts Hero's knockouts across every input file and publishes the session report.
 * Files are independent, so they may be processed on a fixed pool when parallelism > 1.
 * Tournament summary files among the inputs are read for Hero's finish and attached to
 * the hand history report of the same tournament.
 */
@Service
public class KnockoutAggregationService {
    
    private static final Logger log = LoggerFactory.getLogger(KnockoutAggregationService.class);
    
    private final HandHistorySource handHistorySource;
    private final HandHistoryFileProcessor fileProcessor;
    private final TournamentSummaryParser summaryParser;
    private final List<KnockoutReportPublisher> publishers;
    private final TrackerSettings settings;
    private final MetricsService metricsService;
    
    public KnockoutAggregationService(HandHistorySource handHistorySource,
                                      HandHistoryFileProcessor fileProcessor,
                                      TournamentSummaryParser summaryParser,
                                      List<KnockoutReportPublisher> publishers,
                                      TrackerSettings settings,
                                      MetricsService metricsService) {
        this.handHistorySource = handHistorySource;
        this.fileProcessor = fileProcessor;
        this.summaryParser = summaryParser;
        this.publishers = publishers;
        this.settings = settings;
        this.metricsService = metricsService;
    }
    
    /**
     * Process every hand history file found under the given inputs
     * @param inputs Files or directories
     * @return Per-file and total knockout counts
     * @throws IllegalStateException when no hand history file is found
     */
    public SessionKnockoutReport countKnockouts(List<String> inputs) {
        List<Path> files = handHistorySource.discover(inputs);
        if (files.isEmpty()) {
            throw new IllegalStateException("No hand history files found in " + inputs);
        }
        log.info("Processing {} hand history file(s) for hero '{}', min bb {}", 
                files.size(), settings.getHero(), settings.getMinBigBlind());
        
        List<FileKnockoutReport> processed = settings.getParallelism() > 1
                ? processInParallel(files)
                : processSequentially(files);
        
        List<FileKnockoutReport> fileReports = new ArrayList<>(processed.size());
        List<TournamentResult> results = new ArrayList<>();
        for (FileKnockoutReport file : processed) {
            if (file.isSummaryFile()) {
                results.add(file.getResult());
            } else {
                fileReports.add(file);
            }
        }
        attachResults(fileReports, results);
        
        SessionKnockoutReport report = SessionKnockoutReport.builder()
                .hero(settings.getHero())
                .minBigBlind(settings.getMinBigBlind())
                .files(fileReports)
                .totalKnockouts(fileReports.stream().mapToInt(FileKnockoutReport::getKnockouts).sum())
                .totalAttempts(fileReports.stream().mapToInt(FileKnockoutReport::getAttempts).sum())
                .finalTablesReached((int) fileReports.stream().filter(FileKnockoutReport::isReachedFinalTable).count())
                .totalFinalTableKnockouts(fileReports.stream().mapToInt(FileKnockoutReport::getFinalTableKnockouts).sum())
                .totalEarlyFinalTableKnockouts(
                        fileReports.stream().mapToInt(FileKnockoutReport::getEarlyFinalTableKnockouts).sum())
                .totalPreFinalTableKnockouts(
                        fileReports.stream().mapToInt(FileKnockoutReport::getPreFinalTableKnockouts).sum())
                .results(results)
                .totalBuyIn(sum(results, TournamentResult::getBuyIn))
                .totalPayout(sum(results, TournamentResult::getPayout))
                .build();
        for (FileKnockoutReport file : fileReports) {
            file.getStages().forEach((stage, totals) -> 
                    report.getStages().computeIfAbsent(stage, s -> new StageKnockouts()).add(totals));
        }
        
        for (KnockoutReportPublisher publisher : publishers) {
            if (publisher.isEnabled()) {
                publisher.publish(report);
            }
        }
        return report;
    }
    
    FileKnockoutReport processFile(Path file) {
        Timer.Sample sample = metricsService.startFileProcessing();
        try {
            List<String> lines = handHistorySource.readLines(file);
            if (summaryParser.isSummary(lines)) {
                metricsService.recordSummaryParsed();
                return FileKnockoutReport.summary(summaryParser.parse(file.toString(), lines));
            }
            return fileProcessor.process(file.toString(), lines, settings);
        } catch (IOException e) {
            log.error("Could not read {}, reporting it with no hands", file, e);
            return FileKnockoutReport.empty(file.toString());
        } finally {
            metricsService.recordFileProcessing(sample);
            metricsService.recordFileProcessed();
        }
    }
    
    /**
     * Give each hand history report the summary result of its tournament, when one was read
     */
    private void attachResults(List<FileKnockoutReport> fileReports, List<TournamentResult> results) {
        Map<String, TournamentResult> byTournament = new HashMap<>();
        for (TournamentResult result : results) {
            if (result.getTournamentId() != null) {
                byTournament.put(result.getTournamentId(), result);
            }
        }
        for (FileKnockoutReport file : fileReports) {
            if (file.getTournamentId() != null) {
                file.setResult(byTournament.get(file.getTournamentId()));
            }
        }
    }
    
    private BigDecimal sum(List<TournamentResult> results, Function<TournamentResult, BigDecimal> amount) {
        return results.stream()
                .map(amount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
    
    private List<FileKnockoutReport> processSequentially(List<Path> files) {
        List<FileKnockoutReport> reports = new ArrayList<>(files.size());
        for (Path file : files) {
            reports.add(processFile(file));
        }
        return reports;
    }
    
    private List<FileKnockoutReport> processInParallel(List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.getParallelism(), files.size()));
        try {
            List<CompletableFuture<FileKnockoutReport>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(CompletableFuture.supplyAsync(() -> processFile(file), executor));
            }
            List<FileKnockoutReport> reports = new ArrayList<>(files.size());
            for (CompletableFuture<FileKnockoutReport> future : futures) {
                reports.add(future.join());
            }
            return reports;
        } finally {
            executor.shutdown();
        }
    }
}
