package com.royal.kotracker.infrastructure.report.log;

import com.royal.kotracker.domain.model.FileKnockoutReport;
import com.royal.kotracker.domain.model.SessionKnockoutReport;
import com.royal.kotracker.domain.model.TournamentResult;
import com.royal.kotracker.domain.report.KnockoutReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs per-file knockout counts, the session total, the final-table breakdown
 * and Hero's tournament results when summary files were read
 */
@Component
public class LogKnockoutReportPublisher implements KnockoutReportPublisher {
    
    private static final Logger log = LoggerFactory.getLogger(LogKnockoutReportPublisher.class);
    
    @Override
    public void publish(SessionKnockoutReport report) {
        for (FileKnockoutReport file : report.getFiles()) {
            log.info("{}: {} KO(s)", file.getPath(), file.getKnockouts());
        }
        log.info("TOTAL: {} KO(s) for {} across {} file(s), {} attempt(s)", 
                report.getTotalKnockouts(), report.getHero(), report.getFiles().size(), report.getTotalAttempts());
        if (report.filesWithKnockouts().isEmpty()) {
            log.info("No KO found with min bb >= {}", report.getMinBigBlind());
        }
        if (report.getFinalTablesReached() > 0) {
            log.info("Final tables: {} reached, {} KO(s) there, {} early, {} in the hand before", 
                    report.getFinalTablesReached(), report.getTotalFinalTableKnockouts(),
                    report.getTotalEarlyFinalTableKnockouts(), report.getTotalPreFinalTableKnockouts());
            report.getStages().forEach((stage, totals) -> 
                    log.info("  {}: {} KO(s), {} attempt(s) over {} hand(s)", 
                            stage, totals.getKnockouts(), totals.getAttempts(), totals.getHands()));
        }
        for (TournamentResult result : report.getResults()) {
            log.info("Tournament {}: place {}, payout {}, buy-in {}", 
                    result.getTournamentId(), result.getPlace(), result.getPayout(), result.getBuyIn());
        }
        if (!report.getResults().isEmpty()) {
            log.info("Results: {} tournament(s), buy-ins {}, payouts {}", 
                    report.getResults().size(), report.getTotalBuyIn(), report.getTotalPayout());
        }
    }
}
