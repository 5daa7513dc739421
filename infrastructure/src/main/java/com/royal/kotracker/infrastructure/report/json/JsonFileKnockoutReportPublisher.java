package com.royal.kotracker.infrastructure.report.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.royal.kotracker.domain.model.SessionKnockoutReport;
import com.royal.kotracker.domain.report.KnockoutReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the session report as JSON when app.report.json.path is set
 */
@Component
public class JsonFileKnockoutReportPublisher implements KnockoutReportPublisher {
    
    private static final Logger log = LoggerFactory.getLogger(JsonFileKnockoutReportPublisher.class);
    
    private final ObjectMapper objectMapper;
    private final String outputPath;
    
    public JsonFileKnockoutReportPublisher(ObjectMapper objectMapper,
                                           @Value("${app.report.json.path:}") String outputPath) {
        this.objectMapper = objectMapper;
        this.outputPath = outputPath;
    }
    
    @Override
    public boolean isEnabled() {
        return outputPath != null && !outputPath.isBlank();
    }
    
    @Override
    public void publish(SessionKnockoutReport report) {
        Path target = Path.of(outputPath.trim());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), report);
            log.info("Knockout report written to {}", target);
        } catch (IOException e) {
            log.error("Failed to write knockout report to {}", target, e);
            throw new UncheckedIOException("Failed to write knockout report to " + target, e);
        }
    }
}
