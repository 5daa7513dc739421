package com.royal.kotracker.infrastructure.source.filesystem;

import com.royal.kotracker.domain.source.HandHistorySource;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-system implementation of HandHistorySource.
 * Directories are walked recursively for files with the configured extension;
 * reads go through the fileRead retry.
 */
@Component
public class FileSystemHandHistorySource implements HandHistorySource {
    
    private static final Logger log = LoggerFactory.getLogger(FileSystemHandHistorySource.class);
    
    private final Retry fileReadRetry;
    private final String extension;
    
    public FileSystemHandHistorySource(@Qualifier("fileReadRetry") Retry fileReadRetry,
                                       @Value("${app.input.extension:.txt}") String extension) {
        this.fileReadRetry = fileReadRetry;
        this.extension = extension.toLowerCase(Locale.ROOT);
    }
    
    @Override
    public List<Path> discover(List<String> inputs) {
        List<Path> files = new ArrayList<>();
        for (String input : inputs) {
            Path path = Path.of(input);
            if (Files.isDirectory(path)) {
                files.addAll(walk(path));
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                log.warn("Input {} does not exist, ignored", input);
            }
        }
        log.debug("Discovered {} file(s) from {}", files.size(), inputs);
        return files;
    }
    
    @Override
    public List<String> readLines(Path file) throws IOException {
        try {
            return fileReadRetry.executeCheckedSupplier(() -> read(file));
        } catch (IOException e) {
            throw e;
        } catch (Throwable e) {
            throw new IOException("Failed to read " + file, e);
        }
    }
    
    private List<Path> walk(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to scan directory {}", directory, e);
            throw new UncheckedIOException("Failed to scan directory " + directory, e);
        }
    }
    
    /**
     * UTF-8 with malformed bytes replaced, matching how poker clients occasionally write names
     */
    private List<String> read(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        String content = decoder.decode(ByteBuffer.wrap(Files.readAllBytes(file))).toString();
        // Strip a UTF-8 byte order mark
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            content = content.substring(1);
        }
        return content.lines().collect(Collectors.toList());
    }
}
