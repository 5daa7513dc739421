package com.royal.kotracker.domain.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over where hand history files come from.
 * Allows the aggregation pipeline to run against the file system or in-memory fixtures.
 */
public interface HandHistorySource {
    
    /**
     * Resolve input paths (files or directories, recursed) to the hand history files they hold
     * @param inputs Paths as given by the user
     * @return Matching files, in a stable order
     */
    List<Path> discover(List<String> inputs);
    
    /**
     * Read every line of one file
     */
    List<String> readLines(Path file) throws IOException;
}
