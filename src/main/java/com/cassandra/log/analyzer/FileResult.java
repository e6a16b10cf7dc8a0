package com.cassandra.log.analyzer;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Query events of one input file, in file order, with the counters for that file.
 */
public class FileResult {

    private final Path file;
    private final List<QueryEvent> events;
    private final ProcessingStats stats;

    public FileResult(Path file, List<QueryEvent> events, ProcessingStats stats) {
        this.file = file;
        this.events = Collections.unmodifiableList(events);
        this.stats = stats;
    }

    public Path getFile() {
        return file;
    }

    public List<QueryEvent> getEvents() {
        return events;
    }

    public ProcessingStats getStats() {
        return stats;
    }
}
