package com.cassandra.log.analyzer;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.classifier.QueryClassifier;
import com.cassandra.log.analyzer.classifier.UnhandledQueryException;

/**
 * Reads, parses and classifies the slow queries of one input file. The classifier and
 * the configuration behind it are only read, so one classifier is shared by all tasks.
 */
class SlowQueryFileTask implements Callable<FileResult> {

    private static final Logger logger = LoggerFactory.getLogger(SlowQueryFileTask.class);

    private final Path file;
    private final QueryClassifier classifier;

    SlowQueryFileTask(Path file, QueryClassifier classifier) {
        this.file = file;
        this.classifier = classifier;
    }

    @Override
    public FileResult call() throws Exception {
        HitDocumentReader reader = new HitDocumentReader();
        List<RawEvent> rawEvents = reader.read(file);

        long notSlowQuery = 0;
        long unhandled = 0;
        Map<QueryType, Long> eventsByType = new EnumMap<>(QueryType.class);
        Instant earliest = null;
        Instant latest = null;
        List<QueryEvent> events = new ArrayList<>(rawEvents.size());

        for (RawEvent rawEvent : rawEvents) {
            SlowQueryLog log;
            try {
                log = LogRecordParser.parse(rawEvent);
            } catch (LogParseException e) {
                notSlowQuery++;
                logger.warn("{}: dropping record at {}: {}", file.getFileName(), rawEvent.getTimestamp(),
                        e.getMessage());
                continue;
            }

            QueryEvent event;
            try {
                event = classifier.classify(log);
            } catch (UnhandledQueryException e) {
                unhandled++;
                logger.warn("{}: {}", file.getFileName(), e.getMessage());
                continue;
            }

            events.add(event);
            eventsByType.merge(event.getType(), 1L, Long::sum);
            earliest = ProcessingStats.earliest(earliest, event.getTimestamp());
            latest = ProcessingStats.latest(latest, event.getTimestamp());
        }

        ProcessingStats stats = new ProcessingStats(rawEvents.size() + reader.getInvalidHits(),
                reader.getInvalidHits(), notSlowQuery, unhandled, events.size(), eventsByType, earliest, latest);
        logger.info("Thread {} processed {}: {}", Thread.currentThread().getName(), file.getFileName(), stats);
        return new FileResult(file, events, stats);
    }
}
