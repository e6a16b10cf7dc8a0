package com.cassandra.log.analyzer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One exported log record: timestamp, message text and search tags.
 */
public class RawEvent {

    private final Instant timestamp;
    private final String message;
    private final List<String> tags;

    public RawEvent(Instant timestamp, String message, List<String> tags) {
        this.timestamp = timestamp;
        this.message = message;
        this.tags = tags == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getTags() {
        return tags;
    }
}
