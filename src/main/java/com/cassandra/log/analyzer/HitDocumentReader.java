package com.cassandra.log.analyzer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an exported search result document into raw log events:
 * <pre>
 * {"hits": {"hits": [ {"_source": {"@timestamp": "...", "message": "...", "tags": [...]}} ]}}
 * </pre>
 * The message may also be under {@code @message}. Files ending in {@code .gz} are
 * decompressed on the fly.
 *
 * A reader keeps a count of the hits it had to skip, so use one instance per file.
 */
public class HitDocumentReader {

    private static final Logger logger = LoggerFactory.getLogger(HitDocumentReader.class);

    private long invalidHits;

    public List<RawEvent> read(Path file) throws IOException {
        try (BufferedReader in = createReader(file)) {
            JSONObject document = new JSONObject(new JSONTokener(in));
            return read(document, file.getFileName().toString());
        } catch (JSONException e) {
            throw new IOException("Not a valid hits document: " + file + ": " + e.getMessage(), e);
        }
    }

    List<RawEvent> read(JSONObject document, String source) {
        JSONObject outer = document.optJSONObject("hits");
        JSONArray hits = outer == null ? null : outer.optJSONArray("hits");
        if (hits == null) {
            throw new JSONException("Missing hits.hits array");
        }

        List<RawEvent> events = new ArrayList<>(hits.length());
        for (int i = 0; i < hits.length(); i++) {
            JSONObject hit = hits.optJSONObject(i);
            RawEvent event = hit == null ? null : toRawEvent(hit, source, i);
            if (event == null) {
                invalidHits++;
            } else {
                events.add(event);
            }
        }
        logger.debug("Read {} events from {}, {} invalid hits", events.size(), source, invalidHits);
        return events;
    }

    private RawEvent toRawEvent(JSONObject hit, String source, int index) {
        JSONObject doc = hit.optJSONObject("_source");
        if (doc == null) {
            logger.warn("{}: hit {} has no _source", source, index);
            return null;
        }

        String message = doc.optString("message", null);
        if (message == null) {
            message = doc.optString("@message", null);
        }
        if (message == null) {
            logger.warn("{}: hit {} has no message", source, index);
            return null;
        }

        String timestampText = doc.optString("@timestamp", null);
        if (timestampText == null) {
            logger.warn("{}: hit {} has no @timestamp", source, index);
            return null;
        }
        Instant timestamp;
        try {
            timestamp = Instant.parse(timestampText);
        } catch (DateTimeParseException e) {
            logger.warn("{}: hit {} has an invalid @timestamp: {}", source, index, timestampText);
            return null;
        }

        return new RawEvent(timestamp, message, readTags(doc.opt("tags")));
    }

    private static List<String> readTags(Object tags) {
        List<String> result = new ArrayList<>();
        if (tags instanceof JSONArray) {
            JSONArray array = (JSONArray) tags;
            for (int i = 0; i < array.length(); i++) {
                Object tag = array.opt(i);
                if (tag != null && tag != JSONObject.NULL) {
                    result.add(tag.toString());
                }
            }
        } else if (tags instanceof String) {
            result.add((String) tags);
        }
        return result;
    }

    private static BufferedReader createReader(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) {
            in = new GZIPInputStream(in);
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public long getInvalidHits() {
        return invalidHits;
    }
}
