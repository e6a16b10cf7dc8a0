package com.cassandra.log.analyzer.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.schema.SchemaCatalog;
import com.cassandra.log.analyzer.schema.SchemaParseException;
import com.cassandra.log.analyzer.schema.SchemaParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads the files that make up an {@link AnalyzerConfig}: schema dump, query patterns,
 * tag to keyspace mappings and the optional report properties.
 */
public class ConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    private ConfigurationLoader() {
    }

    public static SchemaCatalog loadSchema(Path schemaFile) throws IOException, SchemaParseException {
        String schema = Files.readString(schemaFile, StandardCharsets.UTF_8);
        SchemaCatalog catalog = SchemaParser.parse(schema);
        logger.info("Loaded schema for {} tables in {} keyspaces from {}", catalog.getTableCount(),
                catalog.getKeyspaces().size(), schemaFile);
        return catalog;
    }

    /**
     * Query patterns are a JSON list like:
     * <pre>
     * [ { "start": "SELECT * FROM users WHERE user_id", "parameters": [ "user_id" ] } ]
     * </pre>
     */
    public static List<QueryPattern> loadQueryPatterns(Path queriesFile) throws IOException {
        List<QueryPattern> patterns = mapper.readValue(queriesFile.toFile(), new TypeReference<List<QueryPattern>>() {
        });
        logger.info("Loaded {} query patterns from {}", patterns.size(), queriesFile);
        return patterns;
    }

    /**
     * Tag mappings are a flat JSON object of tag to keyspace. Key order is kept.
     */
    public static Map<String, String> loadTagKeyspaces(Path tagsFile) throws IOException {
        Map<String, String> tags = mapper.readValue(tagsFile.toFile(),
                new TypeReference<LinkedHashMap<String, String>>() {
                });
        logger.info("Loaded {} tag keyspace mappings from {}", tags.size(), tagsFile);
        return tags;
    }

    public static Properties loadProperties(Path configFile) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configFile)) {
            props.load(in);
        }
        logger.info("Loaded report configuration from {}", configFile);
        return props;
    }
}
