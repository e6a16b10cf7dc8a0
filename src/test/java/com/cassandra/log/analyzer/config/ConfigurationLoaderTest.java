package com.cassandra.log.analyzer.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cassandra.log.analyzer.schema.SchemaCatalog;
import com.cassandra.log.analyzer.schema.SchemaParseException;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testLoadSchema() throws Exception {
        Path file = write("schema.cql", "CREATE TABLE ks1.users (\n    user_id text PRIMARY KEY\n);\n");

        SchemaCatalog catalog = ConfigurationLoader.loadSchema(file);

        assertEquals(List.of("user_id"), catalog.getTable("ks1", "users").getPartitionKey());
    }

    @Test
    public void testLoadMalformedSchema() throws Exception {
        Path file = write("schema.cql", "    user_id text PRIMARY KEY,\n");

        assertThrows(SchemaParseException.class, () -> ConfigurationLoader.loadSchema(file));
    }

    @Test
    public void testLoadQueryPatterns() throws Exception {
        Path file = write("queries.json", "[ {\"start\": \"SELECT * FROM users WHERE user_id\", "
                + "\"parameters\": [\"user_id\"]}, {\"start\": \"SELECT * FROM orders\", \"parameters\": []} ]");

        List<QueryPattern> patterns = ConfigurationLoader.loadQueryPatterns(file);

        assertEquals(2, patterns.size());
        assertEquals("SELECT * FROM users WHERE user_id", patterns.get(0).getStart());
        assertEquals(List.of("user_id"), patterns.get(0).getParameters());
        assertTrue(patterns.get(1).getParameters().isEmpty());
    }

    @Test
    public void testLoadTagKeyspacesKeepsOrder() throws Exception {
        Path file = write("tags.json", "{\"zeta\": \"ks1\", \"alpha\": \"ks2\"}");

        Map<String, String> tags = ConfigurationLoader.loadTagKeyspaces(file);

        assertEquals(List.of("zeta", "alpha"), List.copyOf(tags.keySet()));
        assertEquals("ks2", tags.get("alpha"));
    }

    @Test
    public void testLoadProperties() throws Exception {
        Path file = write("analyzer.properties", "report.topN=7\nreport.orderBy=avg_duration\n");

        Properties props = ConfigurationLoader.loadProperties(file);

        assertEquals("7", props.getProperty("report.topN"));
        assertEquals("avg_duration", props.getProperty("report.orderBy"));
    }

    @Test
    public void testMissingFile() {
        assertThrows(IOException.class,
                () -> ConfigurationLoader.loadQueryPatterns(tempDir.resolve("missing.json")));
    }
}
