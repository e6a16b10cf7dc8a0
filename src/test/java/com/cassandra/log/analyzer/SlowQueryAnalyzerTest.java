package com.cassandra.log.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

public class SlowQueryAnalyzerTest {

    @TempDir
    Path tempDir;

    private Path schema;
    private Path tags;

    private static String hit(String timestamp, String message, String tag) {
        return "{\"_source\": {\"@timestamp\": \"" + timestamp + "\", \"message\": \"" + message
                + "\", \"tags\": [\"" + tag + "\"]}}";
    }

    private Path hits(String name, String... hits) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, ("{\"hits\": {\"hits\": [" + String.join(",", hits) + "]}}").getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private List<String> csv(Path dir, String name) throws Exception {
        return List.of(new String(Files.readAllBytes(dir.resolve(name)), StandardCharsets.UTF_8).split("\r\n"));
    }

    @BeforeEach
    public void setUp() throws Exception {
        schema = tempDir.resolve("schema.cql");
        Files.write(schema, String.join("\n",
                "CREATE TABLE ks1.users (",
                "    user_id text PRIMARY KEY,",
                "    name text",
                ");",
                "CREATE TABLE ks1.sessions (user_id text, id text, PRIMARY KEY (user_id, id));",
                "CREATE TABLE ks2.sessions (user_id text, id text, PRIMARY KEY (user_id, id));").getBytes(StandardCharsets.UTF_8));
        tags = tempDir.resolve("tags.json");
        Files.write(tags, "{\"app-two\": \"ks2\"}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testEndToEnd() throws Exception {
        String select = "Query too slow, took %d ms: SELECT * FROM ks1.users WHERE user_id=?; [1 bound values] [user_id:'%s']";
        Path first = hits("first.json",
                hit("2024-01-15T10:23:45.123Z", String.format(select, 45, "u1"), "prod"),
                hit("2024-01-15T10:23:50.000Z", String.format(select, 55, "u1"), "prod"),
                hit("2024-01-15T10:24:10.000Z", "Compaction finished", "prod"));
        Path second = hits("second.json",
                hit("2024-01-15T10:24:20.000Z", String.format(select, 30, "u2"), "prod"),
                hit("2024-01-15T10:24:30.000Z",
                        "Query too slow, took 70 ms: SELECT * FROM sessions WHERE user_id=?; [1 bound values] [user_id:'u3']",
                        "app-two"),
                hit("2024-01-15T10:24:40.000Z", "Query too slow, took 5 ms: TRUNCATE ks1.users", "prod"));
        Path out = tempDir.resolve("out");
        Path json = tempDir.resolve("report.json");

        SlowQueryAnalyzer analyzer = new SlowQueryAnalyzer();
        int exitCode = new CommandLine(analyzer).execute("-f", first.toString(), second.toString(),
                "--schema", schema.toString(), "--tags", tags.toString(), "--min-count", "1",
                "--out", out.toString(), "--json", json.toString(), "--threads", "2");

        assertEquals(0, exitCode);
        assertEquals(List.of("Count,Duration,Avg. Duration,Keyspace,Column Family,Primary Key",
                "2,100,50,ks1,users,u1",
                "1,70,70,ks2,sessions,u3",
                "1,30,30,ks1,users,u2"), csv(out, "primary_keys.csv"));
        assertEquals(List.of("Time,Count,Duration,Avg. Duration",
                "2024-01-15 10:23,2,100,50",
                "2024-01-15 10:24,2,100,50"), csv(out, "volume.csv"));
        assertTrue(Files.exists(json));

        ProcessingStats stats = analyzer.getStats();
        assertEquals(6, stats.hitsRead);
        assertEquals(1, stats.notSlowQuery);
        assertEquals(1, stats.unhandled);
        assertEquals(4, stats.eventsProduced);
    }

    @Test
    public void testUnreadableFileIsSkipped() throws Exception {
        Path good = hits("good.json", hit("2024-01-15T10:23:45.123Z",
                "Query too slow, took 45 ms: SELECT * FROM ks1.users WHERE user_id=?; [1 bound values] [user_id:'u1']",
                "prod"));
        Path out = tempDir.resolve("out");

        int exitCode = new CommandLine(new SlowQueryAnalyzer()).execute("-f", tempDir.resolve("missing.json").toString(),
                good.toString(), "--schema", schema.toString(), "--min-count", "1", "--out", out.toString());

        assertEquals(0, exitCode);
        assertEquals(2, csv(out, "slow_queries.csv").size());
    }

    @Test
    public void testNoFileProcessed() throws Exception {
        Path out = tempDir.resolve("out");

        int exitCode = new CommandLine(new SlowQueryAnalyzer()).execute("-f", tempDir.resolve("missing.json").toString(),
                "--out", out.toString());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(out.resolve("slow_queries.csv")));
    }

    @Test
    public void testInvalidOrderByIsFatal() throws Exception {
        Path file = hits("empty.json");

        int exitCode = new CommandLine(new SlowQueryAnalyzer()).execute("-f", file.toString(), "--order-by", "slowest",
                "--out", tempDir.resolve("out").toString());

        assertNotEquals(0, exitCode);
    }

    @Test
    public void testConfigFileWithCommandLineOverride() throws Exception {
        Path config = tempDir.resolve("analyzer.properties");
        Files.write(config, "report.topN=1\nreport.minCount=1\nreport.orderBy=count\n".getBytes(StandardCharsets.UTF_8));
        String select = "Query too slow, took %d ms: SELECT * FROM ks1.users WHERE user_id=?; [1 bound values] [user_id:'%s']";
        Path file = hits("hits.json",
                hit("2024-01-15T10:23:45.123Z", String.format(select, 500, "u1"), "prod"),
                hit("2024-01-15T10:23:46.000Z", String.format(select, 10, "u2"), "prod"),
                hit("2024-01-15T10:23:47.000Z", String.format(select, 10, "u2"), "prod"));
        Path out = tempDir.resolve("out");

        int exitCode = new CommandLine(new SlowQueryAnalyzer()).execute("-f", file.toString(),
                "--schema", schema.toString(), "--config", config.toString(), "--top-n", "2", "--out", out.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("Count,Duration,Avg. Duration,Keyspace,Column Family,Primary Key",
                "2,20,10,ks1,users,u2",
                "1,500,500,ks1,users,u1"), csv(out, "primary_keys.csv"));
    }
}
