package com.cassandra.log.analyzer.report;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.accumulator.RollupEntry;

/**
 * Writes each report table to its own CSV file in the output directory.
 */
public class CsvReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(CsvReportWriter.class);

    public static final String SLOW_QUERIES_FILE = "slow_queries.csv";
    public static final String SLOW_PRIMARY_KEYS_FILE = "slow_primary_keys.csv";
    public static final String PRIMARY_KEYS_FILE = "primary_keys.csv";
    public static final String VOLUME_FILE = "volume.csv";
    public static final String VOLUME_TOP_N_FILE = "volume_top_n.csv";

    private final Path outputDir;

    public CsvReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public void write(SlowQueryReport report) throws IOException {
        Files.createDirectories(outputDir);

        writeTable(SLOW_QUERIES_FILE, report.getSlowQueries(),
                new String[] { "Count", "Duration", "Avg. Duration", "Query" },
                e -> new Object[] { e.getCount(), e.getDuration(), e.getAvgDuration(), e.getQuery() });

        writeTable(SLOW_PRIMARY_KEYS_FILE, report.getSlowPrimaryKeys(),
                new String[] { "Count", "Duration", "Avg. Duration", "Primary Key", "Query" },
                e -> new Object[] { e.getCount(), e.getDuration(), e.getAvgDuration(), e.getPrimaryKey(),
                        e.getQuery() });

        writeTable(PRIMARY_KEYS_FILE, report.getPrimaryKeys(),
                new String[] { "Count", "Duration", "Avg. Duration", "Keyspace", "Column Family", "Primary Key" },
                e -> new Object[] { e.getCount(), e.getDuration(), e.getAvgDuration(), e.getKeyspace(),
                        e.getTable(), e.getPrimaryKey() });

        writeTable(VOLUME_FILE, report.getVolume(),
                new String[] { "Time", "Count", "Duration", "Avg. Duration" },
                e -> new Object[] { e.getMinute(), e.getCount(), e.getDuration(), e.getAvgDuration() });

        writeTable(VOLUME_TOP_N_FILE, report.getVolumeTopN(),
                new String[] { "Time", "Count", "Duration", "Avg. Duration", "Primary Key", "Query" },
                e -> new Object[] { e.getMinute(), e.getCount(), e.getDuration(), e.getAvgDuration(),
                        e.getPrimaryKey(), e.getQuery() });
    }

    private void writeTable(String fileName, List<RollupEntry> rows, String[] header,
            Function<RollupEntry, Object[]> columns) throws IOException {
        Path file = outputDir.resolve(fileName);
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            writer.print(toCsvLine(header));
            writer.print("\r\n");
            for (RollupEntry row : rows) {
                writer.print(toCsvLine(columns.apply(row)));
                writer.print("\r\n");
            }
            if (writer.checkError()) {
                throw new IOException("Error writing " + file);
            }
        }
        logger.info("Wrote {} rows to {}", rows.size(), file);
    }

    static String toCsvLine(Object[] values) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(escape(values[i]));
        }
        return line.toString();
    }

    static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = value.toString();
        if (text.indexOf(',') == -1 && text.indexOf('"') == -1 && text.indexOf('\n') == -1
                && text.indexOf('\r') == -1) {
            return text;
        }
        return '"' + text.replace("\"", "\"\"") + '"';
    }
}
