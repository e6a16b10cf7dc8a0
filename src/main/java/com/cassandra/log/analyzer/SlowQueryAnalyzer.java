package com.cassandra.log.analyzer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.analyzer.accumulator.RollupAccumulator;
import com.cassandra.log.analyzer.accumulator.Rollups;
import com.cassandra.log.analyzer.classifier.QueryClassifier;
import com.cassandra.log.analyzer.config.AnalyzerConfig;
import com.cassandra.log.analyzer.config.ConfigurationLoader;
import com.cassandra.log.analyzer.report.CsvReportWriter;
import com.cassandra.log.analyzer.report.JsonReportGenerator;
import com.cassandra.log.analyzer.report.RankingReporter;
import com.cassandra.log.analyzer.report.SlowQueryReport;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Cassandra slow query analyzer: reads exported slow query logs, attributes each query to
 * a table and partition, and writes ranked CSV reports.
 */
@Command(name = "slowQueryAnalyzer", mixinStandardHelpOptions = true, version = "1.0",
         description = "Analyze Cassandra slow query logs and report the slowest queries, partitions and minutes")
public class SlowQueryAnalyzer implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(SlowQueryAnalyzer.class);

    @Option(names = { "-f", "--files" }, description = "Exported slow query log file(s), .gz supported", required = true, arity = "1..*")
    private String[] fileNames;

    @Option(names = { "--schema" }, description = "CQL schema dump (DESCRIBE output)")
    private String schemaFile;

    @Option(names = { "--queries" }, description = "JSON file of query patterns for statements without bound values")
    private String queriesFile;

    @Option(names = { "--tags" }, description = "JSON file mapping log tags to keyspaces")
    private String tagsFile;

    @Option(names = { "--top-n" }, description = "Rows in each ranked report (default: 100)")
    private Integer topN;

    @Option(names = { "--rows-per-minute" }, description = "Rows per minute in volume_top_n (default: 5)")
    private Integer rowsPerMinute;

    @Option(names = { "--min-count" }, description = "Drop groups seen fewer times than this (default: 5)")
    private Integer minCount;

    @Option(names = { "--order-by" }, description = "Ranking value: duration, avg_duration or count (default: duration)")
    private String orderBy;

    @Option(names = { "--config" }, description = "Report configuration properties file")
    private String configFile;

    @Option(names = { "--out" }, description = "Output directory for CSV reports (default: current directory)")
    private String outputDir = ".";

    @Option(names = { "--json" }, description = "JSON output file for structured report data")
    private String jsonOutputFile;

    @Option(names = { "--threads" }, description = "Worker threads (default: available processors)")
    private int threads = Runtime.getRuntime().availableProcessors();

    @Option(names = { "--debug" }, description = "Enable debug logging")
    private boolean debug = false;

    private ProcessingStats stats = ProcessingStats.EMPTY;

    @Override
    public Integer call() throws Exception {
        if (debug) {
            enableDebugLogging();
        }
        System.out.println("Cassandra Slow Query Analyzer");
        System.out.println("Processing " + fileNames.length + " file(s)...");

        long loadStart = System.currentTimeMillis();
        AnalyzerConfig config = loadConfiguration();
        logger.info("Configuration: {}", config);
        long loadTime = System.currentTimeMillis() - loadStart;

        long processStart = System.currentTimeMillis();
        List<QueryEvent> events = new ArrayList<>();
        int successfulFiles = read(config, events);
        long processTime = System.currentTimeMillis() - processStart;

        if (successfulFiles == 0) {
            System.err.println("No files were successfully processed. Exiting without generating reports.");
            return 1;
        }

        long analysisStart = System.currentTimeMillis();
        Rollups rollups = RollupAccumulator.aggregate(events, config.getMinCount());
        SlowQueryReport report = new RankingReporter(config).rank(rollups);
        long analysisTime = System.currentTimeMillis() - analysisStart;

        long reportStart = System.currentTimeMillis();
        Path out = Paths.get(outputDir);
        System.out.println("Writing CSV reports to: " + out.toAbsolutePath());
        new CsvReportWriter(out).write(report);
        if (jsonOutputFile != null) {
            System.out.println("Writing JSON report: " + jsonOutputFile);
            JsonReportGenerator.generateReport(Paths.get(jsonOutputFile), report, config, stats);
        }
        long reportTime = System.currentTimeMillis() - reportStart;

        printSummary(successfulFiles);
        logger.info("Timing: loading {} ms, processing {} ms, analysis {} ms, reporting {} ms",
                loadTime, processTime, analysisTime, reportTime);
        return 0;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    AnalyzerConfig loadConfiguration() throws Exception {
        AnalyzerConfig.Builder builder = AnalyzerConfig.builder();
        if (configFile != null) {
            builder.loadFromProperties(ConfigurationLoader.loadProperties(Paths.get(configFile)));
        }
        if (topN != null) {
            builder.topN(topN);
        }
        if (rowsPerMinute != null) {
            builder.rowsPerMinute(rowsPerMinute);
        }
        if (minCount != null) {
            builder.minCount(minCount);
        }
        if (orderBy != null) {
            builder.orderBy(orderBy);
        }
        if (schemaFile != null) {
            builder.schemaCatalog(ConfigurationLoader.loadSchema(Paths.get(schemaFile)));
        } else {
            logger.warn("No schema given, primary keys will not be reported");
        }
        if (queriesFile != null) {
            builder.queryPatterns(ConfigurationLoader.loadQueryPatterns(Paths.get(queriesFile)));
        }
        if (tagsFile != null) {
            builder.tagKeyspaces(ConfigurationLoader.loadTagKeyspaces(Paths.get(tagsFile)));
        }
        return builder.build();
    }

    /**
     * Processes every input file on the worker pool. Events are appended to {@code events}
     * in input file order regardless of which task finishes first.
     *
     * @return number of files processed successfully
     */
    int read(AnalyzerConfig config, List<QueryEvent> events) throws InterruptedException {
        QueryClassifier classifier = new QueryClassifier(config);
        int poolSize = Math.max(1, Math.min(threads, fileNames.length));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);

        List<Future<FileResult>> futures = new ArrayList<>(fileNames.length);
        for (String fileName : fileNames) {
            futures.add(executor.submit(new SlowQueryFileTask(Paths.get(fileName), classifier)));
        }

        int successfulFiles = 0;
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    FileResult result = futures.get(i).get();
                    events.addAll(result.getEvents());
                    stats = stats.merge(result.getStats());
                    successfulFiles++;
                    System.out.printf("[%d/%d] %s: %d events%n", i + 1, fileNames.length,
                            result.getFile().getFileName(), result.getEvents().size());
                } catch (ExecutionException e) {
                    logger.error("Failed to process {}", fileNames[i], e.getCause());
                    System.err.println("Failed to process " + fileNames[i] + ": " + e.getCause().getMessage());
                }
            }
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Executor did not terminate gracefully");
                executor.shutdownNow();
            }
        }
        return successfulFiles;
    }

    private void printSummary(int successfulFiles) {
        System.out.println("Analysis complete!");
        System.out.printf("Files processed: %d of %d%n", successfulFiles, fileNames.length);
        System.out.printf("Hits read: %d, invalid hits: %d, not slow queries: %d, unhandled: %d, events: %d%n",
                stats.hitsRead, stats.invalidHits, stats.notSlowQuery, stats.unhandled, stats.eventsProduced);
        if (stats.earliestTimestamp != null) {
            System.out.printf("Time range: %s to %s%n", stats.earliestTimestamp, stats.latestTimestamp);
        }
        stats.eventsByType.forEach((type, count) -> logger.info("{}: {} events", type, count));
    }

    ProcessingStats getStats() {
        return stats;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SlowQueryAnalyzer()).execute(args);
        System.exit(exitCode);
    }
}
