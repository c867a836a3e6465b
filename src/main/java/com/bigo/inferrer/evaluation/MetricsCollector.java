package com.bigo.inferrer.evaluation;

import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.FunctionComplexity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Collects metrics over one run of the inferrer: how many functions landed in
 * each complexity class, how often the analysis fell back to Unknown and why,
 * and how long it took. Record methods are thread-safe.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private static final String UNSUPPORTED_PREFIX = "unsupported construct: ";

    // Timing metrics
    private Instant startTime;
    private Instant endTime;
    private long totalAnalysisTimeMs = 0;

    // File and code metrics
    private int totalFiles = 0;
    private int failedFiles = 0;
    private int totalClasses = 0;
    private int totalFunctions = 0;
    private int annotatedFunctions = 0;

    // Inference quality
    private int unknownFunctions = 0;
    private int functionsWithWarnings = 0;
    private int totalWarnings = 0;
    private final Map<ComplexityClass, Integer> complexityDistribution = new EnumMap<>(ComplexityClass.class);
    private final Map<String, Integer> unsupportedConstructs = new TreeMap<>();

    public synchronized void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    public synchronized void endAnalysis() {
        this.endTime = Instant.now();
        if (startTime == null) {
            startTime = endTime;
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, endTime).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    public synchronized void recordFile() {
        totalFiles++;
    }

    /**
     * Record a file that could not be parsed or written.
     */
    public synchronized void recordFailedFile() {
        failedFiles++;
    }

    public synchronized void recordClass() {
        totalClasses++;
    }

    /**
     * Record the result of one analyzed function.
     */
    public synchronized void recordFunction(FunctionComplexity result) {
        totalFunctions++;
        complexityDistribution.merge(result.getComplexity(), 1, Integer::sum);
        if (result.getComplexity().isUnknown()) {
            unknownFunctions++;
        }
        if (result.hasWarnings()) {
            functionsWithWarnings++;
            totalWarnings += result.getWarnings().size();
            for (String warning : result.getWarnings()) {
                if (warning.startsWith(UNSUPPORTED_PREFIX)) {
                    unsupportedConstructs.merge(warning.substring(UNSUPPORTED_PREFIX.length()), 1, Integer::sum);
                }
            }
        }
    }

    public synchronized void recordAnnotated(int count) {
        annotatedFunctions += count;
    }

    /**
     * Generate a snapshot of the metrics collected so far.
     */
    public synchronized MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerFile = totalFiles > 0 ? (double) totalAnalysisTimeMs / totalFiles : 0;
        report.averageTimePerFunction = totalFunctions > 0 ? (double) totalAnalysisTimeMs / totalFunctions : 0;

        report.totalFiles = totalFiles;
        report.failedFiles = failedFiles;
        report.totalClasses = totalClasses;
        report.totalFunctions = totalFunctions;
        report.annotatedFunctions = annotatedFunctions;

        report.unknownFunctions = unknownFunctions;
        report.functionsWithWarnings = functionsWithWarnings;
        report.totalWarnings = totalWarnings;
        report.resolvedRate = calculatePercentage(totalFunctions - unknownFunctions, totalFunctions);

        report.complexityDistribution = new LinkedHashMap<>();
        complexityDistribution.forEach((complexityClass, count) ->
                report.complexityDistribution.put(complexityClass.getNotation(), count));
        report.unsupportedConstructs = new LinkedHashMap<>(unsupportedConstructs);

        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        MetricsReport report = generateReport();

        try (FileWriter writer = new FileWriter(outputPath.toFile())) {
            writer.write("{\n");
            writer.write("  \"timing\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"totalAnalysisTimeMs\": %d,\n", report.totalAnalysisTimeMs));
            writer.write(String.format(Locale.ROOT, "    \"averageTimePerFile\": %.2f,\n", report.averageTimePerFile));
            writer.write(String.format(Locale.ROOT, "    \"averageTimePerFunction\": %.2f\n",
                    report.averageTimePerFunction));
            writer.write("  },\n");

            writer.write("  \"codeMetrics\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"totalFiles\": %d,\n", report.totalFiles));
            writer.write(String.format(Locale.ROOT, "    \"failedFiles\": %d,\n", report.failedFiles));
            writer.write(String.format(Locale.ROOT, "    \"totalClasses\": %d,\n", report.totalClasses));
            writer.write(String.format(Locale.ROOT, "    \"totalFunctions\": %d,\n", report.totalFunctions));
            writer.write(String.format(Locale.ROOT, "    \"annotatedFunctions\": %d\n", report.annotatedFunctions));
            writer.write("  },\n");

            writer.write("  \"inference\": {\n");
            writer.write(String.format(Locale.ROOT, "    \"unknownFunctions\": %d,\n", report.unknownFunctions));
            writer.write(String.format(Locale.ROOT, "    \"functionsWithWarnings\": %d,\n",
                    report.functionsWithWarnings));
            writer.write(String.format(Locale.ROOT, "    \"totalWarnings\": %d,\n", report.totalWarnings));
            writer.write(String.format(Locale.ROOT, "    \"resolvedRate\": %.2f\n", report.resolvedRate));
            writer.write("  },\n");

            writer.write("  \"complexityDistribution\": ");
            writeCounts(writer, report.complexityDistribution);
            writer.write(",\n");

            writer.write("  \"unsupportedConstructs\": ");
            writeCounts(writer, report.unsupportedConstructs);
            writer.write("\n");

            writer.write("}\n");
        }

        logger.info("Metrics exported to: {}", outputPath);
    }

    private void writeCounts(FileWriter writer, Map<String, Integer> counts) throws IOException {
        if (counts.isEmpty()) {
            writer.write("{}");
            return;
        }
        writer.write("{\n");
        int count = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            writer.write(String.format(Locale.ROOT, "    \"%s\": %d", escape(entry.getKey()), entry.getValue()));
            if (++count < counts.size()) writer.write(",");
            writer.write("\n");
        }
        writer.write("  }");
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Print a human-readable report to console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("BIG-O COMPLEXITY INFERENCE - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING METRICS]");
        System.out.printf("  Total Analysis Time: %.2f seconds\n", report.totalAnalysisTimeMs / 1000.0);
        System.out.printf("  Average Time per File: %.2f ms\n", report.averageTimePerFile);
        System.out.printf("  Average Time per Function: %.2f ms\n", report.averageTimePerFunction);

        System.out.println("\n[CODE METRICS]");
        System.out.printf("  Total Files Analyzed: %d (%d failed)\n", report.totalFiles, report.failedFiles);
        System.out.printf("  Total Classes: %d\n", report.totalClasses);
        System.out.printf("  Total Functions: %d\n", report.totalFunctions);
        System.out.printf("  Functions Annotated: %d\n", report.annotatedFunctions);

        System.out.println("\n[COMPLEXITY DISTRIBUTION]");
        report.complexityDistribution.forEach((notation, count) ->
                System.out.printf("  %-15s: %,6d functions (%.1f%%)\n", notation, count,
                        calculatePercentage(count, report.totalFunctions)));

        System.out.println("\n[INFERENCE QUALITY]");
        System.out.printf("  Resolved: %.1f%% (%d/%d)\n", report.resolvedRate,
                report.totalFunctions - report.unknownFunctions, report.totalFunctions);
        System.out.printf("  Functions with Warnings: %,d (%,d warnings)\n",
                report.functionsWithWarnings, report.totalWarnings);
        if (!report.unsupportedConstructs.isEmpty()) {
            System.out.println("  Unsupported constructs:");
            report.unsupportedConstructs.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                    .forEach(entry -> System.out.printf("    %-25s: %,6d\n", entry.getKey(), entry.getValue()));
        }

        System.out.println("\n" + "=".repeat(80) + "\n");
    }

    private static double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerFile;
        public double averageTimePerFunction;

        // Code metrics
        public int totalFiles;
        public int failedFiles;
        public int totalClasses;
        public int totalFunctions;
        public int annotatedFunctions;

        // Inference quality
        public int unknownFunctions;
        public int functionsWithWarnings;
        public int totalWarnings;
        public double resolvedRate;

        // Keyed by Big-O notation, in increasing order of growth
        public Map<String, Integer> complexityDistribution;
        public Map<String, Integer> unsupportedConstructs;
    }
}
