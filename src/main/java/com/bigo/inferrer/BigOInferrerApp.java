package com.bigo.inferrer;

import com.bigo.inferrer.analysis.AnalysisOptions;
import com.bigo.inferrer.processor.CodebaseProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main application entry point for the Big-O complexity inferrer.
 * Analyzes a Java codebase and reports the worst-case time complexity of each method.
 */
public class BigOInferrerApp {

    private static final Logger logger = LoggerFactory.getLogger(BigOInferrerApp.class);

    private static final String USAGE = "Usage: java -jar bigo-inferrer.jar <path-to-java-codebase>"
            + " [--annotate] [--threads N] [--config file.properties]";

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println(USAGE);
            System.err.println("Example: java -jar bigo-inferrer.jar /path/to/project/src --threads 4");
            System.exit(1);
        }

        AnalysisOptions options;
        try {
            options = parseOptions(args);
        } catch (IllegalArgumentException | IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        String codebasePath = args[0];
        logger.info("Starting Big-O Complexity Inferrer");
        logger.info("Target codebase: {}", codebasePath);

        try {
            Path path = Paths.get(codebasePath);
            CodebaseProcessor processor = new CodebaseProcessor(options);

            logger.info("Processing codebase...");
            int processedFiles = processor.processCodebase(path);
            processor.getMetricsCollector().printReport();

            logger.info("Processing complete!");
            logger.info("Total files processed: {}", processedFiles);

        } catch (Exception e) {
            logger.error("Error processing codebase", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Builds the run's options from the command-line flags following the path argument.
     *
     * @throws IllegalArgumentException If a flag is unknown or lacks its value
     * @throws IOException If the configuration file cannot be read
     */
    static AnalysisOptions parseOptions(String[] args) throws IOException {
        Path config = null;
        Boolean annotate = null;
        Integer threads = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--annotate" -> annotate = true;
                case "--threads" -> threads = parseThreads(valueOf(args, ++i, "--threads"));
                case "--config" -> config = Paths.get(valueOf(args, ++i, "--config"));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        AnalysisOptions.Builder builder = (config != null ? AnalysisOptions.load(config) : AnalysisOptions.load())
                .toBuilder();
        if (annotate != null) {
            builder.annotate(annotate);
        }
        if (threads != null) {
            builder.threads(threads);
        }
        return builder.build();
    }

    private static String valueOf(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static int parseThreads(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--threads expects a number, got: " + value, e);
        }
    }
}
