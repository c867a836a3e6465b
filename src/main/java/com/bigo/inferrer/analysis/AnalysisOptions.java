package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.ComplexityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Immutable analysis configuration. Loaded from {@value #DEFAULT_RESOURCE} on
 * the classpath, from a properties file, or assembled with {@link Builder}.
 */
public final class AnalysisOptions {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisOptions.class);

    public static final String DEFAULT_RESOURCE = "bigo-inferrer.properties";

    private static final String UNKNOWN_CALLS = "analysis.unknownCalls";
    private static final String SIZE_FUNCTIONS = "analysis.sizeFunctions";
    private static final String CALL_COST_PREFIX = "analysis.callCost.";
    private static final String FAIL_ON_UNSUPPORTED = "analysis.failOnUnsupported";
    private static final String THREADS = "processor.threads";
    private static final String ANNOTATE = "processor.annotate";
    private static final String METRICS_FILE = "processor.metricsFile";

    /**
     * How calls to functions that are neither analyzed nor configured are costed.
     */
    public enum UnknownCallPolicy {
        CONSTANT, UNKNOWN
    }

    private final UnknownCallPolicy unknownCallPolicy;
    private final Set<String> sizeFunctions;
    private final Map<String, ComplexityClass> callCosts;
    private final boolean failOnUnsupported;
    private final int threads;
    private final boolean annotate;
    private final String metricsFile;

    private AnalysisOptions(Builder builder) {
        this.unknownCallPolicy = builder.unknownCallPolicy;
        this.sizeFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sizeFunctions));
        this.callCosts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.callCosts));
        this.failOnUnsupported = builder.failOnUnsupported;
        this.threads = builder.threads;
        this.annotate = builder.annotate;
        this.metricsFile = builder.metricsFile;
    }

    /**
     * Built-in defaults, without reading any resource.
     */
    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to the defaults when it is absent.
     */
    public static AnalysisOptions load() {
        try (InputStream in = AnalysisOptions.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads options from a properties file, layered over the classpath configuration.
     *
     * @param file The properties file
     * @return The combined options
     * @throws IOException If the file cannot be read
     */
    public static AnalysisOptions load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        logger.info("Loaded configuration from {}", file);
        return load().toBuilder().apply(properties).build();
    }

    /**
     * Builds options from properties, starting from the defaults.
     *
     * @throws IllegalArgumentException If a value cannot be parsed
     */
    public static AnalysisOptions fromProperties(Properties properties) {
        return builder().apply(properties).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.unknownCallPolicy = unknownCallPolicy;
        builder.sizeFunctions = new LinkedHashSet<>(sizeFunctions);
        builder.callCosts = new LinkedHashMap<>(callCosts);
        builder.failOnUnsupported = failOnUnsupported;
        builder.threads = threads;
        builder.annotate = annotate;
        builder.metricsFile = metricsFile;
        return builder;
    }

    public UnknownCallPolicy getUnknownCallPolicy() {
        return unknownCallPolicy;
    }

    public Set<String> getSizeFunctions() {
        return sizeFunctions;
    }

    public boolean isSizeFunction(String name) {
        return sizeFunctions.contains(name);
    }

    public Map<String, ComplexityClass> getCallCosts() {
        return callCosts;
    }

    /**
     * Configured class of a library call, if any.
     */
    public Optional<ComplexityClass> callCost(String name) {
        return Optional.ofNullable(callCosts.get(name));
    }

    public boolean isFailOnUnsupported() {
        return failOnUnsupported;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isAnnotate() {
        return annotate;
    }

    /**
     * Metrics file name relative to the analyzed root; empty when metrics export is disabled.
     */
    public String getMetricsFile() {
        return metricsFile;
    }

    public static final class Builder {
        private UnknownCallPolicy unknownCallPolicy = UnknownCallPolicy.CONSTANT;
        private Set<String> sizeFunctions = new LinkedHashSet<>(List.of("len", "size", "length", "count"));
        private Map<String, ComplexityClass> callCosts = new LinkedHashMap<>();
        private boolean failOnUnsupported = false;
        private int threads = 1;
        private boolean annotate = false;
        private String metricsFile = "bigo-inference-metrics.json";

        private Builder() {
        }

        public Builder unknownCallPolicy(UnknownCallPolicy policy) {
            this.unknownCallPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder sizeFunctions(Collection<String> names) {
            this.sizeFunctions = new LinkedHashSet<>(names);
            return this;
        }

        public Builder callCost(String name, ComplexityClass complexityClass) {
            this.callCosts.put(name, Objects.requireNonNull(complexityClass, "complexityClass"));
            return this;
        }

        public Builder failOnUnsupported(boolean failOnUnsupported) {
            this.failOnUnsupported = failOnUnsupported;
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Thread count must be positive: " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder annotate(boolean annotate) {
            this.annotate = annotate;
            return this;
        }

        public Builder metricsFile(String metricsFile) {
            this.metricsFile = metricsFile == null ? "" : metricsFile.trim();
            return this;
        }

        /**
         * Overrides every option present in {@code properties}.
         */
        public Builder apply(Properties properties) {
            for (String key : properties.stringPropertyNames()) {
                String value = properties.getProperty(key).trim();
                if (key.startsWith(CALL_COST_PREFIX)) {
                    callCost(key.substring(CALL_COST_PREFIX.length()), ComplexityClass.fromNotation(value));
                    continue;
                }
                switch (key) {
                    case UNKNOWN_CALLS -> unknownCallPolicy(parsePolicy(value));
                    case SIZE_FUNCTIONS -> sizeFunctions(splitList(value));
                    case FAIL_ON_UNSUPPORTED -> failOnUnsupported(Boolean.parseBoolean(value));
                    case THREADS -> threads(parseInt(key, value));
                    case ANNOTATE -> annotate(Boolean.parseBoolean(value));
                    case METRICS_FILE -> metricsFile(value);
                    default -> logger.debug("Ignoring unrecognized configuration key: {}", key);
                }
            }
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }

        private static UnknownCallPolicy parsePolicy(String value) {
            try {
                return UnknownCallPolicy.valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(UNKNOWN_CALLS + " must be 'constant' or 'unknown', got: " + value, e);
            }
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer, got: " + value, e);
            }
        }

        private static List<String> splitList(String value) {
            List<String> items = new ArrayList<>();
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
            return items;
        }
    }
}
