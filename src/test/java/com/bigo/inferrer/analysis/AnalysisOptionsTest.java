package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.ComplexityClass;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisOptionsTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults() {
        AnalysisOptions options = AnalysisOptions.defaults();
        assertEquals(AnalysisOptions.UnknownCallPolicy.CONSTANT, options.getUnknownCallPolicy());
        assertTrue(options.isSizeFunction("len"));
        assertTrue(options.isSizeFunction("size"));
        assertTrue(options.getCallCosts().isEmpty());
        assertFalse(options.isFailOnUnsupported());
        assertFalse(options.isAnnotate());
        assertEquals(1, options.getThreads());
        assertEquals("bigo-inference-metrics.json", options.getMetricsFile());
    }

    @Test
    void classpathConfigurationDeclaresLibraryCosts() {
        AnalysisOptions options = AnalysisOptions.load();
        assertEquals(ComplexityClass.LINEARITHMIC, options.callCost("sort").orElseThrow());
        assertEquals(ComplexityClass.LOGARITHMIC, options.callCost("binarySearch").orElseThrow());
        assertTrue(options.callCost("frobnicate").isEmpty());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty("analysis.unknownCalls", "Unknown");
        properties.setProperty("analysis.sizeFunctions", "len, count ,");
        properties.setProperty("analysis.callCost.shuffle", "O(n)");
        properties.setProperty("analysis.failOnUnsupported", "true");
        properties.setProperty("processor.threads", "4");
        properties.setProperty("processor.metricsFile", "  ");
        properties.setProperty("unrelated.key", "ignored");

        AnalysisOptions options = AnalysisOptions.fromProperties(properties);
        assertEquals(AnalysisOptions.UnknownCallPolicy.UNKNOWN, options.getUnknownCallPolicy());
        assertEquals(2, options.getSizeFunctions().size());
        assertTrue(options.isSizeFunction("count"));
        assertFalse(options.isSizeFunction("size"));
        assertEquals(ComplexityClass.LINEAR, options.callCost("shuffle").orElseThrow());
        assertTrue(options.isFailOnUnsupported());
        assertEquals(4, options.getThreads());
        assertEquals("", options.getMetricsFile());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.fromProperties(single("processor.threads", "many")));
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.fromProperties(single("processor.threads", "0")));
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.fromProperties(single("analysis.unknownCalls", "maybe")));
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.fromProperties(single("analysis.callCost.f", "O(huge)")));
    }

    @Test
    void fileIsLayeredOverTheClasspathConfiguration() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "analysis.unknownCalls=unknown\nanalysis.callCost.sort=O(n^2)\n");

        AnalysisOptions options = AnalysisOptions.load(file);
        assertEquals(AnalysisOptions.UnknownCallPolicy.UNKNOWN, options.getUnknownCallPolicy());
        assertEquals(ComplexityClass.QUADRATIC, options.callCost("sort").orElseThrow());
        assertEquals(ComplexityClass.LOGARITHMIC, options.callCost("binarySearch").orElseThrow());
    }

    @Test
    void missingFileFails() {
        assertThrows(IOException.class, () -> AnalysisOptions.load(tempDir.resolve("absent.properties")));
    }

    @Test
    void toBuilderCopiesEverySetting() {
        AnalysisOptions original = AnalysisOptions.builder()
                .callCost("shuffle", ComplexityClass.LINEAR)
                .threads(3)
                .annotate(true)
                .build();
        AnalysisOptions copy = original.toBuilder().failOnUnsupported(true).build();

        assertEquals(ComplexityClass.LINEAR, copy.callCost("shuffle").orElseThrow());
        assertEquals(3, copy.getThreads());
        assertTrue(copy.isAnnotate());
        assertTrue(copy.isFailOnUnsupported());
        assertFalse(original.isFailOnUnsupported());
    }

    private static Properties single(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }
}
