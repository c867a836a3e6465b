package com.bigo.inferrer.evaluation;

import com.bigo.inferrer.model.FunctionComplexity;
import com.bigo.inferrer.model.GrowthOrder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    @TempDir
    Path tempDir;

    private static FunctionComplexity result(String name, GrowthOrder order, String... warnings) {
        return new FunctionComplexity(name, name + "/1", order, order.toNotation(), null, List.of(warnings));
    }

    private static MetricsCollector populated() {
        MetricsCollector collector = new MetricsCollector();
        collector.startAnalysis();
        collector.recordFile();
        collector.recordFile();
        collector.recordFailedFile();
        collector.recordClass();
        collector.recordFunction(result("scan", GrowthOrder.LINEAR));
        collector.recordFunction(result("sum", GrowthOrder.LINEAR));
        collector.recordFunction(result("sort", GrowthOrder.QUADRATIC));
        collector.recordFunction(FunctionComplexity.unknown("io", "io/0",
                List.of("unsupported construct: try statement")));
        collector.recordFunction(FunctionComplexity.unknown("spin", "spin/1",
                List.of("unresolved bound for while loop on x < n: loop condition x < n does not change inside the loop",
                        "unsupported construct: try statement")));
        collector.recordAnnotated(3);
        collector.endAnalysis();
        return collector;
    }

    @Test
    void reportCountsFunctionsByClass() {
        MetricsCollector.MetricsReport report = populated().generateReport();

        assertEquals(2, report.totalFiles);
        assertEquals(1, report.failedFiles);
        assertEquals(1, report.totalClasses);
        assertEquals(5, report.totalFunctions);
        assertEquals(3, report.annotatedFunctions);
        assertEquals(2, report.unknownFunctions);
        assertEquals(2, report.functionsWithWarnings);
        assertEquals(3, report.totalWarnings);
        assertEquals(60.0, report.resolvedRate, 1e-9);

        assertEquals(2, report.complexityDistribution.get("O(n)"));
        assertEquals(1, report.complexityDistribution.get("O(n^2)"));
        assertEquals(2, report.complexityDistribution.get("Unknown"));
        assertEquals(List.of("O(n)", "O(n^2)", "Unknown"), List.copyOf(report.complexityDistribution.keySet()));
        assertEquals(2, report.unsupportedConstructs.get("try statement"));
        assertEquals(1, report.unsupportedConstructs.size());
    }

    @Test
    void emptyRunHasNoRates() {
        MetricsCollector collector = new MetricsCollector();
        collector.endAnalysis();
        MetricsCollector.MetricsReport report = collector.generateReport();

        assertEquals(0, report.totalFunctions);
        assertEquals(0.0, report.resolvedRate);
        assertEquals(0.0, report.averageTimePerFile);
        assertTrue(report.complexityDistribution.isEmpty());
    }

    @Test
    void exportsJson() throws IOException {
        Path output = tempDir.resolve("metrics.json");
        populated().exportJSON(output);

        String json = Files.readString(output);
        assertTrue(json.startsWith("{"));
        assertTrue(json.contains("\"totalFunctions\": 5"));
        assertTrue(json.contains("\"failedFiles\": 1"));
        assertTrue(json.contains("\"resolvedRate\": 60.00"));
        assertTrue(json.contains("\"O(n)\": 2"));
        assertTrue(json.contains("\"Unknown\": 2"));
        assertTrue(json.contains("\"try statement\": 2"));
    }

    @Test
    void exportsEmptyCountsAsEmptyObjects() throws IOException {
        Path output = tempDir.resolve("empty.json");
        MetricsCollector collector = new MetricsCollector();
        collector.endAnalysis();
        collector.exportJSON(output);

        String json = Files.readString(output);
        assertTrue(json.contains("\"complexityDistribution\": {}"));
        assertTrue(json.contains("\"unsupportedConstructs\": {}"));
    }
}
