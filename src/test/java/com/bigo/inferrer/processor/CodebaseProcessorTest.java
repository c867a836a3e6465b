package com.bigo.inferrer.processor;

import com.bigo.inferrer.analysis.AnalysisCancelledException;
import com.bigo.inferrer.analysis.AnalysisOptions;
import com.bigo.inferrer.analysis.CancellationToken;
import com.bigo.inferrer.analysis.UnsupportedConstructException;
import com.bigo.inferrer.evaluation.MetricsCollector;
import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.FunctionComplexity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CodebaseProcessorTest {

    private static final String DEMO = String.join("\n",
            "package demo;",
            "",
            "class Demo {",
            "    int sum(int[] xs) {",
            "        int s = 0;",
            "        for (int x : xs) {",
            "            s += x;",
            "        }",
            "        return s;",
            "    }",
            "",
            "    void read() {",
            "        try {",
            "            sum(null);",
            "        } finally {",
            "            System.out.println(\"done\");",
            "        }",
            "    }",
            "",
            "    void caller() {",
            "        read();",
            "    }",
            "",
            "    abstract static class Shape {",
            "        abstract double area();",
            "",
            "        int total(int[] xs) {",
            "            return sum(xs);",
            "        }",
            "",
            "        int sum(int[] xs) {",
            "            int s = 0;",
            "            for (int i = 0; i < xs.length; i++) {",
            "                for (int j = 0; j < xs.length; j++) {",
            "                    s += xs[i] * xs[j];",
            "                }",
            "            }",
            "            return s;",
            "        }",
            "    }",
            "}",
            "");

    private static final String PAIRS = String.join("\n",
            "class Pairs {",
            "    int count(int n) {",
            "        int c = 0;",
            "        for (int i = 0; i < n; i++) {",
            "            for (int j = 0; j < n; j++) {",
            "                c++;",
            "            }",
            "        }",
            "        return c;",
            "    }",
            "}",
            "");

    @TempDir
    Path tempDir;

    private static AnalysisOptions options() {
        return AnalysisOptions.builder().build();
    }

    private Path write(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);
        return file;
    }

    private static Map<String, ComplexityClass> bySignature(List<FunctionComplexity> results) {
        return results.stream().collect(Collectors.toMap(
                FunctionComplexity::getFunctionName, FunctionComplexity::getComplexity, (a, b) -> a));
    }

    @Test
    void analyzesEveryMethodWithABody() throws IOException {
        Path demo = write("demo/Demo.java", DEMO);

        List<FunctionComplexity> results = new CodebaseProcessor(options())
                .processFile(demo, CancellationToken.none());

        assertEquals(List.of("sum", "read", "caller", "total", "sum"),
                results.stream().map(FunctionComplexity::getFunctionName).collect(Collectors.toList()));
        assertEquals(ComplexityClass.LINEAR, results.get(0).getComplexity());
        assertEquals(ComplexityClass.QUADRATIC, results.get(4).getComplexity());
    }

    @Test
    void unsupportedMethodsAndTheirCallersAreUnknown() throws IOException {
        Path demo = write("Demo.java", DEMO);

        List<FunctionComplexity> results = new CodebaseProcessor(options())
                .processFile(demo, CancellationToken.none());

        FunctionComplexity read = results.get(1);
        assertEquals(ComplexityClass.UNKNOWN, read.getComplexity());
        assertEquals(List.of("unsupported construct: try statement"), read.getWarnings());
        assertEquals(ComplexityClass.UNKNOWN, results.get(2).getComplexity());
    }

    @Test
    void methodsOfTheSameTypeResolveEachOther() throws IOException {
        Path demo = write("Demo.java", DEMO);

        List<FunctionComplexity> results = new CodebaseProcessor(options())
                .processFile(demo, CancellationToken.none());

        // Shape.total calls Shape.sum, the quadratic one
        assertEquals(ComplexityClass.QUADRATIC, results.get(3).getComplexity());
    }

    @Test
    void failOnUnsupportedPropagates() throws IOException {
        Path demo = write("Demo.java", DEMO);
        CodebaseProcessor processor = new CodebaseProcessor(
                AnalysisOptions.builder().failOnUnsupported(true).build());

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> processor.processFile(demo, CancellationToken.none()));
        assertEquals("try statement", e.getConstruct());
    }

    @Test
    void processesADirectoryAndWritesMetrics() throws IOException {
        write("demo/Demo.java", DEMO);
        write("Pairs.java", PAIRS);
        write("notes.txt", "not java");

        CodebaseProcessor processor = new CodebaseProcessor(options());
        assertEquals(2, processor.processCodebase(tempDir));

        assertEquals(2, processor.getResults().size());
        assertEquals(Map.of("count", ComplexityClass.QUADRATIC),
                bySignature(processor.getResults().get(tempDir.resolve("Pairs.java"))));

        Path metrics = tempDir.resolve("bigo-inference-metrics.json");
        assertTrue(Files.exists(metrics));
        String json = Files.readString(metrics);
        assertTrue(json.contains("\"totalFiles\": 2"));
        assertTrue(json.contains("\"totalFunctions\": 6"));
        assertTrue(json.contains("\"try statement\": 1"));
    }

    @Test
    void brokenFilesAreCountedAndSkipped() throws IOException {
        write("Pairs.java", PAIRS);
        write("Broken.java", "class Broken { void f( }");

        CodebaseProcessor processor = new CodebaseProcessor(options().toBuilder().metricsFile("").build());
        assertEquals(1, processor.processCodebase(tempDir));

        MetricsCollector.MetricsReport report = processor.getMetricsCollector().generateReport();
        assertEquals(1, report.failedFiles);
        assertEquals(1, report.totalFiles);
        assertFalse(Files.exists(tempDir.resolve("bigo-inference-metrics.json")));
    }

    @Test
    void failingFileDoesNotStopTheRun() throws IOException {
        write("A.java", PAIRS.replace("class Pairs", "class A"));
        Path failing = write("B.java", PAIRS.replace("class Pairs", "class B"));
        write("C.java", PAIRS.replace("class Pairs", "class C"));

        CodebaseProcessor processor = new CodebaseProcessor(options()) {
            @Override
            public List<FunctionComplexity> processFile(Path javaFile, CancellationToken cancellationToken)
                    throws IOException {
                if (javaFile.equals(failing)) {
                    throw new IllegalStateException("engine failure");
                }
                return super.processFile(javaFile, cancellationToken);
            }
        };
        assertEquals(2, processor.processCodebase(tempDir));

        assertEquals(Set.of(tempDir.resolve("A.java"), tempDir.resolve("C.java")), processor.getResults().keySet());
        MetricsCollector.MetricsReport report = processor.getMetricsCollector().generateReport();
        assertEquals(1, report.failedFiles);
        assertEquals(2, report.totalFiles);
        assertTrue(Files.exists(tempDir.resolve("bigo-inference-metrics.json")));
    }

    @Test
    void cancellationStillEndsTheRun() throws IOException {
        write("A.java", PAIRS.replace("class Pairs", "class A"));

        CodebaseProcessor processor = new CodebaseProcessor(options().toBuilder().metricsFile("").build()) {
            @Override
            public List<FunctionComplexity> processFile(Path javaFile, CancellationToken cancellationToken) {
                throw new AnalysisCancelledException("stopped");
            }
        };
        assertThrows(AnalysisCancelledException.class, () -> processor.processCodebase(tempDir));
    }

    @Test
    void missingPathFails() {
        CodebaseProcessor processor = new CodebaseProcessor(options());
        assertThrows(IOException.class, () -> processor.processCodebase(tempDir.resolve("absent")));
    }

    @Test
    void annotatesSourceFilesOnce() throws IOException {
        Path pairs = write("Pairs.java", PAIRS);
        AnalysisOptions annotating = options().toBuilder().annotate(true).build();

        CodebaseProcessor first = new CodebaseProcessor(annotating);
        first.processCodebase(pairs);
        String annotated = Files.readString(pairs);
        assertTrue(annotated.contains("@com.bigo.inferrer.annotations.Complexity(time = \"O(n^2)\")"));
        assertEquals(1, first.getMetricsCollector().generateReport().annotatedFunctions);

        CodebaseProcessor second = new CodebaseProcessor(annotating);
        second.processCodebase(pairs);
        assertEquals(annotated, Files.readString(pairs));
        assertEquals(0, second.getMetricsCollector().generateReport().annotatedFunctions);
    }

    @Test
    void annotationCarriesWarnings() throws IOException {
        Path demo = write("Demo.java", DEMO);

        new CodebaseProcessor(options().toBuilder().annotate(true).metricsFile("").build())
                .processFile(demo, CancellationToken.none());

        String annotated = Files.readString(demo);
        assertTrue(annotated.contains("time = \"Unknown\""));
        assertTrue(annotated.contains("\"unsupported construct: try statement\""));
    }

    @Test
    void parallelRunMatchesSequentialRun() throws IOException {
        write("demo/Demo.java", DEMO);
        write("Pairs.java", PAIRS);
        write("more/Pairs.java", PAIRS.replace("class Pairs", "class MorePairs"));

        CodebaseProcessor sequential = new CodebaseProcessor(options().toBuilder().metricsFile("").build());
        sequential.processCodebase(tempDir);
        CodebaseProcessor parallel = new CodebaseProcessor(
                options().toBuilder().threads(2).metricsFile("").build());
        assertEquals(3, parallel.processCodebase(tempDir));

        for (Map.Entry<Path, List<FunctionComplexity>> entry : sequential.getResults().entrySet()) {
            assertEquals(bySignature(entry.getValue()), bySignature(parallel.getResults().get(entry.getKey())));
        }
    }
}
