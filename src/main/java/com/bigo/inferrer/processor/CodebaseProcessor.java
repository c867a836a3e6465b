package com.bigo.inferrer.processor;

import com.bigo.inferrer.adapter.JavaParserNodeAdapter;
import com.bigo.inferrer.analysis.AnalysisCancelledException;
import com.bigo.inferrer.analysis.AnalysisOptions;
import com.bigo.inferrer.analysis.CancellationToken;
import com.bigo.inferrer.analysis.ComplexityAnalyzer;
import com.bigo.inferrer.analysis.UnsupportedConstructException;
import com.bigo.inferrer.evaluation.MetricsCollector;
import com.bigo.inferrer.model.FunctionComplexity;
import com.bigo.inferrer.syntax.FunctionDefinition;
import com.bigo.inferrer.visitor.ComplexityAnnotationVisitor;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Infers the time complexity of every method in a Java codebase.
 *
 * Each file is parsed with JavaParser and each of its types is analyzed as one
 * module, so calls between methods of the same class resolve to their inferred
 * classes. Methods of earlier types in a file are visible to later ones.
 * Files are independent of each other and may be processed in parallel.
 */
public class CodebaseProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseProcessor.class);

    private final AnalysisOptions options;
    private final ParserConfiguration parserConfig;
    private final JavaParserNodeAdapter adapter = new JavaParserNodeAdapter();
    private final MetricsCollector metricsCollector = new MetricsCollector();
    private final Map<Path, List<FunctionComplexity>> results = new ConcurrentHashMap<>();

    public CodebaseProcessor() {
        this(AnalysisOptions.load());
    }

    public CodebaseProcessor(AnalysisOptions options) {
        this.options = options;
        this.parserConfig = new ParserConfiguration();
        this.parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21);
    }

    public int processCodebase(Path codebasePath) throws IOException {
        return processCodebase(codebasePath, CancellationToken.none());
    }

    /**
     * Processes all Java files under the given path.
     *
     * @param codebasePath Root directory of the codebase, or a single source file
     * @param cancellationToken Checked between files and inside each analysis
     * @return Number of files processed successfully
     * @throws IOException If the path does not exist or cannot be walked
     * @throws UnsupportedConstructException If a method is unsupported and failing is configured
     * @throws AnalysisCancelledException If cancelled
     */
    public int processCodebase(Path codebasePath, CancellationToken cancellationToken) throws IOException {
        if (!Files.exists(codebasePath)) {
            throw new IOException("Path does not exist: " + codebasePath);
        }

        metricsCollector.startAnalysis();

        List<Path> javaFiles;
        try (Stream<Path> paths = Files.walk(codebasePath)) {
            javaFiles = paths.filter(Files::isRegularFile)
                    .filter(path -> path.toString().endsWith(".java"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        logger.info("Found {} Java files. Analyzing with {} thread(s)...", javaFiles.size(), options.getThreads());

        int processed = options.getThreads() > 1
                ? processInParallel(javaFiles, cancellationToken)
                : processSequentially(javaFiles, cancellationToken);

        metricsCollector.endAnalysis();
        exportMetrics(codebasePath);

        logger.info("Processed {} of {} files", processed, javaFiles.size());
        return processed;
    }

    private int processSequentially(List<Path> javaFiles, CancellationToken cancellationToken) {
        int processed = 0;
        for (Path javaFile : javaFiles) {
            cancellationToken.throwIfCancelled();
            if (processFileSafely(javaFile, cancellationToken)) {
                processed++;
            }
        }
        return processed;
    }

    private int processInParallel(List<Path> javaFiles, CancellationToken cancellationToken) {
        ExecutorService executor = Executors.newFixedThreadPool(options.getThreads());
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (Path javaFile : javaFiles) {
                futures.add(executor.submit(() -> {
                    cancellationToken.throwIfCancelled();
                    return processFileSafely(javaFile, cancellationToken);
                }));
            }

            int processed = 0;
            for (Future<Boolean> future : futures) {
                if (future.get()) {
                    processed++;
                }
            }
            return processed;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("File task failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting for file tasks");
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Processes one file, logging and counting its failures instead of propagating them.
     * Cancellation, and unsupported constructs under {@code failOnUnsupported}, still end the run.
     */
    private boolean processFileSafely(Path javaFile, CancellationToken cancellationToken) {
        try {
            processFile(javaFile, cancellationToken);
            return true;
        } catch (AnalysisCancelledException e) {
            throw e;
        } catch (UnsupportedConstructException e) {
            if (options.isFailOnUnsupported()) {
                throw e;
            }
            return failed(javaFile, e);
        } catch (IOException | RuntimeException e) {
            return failed(javaFile, e);
        }
    }

    private boolean failed(Path javaFile, Exception e) {
        logger.error("Error processing file: {}", javaFile, e);
        metricsCollector.recordFailedFile();
        return false;
    }

    /**
     * Analyzes every method of one source file, annotating it when configured.
     *
     * @param javaFile The source file
     * @param cancellationToken Checked inside each analysis
     * @return One result per method with a body, in declaration order
     * @throws IOException If the file cannot be read, parsed, or written back
     */
    public List<FunctionComplexity> processFile(Path javaFile, CancellationToken cancellationToken)
            throws IOException {
        CompilationUnit cu = parse(javaFile);
        metricsCollector.recordFile();

        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(options);
        Map<MethodDeclaration, FunctionComplexity> byDeclaration = new IdentityHashMap<>();
        List<FunctionComplexity> fileResults = new ArrayList<>();

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            metricsCollector.recordClass();
            analyzeType(type, analyzer, cancellationToken, byDeclaration);
            for (MethodDeclaration method : type.getMethods()) {
                FunctionComplexity result = byDeclaration.get(method);
                if (result != null) {
                    fileResults.add(result);
                    metricsCollector.recordFunction(result);
                    logger.info("{}.{}: {}", type.getNameAsString(), result.getSignature(),
                            result.getComplexity());
                }
            }
        }

        if (options.isAnnotate()) {
            ComplexityAnnotationVisitor visitor = new ComplexityAnnotationVisitor(byDeclaration);
            visitor.visit(cu, null);
            if (visitor.hasModifications()) {
                Files.writeString(javaFile, cu.toString());
                metricsCollector.recordAnnotated(visitor.getAnnotatedMethods());
                logger.info("Updated file with @Complexity annotations: {}", javaFile);
            }
        }

        results.put(javaFile, Collections.unmodifiableList(fileResults));
        return fileResults;
    }

    private CompilationUnit parse(Path javaFile) throws IOException {
        // JavaParser instances are not safe to share between worker threads
        ParseResult<CompilationUnit> parsed = new JavaParser(parserConfig).parse(javaFile);
        if (!parsed.isSuccessful()) {
            throw new IOException("Failed to parse file: " + javaFile + " " + parsed.getProblems());
        }
        return parsed.getResult()
                .orElseThrow(() -> new IOException("Failed to parse file: " + javaFile));
    }

    private void analyzeType(TypeDeclaration<?> type, ComplexityAnalyzer analyzer,
                             CancellationToken cancellationToken,
                             Map<MethodDeclaration, FunctionComplexity> byDeclaration) {
        List<MethodDeclaration> adapted = new ArrayList<>();
        List<FunctionDefinition> functions = new ArrayList<>();

        for (MethodDeclaration method : type.getMethods()) {
            if (method.getBody().isEmpty()) {
                continue;
            }
            try {
                functions.add(adapter.adapt(method));
                adapted.add(method);
            } catch (UnsupportedConstructException e) {
                if (options.isFailOnUnsupported()) {
                    throw e;
                }
                String name = method.getNameAsString();
                String signature = FunctionDefinition.signatureOf(name, method.getParameters().size());
                logger.warn("{}: unsupported construct: {}", signature, e.getConstruct());
                FunctionComplexity unknown = FunctionComplexity.unknown(name, signature,
                        List.of("unsupported construct: " + e.getConstruct()));
                // Callers of an unmappable method inherit Unknown
                analyzer.registerExternal(unknown);
                byDeclaration.put(method, unknown);
            }
        }

        List<FunctionComplexity> analyzed = analyzer.analyzeModule(functions, cancellationToken);
        for (int i = 0; i < analyzed.size(); i++) {
            FunctionComplexity result = analyzed.get(i);
            byDeclaration.put(adapted.get(i), result);
            analyzer.registerExternal(result);
        }
    }

    private void exportMetrics(Path codebasePath) {
        String metricsFile = options.getMetricsFile();
        if (metricsFile == null || metricsFile.isBlank()) {
            return;
        }
        Path directory = Files.isDirectory(codebasePath)
                ? codebasePath
                : codebasePath.toAbsolutePath().getParent();
        try {
            metricsCollector.exportJSON(directory.resolve(metricsFile));
        } catch (IOException e) {
            logger.error("Failed to export metrics to JSON", e);
        }
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    /**
     * Results of every file processed so far, keyed by file path.
     */
    public Map<Path, List<FunctionComplexity>> getResults() {
        return Collections.unmodifiableMap(results);
    }
}
