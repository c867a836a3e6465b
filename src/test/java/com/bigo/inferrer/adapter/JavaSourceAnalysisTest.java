package com.bigo.inferrer.adapter;

import com.bigo.inferrer.analysis.ComplexityAnalyzer;
import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.FunctionComplexity;
import com.bigo.inferrer.syntax.FunctionDefinition;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parses real Java methods and runs them through the whole engine.
 */
class JavaSourceAnalysisTest {

    private static final String SOURCE = String.join("\n",
            "class Algorithms {",
            "    int sumArray(int[] xs) {",
            "        int s = 0;",
            "        for (int i = 0; i < xs.length; i++) {",
            "            s += xs[i];",
            "        }",
            "        return s;",
            "    }",
            "",
            "    void bubbleSort(int[] a) {",
            "        int n = a.length;",
            "        for (int i = 0; i < n - 1; i++) {",
            "            for (int j = 0; j < n - i - 1; j++) {",
            "                if (a[j] > a[j + 1]) {",
            "                    int t = a[j];",
            "                    a[j] = a[j + 1];",
            "                    a[j + 1] = t;",
            "                }",
            "            }",
            "        }",
            "    }",
            "",
            "    int countBits(int n) {",
            "        int c = 0;",
            "        while (n > 0) {",
            "            c += n & 1;",
            "            n >>= 1;",
            "        }",
            "        return c;",
            "    }",
            "",
            "    void mergeSort(int[] a, int lo, int hi) {",
            "        if (lo >= hi) return;",
            "        int mid = (lo + hi) / 2;",
            "        mergeSort(a, lo, mid);",
            "        mergeSort(a, mid + 1, hi);",
            "        merge(a, lo, mid, hi);",
            "    }",
            "",
            "    void merge(int[] a, int lo, int mid, int hi) {",
            "        int[] aux = new int[hi - lo + 1];",
            "        int i = lo, j = mid + 1;",
            "        for (int k = lo; k <= hi; k++) {",
            "            if (i > mid) aux[k - lo] = a[j++];",
            "            else aux[k - lo] = a[i++];",
            "        }",
            "    }",
            "",
            "    int search(int[] a, int key, int lo, int hi) {",
            "        if (lo > hi) return -1;",
            "        int mid = (lo + hi) / 2;",
            "        if (a[mid] < key) {",
            "            return search(a, key, mid + 1, hi);",
            "        } else {",
            "            return search(a, key, lo, mid - 1);",
            "        }",
            "    }",
            "",
            "    int fib(int n) {",
            "        if (n <= 1) return n;",
            "        return fib(n - 1) + fib(n - 2);",
            "    }",
            "",
            "    int smallArray() {",
            "        int s = 0;",
            "        for (int x : new int[]{1, 2, 3}) {",
            "            s += x;",
            "        }",
            "        return s;",
            "    }",
            "",
            "    int fixedList() {",
            "        int c = 0;",
            "        for (String s : List.of(\"a\", \"b\")) {",
            "            c++;",
            "        }",
            "        return c;",
            "    }",
            "}");

    private static Map<String, FunctionComplexity> results;

    @BeforeAll
    static void analyze() {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        CompilationUnit cu = parser.parse(SOURCE).getResult().orElseThrow();

        JavaParserNodeAdapter adapter = new JavaParserNodeAdapter();
        List<FunctionDefinition> functions = new ArrayList<>();
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            functions.add(adapter.adapt(method));
        }

        results = new HashMap<>();
        for (FunctionComplexity result : new ComplexityAnalyzer().analyzeModule(functions)) {
            results.put(result.getFunctionName(), result);
        }
    }

    private static ComplexityClass classOf(String name) {
        return results.get(name).getComplexity();
    }

    @Test
    void arrayScanIsLinear() {
        assertEquals(ComplexityClass.LINEAR, classOf("sumArray"));
    }

    @Test
    void bubbleSortIsQuadratic() {
        assertEquals(ComplexityClass.QUADRATIC, classOf("bubbleSort"));
    }

    @Test
    void shiftingLoopIsLogarithmic() {
        assertEquals(ComplexityClass.LOGARITHMIC, classOf("countBits"));
    }

    @Test
    void mergeSortIsLinearithmic() {
        assertEquals(ComplexityClass.LINEAR, classOf("merge"));
        FunctionComplexity mergeSort = results.get("mergeSort");
        assertEquals(ComplexityClass.LINEARITHMIC, mergeSort.getComplexity());
        assertEquals("T(n) = 2T(n/2) + O(n)", mergeSort.getRecurrence());
    }

    @Test
    void recursiveBinarySearchIsLogarithmic() {
        assertEquals(ComplexityClass.LOGARITHMIC, classOf("search"));
    }

    @Test
    void naiveFibonacciIsExponential() {
        assertEquals(ComplexityClass.EXPONENTIAL, classOf("fib"));
    }

    @Test
    void literalContainersHaveAFixedSize() {
        assertEquals(ComplexityClass.CONSTANT, classOf("smallArray"));
        assertEquals(ComplexityClass.CONSTANT, classOf("fixedList"));
    }
}
