package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.FunctionComplexity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Results of already-analyzed functions, so a call to a known function costs
 * that function's class instead of re-analyzing or inlining its body.
 *
 * Lookups try the exact {@code name/arity} signature first and fall back to the
 * bare name when exactly one cached function carries it.
 */
public class FunctionResultCache {

    private static final Logger logger = LoggerFactory.getLogger(FunctionResultCache.class);

    private final Map<String, FunctionComplexity> cache = new LinkedHashMap<>();

    // Secondary index: function name -> list of full signatures
    private final Map<String, List<String>> nameIndex = new HashMap<>();

    /**
     * Stores a result in the cache.
     *
     * @param signature The function signature, {@code name/arity}
     * @param result The analysis result
     */
    public void put(String signature, FunctionComplexity result) {
        if (cache.put(signature, result) == null) {
            nameIndex.computeIfAbsent(extractName(signature), k -> new ArrayList<>()).add(signature);
        }
        logger.debug("Cached result for {}: {}", signature, result.getComplexity());
    }

    /**
     * Copies every entry of {@code other} into this cache.
     */
    public void putAll(FunctionResultCache other) {
        other.cache.forEach(this::put);
    }

    private static String extractName(String signature) {
        int slash = signature.lastIndexOf('/');
        return slash > 0 ? signature.substring(0, slash) : signature;
    }

    /**
     * Retrieves a result from the cache.
     * Tries exact match first, then falls back to an unambiguous name match.
     *
     * @param signature The function signature
     * @return The cached result, or empty if not found
     */
    public Optional<FunctionComplexity> get(String signature) {
        FunctionComplexity result = cache.get(signature);
        if (result != null) {
            return Optional.of(result);
        }

        List<String> candidates = nameIndex.get(extractName(signature));
        if (candidates != null && candidates.size() == 1) {
            logger.debug("Resolved {} by name to {}", signature, candidates.get(0));
            return Optional.of(cache.get(candidates.get(0)));
        }

        return Optional.empty();
    }

    public boolean contains(String signature) {
        return cache.containsKey(signature);
    }

    /**
     * All cached results, in insertion order.
     */
    public Collection<FunctionComplexity> getAll() {
        return Collections.unmodifiableCollection(cache.values());
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        nameIndex.clear();
    }

    /**
     * Gets statistics about the cache.
     */
    public String getStatistics() {
        return String.format("FunctionResultCache: %d results, %d distinct names", cache.size(), nameIndex.size());
    }
}
