package com.bigo.inferrer.adapter;

import com.bigo.inferrer.analysis.UnsupportedConstructException;
import com.bigo.inferrer.syntax.FunctionDefinition;

/**
 * Boundary between a concrete parser and the engine: converts one parsed
 * function into the engine's language-neutral tree.
 *
 * @param <T> The parser's function node type
 */
public interface NodeAdapter<T> {

    /**
     * Converts a parsed function.
     *
     * @param function The parser's function node
     * @return The language-neutral definition
     * @throws UnsupportedConstructException If the body contains a construct with no mapping
     */
    FunctionDefinition adapt(T function);
}
