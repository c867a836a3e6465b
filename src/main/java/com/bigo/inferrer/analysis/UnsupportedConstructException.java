package com.bigo.inferrer.analysis;

/**
 * Raised when a construct has no modeling rule, instead of silently
 * approximating it. Callers recover at function scope by marking the
 * function Unknown, or abort.
 */
public class UnsupportedConstructException extends RuntimeException {

    private final String construct;

    public UnsupportedConstructException(String construct) {
        super("Unsupported construct: " + construct);
        this.construct = construct;
    }

    /**
     * Name of the construct, e.g. {@code "try statement"} or {@code "mutual recursion"}.
     */
    public String getConstruct() {
        return construct;
    }
}
