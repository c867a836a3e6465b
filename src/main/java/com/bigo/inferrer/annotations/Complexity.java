package com.bigo.inferrer.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Inferred worst-case time complexity of a method in Big-O notation.
 * Examples: "O(1)", "O(log n)", "O(n log n)", "O(n^2)", "Unknown"
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.METHOD, ElementType.CONSTRUCTOR})
public @interface Complexity {
    String time() default "";

    /**
     * Reasons the inference fell back to Unknown, if any.
     */
    String[] warnings() default {};
}
