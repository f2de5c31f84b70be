// file: src/main/java/io/otlite/core/TransformEngine.java
package io.otlite.core;

import java.util.List;

/**
 * Pure functions that rewrite one operation against another so that both
 * can be applied without corrupting positions.
 * <p>
 * Contract for {@code transform(a, b)}:
 *  - {@code a} and {@code b} were produced against the same document state S.
 *  - {@code b} has already been applied; the result {@code a'} is valid on
 *    {@code apply(S, b)}.
 *  - Convergence: {@code apply(apply(S, b), transform(a, b))} equals
 *    {@code apply(apply(S, a), transform(b, a))} for every valid pair.
 * <p>
 * Implementations are stateless and thread safe. They never mutate inputs.
 */
public interface TransformEngine {

    /** Rewrite {@code a} so that it applies after the concurrent {@code b}. */
    Operation transform(Operation a, Operation b);

    /**
     * Rebase {@code op} across an ordered slice of already-applied operations
     * by folding left: {@code transform(...transform(transform(op, h1), h2)..., hn)}.
     * The slice is never reordered.
     */
    default Operation rebase(Operation op, List<Operation> applied) {
        Operation current = op;
        for (Operation h : applied) {
            current = transform(current, h);
        }
        return current;
    }
}
