package org.tessera.compiler.frontend.parser;

import java.util.List;

/**
 * The result of splitting an output expression on the pipe operator.
 *
 * @param expression The base expression.
 * @param filters The filter calls in application order, without the markers.
 * @param raw Whether {@code raw()} was present.
 * @param json Whether {@code json()} was present.
 */
public record PipeChain(
        String expression,
        List<String> filters,
        boolean raw,
        boolean json
) {
    public PipeChain {
        filters = List.copyOf(filters);
    }
}
