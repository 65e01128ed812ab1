package org.tessera.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A dynamic expression whose value is written to the output.
 */
public final class OutputNode extends AstNode {

    private final String expression;
    private final boolean escape;
    private final List<String> filters;
    private OutputContext context;

    /**
     * @param expression The Java expression, without filters.
     * @param escape Whether the value is escaped for its context.
     * @param context The initial output context.
     * @param filters The filter calls applied to the value, innermost first.
     * @param line The source line.
     * @param column The source column.
     */
    public OutputNode(String expression, boolean escape, OutputContext context, List<String> filters, int line, int column) {
        super(line, column);
        this.expression = expression;
        this.escape = escape;
        this.context = context;
        this.filters = List.copyOf(filters);
    }

    public String getExpression() {
        return expression;
    }

    public boolean isEscape() {
        return escape;
    }

    public OutputContext getContext() {
        return context;
    }

    /**
     * Assigns the context decided by context analysis.
     * @param context The output context.
     */
    public void setContext(OutputContext context) {
        this.context = context;
    }

    public List<String> getFilters() {
        return filters;
    }
}
