package org.tessera.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a few lines of template source around an error position, with a caret under the column.
 * <pre>
 *  1 | &lt;ul&gt;
 *  2 |   &lt;li s:forech="items as item"&gt;
 *          ^
 *  3 | &lt;/ul&gt;
 * </pre>
 */
public final class SnippetGenerator {

    /** Lines shown before and after the error line. */
    public static final int DEFAULT_CONTEXT_LINES = 2;

    private SnippetGenerator() {}

    /**
     * Generates a snippet with the default amount of context.
     * @param source The template source.
     * @param line The 1-based error line.
     * @param column The 1-based error column; 0 omits the caret.
     * @return The snippet, or an empty string if the line does not exist or is blank.
     */
    public static String generate(String source, int line, int column) {
        return generate(source, line, column, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generates a snippet.
     * @param source The template source.
     * @param line The 1-based error line.
     * @param column The 1-based error column; 0 omits the caret.
     * @param contextLines The lines shown before and after the error line.
     * @return The snippet, or an empty string if the line does not exist or is blank.
     */
    public static String generate(String source, int line, int column, int contextLines) {
        if (source == null || source.isBlank() || line < 1) {
            return "";
        }
        String[] lines = source.split("\n", -1);
        if (line > lines.length || lines[line - 1].isBlank()) {
            return "";
        }

        int first = Math.max(1, line - contextLines);
        int last = Math.min(lines.length, line + contextLines);
        int padding = Math.max(2, String.valueOf(last).length());

        List<String> out = new ArrayList<>();
        for (int i = first; i <= last; i++) {
            out.add(String.format("%" + padding + "d | %s", i, stripCarriageReturn(lines[i - 1])));
            if (i == line && column > 0) {
                out.add(" ".repeat(padding + 3 + column - 1) + "^");
            }
        }
        return String.join("\n", out);
    }

    private static String stripCarriageReturn(String text) {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
