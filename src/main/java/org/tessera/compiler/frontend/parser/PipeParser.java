package org.tessera.compiler.frontend.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits an output expression such as {@code user.name() |> upper() |> raw()} into the base
 * expression and its filter chain.
 * <p>
 * The pipe operator {@code |>} is only recognized outside string and character literals and
 * outside brackets. The markers {@code raw()} and {@code json()} are removed from the chain and
 * reported as flags.
 */
public final class PipeParser {

    private static final String PIPE = "|>";
    private static final Pattern RAW_MARKER = Pattern.compile("raw\\s*\\(\\s*\\)");
    private static final Pattern JSON_MARKER = Pattern.compile("json\\s*\\(\\s*\\)");

    private PipeParser() {}

    /**
     * Parses an expression.
     * @param expression The trimmed output expression.
     * @return The base expression with its filters and markers.
     */
    public static PipeChain parse(String expression) {
        if (!expression.contains(PIPE)) {
            return new PipeChain(expression, List.of(), false, false);
        }
        List<String> segments = split(expression);
        if (segments.size() < 2) {
            return new PipeChain(expression, List.of(), false, false);
        }

        boolean raw = false;
        boolean json = false;
        List<String> filters = new ArrayList<>();
        for (String segment : segments.subList(1, segments.size())) {
            if (RAW_MARKER.matcher(segment).matches()) {
                raw = true;
            } else if (JSON_MARKER.matcher(segment).matches()) {
                json = true;
            } else if (!segment.isEmpty()) {
                filters.add(segment);
            }
        }
        return new PipeChain(segments.get(0), filters, raw, json);
    }

    /**
     * Applies a filter chain to an expression. Each filter wraps the previous result: a
     * {@code ...} argument is replaced by it, otherwise it becomes the first argument.
     *
     * @param expression The base expression.
     * @param filters The filter calls, innermost first.
     * @return The composed Java expression.
     */
    public static String compose(String expression, List<String> filters) {
        String result = expression;
        for (String filter : filters) {
            if (filter.contains("...")) {
                result = filter.replace("...", result);
                continue;
            }
            int open = filter.indexOf('(');
            if (open < 0 || !filter.endsWith(")")) {
                result = filter + "(" + result + ")";
                continue;
            }
            String arguments = filter.substring(open + 1, filter.length() - 1).trim();
            result = filter.substring(0, open).trim() + "(" + result + (arguments.isEmpty() ? "" : ", " + arguments) + ")";
        }
        return result;
    }

    private static List<String> split(String expression) {
        List<String> segments = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                case '|' -> {
                    if (depth == 0 && i + 1 < expression.length() && expression.charAt(i + 1) == '>') {
                        segments.add(expression.substring(start, i).trim());
                        start = i + 2;
                        i++;
                    }
                }
                default -> { }
            }
        }
        segments.add(expression.substring(start).trim());
        return segments;
    }
}
