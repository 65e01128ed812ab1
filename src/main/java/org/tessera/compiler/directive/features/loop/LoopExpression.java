package org.tessera.compiler.directive.features.loop;

import org.tessera.compiler.util.JavaSource;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed iteration clause: {@code COLLECTION as item} or {@code COLLECTION as key => value}.
 *
 * @param collection The Java expression being iterated.
 * @param keyVariable The key variable of the map form, or {@code null}.
 * @param itemVariable The item (or value) variable.
 */
public record LoopExpression(String collection, String keyVariable, String itemVariable) {

    private static final Pattern CLAUSE = Pattern.compile("^(.+?)\\s+as\\s+(.+)$", Pattern.DOTALL);

    /**
     * @param expression The directive expression.
     * @return The parsed clause, or empty if it is malformed or names invalid variables.
     */
    public static Optional<LoopExpression> parse(String expression) {
        Matcher m = CLAUSE.matcher(expression.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        String collection = m.group(1).trim();
        String target = m.group(2).trim();
        String key = null;
        String item = target;
        int arrow = target.indexOf("=>");
        if (arrow >= 0) {
            key = target.substring(0, arrow).trim();
            item = target.substring(arrow + 2).trim();
            if (!JavaSource.isIdentifier(key)) {
                return Optional.empty();
            }
        }
        if (collection.isEmpty() || !JavaSource.isIdentifier(item)) {
            return Optional.empty();
        }
        return Optional.of(new LoopExpression(collection, key, item));
    }

    public boolean hasKey() {
        return keyVariable != null;
    }

    /**
     * @return The name of the loop metadata variable, e.g. {@code itemLoop}.
     */
    public String metadataVariable() {
        return itemVariable + "Loop";
    }
}
