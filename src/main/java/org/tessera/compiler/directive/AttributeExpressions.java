package org.tessera.compiler.directive;

import org.tessera.compiler.frontend.parser.PipeParser;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributePart;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.util.JavaSource;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts attribute values into Java expressions, for directives that merge with existing attributes.
 */
public final class AttributeExpressions {

    private AttributeExpressions() {}

    /**
     * @param value The attribute value.
     * @return A Java expression of type {@code String} (or the raw output expression) for the value.
     */
    public static String toExpression(AttributeValue value) {
        if (value instanceof AttributeValue.Static s) {
            return JavaSource.stringLiteral(s.text());
        }
        if (value instanceof AttributeValue.Output o) {
            return outputExpression(o.output());
        }
        if (value instanceof AttributeValue.Parts p) {
            return p.parts().stream()
                    .map(part -> part instanceof AttributePart.Dynamic d
                            ? "String.valueOf(" + outputExpression(d.output()) + ")"
                            : JavaSource.stringLiteral(((AttributePart.Literal) part).text()))
                    .collect(Collectors.joining(" + ", "(", ")"));
        }
        return "\"\"";
    }

    /**
     * @param output The output node.
     * @return The expression with its filter chain applied.
     */
    public static String outputExpression(OutputNode output) {
        return PipeParser.compose(output.getExpression(), output.getFilters());
    }

    /**
     * @param attributes The element attributes.
     * @return The names of all non-spread attributes, in order.
     */
    public static Set<String> namedAttributes(List<AttributeNode> attributes) {
        Set<String> names = new LinkedHashSet<>();
        for (AttributeNode attribute : attributes) {
            if (!attribute.isSpread()) {
                names.add(attribute.name());
            }
        }
        return names;
    }
}
