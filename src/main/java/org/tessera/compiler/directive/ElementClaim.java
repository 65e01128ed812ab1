package org.tessera.compiler.directive;

import java.util.Optional;

/**
 * Declares that a directive may be written as a custom element, e.g. {@code <s-if condition="x">}.
 *
 * @param expressionAttribute The host attribute holding the directive expression, or {@code null}
 *                            if the element form takes no expression.
 */
public record ElementClaim(String expressionAttribute) {

    /**
     * @param attribute The attribute holding the expression.
     * @return A claim reading its expression from the given attribute.
     */
    public static ElementClaim withAttribute(String attribute) {
        return new ElementClaim(attribute);
    }

    /**
     * @return A claim for directives without an expression, such as {@code else}.
     */
    public static ElementClaim bare() {
        return new ElementClaim(null);
    }

    public Optional<String> getExpressionAttribute() {
        return Optional.ofNullable(expressionAttribute);
    }
}
