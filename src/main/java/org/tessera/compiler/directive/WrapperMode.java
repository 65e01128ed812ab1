package org.tessera.compiler.directive;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.TextNode;

import java.util.List;
import java.util.Optional;

/**
 * Decides between the two code shapes of a repeating directive.
 * <p>
 * In wrapper mode the host element is emitted once and its children repeat inside it; in repeat
 * mode the host element itself repeats. Wrapper mode applies when the directive has exactly one
 * child, an element, that itself has at least one element child (whitespace-only text ignored).
 */
public final class WrapperMode {

    private WrapperMode() {}

    /**
     * @param node The directive node.
     * @return The wrapper element if wrapper mode applies, otherwise empty.
     */
    public static Optional<ElementNode> wrapperElement(DirectiveNode node) {
        List<AstNode> meaningful = node.getChildren().stream()
                .filter(child -> !(child instanceof TextNode text && text.isBlank()))
                .toList();
        if (meaningful.size() != 1 || !(meaningful.get(0) instanceof ElementNode element)) {
            return Optional.empty();
        }
        boolean hasElementChild = element.getChildren().stream().anyMatch(ElementNode.class::isInstance);
        return hasElementChild ? Optional.of(element) : Optional.empty();
    }
}
