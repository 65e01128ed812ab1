package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.api.SyntaxException;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.ComponentNode;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ElementRoutingPass}.
 */
public class ElementRoutingPassTest {

    private static DocumentNode route(String source) {
        CompilerConfig config = CompilerConfig.defaults();
        return PassTestSupport.run(source, new ElementRoutingPass(DirectiveRegistry.withDefaults(config), config));
    }

    @Test
    @Tag("unit")
    void testClaimedAttributeBecomesTheDirectiveValue() {
        // Act
        DocumentNode document = route("<s-if condition=\"ready\" s:class=\"x\">A</s-if>");

        // Assert
        FragmentNode fragment = (FragmentNode) document.getChildren().get(0);
        assertThat(fragment.getAttributes()).extracting(AttributeNode::name).containsExactly("s:if", "s:class");
        assertThat(fragment.getAttributes().get(0).value()).isEqualTo(AttributeValue.ofStatic("ready"));
        assertThat(fragment.getChildren()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testBareClaimBecomesABooleanDirective() {
        // Act
        DocumentNode document = route("<div><s-else>B</s-else></div>");

        // Assert
        FragmentNode fragment = (FragmentNode) document.getChildren().get(0).getChildren().get(0);
        assertThat(fragment.getAttributes().get(0).value().isBoolean()).isTrue();
    }

    @Test
    @Tag("unit")
    void testUnclaimedComponentsAreLeftAlone() {
        // Act
        DocumentNode document = route("<s-card title=\"t\"></s-card>");

        // Assert
        assertThat(document.getChildren().get(0)).isInstanceOf(ComponentNode.class);
    }

    @Test
    @Tag("unit")
    void testMissingClaimedAttributeIsRejected() {
        assertThatThrownBy(() -> route("<s-foreach>x</s-foreach>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("<s-foreach> requires a \"each\" attribute");
    }

    @Test
    @Tag("unit")
    void testForeignAttributesAreRejected() {
        assertThatThrownBy(() -> route("<s-else id=\"x\">B</s-else>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("<s-else> does not accept the attribute \"id\".");
    }
}
