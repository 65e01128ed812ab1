package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.api.SyntaxException;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.TextNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DirectiveExtractionPass}.
 */
public class DirectiveExtractionPassTest {

    private static DocumentNode extract(String source) {
        CompilerConfig config = CompilerConfig.defaults();
        return PassTestSupport.run(source, new DirectiveExtractionPass(DirectiveRegistry.withDefaults(config), config));
    }

    @Test
    @Tag("unit")
    void testControlFlowDirectiveWrapsItsHost() {
        // Act
        DocumentNode document = extract("<li s:if=\"visible\" id=\"a\">x</li>");

        // Assert
        DirectiveNode directive = (DirectiveNode) document.getChildren().get(0);
        assertThat(directive.getName()).isEqualTo("if");
        assertThat(directive.getExpression()).isEqualTo("visible");
        ElementNode host = (ElementNode) directive.getChildren().get(0);
        assertThat(host.getAttributes()).extracting(AttributeNode::name).containsExactly("id");
    }

    @Test
    @Tag("unit")
    void testContentDirectiveReplacesTheBody() {
        // Act
        DocumentNode document = extract("<p s:text=\"title\">placeholder</p>");

        // Assert
        ElementNode host = (ElementNode) document.getChildren().get(0);
        assertThat(host.getChildren()).singleElement().isInstanceOfSatisfying(DirectiveNode.class,
                d -> assertThat(d.getName()).isEqualTo("text"));
    }

    @Test
    @Tag("unit")
    void testBareFragmentIsUnwrapped() {
        // Act
        DocumentNode document = extract("<s-template s:if=\"a\">x<b>y</b></s-template>");

        // Assert
        DirectiveNode directive = (DirectiveNode) document.getChildren().get(0);
        assertThat(directive.getChildren()).hasSize(2);
        assertThat(directive.getChildren().get(0)).isInstanceOf(TextNode.class);
    }

    @Test
    @Tag("unit")
    void testPassThroughDirectivesStayOnTheElement() {
        // Act
        DocumentNode document = extract("<div s:slot=\"header\">h</div>");

        // Assert
        assertThat(document.getChildren().get(0)).isInstanceOfSatisfying(ElementNode.class,
                e -> assertThat(e.getAttributes()).extracting(AttributeNode::name).containsExactly("s:slot"));
    }

    @Test
    @Tag("unit")
    void testDynamicDirectiveValuesAreRejected() {
        assertThatThrownBy(() -> extract("<p s:if=\"<%= x %>\">a</p>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Directive attributes cannot contain dynamic output expressions");
    }

    @Test
    @Tag("unit")
    void testTwoContentDirectivesAreRejected() {
        assertThatThrownBy(() -> extract("<p s:text=\"a\" s:html=\"b\"></p>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("Only one content directive allowed per element.");
    }

    @Test
    @Tag("unit")
    void testContentDirectivesAreRejectedOnComponents() {
        assertThatThrownBy(() -> extract("<s-card s:text=\"a\"></s-card>"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageStartingWith("s:text cannot be used on components.");
    }
}
