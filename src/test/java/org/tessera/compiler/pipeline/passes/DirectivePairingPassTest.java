package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DirectivePairingPassTest {

    private static DocumentNode pair(String source) {
        CompilerConfig config = CompilerConfig.defaults();
        DirectiveRegistry registry = DirectiveRegistry.withDefaults(config);
        return PassTestSupport.run(source,
                new DirectiveExtractionPass(registry, config),
                new DirectivePairingPass(registry));
    }

    @Test
    @Tag("unit")
    void testChainIsLinkedAcrossWhitespace() {
        // Act
        DocumentNode document = pair("<p s:if=\"a\">A</p>\n  <p s:elseif=\"b\">B</p><p s:else>C</p>");

        // Assert
        DirectiveNode first = (DirectiveNode) document.getChildren().get(0);
        DirectiveNode second = (DirectiveNode) document.getChildren().get(2);
        DirectiveNode third = (DirectiveNode) document.getChildren().get(3);
        assertThat(first.getPairedSibling()).containsSame(second);
        assertThat(second.getPairedSibling()).containsSame(third);
        assertThat(second.getPairedPrimary()).containsSame(first);
        assertThat(second.isConsumedByPairing()).isTrue();
        assertThat(third.isConsumedByPairing()).isTrue();
        assertThat(first.isConsumedByPairing()).isFalse();
    }

    @Test
    @Tag("unit")
    void testTextBetweenPartnersBreaksThePair() {
        // Act
        DocumentNode document = pair("<p s:if=\"a\">A</p>x<p s:else>C</p>");

        // Assert
        DirectiveNode primary = (DirectiveNode) document.getChildren().get(0);
        DirectiveNode orphan = (DirectiveNode) document.getChildren().get(2);
        assertThat(primary.getPairedSibling()).isEmpty();
        assertThat(orphan.isConsumedByPairing()).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnrelatedDirectivesStayUnpaired() {
        // Act
        DocumentNode document = pair("<p s:foreach=\"items as item\">A</p><p s:else>C</p>");

        // Assert
        assertThat(((DirectiveNode) document.getChildren().get(0)).getPairedSibling()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testPartnersInDifferentParentsStayUnpaired() {
        // Act
        DocumentNode document = pair("<div><div s:if=\"a\">A</div></div><div s:else>B</div>");

        // Assert
        ElementNode wrapper = (ElementNode) document.getChildren().get(0);
        DirectiveNode primary = (DirectiveNode) wrapper.getChildren().get(0);
        DirectiveNode orphan = (DirectiveNode) document.getChildren().get(1);
        assertThat(primary.getPairedSibling()).isEmpty();
        assertThat(orphan.getPairedPrimary()).isEmpty();
        assertThat(orphan.isConsumedByPairing()).isFalse();
    }
}
