package org.tessera.compiler.directive.features.switchcase;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tessera.testutils.Templates.body;
import static org.tessera.testutils.Templates.error;

/**
 * Contains unit tests for {@link SwitchDirective} and its {@link CaseDirective} branches.
 */
public class SwitchDirectiveTest {

    /**
     * Verifies that a switch on an element keeps the element around the statement and turns
     * every branch into a braced case followed by a break.
     */
    @Test
    @Tag("unit")
    void switchOnAnElementKeepsTheWrapper() throws Exception {
        // Act
        String generated = body("<div s:switch=\"status\"><p s:case=\"1\">One</p><p s:default>Other</p></div>");

        // Assert
        assertThat(generated).isEqualTo(
                "out.write(\"<div>\");\n"
                        + "switch (status) {\n"
                        + "case 1: {\n"
                        + "out.write(\"<p>One</p>\");\n"
                        + "}\n"
                        + "break;\n"
                        + "default: {\n"
                        + "out.write(\"<p>Other</p>\");\n"
                        + "}\n"
                        + "break;\n"
                        + "}\n"
                        + "out.write(\"</div>\");\n");
    }

    @Test
    @Tag("unit")
    void switchElementsRenderOnlyTheBranchContent() throws Exception {
        // Act
        String generated = body("<s-switch value=\"status\">\n"
                + "  <s-case value=\"1\">One</s-case>\n"
                + "  <s-default>Other</s-default>\n"
                + "</s-switch>");

        // Assert
        assertThat(generated).isEqualTo(
                "switch (status) {\n"
                        + "case 1: {\n"
                        + "out.write(\"One\");\n"
                        + "}\n"
                        + "break;\n"
                        + "default: {\n"
                        + "out.write(\"Other\");\n"
                        + "}\n"
                        + "break;\n"
                        + "}\n");
    }

    @Test
    @Tag("unit")
    void commentsBetweenBranchesAreDropped() throws Exception {
        // Act
        String generated = body("<div s:switch=\"status\"><!-- one --><p s:case=\"1\">One</p>\n"
                + "  <!-- fallback --><p s:default>Other</p></div>");

        // Assert
        assertThat(generated).doesNotContain("<!--");
        assertThat(generated).contains("switch (status) {\ncase 1: {\n", "}\nbreak;\ndefault: {\n");
    }

    @Test
    @Tag("unit")
    void invalidSwitchesAreRejected() {
        // Act & Assert
        assertThat(error("<div s:switch><p s:case=\"1\">x</p></div>"))
                .isEqualTo("Switch directive requires a value expression");
        assertThat(error("<div s:switch=\"x\"><p>stray</p></div>"))
                .isEqualTo("Switch directive can only contain s:case and s:default branches");
        assertThat(error("<div s:switch=\"x\"><p s:default>a</p><p s:default>b</p></div>"))
                .isEqualTo("Switch directive can only have one default case");
        assertThat(error("<div s:switch=\"x\"><p s:case=\"\">a</p></div>"))
                .isEqualTo("Case directive requires a value expression");
        assertThat(error("<div s:switch=\"x\"></div>"))
                .isEqualTo("Switch directive must contain at least one case or default");
    }

    @Test
    @Tag("unit")
    void branchesOutsideASwitchAreRejected() {
        // Act & Assert
        assertThat(error("<p s:case=\"1\">x</p>")).isEqualTo("s:case must be used inside s:switch");
        assertThat(error("<s-default>x</s-default>")).isEqualTo("s:default must be used inside s:switch");
    }
}
