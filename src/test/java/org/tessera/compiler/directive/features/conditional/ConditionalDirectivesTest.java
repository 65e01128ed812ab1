package org.tessera.compiler.directive.features.conditional;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tessera.testutils.Templates.body;
import static org.tessera.testutils.Templates.error;

/**
 * Tests the conditional directives: {@code s:if} chains, {@code s:unless}, {@code s:isset},
 * {@code s:empty} and {@code s:notempty}, in attribute, element and fragment form.
 */
public class ConditionalDirectivesTest {

    /**
     * Verifies that an if/elseif/else chain on sibling elements becomes a single Java if statement.
     */
    @Test
    @Tag("unit")
    void ifElseIfElseChainCompilesToOneStatement() throws Exception {
        // Act
        String generated = body("<p s:if=\"a\">A</p><p s:elseif=\"b\">B</p><p s:else>C</p>");

        // Assert
        assertThat(generated).isEqualTo(
                "if (a) {\n"
                        + "out.write(\"<p>A</p>\");\n"
                        + "} else if (b) {\n"
                        + "out.write(\"<p>B</p>\");\n"
                        + "} else {\n"
                        + "out.write(\"<p>C</p>\");\n"
                        + "}\n");
    }

    @Test
    @Tag("unit")
    void whitespaceBetweenPartnersIsWrittenBeforeTheChain() throws Exception {
        // Act
        String generated = body("<p s:if=\"a\">A</p>\n<p s:else>B</p>");

        // Assert
        assertThat(generated).isEqualTo(
                "out.write(\"\\n\");\n"
                        + "if (a) {\n"
                        + "out.write(\"<p>A</p>\");\n"
                        + "} else {\n"
                        + "out.write(\"<p>B</p>\");\n"
                        + "}\n");
    }

    @Test
    @Tag("unit")
    void nonWhitespaceBetweenPartnersBreaksThePairing() {
        // Act
        String message = error("<p s:if=\"a\">A</p>text<p s:else>B</p>");

        // Assert
        assertThat(message).isEqualTo("s:else must follow s:if or s:elseif");
    }

    @Test
    @Tag("unit")
    void unlessIssetAndEmptinessNegateOrTestTheValue() throws Exception {
        // Act & Assert
        assertThat(body("<p s:unless=\"done\">todo</p>")).startsWith("if (!(done)) {\n");
        assertThat(body("<p s:isset=\"user\">hi</p>")).startsWith("if ((user) != null) {\n");
        assertThat(body("<p s:empty=\"items\">none</p>"))
                .startsWith("if (org.tessera.runtime.Values.isEmpty(items)) {\n");
        assertThat(body("<p s:notempty=\"items\">some</p>"))
                .startsWith("if (!org.tessera.runtime.Values.isEmpty(items)) {\n");
    }

    @Test
    @Tag("unit")
    void chainMayEndWithElseIf() throws Exception {
        // Act
        String generated = body("<p s:if=\"a\">A</p><p s:elseif=\"b\">B</p>");

        // Assert
        assertThat(generated).isEqualTo(
                "if (a) {\n"
                        + "out.write(\"<p>A</p>\");\n"
                        + "} else if (b) {\n"
                        + "out.write(\"<p>B</p>\");\n"
                        + "}\n");
    }

    /**
     * Verifies that {@code <s-if>} and {@code <s-else>} elements behave like the attribute form on a fragment.
     */
    @Test
    @Tag("unit")
    void directiveElementsAreRoutedToTheAttributeForm() throws Exception {
        // Act
        String generated = body("<s-if condition=\"a\">A</s-if><s-else>B</s-else>");

        // Assert
        assertThat(generated).isEqualTo(
                "if (a) {\n"
                        + "out.write(\"A\");\n"
                        + "} else {\n"
                        + "out.write(\"B\");\n"
                        + "}\n");
    }

    @Test
    @Tag("unit")
    void fragmentRendersOnlyItsChildren() throws Exception {
        // Act
        String generated = body("<s-template s:if=\"a\"><p>A</p><p>B</p></s-template>");

        // Assert
        assertThat(generated).isEqualTo("if (a) {\nout.write(\"<p>A</p><p>B</p>\");\n}\n");
    }

    @Test
    @Tag("unit")
    void directiveElementErrors() {
        // Act & Assert
        assertThat(error("<s-if>A</s-if>")).isEqualTo("<s-if> requires a \"condition\" attribute");
        assertThat(error("<s-if condition=\"a\" class=\"x\">A</s-if>"))
                .isEqualTo("<s-if> does not accept the attribute \"class\". Only \"condition\" is allowed.");
        assertThat(error("<s-if condition=\"<%= a %>\">A</s-if>"))
                .isEqualTo("Attribute \"condition\" of <s-if> must be a static expression");
    }

    @Test
    @Tag("unit")
    void misplacedOrMalformedConditionalsAreRejected() {
        // Act & Assert
        assertThat(error("<p s:else>B</p>")).isEqualTo("s:else must follow s:if or s:elseif");
        assertThat(error("<p s:elseif=\"b\">B</p>")).isEqualTo("s:elseif must follow s:if or s:elseif");
        assertThat(error("<div><div s:if=\"a\">A</div></div><div s:else>B</div>"))
                .isEqualTo("s:else must follow s:if or s:elseif");
        assertThat(error("<p s:if=\"\">A</p>")).isEqualTo("s:if requires a condition expression");
        assertThat(error("<p s:if=\"<%= a %>\">A</p>"))
                .isEqualTo("Directive attributes cannot contain dynamic output expressions");
        assertThat(error("<p s:if=\"a\" s:unless=\"b\">A</p>"))
                .startsWith("Only one control flow directive allowed per element.");
        assertThat(error("<s-template class=\"x\" s:if=\"a\">A</s-template>"))
                .isEqualTo("<s-template> cannot have regular HTML attributes. Found: class.");
    }

    @Test
    @Tag("unit")
    void nestedConditionalsCompileInsideOut() throws Exception {
        // Act
        String generated = body("<div s:if=\"a\"><p s:if=\"b\">B</p></div>");

        // Assert
        assertThat(generated).isEqualTo(
                "if (a) {\n"
                        + "out.write(\"<div>\");\n"
                        + "if (b) {\n"
                        + "out.write(\"<p>B</p>\");\n"
                        + "}\n"
                        + "out.write(\"</div>\");\n"
                        + "}\n");
    }
}
