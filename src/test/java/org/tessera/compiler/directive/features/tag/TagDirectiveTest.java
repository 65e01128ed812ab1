package org.tessera.compiler.directive.features.tag;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tessera.testutils.Templates.body;
import static org.tessera.testutils.Templates.error;

public class TagDirectiveTest {

    @Test
    @Tag("unit")
    void dynamicTagIsValidatedOnceAndWrittenTwice() throws Exception {
        // Act
        String generated = body("<div s:tag=\"level\">x</div>");

        // Assert
        assertThat(generated).isEqualTo(
                "String __tag1 = org.tessera.runtime.HtmlTags.validate(level);\n"
                        + "out.write(\"<\");\n"
                        + "out.write(__tag1);\n"
                        + "out.write(\">x</\");\n"
                        + "out.write(__tag1);\n"
                        + "out.write(\">\");\n");
    }

    @Test
    @Tag("unit")
    void declarationStaysInsideTheControlFlow() throws Exception {
        // Act
        String generated = body("<div s:if=\"a\" s:tag=\"level\">x</div>");

        // Assert
        assertThat(generated).startsWith("if (a) {\nString __tag1 = org.tessera.runtime.HtmlTags.validate(level);\n")
                .endsWith("}\n");
    }

    /**
     * An element whose tag is only known at render time is treated as ordinary markup, even if
     * its static tag is script.
     */
    @Test
    @Tag("unit")
    void outputsInsideADynamicTagUseTheHtmlEscaper() throws Exception {
        // Act
        String generated = body("<script s:tag=\"kind\"><%= value %></script>");

        // Assert
        assertThat(generated).contains("org.tessera.runtime.Escaper.html(value)");
    }

    @Test
    @Tag("unit")
    void tagNeedsAnExpressionAndAnElement() {
        // Act & Assert
        assertThat(error("<div s:tag=\"\">x</div>")).isEqualTo("s:tag requires a tag name expression");
        assertThat(error("<s-template s:tag=\"t\">x</s-template>"))
                .isEqualTo("<s-template> cannot have attribute directives like s:tag. "
                        + "Only control flow and content directives are allowed.");
    }
}
