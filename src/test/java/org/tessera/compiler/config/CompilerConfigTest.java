package org.tessera.compiler.config;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CompilerConfigTest {

    @Test
    @Tag("unit")
    void testDirectiveNames() {
        // Arrange
        CompilerConfig config = CompilerConfig.defaults();

        // Act & Assert
        assertThat(config.isDirectiveAttribute("s:if")).isTrue();
        assertThat(config.isDirectiveAttribute("s:")).isFalse();
        assertThat(config.isDirectiveAttribute("class")).isFalse();
        assertThat(config.directiveName("s:foreach")).isEqualTo("foreach");
        assertThat(config.directiveAttribute("else")).isEqualTo("s:else");
    }

    @Test
    @Tag("unit")
    void testPrefixChangeMovesElementPrefixAndFragment() {
        // Act
        CompilerConfig config = CompilerConfig.defaults().withDirectivePrefix("t");

        // Assert
        assertThat(config.elementPrefix()).isEqualTo("t-");
        assertThat(config.fragmentElement()).isEqualTo("t-template");
        assertThat(config.directiveAttributePrefix()).isEqualTo("t:");
    }

    @Test
    @Tag("unit")
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> CompilerConfig.defaults().withDirectivePrefix(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Directive prefix must not be empty");
        assertThatThrownBy(() -> new CompilerConfig("s", "s-", null, "slot", "bind", Set.of(), true, false, 0, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Pipeline limits must be positive");
    }
}
