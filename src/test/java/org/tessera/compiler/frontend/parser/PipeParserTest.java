package org.tessera.compiler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link PipeParser}.
 */
public class PipeParserTest {

    @Test
    @Tag("unit")
    void expressionWithoutPipeIsUnchanged() {
        // Act
        PipeChain chain = PipeParser.parse("a || b");

        // Assert
        assertThat(chain).isEqualTo(new PipeChain("a || b", List.of(), false, false));
    }

    @Test
    @Tag("unit")
    void splitsFiltersAndExtractsMarkers() {
        // Act
        PipeChain chain = PipeParser.parse("post.body() |> markdown() |> raw()");

        // Assert
        assertThat(chain.expression()).isEqualTo("post.body()");
        assertThat(chain.filters()).containsExactly("markdown()");
        assertThat(chain.raw()).isTrue();
        assertThat(chain.json()).isFalse();
    }

    /**
     * Verifies that pipe operators inside string literals and brackets are part of the expression.
     */
    @Test
    @Tag("unit")
    void ignoresPipesInStringsAndBrackets() {
        // Act
        PipeChain chain = PipeParser.parse("format(\"a |> b\", f(x |> y)) |> json( )");

        // Assert
        assertThat(chain.expression()).isEqualTo("format(\"a |> b\", f(x |> y))");
        assertThat(chain.filters()).isEmpty();
        assertThat(chain.json()).isTrue();
    }

    @Test
    @Tag("unit")
    void composeWrapsEachFilterAroundThePreviousResult() {
        // Act & Assert
        assertThat(PipeParser.compose("x", List.of("upper()", "truncate(10)"))).isEqualTo("truncate(upper(x), 10)");
        assertThat(PipeParser.compose("x", List.of("trim"))).isEqualTo("trim(x)");
        assertThat(PipeParser.compose("price", List.of("format(\"%.2f\")"))).isEqualTo("format(price, \"%.2f\")");
        assertThat(PipeParser.compose("name", List.of("pad(..., 3)"))).isEqualTo("pad(name, 3)");
    }
}
