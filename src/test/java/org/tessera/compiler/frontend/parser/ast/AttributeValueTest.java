package org.tessera.compiler.frontend.parser.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the normalization of {@link AttributeValue}.
 */
public class AttributeValueTest {

    private static OutputNode output(String expression) {
        return new OutputNode(expression, true, OutputContext.HTML, List.of(), 1, 1);
    }

    @Test
    @Tag("unit")
    void singleLiteralCollapsesToStatic() {
        // Act
        AttributeValue value = AttributeValue.of(List.of(
                new AttributePart.Literal("btn"), new AttributePart.Literal(""), new AttributePart.Literal(" primary")));

        // Assert
        assertThat(value).isEqualTo(new AttributeValue.Static("btn primary"));
    }

    @Test
    @Tag("unit")
    void singleExpressionCollapsesToOutput() {
        // Arrange
        OutputNode name = output("name");

        // Act
        AttributeValue value = AttributeValue.of(List.of(new AttributePart.Literal(""), new AttributePart.Dynamic(name)));

        // Assert
        assertThat(value.isOutput()).isTrue();
        assertThat(((AttributeValue.Output) value).output()).isSameAs(name);
    }

    @Test
    @Tag("unit")
    void noPartsIsAnEmptyStatic() {
        assertThat(AttributeValue.of(List.of())).isEqualTo(new AttributeValue.Static(""));
    }

    @Test
    @Tag("unit")
    void appendKeepsTheSimplestShape() {
        // Arrange
        OutputNode id = output("id");

        // Act
        AttributeValue literal = AttributeValue.ofStatic("item-").append(new AttributePart.Literal("row"));
        AttributeValue mixed = literal.append(new AttributePart.Dynamic(id)).append(new AttributePart.Literal("-"))
                .append(new AttributePart.Literal("x"));

        // Assert
        assertThat(literal).isEqualTo(new AttributeValue.Static("item-row"));
        assertThat(mixed.isParts()).isTrue();
        assertThat(mixed.toParts()).containsExactly(
                new AttributePart.Literal("item-row"), new AttributePart.Dynamic(id), new AttributePart.Literal("-x"));
    }

    @Test
    @Tag("unit")
    void withPartsShrinksBackToASingleShape() {
        // Arrange
        OutputNode id = output("id");
        AttributeValue mixed = AttributeValue.of(List.of(new AttributePart.Literal("a"), new AttributePart.Dynamic(id)));

        // Act
        AttributeValue dynamicOnly = mixed.withParts(List.of(new AttributePart.Dynamic(id)));
        AttributeValue literalOnly = mixed.withParts(List.of(new AttributePart.Literal("a"), new AttributePart.Literal("b")));

        // Assert
        assertThat(mixed.isParts()).isTrue();
        assertThat(dynamicOnly).isEqualTo(new AttributeValue.Output(id));
        assertThat(literalOnly).isEqualTo(new AttributeValue.Static("ab"));
    }

    @Test
    @Tag("unit")
    void appendingToABooleanStartsFromNothing() {
        assertThat(AttributeValue.BOOLEAN.append(new AttributePart.Literal("on"))).isEqualTo(new AttributeValue.Static("on"));
    }

    @Test
    @Tag("unit")
    void partsRejectsValuesThatAreNotNormalized() {
        OutputNode id = output("id");

        assertThatThrownBy(() -> new AttributeValue.Parts(List.of(new AttributePart.Dynamic(id))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least two parts");
        assertThatThrownBy(() -> new AttributeValue.Parts(List.of(
                new AttributePart.Literal("a"), new AttributePart.Literal("b"), new AttributePart.Dynamic(id))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Adjacent literal parts");
    }
}
