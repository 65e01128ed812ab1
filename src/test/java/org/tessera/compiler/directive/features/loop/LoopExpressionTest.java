package org.tessera.compiler.directive.features.loop;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LoopExpressionTest {

    @Test
    @Tag("unit")
    void parsesItemForm() {
        // Act
        LoopExpression loop = LoopExpression.parse("  user.orders() as order ").orElseThrow();

        // Assert
        assertThat(loop.collection()).isEqualTo("user.orders()");
        assertThat(loop.itemVariable()).isEqualTo("order");
        assertThat(loop.hasKey()).isFalse();
        assertThat(loop.metadataVariable()).isEqualTo("orderLoop");
    }

    @Test
    @Tag("unit")
    void parsesKeyValueForm() {
        // Act
        LoopExpression loop = LoopExpression.parse("scores as player => score").orElseThrow();

        // Assert
        assertThat(loop.collection()).isEqualTo("scores");
        assertThat(loop.keyVariable()).isEqualTo("player");
        assertThat(loop.itemVariable()).isEqualTo("score");
        assertThat(loop.hasKey()).isTrue();
    }

    @Test
    @Tag("unit")
    void splitsAtTheFirstAs() {
        // Act
        LoopExpression loop = LoopExpression.parse("lookup(\"x\") as a").orElseThrow();

        // Assert
        assertThat(loop.collection()).isEqualTo("lookup(\"x\")");
        assertThat(loop.itemVariable()).isEqualTo("a");
    }

    @Test
    @Tag("unit")
    void rejectsMissingClauseAndInvalidNames() {
        // Act & Assert
        assertThat(LoopExpression.parse("items")).isEmpty();
        assertThat(LoopExpression.parse("items as")).isEmpty();
        assertThat(LoopExpression.parse("items as 2nd")).isEmpty();
        assertThat(LoopExpression.parse("items as int")).isEmpty();
        assertThat(LoopExpression.parse("map as k.x => v")).isEmpty();
    }
}
