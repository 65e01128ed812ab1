package org.tessera.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LineOffsetCacheTest {

    @Test
    @Tag("unit")
    void tableMapsOffsetsToLinesAndColumns() {
        // Arrange
        LineOffsetTable table = LineOffsetTable.build("ab\ncd\n\nef");

        // Act & Assert
        assertThat(table.lineCount()).isEqualTo(4);
        assertThat(table.lineAt(0)).isEqualTo(1);
        assertThat(table.columnAt(1)).isEqualTo(2);
        assertThat(table.lineAt(3)).isEqualTo(2);
        assertThat(table.columnAt(3)).isEqualTo(1);
        assertThat(table.lineAt(6)).isEqualTo(3);
        assertThat(table.lineAt(8)).isEqualTo(4);
        assertThat(table.columnAt(8)).isEqualTo(2);
        assertThat(table.lineAt(1_000)).isEqualTo(4);
    }

    /**
     * Verifies least-recently-used eviction: a hit refreshes an entry so the other one is evicted.
     */
    @Test
    @Tag("unit")
    void evictsTheLeastRecentlyUsedTable() {
        // Arrange
        LineOffsetCache cache = new LineOffsetCache(2);
        LineOffsetTable a = cache.tableFor("a");
        cache.tableFor("b");

        // Act
        LineOffsetTable again = cache.tableFor("a");
        cache.tableFor("c");

        // Assert
        assertThat(again).isSameAs(a);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.contains("a")).isTrue();
        assertThat(cache.contains("b")).isFalse();
        assertThat(cache.contains("c")).isTrue();
    }

    @Test
    @Tag("unit")
    void capacityMustBePositive() {
        // Act & Assert
        assertThatThrownBy(() -> new LineOffsetCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
