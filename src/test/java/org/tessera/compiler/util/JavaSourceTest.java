package org.tessera.compiler.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class JavaSourceTest {

    @Test
    @Tag("unit")
    void testStringLiteralEscapesControlCharacters() {
        assertThat(JavaSource.stringLiteral("a\"b\\c\n\t\u0001")).isEqualTo("\"a\\\"b\\\\c\\n\\t\\u0001\"");
    }

    @Test
    @Tag("unit")
    void testIdentifiers() {
        assertThat(JavaSource.isIdentifier("item")).isTrue();
        assertThat(JavaSource.isIdentifier("class")).isFalse();
        assertThat(JavaSource.isIdentifier("a.b")).isFalse();
        assertThat(JavaSource.isIdentifier("1x")).isFalse();
        assertThat(JavaSource.isIdentifier(null)).isFalse();
    }
}
