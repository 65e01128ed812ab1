package org.tessera.compiler.frontend.parser.ast;

/**
 * The syntactic position of a dynamic expression, which decides how its value is escaped.
 */
public enum OutputContext {
    /** Element body text. */
    HTML,
    /** Inside an attribute value. */
    HTML_ATTRIBUTE,
    /** Inside a {@code <script>} element. */
    JAVASCRIPT,
    /** Inside a {@code <style>} element. */
    CSS,
    /** A query component of a URL attribute. */
    URL,
    /** Structured data, selected with {@code json()}. */
    JSON,
    /** No escaping, selected with {@code raw()}. */
    RAW
}
