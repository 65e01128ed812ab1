package org.tessera.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Markup.
    /** Literal text between tags. */
    TEXT,
    /** The '<' starting an opening or closing tag. */
    TAG_OPEN,
    /** The name of an element, fragment or component. */
    TAG_NAME,
    /** The name of an attribute. */
    ATTRIBUTE_NAME,
    /** The '=' between an attribute name and its value. */
    EQUALS,
    /** The opening quote of an attribute value. */
    QUOTE_OPEN,
    /** The closing quote of an attribute value. */
    QUOTE_CLOSE,
    /** Literal text inside a quoted attribute value. */
    ATTRIBUTE_TEXT,
    /** An attribute value without quotes. */
    ATTRIBUTE_VALUE_UNQUOTED,
    /** The '/' of a closing tag. */
    SLASH,
    /** The '>' or '/>' ending a tag. Void elements always get '/>'. */
    TAG_CLOSE,

    // Dynamic regions.
    /** The '&lt;%=' starting an escaped output. */
    OUTPUT_OPEN,
    /** The '%&gt;' ending an output. */
    OUTPUT_CLOSE,
    /** The trimmed expression of an output. */
    EXPRESSION,
    /** The opening of a code block ('&lt;%java' or '&lt;%'). */
    CODE_BLOCK_OPEN,
    /** The trimmed statements of a code block. */
    CODE,

    // Verbatim regions.
    /** The unparsed body of a raw element. */
    RAW_BODY,
    /** An HTML comment, including its delimiters. */
    COMMENT,
    /** A doctype, CDATA section or processing instruction. */
    SPECIAL_TAG,

    // Miscellaneous.
    /** Represents the end of the template source. */
    EOF
}
