package org.tessera.compiler.util;

import javax.lang.model.SourceVersion;

/**
 * Helpers for producing fragments of Java source text.
 */
public final class JavaSource {

    private JavaSource() {}

    /**
     * Quotes a string as a Java string literal.
     * @param value The raw value.
     * @return The literal including the surrounding double quotes.
     */
    public static String stringLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Checks whether the name can be used as a local variable.
     * @param name The candidate name.
     * @return {@code true} for a legal Java identifier that is not a keyword.
     */
    public static boolean isIdentifier(String name) {
        return name != null && SourceVersion.isName(name) && name.indexOf('.') < 0;
    }
}
