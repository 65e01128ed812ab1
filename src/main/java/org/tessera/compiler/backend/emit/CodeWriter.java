package org.tessera.compiler.backend.emit;

import org.tessera.compiler.util.JavaSource;
import org.tessera.compiler.util.RuntimeSymbols;

/**
 * Accumulates the generated render body.
 * <p>
 * Literal markup is buffered and written as one {@code out.write("...")} call as soon as a
 * non-literal statement follows, so adjacent text, tags and static attributes coalesce.
 */
public final class CodeWriter {

    private final StringBuilder body = new StringBuilder();
    private final StringBuilder pendingLiteral = new StringBuilder();

    /**
     * Appends literal markup.
     * @param text The markup, written verbatim at render time.
     */
    public void literal(String text) {
        pendingLiteral.append(text);
    }

    /**
     * Writes the value of a Java expression of type {@code String}.
     * @param expression The expression.
     */
    public void write(String expression) {
        statement(RuntimeSymbols.OUT + ".write(" + expression + ");");
    }

    /**
     * Appends Java statements.
     * @param code One or more statements, possibly spanning several lines.
     */
    public void statement(String code) {
        flushLiteral();
        body.append(code);
        if (!code.endsWith("\n")) {
            body.append('\n');
        }
    }

    /**
     * Appends a comment line.
     * @param text The comment text.
     */
    public void comment(String text) {
        statement("// " + text.replace('\n', ' ').replace('\r', ' '));
    }

    private void flushLiteral() {
        if (pendingLiteral.length() == 0) {
            return;
        }
        String literal = pendingLiteral.toString();
        pendingLiteral.setLength(0);
        body.append(RuntimeSymbols.OUT).append(".write(").append(JavaSource.stringLiteral(literal)).append(");\n");
    }

    /**
     * @return The generated source, with any buffered literal written out.
     */
    public String finish() {
        flushLiteral();
        return body.toString();
    }
}
