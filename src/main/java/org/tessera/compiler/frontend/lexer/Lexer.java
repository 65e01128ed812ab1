package org.tessera.compiler.frontend.lexer;

import org.tessera.compiler.config.CompilerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The Lexer converts template source into a flat sequence of tokens ending in {@link TokenType#EOF}.
 * <p>
 * It works as a small state machine over markup text, tags, attribute values and dynamic
 * regions ({@code <%= %>}, {@code <% %>}). Elements marked with the raw directive attribute are
 * located in a pre-scan and their body is emitted as a single {@link TokenType#RAW_BODY} token.
 * <p>
 * The lexer never fails: malformed or unterminated input is flushed as whatever token was in
 * progress, and validity is judged by later stages. A lexer instance may be reused; every call
 * to {@link #scanTokens()} starts from a clean state.
 */
public class Lexer {

    private static final String OUTPUT_OPEN = "<%=";
    private static final String TEMPLATE_COMMENT_OPEN = "<%--";
    private static final String TEMPLATE_COMMENT_CLOSE = "--%>";
    private static final String JAVA_BLOCK_OPEN = "<%java";
    private static final String CODE_OPEN = "<%";
    private static final String CODE_CLOSE = "%>";
    private static final String COMMENT_OPEN = "<!--";
    private static final String COMMENT_CLOSE = "-->";
    private static final String CDATA_OPEN = "<![CDATA[";
    private static final String CDATA_CLOSE = "]]>";
    private static final Pattern QUOTED = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"|'(?:\\\\.|[^'\\\\])*'", Pattern.DOTALL);

    private final String source;
    private final CompilerConfig config;
    private final String rawMarker;
    private final LineOffsetTable offsets;
    private final List<Token> tokens = new ArrayList<>();
    private List<RawRegion> rawRegions = List.of();
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * A pre-scanned raw element.
     *
     * @param openStart Offset of the '&lt;' of the opening tag.
     * @param bodyStart Offset just past the opening tag.
     * @param bodyEnd   Offset of the closing tag, or the end of input.
     * @param selfClosing Whether the element has no body and no closing tag.
     */
    record RawRegion(int openStart, int bodyStart, int bodyEnd, boolean selfClosing) {
    }

    /**
     * Creates a new Lexer.
     * @param source The template source.
     * @param config The compiler configuration (directive prefix, void tags).
     */
    public Lexer(String source, CompilerConfig config) {
        this.source = source;
        this.config = config;
        this.rawMarker = config.directiveAttribute("raw");
        this.offsets = LineOffsetCache.shared().tableFor(source);
    }

    /**
     * Performs the tokenization of the entire template.
     * @return The recognized tokens, ending in {@link TokenType#EOF}.
     */
    public List<Token> scanTokens() {
        tokens.clear();
        current = 0;
        line = 1;
        column = 1;
        rawRegions = scanRawRegions();
        int nextRaw = 0;

        while (!isAtEnd()) {
            if (nextRaw < rawRegions.size() && rawRegions.get(nextRaw).openStart() == current) {
                rawRegion(rawRegions.get(nextRaw++));
            } else if (startsWith(OUTPUT_OPEN)) {
                output();
            } else if (startsWith(TEMPLATE_COMMENT_OPEN)) {
                templateComment();
            } else if (startsWith(JAVA_BLOCK_OPEN) && !isIdentifierChar(charAt(current + JAVA_BLOCK_OPEN.length()))) {
                codeBlock(JAVA_BLOCK_OPEN);
            } else if (startsWith(CODE_OPEN)) {
                codeBlock(CODE_OPEN);
            } else if (startsWith(COMMENT_OPEN)) {
                comment();
            } else if (startsWith("<!") || startsWith("<?")) {
                specialTag();
            } else if (isTagStart(current)) {
                tag();
            } else {
                text();
            }
        }
        tokens.add(new Token(TokenType.EOF, "", line, column));
        return new ArrayList<>(tokens);
    }

    // ---- Regions -----------------------------------------------------------------------------

    private void text() {
        int start = current;
        int startLine = line;
        int startColumn = column;
        advance();
        while (!isAtEnd() && !isBoundary(current)) {
            advance();
        }
        tokens.add(new Token(TokenType.TEXT, source.substring(start, current), startLine, startColumn));
    }

    private void output() {
        addAndAdvance(TokenType.OUTPUT_OPEN, OUTPUT_OPEN);
        int end = source.indexOf(CODE_CLOSE, current);
        dynamicBody(TokenType.EXPRESSION, end < 0 ? source.length() : end);
        if (end >= 0) {
            addAndAdvance(TokenType.OUTPUT_CLOSE, CODE_CLOSE);
        }
    }

    private void codeBlock(String opener) {
        addAndAdvance(TokenType.CODE_BLOCK_OPEN, opener);
        int end = source.indexOf(CODE_CLOSE, current);
        dynamicBody(TokenType.CODE, end < 0 ? source.length() : end);
        if (end >= 0) {
            advanceBy(CODE_CLOSE.length());
        }
    }

    /**
     * Emits the trimmed content between the cursor and {@code end}, positioned at its first
     * non-whitespace character.
     */
    private void dynamicBody(TokenType type, int end) {
        while (current < end && Character.isWhitespace(peek())) {
            advance();
        }
        String content = source.substring(current, end).stripTrailing();
        if (!content.isEmpty()) {
            tokens.add(new Token(type, content, line, column));
        }
        advanceTo(end);
    }

    private void templateComment() {
        int end = source.indexOf(TEMPLATE_COMMENT_CLOSE, current + TEMPLATE_COMMENT_OPEN.length());
        advanceTo(end < 0 ? source.length() : end + TEMPLATE_COMMENT_CLOSE.length());
    }

    private void comment() {
        int end = source.indexOf(COMMENT_CLOSE, current + COMMENT_OPEN.length());
        verbatim(TokenType.COMMENT, end < 0 ? source.length() : end + COMMENT_CLOSE.length());
    }

    private void specialTag() {
        int end;
        if (startsWith(CDATA_OPEN)) {
            end = source.indexOf(CDATA_CLOSE, current);
            end = end < 0 ? source.length() : end + CDATA_CLOSE.length();
        } else if (startsWith("<?")) {
            end = source.indexOf("?>", current + 2);
            end = end < 0 ? source.length() : end + 2;
        } else {
            end = source.indexOf('>', current);
            end = end < 0 ? source.length() : end + 1;
        }
        verbatim(TokenType.SPECIAL_TAG, end);
    }

    private void verbatim(TokenType type, int end) {
        int startLine = line;
        int startColumn = column;
        String text = source.substring(current, end);
        advanceTo(end);
        tokens.add(new Token(type, text, startLine, startColumn));
    }

    // ---- Tags --------------------------------------------------------------------------------

    private void tag() {
        addAndAdvance(TokenType.TAG_OPEN, "<");
        boolean closing = false;
        if (peek() == '/') {
            addAndAdvance(TokenType.SLASH, "/");
            closing = true;
        }
        String name = read(TokenType.TAG_NAME, false);

        if (closing) {
            while (!isAtEnd() && peek() != '>') {
                advance();
            }
            if (!isAtEnd()) {
                addAndAdvance(TokenType.TAG_CLOSE, ">");
            }
            return;
        }

        boolean isVoid = config.isVoidTag(name);
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) {
                return;
            }
            if (startsWith("/>")) {
                addAndAdvance(TokenType.TAG_CLOSE, "/>");
                return;
            }
            if (peek() == '>') {
                tokens.add(new Token(TokenType.TAG_CLOSE, isVoid ? "/>" : ">", line, column));
                advance();
                return;
            }
            if (startsWith(OUTPUT_OPEN)) {
                output();
            } else if (isAttributeNameChar(peek())) {
                attribute();
            } else {
                advance();
            }
        }
    }

    private void attribute() {
        read(TokenType.ATTRIBUTE_NAME, true);
        int mark = current;
        int markLine = line;
        int markColumn = column;
        skipWhitespace();
        if (peek() != '=') {
            current = mark;
            line = markLine;
            column = markColumn;
            return;
        }
        addAndAdvance(TokenType.EQUALS, "=");
        skipWhitespace();
        char c = peek();
        if (c == '"' || c == '\'') {
            quotedValue(c);
        } else if (startsWith(OUTPUT_OPEN)) {
            output();
        } else {
            unquotedValue();
        }
    }

    private void quotedValue(char quote) {
        addAndAdvance(TokenType.QUOTE_OPEN, String.valueOf(quote));
        int start = current;
        int startLine = line;
        int startColumn = column;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\\' && charAt(current + 1) == quote) {
                advanceBy(2);
            } else if (c == quote) {
                flushAttributeText(start, startLine, startColumn);
                addAndAdvance(TokenType.QUOTE_CLOSE, String.valueOf(quote));
                return;
            } else if (startsWith(OUTPUT_OPEN)) {
                flushAttributeText(start, startLine, startColumn);
                output();
                start = current;
                startLine = line;
                startColumn = column;
            } else {
                advance();
            }
        }
        flushAttributeText(start, startLine, startColumn);
    }

    private void flushAttributeText(int start, int startLine, int startColumn) {
        if (current > start) {
            tokens.add(new Token(TokenType.ATTRIBUTE_TEXT, source.substring(start, current), startLine, startColumn));
        }
    }

    private void unquotedValue() {
        int start = current;
        int startLine = line;
        int startColumn = column;
        while (!isAtEnd() && !Character.isWhitespace(peek()) && peek() != '>' && !startsWith("/>")) {
            advance();
        }
        if (current > start) {
            tokens.add(new Token(TokenType.ATTRIBUTE_VALUE_UNQUOTED, source.substring(start, current), startLine, startColumn));
        }
    }

    private String read(TokenType type, boolean attributeName) {
        int start = current;
        int startLine = line;
        int startColumn = column;
        while (!isAtEnd() && (attributeName ? isAttributeNameChar(peek()) : isTagNameChar(peek()))) {
            advance();
        }
        String text = source.substring(start, current);
        if (!text.isEmpty()) {
            tokens.add(new Token(type, text, startLine, startColumn));
        }
        return text;
    }

    // ---- Raw regions -------------------------------------------------------------------------

    private void rawRegion(RawRegion region) {
        int mark = tokens.size();
        tag();
        removeRawAttribute(mark);
        if (region.selfClosing()) {
            return;
        }
        if (region.bodyEnd() > region.bodyStart()) {
            tokens.add(new Token(TokenType.RAW_BODY, source.substring(region.bodyStart(), region.bodyEnd()),
                    offsets.lineAt(region.bodyStart()), offsets.columnAt(region.bodyStart())));
        }
        jumpTo(region.bodyEnd());
        if (!isAtEnd()) {
            tag();
        }
    }

    private void removeRawAttribute(int from) {
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.ATTRIBUTE_NAME || !token.text().equals(rawMarker)) {
                continue;
            }
            int end = i + 1;
            if (end < tokens.size() && tokens.get(end).type() == TokenType.EQUALS) {
                end++;
                TokenType valueType = end < tokens.size() ? tokens.get(end).type() : TokenType.EOF;
                if (valueType == TokenType.ATTRIBUTE_VALUE_UNQUOTED) {
                    end++;
                } else if (valueType == TokenType.QUOTE_OPEN || valueType == TokenType.OUTPUT_OPEN) {
                    TokenType closer = valueType == TokenType.QUOTE_OPEN ? TokenType.QUOTE_CLOSE : TokenType.OUTPUT_CLOSE;
                    while (end < tokens.size() && tokens.get(end).type() != closer) {
                        end++;
                    }
                    end = Math.min(end + 1, tokens.size());
                }
            }
            tokens.subList(i, end).clear();
            return;
        }
    }

    /**
     * Finds all elements carrying the raw attribute. Dynamic regions and comments are skipped,
     * quoted content is ignored when looking for the end of a tag, and nested tags with the same
     * name are counted to find the matching closing tag.
     */
    private List<RawRegion> scanRawRegions() {
        if (!source.contains(rawMarker)) {
            return List.of();
        }
        Pattern markerPattern = Pattern.compile("\\s" + Pattern.quote(rawMarker) + "(?=[\\s=/>]|$)");
        List<RawRegion> regions = new ArrayList<>();
        int pos = 0;
        while (true) {
            int lt = source.indexOf('<', pos);
            if (lt < 0) {
                break;
            }
            if (source.startsWith(CODE_OPEN, lt)) {
                pos = skipPast(CODE_CLOSE, lt + CODE_OPEN.length());
                continue;
            }
            if (source.startsWith(COMMENT_OPEN, lt)) {
                pos = skipPast(COMMENT_CLOSE, lt + COMMENT_OPEN.length());
                continue;
            }
            if (!isLetter(charAt(lt + 1))) {
                pos = lt + 1;
                continue;
            }
            int tagEnd = findTagEnd(lt);
            if (tagEnd < 0) {
                break;
            }
            String tagSource = source.substring(lt, tagEnd + 1);
            String stripped = QUOTED.matcher(tagSource).replaceAll("\"\"");
            if (!markerPattern.matcher(stripped).find()) {
                pos = tagEnd + 1;
                continue;
            }
            String name = tagName(lt + 1);
            boolean selfClosing = source.charAt(tagEnd - 1) == '/' || config.isVoidTag(name);
            int bodyEnd = selfClosing ? tagEnd + 1 : findMatchingCloseTag(name, tagEnd + 1);
            regions.add(new RawRegion(lt, tagEnd + 1, bodyEnd, selfClosing));
            pos = bodyEnd;
        }
        return regions;
    }

    private int findTagEnd(int from) {
        char quote = 0;
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i;
            }
        }
        return -1;
    }

    private int findMatchingCloseTag(String name, int from) {
        int depth = 1;
        int pos = from;
        while (true) {
            int lt = source.indexOf('<', pos);
            if (lt < 0) {
                return source.length();
            }
            if (charAt(lt + 1) == '/' && matchesTagName(name, lt + 2)) {
                depth--;
                if (depth == 0) {
                    return lt;
                }
                pos = lt + 2;
            } else if (matchesTagName(name, lt + 1)) {
                int tagEnd = findTagEnd(lt);
                if (tagEnd < 0) {
                    return source.length();
                }
                if (source.charAt(tagEnd - 1) != '/') {
                    depth++;
                }
                pos = tagEnd + 1;
            } else {
                pos = lt + 1;
            }
        }
    }

    private boolean matchesTagName(String name, int at) {
        return source.regionMatches(true, at, name, 0, name.length())
                && !isTagNameChar(charAt(at + name.length()));
    }

    private String tagName(int at) {
        int end = at;
        while (end < source.length() && isTagNameChar(source.charAt(end))) {
            end++;
        }
        return source.substring(at, end).toLowerCase(Locale.ROOT);
    }

    private int skipPast(String terminator, int from) {
        int end = source.indexOf(terminator, from);
        return end < 0 ? source.length() : end + terminator.length();
    }

    // ---- Cursor ------------------------------------------------------------------------------

    private boolean isBoundary(int pos) {
        if (source.charAt(pos) != '<') {
            return false;
        }
        char next = charAt(pos + 1);
        return next == '%' || next == '!' || next == '?' || isTagStart(pos);
    }

    private boolean isTagStart(int pos) {
        if (source.charAt(pos) != '<') {
            return false;
        }
        char next = charAt(pos + 1);
        return isLetter(next) || (next == '/' && isLetter(charAt(pos + 2)));
    }

    private void addAndAdvance(TokenType type, String text) {
        tokens.add(new Token(type, text, line, column));
        advanceBy(text.length());
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private void advance() {
        if (source.charAt(current) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        current++;
    }

    private void advanceBy(int count) {
        advanceTo(Math.min(source.length(), current + count));
    }

    private void advanceTo(int target) {
        while (current < target) {
            advance();
        }
    }

    private void jumpTo(int target) {
        current = target;
        line = offsets.lineAt(target);
        column = offsets.columnAt(target);
    }

    private boolean startsWith(String prefix) {
        return source.startsWith(prefix, current);
    }

    private char peek() {
        return charAt(current);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierChar(char c) {
        return c != '\0' && Character.isJavaIdentifierPart(c);
    }

    private static boolean isTagNameChar(char c) {
        return isLetter(c) || (c >= '0' && c <= '9') || c == '-' || c == '_' || c == ':' || c == '.';
    }

    private static boolean isAttributeNameChar(char c) {
        return isTagNameChar(c) || c == '@';
    }
}
