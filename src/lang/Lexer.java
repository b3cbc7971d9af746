package lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;

/**
 * Turns source text into a list of {@link Token}s. Indentation is reported through INDENT and DEDENT tokens, line ends
 * inside brackets and after a backslash are ignored. Comments are kept as COMMENT tokens so that annotations can be
 * read from them.
 */
public class Lexer {

    /**
     * Three character operators, checked before shorter ones
     */
    private static final Set<String> OPERATORS_3 = new HashSet<>(Arrays.asList("**=", "//=", ">>=", "<<=", "..."));
    private static final Set<String> OPERATORS_2 = new HashSet<>(Arrays.asList("==", "!=", "<=", ">=", "**", "//",
            "->", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", "<<", ">>", ":="));
    private static final String OPERATORS_1 = "()[]{}:,;.+-*/%<>=&|^~@";
    /**
     * Letters that may prefix a string literal
     */
    private static final String STRING_PREFIX_CHARS = "rRbBuUfF";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    /**
     * Column of each open indentation level, the bottom is always 0
     */
    private final Stack<Integer> indents = new Stack<>();
    private int pos;
    private int line = 1;
    /**
     * Number of open brackets
     */
    private int depth;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the whole source
     *
     * @return tokens, the last one is always {@link TokenKind#END}
     * @throws ParseException if the source cannot be tokenized
     */
    public List<Token> tokenize() throws ParseException {
        tokens.clear();
        indents.clear();
        indents.push(0);
        pos = 0;
        line = 1;
        depth = 0;

        boolean lineStart = true;
        while (pos < source.length()) {
            if (lineStart && depth == 0) {
                if (!indentation()) {
                    // blank or comment-only line
                    continue;
                }
                lineStart = false;
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            }
            else if (c == '#') {
                comment();
            }
            else if (c == '\\' && isNewline(pos + 1)) {
                pos++;
                skipNewline();
            }
            else if (isNewline(pos)) {
                if (depth > 0) {
                    skipNewline();
                }
                else {
                    int start = pos;
                    int l = line;
                    skipNewline();
                    add(TokenKind.NEWLINE, "\n", l, start, pos);
                    lineStart = true;
                }
            }
            else if (isStringStart(pos)) {
                string();
            }
            else if (Character.isLetter(c) || c == '_') {
                name();
            }
            else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                    && Character.isDigit(source.charAt(pos + 1)))) {
                number();
            }
            else {
                operator();
            }
        }

        if (depth > 0) {
            throw new ParseException("unexpected end of input inside brackets", line);
        }
        if (!lineStart) {
            add(TokenKind.NEWLINE, "", line, pos, pos);
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenKind.DEDENT, "", line, pos, pos);
        }
        add(TokenKind.END, "", line, pos, pos);
        return tokens;
    }

    /**
     * Measure the indentation of the line starting at the current position and emit INDENT/DEDENT tokens. Blank and
     * comment-only lines are consumed completely and do not change the indentation.
     *
     * @return true if the line contains code, false if it was consumed
     * @throws ParseException inconsistent dedent
     */
    private boolean indentation() throws ParseException {
        int col = 0;
        int p = pos;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == ' ') {
                col++;
            }
            else if (c == '\t') {
                col = (col / 8 + 1) * 8;
            }
            else if (c == '\f') {
                col = 0;
            }
            else {
                break;
            }
            p++;
        }
        pos = p;
        if (p >= source.length()) {
            return false;
        }
        char c = source.charAt(p);
        if (c == '#' || isNewline(p)) {
            if (c == '#') {
                comment();
            }
            if (pos < source.length()) {
                int start = pos;
                int l = line;
                skipNewline();
                add(TokenKind.NL, "\n", l, start, pos);
            }
            return false;
        }

        if (col > indents.peek()) {
            indents.push(col);
            add(TokenKind.INDENT, "", line, pos, pos);
        }
        else {
            while (col < indents.peek()) {
                indents.pop();
                add(TokenKind.DEDENT, "", line, pos, pos);
            }
            if (col != indents.peek()) {
                throw new ParseException("unindent does not match any outer indentation level", line);
            }
        }
        return true;
    }

    private void comment() {
        int start = pos;
        while (pos < source.length() && !isNewline(pos)) {
            pos++;
        }
        add(TokenKind.COMMENT, source.substring(start, pos), line, start, pos);
    }

    private void name() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        add(TokenKind.NAME, source.substring(start, pos), line, start, pos);
    }

    private void number() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            }
            else if ((c == '+' || c == '-') && isExponent(start, pos - 1)) {
                pos++;
            }
            else {
                break;
            }
        }
        add(TokenKind.NUMBER, source.substring(start, pos), line, start, pos);
    }

    /**
     * Whether the character at <code>p</code> is the exponent marker of a decimal number starting at
     * <code>start</code>
     */
    private boolean isExponent(int start, int p) {
        char c = source.charAt(p);
        if (c != 'e' && c != 'E') {
            return false;
        }
        String soFar = source.substring(start, p).toLowerCase();
        return !soFar.startsWith("0x");
    }

    /**
     * Whether a string literal (possibly with a prefix) starts at <code>p</code>
     */
    private boolean isStringStart(int p) {
        int q = p;
        while (q < source.length() && q - p < 2 && STRING_PREFIX_CHARS.indexOf(source.charAt(q)) >= 0) {
            q++;
        }
        if (q >= source.length()) {
            return false;
        }
        char c = source.charAt(q);
        if (c != '"' && c != '\'') {
            return false;
        }
        // a prefix must not be the tail of a longer identifier
        return q == p || p == 0 || !(Character.isLetterOrDigit(source.charAt(p - 1)) || source.charAt(p - 1) == '_');
    }

    private void string() throws ParseException {
        int start = pos;
        int startLine = line;
        while (STRING_PREFIX_CHARS.indexOf(source.charAt(pos)) >= 0) {
            pos++;
        }
        char quote = source.charAt(pos);
        boolean triple = source.startsWith("" + quote + quote + quote, pos);
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= source.length()) {
                throw new ParseException("unterminated string literal", startLine);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < source.length() && isNewline(pos)) {
                    skipNewline();
                }
                else {
                    pos++;
                }
            }
            else if (isNewline(pos)) {
                if (!triple) {
                    throw new ParseException("unterminated string literal", startLine);
                }
                skipNewline();
            }
            else if (c == quote && (!triple || source.startsWith("" + quote + quote + quote, pos))) {
                pos += triple ? 3 : 1;
                break;
            }
            else {
                pos++;
            }
        }
        add(TokenKind.STRING, source.substring(start, pos), startLine, start, pos);
    }

    private void operator() throws ParseException {
        int start = pos;
        String op;
        if (pos + 3 <= source.length() && OPERATORS_3.contains(source.substring(pos, pos + 3))) {
            op = source.substring(pos, pos + 3);
        }
        else if (pos + 2 <= source.length() && OPERATORS_2.contains(source.substring(pos, pos + 2))) {
            op = source.substring(pos, pos + 2);
        }
        else if (OPERATORS_1.indexOf(source.charAt(pos)) >= 0) {
            op = source.substring(pos, pos + 1);
        }
        else {
            throw new ParseException("unexpected character '" + source.charAt(pos) + "'", line);
        }
        pos += op.length();
        if (op.equals("(") || op.equals("[") || op.equals("{")) {
            depth++;
        }
        else if (op.equals(")") || op.equals("]") || op.equals("}")) {
            if (depth == 0) {
                throw new ParseException("unmatched '" + op + "'", line);
            }
            depth--;
        }
        add(TokenKind.OPERATOR, op, line, start, pos);
    }

    private boolean isNewline(int p) {
        if (p >= source.length()) {
            return false;
        }
        char c = source.charAt(p);
        return c == '\n' || c == '\r';
    }

    /**
     * Consume one line terminator (\n, \r or \r\n) at the current position
     */
    private void skipNewline() {
        if (source.charAt(pos) == '\r' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
    }

    private void add(TokenKind kind, String text, int l, int start, int end) {
        tokens.add(new Token(kind, text, l, start, end));
    }
}
