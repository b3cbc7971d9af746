package lang;

/**
 * Lexical token with its position in the source
 */
public class Token {

    private final TokenKind kind;
    private final String text;
    private final int line;
    /**
     * Offset of the first character
     */
    private final int start;
    /**
     * Offset one past the last character
     */
    private final int end;

    public Token(TokenKind kind, String text, int line, int start, int end) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.start = start;
        this.end = end;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Whether this is a name (or keyword) token with the given text
     *
     * @param s expected text
     * @return true if this is the NAME <code>s</code>
     */
    public boolean isName(String s) {
        return kind == TokenKind.NAME && text.equals(s);
    }

    /**
     * Whether this is an operator token with the given text
     *
     * @param s expected text
     * @return true if this is the OPERATOR <code>s</code>
     */
    public boolean isOperator(String s) {
        return kind == TokenKind.OPERATOR && text.equals(s);
    }

    @Override
    public String toString() {
        return kind + "(" + text.replace("\n", "\\n") + ")@" + line;
    }
}
