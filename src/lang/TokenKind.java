package lang;

/**
 * Classification of lexical tokens
 */
public enum TokenKind {
    /**
     * <code># ...</code> up to (not including) the end of the line
     */
    COMMENT,
    /**
     * Identifier or keyword
     */
    NAME,
    NUMBER,
    /**
     * String literal including prefix and quotes
     */
    STRING,
    /**
     * Operator or delimiter
     */
    OPERATOR,
    /**
     * End of a logical line
     */
    NEWLINE,
    /**
     * End of a line that does not end a statement (blank or comment-only line)
     */
    NL,
    INDENT,
    DEDENT,
    /**
     * End of input
     */
    END;
}
