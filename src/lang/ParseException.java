package lang;

/**
 * Syntax error in an analyzed source
 */
public class ParseException extends Exception {

    private static final long serialVersionUID = 6514308262384932178L;

    /**
     * Line of the error
     */
    private final int line;

    public ParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "line " + line + ": " + getMessage();
    }
}
