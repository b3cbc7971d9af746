package lang.ast;

/**
 * Node of the abstract syntax tree of an analyzed source. Every node knows the line it starts on and the source text
 * it was parsed from.
 */
public abstract class Node {

    /**
     * Line the node starts on (first line is 1)
     */
    private final int line;
    /**
     * Source text of the node
     */
    private final String code;

    protected Node(int line, String code) {
        this.line = line;
        this.code = code;
    }

    /**
     * Kind of this node, used to dispatch on the node type
     *
     * @return the kind of node
     */
    public abstract NodeKind getKind();

    public int getLine() {
        return line;
    }

    /**
     * Source text of this node, for compound statements only the header line
     *
     * @return source code for the node
     */
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getKind() + "@" + line + ": " + code;
    }
}
