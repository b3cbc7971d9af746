package lang.ast;

/**
 * Expression evaluated for its side effects, its value is discarded
 */
public class ExpressionStatement extends Node {

    private final Node value;

    public ExpressionStatement(int line, String code, Node value) {
        super(line, code);
        this.value = value;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }
}
