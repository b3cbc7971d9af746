package lang.ast;

/**
 * <code>body if test else orelse</code>
 */
public class ConditionalExpression extends Node {

    private final Node test;
    private final Node body;
    private final Node orelse;

    public ConditionalExpression(int line, String code, Node test, Node body, Node orelse) {
        super(line, code);
        this.test = test;
        this.body = body;
        this.orelse = orelse;
    }

    public Node getTest() {
        return test;
    }

    public Node getBody() {
        return body;
    }

    public Node getOrelse() {
        return orelse;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONDITIONAL_EXPRESSION;
    }
}
