package lang.ast;

/**
 * <code>value[index]</code>
 */
public class Subscript extends Node {

    private final Node value;
    private final Node index;
    private final ExprContext context;

    public Subscript(int line, String code, Node value, Node index, ExprContext context) {
        super(line, code);
        this.value = value;
        this.index = index;
        this.context = context;
    }

    public Node getValue() {
        return value;
    }

    public Node getIndex() {
        return index;
    }

    public ExprContext getContext() {
        return context;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUBSCRIPT;
    }
}
