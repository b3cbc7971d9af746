package lang.ast;

/**
 * <code>value.attribute</code>
 */
public class Attribute extends Node {

    private final Node value;
    private final String attribute;
    private final ExprContext context;

    public Attribute(int line, String code, Node value, String attribute, ExprContext context) {
        super(line, code);
        this.value = value;
        this.attribute = attribute;
        this.context = context;
    }

    public Node getValue() {
        return value;
    }

    public String getAttribute() {
        return attribute;
    }

    public ExprContext getContext() {
        return context;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ATTRIBUTE;
    }
}
