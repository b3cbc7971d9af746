package lang.ast;

public class Return extends Node {

    /**
     * null for a bare <code>return</code>
     */
    private final Node value;

    public Return(int line, String code, Node value) {
        super(line, code);
        this.value = value;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RETURN;
    }
}
