package lang.ast;

/**
 * <code>target op= value</code>
 */
public class AugmentedAssign extends Node {

    private final Node target;
    private final String operator;
    private final Node value;

    public AugmentedAssign(int line, String code, Node target, String operator, Node value) {
        super(line, code);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Node getTarget() {
        return target;
    }

    public String getOperator() {
        return operator;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AUGMENTED_ASSIGN;
    }
}
