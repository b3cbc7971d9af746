package lang.ast;

/**
 * Literal value, kept as written in the source
 */
public class Constant extends Node {

    public Constant(int line, String code) {
        super(line, code);
    }

    public String getValue() {
        return getCode();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTANT;
    }
}
