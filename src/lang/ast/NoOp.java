package lang.ast;

/**
 * Statement with no data flow: <code>pass</code>, <code>break</code> or <code>continue</code>
 */
public class NoOp extends Node {

    private final String keyword;

    public NoOp(int line, String code, String keyword) {
        super(line, code);
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NO_OP;
    }
}
