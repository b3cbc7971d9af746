package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * <code>if test: body else: orelse</code>, the else block may be empty. An <code>elif</code> is represented as an {@link If} that is the only statement of the else block.
 */
public class If extends Node {

    private final Node test;
    private final List<Node> body;
    private final List<Node> orelse;

    public If(int line, String code, Node test, List<Node> body, List<Node> orelse) {
        super(line, code);
        this.test = test;
        this.body = Collections.unmodifiableList(body);
        this.orelse = Collections.unmodifiableList(orelse);
    }

    public Node getTest() {
        return test;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Node> getOrelse() {
        return orelse;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF;
    }
}
