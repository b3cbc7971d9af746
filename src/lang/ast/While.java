package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * <code>while test: body else: orelse</code>, the else block may be empty.
 */
public class While extends Node {

    private final Node test;
    private final List<Node> body;
    private final List<Node> orelse;

    public While(int line, String code, Node test, List<Node> body, List<Node> orelse) {
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
        return NodeKind.WHILE;
    }
}
