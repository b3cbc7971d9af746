package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * Root of the syntax tree of one source
 */
public class Module extends Node {

    private final List<Node> body;

    public Module(List<Node> body) {
        super(1, "<module>");
        this.body = Collections.unmodifiableList(body);
    }

    public List<Node> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE;
    }
}
