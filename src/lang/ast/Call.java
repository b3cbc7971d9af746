package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * Call <code>func(args)</code>. Keyword and starred arguments are represented by their value expression.
 */
public class Call extends Node {

    private final Node func;
    private final List<Node> args;

    public Call(int line, String code, Node func, List<Node> args) {
        super(line, code);
        this.func = func;
        this.args = Collections.unmodifiableList(args);
    }

    /**
     * Expression for the called function, usually a {@link Name}
     *
     * @return callee
     */
    public Node getFunc() {
        return func;
    }

    public List<Node> getArgs() {
        return args;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }
}
