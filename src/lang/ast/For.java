package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * <code>for target in iter: body else: orelse</code>
 */
public class For extends Node {

    private final Node target;
    private final Node iter;
    private final List<Node> body;
    private final List<Node> orelse;

    public For(int line, String code, Node target, Node iter, List<Node> body, List<Node> orelse) {
        super(line, code);
        this.target = target;
        this.iter = iter;
        this.body = Collections.unmodifiableList(body);
        this.orelse = Collections.unmodifiableList(orelse);
    }

    /**
     * Loop variable(s), in {@link ExprContext#STORE} context
     *
     * @return loop target
     */
    public Node getTarget() {
        return target;
    }

    /**
     * Expression iterated over
     *
     * @return iterated expression
     */
    public Node getIter() {
        return iter;
    }

    public List<Node> getBody() {
        return body;
    }

    public List<Node> getOrelse() {
        return orelse;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOR;
    }
}
