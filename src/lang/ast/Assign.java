package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * Assignment <code>t1 = t2 = ... = value</code>
 */
public class Assign extends Node {

    private final List<Node> targets;
    private final Node value;

    public Assign(int line, String code, List<Node> targets, Node value) {
        super(line, code);
        assert !targets.isEmpty();
        this.targets = Collections.unmodifiableList(targets);
        this.value = value;
    }

    /**
     * Targets in source order, all in {@link ExprContext#STORE} context
     *
     * @return assignment targets
     */
    public List<Node> getTargets() {
        return targets;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGN;
    }
}
