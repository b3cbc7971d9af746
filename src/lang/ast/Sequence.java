package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * Tuple <code>(a, b)</code> or list <code>[a, b]</code>, either a literal or a destructuring target
 */
public class Sequence extends Node {

    private final List<Node> elements;
    private final ExprContext context;
    private final boolean list;

    public Sequence(int line, String code, List<Node> elements, ExprContext context, boolean list) {
        super(line, code);
        this.elements = Collections.unmodifiableList(elements);
        this.context = context;
        this.list = list;
    }

    public List<Node> getElements() {
        return elements;
    }

    public ExprContext getContext() {
        return context;
    }

    public boolean isStore() {
        return context == ExprContext.STORE;
    }

    /**
     * @return true for a list, false for a tuple
     */
    public boolean isList() {
        return list;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SEQUENCE;
    }
}
