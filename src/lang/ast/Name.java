package lang.ast;

/**
 * Reference to a variable
 */
public class Name extends Node {

    private final String id;
    private final ExprContext context;

    public Name(int line, String code, String id, ExprContext context) {
        super(line, code);
        this.id = id;
        this.context = context;
    }

    public String getId() {
        return id;
    }

    public ExprContext getContext() {
        return context;
    }

    /**
     * Whether this name is being written
     *
     * @return true if the context is {@link ExprContext#STORE}
     */
    public boolean isStore() {
        return context == ExprContext.STORE;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAME;
    }
}
