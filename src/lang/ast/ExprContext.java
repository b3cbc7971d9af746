package lang.ast;

/**
 * Whether an expression is read or written
 */
public enum ExprContext {
    LOAD, STORE;
}
