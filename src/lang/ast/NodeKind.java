package lang.ast;

/**
 * Enumeration of the kinds of syntax tree nodes
 */
public enum NodeKind {
    /**
     * Root of a source file
     *
     * @see Module
     */
    MODULE,
    /**
     * @see FunctionDef
     */
    FUNCTION_DEF,
    /**
     * <code>if</code> statement, <code>elif</code> is an <code>if</code> nested in the else block
     *
     * @see If
     */
    IF,
    /**
     * @see While
     */
    WHILE,
    /**
     * @see For
     */
    FOR,
    /**
     * Possibly chained assignment <code>a = b = v</code>
     *
     * @see Assign
     */
    ASSIGN,
    /**
     * <code>a += v</code> and friends
     *
     * @see AugmentedAssign
     */
    AUGMENTED_ASSIGN,
    /**
     * Expression whose value is not used, e.g. a call for its side effects
     *
     * @see ExpressionStatement
     */
    EXPRESSION_STATEMENT,
    /**
     * @see Return
     */
    RETURN,
    /**
     * <code>pass</code>, <code>break</code> and <code>continue</code>
     *
     * @see NoOp
     */
    NO_OP,
    /**
     * @see Call
     */
    CALL,
    /**
     * Chain of comparisons <code>a &lt; b == c</code>
     *
     * @see Comparison
     */
    COMPARISON,
    /**
     * <code>body if test else orelse</code>
     *
     * @see ConditionalExpression
     */
    CONDITIONAL_EXPRESSION,
    /**
     * Variable read or written
     *
     * @see Name
     */
    NAME,
    /**
     * Tuple or list literal, or a tuple/list target
     *
     * @see Sequence
     */
    SEQUENCE,
    /**
     * Number, string, <code>True</code>, <code>False</code> or <code>None</code>
     *
     * @see Constant
     */
    CONSTANT,
    /**
     * Unary, binary and boolean operators
     *
     * @see Operator
     */
    OPERATOR,
    /**
     * <code>value.attr</code>
     *
     * @see Attribute
     */
    ATTRIBUTE,
    /**
     * <code>value[index]</code>
     *
     * @see Subscript
     */
    SUBSCRIPT;
}
