package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * Unary (one operand), binary (two operands) or boolean (two or more operands) operator application
 */
public class Operator extends Node {

    private final String operator;
    private final List<Node> operands;

    public Operator(int line, String code, String operator, List<Node> operands) {
        super(line, code);
        this.operator = operator;
        this.operands = Collections.unmodifiableList(operands);
    }

    public String getOperator() {
        return operator;
    }

    public List<Node> getOperands() {
        return operands;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OPERATOR;
    }
}
