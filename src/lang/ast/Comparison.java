package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * <code>left op1 c1 op2 c2 ...</code>, there is one operator per comparator
 */
public class Comparison extends Node {

    private final Node left;
    private final List<String> operators;
    private final List<Node> comparators;

    public Comparison(int line, String code, Node left, List<String> operators, List<Node> comparators) {
        super(line, code);
        assert operators.size() == comparators.size();
        this.left = left;
        this.operators = Collections.unmodifiableList(operators);
        this.comparators = Collections.unmodifiableList(comparators);
    }

    public Node getLeft() {
        return left;
    }

    public List<String> getOperators() {
        return operators;
    }

    public List<Node> getComparators() {
        return comparators;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPARISON;
    }
}
