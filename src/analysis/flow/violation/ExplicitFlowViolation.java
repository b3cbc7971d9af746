package analysis.flow.violation;

import java.util.Set;

import lang.ast.Node;
import analysis.flow.SecurityState;
import analysis.flow.label.Label;

/**
 * A write of a value computed from data the target may not hold: the labels of the target are not a superset of the
 * labels of the variables used to compute the value.
 */
public class ExplicitFlowViolation extends FlowViolation {

    private final String info;

    public ExplicitFlowViolation(Node node, SecurityState state, FlowVariable target, Set<Label> missing, String info) {
        super(node, state, target, missing);
        this.info = info;
    }

    @Override
    public Kind getKind() {
        return Kind.EXPLICIT;
    }

    @Override
    public String getInfo() {
        return info;
    }
}
