package analysis.flow.violation;

import java.util.Set;

import lang.ast.Node;
import analysis.flow.SecurityState;
import analysis.flow.label.Label;

/**
 * A write under a control dependency on data the target may not be influenced by: the labels of the target are not a
 * superset of the program counter.
 */
public class ImplicitFlowViolation extends FlowViolation {

    private final String info;

    public ImplicitFlowViolation(Node node, SecurityState state, FlowVariable target, Set<Label> missing, String info) {
        super(node, state, target, missing);
        this.info = info;
    }

    @Override
    public Kind getKind() {
        return Kind.IMPLICIT;
    }

    @Override
    public String getInfo() {
        return info;
    }
}
