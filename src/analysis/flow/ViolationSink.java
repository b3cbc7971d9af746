package analysis.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.flow.violation.FlowViolation;
import analysis.flow.violation.UnsupportedConstruct;

/**
 * Append-only log of the violations and unsupported constructs found while analyzing one source. A single sink is
 * shared by every copy of a {@link SecurityState}, so whatever is found deep inside nested blocks is visible to the
 * caller that created the root state. Sinks are never copied.
 */
public class ViolationSink {

    private final List<FlowViolation> violations = new ArrayList<>();
    private final List<UnsupportedConstruct> unsupported = new ArrayList<>();

    public void record(FlowViolation violation) {
        violations.add(violation);
    }

    public void note(UnsupportedConstruct construct) {
        unsupported.add(construct);
    }

    /**
     * Violations in the order they were recorded
     *
     * @return unmodifiable list of violations
     */
    public List<FlowViolation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    /**
     * Unsupported constructs in the order they were encountered
     *
     * @return unmodifiable list of unsupported constructs
     */
    public List<UnsupportedConstruct> getUnsupported() {
        return Collections.unmodifiableList(unsupported);
    }

    public boolean isEmpty() {
        return violations.isEmpty();
    }
}
