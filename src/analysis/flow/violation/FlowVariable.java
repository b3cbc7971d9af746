package analysis.flow.violation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

import analysis.flow.label.Label;

/**
 * A variable name with its labels. A null label set means the variable is untracked (e.g. a called function), which is
 * different from a variable whose label set is empty.
 */
public class FlowVariable {

    private final String name;
    private final Set<Label> labels;

    /**
     * @param name variable name
     * @param labels labels of the variable, null if untracked
     */
    public FlowVariable(String name, Set<Label> labels) {
        this.name = name;
        this.labels = labels == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    }

    /**
     * Descriptor for a variable whose labels are not tracked
     *
     * @param name variable name
     * @return descriptor with a null label set
     */
    public static FlowVariable untracked(String name) {
        return new FlowVariable(name, null);
    }

    public String getName() {
        return name;
    }

    /**
     * Labels of the variable
     *
     * @return labels, null if the variable is untracked
     */
    public Set<Label> getLabels() {
        return labels;
    }

    public boolean isUntracked() {
        return labels == null;
    }

    @Override
    public String toString() {
        String labs;
        if (labels == null) {
            labs = "untracked";
        }
        else if (labels.isEmpty()) {
            labs = "()";
        }
        else {
            labs = new TreeSet<>(labels).toString();
        }
        return name + " : " + labs;
    }
}
