package analysis.flow;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import analysis.flow.label.Label;
import analysis.flow.label.RuleTable;
import analysis.flow.violation.FlowViolation;
import analysis.flow.violation.UnsupportedConstruct;

/**
 * Flow-sensitive context of the analysis: the label rules in scope, the program counter (labels of the data the
 * current control path depends on), the names read since the state was created and the sink violations are reported
 * to.
 * <p>
 * Copies made with {@link #copy()} have their own rules and program counter, but all copies of a state share its
 * {@link ViolationSink}.
 */
public class SecurityState {

    /**
     * Label declarations visible in this state
     */
    private final RuleTable rules;
    /**
     * Program counter, only ever grows
     */
    private final Set<Label> pc;
    /**
     * Names read since this state was created
     */
    private final Set<String> used;
    /**
     * Shared by all copies
     */
    private final ViolationSink sink;

    /**
     * Create a state with no rules, an empty program counter and a new sink
     */
    public SecurityState() {
        this(new ViolationSink());
    }

    /**
     * Create a state with no rules and an empty program counter reporting to the given sink
     *
     * @param sink where violations are recorded
     */
    public SecurityState(ViolationSink sink) {
        this(new RuleTable(), new LinkedHashSet<Label>(), new LinkedHashSet<String>(), sink);
    }

    private SecurityState(RuleTable rules, Set<Label> pc, Set<String> used, ViolationSink sink) {
        this.rules = rules;
        this.pc = pc;
        this.used = used;
        this.sink = sink;
    }

    /**
     * Add the rules declared by an annotation
     *
     * @param annotation annotation text with the marker removed
     * @return number of well formed clauses
     * @see RuleTable#declare(String)
     */
    public int declare(String annotation) {
        return rules.declare(annotation);
    }

    /**
     * Copy for a nested node: independent rules and program counter, no used names, same sink
     *
     * @return new state
     */
    public SecurityState copy() {
        return new SecurityState(rules.copy(), new LinkedHashSet<>(pc), new LinkedHashSet<String>(), sink);
    }

    /**
     * Copy that also keeps the used names, the sink is still shared
     *
     * @return new state
     */
    public SecurityState snapshot() {
        return new SecurityState(rules.copy(), new LinkedHashSet<>(pc), new LinkedHashSet<>(used), sink);
    }

    /**
     * Fold the program counter and rules of an enclosing scope into this state
     *
     * @param other state to merge into this one
     */
    public void merge(SecurityState other) {
        pc.addAll(other.pc);
        rules.merge(other.rules);
    }

    /**
     * Record that a variable was read
     *
     * @param name variable name
     */
    public void markUsed(String name) {
        used.add(name);
    }

    /**
     * Record that every name read in <code>other</code> was also read in this state
     *
     * @param other state whose used names are added
     */
    public void markUsed(SecurityState other) {
        used.addAll(other.used);
    }

    /**
     * Names read since this state was created
     *
     * @return unmodifiable set of names
     */
    public Set<String> getUsedNames() {
        return Collections.unmodifiableSet(used);
    }

    /**
     * Labels of the data the value being computed depends on: the union of the labels of every used name
     *
     * @return labels of the used names
     */
    public Set<Label> getUsedLabels() {
        Set<Label> labels = new LinkedHashSet<>();
        for (String name : used) {
            labels.addAll(rules.labelsOf(name));
        }
        return labels;
    }

    /**
     * The labels of each used name
     *
     * @return map from used name to its labels, in the order the names were used
     */
    public Map<String, Set<Label>> getUsedLabelsByName() {
        Map<String, Set<Label>> map = new LinkedHashMap<>();
        for (String name : used) {
            map.put(name, rules.labelsOf(name));
        }
        return map;
    }

    /**
     * Add labels to the program counter, labels are never removed
     *
     * @param labels labels of data the control flow now depends on
     */
    public void raisePc(Collection<Label> labels) {
        pc.addAll(labels);
    }

    /**
     * Program counter
     *
     * @return unmodifiable view of the program counter
     */
    public Set<Label> getPc() {
        return Collections.unmodifiableSet(pc);
    }

    /**
     * Labels of a variable according to the rules of this state
     *
     * @param name variable name
     * @return labels of the variable
     */
    public Set<Label> getLabels(String name) {
        return rules.labelsOf(name);
    }

    public RuleTable getRules() {
        return rules;
    }

    public void record(FlowViolation violation) {
        sink.record(violation);
    }

    public void note(UnsupportedConstruct construct) {
        sink.note(construct);
    }

    public ViolationSink getSink() {
        return sink;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("State:\n");
        sb.append("\t<PC>: ").append(new TreeSet<>(pc)).append("\n");
        for (String line : rules.toString().split("\n")) {
            if (!line.isEmpty()) {
                sb.append("\t").append(line).append("\n");
            }
        }
        sb.append("\tUsed: ").append(used);
        return sb.toString();
    }
}
