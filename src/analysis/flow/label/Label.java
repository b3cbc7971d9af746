package analysis.flow.label;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Security category attached to data, e.g. "high" or "low". Labels are interned: there is a single instance for each
 * name, obtained through {@link #of(String)}. Labels are not ordered, a larger set of labels is more confidential.
 */
public final class Label implements Comparable<Label> {

    /**
     * canonical instances
     */
    private static final ConcurrentMap<String, Label> memo = new ConcurrentHashMap<>();

    private final String name;

    private Label(String name) {
        this.name = name;
    }

    /**
     * Get the canonical label with the given name
     *
     * @param name name of the label
     * @return the unique label for <code>name</code>
     */
    public static Label of(String name) {
        assert name != null && !name.isEmpty() : "Empty label name";
        Label l = memo.get(name);
        if (l == null) {
            Label newLabel = new Label(name);
            l = memo.putIfAbsent(name, newLabel);
            if (l == null) {
                l = newLabel;
            }
        }
        return l;
    }

    /**
     * Create a mutable, insertion ordered set of labels with the given names
     *
     * @param names label names
     * @return set containing the labels
     */
    public static Set<Label> setOf(String... names) {
        Set<Label> labels = new LinkedHashSet<>();
        for (String n : names) {
            labels.add(of(n));
        }
        return labels;
    }

    /**
     * Labels in <code>labels</code> that are not in <code>allowed</code>
     *
     * @param labels labels flowing somewhere
     * @param allowed labels permitted at the destination
     * @return the labels that would leak, empty if none
     */
    public static Set<Label> missing(Collection<Label> labels, Collection<Label> allowed) {
        if (allowed.containsAll(labels)) {
            return Collections.emptySet();
        }
        Set<Label> missing = new LinkedHashSet<>(labels);
        missing.removeAll(allowed);
        return missing;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(Label o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
