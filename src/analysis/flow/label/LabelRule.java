package analysis.flow.label;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A wildcard pattern over variable names together with the labels carried by the names it matches. In the pattern
 * <code>*</code> matches any sequence of characters and every other character matches itself; the pattern must match
 * the whole name.
 * <p>
 * A rule with no labels is a <i>clearing</i> rule: names it matches carry no labels at all, whatever other rules say.
 */
public class LabelRule {

    /**
     * Wildcard glyph
     */
    public static final String WILDCARD = "*";

    /**
     * Pattern as written in the annotation
     */
    private final String pattern;
    /**
     * Compiled, anchored form of the pattern
     */
    private final Pattern regex;
    /**
     * Labels of matching names
     */
    private final Set<Label> labels;

    /**
     * Create a rule
     *
     * @param pattern wildcard pattern
     * @param labels labels of names matching the pattern, empty for a clearing rule
     */
    public LabelRule(String pattern, Collection<Label> labels) {
        this(pattern, compile(pattern), new LinkedHashSet<>(labels));
    }

    private LabelRule(String pattern, Pattern regex, Set<Label> labels) {
        this.pattern = pattern;
        this.regex = regex;
        this.labels = labels;
    }

    /**
     * Translate a wildcard pattern into an anchored regular expression
     *
     * @param pattern wildcard pattern
     * @return compiled regular expression
     */
    private static Pattern compile(String pattern) {
        StringBuilder sb = new StringBuilder("^");
        int start = 0;
        int star;
        while ((star = pattern.indexOf(WILDCARD, start)) >= 0) {
            if (star > start) {
                sb.append(Pattern.quote(pattern.substring(start, star)));
            }
            sb.append(".*");
            start = star + 1;
        }
        if (start < pattern.length()) {
            sb.append(Pattern.quote(pattern.substring(start)));
        }
        sb.append("$");
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    /**
     * Whether this rule applies to the given name
     *
     * @param name variable name
     * @return true if the pattern matches all of <code>name</code>
     */
    public boolean appliesTo(String name) {
        return regex.matcher(name).matches();
    }

    /**
     * Add labels to this rule
     *
     * @param newLabels labels to add
     * @return true if the label set changed
     */
    public boolean add(Collection<Label> newLabels) {
        return labels.addAll(newLabels);
    }

    /**
     * Remove every label from this rule, turning it into a clearing rule
     */
    public void clear() {
        labels.clear();
    }

    /**
     * Names matching a clearing rule carry no labels
     *
     * @return true if the rule has no labels
     */
    public boolean isClearing() {
        return labels.isEmpty();
    }

    public String getPattern() {
        return pattern;
    }

    public Set<Label> getLabels() {
        return Collections.unmodifiableSet(labels);
    }

    /**
     * Copy of this rule whose label set is independent of this one
     *
     * @return new rule
     */
    public LabelRule copy() {
        return new LabelRule(pattern, regex, new LinkedHashSet<>(labels));
    }

    @Override
    public String toString() {
        return "Rule " + pattern + " -> " + labels;
    }
}
