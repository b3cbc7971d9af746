package analysis.flow.label;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import util.Logger;

/**
 * Insertion ordered map from wildcard pattern to {@link LabelRule}, built from annotations of the form
 *
 * <pre>
 * pattern: label, label. pattern: label.
 * </pre>
 *
 * The label <code>()</code> means "no label". A clause whose only label is <code>()</code> declares a clearing rule.
 */
public class RuleTable {

    /**
     * Separates independent clauses
     */
    private static final String CLAUSE_SEPARATOR = ".";
    /**
     * Separates the pattern from the labels of a clause
     */
    private static final String PATTERN_SEPARATOR = ":";
    /**
     * Separates labels
     */
    private static final String LABEL_SEPARATOR = ",";
    /**
     * Label token meaning "no label"
     */
    public static final String NO_LABEL = "()";
    /**
     * Characters allowed in a pattern
     */
    private static final Pattern PATTERN_CHARS = Pattern.compile("[a-zA-Z0-9_*]+");

    private final Map<String, LabelRule> rules;

    /**
     * Create an empty rule table
     */
    public RuleTable() {
        this.rules = new LinkedHashMap<>();
    }

    private RuleTable(Map<String, LabelRule> rules) {
        this.rules = rules;
    }

    /**
     * Parse the annotation text and add the rules it declares. Malformed clauses are logged and skipped, the other
     * clauses still apply.
     *
     * @param annotation annotation text with the marker removed
     * @return number of clauses that were added
     */
    public int declare(String annotation) {
        int added = 0;
        for (String clause : split(annotation.trim(), CLAUSE_SEPARATOR)) {
            if (clause.trim().isEmpty()) {
                continue;
            }
            if (declareClause(clause)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Parse and add a single <code>pattern: labels</code> clause
     *
     * @param clause clause text
     * @return true if the clause was well formed
     */
    private boolean declareClause(String clause) {
        List<String> parts = split(clause, PATTERN_SEPARATOR);
        if (parts.size() != 2) {
            Logger.println(1, "Skipping annotation clause \"" + clause.trim() + "\": expected exactly one \""
                    + PATTERN_SEPARATOR + "\"");
            return false;
        }
        Matcher m = PATTERN_CHARS.matcher(parts.get(0));
        if (!m.find()) {
            Logger.println(1, "Skipping annotation clause \"" + clause.trim() + "\": no pattern");
            return false;
        }
        String pattern = m.group();

        List<String> labelNames = new ArrayList<>();
        for (String l : split(parts.get(1), LABEL_SEPARATOR)) {
            String trimmed = l.trim();
            if (!trimmed.isEmpty()) {
                labelNames.add(trimmed);
            }
        }
        if (labelNames.isEmpty()) {
            Logger.println(1, "Skipping annotation clause \"" + clause.trim() + "\": no labels");
            return false;
        }

        Set<Label> labels = new LinkedHashSet<>();
        for (String l : labelNames) {
            if (!l.equals(NO_LABEL)) {
                labels.add(Label.of(l));
            }
        }
        declare(pattern, labels);
        return true;
    }

    /**
     * Add a rule. An empty label set declares a clearing rule, replacing whatever labels the pattern had. Otherwise
     * the labels are added to those already declared for the pattern.
     *
     * @param pattern wildcard pattern
     * @param labels labels for names matching the pattern
     */
    public void declare(String pattern, Collection<Label> labels) {
        LabelRule existing = rules.get(pattern);
        if (existing == null) {
            rules.put(pattern, new LabelRule(pattern, labels));
        }
        else if (labels.isEmpty()) {
            existing.clear();
        }
        else {
            existing.add(labels);
        }
    }

    /**
     * Labels carried by the given name: the union of the labels of every rule matching the name, or the empty set if
     * any matching rule is a clearing rule. The result does not depend on the order rules were declared in.
     *
     * @param name variable name
     * @return labels of the name
     */
    public Set<Label> labelsOf(String name) {
        Set<Label> result = new LinkedHashSet<>();
        for (LabelRule rule : rules.values()) {
            if (rule.appliesTo(name)) {
                if (rule.isClearing()) {
                    return new LinkedHashSet<>();
                }
                result.addAll(rule.getLabels());
            }
        }
        return result;
    }

    /**
     * Fold the rules of <code>other</code> into this table. Patterns not yet in this table are copied, label sets of
     * patterns present in both are unioned.
     *
     * @param other table to merge into this one
     */
    public void merge(RuleTable other) {
        for (Map.Entry<String, LabelRule> e : other.rules.entrySet()) {
            LabelRule existing = rules.get(e.getKey());
            if (existing == null) {
                rules.put(e.getKey(), e.getValue().copy());
            }
            else {
                existing.add(e.getValue().getLabels());
            }
        }
    }

    /**
     * Deep copy, rules in the copy can be changed without affecting this table
     *
     * @return new rule table
     */
    public RuleTable copy() {
        Map<String, LabelRule> newRules = new LinkedHashMap<>();
        for (Map.Entry<String, LabelRule> e : rules.entrySet()) {
            newRules.put(e.getKey(), e.getValue().copy());
        }
        return new RuleTable(newRules);
    }

    /**
     * Get the rule declared for exactly this pattern
     *
     * @param pattern wildcard pattern
     * @return the rule or null if the pattern was never declared
     */
    public LabelRule getRule(String pattern) {
        return rules.get(pattern);
    }

    /**
     * All rules in declaration order
     *
     * @return unmodifiable collection of rules
     */
    public Collection<LabelRule> getRules() {
        return Collections.unmodifiableCollection(rules.values());
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Split on a literal separator keeping empty pieces
     */
    private static List<String> split(String s, String separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int i;
        while ((i = s.indexOf(separator, start)) >= 0) {
            parts.add(s.substring(start, i));
            start = i + separator.length();
        }
        parts.add(s.substring(start));
        return parts;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (LabelRule rule : rules.values()) {
            sb.append(rule.getPattern()).append(": ").append(rule.getLabels()).append("\n");
        }
        return sb.toString();
    }
}
