package util.print;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import results.CollectedResults;
import analysis.flow.SecurityState;
import analysis.flow.label.Label;
import analysis.flow.violation.FlowVariable;
import analysis.flow.violation.FlowViolation;
import analysis.flow.violation.UnsupportedConstruct;

/**
 * Plain text rendering of analysis results, states and source context
 */
public class PrettyPrinter {

    /**
     * Label set as a sorted, brace enclosed list, "()" for the empty set
     *
     * @param labels labels to print
     * @return string for the labels
     */
    public static String labelsString(Set<Label> labels) {
        if (labels == null) {
            return "untracked";
        }
        if (labels.isEmpty()) {
            return "()";
        }
        StringBuilder sb = new StringBuilder("{");
        String sep = "";
        for (Label l : new TreeSet<>(labels)) {
            sb.append(sep).append(l.getName());
            sep = ", ";
        }
        return sb.append("}").toString();
    }

    /**
     * @param v variable descriptor
     * @return "name : labels"
     */
    public static String variableString(FlowVariable v) {
        return v.getName() + " : " + labelsString(v.getLabels());
    }

    /**
     * Multi-line description of a violation: kind, location, the program counter (implicit) or the used variables
     * (explicit), and the target
     *
     * @param v violation
     * @return description
     */
    public static String violationString(FlowViolation v) {
        List<String> lines = new ArrayList<>();
        String kind = v.getKind() == FlowViolation.Kind.IMPLICIT ? "Implicit Flow Error" : "Explicit Flow Error";
        lines.add(kind + (v.getInfo().isEmpty() ? "" : ": " + v.getInfo()));
        lines.add("@ line " + v.getLine() + ": \t" + v.getCode());
        if (v.getKind() == FlowViolation.Kind.IMPLICIT) {
            lines.add("PC:     \t" + labelsString(v.getState().getPc()));
        }
        else {
            StringBuilder used = new StringBuilder();
            for (Map.Entry<String, Set<Label>> e : v.getState().getUsedLabelsByName().entrySet()) {
                if (used.length() > 0) {
                    used.append("   ");
                }
                used.append(e.getKey()).append(" : ").append(labelsString(e.getValue()));
            }
            lines.add("Used:   \t" + used);
        }
        lines.add("Target: \t" + variableString(v.getTarget()));
        return String.join("\n\t", lines);
    }

    /**
     * Source lines around <code>line</code>, numbered, the given line marked with "&gt;"
     *
     * @param source source text
     * @param line line to show the context of (first line is 1)
     * @param diff number of lines to show before and after
     * @return numbered lines, empty if the line is not in the source
     */
    public static String contextString(String source, int line, int diff) {
        String[] lines = source.split("\r\n|\r|\n", -1);
        if (line < 1 || line > lines.length) {
            return "";
        }
        int bottom = Math.max(1, line - diff);
        int top = Math.min(lines.length, line + diff);
        int width = String.valueOf(top).length();
        StringBuilder sb = new StringBuilder();
        for (int i = bottom; i <= top; i++) {
            String num = String.valueOf(i);
            sb.append(i == line ? "> " : "  ");
            for (int pad = num.length(); pad < width; pad++) {
                sb.append(' ');
            }
            sb.append(num).append("  ").append(lines[i - 1]).append("\n");
        }
        return sb.toString();
    }

    /**
     * Report for one analyzed source
     *
     * @param results results to print
     * @param context lines of source context around each violation, no context if 0
     * @return report
     */
    public static String resultsString(CollectedResults results, int context) {
        StringBuilder sb = new StringBuilder();
        sb.append("...analysing '").append(results.getName()).append("'...\n");
        if (!results.hasViolations()) {
            sb.append("No flow violations detected!\n");
        }
        else {
            sb.append("\nFlow violation(s) detected!\n");
            sb.append(results.getViolations().size()).append(" warnings from source '").append(results.getName());
            sb.append("' (").append(results.getImplicitFlowCount()).append(" implicit, ");
            sb.append(results.getExplicitFlowCount()).append(" explicit):\n");
            for (FlowViolation v : results.getViolations()) {
                sb.append("\n").append(violationString(v)).append("\n");
                if (context > 0) {
                    sb.append("\nCode context:\n").append(contextString(results.getSource(), v.getLine(), context));
                }
            }
        }
        if (!results.getUnsupported().isEmpty()) {
            sb.append("\n").append(results.getUnsupported().size()).append(" construct(s) not analyzed:\n");
            for (UnsupportedConstruct u : results.getUnsupported()) {
                sb.append("\t").append(u).append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * Declared state of every scope of a source
     *
     * @param scopes map from scope name to declared state
     * @return description of the states
     */
    public static String statesString(Map<String, SecurityState> scopes) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, SecurityState> e : scopes.entrySet()) {
            sb.append("Function ").append(e.getKey()).append(":\n").append(e.getValue()).append("\n");
        }
        return sb.toString();
    }
}
