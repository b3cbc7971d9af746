package analysis.flow.violation;

import java.io.Writer;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lang.ast.Node;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.flow.SecurityState;
import analysis.flow.label.Label;
import analysis.flow.serialization.JSONSerializable;
import analysis.flow.serialization.JSONUtil;

/**
 * Information flow into a variable that is not allowed to hold some of the labels involved. Violations are collected,
 * never thrown.
 */
public abstract class FlowViolation implements JSONSerializable {

    /**
     * Kinds of flow violation
     */
    public enum Kind {
        /**
         * Flow through a control dependency
         */
        IMPLICIT,
        /**
         * Flow through the value written
         */
        EXPLICIT;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    /**
     * Node where the flow happens
     */
    private final Node node;
    /**
     * Snapshot of the state at the point of failure
     */
    private final SecurityState state;
    /**
     * Variable written
     */
    private final FlowVariable target;
    /**
     * Labels that flow into the target but that the target may not hold
     */
    private final Set<Label> missing;

    /**
     * Create a violation
     *
     * @param node node where the flow happens
     * @param state state when the flow happens, a snapshot is taken
     * @param target variable written
     * @param missing labels the target may not hold
     */
    protected FlowViolation(Node node, SecurityState state, FlowVariable target, Set<Label> missing) {
        this.node = node;
        this.state = state.snapshot();
        this.target = target;
        this.missing = Collections.unmodifiableSet(new LinkedHashSet<>(missing));
    }

    public abstract Kind getKind();

    /**
     * Short description of the cause
     *
     * @return explanation for a report
     */
    public abstract String getInfo();

    public Node getNode() {
        return node;
    }

    public int getLine() {
        return node.getLine();
    }

    /**
     * Source code of the offending node
     *
     * @return source text
     */
    public String getCode() {
        return node.getCode();
    }

    /**
     * State at the point of failure, from which the PC and the labels of the used variables can be recovered
     *
     * @return state snapshot
     */
    public SecurityState getState() {
        return state;
    }

    public FlowVariable getTarget() {
        return target;
    }

    public Set<Label> getMissingLabels() {
        return missing;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "kind", getKind().toString());
        JSONUtil.addJSON(json, "line", getLine());
        JSONUtil.addJSON(json, "code", getCode());
        JSONUtil.addJSON(json, "pc", JSONUtil.toJSON(state.getPc()));
        JSONUtil.addJSON(json, "used", JSONUtil.toJSON(state.getUsedLabelsByName()));
        JSONObject targetJSON = new JSONObject();
        JSONUtil.addJSON(targetJSON, "name", target.getName());
        JSONUtil.addJSON(targetJSON, "labels", JSONUtil.toJSON(target.getLabels()));
        JSONUtil.addJSON(json, "target", targetJSON);
        JSONUtil.addJSON(json, "missing", JSONUtil.toJSON(missing));
        JSONUtil.addJSON(json, "info", getInfo());
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public String toString() {
        return getKind() + " flow violation @ line " + getLine() + ": " + getInfo() + " (" + target + ")";
    }
}
