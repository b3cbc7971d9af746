package results;

import java.io.Writer;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.flow.SecurityState;
import analysis.flow.ViolationSink;
import analysis.flow.serialization.JSONSerializable;
import analysis.flow.serialization.JSONUtil;
import analysis.flow.violation.FlowViolation;
import analysis.flow.violation.UnsupportedConstruct;

/**
 * Results of analyzing one source
 */
public class CollectedResults implements JSONSerializable {

    private final String name;
    private final String source;
    private final ViolationSink sink;
    private final Map<String, SecurityState> scopes;
    private int implicitFlowCounter;
    private int explicitFlowCounter;

    /**
     * @param name name of the analyzed source
     * @param source source text
     * @param sink sink the analysis reported to
     * @param scopes declared state of each scope
     */
    public CollectedResults(String name, String source, ViolationSink sink, Map<String, SecurityState> scopes) {
        this.name = name;
        this.source = source;
        this.sink = sink;
        this.scopes = Collections.unmodifiableMap(scopes);
        for (FlowViolation v : sink.getViolations()) {
            switch (v.getKind()) {
            case IMPLICIT:
                recordImplicitFlow();
                break;
            case EXPLICIT:
                recordExplicitFlow();
                break;
            }
        }
    }

    private void recordImplicitFlow() {
        implicitFlowCounter++;
    }

    private void recordExplicitFlow() {
        explicitFlowCounter++;
    }

    public int getImplicitFlowCount() {
        return implicitFlowCounter;
    }

    public int getExplicitFlowCount() {
        return explicitFlowCounter;
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    /**
     * Violations in the order they were found
     *
     * @return violations
     */
    public List<FlowViolation> getViolations() {
        return sink.getViolations();
    }

    /**
     * Constructs whose flows were not analyzed
     *
     * @return unsupported constructs in the order they were encountered
     */
    public List<UnsupportedConstruct> getUnsupported() {
        return sink.getUnsupported();
    }

    /**
     * Declared state of each scope, the top-level scope is under {@link analysis.flow.FlowEvaluator#MODULE_SCOPE}
     *
     * @return map from scope name to declared state
     */
    public Map<String, SecurityState> getScopes() {
        return scopes;
    }

    public boolean hasViolations() {
        return !sink.isEmpty();
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "source", name);
        JSONUtil.addJSON(json, "implicit", implicitFlowCounter);
        JSONUtil.addJSON(json, "explicit", explicitFlowCounter);
        JSONArray violations = new JSONArray();
        for (FlowViolation v : getViolations()) {
            violations.put(v.toJSON());
        }
        JSONUtil.addJSON(json, "violations", violations);
        JSONArray unsupported = new JSONArray();
        for (UnsupportedConstruct u : getUnsupported()) {
            unsupported.put(u.toJSON());
        }
        JSONUtil.addJSON(json, "unsupported", unsupported);
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }
}
