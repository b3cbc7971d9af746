package analysis.flow.violation;

import java.io.Writer;

import lang.ast.Node;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.flow.serialization.JSONSerializable;
import analysis.flow.serialization.JSONUtil;

/**
 * A construct the analysis does not check. This is not a violation but a gap in what was verified, flows through the
 * construct may go unreported.
 */
public class UnsupportedConstruct implements JSONSerializable {

    private final Node node;
    private final String message;

    public UnsupportedConstruct(Node node, String message) {
        this.node = node;
        this.message = message;
    }

    public Node getNode() {
        return node;
    }

    public int getLine() {
        return node.getLine();
    }

    public String getMessage() {
        return message;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "line", getLine());
        JSONUtil.addJSON(json, "code", node.getCode());
        JSONUtil.addJSON(json, "message", message);
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public String toString() {
        return "line " + getLine() + ": " + message;
    }
}
