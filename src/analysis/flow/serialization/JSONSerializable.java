package analysis.flow.serialization;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Part of a flow report that can be written as JSON: a violation, a construct that was not analyzed, or the results
 * for a whole source. Label sets are written with {@link JSONUtil#toJSON(java.util.Collection)}.
 */
public interface JSONSerializable {

    /**
     * JSON form of this report entry, used by the <code>-json</code> output of the checker
     *
     * @return new JSON object, later changes to <code>this</code> are not reflected in it
     */
    public JSONObject toJSON();

    /**
     * Write the JSON form of this report entry
     *
     * @param out writer for the report
     * @throws JSONException if the JSON cannot be written to <code>out</code>
     */
    public void writeJSON(Writer out) throws JSONException;
}
