package analysis.flow.serialization;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.flow.label.Label;

/**
 * Helpers for building JSON objects. Serialization errors are reported and the offending entry is left out rather
 * than aborting the whole report.
 */
public class JSONUtil {

    /**
     * Labels as a sorted JSON array, {@link JSONObject#NULL} for an untracked (null) label set
     *
     * @param labels labels to serialize, may be null
     * @return JSON array of label names or {@link JSONObject#NULL}
     */
    public static Object toJSON(Collection<Label> labels) {
        if (labels == null) {
            return JSONObject.NULL;
        }
        JSONArray array = new JSONArray();
        for (Label l : new TreeSet<>(labels)) {
            array.put(l.getName());
        }
        return array;
    }

    /**
     * Map from variable name to labels as a JSON object
     *
     * @param labelsByName variable names and their labels
     * @return JSON object with one array of label names per variable
     */
    public static JSONObject toJSON(Map<String, Set<Label>> labelsByName) {
        JSONObject json = new JSONObject();
        for (Map.Entry<String, Set<Label>> e : labelsByName.entrySet()) {
            addJSON(json, e.getKey(), toJSON(e.getValue()));
        }
        return json;
    }

    /**
     * Add a key value pair to the given {@link JSONObject}.
     *
     * @param json
     *            JSON object to add the pair to
     * @param key
     *            key
     * @param value
     *            value, {@link JSONObject#NULL} is used for null
     */
    public static void addJSON(JSONObject json, String key, Object value) {
        try {
            json.put(key, value == null ? JSONObject.NULL : value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }

    /**
     * Add a key value pair to the given {@link JSONObject}.
     *
     * @param json
     *            JSON object to add the pair to
     * @param key
     *            key
     * @param value
     *            value
     */
    public static void addJSON(JSONObject json, String key, int value) {
        try {
            json.put(key, value);
        } catch (JSONException e) {
            System.err.println("Serialization error for (" + key + ", " + value + "), message: " + e.getMessage());
        }
    }
}
