package analysis.flow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lang.Token;
import lang.TokenKind;
import util.Logger;

/**
 * Reads label annotations from the comments of a source and builds the state declared for each scope. An annotation is
 * a comment whose text starts with the marker, e.g.
 *
 * <pre>
 * # fp secret*: high. public_*: ().
 * def f():
 * </pre>
 *
 * Consecutive annotations form a block, declared in order into one state. A block immediately before a
 * <code>def</code> belongs to that function, a later block for a function of the same name replaces it. Any other
 * block is merged (label union) into the top-level scope, {@link FlowEvaluator#MODULE_SCOPE}.
 */
public class AnnotationCollector {

    /**
     * Marker used when none is given
     */
    public static final String DEFAULT_MARKER = "fp";

    /**
     * Marker that must follow the comment leader
     */
    private final String marker;

    public AnnotationCollector() {
        this(DEFAULT_MARKER);
    }

    public AnnotationCollector(String marker) {
        this.marker = marker;
    }

    /**
     * Build the declared state of every annotated scope
     *
     * @param tokens all tokens of the source, including comments
     * @return map from function name (or {@link FlowEvaluator#MODULE_SCOPE}) to the declared state, the top-level
     *         scope is always present
     */
    public Map<String, SecurityState> collect(List<Token> tokens) {
        Map<String, SecurityState> scopes = new LinkedHashMap<>();
        SecurityState module = new SecurityState();
        // consecutive annotations not yet bound to a scope, null if there are none
        SecurityState block = null;
        boolean expectingName = false;

        for (Token t : tokens) {
            switch (t.getKind()) {
            case NEWLINE:
            case NL:
            case INDENT:
            case DEDENT:
                continue;
            case COMMENT:
                String annotation = getAnnotation(t.getText());
                if (annotation != null) {
                    if (block == null) {
                        block = new SecurityState();
                    }
                    block.declare(annotation);
                }
                continue;
            default:
                break;
            }

            if (block == null) {
                continue;
            }
            if (expectingName) {
                if (t.getKind() == TokenKind.NAME) {
                    if (scopes.put(t.getText(), block) != null) {
                        Logger.println(2, "Replacing the annotations of redefined function " + t.getText());
                    }
                }
                else {
                    module.merge(block);
                }
                block = null;
                expectingName = false;
            }
            else if (t.isName("def")) {
                expectingName = true;
            }
            else {
                module.merge(block);
                block = null;
            }
        }
        if (block != null) {
            module.merge(block);
        }
        scopes.put(FlowEvaluator.MODULE_SCOPE, module);
        return scopes;
    }

    /**
     * Text of the annotation in the comment
     *
     * @param comment comment including the leading "#"
     * @return annotation with the marker removed, null if this comment is not an annotation
     */
    public String getAnnotation(String comment) {
        if (!comment.startsWith("#")) {
            return null;
        }
        String text = comment.substring(1).trim();
        if (!text.startsWith(marker)) {
            return null;
        }
        String rest = text.substring(marker.length());
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
            // the marker must be a word of its own
            return null;
        }
        return rest;
    }
}
