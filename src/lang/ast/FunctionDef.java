package lang.ast;

import java.util.Collections;
import java.util.List;

/**
 * Function definition <code>def name(params): body</code>
 */
public class FunctionDef extends Node {

    private final String name;
    private final List<String> parameters;
    private final List<Node> body;

    public FunctionDef(int line, String code, String name, List<String> parameters, List<Node> body) {
        super(line, code);
        this.name = name;
        this.parameters = Collections.unmodifiableList(parameters);
        this.body = Collections.unmodifiableList(body);
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<Node> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_DEF;
    }
}
