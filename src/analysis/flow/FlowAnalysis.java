package analysis.flow;

import java.util.List;
import java.util.Map;

import lang.Lexer;
import lang.ParseException;
import lang.Parser;
import lang.Token;
import lang.ast.Module;
import results.CollectedResults;

/**
 * Information flow analysis of a source: tokenize, read the annotations, parse and check the tree. Each call works on
 * its own root state and sink, so different sources may be analyzed concurrently.
 */
public class FlowAnalysis {

    /**
     * Marker introducing annotation comments
     */
    private final String marker;

    public FlowAnalysis() {
        this(AnnotationCollector.DEFAULT_MARKER);
    }

    public FlowAnalysis(String marker) {
        this.marker = marker;
    }

    /**
     * Analyze a source
     *
     * @param name name of the source used in reports
     * @param source source text
     * @return violations found
     * @throws ParseException the source has a syntax error
     */
    public CollectedResults analyze(String name, String source) throws ParseException {
        List<Token> tokens = new Lexer(source).tokenize();
        Map<String, SecurityState> scopes = new AnnotationCollector(marker).collect(tokens);
        Module module = new Parser(source, tokens).parseModule();
        return analyze(name, source, module, scopes);
    }

    /**
     * Analyze an already parsed source
     *
     * @param name name of the source used in reports
     * @param source source text, used only for reports
     * @param module root of the syntax tree
     * @param scopes declared state for each scope, see {@link AnnotationCollector#collect(List)}
     * @return violations found
     */
    public static CollectedResults analyze(String name, String source, Module module,
                                           Map<String, SecurityState> scopes) {
        SecurityState root = new SecurityState();
        new FlowEvaluator(scopes).evaluate(module, root);
        return new CollectedResults(name, source, root.getSink(), scopes);
    }
}
