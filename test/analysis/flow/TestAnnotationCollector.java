package analysis.flow;

import java.util.Map;

import junit.framework.TestCase;
import lang.Lexer;
import lang.ParseException;
import analysis.flow.label.Label;

public class TestAnnotationCollector extends TestCase {

    private static Map<String, SecurityState> collect(String source) throws ParseException {
        return new AnnotationCollector().collect(new Lexer(source).tokenize());
    }

    public static void testGetAnnotation() {
        AnnotationCollector c = new AnnotationCollector();
        assertEquals(" a: high.", c.getAnnotation("# fp a: high."));
        assertEquals(" a: high.", c.getAnnotation("#fp a: high."));
        assertEquals("", c.getAnnotation("# fp"));
        assertNull(c.getAnnotation("# fpa: high."));
        assertNull(c.getAnnotation("# a comment"));
        assertNull(c.getAnnotation("fp a: high."));
    }

    public static void testModuleScopeAlwaysPresent() throws ParseException {
        Map<String, SecurityState> scopes = collect("x = 1\n");
        assertEquals(1, scopes.size());
        assertTrue(scopes.get(FlowEvaluator.MODULE_SCOPE).getRules().isEmpty());
    }

    public static void testAnnotationsBeforeDef() throws ParseException {
        String source = "# fp top: t.\n" + "x = 1\n" + "# fp a: high.\n" + "# fp b: low.\n" + "def f(a, b):\n"
                + "    pass\n" + "# fp c: med.\n" + "def g():\n" + "    pass\n";
        Map<String, SecurityState> scopes = collect(source);
        assertEquals(3, scopes.size());
        assertEquals(Label.setOf("t"), scopes.get(FlowEvaluator.MODULE_SCOPE).getLabels("top"));
        assertTrue(scopes.get(FlowEvaluator.MODULE_SCOPE).getLabels("a").isEmpty());

        SecurityState f = scopes.get("f");
        assertEquals(Label.setOf("high"), f.getLabels("a"));
        assertEquals(Label.setOf("low"), f.getLabels("b"));
        assertTrue(f.getLabels("c").isEmpty());

        assertEquals(Label.setOf("med"), scopes.get("g").getLabels("c"));
    }

    public static void testTrailingAnnotationGoesToModule() throws ParseException {
        Map<String, SecurityState> scopes = collect("x = 1\n# fp a: high.\n");
        assertEquals(Label.setOf("high"), scopes.get(FlowEvaluator.MODULE_SCOPE).getLabels("a"));
    }

    public static void testInlineAnnotation() throws ParseException {
        Map<String, SecurityState> scopes = collect("x = 1  # fp x: high.\ny = x\n");
        assertEquals(Label.setOf("high"), scopes.get(FlowEvaluator.MODULE_SCOPE).getLabels("x"));
    }

    public static void testAnnotationsAreDeclaredInOrder() throws ParseException {
        Map<String, SecurityState> scopes = collect("# fp a: high.\n# fp a: ().\nx = 1\n");
        assertTrue(scopes.get(FlowEvaluator.MODULE_SCOPE).getLabels("a").isEmpty());
        assertTrue(scopes.get(FlowEvaluator.MODULE_SCOPE).getRules().getRule("a").isClearing());
    }

    public static void testModuleBlocksAreUnioned() throws ParseException {
        Map<String, SecurityState> scopes = collect("# fp a: high.\nx = 1\n# fp a: ().\n# fp b: low.\ny = 1\n");
        SecurityState module = scopes.get(FlowEvaluator.MODULE_SCOPE);
        // a clearing clause in a separate block does not remove labels merged from an earlier block
        assertEquals(Label.setOf("high"), module.getLabels("a"));
        assertEquals(Label.setOf("low"), module.getLabels("b"));
    }

    public static void testClearingBlockMergedIntoModule() throws ParseException {
        Map<String, SecurityState> scopes = collect("# fp s*: high.\nx = 1\n# fp s_pub: ().\ny = 1\n");
        SecurityState module = scopes.get(FlowEvaluator.MODULE_SCOPE);
        assertTrue(module.getLabels("s_pub").isEmpty());
        assertEquals(Label.setOf("high"), module.getLabels("s_key"));
    }

    public static void testRedefinedFunctionKeepsLastAnnotations() throws ParseException {
        String source = "# fp a: high.\ndef f():\n    pass\n# fp b: low.\ndef f():\n    pass\n";
        Map<String, SecurityState> scopes = collect(source);
        assertEquals(2, scopes.size());
        assertEquals(Label.setOf("low"), scopes.get("f").getLabels("b"));
        assertTrue(scopes.get("f").getLabels("a").isEmpty());
    }

    public static void testCustomMarker() throws ParseException {
        Map<String, SecurityState> scopes = new AnnotationCollector("label")
                .collect(new Lexer("# label a: high.\n# fp b: high.\nx = 1\n").tokenize());
        SecurityState module = scopes.get(FlowEvaluator.MODULE_SCOPE);
        assertEquals(Label.setOf("high"), module.getLabels("a"));
        assertTrue(module.getLabels("b").isEmpty());
    }
}
