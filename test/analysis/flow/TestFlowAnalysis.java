package analysis.flow;

import java.util.List;

import junit.framework.TestCase;
import lang.ParseException;
import lang.ast.NodeKind;

import org.junit.Test;

import results.CollectedResults;
import analysis.flow.label.Label;
import analysis.flow.violation.FlowViolation;
import analysis.flow.violation.UnsupportedConstruct;

/**
 * Check small annotated programs end to end
 */
public class TestFlowAnalysis extends TestCase {

    private static CollectedResults check(String... lines) throws ParseException {
        StringBuilder sb = new StringBuilder();
        for (String l : lines) {
            sb.append(l).append("\n");
        }
        return new FlowAnalysis().analyze("test", sb.toString());
    }

    private static void assertCounts(CollectedResults r, int implicit, int explicit) {
        assertEquals("implicit flows in " + r.getViolations(), implicit, r.getImplicitFlowCount());
        assertEquals("explicit flows in " + r.getViolations(), explicit, r.getExplicitFlowCount());
    }

    @Test
    public void testImplicitFlowThroughCall() throws ParseException {
        CollectedResults r = check("# fp a: L.",
                                   "def f():",
                                   "    if a == 1:",
                                   "        print()",
                                   "    else:",
                                   "        return 0");
        assertCounts(r, 1, 0);
        FlowViolation v = r.getViolations().get(0);
        assertEquals(FlowViolation.Kind.IMPLICIT, v.getKind());
        assertEquals(4, v.getLine());
        assertEquals("print()", v.getCode());
        assertEquals(NodeKind.CALL, v.getNode().getKind());
        assertEquals(Label.setOf("L"), v.getState().getPc());
        assertTrue(v.getTarget().isUntracked());
        assertNull(v.getTarget().getLabels());
        assertEquals("print", v.getTarget().getName());

        // the return is reported but not analyzed
        assertEquals(1, r.getUnsupported().size());
        assertEquals(6, r.getUnsupported().get(0).getLine());
    }

    @Test
    public void testExplicitFlow() throws ParseException {
        CollectedResults r = check("# fp a: high.", "a = 1; b = a");
        assertCounts(r, 0, 1);
        FlowViolation v = r.getViolations().get(0);
        assertEquals(FlowViolation.Kind.EXPLICIT, v.getKind());
        assertEquals(2, v.getLine());
        assertEquals("b = a", v.getCode());
        assertEquals("b", v.getTarget().getName());
        assertTrue(v.getTarget().getLabels().isEmpty());
        assertEquals(Label.setOf("high"), v.getState().getUsedLabelsByName().get("a"));
        assertEquals(Label.setOf("high"), v.getMissingLabels());
    }

    @Test
    public void testDestructuring() throws ParseException {
        CollectedResults r = check("# fp a: high. d: med.", "a = 1", "(b, c) = (a, 2)", "e = (a, b, d)");
        assertCounts(r, 0, 2);
        List<FlowViolation> vs = r.getViolations();

        assertEquals("b", vs.get(0).getTarget().getName());
        assertEquals(3, vs.get(0).getLine());
        assertEquals(Label.setOf("high"), vs.get(0).getMissingLabels());
        assertFalse(vs.get(0).getState().getUsedNames().contains("d"));

        assertEquals("e", vs.get(1).getTarget().getName());
        assertEquals(4, vs.get(1).getLine());
        assertEquals(Label.setOf("high", "med"), vs.get(1).getMissingLabels());
        assertTrue(r.getUnsupported().isEmpty());
    }

    @Test
    public void testAllowedFlow() throws ParseException {
        CollectedResults r = check("# fp a: high. b: high.", "b = a");
        assertFalse(r.hasViolations());
    }

    @Test
    public void testWhileRaisesPc() throws ParseException {
        CollectedResults r = check("# fp secret: high.", "while secret:", "    x = 1");
        assertCounts(r, 1, 0);
        FlowViolation v = r.getViolations().get(0);
        assertEquals(3, v.getLine());
        assertEquals("x", v.getTarget().getName());
        assertEquals(Label.setOf("high"), v.getMissingLabels());
    }

    @Test
    public void testBothBranchesOfIf() throws ParseException {
        CollectedResults r = check("# fp h: high. l: ().", "if h:", "    l = 1", "else:", "    l = 2");
        assertCounts(r, 2, 0);
        assertEquals(3, r.getViolations().get(0).getLine());
        assertEquals(5, r.getViolations().get(1).getLine());
    }

    @Test
    public void testNestedConditionsAccumulatePc() throws ParseException {
        CollectedResults r = check("# fp a: A. b: B. x: A.", "if a:", "    if b:", "        x = 1");
        assertCounts(r, 1, 0);
        FlowViolation v = r.getViolations().get(0);
        assertEquals(Label.setOf("A", "B"), v.getState().getPc());
        assertEquals(Label.setOf("B"), v.getMissingLabels());
    }

    @Test
    public void testPcDoesNotLeakToFollowingStatements() throws ParseException {
        CollectedResults r = check("# fp h: high.", "if h:", "    pass", "y = 1");
        assertFalse(r.hasViolations());
    }

    @Test
    public void testForTargetWrittenFromIterable() throws ParseException {
        CollectedResults r = check("# fp items: high.", "for i in items:", "    pass");
        assertCounts(r, 0, 1);
        FlowViolation v = r.getViolations().get(0);
        assertEquals("i", v.getTarget().getName());
        assertEquals(2, v.getLine());
    }

    @Test
    public void testForBodyUnderPc() throws ParseException {
        CollectedResults r = check("# fp items: high. i: high.", "for i in items:", "    total = 0");
        assertCounts(r, 1, 0);
        assertEquals("total", r.getViolations().get(0).getTarget().getName());
    }

    @Test
    public void testConditionalExpressionRaisesPc() throws ParseException {
        CollectedResults r = check("# fp c: high.", "x = 1 if c else 2");
        assertCounts(r, 1, 0);
        assertEquals("x", r.getViolations().get(0).getTarget().getName());
    }

    @Test
    public void testConditionalExpressionInsideLiteral() throws ParseException {
        CollectedResults r = check("# fp c: high.", "t = (1 if c else 2, 3)");
        assertCounts(r, 1, 0);
    }

    @Test
    public void testConditionalExpressionInsideCall() throws ParseException {
        CollectedResults r = check("# fp c: high.", "y = f(1 if c else 2)");
        assertCounts(r, 1, 0);
        assertEquals("y", r.getViolations().get(0).getTarget().getName());
        assertEquals(Label.setOf("high"), r.getViolations().get(0).getState().getPc());
    }

    @Test
    public void testConditionalExpressionInsideComparison() throws ParseException {
        CollectedResults r = check("# fp c: high.", "flag = (1 if c else 2) == 1");
        assertCounts(r, 1, 0);
        assertEquals("flag", r.getViolations().get(0).getTarget().getName());
    }

    @Test
    public void testLaterModuleBlockDoesNotClearEarlierLabels() throws ParseException {
        CollectedResults r = check("# fp a: high.", "x = 1", "# fp a: ().", "y = 1", "b = a");
        assertCounts(r, 0, 1);
        FlowViolation v = r.getViolations().get(0);
        assertEquals(5, v.getLine());
        assertEquals("b", v.getTarget().getName());
        assertEquals(Label.setOf("high"), v.getState().getLabels("a"));
    }

    @Test
    public void testCallArgumentsAreUsed() throws ParseException {
        CollectedResults r = check("# fp s: high.", "y = f(s)");
        assertCounts(r, 0, 1);
        assertTrue(r.getViolations().get(0).getState().getUsedNames().contains("s"));
        assertTrue(r.getViolations().get(0).getState().getUsedNames().contains("f"));
    }

    @Test
    public void testCallUnderPc() throws ParseException {
        CollectedResults r = check("# fp h: high.", "if h:", "    print(h)");
        assertCounts(r, 1, 0);
        assertEquals(3, r.getViolations().get(0).getLine());
        assertTrue(r.getViolations().get(0).getTarget().isUntracked());
    }

    @Test
    public void testComparisonIsUsed() throws ParseException {
        CollectedResults r = check("# fp s: high.", "flag = s == 1");
        assertCounts(r, 0, 1);
    }

    @Test
    public void testChainedAssignment() throws ParseException {
        CollectedResults r = check("# fp s: high.", "x = y = s");
        assertCounts(r, 0, 2);
        assertEquals("x", r.getViolations().get(0).getTarget().getName());
        assertEquals("y", r.getViolations().get(1).getTarget().getName());
    }

    @Test
    public void testListTargetPointwise() throws ParseException {
        CollectedResults r = check("# fp s: high.", "[p, q] = [s, 1]");
        assertCounts(r, 0, 1);
        assertEquals("p", r.getViolations().get(0).getTarget().getName());
    }

    @Test
    public void testArityMismatchChecksWholeValue() throws ParseException {
        CollectedResults r = check("# fp a: high.", "b, c = a");
        assertCounts(r, 0, 2);
        assertEquals(1, r.getUnsupported().size());
        UnsupportedConstruct u = r.getUnsupported().get(0);
        assertEquals(2, u.getLine());
        assertTrue(u.getMessage(), u.getMessage().contains("cannot match 2 targets"));

        r = check("# fp a: high.", "b, c = a, 1, 2");
        assertCounts(r, 0, 2);
        assertTrue(r.getUnsupported().get(0).getMessage().contains("of length 3"));
    }

    @Test
    public void testUnsupportedConstructsAreNoted() throws ParseException {
        CollectedResults r = check("# fp s: high.", "x += s", "y = s + 1", "z = s.attr");
        assertFalse(r.hasViolations());
        assertEquals(3, r.getUnsupported().size());
        assertTrue(r.getUnsupported().get(0).getMessage().contains("AUGMENTED_ASSIGN"));
        assertTrue(r.getUnsupported().get(1).getMessage().contains("OPERATOR"));
        assertTrue(r.getUnsupported().get(2).getMessage().contains("ATTRIBUTE"));
    }

    @Test
    public void testFunctionAnnotationsAreScoped() throws ParseException {
        CollectedResults r = check("# fp a: high.", "def f():", "    b = a", "b = a");
        assertCounts(r, 0, 1);
        assertEquals(3, r.getViolations().get(0).getLine());
    }

    @Test
    public void testModuleAnnotationsReachFunctions() throws ParseException {
        CollectedResults r = check("# fp a: high.", "x = 0", "def f():", "    b = a");
        assertCounts(r, 0, 1);
        assertEquals(4, r.getViolations().get(0).getLine());
    }

    @Test
    public void testCustomMarker() throws ParseException {
        String source = "# flow a: high.\n# fp b: high.\nb = a\n";
        assertFalse(new FlowAnalysis("flow").analyze("test", source).getViolations().isEmpty());
        assertFalse(new FlowAnalysis().analyze("test", source).hasViolations());
    }

    @Test
    public void testSyntaxError() {
        try {
            check("def :");
            fail("Expected a syntax error");
        }
        catch (ParseException e) {
            assertEquals(1, e.getLine());
        }
    }

    @Test
    public void testSourcesAreIndependent() throws ParseException {
        FlowAnalysis analysis = new FlowAnalysis();
        CollectedResults first = analysis.analyze("first", "# fp a: high.\nb = a\n");
        CollectedResults second = analysis.analyze("second", "b = a\n");
        assertTrue(first.hasViolations());
        assertFalse(second.hasViolations());
    }
}
