package analysis.flow;

import java.util.Map;
import java.util.Set;

import junit.framework.TestCase;
import lang.ast.Constant;
import analysis.flow.label.Label;
import analysis.flow.violation.ExplicitFlowViolation;
import analysis.flow.violation.FlowVariable;
import analysis.flow.violation.UnsupportedConstruct;

public class TestSecurityState extends TestCase {

    public static void testCopyIsolatesRulesAndPc() {
        SecurityState original = new SecurityState();
        original.declare("a: high.");
        original.raisePc(Label.setOf("L"));

        SecurityState copy = original.copy();
        copy.declare("a: low. b: med.");
        copy.raisePc(Label.setOf("M"));

        assertEquals(Label.setOf("high"), original.getLabels("a"));
        assertTrue(original.getLabels("b").isEmpty());
        assertEquals(Label.setOf("L"), original.getPc());

        assertEquals(Label.setOf("high", "low"), copy.getLabels("a"));
        assertEquals(Label.setOf("L", "M"), copy.getPc());
    }

    public static void testCopySharesSink() {
        SecurityState original = new SecurityState();
        SecurityState copy = original.copy().copy();
        assertSame(original.getSink(), copy.getSink());

        Constant node = new Constant(3, "1");
        copy.record(new ExplicitFlowViolation(node, copy, new FlowVariable("x", Label.setOf()), Label.setOf("h"), ""));
        copy.note(new UnsupportedConstruct(node, "not analyzed"));
        assertEquals(1, original.getSink().getViolations().size());
        assertEquals(1, original.getSink().getUnsupported().size());
        assertFalse(original.getSink().isEmpty());
    }

    public static void testCopyResetsUsedNames() {
        SecurityState state = new SecurityState();
        state.markUsed("a");
        assertTrue(state.copy().getUsedNames().isEmpty());
        assertEquals(state.getUsedNames(), state.snapshot().getUsedNames());

        SecurityState snapshot = state.snapshot();
        snapshot.markUsed("b");
        assertFalse(state.getUsedNames().contains("b"));
    }

    public static void testUsedLabels() {
        SecurityState state = new SecurityState();
        state.declare("a: high. d: med.");
        state.markUsed("a");
        state.markUsed("b");

        SecurityState other = state.copy();
        other.markUsed("d");
        state.markUsed(other);

        assertEquals(Label.setOf("high", "med"), state.getUsedLabels());
        Map<String, Set<Label>> byName = state.getUsedLabelsByName();
        assertEquals(3, byName.size());
        assertEquals(Label.setOf("high"), byName.get("a"));
        assertTrue(byName.get("b").isEmpty());
        assertEquals(Label.setOf("med"), byName.get("d"));
    }

    public static void testMerge() {
        SecurityState scope = new SecurityState();
        scope.declare("x: secret.");
        scope.raisePc(Label.setOf("P"));

        SecurityState state = new SecurityState();
        state.declare("x: public.");
        state.merge(scope);

        assertEquals(Label.setOf("public", "secret"), state.getLabels("x"));
        assertEquals(Label.setOf("P"), state.getPc());
        assertNotSame(scope.getSink(), state.getSink());
    }

    public static void testPcOnlyGrows() {
        SecurityState state = new SecurityState();
        state.raisePc(Label.setOf("a"));
        state.raisePc(Label.setOf());
        state.raisePc(Label.setOf("b"));
        assertEquals(Label.setOf("a", "b"), state.getPc());
        try {
            state.getPc().clear();
            fail("The program counter must not be modifiable through its getter");
        }
        catch (UnsupportedOperationException e) {
            // expected
        }
    }
}
