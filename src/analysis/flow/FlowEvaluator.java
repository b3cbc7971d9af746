package analysis.flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lang.ast.Assign;
import lang.ast.Call;
import lang.ast.Comparison;
import lang.ast.ConditionalExpression;
import lang.ast.ExpressionStatement;
import lang.ast.For;
import lang.ast.FunctionDef;
import lang.ast.If;
import lang.ast.Module;
import lang.ast.Name;
import lang.ast.Node;
import lang.ast.NodeKind;
import lang.ast.Sequence;
import lang.ast.While;
import util.Logger;
import analysis.flow.label.Label;
import analysis.flow.violation.ExplicitFlowViolation;
import analysis.flow.violation.FlowVariable;
import analysis.flow.violation.ImplicitFlowViolation;
import analysis.flow.violation.UnsupportedConstruct;

/**
 * Walks a syntax tree propagating labels and checking every write. The handler for a node is chosen based on its
 * {@link NodeKind}. Each handler takes the state in effect at the node and returns the state after it, with the names
 * the node read marked as used. Violations are recorded in the sink shared by all states derived from the root state.
 * <p>
 * Children whose program counter or used names must not leak back to their siblings (statements of a block, branches,
 * sub-expressions) are evaluated against a {@link SecurityState#copy()}.
 */
public class FlowEvaluator {

    /**
     * Key of the top-level scope in the map of scope states
     */
    public static final String MODULE_SCOPE = "<module>";

    /**
     * Rules declared for each function, and for the top level under {@link #MODULE_SCOPE}
     */
    private final Map<String, SecurityState> scopeStates;
    /**
     * Statements being evaluated, innermost on top
     */
    private final Deque<Node> statements = new ArrayDeque<>();

    /**
     * Create an evaluator
     *
     * @param scopeStates map from function name (or {@link #MODULE_SCOPE}) to the state holding the rules declared
     *            for that scope
     */
    public FlowEvaluator(Map<String, SecurityState> scopeStates) {
        this.scopeStates = scopeStates;
    }

    /**
     * Analyze the given node
     *
     * @param node node to analyze
     * @param state state in effect at the node
     * @return state after the node
     */
    public SecurityState evaluate(Node node, SecurityState state) {
        switch (node.getKind()) {
        case MODULE:
            return flowModule((Module) node, state);
        case FUNCTION_DEF:
            return flowFunctionDef((FunctionDef) node, state);
        case IF:
            return flowIf((If) node, state);
        case WHILE:
            return flowWhile((While) node, state);
        case FOR:
            return flowFor((For) node, state);
        case ASSIGN:
            return flowAssign((Assign) node, state);
        case EXPRESSION_STATEMENT:
            return flowExpressionStatement((ExpressionStatement) node, state);
        case CALL:
            return flowCall((Call) node, state);
        case COMPARISON:
            return flowComparison((Comparison) node, state);
        case CONDITIONAL_EXPRESSION:
            return flowConditionalExpression((ConditionalExpression) node, state);
        case NAME:
            return flowName((Name) node, state);
        case SEQUENCE:
            return flowSequence((Sequence) node, state);
        case CONSTANT:
        case NO_OP:
            return state;
        case AUGMENTED_ASSIGN:
        case RETURN:
        case OPERATOR:
        case ATTRIBUTE:
        case SUBSCRIPT:
        default:
            return flowUnsupported(node, state);
        }
    }

    /**
     * Fold the rules declared for the top level into the state, then analyze the body
     */
    protected SecurityState flowModule(Module node, SecurityState state) {
        SecurityState declared = scopeStates.get(MODULE_SCOPE);
        if (declared != null) {
            state.merge(declared);
        }
        return flowBlock(node.getBody(), state);
    }

    /**
     * Fold the rules declared for the function into the state, then analyze the body
     */
    protected SecurityState flowFunctionDef(FunctionDef node, SecurityState state) {
        SecurityState declared = scopeStates.get(node.getName());
        if (declared != null) {
            Logger.println(2, "Analyzing " + node.getName() + " with declared " + declared.getRules().getRules());
            state.merge(declared);
        }
        return flowBlock(node.getBody(), state);
    }

    /**
     * Each statement is analyzed against its own copy of the state, siblings do not see each other's program counter
     * or used names
     *
     * @param body statements
     * @param state state in effect at the start of the block
     * @return <code>state</code>
     */
    protected SecurityState flowBlock(List<Node> body, SecurityState state) {
        for (Node statement : body) {
            statements.push(statement);
            try {
                evaluate(statement, state.copy());
            } finally {
                statements.pop();
            }
        }
        return state;
    }

    /**
     * The labels of the names read by the test are added to the program counter for both branches
     */
    protected SecurityState flowIf(If node, SecurityState state) {
        SecurityState test = evaluate(node.getTest(), state.copy());
        state.raisePc(test.getUsedLabels());
        flowBlock(node.getBody(), state);
        flowBlock(node.getOrelse(), state);
        return state;
    }

    protected SecurityState flowWhile(While node, SecurityState state) {
        SecurityState test = evaluate(node.getTest(), state.copy());
        state.raisePc(test.getUsedLabels());
        flowBlock(node.getBody(), state);
        flowBlock(node.getOrelse(), state);
        return state;
    }

    /**
     * The loop target is written with values of the iterated expression, which is also the test deciding whether the
     * body runs
     */
    protected SecurityState flowFor(For node, SecurityState state) {
        SecurityState iter = evaluate(node.getIter(), state.copy());
        evaluate(node.getTarget(), iter.snapshot());
        state.raisePc(iter.getUsedLabels());
        flowBlock(node.getBody(), state);
        flowBlock(node.getOrelse(), state);
        return state;
    }

    /**
     * Check every target against the value. A tuple or list target assigned a literal of the same length is checked
     * element by element, in every other case each target is checked against everything the value reads.
     */
    protected SecurityState flowAssign(Assign node, SecurityState state) {
        Node value = node.getValue();
        SecurityState valueState = state.copy();
        List<SecurityState> elementStates = null;
        if (value.getKind() == NodeKind.SEQUENCE) {
            elementStates = flowElements((Sequence) value, valueState);
        }
        else {
            valueState = evaluate(value, valueState);
        }

        for (Node target : node.getTargets()) {
            if (target.getKind() != NodeKind.SEQUENCE) {
                evaluate(target, valueState.snapshot());
                continue;
            }
            List<Node> targetElements = ((Sequence) target).getElements();
            if (elementStates != null && elementStates.size() == targetElements.size()) {
                for (int i = 0; i < targetElements.size(); i++) {
                    evaluate(targetElements.get(i), elementStates.get(i).snapshot());
                }
                continue;
            }
            String msg = "cannot match " + targetElements.size() + " targets to the value "
                    + (elementStates == null ? "" : "of length " + elementStates.size() + " ")
                    + "in \"" + node.getCode() + "\", each target is checked against the whole value";
            Logger.warn(node.getLine(), msg);
            state.note(new UnsupportedConstruct(node, msg));
            evaluate(target, valueState.snapshot());
        }
        return state;
    }

    protected SecurityState flowExpressionStatement(ExpressionStatement node, SecurityState state) {
        evaluate(node.getValue(), state.copy());
        return state;
    }

    /**
     * Calls are not followed into the callee. With a non-empty program counter the call may leak through its side
     * effects, this is reported as an implicit flow into the (untracked) callee. The names read by the arguments, and
     * any raise of the program counter inside them, carry over to the call.
     */
    protected SecurityState flowCall(Call node, SecurityState state) {
        SecurityState callee = evaluate(node.getFunc(), state.copy());
        state.markUsed(callee);
        if (!state.getPc().isEmpty()) {
            String calleeName = node.getFunc().getKind() == NodeKind.NAME ? ((Name) node.getFunc()).getId()
                    : node.getFunc().getCode();
            state.record(new ImplicitFlowViolation(node,
                                                   state,
                                                   FlowVariable.untracked(calleeName),
                                                   state.getPc(),
                                                   "Untracked function call with non-empty PC"));
        }
        for (Node arg : node.getArgs()) {
            SecurityState argState = evaluate(arg, state.copy());
            state.markUsed(argState);
            state.raisePc(argState.getPc());
        }
        return state;
    }

    protected SecurityState flowComparison(Comparison node, SecurityState state) {
        List<Node> operands = new ArrayList<>();
        operands.add(node.getLeft());
        operands.addAll(node.getComparators());
        for (Node operand : operands) {
            SecurityState operandState = evaluate(operand, state.copy());
            state.markUsed(operandState);
            state.raisePc(operandState.getPc());
        }
        return state;
    }

    /**
     * The test raises the program counter of this state, the branches are analyzed against copies and their used
     * names are not propagated
     */
    protected SecurityState flowConditionalExpression(ConditionalExpression node, SecurityState state) {
        SecurityState test = evaluate(node.getTest(), state.copy());
        state.raisePc(test.getUsedLabels());
        evaluate(node.getBody(), state.copy());
        evaluate(node.getOrelse(), state.copy());
        return state;
    }

    /**
     * A read marks the name used. A write is where flows are checked: the labels of the target must include the
     * labels of every used name (explicit flow) and the program counter (implicit flow).
     */
    protected SecurityState flowName(Name node, SecurityState state) {
        if (!node.isStore()) {
            state.markUsed(node.getId());
            return state;
        }

        Set<Label> targetLabels = state.getLabels(node.getId());
        FlowVariable target = new FlowVariable(node.getId(), targetLabels);
        Node statement = statements.isEmpty() ? node : statements.peek();

        Set<Label> missingExplicit = Label.missing(state.getUsedLabels(), targetLabels);
        if (!missingExplicit.isEmpty()) {
            state.record(new ExplicitFlowViolation(statement,
                                                   state,
                                                   target,
                                                   missingExplicit,
                                                   "Target missing labels " + missingExplicit));
        }
        Set<Label> missingImplicit = Label.missing(state.getPc(), targetLabels);
        if (!missingImplicit.isEmpty()) {
            state.record(new ImplicitFlowViolation(statement,
                                                   state,
                                                   target,
                                                   missingImplicit,
                                                   "Target missing PC labels " + missingImplicit));
        }
        return state;
    }

    /**
     * A literal reads everything its elements read. A target checks every element against this state.
     */
    protected SecurityState flowSequence(Sequence node, SecurityState state) {
        if (node.isStore()) {
            for (Node element : node.getElements()) {
                evaluate(element, state);
            }
            return state;
        }
        flowElements(node, state);
        return state;
    }

    /**
     * Analyze each element of a literal against its own copy of the state and add what it read (and any raise of the
     * program counter) to <code>state</code>
     *
     * @param node literal
     * @param state state to accumulate into
     * @return state after each element, in order
     */
    private List<SecurityState> flowElements(Sequence node, SecurityState state) {
        List<SecurityState> elementStates = new ArrayList<>();
        for (Node element : node.getElements()) {
            SecurityState elementState = evaluate(element, state.copy());
            state.markUsed(elementState);
            state.raisePc(elementState.getPc());
            elementStates.add(elementState);
        }
        return elementStates;
    }

    /**
     * Flows through the node are not analyzed. This is reported so the gap is visible, the analysis goes on.
     */
    protected SecurityState flowUnsupported(Node node, SecurityState state) {
        String msg = "Evaluator not implemented for " + node.getKind() + " \"" + node.getCode() + "\"";
        Logger.warn(node.getLine(), msg);
        state.note(new UnsupportedConstruct(node, msg));
        return state;
    }
}
