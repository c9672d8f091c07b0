package org.nd.support;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.nd.formula.Formula.var;

import java.util.List;

import org.junit.Test;
import org.nd.rules.Goal;
import org.nd.rules.RuleName;

public class ScopeStackTest {

    private final ScopeStack stack = new ScopeStack(Scope.root(Goal.of(var("W"))));

    @Test
    public void testInnerLinesVisibleOnlyWhileOpen() {
        stack.current().record(ProofLedgerTest.assumption(1, "A"));
        ProofLine hypothesis = hypothesis(2, "P", 1);
        openCaseSplit(hypothesis, 1);

        assertEquals(1, stack.depth());
        assertEquals(2, stack.visibleLines().size());
        assertTrue(stack.isVisible(var("P")));
        assertTrue(stack.isCaseSplitOpen(1));

        stack.pop();
        assertEquals(0, stack.depth());
        assertEquals(1, stack.visibleLines().size());
        assertFalse(stack.isVisible(var("P")));
        assertFalse(stack.isCaseSplitOpen(1));
    }

    @Test
    public void testHypothesisOpenInChain() {
        ProofLine hypothesis = hypothesis(1, "P", 1);
        Scope scope = Scope.nested(1, hypothesis, RuleName.CONDITIONAL_PROOF, null, Goal.of(var("Q")));
        stack.push(scope);
        scope.record(hypothesis);

        assertTrue(stack.isHypothesisOpen(RuleName.CONDITIONAL_PROOF, var("P"), Goal.of(var("Q"))));
        assertFalse(stack.isHypothesisOpen(RuleName.CONDITIONAL_PROOF, var("P"), Goal.of(var("R"))));
        assertFalse(stack.isHypothesisOpen(RuleName.REDUCTIO_AD_ABSURDUM, var("P"), Goal.of(var("Q"))));
        assertEquals(1, stack.countOpen(RuleName.CONDITIONAL_PROOF, Goal.of(var("Q"))));
        assertEquals(0, stack.countOpen(RuleName.REDUCTIO_AD_ABSURDUM, Goal.contradiction()));
    }

    @Test(expected = IllegalStateException.class)
    public void testRootCannotBePopped() {
        stack.pop();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPushRequiresNextDepth() {
        stack.push(Scope.nested(2, hypothesis(1, "P", 2), RuleName.CONDITIONAL_PROOF, null, Goal.of(var("Q"))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testScopeRejectsLineAtOtherDepth() {
        stack.current().record(hypothesis(1, "P", 1));
    }

    @Test
    public void testAttemptsAreRecordedOnce() {
        assertTrue(stack.current().markAttempt("CP|A"));
        assertFalse(stack.current().markAttempt("CP|A"));
    }

    private void openCaseSplit(ProofLine hypothesis, int orLine) {
        Scope scope = Scope.nested(1, hypothesis, RuleName.OR_ELIMINATION, orLine, Goal.of(var("W")));
        stack.push(scope);
        scope.record(hypothesis);
    }

    private static ProofLine hypothesis(int number, String name, int depth) {
        return new ProofLine(number, var(name), List.of(number),
                Justification.hypothesis(RuleName.OR_ELIMINATION_HYPOTHESIS), depth);
    }
}
