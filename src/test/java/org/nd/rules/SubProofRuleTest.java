package org.nd.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;
import org.nd.formula.Formula;
import org.nd.parser.FormulaParser;
import org.nd.support.Justification;
import org.nd.support.ProofLine;

public class SubProofRuleTest {

    @Test
    public void testOrEliminationPlansOneCaseSplitPerDisjunction() {
        StubContext context = new StubContext().assume("P v Q").assume("P -> W").assume("Q -> W");
        List<SubProofPlan> plans = new OrElimination().plans(context, Goal.of(f("W")));

        assertEquals(1, plans.size());
        SubProofPlan plan = plans.get(0);
        assertEquals(f("W"), plan.conclusion());
        assertEquals(1, plan.caseSplitSource().number());
        assertEquals(f("P"), plan.branches().get(0).hypothesis());
        assertEquals(f("Q"), plan.branches().get(1).hypothesis());
        assertEquals(Goal.of(f("W")), plan.branches().get(1).goal());

        assertTrue(new OrElimination().plans(context, Goal.contradiction()).isEmpty());
    }

    @Test
    public void testOrEliminationDischargeRemovesBothHypotheses() {
        StubContext context = new StubContext().assume("P v Q").assume("P -> W").assume("Q -> W");
        SubProofPlan plan = new OrElimination().plans(context, Goal.of(f("W"))).get(0);

        ProofLine hypothesisP = hypothesis(4, "P", RuleName.OR_ELIMINATION_HYPOTHESIS);
        ProofLine witnessP = derived(5, "W", List.of(2, 4));
        ProofLine hypothesisQ = hypothesis(6, "Q", RuleName.OR_ELIMINATION_HYPOTHESIS);
        ProofLine witnessQ = derived(7, "W", List.of(3, 6));

        Derivation derivation = new OrElimination().discharge(plan, List.of(
                new BranchOutcome(hypothesisP, List.of(witnessP)),
                new BranchOutcome(hypothesisQ, List.of(witnessQ))));

        assertEquals(f("W"), derivation.formula());
        assertEquals(List.of(1, 4, 5, 6, 7), derivation.citedLines());
        assertEquals(List.of(1, 2, 3), derivation.dependencies());
        assertTrue(new OrElimination().justifies(f("W"), List.of(f("P v Q"), f("P"), f("W"), f("Q"), f("W"))));
        assertFalse(new OrElimination().justifies(f("W"), List.of(f("P v Q"), f("Q"), f("W"), f("P"), f("W"))));
    }

    @Test
    public void testConditionalProofCandidates() {
        StubContext context = new StubContext().assume("(A -> B) -> C");
        List<SubProofPlan> plans = new ConditionalProof().plans(context, Goal.of(f("(D -> E) & C")));

        assertEquals(2, plans.size());
        assertEquals(f("D -> E"), plans.get(0).conclusion());
        assertEquals(f("D"), plans.get(0).branches().get(0).hypothesis());
        assertEquals(Goal.of(f("E")), plans.get(0).branches().get(0).goal());
        assertEquals(f("A -> B"), plans.get(1).conclusion());
        assertNull(plans.get(1).caseSplitSource());
    }

    @Test
    public void testConditionalProofSkipsVisibleImplication() {
        StubContext context = new StubContext().assume("A -> B");
        assertTrue(new ConditionalProof().plans(context, Goal.of(f("A -> B"))).isEmpty());
    }

    @Test
    public void testConditionalProofDischarge() {
        SubProofPlan plan = new ConditionalProof().plans(new StubContext().assume("B"), Goal.of(f("A -> B"))).get(0);
        ProofLine hypothesis = hypothesis(2, "A", RuleName.CONDITIONAL_PROOF_HYPOTHESIS);
        ProofLine witness = new ProofLine(1, f("B"), List.of(1), Justification.assumption(), 0);

        Derivation derivation = new ConditionalProof().discharge(plan, List.of(new BranchOutcome(hypothesis, List.of(witness))));
        assertEquals(List.of(2, 1), derivation.citedLines());
        assertEquals(List.of(1), derivation.dependencies());
        assertTrue(new ConditionalProof().justifies(f("A -> B"), List.of(f("A"), f("B"))));
        assertFalse(new ConditionalProof().justifies(f("B -> A"), List.of(f("A"), f("B"))));
    }

    @Test
    public void testReductioAssumesNegatedGoal() {
        StubContext context = new StubContext().assume("~A -> B");
        List<SubProofPlan> plans = new ReductioAdAbsurdum().plans(context, Goal.of(f("A")));

        assertEquals(1, plans.size());
        assertEquals(f("~A"), plans.get(0).branches().get(0).hypothesis());
        assertTrue(plans.get(0).branches().get(0).goal().isContradiction());
        assertTrue(new ReductioAdAbsurdum().plans(context.openRefutations(2), Goal.contradiction()).isEmpty());
    }

    @Test
    public void testReductioSplitsOnVariablesInsideRefutation() {
        StubContext context = new StubContext().assume("~A -> B").openRefutations(1);
        List<SubProofPlan> plans = new ReductioAdAbsurdum().plans(context, Goal.contradiction());

        assertEquals(2, plans.size());
        assertEquals(f("~A"), plans.get(0).branches().get(0).hypothesis());
        assertEquals(f("A"), plans.get(0).conclusion());
        assertTrue(plans.get(0).branches().get(0).goal().isContradiction());
        assertEquals(f("~B"), plans.get(1).branches().get(0).hypothesis());
        assertEquals(f("B"), plans.get(1).conclusion());
    }

    @Test
    public void testReductioSplitSkipsDecidedVariables() {
        StubContext context = new StubContext().assume("A").assume("~B").assume("A -> C").openRefutations(1);
        List<SubProofPlan> plans = new ReductioAdAbsurdum().plans(context, Goal.contradiction());

        assertEquals(1, plans.size());
        assertEquals(f("~C"), plans.get(0).branches().get(0).hypothesis());
    }

    @Test
    public void testReductioDischargeAndRecheck() {
        SubProofPlan plan = new ReductioAdAbsurdum().plans(new StubContext().assume("C"), Goal.of(f("A"))).get(0);
        ProofLine hypothesis = hypothesis(2, "~A", RuleName.REDUCTIO_HYPOTHESIS);
        ProofLine positive = derived(3, "B", List.of(1, 2));
        ProofLine negative = derived(4, "~B", List.of(2));

        Derivation derivation = new ReductioAdAbsurdum().discharge(plan,
                List.of(new BranchOutcome(hypothesis, List.of(positive, negative))));
        assertEquals(f("A"), derivation.formula());
        assertEquals(List.of(2, 3, 4), derivation.citedLines());
        assertEquals(List.of(1), derivation.dependencies());

        assertTrue(new ReductioAdAbsurdum().justifies(f("A"), List.of(f("~A"), f("B"), f("~B"))));
        assertFalse(new ReductioAdAbsurdum().justifies(f("A"), List.of(f("~A"), f("B"), f("~C"))));
    }

    @Test
    public void testContradictionWitness() {
        StubContext context = new StubContext().assume("C").assume("~B").assume("B");
        List<ProofLine> witness = Goal.contradiction().findWitness(context).orElseThrow();
        assertEquals(3, witness.get(0).number());
        assertEquals(2, witness.get(1).number());
        assertTrue(Goal.contradiction().findWitness(new StubContext().assume("A")).isEmpty());
    }

    private static ProofLine hypothesis(int number, String text, RuleName marker) {
        return new ProofLine(number, f(text), List.of(number), Justification.hypothesis(marker), 1);
    }

    private static ProofLine derived(int number, String text, List<Integer> dependencies) {
        return new ProofLine(number, f(text), dependencies, new Justification(RuleName.MODUS_PONENS, List.of()), 1);
    }

    private static Formula f(String text) {
        return FormulaParser.parse(text);
    }
}
