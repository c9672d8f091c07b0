package org.nd.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.nd.formula.Formula;
import org.nd.rules.Goal;
import org.nd.rules.RuleName;
import org.nd.rules.SubProofPlan;

public class SearchStateTest {

    private SearchState state;
    private SubProofPlan refutation;

    @Before
    public void setUp() {
        state = new SearchState(List.of(Formula.var("A")), Formula.var("B"), SearchConfiguration.defaults());
        refutation = new SubProofPlan(RuleName.REDUCTIO_AD_ABSURDUM,
                List.of(new SubProofPlan.Branch(Formula.not(Formula.var("B")), RuleName.REDUCTIO_HYPOTHESIS,
                        Goal.contradiction())),
                Formula.var("B"), null);
    }

    @Test
    public void testPhaseFollowsScopes() {
        assertEquals(SearchPhase.SEARCHING, state.getPhase());

        state.openScope(refutation, refutation.branches().get(0));
        assertEquals(SearchPhase.SUB_PROOF_OPEN, state.getPhase());
        assertEquals(1, state.depth());
        assertEquals(1, state.openScopeCount(RuleName.REDUCTIO_AD_ABSURDUM, Goal.contradiction()));

        state.closeScope();
        assertEquals(SearchPhase.SEARCHING, state.getPhase());
        assertEquals(0, state.openScopeCount(RuleName.REDUCTIO_AD_ABSURDUM, Goal.contradiction()));

        state.finish(SearchPhase.EXHAUSTED);
        assertEquals(SearchPhase.EXHAUSTED, state.getPhase());
    }

    @Test
    public void testAbandonReturnsToSearching() {
        int checkpoint = state.checkpoint();
        state.openScope(refutation, refutation.branches().get(0));
        state.abandon(checkpoint, 0);

        assertEquals(SearchPhase.SEARCHING, state.getPhase());
        assertEquals(1, state.ledgerSnapshot().size());
        assertFalse(state.isVisible(Formula.not(Formula.var("B"))));
        assertEquals(1, state.getStatistics().getSteps());
    }

    @Test
    public void testLengthCapPrunesWithoutStopping() {
        SearchState capped = new SearchState(List.of(Formula.var("A")), Formula.var("B"),
                SearchConfiguration.builder().maxProofLength(1).build());

        assertFalse(capped.canStep());
        assertFalse(capped.isStopped());
        assertEquals(ExhaustionReason.PROOF_LENGTH, capped.exhaustionReason());
        assertEquals(ExhaustionReason.SEARCH_SPACE, state.exhaustionReason());
        assertTrue(state.canStep());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFinishRequiresTerminalPhase() {
        state.finish(SearchPhase.SUB_PROOF_OPEN);
    }
}
