package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Or;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * ELIMINAZIONE DELLA DISGIUNZIONE - Ragionamento per casi
 *
 * Da (P v Q), da un sotto-ragionamento che assume P e deriva R e da un secondo
 * che assume Q e deriva la stessa R, si deriva R. Le due ipotesi vengono
 * scaricate: le dipendenze della riga finale sono l'unione di quelle della
 * disgiunzione e dei due testimoni, senza le righe di ipotesi.
 *
 * I due rami devono convergere sulla stessa formula sintattica: l'obiettivo
 * dello scope corrente. Una disgiunzione già sotto analisi in uno scope aperto
 * non viene riaperta, altrimenti ogni caso ripeterebbe la stessa analisi.
 *
 * Righe citate: disgiunzione, ipotesi P, testimone del caso P, ipotesi Q, testimone del caso Q.
 */
public class OrElimination implements SubProofRule {

    @Override
    public RuleName name() {
        return RuleName.OR_ELIMINATION;
    }

    @Override
    public List<SubProofPlan> plans(RuleContext context, Goal goal) {
        List<SubProofPlan> plans = new ArrayList<>();
        if (goal.isContradiction() || context.isVisible(goal.formula())) {
            return plans;
        }

        for (ProofLine line : context.visibleLines()) {
            if (!(line.formula() instanceof Or disjunction) || context.isCaseSplitOpen(line.number())) {
                continue;
            }
            plans.add(new SubProofPlan(name(), List.of(
                    new SubProofPlan.Branch(disjunction.left(), RuleName.OR_ELIMINATION_HYPOTHESIS, goal),
                    new SubProofPlan.Branch(disjunction.right(), RuleName.OR_ELIMINATION_HYPOTHESIS, goal)),
                    goal.formula(), line));
        }
        return plans;
    }

    @Override
    public Derivation discharge(SubProofPlan plan, List<BranchOutcome> outcomes) {
        if (outcomes.size() != 2 || plan.caseSplitSource() == null) {
            throw new IllegalArgumentException("L'eliminazione della disgiunzione richiede due casi e una disgiunzione");
        }
        BranchOutcome left = outcomes.get(0);
        BranchOutcome right = outcomes.get(1);

        List<ProofLine> cited = List.of(plan.caseSplitSource(),
                left.hypothesis(), left.witness().get(0),
                right.hypothesis(), right.witness().get(0));
        return Derivation.discharging(plan.conclusion(), name(), cited,
                List.of(left.hypothesis().number(), right.hypothesis().number()));
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 5
                && cited.get(0).equals(new Or(cited.get(1), cited.get(3)))
                && cited.get(2).equals(conclusion)
                && cited.get(4).equals(conclusion);
    }

    @Override
    public List<Integer> dischargedPositions(int citedCount) {
        return List.of(1, 3);
    }
}
