package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Not;
import org.nd.formula.Variable;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * RIDUZIONE ALL'ASSURDO
 *
 * Un sotto-ragionamento che assume ~P e raggiunge una contraddizione (R e ~R
 * entrambe visibili) si scarica in P.
 *
 * PIANI:
 * - Obiettivo formula G non visibile: ipotesi ~G
 * - Obiettivo contraddizione, dentro la prima riduzione della catena: per ogni
 *   variabile rilevante X con X e ~X non visibili, ipotesi ~X; lo scarico
 *   aggiunge X allo scope che cerca la contraddizione. Dentro uno scope aperto
 *   in questo modo non si apre un'altra riduzione su variabili.
 *
 * Righe citate: ipotesi ~P, riga R, riga ~R.
 */
public class ReductioAdAbsurdum implements SubProofRule {

    @Override
    public RuleName name() {
        return RuleName.REDUCTIO_AD_ABSURDUM;
    }

    @Override
    public List<SubProofPlan> plans(RuleContext context, Goal goal) {
        List<SubProofPlan> plans = new ArrayList<>();
        if (goal.isContradiction()) {
            if (context.openScopeCount(name(), Goal.contradiction()) == 1) {
                for (Formula formula : context.relevantFormulas()) {
                    if (formula instanceof Variable && !context.isVisible(formula)
                            && !context.isVisible(new Not(formula))) {
                        addPlan(context, formula, plans);
                    }
                }
            }
            return plans;
        }

        if (!context.isVisible(goal.formula())) {
            addPlan(context, goal.formula(), plans);
        }
        return plans;
    }

    private void addPlan(RuleContext context, Formula conclusion, List<SubProofPlan> plans) {
        Formula hypothesis = new Not(conclusion);
        if (context.isHypothesisOpen(name(), hypothesis, Goal.contradiction())) {
            return;
        }
        plans.add(new SubProofPlan(name(), List.of(
                new SubProofPlan.Branch(hypothesis, RuleName.REDUCTIO_HYPOTHESIS, Goal.contradiction())),
                conclusion, null));
    }

    @Override
    public Derivation discharge(SubProofPlan plan, List<BranchOutcome> outcomes) {
        if (outcomes.size() != 1 || outcomes.get(0).witness().size() != 2) {
            throw new IllegalArgumentException("La riduzione all'assurdo richiede un ramo concluso da una contraddizione");
        }
        BranchOutcome outcome = outcomes.get(0);
        ProofLine hypothesis = outcome.hypothesis();

        List<ProofLine> cited = List.of(hypothesis, outcome.witness().get(0), outcome.witness().get(1));
        return Derivation.discharging(plan.conclusion(), name(), cited, List.of(hypothesis.number()));
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 3
                && cited.get(0).equals(new Not(conclusion))
                && cited.get(2).equals(new Not(cited.get(1)));
    }

    @Override
    public List<Integer> dischargedPositions(int citedCount) {
        return List.of(0);
    }
}
