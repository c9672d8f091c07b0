package org.nd.rules;

import org.nd.formula.And;
import org.nd.formula.Formula;
import org.nd.formula.Implies;
import org.nd.formula.Or;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PROVA CONDIZIONALE - Introduzione dell'implicazione
 *
 * Un sotto-ragionamento che assume P e deriva Q si scarica in (P -&gt; Q),
 * togliendo l'ipotesi dalle dipendenze.
 *
 * OBIETTIVI CANDIDATI (in ordine):
 * 1. L'obiettivo corrente e, ricorsivamente, i componenti di congiunzioni e disgiunzioni
 * 2. Gli antecedenti non ancora visibili delle implicazioni visibili (servono al modus ponens)
 *
 * Tra questi si considerano solo le implicazioni non ancora derivate.
 *
 * Righe citate: ipotesi P, testimone Q (coincidono se Q è l'ipotesi stessa).
 */
public class ConditionalProof implements SubProofRule {

    @Override
    public RuleName name() {
        return RuleName.CONDITIONAL_PROOF;
    }

    @Override
    public List<SubProofPlan> plans(RuleContext context, Goal goal) {
        Set<Formula> candidates = new LinkedHashSet<>();
        if (!goal.isContradiction()) {
            collectGoalComponents(goal.formula(), candidates);
        }
        for (ProofLine line : context.visibleLines()) {
            if (line.formula() instanceof Implies implication && !context.isVisible(implication.antecedent())) {
                candidates.add(implication.antecedent());
            }
        }

        List<SubProofPlan> plans = new ArrayList<>();
        for (Formula candidate : candidates) {
            if (!(candidate instanceof Implies implication) || context.isVisible(implication)) {
                continue;
            }
            Goal branchGoal = Goal.of(implication.consequent());
            if (context.isHypothesisOpen(name(), implication.antecedent(), branchGoal)) {
                continue;
            }
            plans.add(new SubProofPlan(name(), List.of(
                    new SubProofPlan.Branch(implication.antecedent(), RuleName.CONDITIONAL_PROOF_HYPOTHESIS, branchGoal)),
                    implication, null));
        }
        return plans;
    }

    private static void collectGoalComponents(Formula formula, Set<Formula> candidates) {
        candidates.add(formula);
        if (formula instanceof And conjunction) {
            collectGoalComponents(conjunction.left(), candidates);
            collectGoalComponents(conjunction.right(), candidates);
        } else if (formula instanceof Or disjunction) {
            collectGoalComponents(disjunction.left(), candidates);
            collectGoalComponents(disjunction.right(), candidates);
        }
    }

    @Override
    public Derivation discharge(SubProofPlan plan, List<BranchOutcome> outcomes) {
        if (outcomes.size() != 1) {
            throw new IllegalArgumentException("La prova condizionale richiede esattamente un ramo");
        }
        BranchOutcome outcome = outcomes.get(0);
        ProofLine hypothesis = outcome.hypothesis();

        return Derivation.discharging(plan.conclusion(), name(),
                List.of(hypothesis, outcome.witness().get(0)), List.of(hypothesis.number()));
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 2 && conclusion.equals(new Implies(cited.get(0), cited.get(1)));
    }

    @Override
    public List<Integer> dischargedPositions(int citedCount) {
        return List.of(0);
    }
}
