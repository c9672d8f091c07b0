package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.support.ProofLine;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sotto-ragionamento che una regola può aprire: uno o più rami, ciascuno con
 * un'ipotesi e un obiettivo, e la formula che la regola produrrà allo scarico.
 *
 * @param rule regola che apre gli scope
 * @param branches rami da esplorare in ordine
 * @param conclusion formula prodotta se tutti i rami raggiungono il loro obiettivo
 * @param caseSplitSource riga della disgiunzione analizzata, null se non è un'analisi per casi
 */
public record SubProofPlan(RuleName rule, List<Branch> branches, Formula conclusion, ProofLine caseSplitSource) {

    public SubProofPlan {
        Objects.requireNonNull(rule, "Regola non può essere null");
        Objects.requireNonNull(conclusion, "Conclusione non può essere null");
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("Un sotto-ragionamento richiede almeno un ramo");
        }
        branches = List.copyOf(branches);
    }

    /**
     * @return chiave che identifica il tentativo, usata per non ripeterlo nello stesso stato
     */
    public String key() {
        return rule.name() + "|" + (caseSplitSource == null ? "-" : caseSplitSource.number()) + "|"
                + branches.stream().map(Branch::toString).collect(Collectors.joining(";"))
                + "|" + conclusion;
    }

    /**
     * Ramo del sotto-ragionamento.
     *
     * @param hypothesis formula assunta all'apertura dello scope
     * @param hypothesisRule marcatore della riga di ipotesi
     * @param goal obiettivo da raggiungere dentro lo scope
     */
    public record Branch(Formula hypothesis, RuleName hypothesisRule, Goal goal) {

        public Branch {
            Objects.requireNonNull(hypothesis, "Ipotesi non può essere null");
            Objects.requireNonNull(goal, "Obiettivo non può essere null");
            if (hypothesisRule == null || !hypothesisRule.isHypothesis()) {
                throw new IllegalArgumentException("Marcatore di ipotesi non valido: " + hypothesisRule);
            }
        }

        @Override
        public String toString() {
            return hypothesis + "=>" + goal;
        }
    }
}
