package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Not;
import org.nd.support.ProofLine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Obiettivo di un ragionamento: una formula precisa, oppure una contraddizione
 * qualsiasi (R e ~R entrambe visibili) per la riduzione all'assurdo.
 */
public final class Goal {

    private static final Goal CONTRADICTION = new Goal(null);

    /** Formula da raggiungere, null per l'obiettivo contraddizione */
    private final Formula formula;

    private Goal(Formula formula) {
        this.formula = formula;
    }

    public static Goal of(Formula formula) {
        return new Goal(Objects.requireNonNull(formula, "Formula obiettivo non può essere null"));
    }

    public static Goal contradiction() {
        return CONTRADICTION;
    }

    public boolean isContradiction() {
        return formula == null;
    }

    /**
     * @return formula obiettivo
     * @throws IllegalStateException se l'obiettivo è una contraddizione
     */
    public Formula formula() {
        if (formula == null) {
            throw new IllegalStateException("L'obiettivo contraddizione non ha una formula");
        }
        return formula;
    }

    /**
     * Cerca tra le righe visibili quelle che realizzano l'obiettivo.
     *
     * @param context stato corrente della prova
     * @return una riga con la formula obiettivo, oppure la prima coppia R, ~R in ordine di riga
     */
    public Optional<List<ProofLine>> findWitness(RuleContext context) {
        if (formula != null) {
            return context.findVisible(formula).map(List::of);
        }
        for (ProofLine line : context.visibleLines()) {
            Optional<ProofLine> negation = context.findVisible(new Not(line.formula()));
            if (negation.isPresent()) {
                return Optional.of(List.of(line, negation.get()));
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Goal other)) return false;
        return Objects.equals(formula, other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(formula);
    }

    @Override
    public String toString() {
        return formula == null ? "contraddizione" : formula.toString();
    }
}
