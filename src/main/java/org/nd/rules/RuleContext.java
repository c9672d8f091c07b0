package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.support.ProofLine;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Vista in sola lettura dello stato della prova offerta alle regole.
 */
public interface RuleContext {

    /**
     * @return righe citabili, in ordine crescente di numero
     */
    List<ProofLine> visibleLines();

    /**
     * @param formula formula cercata
     * @return prima riga visibile che afferma la formula
     */
    Optional<ProofLine> findVisible(Formula formula);

    default boolean isVisible(Formula formula) {
        return findVisible(formula).isPresent();
    }

    /**
     * Formule che le regole di introduzione possono costruire: sottoformule di
     * assunzioni, conclusione e ipotesi di riduzione all'assurdo, in ordine di scoperta.
     *
     * @return insieme ordinato delle formule rilevanti
     */
    Set<Formula> relevantFormulas();

    /**
     * @param orLine riga di una disgiunzione
     * @return true se uno scope aperto sta già analizzandone i casi
     */
    boolean isCaseSplitOpen(int orLine);

    /**
     * @return true se nella catena è già aperto uno scope con la stessa regola, ipotesi e obiettivo
     */
    boolean isHypothesisOpen(RuleName rule, Formula hypothesis, Goal goal);

    /**
     * @return numero di scope aperti nella catena dalla regola indicata verso l'obiettivo indicato
     */
    int openScopeCount(RuleName rule, Goal goal);
}
