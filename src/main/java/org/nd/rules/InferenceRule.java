package org.nd.rules;

import org.nd.formula.Formula;

import java.util.List;

/**
 * Regola di inferenza della deduzione naturale.
 *
 * Ogni regola espone il proprio nome e un controllo di correttezza indipendente
 * dalla ricerca: data la formula di una riga e le formule delle righe citate,
 * verifica che la regola la produca davvero. Le due specializzazioni
 * ({@link DerivationRule} e {@link SubProofRule}) aggiungono la parte di ricerca.
 */
public interface InferenceRule {

    RuleName name();

    /**
     * Ricontrolla un'applicazione della regola.
     *
     * @param conclusion formula della riga giustificata
     * @param cited formule delle righe citate, nell'ordine della giustificazione
     * @return true se la regola produce la formula a partire dalle righe citate
     */
    boolean justifies(Formula conclusion, List<Formula> cited);

    /**
     * Posizioni, nella lista delle righe citate, delle ipotesi scaricate da questa regola.
     *
     * @param citedCount numero di righe citate
     * @return indici delle ipotesi scaricate (vuoto per le regole che non aprono scope)
     */
    default List<Integer> dischargedPositions(int citedCount) {
        return List.of();
    }
}
