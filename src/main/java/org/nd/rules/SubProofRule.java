package org.nd.rules;

import java.util.List;

/**
 * Regola che apre scope con ipotesi temporanee e li scarica al termine.
 */
public interface SubProofRule extends InferenceRule {

    /**
     * Sotto-ragionamenti che la regola può aprire per avvicinarsi all'obiettivo corrente.
     *
     * @param context stato corrente della prova
     * @param goal obiettivo dello scope corrente
     * @return piani in ordine di preferenza
     */
    List<SubProofPlan> plans(RuleContext context, Goal goal);

    /**
     * Produce la riga che scarica le ipotesi dopo che tutti i rami hanno avuto successo.
     *
     * @param plan piano eseguito
     * @param outcomes esiti dei rami, nello stesso ordine di {@link SubProofPlan#branches()}
     * @return derivazione con le ipotesi rimosse dalle dipendenze
     */
    Derivation discharge(SubProofPlan plan, List<BranchOutcome> outcomes);
}
