package org.nd.engine;

/**
 * Fasi di un tentativo di prova.
 *
 * TRANSIZIONI:
 * SEARCHING -&gt; SUB_PROOF_OPEN all'apertura di uno scope, e ritorno alla chiusura dell'ultimo;
 * SEARCHING -&gt; FOUND quando la conclusione compare a profondità 0;
 * qualsiasi fase -&gt; EXHAUSTED per budget, tempo o assenza di mosse.
 * FOUND ed EXHAUSTED sono terminali.
 */
public enum SearchPhase {
    SEARCHING,
    SUB_PROOF_OPEN,
    FOUND,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == FOUND || this == EXHAUSTED;
    }
}
