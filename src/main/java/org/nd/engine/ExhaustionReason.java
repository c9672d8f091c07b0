package org.nd.engine;

/**
 * Motivo per cui una ricerca è terminata senza trovare la prova.
 */
public enum ExhaustionReason {
    STEP_BUDGET("budget di passi esaurito"),
    TIME_LIMIT("limite di tempo superato"),
    SEARCH_SPACE("nessuna regola produce nuove righe"),
    PROOF_LENGTH("lunghezza massima della prova raggiunta in ogni ramo");

    private final String description;

    ExhaustionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
