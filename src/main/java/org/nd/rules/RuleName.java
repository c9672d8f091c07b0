package org.nd.rules;

import java.util.Locale;

/**
 * Nomi delle regole della deduzione naturale e delle righe assunte.
 *
 * Ogni voce riporta l'abbreviazione dei manuali (A, MPP, MTT, DN, &amp;I, &amp;E,
 * vI, vE, CP, RAA) usata nella stampa delle prove e accettata dalla riga di comando.
 */
public enum RuleName {

    ASSUMPTION("A", Kind.ASSUMPTION),
    OR_ELIMINATION_HYPOTHESIS("A (vE)", Kind.HYPOTHESIS),
    CONDITIONAL_PROOF_HYPOTHESIS("A (CP)", Kind.HYPOTHESIS),
    REDUCTIO_HYPOTHESIS("A (RAA)", Kind.HYPOTHESIS),

    MODUS_PONENS("MPP", Kind.FLAT),
    MODUS_TOLLENS("MTT", Kind.FLAT),
    DOUBLE_NEGATION_ELIMINATION("DNE", Kind.FLAT),
    DOUBLE_NEGATION_INTRODUCTION("DNI", Kind.FLAT),
    AND_INTRODUCTION("&I", Kind.FLAT),
    AND_ELIMINATION("&E", Kind.FLAT),
    OR_INTRODUCTION("vI", Kind.FLAT),

    OR_ELIMINATION("vE", Kind.SUB_PROOF),
    CONDITIONAL_PROOF("CP", Kind.SUB_PROOF),
    REDUCTIO_AD_ABSURDUM("RAA", Kind.SUB_PROOF);

    /**
     * Ruolo della voce nel motore di ricerca.
     */
    public enum Kind {
        ASSUMPTION,     // Assunzione iniziale
        HYPOTHESIS,     // Ipotesi temporanea di un sotto-ragionamento
        FLAT,           // Regola che lavora solo sulle righe visibili
        SUB_PROOF       // Regola che apre uno o più scope
    }

    private final String symbol;
    private final Kind kind;

    RuleName(String symbol, Kind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    public String symbol() {
        return symbol;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isHypothesis() {
        return kind == Kind.HYPOTHESIS;
    }

    /**
     * @return true per assunzioni iniziali e ipotesi
     */
    public boolean isAssumed() {
        return kind == Kind.ASSUMPTION || kind == Kind.HYPOTHESIS;
    }

    /**
     * @return true se la voce è una regola di inferenza configurabile nella strategia
     */
    public boolean isInferenceRule() {
        return kind == Kind.FLAT || kind == Kind.SUB_PROOF;
    }

    /**
     * Riconosce una regola dal nome della costante o dalla sua abbreviazione.
     * Il confronto ignora maiuscole/minuscole e spazi ai bordi.
     *
     * @param label es. "MODUS_PONENS", "mpp", "&amp;I"
     * @return regola corrispondente
     * @throws IllegalArgumentException se l'etichetta non corrisponde a nessuna voce
     */
    public static RuleName fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Nome regola vuoto");
        }
        String normalized = label.trim();
        for (RuleName rule : values()) {
            if (rule.name().equalsIgnoreCase(normalized) || rule.symbol.equalsIgnoreCase(normalized)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Regola sconosciuta: " + label.toUpperCase(Locale.ROOT));
    }
}
