package org.nd.engine;

import org.nd.support.ProofLine;

import java.util.List;
import java.util.Objects;

/**
 * RISULTATO DI PROVA - Esito immutabile di un tentativo
 *
 * ESITI:
 * - Trovata: righe della prova completa, dalla prima assunzione alla conclusione
 * - Esaurita: motivo dell'esaurimento, nessuna riga (la ricerca non restituisce prove parziali)
 *
 * L'esaurimento è un esito normale e non un'eccezione: il chiamante può
 * ritentare con un budget maggiore o un'altra priorità delle regole.
 */
public class ProofResult {

    private final List<ProofLine> lines;
    private final ExhaustionReason reason;
    private final SearchStatistics statistics;

    private ProofResult(List<ProofLine> lines, ExhaustionReason reason, SearchStatistics statistics) {
        this.lines = lines;
        this.reason = reason;
        this.statistics = statistics != null ? statistics : new SearchStatistics();
    }

    /**
     * @param lines righe della prova (non vuote)
     * @param statistics metriche della ricerca
     * @return risultato positivo
     * @throws IllegalArgumentException se le righe sono null o vuote
     */
    public static ProofResult found(List<ProofLine> lines, SearchStatistics statistics) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("Una prova trovata richiede almeno una riga");
        }
        return new ProofResult(List.copyOf(lines), null, statistics);
    }

    /**
     * @param reason motivo dell'esaurimento
     * @param statistics metriche della ricerca
     * @return risultato negativo
     */
    public static ProofResult exhausted(ExhaustionReason reason, SearchStatistics statistics) {
        Objects.requireNonNull(reason, "Motivo dell'esaurimento non può essere null");
        return new ProofResult(List.of(), reason, statistics);
    }

    public boolean isFound() {
        return reason == null;
    }

    public boolean isExhausted() {
        return reason != null;
    }

    /**
     * @return fase terminale del tentativo: {@link SearchPhase#FOUND} o {@link SearchPhase#EXHAUSTED}
     */
    public SearchPhase getPhase() {
        return isFound() ? SearchPhase.FOUND : SearchPhase.EXHAUSTED;
    }

    /**
     * @return righe della prova, vuota se la ricerca è esaurita
     */
    public List<ProofLine> getLines() {
        return lines;
    }

    /**
     * @return motivo dell'esaurimento, null se la prova è stata trovata
     */
    public ExhaustionReason getReason() {
        return reason;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return ultima riga della prova (la conclusione)
     * @throws IllegalStateException se la ricerca è esaurita
     */
    public ProofLine getConclusionLine() {
        if (!isFound()) {
            throw new IllegalStateException("Nessuna prova: ricerca esaurita (" + reason.getDescription() + ")");
        }
        return lines.get(lines.size() - 1);
    }

    /**
     * @return riepilogo compatto per il logging
     */
    public String toCompactString() {
        return String.format("ProofResult{%s, righe=%d, passi=%d, tempo=%dms}",
                isFound() ? "TROVATA" : "ESAURITA: " + reason.getDescription(),
                lines.size(),
                statistics.getSteps(),
                statistics.getElapsedMs());
    }

    @Override
    public String toString() {
        return toCompactString();
    }
}
