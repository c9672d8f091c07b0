package org.nd.engine;

import org.nd.rules.RuleName;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * STATISTICHE DI RICERCA - Metriche di un tentativo di prova
 *
 * Raccoglie i contatori del motore durante la ricerca: passi consumati, righe
 * derivate, sotto-ragionamenti aperti/scaricati/abbandonati, profondità massima
 * raggiunta e uso delle singole regole. Il timer parte alla costruzione.
 */
public class SearchStatistics {

    //region CONTATORI

    /** Passi consumati: righe aggiunte al registro, ipotesi comprese */
    private int steps = 0;

    /** Righe prodotte da regole senza scope */
    private int flatDerivations = 0;

    /** Scope aperti (uno per ramo) */
    private int subProofsOpened = 0;

    /** Sotto-ragionamenti conclusi con una riga di scarico */
    private int subProofsDischarged = 0;

    /** Sotto-ragionamenti abbandonati e rimossi dal registro */
    private int subProofsAbandoned = 0;

    /** Profondità di scope massima raggiunta */
    private int deepestScope = 0;

    /** Righe della prova restituita */
    private int proofLength = 0;

    private final Map<RuleName, Integer> ruleUsage = new EnumMap<>(RuleName.class);

    //endregion

    //region TIMING

    private final long startTime;
    private long elapsedMs = 0;
    private boolean timerStopped = false;

    //endregion

    public SearchStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public void incrementSteps() {
        steps++;
    }

    /**
     * Registra una riga prodotta da una regola.
     *
     * @param rule regola applicata
     */
    public void recordDerivation(RuleName rule) {
        if (rule.kind() == RuleName.Kind.FLAT) {
            flatDerivations++;
        }
        ruleUsage.merge(rule, 1, Integer::sum);
    }

    /**
     * @param depth profondità dello scope appena aperto
     */
    public void recordScopeOpened(int depth) {
        subProofsOpened++;
        deepestScope = Math.max(deepestScope, depth);
    }

    public void incrementSubProofsDischarged() {
        subProofsDischarged++;
    }

    public void incrementSubProofsAbandoned() {
        subProofsAbandoned++;
    }

    public void setProofLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Lunghezza prova non può essere negativa: " + length);
        }
        this.proofLength = length;
    }

    //endregion

    //region TIMER

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            elapsedMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo trascorso in ms (parziale se il timer è ancora attivo)
     */
    public long getElapsedMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return elapsedMs;
    }

    //endregion

    //region ACCESSORS

    public int getSteps() {
        return steps;
    }

    public int getFlatDerivations() {
        return flatDerivations;
    }

    public int getSubProofsOpened() {
        return subProofsOpened;
    }

    public int getSubProofsDischarged() {
        return subProofsDischarged;
    }

    public int getSubProofsAbandoned() {
        return subProofsAbandoned;
    }

    public int getDeepestScope() {
        return deepestScope;
    }

    public int getProofLength() {
        return proofLength;
    }

    /**
     * @param rule regola
     * @return numero di righe prodotte dalla regola durante la ricerca, anche se poi scartate
     */
    public int getRuleUsage(RuleName rule) {
        return ruleUsage.getOrDefault(rule, 0);
    }

    public Map<RuleName, Integer> getRuleUsage() {
        return Collections.unmodifiableMap(ruleUsage);
    }

    //endregion

    /**
     * Report testuale delle statistiche.
     */
    @Override
    public String toString() {
        StringBuilder report = new StringBuilder();
        report.append("Passi consumati: ").append(steps).append("\n");
        report.append("Righe della prova: ").append(proofLength).append("\n");
        report.append("Derivazioni dirette: ").append(flatDerivations).append("\n");
        report.append("Sotto-ragionamenti aperti: ").append(subProofsOpened).append("\n");
        report.append("Sotto-ragionamenti scaricati: ").append(subProofsDischarged).append("\n");
        report.append("Sotto-ragionamenti abbandonati: ").append(subProofsAbandoned).append("\n");
        report.append("Profondità massima: ").append(deepestScope).append("\n");
        report.append("Tempo: ").append(getElapsedMs()).append(" ms\n");
        if (!ruleUsage.isEmpty()) {
            report.append("Uso delle regole:");
            ruleUsage.forEach((rule, count) -> report.append(" ").append(rule.symbol()).append("=").append(count));
            report.append("\n");
        }
        return report.toString();
    }
}
