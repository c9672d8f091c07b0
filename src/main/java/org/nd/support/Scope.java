package org.nd.support;

import org.nd.formula.Formula;
import org.nd.rules.Goal;
import org.nd.rules.RuleName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * SCOPE - Regione della prova aperta da un'ipotesi temporanea
 *
 * Ogni scope possiede l'ipotesi che lo ha aperto, l'obiettivo da raggiungere,
 * le righe derivate mentre è aperto e l'insieme delle formule che contiene
 * (per la deduplicazione). Lo scope radice (profondità 0) non ha ipotesi e
 * contiene assunzioni e righe della prova esterna.
 */
public class Scope {

    /** Profondità: 0 per lo scope radice */
    private final int depth;

    /** Riga dell'ipotesi, null per lo scope radice */
    private final ProofLine hypothesis;

    /** Regola che ha aperto lo scope, null per lo scope radice */
    private final RuleName openingRule;

    /** Riga della disgiunzione sotto analisi per i casi dell'eliminazione della disgiunzione */
    private final Integer caseSplitSource;

    /** Obiettivo del ragionamento dentro lo scope */
    private final Goal goal;

    private final List<ProofLine> lines = new ArrayList<>();

    private final Set<Formula> formulas = new HashSet<>();

    /** Chiavi dei sotto-ragionamenti già tentati in questo scope */
    private final Set<String> attempts = new HashSet<>();

    private Scope(int depth, ProofLine hypothesis, RuleName openingRule, Integer caseSplitSource, Goal goal) {
        this.depth = depth;
        this.hypothesis = hypothesis;
        this.openingRule = openingRule;
        this.caseSplitSource = caseSplitSource;
        this.goal = goal;
    }

    /**
     * @param goal conclusione della prova
     * @return scope radice, senza ipotesi
     */
    public static Scope root(Goal goal) {
        return new Scope(0, null, null, null, goal);
    }

    /**
     * Crea uno scope annidato. La riga di ipotesi non è ancora registrata:
     * va aggiunta con {@link #record(ProofLine)} subito dopo l'apertura.
     *
     * @param depth profondità (&gt; 0)
     * @param hypothesis riga dell'ipotesi
     * @param openingRule regola che apre lo scope
     * @param caseSplitSource riga della disgiunzione analizzata, oppure null
     * @param goal obiettivo del sotto-ragionamento
     * @return nuovo scope
     */
    public static Scope nested(int depth, ProofLine hypothesis, RuleName openingRule, Integer caseSplitSource, Goal goal) {
        if (depth < 1) {
            throw new IllegalArgumentException("Uno scope annidato deve avere profondità positiva");
        }
        if (hypothesis == null || openingRule == null) {
            throw new IllegalArgumentException("Uno scope annidato richiede ipotesi e regola di apertura");
        }
        return new Scope(depth, hypothesis, openingRule, caseSplitSource, goal);
    }

    /**
     * Registra una riga derivata mentre lo scope è aperto.
     *
     * @param line riga alla profondità di questo scope
     */
    public void record(ProofLine line) {
        if (line.depth() != depth) {
            throw new IllegalArgumentException(String.format(
                    "Riga %d a profondità %d registrata nello scope di profondità %d", line.number(), line.depth(), depth));
        }
        lines.add(line);
        formulas.add(line.formula());
    }

    public boolean holds(Formula formula) {
        return formulas.contains(formula);
    }

    /**
     * Segna un tentativo di sotto-ragionamento.
     *
     * @param key chiave del tentativo
     * @return true se il tentativo non era ancora stato fatto
     */
    public boolean markAttempt(String key) {
        return attempts.add(key);
    }

    public int getDepth() {
        return depth;
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public ProofLine getHypothesis() {
        return hypothesis;
    }

    public RuleName getOpeningRule() {
        return openingRule;
    }

    public Integer getCaseSplitSource() {
        return caseSplitSource;
    }

    public Goal getGoal() {
        return goal;
    }

    public List<ProofLine> getLines() {
        return Collections.unmodifiableList(lines);
    }
}
