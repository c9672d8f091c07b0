package org.nd.support;

import org.nd.formula.Formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * RIGA DI PROVA - Voce immutabile del registro della dimostrazione
 *
 * COMPONENTI:
 * - Numero di riga (1-based, unico e crescente nel registro)
 * - Formula affermata
 * - Insieme delle dipendenze: numeri delle assunzioni/ipotesi su cui la riga poggia,
 *   ordinato in modo crescente e senza duplicati
 * - Giustificazione: regola e righe citate
 * - Profondità di scope: 0 nella prova esterna, &gt;0 dentro un sotto-ragionamento
 *
 * @param number numero della riga
 * @param formula formula affermata
 * @param dependencies dipendenze (normalizzate in ordine crescente)
 * @param justification regola e righe citate
 * @param depth profondità di scope
 */
public record ProofLine(int number, Formula formula, List<Integer> dependencies,
                        Justification justification, int depth) {

    public ProofLine {
        if (number < 1) {
            throw new IllegalArgumentException("Numero di riga deve essere positivo: " + number);
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Profondità di scope negativa: " + depth);
        }
        Objects.requireNonNull(formula, "Formula non può essere null");
        Objects.requireNonNull(justification, "Giustificazione non può essere null");
        dependencies = List.copyOf(new TreeSet<>(Objects.requireNonNull(dependencies, "Dipendenze non possono essere null")));
    }

    /**
     * @return true se la riga è un'assunzione iniziale o un'ipotesi di sotto-ragionamento
     */
    public boolean isAssumed() {
        return justification.rule().isAssumed();
    }

    /**
     * Unione delle dipendenze delle righe indicate, ordinata e senza duplicati.
     *
     * @param lines righe citate
     * @return unione delle dipendenze
     */
    public static List<Integer> unionOf(Collection<ProofLine> lines) {
        TreeSet<Integer> union = new TreeSet<>();
        for (ProofLine line : lines) {
            union.addAll(line.dependencies());
        }
        return new ArrayList<>(union);
    }

    /**
     * Unione delle dipendenze senza le ipotesi scaricate.
     *
     * @param lines righe citate
     * @param discharged numeri delle ipotesi da rimuovere
     * @return dipendenze risultanti dopo lo scarico
     */
    public static List<Integer> unionDischarging(Collection<ProofLine> lines, Collection<Integer> discharged) {
        List<Integer> union = unionOf(lines);
        union.removeAll(discharged);
        return union;
    }

    @Override
    public String toString() {
        String deps = dependencies.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return String.format("%d: %s [%s] %s", number, formula, deps, justification);
    }
}
