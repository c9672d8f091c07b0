package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Risultato di un'applicazione di regola: la riga ancora da registrare.
 *
 * @param formula formula prodotta
 * @param rule regola applicata
 * @param citedLines righe citate, nell'ordine in cui la regola le consuma
 * @param dependencies dipendenze della nuova riga
 */
public record Derivation(Formula formula, RuleName rule, List<Integer> citedLines, List<Integer> dependencies) {

    public Derivation {
        Objects.requireNonNull(formula, "Formula prodotta non può essere null");
        Objects.requireNonNull(rule, "Regola non può essere null");
        citedLines = List.copyOf(citedLines);
        dependencies = List.copyOf(dependencies);
    }

    /**
     * Derivazione senza scarico di ipotesi: le dipendenze sono l'unione di quelle citate.
     */
    public static Derivation of(Formula formula, RuleName rule, ProofLine... cited) {
        List<ProofLine> lines = List.of(cited);
        return new Derivation(formula, rule, numbersOf(lines), ProofLine.unionOf(lines));
    }

    /**
     * Derivazione che scarica le ipotesi indicate.
     */
    public static Derivation discharging(Formula formula, RuleName rule, List<ProofLine> cited, Collection<Integer> discharged) {
        return new Derivation(formula, rule, numbersOf(cited), ProofLine.unionDischarging(cited, discharged));
    }

    private static List<Integer> numbersOf(List<ProofLine> lines) {
        List<Integer> numbers = new ArrayList<>();
        for (ProofLine line : lines) {
            numbers.add(line.number());
        }
        return numbers;
    }
}
