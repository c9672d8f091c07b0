package org.nd.support;

import org.nd.rules.RuleName;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Giustificazione di una riga: regola applicata e righe citate, nell'ordine
 * in cui la regola le consuma.
 *
 * @param rule regola che ha prodotto la riga
 * @param citedLines numeri delle righe citate (vuota per assunzioni e ipotesi)
 */
public record Justification(RuleName rule, List<Integer> citedLines) {

    public Justification {
        Objects.requireNonNull(rule, "Regola non può essere null");
        Objects.requireNonNull(citedLines, "Lista righe citate non può essere null");
        citedLines = List.copyOf(citedLines);
    }

    public static Justification assumption() {
        return new Justification(RuleName.ASSUMPTION, List.of());
    }

    public static Justification hypothesis(RuleName hypothesisRule) {
        if (!hypothesisRule.isHypothesis()) {
            throw new IllegalArgumentException("Regola non apre ipotesi: " + hypothesisRule);
        }
        return new Justification(hypothesisRule, List.of());
    }

    @Override
    public String toString() {
        if (citedLines.isEmpty()) {
            return rule.symbol();
        }
        return rule.symbol() + " " + citedLines.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
