package org.nd.parser;

import org.nd.formula.Formula;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Enunciato da dimostrare: assunzioni e conclusione.
 *
 * @param assumptions assunzioni nell'ordine in cui compaiono nel testo
 * @param conclusion formula da derivare
 */
public record Statement(List<Formula> assumptions, Formula conclusion) {

    public Statement {
        Objects.requireNonNull(assumptions, "Lista assunzioni non può essere null");
        Objects.requireNonNull(conclusion, "Conclusione non può essere null");
        assumptions = List.copyOf(assumptions);
    }

    /**
     * @return enunciato in forma testuale canonica, rileggibile dal parser
     */
    @Override
    public String toString() {
        return assumptions.stream().map(Formula::toString).collect(Collectors.joining(", "))
                + " / " + conclusion;
    }
}
