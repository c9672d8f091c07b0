package org.nd.formula;

import java.util.List;
import java.util.Objects;

/**
 * Implicazione (L -&gt; R), associativa a destra nel testo.
 *
 * @param antecedent antecedente
 * @param consequent conseguente
 */
public record Implies(Formula antecedent, Formula consequent) implements Formula {

    public Implies {
        Objects.requireNonNull(antecedent, "Antecedente non può essere null");
        Objects.requireNonNull(consequent, "Conseguente non può essere null");
    }

    @Override
    public Type type() {
        return Type.IMPLIES;
    }

    @Override
    public List<Formula> children() {
        return List.of(antecedent, consequent);
    }

    @Override
    public String toString() {
        return "(" + antecedent + " -> " + consequent + ")";
    }
}
