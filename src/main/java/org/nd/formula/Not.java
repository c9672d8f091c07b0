package org.nd.formula;

import java.util.List;
import java.util.Objects;

/**
 * Negazione ~X.
 *
 * @param operand formula negata
 */
public record Not(Formula operand) implements Formula {

    public Not {
        Objects.requireNonNull(operand, "Operando per negazione non può essere null");
    }

    @Override
    public Type type() {
        return Type.NOT;
    }

    @Override
    public List<Formula> children() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "~" + operand;
    }
}
