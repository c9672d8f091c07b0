package org.nd.formula;

import java.util.List;
import java.util.Objects;

/**
 * Disgiunzione (L v R).
 *
 * @param left operando sinistro
 * @param right operando destro
 */
public record Or(Formula left, Formula right) implements Formula {

    public Or {
        Objects.requireNonNull(left, "Operando sinistro non può essere null");
        Objects.requireNonNull(right, "Operando destro non può essere null");
    }

    @Override
    public Type type() {
        return Type.OR;
    }

    @Override
    public List<Formula> children() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " v " + right + ")";
    }
}
