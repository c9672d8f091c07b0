package org.nd.formula;

import java.util.List;
import java.util.Objects;

/**
 * Congiunzione (L &amp; R).
 *
 * @param left operando sinistro
 * @param right operando destro
 */
public record And(Formula left, Formula right) implements Formula {

    public And {
        Objects.requireNonNull(left, "Operando sinistro non può essere null");
        Objects.requireNonNull(right, "Operando destro non può essere null");
    }

    @Override
    public Type type() {
        return Type.AND;
    }

    @Override
    public List<Formula> children() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " & " + right + ")";
    }
}
