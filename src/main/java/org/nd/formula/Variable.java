package org.nd.formula;

import java.util.List;

/**
 * Variabile proposizionale atomica.
 *
 * @param name nome della variabile (lettere maiuscole, non vuoto)
 */
public record Variable(String name) implements Formula {

    public Variable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isLetter(name.charAt(i))) {
                throw new IllegalArgumentException("Nome variabile non alfabetico: " + name);
            }
        }
    }

    @Override
    public Type type() {
        return Type.VARIABLE;
    }

    @Override
    public List<Formula> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return name;
    }
}
