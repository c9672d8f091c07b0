package org.nd.formula;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * FORMULA PROPOSIZIONALE - Unione chiusa delle cinque forme sintattiche
 *
 * Rappresenta una formula della logica proposizionale come albero immutabile e
 * finito. Le varianti sono esattamente cinque e la gerarchia è sigillata: ogni
 * regola di inferenza può quindi ragionare in modo esaustivo sul tipo del nodo.
 *
 * VARIANTI:
 * - {@link Variable}: variabile proposizionale (A, P, Q, ...)
 * - {@link Not}: negazione ~X
 * - {@link And}: congiunzione (X &amp; Y)
 * - {@link Or}: disgiunzione (X v Y)
 * - {@link Implies}: implicazione (X -&gt; Y)
 *
 * UGUAGLIANZA:
 * - Strutturale: stessa variante e sottoformule ricorsivamente uguali
 * - Nessuna normalizzazione: (A &amp; B) e (B &amp; A) sono formule distinte
 * - hashCode coerente con equals, usato per la deduplicazione delle righe
 *
 * La rappresentazione testuale ({@link #toString()}) è canonica: ogni operatore
 * binario è racchiuso tra parentesi, quindi il parser la rilegge senza ambiguità.
 */
public sealed interface Formula permits Variable, Not, And, Or, Implies {

    /**
     * Tipi di nodo supportati nell'albero della formula.
     */
    enum Type {
        VARIABLE,   // Variabile atomica: P, Q, R, ...
        NOT,        // Negazione: ~A
        AND,        // Congiunzione: A & B
        OR,         // Disgiunzione: A v B
        IMPLIES     // Implicazione: A -> B
    }

    /**
     * @return tipo del nodo radice della formula
     */
    Type type();

    /**
     * Sottoformule dirette, da sinistra a destra.
     *
     * @return lista vuota per le variabili, un elemento per la negazione, due per i connettivi binari
     */
    List<Formula> children();

    /**
     * Elenca tutte le sottoformule in pre-ordine (radice, poi figli da sinistra a destra),
     * senza duplicati. La formula stessa è sempre il primo elemento.
     *
     * @return insieme ordinato delle sottoformule
     */
    default Set<Formula> subformulas() {
        Set<Formula> collected = new LinkedHashSet<>();
        collectSubformulas(this, collected);
        return collected;
    }

    /**
     * @return variabili che compaiono nella formula, in ordine di prima apparizione
     */
    default Set<Variable> variables() {
        Set<Variable> variables = new LinkedHashSet<>();
        for (Formula subformula : subformulas()) {
            if (subformula instanceof Variable variable) {
                variables.add(variable);
            }
        }
        return variables;
    }

    /**
     * @return profondità dell'albero (1 per una variabile)
     */
    default int depth() {
        int deepestChild = 0;
        for (Formula child : children()) {
            deepestChild = Math.max(deepestChild, child.depth());
        }
        return deepestChild + 1;
    }

    /**
     * Costruisce la negazione di questa formula.
     *
     * @return ~this
     */
    default Formula negate() {
        return new Not(this);
    }

    private static void collectSubformulas(Formula formula, Set<Formula> collected) {
        if (!collected.add(formula)) {
            return;
        }
        for (Formula child : formula.children()) {
            collectSubformulas(child, collected);
        }
    }

    //region FACTORY

    static Variable var(String name) {
        return new Variable(name);
    }

    static Not not(Formula operand) {
        return new Not(operand);
    }

    static And and(Formula left, Formula right) {
        return new And(left, right);
    }

    static Or or(Formula left, Formula right) {
        return new Or(left, right);
    }

    static Implies implies(Formula antecedent, Formula consequent) {
        return new Implies(antecedent, consequent);
    }

    /**
     * Raccoglie le sottoformule di più formule mantenendo l'ordine di scoperta.
     *
     * @param formulas formule sorgente, nell'ordine desiderato
     * @return unione ordinata delle sottoformule
     */
    static Set<Formula> subformulasOf(List<? extends Formula> formulas) {
        Set<Formula> collected = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            collected.addAll(formula.subformulas());
        }
        return collected;
    }

    //endregion
}
