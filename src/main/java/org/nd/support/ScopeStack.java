package org.nd.support;

import org.nd.formula.Formula;
import org.nd.rules.Goal;
import org.nd.rules.RuleName;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import java.util.logging.Logger;

/**
 * STACK DEGLI SCOPE - Catena dei sotto-ragionamenti aperti
 *
 * ORGANIZZAZIONE:
 * - Indice 0: scope radice (prova esterna, sempre presente, mai rimosso)
 * - Indice i&gt;0: scope aperto da un'ipotesi alla profondità i
 *
 * VISIBILITÀ:
 * Una riga è citabile solo se appartiene a uno scope della catena aperta. Le righe di
 * uno scope chiuso diventano invisibili: l'unico modo di usarne il contenuto
 * all'esterno è la riga prodotta dalla regola che lo scarica.
 *
 * INVARIANTI:
 * - size() &gt;= 1
 * - chiusura sempre dall'ultimo scope aperto
 */
public class ScopeStack {

    private static final Logger LOGGER = Logger.getLogger(ScopeStack.class.getName());

    private final Stack<Scope> scopes = new Stack<>();

    public ScopeStack(Scope root) {
        if (root == null || !root.isRoot()) {
            throw new IllegalArgumentException("Lo stack deve partire da uno scope radice");
        }
        scopes.push(root);
    }

    //region APERTURA E CHIUSURA

    /**
     * Apre uno scope annidato sopra quello corrente.
     *
     * @param scope scope con profondità pari a {@link #depth()} + 1
     */
    public void push(Scope scope) {
        if (scope.getDepth() != depth() + 1) {
            throw new IllegalArgumentException(String.format(
                    "Profondità scope non valida: attesa %d, ricevuta %d", depth() + 1, scope.getDepth()));
        }
        scopes.push(scope);
        LOGGER.fine(String.format("Scope aperto a profondità %d con ipotesi %s",
                scope.getDepth(), scope.getHypothesis().formula()));
    }

    /**
     * Chiude lo scope più interno.
     *
     * @return scope chiuso
     * @throws IllegalStateException se resta solo lo scope radice
     */
    public Scope pop() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Lo scope radice non può essere chiuso");
        }
        Scope closed = scopes.pop();
        LOGGER.fine("Scope chiuso a profondità " + closed.getDepth());
        return closed;
    }

    //endregion

    //region INTERROGAZIONE

    public Scope current() {
        return scopes.peek();
    }

    /**
     * @return profondità dello scope corrente (0 = prova esterna)
     */
    public int depth() {
        return scopes.size() - 1;
    }

    /**
     * Righe citabili nello stato corrente, in ordine crescente di numero.
     * Le righe degli scope più interni hanno sempre numeri maggiori di quelle
     * degli scope esterni, quindi basta concatenarle dalla radice.
     *
     * @return righe visibili
     */
    public List<ProofLine> visibleLines() {
        List<ProofLine> visible = new ArrayList<>();
        for (Scope scope : scopes) {
            visible.addAll(scope.getLines());
        }
        return visible;
    }

    /**
     * @param formula formula cercata
     * @return true se una riga visibile afferma già la formula
     */
    public boolean isVisible(Formula formula) {
        for (Scope scope : scopes) {
            if (scope.holds(formula)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param orLine numero di riga di una disgiunzione
     * @return true se uno scope aperto sta già analizzando i casi di quella disgiunzione
     */
    public boolean isCaseSplitOpen(int orLine) {
        for (Scope scope : scopes) {
            Integer source = scope.getCaseSplitSource();
            if (source != null && source == orLine) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param rule regola che aprirebbe lo scope
     * @param hypothesis ipotesi che verrebbe assunta
     * @param goal obiettivo del sotto-ragionamento
     * @return true se la catena contiene già uno scope identico
     */
    public boolean isHypothesisOpen(RuleName rule, Formula hypothesis, Goal goal) {
        for (Scope scope : scopes) {
            if (scope.isRoot()) {
                continue;
            }
            if (scope.getOpeningRule() == rule
                    && scope.getHypothesis().formula().equals(hypothesis)
                    && scope.getGoal().equals(goal)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param rule regola che ha aperto gli scope
     * @param goal obiettivo degli scope
     * @return numero di scope aperti nella catena con quella regola e quell'obiettivo
     */
    public int countOpen(RuleName rule, Goal goal) {
        int count = 0;
        for (Scope scope : scopes) {
            if (!scope.isRoot() && scope.getOpeningRule() == rule && scope.getGoal().equals(goal)) {
                count++;
            }
        }
        return count;
    }

    //endregion
}
