package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Not;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Eliminazione della doppia negazione: da ~~P si deriva P.
 */
public class DoubleNegationElimination implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.DOUBLE_NEGATION_ELIMINATION;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        for (ProofLine line : context.visibleLines()) {
            if (line.formula() instanceof Not outer && outer.operand() instanceof Not inner) {
                found.add(Derivation.of(inner.operand(), name(), line));
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 1 && cited.get(0).equals(new Not(new Not(conclusion)));
    }
}
