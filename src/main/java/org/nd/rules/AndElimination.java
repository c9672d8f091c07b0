package org.nd.rules;

import org.nd.formula.And;
import org.nd.formula.Formula;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Eliminazione della congiunzione: da (P &amp; Q) si derivano P e Q.
 */
public class AndElimination implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.AND_ELIMINATION;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        for (ProofLine line : context.visibleLines()) {
            if (line.formula() instanceof And conjunction) {
                found.add(Derivation.of(conjunction.left(), name(), line));
                found.add(Derivation.of(conjunction.right(), name(), line));
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 1
                && cited.get(0) instanceof And conjunction
                && (conjunction.left().equals(conclusion) || conjunction.right().equals(conclusion));
    }
}
