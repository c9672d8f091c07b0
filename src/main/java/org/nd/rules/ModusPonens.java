package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Implies;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Modus ponens: da (P -&gt; Q) e P si deriva Q.
 */
public class ModusPonens implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.MODUS_PONENS;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        List<ProofLine> visible = context.visibleLines();
        for (ProofLine major : visible) {
            if (!(major.formula() instanceof Implies implication)) {
                continue;
            }
            for (ProofLine minor : visible) {
                if (minor.formula().equals(implication.antecedent())) {
                    found.add(Derivation.of(implication.consequent(), name(), major, minor));
                }
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 2
                && cited.get(0) instanceof Implies implication
                && implication.antecedent().equals(cited.get(1))
                && implication.consequent().equals(conclusion);
    }
}
