package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Implies;
import org.nd.formula.Not;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Modus tollens: da (P -&gt; Q) e ~Q si deriva ~P.
 */
public class ModusTollens implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.MODUS_TOLLENS;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        List<ProofLine> visible = context.visibleLines();
        for (ProofLine major : visible) {
            if (!(major.formula() instanceof Implies implication)) {
                continue;
            }
            Not negatedConsequent = new Not(implication.consequent());
            for (ProofLine minor : visible) {
                if (minor.formula().equals(negatedConsequent)) {
                    found.add(Derivation.of(new Not(implication.antecedent()), name(), major, minor));
                }
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 2
                && cited.get(0) instanceof Implies implication
                && cited.get(1).equals(new Not(implication.consequent()))
                && conclusion.equals(new Not(implication.antecedent()));
    }
}
