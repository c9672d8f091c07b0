package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Not;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Introduzione della doppia negazione: da P si deriva ~~P.
 *
 * Limitata alle formule rilevanti, altrimenti la regola genererebbe catene
 * ~~P, ~~~~P, ... senza fine.
 */
public class DoubleNegationIntroduction implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.DOUBLE_NEGATION_INTRODUCTION;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        Set<Formula> relevant = context.relevantFormulas();
        for (ProofLine line : context.visibleLines()) {
            Formula doubled = new Not(new Not(line.formula()));
            if (relevant.contains(doubled)) {
                found.add(Derivation.of(doubled, name(), line));
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 1 && conclusion.equals(new Not(new Not(cited.get(0))));
    }
}
