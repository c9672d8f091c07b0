package org.nd.rules;

import org.nd.formula.And;
import org.nd.formula.Formula;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Introduzione della congiunzione: da P e Q si deriva (P &amp; Q), solo se la
 * congiunzione è una formula rilevante.
 */
public class AndIntroduction implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.AND_INTRODUCTION;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        Set<Formula> relevant = context.relevantFormulas();
        List<ProofLine> visible = context.visibleLines();
        for (ProofLine left : visible) {
            for (ProofLine right : visible) {
                And conjunction = new And(left.formula(), right.formula());
                if (relevant.contains(conjunction)) {
                    found.add(Derivation.of(conjunction, name(), left, right));
                }
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 2 && conclusion.equals(new And(cited.get(0), cited.get(1)));
    }
}
