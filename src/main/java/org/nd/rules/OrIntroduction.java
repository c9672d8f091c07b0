package org.nd.rules;

import org.nd.formula.Formula;
import org.nd.formula.Or;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Introduzione della disgiunzione: da P si deriva (P v X) oppure (X v P).
 *
 * Il disgiunto aggiunto X è scelto tra le formule rilevanti: si costruiscono solo
 * disgiunzioni che compaiono nelle assunzioni, nella conclusione o nelle ipotesi.
 */
public class OrIntroduction implements DerivationRule {

    @Override
    public RuleName name() {
        return RuleName.OR_INTRODUCTION;
    }

    @Override
    public List<Derivation> applications(RuleContext context) {
        List<Derivation> found = new ArrayList<>();
        List<Or> disjunctions = new ArrayList<>();
        for (Formula formula : context.relevantFormulas()) {
            if (formula instanceof Or disjunction) {
                disjunctions.add(disjunction);
            }
        }

        for (ProofLine line : context.visibleLines()) {
            for (Or disjunction : disjunctions) {
                if (disjunction.left().equals(line.formula()) || disjunction.right().equals(line.formula())) {
                    found.add(Derivation.of(disjunction, name(), line));
                }
            }
        }
        return found;
    }

    @Override
    public boolean justifies(Formula conclusion, List<Formula> cited) {
        return cited.size() == 1
                && conclusion instanceof Or disjunction
                && (disjunction.left().equals(cited.get(0)) || disjunction.right().equals(cited.get(0)));
    }
}
