package org.nd.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.nd.formula.Formula;
import org.nd.parser.FormulaParser;
import org.nd.support.Justification;
import org.nd.support.ProofLine;

/**
 * Contesto minimo per provare le regole senza motore: righe assunte a profondità 0
 * e insieme rilevante costruito dalle loro sottoformule.
 */
class StubContext implements RuleContext {

    private final List<ProofLine> lines = new ArrayList<>();
    private final Set<Formula> relevant = new LinkedHashSet<>();
    private int openRefutations = 0;

    StubContext assume(String text) {
        Formula formula = FormulaParser.parse(text);
        int number = lines.size() + 1;
        lines.add(new ProofLine(number, formula, List.of(number), Justification.assumption(), 0));
        relevant.addAll(formula.subformulas());
        return this;
    }

    StubContext relevant(String text) {
        relevant.addAll(FormulaParser.parse(text).subformulas());
        return this;
    }

    /**
     * Simula una catena con il numero indicato di riduzioni all'assurdo aperte.
     */
    StubContext openRefutations(int count) {
        this.openRefutations = count;
        return this;
    }

    ProofLine line(int number) {
        return lines.get(number - 1);
    }

    @Override
    public List<ProofLine> visibleLines() {
        return List.copyOf(lines);
    }

    @Override
    public Optional<ProofLine> findVisible(Formula formula) {
        return lines.stream().filter(line -> line.formula().equals(formula)).findFirst();
    }

    @Override
    public Set<Formula> relevantFormulas() {
        return relevant;
    }

    @Override
    public boolean isCaseSplitOpen(int orLine) {
        return false;
    }

    @Override
    public boolean isHypothesisOpen(RuleName rule, Formula hypothesis, Goal goal) {
        return false;
    }

    @Override
    public int openScopeCount(RuleName rule, Goal goal) {
        return rule == RuleName.REDUCTIO_AD_ABSURDUM && goal.isContradiction() ? openRefutations : 0;
    }
}
