package org.nd.engine;

import org.nd.formula.Formula;
import org.nd.rules.Derivation;
import org.nd.rules.Goal;
import org.nd.rules.RuleContext;
import org.nd.rules.RuleName;
import org.nd.rules.SubProofPlan;
import org.nd.support.Justification;
import org.nd.support.ProofLedger;
import org.nd.support.ProofLine;
import org.nd.support.Scope;
import org.nd.support.ScopeStack;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * STATO DI RICERCA - Tutto ciò che un tentativo di prova possiede
 *
 * Contiene registro, stack degli scope, insieme delle formule rilevanti,
 * contatore dei passi, scadenza facoltativa, fase corrente e statistiche.
 * Vive per un solo tentativo e non è condiviso: tentativi diversi possono
 * procedere in parallelo senza interferire.
 *
 * Verso le regole espone solo la vista in sola lettura {@link RuleContext};
 * le scritture passano dai metodi di questa classe, usati dal motore.
 */
class SearchState implements RuleContext {

    private static final Logger LOGGER = Logger.getLogger(SearchState.class.getName());

    private final SearchConfiguration configuration;
    private final SearchStatistics statistics;
    private final ProofLedger ledger = new ProofLedger();
    private final ScopeStack scopes;

    /** Formule costruibili dalle regole di introduzione, cresce con le ipotesi aperte */
    private final Set<Formula> relevant = new LinkedHashSet<>();

    /** Istante (System.nanoTime) oltre il quale la ricerca si ferma, 0 se assente */
    private final long deadline;

    private int stepsUsed = 0;
    private SearchPhase phase = SearchPhase.SEARCHING;

    /** Motivo dell'arresto anticipato, null finché budget e tempo lo consentono */
    private ExhaustionReason stopReason;

    /** Almeno un ramo è stato potato per la lunghezza massima della prova */
    private boolean lengthCapReached = false;

    SearchState(List<Formula> assumptions, Formula conclusion, SearchConfiguration configuration) {
        this.configuration = configuration;
        this.statistics = new SearchStatistics();
        this.scopes = new ScopeStack(Scope.root(Goal.of(conclusion)));
        this.deadline = configuration.getTimeLimit()
                .map(Duration::toNanos)
                .map(limit -> System.nanoTime() + limit)
                .orElse(0L);

        relevant.addAll(Formula.subformulasOf(assumptions));
        relevant.addAll(conclusion.subformulas());

        for (Formula assumption : assumptions) {
            recordAssumption(assumption);
        }
    }

    //region VISTA PER LE REGOLE

    @Override
    public List<ProofLine> visibleLines() {
        return scopes.visibleLines();
    }

    @Override
    public Optional<ProofLine> findVisible(Formula formula) {
        if (!scopes.isVisible(formula)) {
            return Optional.empty();
        }
        for (ProofLine line : scopes.visibleLines()) {
            if (line.formula().equals(formula)) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean isVisible(Formula formula) {
        return scopes.isVisible(formula);
    }

    @Override
    public Set<Formula> relevantFormulas() {
        return Collections.unmodifiableSet(relevant);
    }

    @Override
    public boolean isCaseSplitOpen(int orLine) {
        return scopes.isCaseSplitOpen(orLine);
    }

    @Override
    public boolean isHypothesisOpen(RuleName rule, Formula hypothesis, Goal goal) {
        return scopes.isHypothesisOpen(rule, hypothesis, goal);
    }

    @Override
    public int openScopeCount(RuleName rule, Goal goal) {
        return scopes.countOpen(rule, goal);
    }

    //endregion

    //region BUDGET

    /**
     * Verifica che sia possibile consumare un altro passo.
     * Al primo superamento di budget o scadenza registra il motivo dell'arresto.
     * La lunghezza massima non ferma la ricerca: il ramo corrente fallisce e
     * gli altri restano esplorabili.
     *
     * @return true se la ricerca può aggiungere una riga
     */
    boolean canStep() {
        if (stopReason != null) {
            return false;
        }
        if (stepsUsed >= configuration.getMaxSteps()) {
            stopReason = ExhaustionReason.STEP_BUDGET;
            LOGGER.fine("Budget di passi esaurito: " + stepsUsed);
        } else if (deadline != 0 && System.nanoTime() - deadline >= 0) {
            stopReason = ExhaustionReason.TIME_LIMIT;
            LOGGER.fine("Limite di tempo superato dopo " + stepsUsed + " passi");
        }
        if (stopReason != null) {
            return false;
        }

        Optional<Integer> maxProofLength = configuration.getMaxProofLength();
        if (maxProofLength.isPresent() && ledger.size() >= maxProofLength.get()) {
            lengthCapReached = true;
            LOGGER.finest("Ramo potato a " + ledger.size() + " righe");
            return false;
        }
        return true;
    }

    boolean isStopped() {
        return stopReason != null;
    }

    /**
     * @return motivo dell'esaurimento: arresto anticipato, potatura per lunghezza o spazio esplorato
     */
    ExhaustionReason exhaustionReason() {
        if (stopReason != null) {
            return stopReason;
        }
        return lengthCapReached ? ExhaustionReason.PROOF_LENGTH : ExhaustionReason.SEARCH_SPACE;
    }

    private void consumeStep() {
        if (stepsUsed >= configuration.getMaxSteps()) {
            throw new IllegalStateException("Passo richiesto oltre il budget di " + configuration.getMaxSteps());
        }
        stepsUsed++;
        statistics.incrementSteps();
    }

    //endregion

    //region SCRITTURE

    private void recordAssumption(Formula formula) {
        int number = ledger.nextLineNumber();
        ProofLine line = new ProofLine(number, formula, List.of(number), Justification.assumption(), 0);
        ledger.append(line);
        scopes.current().record(line);
    }

    /**
     * Registra una derivazione nello scope corrente, consumando un passo.
     *
     * @param derivation derivazione prodotta da una regola
     * @return riga aggiunta
     */
    ProofLine appendDerivation(Derivation derivation) {
        consumeStep();
        ProofLine line = new ProofLine(ledger.nextLineNumber(), derivation.formula(), derivation.dependencies(),
                new Justification(derivation.rule(), derivation.citedLines()), scopes.depth());
        ledger.append(line);
        scopes.current().record(line);
        statistics.recordDerivation(derivation.rule());
        return line;
    }

    /**
     * Apre lo scope di un ramo e vi registra la riga di ipotesi, consumando un passo.
     *
     * @param plan piano che apre lo scope
     * @param branch ramo da esplorare
     * @return riga dell'ipotesi
     */
    ProofLine openScope(SubProofPlan plan, SubProofPlan.Branch branch) {
        consumeStep();
        int number = ledger.nextLineNumber();
        int depth = scopes.depth() + 1;
        ProofLine hypothesis = new ProofLine(number, branch.hypothesis(), List.of(number),
                Justification.hypothesis(branch.hypothesisRule()), depth);

        Integer caseSplitSource = plan.caseSplitSource() == null ? null : plan.caseSplitSource().number();
        Scope scope = Scope.nested(depth, hypothesis, plan.rule(), caseSplitSource, branch.goal());
        scopes.push(scope);
        ledger.append(hypothesis);
        scope.record(hypothesis);

        relevant.addAll(branch.hypothesis().subformulas());
        phase = SearchPhase.SUB_PROOF_OPEN;
        statistics.recordScopeOpened(depth);
        return hypothesis;
    }

    /**
     * Chiude lo scope più interno dopo che il suo obiettivo è stato raggiunto.
     */
    void closeScope() {
        scopes.pop();
        if (scopes.depth() == 0) {
            phase = SearchPhase.SEARCHING;
        }
    }

    /**
     * @return punto di ripristino: dimensione corrente del registro
     */
    int checkpoint() {
        return ledger.size();
    }

    /**
     * Abbandona un sotto-ragionamento: chiude gli scope aperti oltre la
     * profondità indicata e scarta le righe successive al punto di ripristino.
     * I passi consumati restano consumati.
     *
     * @param checkpoint punto di ripristino ottenuto prima dell'apertura
     * @param depth profondità a cui tornare
     */
    void abandon(int checkpoint, int depth) {
        while (scopes.depth() > depth) {
            scopes.pop();
        }
        ledger.rollbackTo(checkpoint);
        if (scopes.depth() == 0) {
            phase = SearchPhase.SEARCHING;
        }
        statistics.incrementSubProofsAbandoned();
    }

    void finish(SearchPhase terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Fase non terminale: " + terminal);
        }
        this.phase = terminal;
        statistics.setProofLength(terminal == SearchPhase.FOUND ? ledger.size() : 0);
        statistics.stopTimer();
    }

    //endregion

    //region ACCESSORS

    int depth() {
        return scopes.depth();
    }

    Scope currentScope() {
        return scopes.current();
    }

    SearchPhase getPhase() {
        return phase;
    }

    SearchStatistics getStatistics() {
        return statistics;
    }

    List<ProofLine> ledgerSnapshot() {
        return ledger.snapshot();
    }

    //endregion
}
