package org.nd.engine;

import org.nd.formula.Formula;
import org.nd.rules.BranchOutcome;
import org.nd.rules.Derivation;
import org.nd.rules.DerivationRule;
import org.nd.rules.Goal;
import org.nd.rules.RuleCatalogue;
import org.nd.rules.SubProofPlan;
import org.nd.rules.SubProofRule;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE DI DERIVAZIONE - Ricerca di prove in deduzione naturale
 *
 * Dato un insieme di assunzioni e una conclusione, costruisce riga dopo riga
 * una prova con dipendenze esplicite, oppure segnala che nessuna prova è
 * stata trovata entro il budget.
 *
 * ALGORITMO (per ogni scope, a partire dalla radice):
 * 1. Se l'obiettivo dello scope è già visibile, lo scope è concluso
 * 2. Regole senza scope, in ordine di priorità: la prima applicazione (in ordine
 *    di riga) che produce una formula non ancora visibile viene registrata, e si riparte da 1
 * 3. Se nessuna regola senza scope produce nulla, regole che aprono scope in ordine
 *    di priorità: ogni piano apre i suoi rami e li cerca ricorsivamente; se tutti i rami
 *    riescono la riga di scarico viene registrata e si riparte da 1, altrimenti le righe
 *    del tentativo vengono scartate e si prova il piano successivo
 * 4. Nessun piano riesce: lo scope fallisce (alla radice la ricerca è esaurita)
 *
 * TERMINAZIONE:
 * - Deduplicazione: nessuna formula già visibile viene derivata di nuovo
 * - Le regole di introduzione costruiscono solo formule rilevanti (insieme finito)
 * - Ogni piano è tentato una sola volta per scope e per numero di righe visibili
 * - Annidamento limitato dalla profondità massima degli scope
 * - Ogni riga aggiunta consuma un passo: il budget è il limite rigido
 *
 * Il motore è privo di stato: ogni chiamata crea il proprio {@link SearchState},
 * quindi la stessa istanza può servire tentativi concorrenti.
 */
public class DerivationEngine {

    private static final Logger LOGGER = Logger.getLogger(DerivationEngine.class.getName());

    private final RuleCatalogue catalogue;

    public DerivationEngine() {
        this(RuleCatalogue.standard());
    }

    public DerivationEngine(RuleCatalogue catalogue) {
        this.catalogue = Objects.requireNonNull(catalogue, "Catalogo regole non può essere null");
    }

    //region PUNTO DI INGRESSO

    /**
     * Tenta di dimostrare la conclusione a partire dalle assunzioni.
     *
     * @param assumptions assunzioni, registrate come righe 1..n nell'ordine dato
     * @param conclusion formula da dimostrare
     * @param configuration budget, priorità delle regole, profondità e tempo massimi
     * @return prova trovata, oppure esaurimento con il relativo motivo
     * @throws IllegalArgumentException se assunzioni o conclusione sono null
     */
    public ProofResult attemptProof(List<Formula> assumptions, Formula conclusion, SearchConfiguration configuration) {
        if (assumptions == null) {
            throw new IllegalArgumentException("Le assunzioni non possono essere null");
        }
        for (Formula assumption : assumptions) {
            if (assumption == null) {
                throw new IllegalArgumentException("Le assunzioni non possono contenere elementi null");
            }
        }
        Objects.requireNonNull(conclusion, "Conclusione non può essere null");
        Objects.requireNonNull(configuration, "Configurazione non può essere null");

        LOGGER.info(String.format("Ricerca prova: %s / %s", assumptions, conclusion));
        Search search = new Search(new SearchState(assumptions, conclusion, configuration), configuration);

        Optional<List<ProofLine>> witness = search.run(Goal.of(conclusion));
        SearchState state = search.state;

        state.finish(witness.isPresent() ? SearchPhase.FOUND : SearchPhase.EXHAUSTED);
        ProofResult result = state.getPhase() == SearchPhase.FOUND
                ? ProofResult.found(state.ledgerSnapshot(), state.getStatistics())
                : ProofResult.exhausted(state.exhaustionReason(), state.getStatistics());

        LOGGER.info("Esito: " + result.toCompactString());
        return result;
    }

    /**
     * Tentativo con la configurazione predefinita.
     */
    public ProofResult attemptProof(List<Formula> assumptions, Formula conclusion) {
        return attemptProof(assumptions, conclusion, SearchConfiguration.defaults());
    }

    //endregion

    /**
     * Singola ricerca: stato del tentativo e regole selezionate dalla configurazione.
     */
    private final class Search {

        private final SearchState state;
        private final List<DerivationRule> derivationRules;
        private final List<SubProofRule> subProofRules;
        private final int maxScopeDepth;

        Search(SearchState state, SearchConfiguration configuration) {
            this.state = state;
            this.derivationRules = catalogue.derivationRules(configuration.getRulePriority());
            this.subProofRules = catalogue.subProofRules(configuration.getRulePriority());
            this.maxScopeDepth = configuration.getMaxScopeDepth();
        }

        //region CICLO DI RICERCA

        /**
         * Cerca l'obiettivo nello scope corrente.
         *
         * @param goal obiettivo dello scope corrente
         * @return righe che realizzano l'obiettivo, vuoto se lo scope fallisce o la ricerca si ferma
         */
        Optional<List<ProofLine>> run(Goal goal) {
            while (true) {
                Optional<List<ProofLine>> witness = goal.findWitness(state);
                if (witness.isPresent()) {
                    LOGGER.fine(String.format("Obiettivo %s raggiunto a profondità %d", goal, state.depth()));
                    return witness;
                }
                if (!state.canStep()) {
                    return Optional.empty();
                }
                if (applyDerivationRule()) {
                    continue;
                }
                if (!applySubProof(goal)) {
                    return Optional.empty();
                }
            }
        }

        /**
         * Passo senza scope: prima applicazione nuova della prima regola che ne ha una.
         *
         * @return true se una riga è stata aggiunta
         */
        private boolean applyDerivationRule() {
            for (DerivationRule rule : derivationRules) {
                for (Derivation derivation : rule.applications(state)) {
                    if (!state.isVisible(derivation.formula())) {
                        ProofLine line = state.appendDerivation(derivation);
                        if (LOGGER.isLoggable(Level.FINEST)) {
                            LOGGER.finest("Derivata " + line);
                        }
                        return true;
                    }
                }
            }
            return false;
        }

        //endregion

        //region SOTTO-RAGIONAMENTI

        /**
         * Prova i piani delle regole che aprono scope, in ordine di priorità,
         * fino al primo che si conclude con una riga di scarico.
         *
         * @param goal obiettivo dello scope corrente
         * @return true se una riga di scarico è stata aggiunta
         */
        private boolean applySubProof(Goal goal) {
            if (state.depth() >= maxScopeDepth) {
                return false;
            }
            int visibleCount = state.visibleLines().size();

            for (SubProofRule rule : subProofRules) {
                for (SubProofPlan plan : rule.plans(state, goal)) {
                    if (!state.currentScope().markAttempt(plan.key() + "@" + visibleCount)) {
                        continue;
                    }
                    if (trySubProof(rule, plan)) {
                        return true;
                    }
                    if (state.isStopped()) {
                        return false;
                    }
                }
            }
            return false;
        }

        /**
         * Esegue un piano: apre e cerca ogni ramo in ordine, poi scarica le ipotesi.
         * Se un ramo fallisce il tentativo viene abbandonato e le sue righe scartate.
         *
         * @return true se il piano si è concluso con la riga di scarico
         */
        private boolean trySubProof(SubProofRule rule, SubProofPlan plan) {
            int checkpoint = state.checkpoint();
            int depth = state.depth();
            List<BranchOutcome> outcomes = new ArrayList<>();

            LOGGER.fine(String.format("Tentativo %s verso %s a profondità %d",
                    rule.name().symbol(), plan.conclusion(), depth));

            for (SubProofPlan.Branch branch : plan.branches()) {
                if (!state.canStep()) {
                    state.abandon(checkpoint, depth);
                    return false;
                }
                ProofLine hypothesis = state.openScope(plan, branch);
                Optional<List<ProofLine>> witness = run(branch.goal());
                if (witness.isEmpty()) {
                    LOGGER.fine(String.format("Ramo con ipotesi %s fallito: tentativo %s abbandonato",
                            branch.hypothesis(), rule.name().symbol()));
                    state.abandon(checkpoint, depth);
                    return false;
                }
                state.closeScope();
                outcomes.add(new BranchOutcome(hypothesis, witness.get()));
            }

            Derivation discharge = rule.discharge(plan, outcomes);
            if (state.isVisible(discharge.formula()) || !state.canStep()) {
                state.abandon(checkpoint, depth);
                return false;
            }
            ProofLine line = state.appendDerivation(discharge);
            state.getStatistics().incrementSubProofsDischarged();
            LOGGER.fine("Scaricato " + line);
            return true;
        }

        //endregion
    }
}
