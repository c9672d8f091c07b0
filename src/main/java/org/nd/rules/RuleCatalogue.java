package org.nd.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * CATALOGO DELLE REGOLE - Tabella nome -&gt; regola
 *
 * La strategia di prova è una lista ordinata di nomi: il catalogo la traduce
 * nelle regole corrispondenti, nello stesso ordine. Le regole non elencate
 * restano disattivate; riordinare o disattivare regole non richiede codice.
 *
 * PRIORITÀ PREDEFINITA:
 * prima le eliminazioni (più dirette), poi le introduzioni, infine le regole
 * che aprono scope in ordine di costo crescente.
 */
public final class RuleCatalogue {

    /**
     * Ordine predefinito: eliminazioni, analisi per casi, introduzioni, prova condizionale, assurdo.
     */
    public static final List<RuleName> DEFAULT_PRIORITY = List.of(
            RuleName.MODUS_PONENS,
            RuleName.MODUS_TOLLENS,
            RuleName.AND_ELIMINATION,
            RuleName.DOUBLE_NEGATION_ELIMINATION,
            RuleName.OR_ELIMINATION,
            RuleName.AND_INTRODUCTION,
            RuleName.OR_INTRODUCTION,
            RuleName.DOUBLE_NEGATION_INTRODUCTION,
            RuleName.CONDITIONAL_PROOF,
            RuleName.REDUCTIO_AD_ABSURDUM);

    private static final RuleCatalogue STANDARD = new RuleCatalogue(List.of(
            new ModusPonens(),
            new ModusTollens(),
            new AndElimination(),
            new DoubleNegationElimination(),
            new OrElimination(),
            new AndIntroduction(),
            new OrIntroduction(),
            new DoubleNegationIntroduction(),
            new ConditionalProof(),
            new ReductioAdAbsurdum()));

    private final Map<RuleName, InferenceRule> rules = new EnumMap<>(RuleName.class);

    private RuleCatalogue(List<InferenceRule> available) {
        for (InferenceRule rule : available) {
            rules.put(rule.name(), rule);
        }
    }

    /**
     * Le regole sono prive di stato, quindi un unico catalogo è condivisibile
     * tra tentativi di prova concorrenti.
     *
     * @return catalogo con tutte le regole del nucleo della deduzione naturale
     */
    public static RuleCatalogue standard() {
        return STANDARD;
    }

    /**
     * @param name nome della regola
     * @return regola corrispondente
     * @throws IllegalArgumentException se il nome non è una regola di inferenza
     */
    public InferenceRule rule(RuleName name) {
        InferenceRule rule = rules.get(name);
        if (rule == null) {
            throw new IllegalArgumentException("Nessuna regola di inferenza per: " + name);
        }
        return rule;
    }

    /**
     * @param priority strategia: nomi delle regole attive in ordine
     * @return regole senza scope, nell'ordine della strategia
     */
    public List<DerivationRule> derivationRules(List<RuleName> priority) {
        List<DerivationRule> selected = new ArrayList<>();
        for (RuleName name : priority) {
            if (rule(name) instanceof DerivationRule derivationRule) {
                selected.add(derivationRule);
            }
        }
        return Collections.unmodifiableList(selected);
    }

    /**
     * @param priority strategia: nomi delle regole attive in ordine
     * @return regole che aprono scope, nell'ordine della strategia
     */
    public List<SubProofRule> subProofRules(List<RuleName> priority) {
        List<SubProofRule> selected = new ArrayList<>();
        for (RuleName name : priority) {
            if (rule(name) instanceof SubProofRule subProofRule) {
                selected.add(subProofRule);
            }
        }
        return Collections.unmodifiableList(selected);
    }
}
