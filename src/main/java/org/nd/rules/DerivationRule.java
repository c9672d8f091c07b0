package org.nd.rules;

import java.util.List;

/**
 * Regola che opera solo sulle righe visibili, senza aprire scope.
 */
public interface DerivationRule extends InferenceRule {

    /**
     * Elenca tutte le applicazioni possibili nell'ordine di scoperta: righe
     * visibili in ordine crescente, prima riga citata come indice più esterno.
     * Le applicazioni la cui formula è già visibile sono incluse: il filtro
     * di deduplicazione spetta al motore.
     *
     * @param context stato corrente della prova
     * @return applicazioni in ordine deterministico
     */
    List<Derivation> applications(RuleContext context);
}
