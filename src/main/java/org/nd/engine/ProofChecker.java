package org.nd.engine;

import org.nd.formula.Formula;
import org.nd.rules.InferenceRule;
import org.nd.rules.RuleCatalogue;
import org.nd.rules.RuleName;
import org.nd.support.ProofLine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * VERIFICATORE DI PROVE - Controllo indipendente dalla ricerca
 *
 * Ricontrolla una sequenza di righe senza fidarsi del motore che l'ha prodotta.
 *
 * CONTROLLI PER RIGA:
 * - Numeri di riga strettamente crescenti
 * - Assunzioni e ipotesi: nessuna riga citata, dipendenze uguali a {numero della riga}
 * - Righe derivate: righe citate precedenti ed esistenti, formula riprodotta da
 *   {@link InferenceRule#justifies} a partire dalle formule citate
 * - Dipendenze uguali all'unione di quelle citate, meno le ipotesi scaricate
 * - Visibilità: le righe citate appartengono a scope ancora aperti, salvo le
 *   righe dello scope chiuso dalla regola che scarica l'ipotesi
 */
public class ProofChecker {

    private static final Logger LOGGER = Logger.getLogger(ProofChecker.class.getName());

    private final RuleCatalogue catalogue;

    public ProofChecker() {
        this(RuleCatalogue.standard());
    }

    public ProofChecker(RuleCatalogue catalogue) {
        this.catalogue = catalogue;
    }

    /**
     * @param lines righe della prova in ordine
     * @return violazioni trovate, vuota se la prova è corretta
     */
    public List<String> check(List<ProofLine> lines) {
        List<String> violations = new ArrayList<>();
        Map<Integer, Integer> positions = new HashMap<>();
        int previous = 0;

        for (int index = 0; index < lines.size(); index++) {
            ProofLine line = lines.get(index);
            if (line.number() <= previous) {
                violations.add(String.format("Riga %d: numero non crescente dopo la riga %d", line.number(), previous));
            }
            previous = line.number();

            if (line.isAssumed()) {
                checkAssumed(line, violations);
            } else {
                checkDerived(lines, positions, index, violations);
            }
            positions.put(line.number(), index);
        }

        if (!violations.isEmpty()) {
            LOGGER.warning("Prova non valida: " + violations.size() + " violazioni");
        }
        return violations;
    }

    /**
     * @return true se la prova non ha violazioni
     */
    public boolean isValid(List<ProofLine> lines) {
        return check(lines).isEmpty();
    }

    private void checkAssumed(ProofLine line, List<String> violations) {
        if (!line.justification().citedLines().isEmpty()) {
            violations.add(String.format("Riga %d: un'assunzione non cita altre righe", line.number()));
        }
        if (!line.dependencies().equals(List.of(line.number()))) {
            violations.add(String.format("Riga %d: un'assunzione dipende solo da se stessa, trovato %s",
                    line.number(), line.dependencies()));
        }
        if (line.justification().rule() == RuleName.ASSUMPTION && line.depth() != 0) {
            violations.add(String.format("Riga %d: assunzione iniziale dentro uno scope", line.number()));
        }
    }

    private void checkDerived(List<ProofLine> lines, Map<Integer, Integer> positions, int index, List<String> violations) {
        ProofLine line = lines.get(index);
        RuleName ruleName = line.justification().rule();
        InferenceRule rule = catalogue.rule(ruleName);

        List<ProofLine> cited = new ArrayList<>();
        for (Integer number : line.justification().citedLines()) {
            Integer position = positions.get(number);
            if (position == null) {
                violations.add(String.format("Riga %d: cita la riga %d che non la precede", line.number(), number));
                return;
            }
            cited.add(lines.get(position));
        }

        List<Formula> citedFormulas = cited.stream().map(ProofLine::formula).toList();
        if (!rule.justifies(line.formula(), citedFormulas)) {
            violations.add(String.format("Riga %d: %s non produce %s dalle righe %s",
                    line.number(), ruleName.symbol(), line.formula(), line.justification().citedLines()));
        }

        List<Integer> dischargedPositions = rule.dischargedPositions(cited.size());
        TreeSet<Integer> expected = new TreeSet<>();
        for (ProofLine citedLine : cited) {
            expected.addAll(citedLine.dependencies());
        }
        for (Integer position : dischargedPositions) {
            if (position >= cited.size()) {
                continue;
            }
            ProofLine hypothesis = cited.get(position);
            if (!hypothesis.justification().rule().isHypothesis()) {
                violations.add(String.format("Riga %d: la riga scaricata %d non è un'ipotesi",
                        line.number(), hypothesis.number()));
            }
            expected.remove(hypothesis.number());
        }
        if (!line.dependencies().equals(new ArrayList<>(expected))) {
            violations.add(String.format("Riga %d: dipendenze %s, attese %s",
                    line.number(), line.dependencies(), expected));
        }

        for (ProofLine citedLine : cited) {
            if (!isCitable(lines, positions.get(citedLine.number()), index, ruleName.kind() == RuleName.Kind.SUB_PROOF)) {
                violations.add(String.format("Riga %d: la riga %d appartiene a uno scope chiuso",
                        line.number(), citedLine.number()));
            }
        }
    }

    /**
     * Una riga è citabile se il suo scope è ancora aperto: tra la riga citata e
     * quella che cita nessuna riga torna a una profondità minore e nessuna nuova
     * ipotesi apre uno scope fratello alla stessa profondità. Una regola di
     * scarico può citare anche le righe dello scope immediatamente più interno.
     */
    private static boolean isCitable(List<ProofLine> lines, int citedIndex, int citingIndex, boolean discharging) {
        ProofLine cited = lines.get(citedIndex);
        ProofLine citing = lines.get(citingIndex);
        int scopeDepth = cited.depth();

        if (scopeDepth > citing.depth()) {
            if (!discharging || scopeDepth != citing.depth() + 1) {
                return false;
            }
            // la riga citata vive nello scope appena chiuso, o in uno dei due casi dell'eliminazione della disgiunzione
            for (int k = citedIndex + 1; k < citingIndex; k++) {
                if (lines.get(k).depth() < scopeDepth) {
                    return false;
                }
            }
            return true;
        }

        for (int k = citedIndex + 1; k <= citingIndex; k++) {
            ProofLine between = lines.get(k);
            if (between.depth() < scopeDepth) {
                return false;
            }
            if (scopeDepth > 0 && between.depth() == scopeDepth && between.justification().rule().isHypothesis()) {
                return false;
            }
        }
        return true;
    }
}
