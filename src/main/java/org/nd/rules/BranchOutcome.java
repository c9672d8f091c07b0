package org.nd.rules;

import org.nd.support.ProofLine;

import java.util.List;
import java.util.Objects;

/**
 * Esito di un ramo concluso con successo.
 *
 * @param hypothesis riga dell'ipotesi del ramo
 * @param witness righe che realizzano l'obiettivo (una formula, oppure la coppia R, ~R)
 */
public record BranchOutcome(ProofLine hypothesis, List<ProofLine> witness) {

    public BranchOutcome {
        Objects.requireNonNull(hypothesis, "Riga di ipotesi non può essere null");
        if (witness == null || witness.isEmpty()) {
            throw new IllegalArgumentException("Un ramo concluso richiede almeno una riga testimone");
        }
        witness = List.copyOf(witness);
    }
}
