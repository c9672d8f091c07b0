package org.nd.engine;

import org.nd.rules.RuleCatalogue;
import org.nd.rules.RuleName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CONFIGURAZIONE DI RICERCA - Strategia di prova personalizzabile
 *
 * PARAMETRI:
 * - maxSteps: tetto ai passi del motore (ogni riga aggiunta, ipotesi comprese, costa un passo)
 * - rulePriority: regole attive nell'ordine in cui vengono provate
 * - maxScopeDepth: massimo annidamento dei sotto-ragionamenti (0 = nessuno scope)
 * - timeLimit: limite di tempo facoltativo, controllato tra un passo e l'altro
 * - maxProofLength: numero massimo facoltativo di righe della prova; i rami che lo
 *   raggiungono vengono potati e la ricerca prosegue sugli altri
 *
 * Le istanze sono immutabili e validate alla costruzione: una configurazione
 * errata viene rifiutata con {@link InvalidConfigurationException} prima che la
 * ricerca cominci.
 */
public final class SearchConfiguration {

    public static final int DEFAULT_MAX_STEPS = 50_000;
    public static final int DEFAULT_MAX_SCOPE_DEPTH = 4;

    private static final SearchConfiguration DEFAULTS = builder().build();

    private final int maxSteps;
    private final List<RuleName> rulePriority;
    private final int maxScopeDepth;
    private final Duration timeLimit;
    private final Integer maxProofLength;

    private SearchConfiguration(Builder builder) {
        this.maxSteps = builder.maxSteps;
        this.rulePriority = List.copyOf(builder.rulePriority);
        this.maxScopeDepth = builder.maxScopeDepth;
        this.timeLimit = builder.timeLimit;
        this.maxProofLength = builder.maxProofLength;
    }

    /**
     * @return configurazione con budget di 50 000 passi, priorità predefinita, profondità 4,
     *         nessun limite di tempo né di lunghezza
     */
    public static SearchConfiguration defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder inizializzato con i valori di questa configurazione
     */
    public Builder toBuilder() {
        return new Builder()
                .maxSteps(maxSteps)
                .rulePriority(rulePriority)
                .maxScopeDepth(maxScopeDepth)
                .timeLimit(timeLimit)
                .maxProofLength(maxProofLength);
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public List<RuleName> getRulePriority() {
        return rulePriority;
    }

    public int getMaxScopeDepth() {
        return maxScopeDepth;
    }

    public Optional<Duration> getTimeLimit() {
        return Optional.ofNullable(timeLimit);
    }

    public Optional<Integer> getMaxProofLength() {
        return Optional.ofNullable(maxProofLength);
    }

    @Override
    public String toString() {
        return String.format("SearchConfiguration{maxSteps=%d, maxScopeDepth=%d, timeLimit=%s, maxProofLength=%s, rules=%s}",
                maxSteps, maxScopeDepth, timeLimit == null ? "nessuno" : timeLimit.toMillis() + "ms",
                maxProofLength == null ? "nessuna" : maxProofLength,
                rulePriority.stream().map(RuleName::symbol).toList());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SearchConfiguration other = (SearchConfiguration) obj;
        return maxSteps == other.maxSteps
                && maxScopeDepth == other.maxScopeDepth
                && rulePriority.equals(other.rulePriority)
                && Objects.equals(timeLimit, other.timeLimit)
                && Objects.equals(maxProofLength, other.maxProofLength);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxSteps, rulePriority, maxScopeDepth, timeLimit, maxProofLength);
    }

    /**
     * Builder della configurazione. I valori non impostati restano quelli predefiniti.
     */
    public static final class Builder {

        private int maxSteps = DEFAULT_MAX_STEPS;
        private List<RuleName> rulePriority = new ArrayList<>(RuleCatalogue.DEFAULT_PRIORITY);
        private int maxScopeDepth = DEFAULT_MAX_SCOPE_DEPTH;
        private Duration timeLimit;
        private Integer maxProofLength;

        private Builder() {
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder rulePriority(List<RuleName> rulePriority) {
            this.rulePriority = rulePriority == null ? null : new ArrayList<>(rulePriority);
            return this;
        }

        public Builder maxScopeDepth(int maxScopeDepth) {
            this.maxScopeDepth = maxScopeDepth;
            return this;
        }

        /**
         * @param timeLimit limite di tempo, null per nessun limite
         */
        public Builder timeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        /**
         * @param maxProofLength righe massime della prova, assunzioni comprese; null per nessun limite
         */
        public Builder maxProofLength(Integer maxProofLength) {
            this.maxProofLength = maxProofLength;
            return this;
        }

        /**
         * @return configurazione validata
         * @throws InvalidConfigurationException se un parametro non è valido
         */
        public SearchConfiguration build() {
            if (maxSteps <= 0) {
                throw new InvalidConfigurationException("Il budget di passi deve essere positivo: " + maxSteps);
            }
            if (maxScopeDepth < 0) {
                throw new InvalidConfigurationException("La profondità massima degli scope non può essere negativa: " + maxScopeDepth);
            }
            if (timeLimit != null && (timeLimit.isZero() || timeLimit.isNegative())) {
                throw new InvalidConfigurationException("Il limite di tempo deve essere positivo: " + timeLimit);
            }
            if (maxProofLength != null && maxProofLength <= 0) {
                throw new InvalidConfigurationException("La lunghezza massima della prova deve essere positiva: " + maxProofLength);
            }
            validateRulePriority();
            return new SearchConfiguration(this);
        }

        private void validateRulePriority() {
            if (rulePriority == null || rulePriority.isEmpty()) {
                throw new InvalidConfigurationException("La lista di priorità delle regole non può essere vuota");
            }
            Set<RuleName> seen = EnumSet.noneOf(RuleName.class);
            for (RuleName rule : rulePriority) {
                if (rule == null) {
                    throw new InvalidConfigurationException("La lista di priorità contiene un elemento null");
                }
                if (!rule.isInferenceRule()) {
                    throw new InvalidConfigurationException("Non è una regola di inferenza: " + rule.symbol());
                }
                if (!seen.add(rule)) {
                    throw new InvalidConfigurationException("Regola ripetuta nella lista di priorità: " + rule.symbol());
                }
            }
        }
    }
}
