package org.nd.report;

import org.nd.engine.ProofResult;
import org.nd.formula.Formula;
import org.nd.support.ProofLine;

import java.util.List;
import java.util.stream.Collectors;

/**
 * FORMATTATORE DI PROVE - Trascrizione testuale in stile manuale
 *
 * FORMATO DI UNA RIGA:
 * <pre>
 * 1,2,3    (8)  W                  vE 1, 4, 5, 6, 7
 * 4        (4)    P                A (vE)
 * </pre>
 * dipendenze, numero di riga tra parentesi, formula rientrata di due spazi per
 * ogni livello di scope, regola con le righe citate.
 */
public final class ProofFormatter {

    private static final String INDENT = "  ";
    private static final String SEPARATOR = "====================================";

    private ProofFormatter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param assumptions assunzioni dell'enunciato
     * @param conclusion conclusione dell'enunciato
     * @param result esito della ricerca
     * @return trascrizione completa: intestazione, righe della prova o motivo dell'esaurimento, statistiche
     */
    public static String format(List<Formula> assumptions, Formula conclusion, ProofResult result) {
        StringBuilder output = new StringBuilder();
        output.append("Assunzioni: ").append(joinFormulas(assumptions)).append("\n");
        output.append("Conclusione: ").append(conclusion).append("\n");

        if (result.isFound()) {
            output.append("Esito: PROVA TROVATA\n");
            output.append("Passi totali: ").append(result.getStatistics().getSteps()).append("\n");
            output.append(SEPARATOR).append("\n");
            output.append(formatLines(result.getLines()));
        } else {
            output.append("Esito: NESSUNA PROVA TROVATA (").append(result.getReason().getDescription()).append(")\n");
            output.append("Passi totali: ").append(result.getStatistics().getSteps()).append("\n");
        }

        output.append(SEPARATOR).append("\n");
        output.append(result.getStatistics());
        return output.toString();
    }

    /**
     * @param lines righe della prova
     * @return una riga di testo per ogni riga della prova, colonne allineate
     */
    public static String formatLines(List<ProofLine> lines) {
        int dependencyWidth = 0;
        int numberWidth = 0;
        int formulaWidth = 0;
        for (ProofLine line : lines) {
            dependencyWidth = Math.max(dependencyWidth, dependencies(line).length());
            numberWidth = Math.max(numberWidth, String.valueOf(line.number()).length() + 2);
            formulaWidth = Math.max(formulaWidth, indentedFormula(line).length());
        }

        StringBuilder output = new StringBuilder();
        for (ProofLine line : lines) {
            output.append(pad(dependencies(line), dependencyWidth)).append("  ")
                    .append(pad("(" + line.number() + ")", numberWidth)).append("  ")
                    .append(pad(indentedFormula(line), formulaWidth)).append("  ")
                    .append(line.justification())
                    .append("\n");
        }
        return output.toString();
    }

    private static String dependencies(ProofLine line) {
        return line.dependencies().stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static String indentedFormula(ProofLine line) {
        return INDENT.repeat(line.depth()) + line.formula();
    }

    private static String joinFormulas(List<Formula> formulas) {
        return formulas.stream().map(Formula::toString).collect(Collectors.joining(", "));
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}
