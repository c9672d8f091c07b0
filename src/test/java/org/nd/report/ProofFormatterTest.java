package org.nd.report;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.nd.engine.DerivationEngine;
import org.nd.engine.ProofResult;
import org.nd.parser.FormulaParser;
import org.nd.parser.Statement;

public class ProofFormatterTest {

    private final DerivationEngine engine = new DerivationEngine();

    @Test
    public void testFoundProofTranscript() {
        Statement statement = FormulaParser.parseStatement("(A -> B), (B -> C), A / C");
        ProofResult result = engine.attemptProof(statement.assumptions(), statement.conclusion());

        String output = ProofFormatter.format(statement.assumptions(), statement.conclusion(), result);
        assertTrue(output.contains("Assunzioni: (A -> B), (B -> C), A"));
        assertTrue(output.contains("Conclusione: C"));
        assertTrue(output.contains("Esito: PROVA TROVATA"));
        assertTrue(output.contains("Passi totali: 2"));
        assertTrue(output.contains("MPP 1, 3"));
        assertTrue(output.contains("MPP 2, 4"));
    }

    @Test
    public void testScopedLinesAreIndented() {
        Statement statement = FormulaParser.parseStatement("(P v Q), (P -> W), (Q -> W) / W");
        ProofResult result = engine.attemptProof(statement.assumptions(), statement.conclusion());

        String[] rows = ProofFormatter.formatLines(result.getLines()).split("\n");
        assertEquals(8, rows.length);
        assertTrue(rows[3].startsWith("4 "));
        assertTrue(rows[3].contains("(4)    P "));
        assertTrue(rows[3].endsWith("A (vE)"));
        assertTrue(rows[7].startsWith("1,2,3"));
        assertTrue(rows[7].contains("(8)  W "));
        assertTrue(rows[7].endsWith("vE 1, 4, 5, 6, 7"));
    }

    @Test
    public void testExhaustedTranscript() {
        Statement statement = FormulaParser.parseStatement("(A v B) / C");
        ProofResult result = engine.attemptProof(statement.assumptions(), statement.conclusion());

        String output = ProofFormatter.format(statement.assumptions(), statement.conclusion(), result);
        assertTrue(output.contains("Esito: NESSUNA PROVA TROVATA (" + result.getReason().getDescription() + ")"));
        assertTrue(output.contains("Conclusione: C"));
    }
}
