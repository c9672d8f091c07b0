package org.nd.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.nd.antlr.LogicFormulaLexer;
import org.nd.antlr.LogicFormulaParser;
import org.nd.antlr.LogicFormulaParser.FormulaContext;
import org.nd.antlr.LogicFormulaParser.StatementContext;
import org.nd.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE - Punto di ingresso per la lettura di formule ed enunciati
 *
 * Coordina la pipeline ANTLR (lexer, token stream, parser) e la conversione
 * dell'albero sintattico in {@link Formula} tramite {@link FormulaTreeBuilder}.
 *
 * FORMATI ACCETTATI:
 * - Formula: P, ~P, (P &amp; Q), P v Q, P -&gt; Q, con parentesi arbitrarie
 * - Enunciato: A1, A2, ..., An / C  (almeno un'assunzione, un solo '/')
 *
 * Il primo errore lessicale o sintattico interrompe il parsing con una
 * {@link FormulaSyntaxException} che riporta la posizione del carattere.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte il testo di una singola formula nel corrispondente albero.
     *
     * @param text formula in notazione infissa
     * @return formula costruita
     * @throws FormulaSyntaxException se il testo non è una formula ben formata
     */
    public static Formula parse(String text) {
        LogicFormulaParser parser = createParser(text);
        Formula formula = new FormulaTreeBuilder().visit(parser.singleFormula());

        LOGGER.fine("Formula letta: " + formula);
        return formula;
    }

    /**
     * Converte un enunciato nella forma {@code A1, ..., An / C}.
     *
     * @param text enunciato completo
     * @return assunzioni e conclusione
     * @throws FormulaSyntaxException se manca il separatore '/' o una formula non è ben formata
     */
    public static Statement parseStatement(String text) {
        LogicFormulaParser parser = createParser(text);
        StatementContext ctx = parser.statement();

        FormulaTreeBuilder builder = new FormulaTreeBuilder();
        List<FormulaContext> formulas = ctx.formula();

        // L'ultima formula è la conclusione, tutte le precedenti sono assunzioni
        List<Formula> assumptions = new ArrayList<>();
        for (int i = 0; i < formulas.size() - 1; i++) {
            assumptions.add(builder.visit(formulas.get(i)));
        }
        Formula conclusion = builder.visit(formulas.get(formulas.size() - 1));

        Statement statement = new Statement(assumptions, conclusion);
        LOGGER.fine("Enunciato letto: " + statement);
        return statement;
    }

    private static LogicFormulaParser createParser(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo da analizzare non può essere null");
        }

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);
        return parser;
    }
}
