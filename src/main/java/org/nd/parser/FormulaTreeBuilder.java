package org.nd.parser;

import org.nd.antlr.LogicFormulaBaseVisitor;
import org.nd.antlr.LogicFormulaParser.AndContext;
import org.nd.antlr.LogicFormulaParser.FormulaContext;
import org.nd.antlr.LogicFormulaParser.IdContext;
import org.nd.antlr.LogicFormulaParser.ImpliesContext;
import org.nd.antlr.LogicFormulaParser.NotContext;
import org.nd.antlr.LogicFormulaParser.OrContext;
import org.nd.antlr.LogicFormulaParser.ParContext;
import org.nd.antlr.LogicFormulaParser.SingleFormulaContext;
import org.nd.antlr.LogicFormulaParser.VarContext;
import org.nd.formula.And;
import org.nd.formula.Formula;
import org.nd.formula.Implies;
import org.nd.formula.Not;
import org.nd.formula.Or;
import org.nd.formula.Variable;

import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERI FORMULA - Visitor dall'albero sintattico ANTLR a {@link Formula}
 *
 * Attraversa l'albero prodotto dalla grammatica LogicFormula e costruisce la
 * formula corrispondente, senza alcuna trasformazione semantica: la struttura
 * risultante è esattamente quella scritta dall'utente.
 *
 * OPERATORI (in ordine di precedenza crescente):
 * - Implicazione (-&gt;): associativa a destra, A -&gt; B -&gt; C ~ A -&gt; (B -&gt; C)
 * - Disgiunzione (v): associativa a sinistra, A v B v C ~ (A v B) v C
 * - Congiunzione (&amp;): associativa a sinistra
 * - Negazione (~): unaria, massima precedenza
 * - Variabili e parentesi
 */
public class FormulaTreeBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTI DI INGRESSO

    @Override
    public Formula visitSingleFormula(SingleFormulaContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    //endregion

    //region CONNETTIVI BINARI

    /**
     * Gestisce le implicazioni. La ricorsione sul conseguente dà l'associatività a destra.
     *
     * @param ctx contesto implicazione dalla grammatica
     * @return implicazione, oppure la disgiunzione sottostante se manca l'operatore
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }

        Formula consequent = visit(ctx.implication());
        return new Implies(antecedent, consequent);
    }

    /**
     * Gestisce le disgiunzioni, piegando gli operandi da sinistra.
     *
     * @param ctx contesto disgiunzione dalla grammatica
     * @return disgiunzione associata a sinistra
     */
    @Override
    public Formula visitOr(OrContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = new Or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    /**
     * Gestisce le congiunzioni, piegando gli operandi da sinistra.
     *
     * @param ctx contesto congiunzione dalla grammatica
     * @return congiunzione associata a sinistra
     */
    @Override
    public Formula visitAnd(AndContext ctx) {
        Formula result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = new And(result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return new Not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        LOGGER.finest("Rimozione parentesi trasparente");
        return visit(ctx.formula());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Elaborazione variabile atomica: " + variableName);
        return new Variable(variableName);
    }

    //endregion
}
