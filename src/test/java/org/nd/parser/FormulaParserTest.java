package org.nd.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.nd.formula.Formula.and;
import static org.nd.formula.Formula.implies;
import static org.nd.formula.Formula.not;
import static org.nd.formula.Formula.or;
import static org.nd.formula.Formula.var;

import java.util.List;

import org.junit.Test;
import org.nd.formula.Formula;

public class FormulaParserTest {

    @Test
    public void testPrecedenceTightestFirst() {
        Formula expected = implies(or(and(not(var("A")), var("B")), var("C")), var("D"));
        assertEquals(expected, FormulaParser.parse("~A & B v C -> D"));
    }

    @Test
    public void testImplicationIsRightAssociative() {
        assertEquals(implies(var("A"), implies(var("B"), var("C"))), FormulaParser.parse("A -> B -> C"));
        assertEquals(implies(implies(var("A"), var("B")), var("C")), FormulaParser.parse("(A -> B) -> C"));
    }

    @Test
    public void testConjunctionAndDisjunctionAreLeftAssociative() {
        assertEquals(and(and(var("A"), var("B")), var("C")), FormulaParser.parse("A & B & C"));
        assertEquals(or(or(var("A"), var("B")), var("C")), FormulaParser.parse("A v B v C"));
    }

    @Test
    public void testLowerCaseVIsAlwaysDisjunction() {
        assertEquals(or(var("P"), var("Q")), FormulaParser.parse("PvQ"));
        assertEquals(var("AB"), FormulaParser.parse("AB"));
    }

    @Test
    public void testWhitespaceIsInsignificant() {
        assertEquals(FormulaParser.parse("(A->B)&~C"), FormulaParser.parse(" ( A\t-> B )\n &  ~ C "));
    }

    @Test
    public void testNestedNegation() {
        assertEquals(not(not(var("A"))), FormulaParser.parse("~~A"));
        assertEquals(not(and(var("A"), var("B"))), FormulaParser.parse("~(A & B)"));
    }

    @Test
    public void testRoundTripThroughCanonicalText() {
        List<String> inputs = List.of("A", "~A -> B", "(A v B) & ~(C -> D)", "A -> B -> C", "~~(P v Q v R)");
        for (String input : inputs) {
            Formula formula = FormulaParser.parse(input);
            assertEquals(input, formula, FormulaParser.parse(formula.toString()));
        }
    }

    @Test
    public void testStatement() {
        Statement statement = FormulaParser.parseStatement("A -> B, B -> C, A / C");
        assertEquals(List.of(implies(var("A"), var("B")), implies(var("B"), var("C")), var("A")), statement.assumptions());
        assertEquals(var("C"), statement.conclusion());
    }

    @Test
    public void testCompactStatement() {
        Statement statement = FormulaParser.parseStatement("A,B/C");
        assertEquals(List.of(var("A"), var("B")), statement.assumptions());
        assertEquals(var("C"), statement.conclusion());
    }

    @Test
    public void testDanglingOperatorReportsPositionAfterIt() {
        assertSyntaxError("A&", 2);
    }

    @Test
    public void testUnknownCharacter() {
        assertSyntaxError("A # B", 2);
    }

    @Test
    public void testUnbalancedParentheses() {
        assertSyntaxError("(A & B", 6);
        assertSyntaxError("A)", 1);
    }

    @Test
    public void testEmptyInput() {
        assertSyntaxError("", 0);
    }

    @Test
    public void testMissingSeparator() {
        try {
            FormulaParser.parseStatement("A, B");
            fail("Enunciato senza '/' accettato");
        } catch (FormulaSyntaxException e) {
            assertEquals(4, e.getPosition());
        }
    }

    @Test(expected = FormulaSyntaxException.class)
    public void testMalformedAssumption() {
        FormulaParser.parseStatement("A ->, B / B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullText() {
        FormulaParser.parse(null);
    }

    private static void assertSyntaxError(String text, int position) {
        try {
            FormulaParser.parse(text);
            fail("Testo non valido accettato: " + text);
        } catch (FormulaSyntaxException e) {
            assertEquals("posizione per '" + text + "'", position, e.getPosition());
        }
    }
}
