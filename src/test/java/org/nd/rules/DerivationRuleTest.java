package org.nd.rules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;
import org.nd.formula.Formula;
import org.nd.parser.FormulaParser;

public class DerivationRuleTest {

    @Test
    public void testModusPonens() {
        StubContext context = new StubContext().assume("A -> B").assume("C").assume("A");
        List<Derivation> derivations = new ModusPonens().applications(context);

        assertEquals(1, derivations.size());
        Derivation derivation = derivations.get(0);
        assertEquals(f("B"), derivation.formula());
        assertEquals(List.of(1, 3), derivation.citedLines());
        assertEquals(List.of(1, 3), derivation.dependencies());

        assertTrue(new ModusPonens().justifies(f("B"), List.of(f("A -> B"), f("A"))));
        assertFalse(new ModusPonens().justifies(f("A"), List.of(f("A -> B"), f("B"))));
    }

    @Test
    public void testModusTollens() {
        StubContext context = new StubContext().assume("A -> B").assume("~B");
        List<Derivation> derivations = new ModusTollens().applications(context);

        assertEquals(1, derivations.size());
        assertEquals(f("~A"), derivations.get(0).formula());
        assertEquals(List.of(1, 2), derivations.get(0).citedLines());
        assertTrue(new ModusTollens().justifies(f("~A"), List.of(f("A -> B"), f("~B"))));
        assertFalse(new ModusTollens().justifies(f("~B"), List.of(f("A -> B"), f("~A"))));
    }

    @Test
    public void testDoubleNegation() {
        StubContext context = new StubContext().assume("~~A");
        assertEquals(f("A"), new DoubleNegationElimination().applications(context).get(0).formula());
        assertTrue(new DoubleNegationElimination().justifies(f("A"), List.of(f("~~A"))));

        StubContext introduction = new StubContext().assume("A");
        assertTrue(new DoubleNegationIntroduction().applications(introduction).isEmpty());
        introduction.relevant("~~A");
        assertEquals(f("~~A"), new DoubleNegationIntroduction().applications(introduction).get(0).formula());
        assertTrue(new DoubleNegationIntroduction().justifies(f("~~A"), List.of(f("A"))));
    }

    @Test
    public void testAndEliminationLeftThenRight() {
        StubContext context = new StubContext().assume("A & (B v C)");
        List<Derivation> derivations = new AndElimination().applications(context);

        assertEquals(List.of(f("A"), f("B v C")), derivations.stream().map(Derivation::formula).toList());
        assertTrue(new AndElimination().justifies(f("B v C"), List.of(f("A & (B v C)"))));
        assertFalse(new AndElimination().justifies(f("B"), List.of(f("A & (B v C)"))));
    }

    @Test
    public void testAndIntroductionOnlyBuildsRelevantFormulas() {
        StubContext context = new StubContext().assume("A").assume("B");
        assertTrue(new AndIntroduction().applications(context).isEmpty());

        context.relevant("B & A");
        List<Derivation> derivations = new AndIntroduction().applications(context);
        assertEquals(1, derivations.size());
        assertEquals(f("B & A"), derivations.get(0).formula());
        assertEquals(List.of(2, 1), derivations.get(0).citedLines());
        assertEquals(List.of(1, 2), derivations.get(0).dependencies());
        assertTrue(new AndIntroduction().justifies(f("B & A"), List.of(f("B"), f("A"))));
        assertFalse(new AndIntroduction().justifies(f("A & B"), List.of(f("B"), f("A"))));
    }

    @Test
    public void testOrIntroduction() {
        StubContext context = new StubContext().assume("A").relevant("C v A");
        List<Derivation> derivations = new OrIntroduction().applications(context);

        assertEquals(1, derivations.size());
        assertEquals(f("C v A"), derivations.get(0).formula());
        assertTrue(new OrIntroduction().justifies(f("A v C"), List.of(f("A"))));
        assertFalse(new OrIntroduction().justifies(f("B v C"), List.of(f("A"))));
    }

    @Test
    public void testRulesIgnoreUnrelatedLines() {
        StubContext context = new StubContext().assume("A").assume("B -> C");
        assertTrue(new ModusPonens().applications(context).isEmpty());
        assertTrue(new ModusTollens().applications(context).isEmpty());
        assertTrue(new AndElimination().applications(context).isEmpty());
        assertTrue(new DoubleNegationElimination().applications(context).isEmpty());
    }

    private static Formula f(String text) {
        return FormulaParser.parse(text);
    }
}
