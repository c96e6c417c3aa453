package org.calista.credence.confidence;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    void parsesNestedApplicationsAndAliases() throws MalformedFormulaException {
        Formula f = parser.parse("and(x, or(y, z))");

        assertEquals("min(x, max(y, z))", f.render());
        assertEquals(Set.of("x", "y", "z"), f.inputNames());
        assertEquals(3, f.depth());
    }

    @Test
    void parsesParameters() throws MalformedFormulaException {
        Formula f = parser.parse("weighted_average(a, b; 1, 3)");

        Formula.Application app = assertInstanceOf(Formula.Application.class, f);
        assertEquals(Combinator.WEIGHTED_AVERAGE, app.combinator());
        assertEquals(List.of(1.0, 3.0), app.parameters());
    }

    @Test
    void bareIdentifierIsInputReference() throws MalformedFormulaException {
        assertInstanceOf(Formula.InputRef.class, parser.parse("  claim.support_1 "));
    }

    @Test
    void rejectsMalformedText() {
        for (String bad : List.of("", "min(x", "min(x,)", "frobnicate(x, y)", "min(x, y) z",
                "min()", "not(x, y)", "decay(x)", "decay(x; 2)", "parallel_all_rho(x, y; -0.1)",
                "weighted_average(x, y; 1)", "min(x, y; 0.5)", "min(x # y)")) {
            assertThrows(MalformedFormulaException.class, () -> parser.parse(bad), bad);
        }
    }

    @Test
    void reportsPositionOfUnknownCombinator() {
        MalformedFormulaException e = assertThrows(MalformedFormulaException.class,
                () -> parser.parse("min(x, guess(y))"));

        assertEquals(7, e.position());
    }

    @Test
    void rejectsNestingDeeperThanLimit() {
        FormulaParser shallow = new FormulaParser(3);

        assertDoesNotThrow(() -> shallow.parse("not(not(x))"));
        assertThrows(MalformedFormulaException.class, () -> shallow.parse("not(not(not(x)))"));
    }
}
