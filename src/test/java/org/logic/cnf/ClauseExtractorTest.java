package org.logic.cnf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.logic.parser.FormulaParser;
import org.logic.support.Clause;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ClauseExtractorTest {

    private static List<String> render(List<Clause> clauses) {
        return clauses.stream().map(Clause::toString).collect(Collectors.toList());
    }

    @Test
    void testConjunctionOfClauses() {
        List<Clause> clauses = ClauseExtractor.extract(FormulaParser.parse("(x1 + ~x2) * (x2) * (~x3 + x1 + x4)"));

        assertEquals(List.of("(x1 + ~x2)", "(x2)", "(~x3 + x1 + x4)"), render(clauses));
    }

    @Test
    void testSingleLiteralIsOneClause() {
        assertEquals(List.of("(~p)"), render(ClauseExtractor.extract(FormulaParser.parse("~p"))));
    }

    @Test
    void testDuplicateLiteralsPreserved() {
        assertEquals(List.of("(p + p)"), render(ClauseExtractor.extract(FormulaParser.parse("p + p"))));
    }

    @Test
    void testNonCnfTreeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ClauseExtractor.extract(FormulaParser.parse("p + (q * r)")));
        assertThrows(IllegalArgumentException.class,
                () -> ClauseExtractor.extract(FormulaParser.parse("~(p + q)")));
        assertThrows(IllegalArgumentException.class,
                () -> ClauseExtractor.extract(FormulaParser.parse("p > q")));
    }

    @Test
    @DisplayName("Rifiuto anche per AND annidato sotto OR in posizione profonda")
    void testNestedNonCnfRejectedBeforeExtraction() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ClauseExtractor.extract(FormulaParser.parse("(p + q) * (r + (s * t))")));
        assertTrue(ex.getMessage().startsWith("Albero non in CNF"));

        assertThrows(IllegalArgumentException.class,
                () -> ClauseExtractor.extract(FormulaParser.parse("(p + q) * ~~r")));
    }
}
