package org.logic.evaluation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.logic.parser.FormulaParser;
import org.logic.support.FormulaTree;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TruthTableTest {

    @Test
    @DisplayName("Righe ordinate con il primo atomo come bit più significativo")
    void testRowOrdering() {
        TruthTable table = TruthTable.generate(FormulaParser.parse("q > p"));

        assertEquals(List.of("p", "q"), table.getAtoms());
        assertEquals(4, table.size());

        TruthTable.Row row = table.getRows().get(2);
        assertTrue(row.getValue(0));
        assertFalse(row.getValue(1));
        assertEquals(Map.of("p", true, "q", false), row.getAssignment());
    }

    @Test
    void testResultsForImplication() {
        TruthTable table = TruthTable.generate(FormulaParser.parse("p > q"));

        List<Boolean> results = table.getRows().stream()
                .map(TruthTable.Row::getResult)
                .collect(Collectors.toList());
        assertEquals(Arrays.asList(true, true, false, true), results);
    }

    @Test
    @DisplayName("2^n righe con assegnamenti distinti")
    void testSizeAndDistinctRows() {
        TruthTable table = TruthTable.generate(FormulaParser.parse("(a + b) * (c > ~d) + e"));

        assertEquals(32, table.size());
        Set<Map<String, Boolean>> distinct = new HashSet<>();
        table.getRows().forEach(row -> distinct.add(row.getAssignment()));
        assertEquals(32, distinct.size());
    }

    @Test
    void testRepeatedAtomCountedOnce() {
        assertEquals(2, TruthTable.generate(FormulaParser.parse("p + ~p")).size());
    }

    @Test
    void testRender() {
        String rendered = TruthTable.generate(FormulaParser.parse("p > q")).render();

        String expected = "     p     q    Result\n"
                + "----------------------\n"
                + "     0     0         1\n"
                + "     0     1         1\n"
                + "     1     0         0\n"
                + "     1     1         1\n";
        assertEquals(expected, rendered);
    }

    @Test
    void testTooManyAtomsRejected() {
        String formula = IntStream.rangeClosed(0, TruthTable.MAX_ATOMS)
                .mapToObj(i -> "a" + i)
                .collect(Collectors.joining(" + "));

        assertThrows(IllegalArgumentException.class, () -> TruthTable.generate(FormulaParser.parse(formula)));
    }

    @Test
    @DisplayName("Ogni risultato coincide con la valutazione completa della riga")
    void testResultsMatchCheckedEvaluation() {
        FormulaTree root = FormulaParser.parse("(p > q) * ~(r + p) + q");
        TruthTable table = TruthTable.generate(root);

        assertEquals(8, table.size());
        for (TruthTable.Row row : table.getRows()) {
            assertEquals(Evaluator.evaluate(root, row.getAssignment()), row.getResult());
            assertEquals(Evaluator.evaluate(root, row.getAssignment()), Evaluator.evaluateAssigned(root, row.getAssignment()));
        }
    }
}
