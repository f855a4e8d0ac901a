package org.logic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Pipeline completa")
    class PipelineTests {

        @Test
        void testExpressionWithAssignment() {
            assertEquals(Main.EXIT_OK, run("-e", "p > q", "-a", "p=1,q=0"));

            String out = output();
            assertTrue(out.contains("Prefisso: > p q"));
            assertTrue(out.contains("Infisso: (p > q)"));
            assertTrue(out.contains("Altezza albero: 2"));
            assertTrue(out.contains("La formula vale FALSE."));
            assertTrue(out.contains("Forma CNF: ((~p) + q)"));
            assertTrue(out.contains("Clausole non tautologiche: 1"));
        }

        @Test
        void testTruthTableRequested() {
            assertEquals(Main.EXIT_OK, run("-e", "p + ~p", "-tt"));

            String out = output();
            assertTrue(out.contains("Valutazione saltata"));
            assertTrue(out.contains("Result"));
            assertTrue(out.contains("La CNF è valida (tutte le clausole sono tautologie)."));
        }

        @Test
        void testDimacsFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("formula.cnf");
            Files.write(file, List.of("p cnf 2 2", "1 -2 0", "2 0"));

            assertEquals(Main.EXIT_OK, run("-f", file.toString()));
            assertTrue(output().contains("Formula da CNF: (x1 + ~x2) * (x2)"));
        }
    }

    @Nested
    @DisplayName("Errori")
    class ErrorTests {

        @Test
        @DisplayName("Espressione malformata interrompe la pipeline")
        void testMalformedExpression() {
            assertEquals(Main.EXIT_ERROR, run("-e", "p +"));

            String out = output();
            assertTrue(out.contains("Albero non costruibile"));
            assertFalse(out.contains("Forma CNF"));
        }

        @Test
        void testUndefinedAtom() {
            assertEquals(Main.EXIT_ERROR, run("-e", "p * q", "-a", "p=1"));
            assertTrue(output().contains("Atomo non definito nell'assegnamento: q"));
        }

        @Test
        void testMissingFileIsEmptyResult(@TempDir Path dir) {
            assertEquals(Main.EXIT_ERROR, run("-f", dir.resolve("assente.cnf").toString()));
            assertTrue(output().contains("Il file CNF non ha prodotto alcuna formula."));
        }

        @Test
        void testInvalidArguments() {
            assertEquals(Main.EXIT_ERROR, run());
            assertEquals(Main.EXIT_ERROR, run("-x"));
            assertEquals(Main.EXIT_ERROR, run("-e"));
            assertEquals(Main.EXIT_ERROR, run("-e", "p", "-f", "a.cnf"));
            assertEquals(Main.EXIT_ERROR, run("-e", "p", "-a", "p=2"));
        }

        @Test
        void testHelp() {
            assertEquals(Main.EXIT_OK, run("-h"));
            assertTrue(output().contains("UTILIZZO:"));
        }
    }

    @Test
    void testParseAssignment() {
        Map<String, Boolean> assignment = new Main.ArgumentParser().parseAssignment("p=1, q = 0");

        assertEquals(Map.of("p", true, "q", false), assignment);
    }
}
