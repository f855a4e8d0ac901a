package org.logic.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.logic.support.FormulaTree.Type;

import java.util.List;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.logic.support.FormulaTree.and;
import static org.logic.support.FormulaTree.atom;
import static org.logic.support.FormulaTree.implies;
import static org.logic.support.FormulaTree.not;
import static org.logic.support.FormulaTree.or;

class FormulaTreeTest {

    @Nested
    @DisplayName("Costruzione e invarianti")
    class ConstructionTests {

        @Test
        void testAtomIsLeaf() {
            FormulaTree p = atom("p");

            assertEquals(Type.ATOM, p.getType());
            assertTrue(p.isAtom());
            assertNull(p.getLeft());
            assertNull(p.getRight());
        }

        @Test
        void testInvalidAtomNames() {
            assertThrows(IllegalArgumentException.class, () -> atom(null));
            assertThrows(IllegalArgumentException.class, () -> atom(" "));
            assertThrows(IllegalArgumentException.class, () -> atom("*"));
        }

        @Test
        void testNullChildrenRejected() {
            assertThrows(IllegalArgumentException.class, () -> not(null));
            assertThrows(IllegalArgumentException.class, () -> and(atom("p"), null));
            assertThrows(IllegalArgumentException.class, () -> FormulaTree.binary(Type.NOT, atom("p"), atom("q")));
        }

        @Test
        void testTypeFromSymbol() {
            assertEquals(Type.NOT, Type.fromSymbol("~"));
            assertEquals(Type.AND, Type.fromSymbol("*"));
            assertEquals(Type.OR, Type.fromSymbol("+"));
            assertEquals(Type.IMPLIES, Type.fromSymbol(">"));
            assertNull(Type.fromSymbol("p"));
            assertNull(Type.fromSymbol("("));
        }

        @Test
        void testPrecedenceOrder() {
            assertTrue(Type.NOT.precedence() > Type.AND.precedence());
            assertTrue(Type.AND.precedence() > Type.OR.precedence());
            assertTrue(Type.OR.precedence() > Type.IMPLIES.precedence());
        }
    }

    @Nested
    @DisplayName("Resa infissa")
    class RenderingTests {

        @Test
        void testFullyParenthesized() {
            FormulaTree tree = implies(and(atom("p"), not(atom("q"))), or(atom("r"), atom("s")));

            assertEquals("((p * (~q)) > (r + s))", tree.toInfix());
            assertEquals(tree.toInfix(), tree.toString());
        }

        @Test
        void testAtomRendersAsName() {
            assertEquals("x1", atom("x1").toInfix());
        }
    }

    @Nested
    @DisplayName("Analisi strutturale")
    class AnalysisTests {

        @Test
        void testHeight() {
            assertEquals(1, atom("p").height());
            assertEquals(2, not(atom("p")).height());
            assertEquals(4, or(atom("p"), and(atom("q"), not(atom("r")))).height());
        }

        @Test
        @DisplayName("Atomi distinti in ordine lessicografico")
        void testCollectAtoms() {
            FormulaTree tree = or(and(atom("q"), atom("p")), implies(atom("q"), atom("a1")));

            assertEquals(List.of("a1", "p", "q"), new ArrayList<>(tree.collectAtoms()));
        }

        @Test
        void testIsLiteral() {
            assertTrue(atom("p").isLiteral());
            assertTrue(not(atom("p")).isLiteral());
            assertFalse(not(not(atom("p"))).isLiteral());
            assertFalse(or(atom("p"), atom("q")).isLiteral());
        }

        @Test
        @DisplayName("La copia è uguale ma non condivide nodi")
        void testCopyIsDeep() {
            FormulaTree tree = and(not(atom("p")), atom("q"));
            FormulaTree copy = tree.copy();

            assertEquals(tree, copy);
            assertEquals(tree.hashCode(), copy.hashCode());
            assertNotSame(tree.getLeft(), copy.getLeft());
            assertNotSame(tree.getLeft().getLeft(), copy.getLeft().getLeft());
        }

        @Test
        void testEqualityIsOrderSensitive() {
            assertNotEquals(or(atom("p"), atom("q")), or(atom("q"), atom("p")));
        }
    }
}
