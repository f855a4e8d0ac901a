package org.logic.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.logic.support.FormulaTree;
import org.logic.support.FormulaTree.Type;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    @Test
    @DisplayName("Primo pop è il figlio sinistro, secondo il destro")
    void testBuild_BinaryOperandOrder() {
        FormulaTree tree = TreeBuilder.build(List.of(">", "p", "q"));

        assertEquals(Type.IMPLIES, tree.getType());
        assertEquals("p", tree.getLeft().getAtom());
        assertEquals("q", tree.getRight().getAtom());
    }

    @Test
    void testBuild_NegationHasOnlyLeftChild() {
        FormulaTree tree = TreeBuilder.build(List.of("~", "p"));

        assertEquals(Type.NOT, tree.getType());
        assertEquals(FormulaTree.atom("p"), tree.getLeft());
        assertNull(tree.getRight());
    }

    @Test
    void testBuild_NestedExpression() {
        FormulaTree tree = TreeBuilder.build(List.of("*", "+", "p", "q", "~", "r"));

        assertEquals("((p + q) * (~r))", tree.toInfix());
    }

    @Test
    void testBuild_SingleAtom() {
        assertEquals(FormulaTree.atom("x1"), TreeBuilder.build(List.of("x1")));
    }

    @Test
    @DisplayName("Operandi insufficienti per un operatore binario")
    void testBuild_MissingOperand() {
        MalformedExpressionException e = assertThrows(MalformedExpressionException.class,
                () -> TreeBuilder.build(List.of("+", "p")));
        assertTrue(e.getMessage().startsWith("Albero non costruibile"));
    }

    @Test
    void testBuild_NegationWithoutOperand() {
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.build(List.of("~")));
    }

    @Test
    @DisplayName("Più di un sottoalbero rimasto sullo stack")
    void testBuild_TooManyTrees() {
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.build(List.of("p", "q")));
    }

    @Test
    void testBuild_EmptyInput() {
        assertThrows(MalformedExpressionException.class, () -> TreeBuilder.build(List.of()));
    }
}
