package org.logic.evaluation;

import org.logic.support.FormulaTree;

import java.util.Map;

/**
 * VALUTATORE - Calcolo del valore di verità di un albero dato un assegnamento
 *
 * Funzione pura e ricorsiva: nessuna mutazione e nessuno stato condiviso tra
 * chiamate. L'assegnamento deve essere completo rispetto agli atomi
 * dell'albero; gli atomi mancanti non ricevono un valore di default.
 */
public final class Evaluator {

    private Evaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Valuta la formula.
     *
     * @param root radice dell'albero (non null)
     * @param assignment mappa atomo -> valore di verità (non null)
     * @return valore della formula
     * @throws UndefinedAtomException se un atomo della formula non ha valore
     */
    public static boolean evaluate(FormulaTree root, Map<String, Boolean> assignment) {
        if (root == null) {
            throw new IllegalArgumentException("Albero da valutare non può essere null");
        }
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        // Completezza verificata prima: AND/OR valutano in corto circuito
        for (String atom : root.collectAtoms()) {
            if (assignment.get(atom) == null) {
                throw new UndefinedAtomException(atom);
            }
        }
        return evaluateNode(root, assignment);
    }

    /**
     * Valutazione senza controllo di completezza, per chiamanti che hanno già
     * costruito un assegnamento su tutti gli atomi della formula.
     */
    static boolean evaluateAssigned(FormulaTree root, Map<String, Boolean> assignment) {
        return evaluateNode(root, assignment);
    }

    private static boolean evaluateNode(FormulaTree node, Map<String, Boolean> assignment) {
        return switch (node.getType()) {
            case ATOM -> {
                Boolean value = assignment.get(node.getAtom());
                if (value == null) {
                    throw new UndefinedAtomException(node.getAtom());
                }
                yield value;
            }
            case NOT -> !evaluateNode(node.getLeft(), assignment);
            case AND -> evaluateNode(node.getLeft(), assignment) && evaluateNode(node.getRight(), assignment);
            case OR -> evaluateNode(node.getLeft(), assignment) || evaluateNode(node.getRight(), assignment);
            // A > B equivale a ~A + B
            case IMPLIES -> !evaluateNode(node.getLeft(), assignment) || evaluateNode(node.getRight(), assignment);
        };
    }
}
