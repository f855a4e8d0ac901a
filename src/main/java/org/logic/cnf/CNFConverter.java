package org.logic.cnf;

import org.logic.support.FormulaTree;
import org.logic.support.FormulaTree.Type;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CONVERTITORE CNF - Trasformazione di alberi di espressione in Forma Normale Congiuntiva
 *
 * Applica in sequenza tre passate di riscrittura strutturale, ognuna delle quali
 * preserva l'equivalenza logica. Gli alberi sono immutabili: ogni passata
 * restituisce lo stesso sottoalbero se invariato oppure un sottoalbero nuovo,
 * per cui il risultato resta sempre una gerarchia semplice.
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Eliminazione implicazioni: A &gt; B -&gt; ~A + B
 * 2. Normalizzazione negazioni (NNF) con doppia negazione e leggi di De Morgan
 * 3. Distribuzione OR su AND
 */
public final class CNFConverter {

    private static final Logger LOGGER = Logger.getLogger(CNFConverter.class.getName());

    private CNFConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA CONVERSIONE CNF

    /**
     * Converte la formula in CNF: congiunzione di disgiunzioni di letterali
     * (o singola clausola, o singolo letterale se la formula degenera).
     *
     * @param root radice dell'albero da convertire (non null)
     * @return albero in CNF logicamente equivalente
     * @throws RuntimeException se la trasformazione fallisce
     */
    public static FormulaTree toCNF(FormulaTree root) {
        if (root == null) {
            throw new IllegalArgumentException("Albero da convertire non può essere null");
        }

        try {
            LOGGER.fine("Inizio conversione CNF per: " + root);

            // Fase 1: eliminazione implicazioni
            FormulaTree result = eliminateImplications(root);
            LOGGER.finest("Dopo eliminazione implicazioni: " + result);

            // Fase 2: negazioni spinte verso gli atomi
            result = normalizeNegations(result);
            LOGGER.finest("Dopo normalizzazione negazioni: " + result);

            // Fase 3: distribuzione OR su AND
            result = distributeOrOverAnd(result);
            LOGGER.fine("Conversione CNF completata: " + result);

            return result;

        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore durante conversione CNF", e);
            throw new RuntimeException("Conversione CNF fallita per formula: " + root, e);
        }
    }

    //endregion

    //region FASE 1: ELIMINAZIONE IMPLICAZIONI

    /**
     * Riscrive ogni A &gt; B in (~A) + B, dal basso verso l'alto così che le
     * implicazioni annidate siano eliminate completamente.
     *
     * @param node radice del sottoalbero
     * @return sottoalbero senza nodi IMPLIES
     */
    public static FormulaTree eliminateImplications(FormulaTree node) {
        return switch (node.getType()) {
            case ATOM -> node;

            case NOT -> {
                FormulaTree operand = eliminateImplications(node.getLeft());
                yield operand == node.getLeft() ? node : FormulaTree.not(operand);
            }

            case AND, OR -> {
                FormulaTree left = eliminateImplications(node.getLeft());
                FormulaTree right = eliminateImplications(node.getRight());
                yield left == node.getLeft() && right == node.getRight()
                        ? node
                        : FormulaTree.binary(node.getType(), left, right);
            }

            // A > B -> (~A) + B
            case IMPLIES -> FormulaTree.or(
                    FormulaTree.not(eliminateImplications(node.getLeft())),
                    eliminateImplications(node.getRight()));
        };
    }

    //endregion

    //region FASE 2: NORMALIZZAZIONE NEGAZIONI (LEGGI DE MORGAN)

    /**
     * Spinge le negazioni verso le foglie, dall'alto verso il basso.
     *
     * TRASFORMAZIONI APPLICATE:
     * - ~~A -&gt; A
     * - ~(A + B) -&gt; (~A) * (~B)
     * - ~(A * B) -&gt; (~A) + (~B)
     * - ~P su atomo resta invariato
     *
     * Dopo la fase 1 ogni NOT risultante ha come figlio un atomo.
     *
     * @param node radice del sottoalbero senza implicazioni
     * @return sottoalbero in forma normale negata
     */
    public static FormulaTree normalizeNegations(FormulaTree node) {
        return switch (node.getType()) {
            case ATOM -> node;
            case NOT -> applyNegationTransformation(node);
            case AND, OR, IMPLIES -> {
                FormulaTree left = normalizeNegations(node.getLeft());
                FormulaTree right = normalizeNegations(node.getRight());
                yield left == node.getLeft() && right == node.getRight()
                        ? node
                        : FormulaTree.binary(node.getType(), left, right);
            }
        };
    }

    /**
     * Trasformazioni specifiche per un nodo NOT in base al tipo del figlio.
     */
    private static FormulaTree applyNegationTransformation(FormulaTree negation) {
        FormulaTree child = negation.getLeft();

        return switch (child.getType()) {
            case ATOM -> negation;

            // ~~A -> A
            case NOT -> normalizeNegations(child.getLeft());

            // ~(A + B) -> (~A) * (~B)
            case OR -> FormulaTree.and(
                    normalizeNegations(FormulaTree.not(child.getLeft())),
                    normalizeNegations(FormulaTree.not(child.getRight())));

            // ~(A * B) -> (~A) + (~B)
            case AND -> FormulaTree.or(
                    normalizeNegations(FormulaTree.not(child.getLeft())),
                    normalizeNegations(FormulaTree.not(child.getRight())));

            case IMPLIES -> {
                // Possibile solo se la fase 1 non è stata applicata
                LOGGER.warning("Negazione di implicazione trovata durante normalizzazione: " + negation);
                yield negation;
            }
        };
    }

    //endregion

    //region FASE 3: DISTRIBUZIONE OR SU AND

    /**
     * Distribuisce OR sopra AND, dal basso verso l'alto.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * - (A1 * A2) + B -&gt; (A1 + B) * (A2 + B)
     * - A + (B1 * B2) -&gt; (A + B1) * (A + B2)
     *
     * Se entrambi i lati sono AND si applica prima la regola sinistra; la
     * ricorsione gestisce poi l'AND destro all'interno di ciascun ramo.
     *
     * @param node radice del sottoalbero in forma normale negata
     * @return sottoalbero in CNF
     */
    public static FormulaTree distributeOrOverAnd(FormulaTree node) {
        return switch (node.getType()) {
            case ATOM, NOT -> node;

            case OR -> distributeOr(
                    distributeOrOverAnd(node.getLeft()),
                    distributeOrOverAnd(node.getRight()));

            case AND, IMPLIES -> {
                FormulaTree left = distributeOrOverAnd(node.getLeft());
                FormulaTree right = distributeOrOverAnd(node.getRight());
                yield left == node.getLeft() && right == node.getRight()
                        ? node
                        : FormulaTree.binary(node.getType(), left, right);
            }
        };
    }

    /**
     * Costruisce left + right con operandi già distribuiti. Il lato che viene
     * replicato in due rami è copiato, così nessun sottoalbero ha due genitori.
     */
    private static FormulaTree distributeOr(FormulaTree left, FormulaTree right) {
        if (left.getType() == Type.AND) {
            return FormulaTree.and(
                    distributeOr(left.getLeft(), right),
                    distributeOr(left.getRight(), right.copy()));
        }
        if (right.getType() == Type.AND) {
            return FormulaTree.and(
                    distributeOr(left, right.getLeft()),
                    distributeOr(left.copy(), right.getRight()));
        }
        return FormulaTree.or(left, right);
    }

    //endregion

    //region VERIFICA STRUTTURA

    /**
     * Verifica se l'albero è una congiunzione di clausole di letterali.
     */
    public static boolean isCNF(FormulaTree node) {
        if (node.getType() == Type.AND) {
            return isCNF(node.getLeft()) && isCNF(node.getRight());
        }
        return isClause(node);
    }

    private static boolean isClause(FormulaTree node) {
        if (node.getType() == Type.OR) {
            return isClause(node.getLeft()) && isClause(node.getRight());
        }
        return node.isLiteral();
    }

    //endregion
}
