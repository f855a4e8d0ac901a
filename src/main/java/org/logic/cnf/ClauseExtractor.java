package org.logic.cnf;

import org.logic.support.Clause;
import org.logic.support.FormulaTree;
import org.logic.support.Literal;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ESTRATTORE CLAUSOLE - Da albero CNF a lista di clausole di letterali
 *
 * Ai nodi AND si visitano entrambi i figli accumulandone le clausole; ogni
 * altro sottoalbero è una clausola i cui letterali si ottengono percorrendo la
 * catena di OR. L'ordine di visita è sinistra prima di destra. La forma
 * dell'albero è verificata con {@link CNFConverter#isCNF} prima della visita.
 */
public final class ClauseExtractor {

    private static final Logger LOGGER = Logger.getLogger(ClauseExtractor.class.getName());

    private ClauseExtractor() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Estrae le clausole da un albero in CNF.
     *
     * @param cnfRoot radice dell'albero CNF (non null)
     * @return clausole in ordine di visita
     * @throws IllegalArgumentException se l'albero non è in CNF
     */
    public static List<Clause> extract(FormulaTree cnfRoot) {
        if (cnfRoot == null) {
            throw new IllegalArgumentException("Albero CNF non può essere null");
        }
        if (!CNFConverter.isCNF(cnfRoot)) {
            throw new IllegalArgumentException("Albero non in CNF: " + cnfRoot);
        }

        List<Clause> clauses = new ArrayList<>();
        collectClauses(cnfRoot, clauses);
        LOGGER.fine("Clausole totali estratte: " + clauses.size());
        return clauses;
    }

    private static void collectClauses(FormulaTree node, List<Clause> clauses) {
        switch (node.getType()) {
            case AND -> {
                collectClauses(node.getLeft(), clauses);
                collectClauses(node.getRight(), clauses);
            }
            default -> {
                List<Literal> literals = new ArrayList<>();
                collectLiterals(node, literals);
                Clause clause = new Clause(literals);
                clauses.add(clause);

                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Clausola aggiunta: " + clause);
                }
            }
        }
    }

    private static void collectLiterals(FormulaTree node, List<Literal> literals) {
        switch (node.getType()) {
            case OR -> {
                collectLiterals(node.getLeft(), literals);
                collectLiterals(node.getRight(), literals);
            }
            case ATOM -> literals.add(Literal.positive(node.getAtom()));
            // isCNF garantisce NOT solo sopra un atomo
            default -> literals.add(Literal.negative(node.getLeft().getAtom()));
        }
    }
}
