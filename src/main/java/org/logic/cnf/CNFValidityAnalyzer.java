package org.logic.cnf;

import org.logic.support.Clause;
import org.logic.support.FormulaTree;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * ANALIZZATORE VALIDITÀ CNF - Classificazione tautologica delle clausole
 *
 * Una clausola è tautologica se contiene un letterale e il suo complementare.
 * La formula CNF è una tautologia solo se lo è ogni clausola; la lista vuota
 * di clausole è vacuamente tautologica.
 */
public final class CNFValidityAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(CNFValidityAnalyzer.class.getName());

    private CNFValidityAnalyzer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte la formula in CNF e ne analizza le clausole.
     *
     * @param root albero della formula originale (non null)
     */
    public static CNFValidityReport convertAndAnalyze(FormulaTree root) {
        return analyze(CNFConverter.toCNF(root));
    }

    /**
     * Analizza un albero già in CNF.
     *
     * @param cnfRoot albero CNF (non null)
     * @throws IllegalArgumentException se l'albero non è in CNF
     */
    public static CNFValidityReport analyze(FormulaTree cnfRoot) {
        List<Clause> clauses = ClauseExtractor.extract(cnfRoot);
        return buildReport(cnfRoot.toInfix(), clauses);
    }

    /**
     * Analizza una lista di clausole già estratte.
     */
    public static CNFValidityReport analyze(List<Clause> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }
        return buildReport(null, clauses);
    }

    private static CNFValidityReport buildReport(String cnfText, List<Clause> clauses) {
        int tautological = 0;
        int nonTautological = 0;

        for (Clause clause : clauses) {
            if (clause.isTautology()) {
                tautological++;
            } else {
                nonTautological++;
            }
        }

        LOGGER.fine("Analisi validità: " + tautological + " clausole tautologiche, "
                + nonTautological + " non tautologiche");
        return new CNFValidityReport(cnfText, new ArrayList<>(clauses), tautological, nonTautological);
    }
}
