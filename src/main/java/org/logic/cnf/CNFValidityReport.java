package org.logic.cnf;

import org.logic.support.Clause;

import java.util.Collections;
import java.util.List;

/**
 * RAPPORTO VALIDITÀ CNF - Esito immutabile dell'analisi di tautologia per clausola
 *
 * COMPONENTI:
 * - Formula CNF resa in notazione infissa
 * - Clausole estratte in ordine di visita
 * - Conteggi di clausole tautologiche e non tautologiche
 * - Verdetto complessivo: vero solo se ogni clausola è tautologica
 */
public final class CNFValidityReport {

    private final String cnfText;
    private final List<Clause> clauses;
    private final int tautologicalCount;
    private final int nonTautologicalCount;

    CNFValidityReport(String cnfText, List<Clause> clauses, int tautologicalCount, int nonTautologicalCount) {
        if (tautologicalCount + nonTautologicalCount != clauses.size()) {
            throw new IllegalArgumentException("Conteggi incoerenti con il numero di clausole: "
                    + tautologicalCount + " + " + nonTautologicalCount + " != " + clauses.size());
        }
        this.cnfText = cnfText;
        this.clauses = Collections.unmodifiableList(clauses);
        this.tautologicalCount = tautologicalCount;
        this.nonTautologicalCount = nonTautologicalCount;
    }

    /** Formula CNF in notazione infissa, null se l'analisi è partita da una lista di clausole */
    public String getCnfText() {
        return cnfText;
    }

    public List<Clause> getClauses() {
        return clauses;
    }

    public int getTautologicalCount() {
        return tautologicalCount;
    }

    public int getNonTautologicalCount() {
        return nonTautologicalCount;
    }

    /** Vero se tutte le clausole sono tautologiche (vacuamente vero senza clausole). */
    public boolean isTautology() {
        return nonTautologicalCount == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (cnfText != null) {
            sb.append("Forma CNF: ").append(cnfText).append('\n');
        }
        sb.append("Clausole tautologiche: ").append(tautologicalCount).append('\n');
        sb.append("Clausole non tautologiche: ").append(nonTautologicalCount).append('\n');
        sb.append(isTautology()
                ? "La CNF è valida (tutte le clausole sono tautologie)."
                : "La CNF non è valida (alcune clausole non sono tautologie).");
        return sb.toString();
    }
}
