package org.logic.evaluation;

import org.logic.support.FormulaTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TABELLA DI VERITÀ - Enumerazione completa dei 2^n assegnamenti di una formula
 *
 * Gli atomi sono ordinati lessicograficamente; la riga i assegna all'atomo j il
 * bit (n-1-j) di i, quindi il primo atomo è il bit più significativo.
 * Una formula senza atomi produce una tabella vuota.
 */
public final class TruthTable {

    private static final Logger LOGGER = Logger.getLogger(TruthTable.class.getName());

    /** Numero massimo di atomi accettati (2^20 righe) */
    public static final int MAX_ATOMS = 20;

    private static final int ATOM_COLUMN_WIDTH = 6;
    private static final int RESULT_COLUMN_WIDTH = 10;

    /**
     * Riga della tabella: valori degli atomi nell'ordine della tabella e risultato.
     */
    public static final class Row {
        private final List<String> atoms;
        private final boolean[] values;
        private final boolean result;

        private Row(List<String> atoms, boolean[] values, boolean result) {
            this.atoms = atoms;
            this.values = values;
            this.result = result;
        }

        public boolean getValue(int atomIndex) {
            return values[atomIndex];
        }

        /** Assegnamento della riga come mappa ordinata atomo -> valore */
        public Map<String, Boolean> getAssignment() {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int j = 0; j < atoms.size(); j++) {
                assignment.put(atoms.get(j), values[j]);
            }
            return assignment;
        }

        public boolean getResult() {
            return result;
        }
    }

    private final List<String> atoms;
    private final List<Row> rows;

    private TruthTable(List<String> atoms, List<Row> rows) {
        this.atoms = atoms;
        this.rows = rows;
    }

    /**
     * Genera la tabella di verità della formula.
     *
     * @param root radice dell'albero (non null)
     * @return tabella con 2^n righe, vuota se la formula non ha atomi
     * @throws IllegalArgumentException se gli atomi sono più di {@link #MAX_ATOMS}
     */
    public static TruthTable generate(FormulaTree root) {
        if (root == null) {
            throw new IllegalArgumentException("Albero non può essere null");
        }

        List<String> atoms = Collections.unmodifiableList(new ArrayList<>(root.collectAtoms()));
        int n = atoms.size();

        if (n == 0) {
            LOGGER.fine("Nessun atomo trovato, tabella vuota");
            return new TruthTable(atoms, Collections.emptyList());
        }
        if (n > MAX_ATOMS) {
            throw new IllegalArgumentException("Troppi atomi per la tabella di verità: " + n + " (massimo " + MAX_ATOMS + ")");
        }

        int total = 1 << n;
        List<Row> rows = new ArrayList<>(total);
        Map<String, Boolean> assignment = new LinkedHashMap<>();

        for (int i = 0; i < total; i++) {
            boolean[] values = new boolean[n];
            for (int j = 0; j < n; j++) {
                values[j] = ((i >> (n - j - 1)) & 1) == 1;
                assignment.put(atoms.get(j), values[j]);
            }
            // Ogni riga assegna tutti gli atomi raccolti: nessuna verifica per riga
            rows.add(new Row(atoms, values, Evaluator.evaluateAssigned(root, assignment)));
        }

        LOGGER.fine("Tabella di verità generata: " + n + " atomi, " + total + " righe");
        return new TruthTable(atoms, Collections.unmodifiableList(rows));
    }

    public List<String> getAtoms() {
        return atoms;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Rende la tabella con una colonna per atomo e la colonna finale "Result";
     * i valori sono stampati come 0/1.
     */
    public String render() {
        StringBuilder builder = new StringBuilder();
        for (String atom : atoms) {
            builder.append(String.format("%" + ATOM_COLUMN_WIDTH + "s", atom));
        }
        builder.append(String.format("%" + RESULT_COLUMN_WIDTH + "s", "Result")).append('\n');
        builder.append("-".repeat(ATOM_COLUMN_WIDTH * atoms.size() + RESULT_COLUMN_WIDTH)).append('\n');

        for (Row row : rows) {
            for (boolean value : row.values) {
                builder.append(String.format("%" + ATOM_COLUMN_WIDTH + "d", value ? 1 : 0));
            }
            builder.append(String.format("%" + RESULT_COLUMN_WIDTH + "d", row.result ? 1 : 0)).append('\n');
        }
        return builder.toString();
    }
}
