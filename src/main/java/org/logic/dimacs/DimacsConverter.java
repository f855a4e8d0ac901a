package org.logic.dimacs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * CONVERTITORE DIMACS - Da file CNF in formato DIMACS a formula infissa
 *
 * FORMATO GESTITO:
 * - Righe vuote, commenti ("c ...") e header ("p cnf ...") ignorati
 * - Ogni altra riga è una clausola: interi separati da spazi terminati da 0
 * - k positivo -&gt; atomo "xk", -k -&gt; letterale negato "~xk"
 *
 * OUTPUT: "(l1 + l2 + ...) * (l1 + ...) * ..." pronto per essere riletto dal parser.
 */
public final class DimacsConverter {

    private static final Logger LOGGER = Logger.getLogger(DimacsConverter.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Prefisso per gli atomi generati dagli indici numerici */
    public static final String VARIABLE_PREFIX = "x";

    /** Terminatore clausola nel formato DIMACS */
    private static final int CLAUSE_TERMINATOR = 0;

    /** Carattere commento nel formato DIMACS */
    private static final char COMMENT_CHAR = 'c';

    /** Carattere iniziale dell'header problema */
    private static final char PROBLEM_CHAR = 'p';

    /** Token intero con segno opzionale */
    private static final Pattern INTEGER_TOKEN = Pattern.compile("[-+]?\\d+");

    private static final String OR_SEPARATOR = " + ";
    private static final String AND_SEPARATOR = " * ";

    //endregion

    private DimacsConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Legge un file DIMACS e lo converte in formula infissa.
     *
     * @param path percorso del file .cnf
     * @return formula infissa, stringa vuota se il file non contiene clausole
     * @throws IOException se il file non esiste o non è leggibile
     */
    public static String convertFile(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Percorso file non può essere null");
        }
        if (!path.toString().toLowerCase().endsWith(".cnf")) {
            LOGGER.warning("File non ha estensione .cnf: " + path);
        }
        if (!Files.exists(path)) {
            throw new IOException("File non esistente: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File non leggibile: " + path);
        }

        List<String> lines = Files.readAllLines(path);
        LOGGER.fine("File letto: " + lines.size() + " righe totali");
        return convertLines(lines);
    }

    /**
     * Converte le righe di un documento DIMACS in formula infissa.
     *
     * @param lines righe del documento (non null)
     * @return formula infissa, stringa vuota se non ci sono clausole
     * @throws IllegalArgumentException se un letterale numerico è fuori dall'intervallo 1..2147483647 in valore assoluto
     */
    public static String convertLines(List<String> lines) {
        if (lines == null) {
            throw new IllegalArgumentException("Lista righe non può essere null");
        }

        List<String> clauses = new ArrayList<>();
        for (int lineNumber = 0; lineNumber < lines.size(); lineNumber++) {
            String clause = processLine(lines.get(lineNumber), lineNumber + 1);
            if (clause != null) {
                clauses.add(clause);
            }
        }

        LOGGER.fine("Conversione DIMACS completata: " + clauses.size() + " clausole");
        return String.join(AND_SEPARATOR, clauses);
    }

    //endregion

    //region PARSING RIGHE

    /**
     * Converte una riga in clausola infissa.
     *
     * @return clausola "(...)", null se la riga va saltata
     */
    private static String processLine(String line, int lineNumber) {
        String cleanLine = line.trim();

        if (isLineToSkip(cleanLine)) {
            return null;
        }

        List<Integer> literals = parseClauseFromLine(cleanLine, lineNumber);
        if (literals == null || literals.isEmpty()) {
            LOGGER.warning("Riga " + lineNumber + " ignorata: nessun letterale valido");
            return null;
        }

        String clause = literals.stream()
                .map(DimacsConverter::toLiteral)
                .collect(Collectors.joining(OR_SEPARATOR, "(", ")"));

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Clausola estratta da riga " + lineNumber + ": " + clause);
        }
        return clause;
    }

    private static boolean isLineToSkip(String line) {
        return line.isEmpty()
                || line.charAt(0) == COMMENT_CHAR
                || line.charAt(0) == PROBLEM_CHAR;
    }

    /**
     * Legge i letterali fino al terminatore 0.
     *
     * @return letterali con segno, null se la riga contiene token non numerici
     * @throws IllegalArgumentException se un indice di variabile è fuori intervallo
     */
    private static List<Integer> parseClauseFromLine(String line, int lineNumber) {
        List<Integer> clause = new ArrayList<>();
        for (String token : line.split("\\s+")) {
            if (!INTEGER_TOKEN.matcher(token).matches()) {
                LOGGER.warning("Riga " + lineNumber + " non numerica: '" + line + "'");
                return null;
            }
            int literal = toVariableIndex(token, lineNumber);
            if (literal == CLAUSE_TERMINATOR) {
                break;
            }
            clause.add(literal);
        }
        return clause;
    }

    /**
     * Interpreta un token intero; il valore assoluto deve stare in 0..Integer.MAX_VALUE
     * così che anche la sua negazione sia rappresentabile.
     */
    private static int toVariableIndex(String token, int lineNumber) {
        long value;
        try {
            value = Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Riga " + lineNumber + ": letterale fuori intervallo '" + token + "'", e);
        }
        if (value > Integer.MAX_VALUE || value < -Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Riga " + lineNumber + ": letterale fuori intervallo '" + token + "'");
        }
        return (int) value;
    }

    private static String toLiteral(int literal) {
        return literal < 0
                ? "~" + VARIABLE_PREFIX + (-literal)
                : VARIABLE_PREFIX + literal;
    }

    //endregion
}
