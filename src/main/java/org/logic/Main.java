package org.logic;

import org.logic.cnf.CNFConverter;
import org.logic.cnf.CNFValidityAnalyzer;
import org.logic.cnf.CNFValidityReport;
import org.logic.dimacs.DimacsConverter;
import org.logic.evaluation.Evaluator;
import org.logic.evaluation.TruthTable;
import org.logic.evaluation.UndefinedAtomException;
import org.logic.parser.FormulaParser;
import org.logic.parser.MalformedExpressionException;
import org.logic.parser.TreeBuilder;
import org.logic.support.FormulaTree;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * ANALIZZATORE FORMULE PROPOSIZIONALI - Interfaccia a linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula infissa (-e) oppure file CNF in formato DIMACS (-f)
 * 2. CONVERSIONE PREFISSA e costruzione dell'albero di espressione
 * 3. RESA INFISSA completamente parentesizzata e altezza dell'albero
 * 4. VALUTAZIONE con l'assegnamento fornito (-a), se presente
 * 5. TABELLA DI VERITÀ (-tt), se richiesta
 * 6. CONVERSIONE CNF e analisi di tautologia per clausola
 *
 * Un errore in una fase interrompe la pipeline: le fasi dipendenti vengono saltate.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String ASSIGNMENT_PARAM = "-a";
    private static final String TRUTH_TABLE_PARAM = "-tt";

    /** Risorsa di configurazione del logging */
    private static final String LOGGING_CONFIG = "/logging.properties";

    /** Oltre questa lunghezza la formula da file non viene stampata */
    private static final int MAX_PRINTABLE_FORMULA_LENGTH = 2000;

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione scrivendo l'output sullo stream indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return codice di uscita, 0 se la pipeline è stata completata
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_ERROR;
        }

        try {
            AppConfiguration config = new ArgumentParser().parse(args);
            if (config == null) {
                printApplicationHelp(out);
                return EXIT_OK;
            }
            return executeMainPipeline(config, out);

        } catch (IllegalArgumentException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Configurazione logging non caricata", e);
        }
    }

    //endregion

    //region PIPELINE PRINCIPALE

    private static int executeMainPipeline(AppConfiguration config, PrintStream out) {
        String expression = loadExpression(config, out);
        if (expression == null) {
            return EXIT_ERROR;
        }

        // Fase 1: infisso -> prefisso
        List<String> prefix = FormulaParser.toPrefix(expression);
        out.println("\n--- Conversione prefissa ---");
        out.println("Infisso: " + expression);
        out.println("Prefisso: " + FormulaParser.formatPrefix(prefix));

        // Fase 2: prefisso -> albero
        out.println("\n--- Costruzione albero ---");
        FormulaTree root;
        try {
            root = TreeBuilder.build(prefix);
        } catch (MalformedExpressionException e) {
            out.println("[E] " + e.getMessage() + ". Controllare l'espressione in input.");
            return EXIT_ERROR;
        }
        out.println("Albero costruito correttamente.");

        // Fase 3: albero -> infisso, altezza
        out.println("\n--- Resa infissa ---");
        out.println("Infisso: " + root.toInfix());
        out.println("Altezza albero: " + root.height());

        // Fase 4: valutazione
        out.println("\n--- Valutazione ---");
        if (config.assignment.isEmpty()) {
            out.println("Nessun atomo assegnato. Valutazione saltata.");
        } else {
            try {
                boolean result = Evaluator.evaluate(root, config.assignment);
                out.println("La formula vale " + (result ? "TRUE" : "FALSE") + ".");
            } catch (UndefinedAtomException e) {
                out.println("[E] " + e.getMessage());
                return EXIT_ERROR;
            }
        }

        // Fase 5: tabella di verità
        if (config.truthTable) {
            out.println("\n--- Tabella di verità ---");
            TruthTable table = TruthTable.generate(root);
            if (table.isEmpty()) {
                out.println("Nessun atomo trovato.");
            } else {
                out.print(table.render());
            }
        }

        // Fase 6: CNF e validità
        out.println("\n--- Conversione CNF e validità clausole ---");
        CNFValidityReport report = CNFValidityAnalyzer.analyze(CNFConverter.toCNF(root));
        out.println(report);
        return EXIT_OK;
    }

    /**
     * Restituisce la formula da elaborare, letta da argomento o da file DIMACS.
     *
     * @return formula infissa, null se il file non produce alcun risultato
     */
    private static String loadExpression(AppConfiguration config, PrintStream out) {
        if (config.expression != null) {
            out.println("Espressione: " + config.expression);
            return config.expression;
        }

        out.println("Lettura del file CNF: " + config.inputPath);
        String formula;
        try {
            formula = DimacsConverter.convertFile(Paths.get(config.inputPath));
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante lettura file DIMACS", e);
            formula = "";
        }

        if (formula.isEmpty()) {
            out.println("[E] Il file CNF non ha prodotto alcuna formula.");
            return null;
        }

        if (formula.length() > MAX_PRINTABLE_FORMULA_LENGTH) {
            out.println("[I] La formula convertita è troppo lunga per essere mostrata a schermo.");
        } else {
            out.println("Formula da CNF: " + formula);
        }
        return formula;
    }

    private static void printApplicationHelp(PrintStream out) {
        out.println("\n::>> ANALIZZATORE FORMULE PROPOSIZIONALI <<::");
        out.println("Parsing, valutazione e conversione CNF di formule proposizionali\n");

        out.println("UTILIZZO:");
        out.println("  java -jar logic-parser.jar [opzioni]\n");

        out.println("OPZIONI:");
        out.println("  -e <formula>          Formula infissa da elaborare");
        out.println("  -f <file.cnf>         File CNF in formato DIMACS (alternativo a -e)");
        out.println("  -a <atomo=0|1,...>    Assegnamento per la valutazione, es. p=1,q=0");
        out.println("  -tt                   Genera la tabella di verità");
        out.println("  -h                    Mostra questa guida\n");

        out.println("OPERATORI (precedenza decrescente):");
        out.println("  ~  negazione");
        out.println("  *  congiunzione");
        out.println("  +  disgiunzione");
        out.println("  >  implicazione\n");

        out.println("FORMATO DIMACS:");
        out.println("  Righe 'c' e 'p' ignorate, ogni altra riga: <letterali> 0");
        out.println("  k -> xk, -k -> ~xk");
    }

    //endregion

    //region CONFIGURAZIONE E PARSING PARAMETRI

    /**
     * Configurazione immutabile ricavata dalla linea di comando.
     */
    static final class AppConfiguration {
        final String expression;
        final String inputPath;
        final Map<String, Boolean> assignment;
        final boolean truthTable;

        AppConfiguration(String expression, String inputPath, Map<String, Boolean> assignment, boolean truthTable) {
            this.expression = expression;
            this.inputPath = inputPath;
            this.assignment = assignment;
            this.truthTable = truthTable;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * Processa sequenzialmente i parametri e costruisce la configurazione.
         *
         * @param args parametri da linea di comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        AppConfiguration parse(String[] args) {
            String expression = null;
            String inputPath = null;
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            boolean truthTable = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case EXPRESSION_PARAM -> {
                        validateExclusiveInput(inputPath);
                        expression = getNextArgument(args, ++i, "un'espressione");
                    }
                    case FILE_PARAM -> {
                        validateExclusiveInput(expression);
                        inputPath = getNextArgument(args, ++i, "un file");
                    }
                    case ASSIGNMENT_PARAM -> assignment.putAll(parseAssignment(getNextArgument(args, ++i, "un assegnamento")));
                    case TRUTH_TABLE_PARAM -> truthTable = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (expression == null && inputPath == null) {
                throw new IllegalArgumentException("Specificare una formula con -e oppure un file con -f");
            }
            if (expression != null && expression.trim().isEmpty()) {
                throw new IllegalArgumentException("L'espressione non può essere vuota");
            }
            return new AppConfiguration(expression, inputPath, assignment, truthTable);
        }

        /**
         * Interpreta "p=1,q=0" come assegnamento; i valori ammessi sono 0 e 1.
         */
        Map<String, Boolean> parseAssignment(String text) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (String entry : text.split(",")) {
                String[] parts = entry.split("=", -1);
                if (parts.length != 2 || parts[0].trim().isEmpty()) {
                    throw new IllegalArgumentException("Assegnamento non valido: '" + entry + "' (formato atomo=0|1)");
                }
                String value = parts[1].trim();
                if (!value.equals("0") && !value.equals("1")) {
                    throw new IllegalArgumentException("Valore non valido per " + parts[0].trim() + ": inserire 0 oppure 1");
                }
                assignment.put(parts[0].trim(), value.equals("1"));
            }
            return assignment;
        }

        private void validateExclusiveInput(String otherInput) {
            if (otherInput != null) {
                throw new IllegalArgumentException("I parametri -e e -f sono mutualmente esclusivi");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }
    }

    //endregion
}
