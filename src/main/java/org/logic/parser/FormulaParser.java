package org.logic.parser;

import org.logic.support.FormulaTree;

import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Pipeline testo infisso -> albero di espressione
 *
 * Coordina tokenizzazione, conversione in notazione prefissa e costruzione
 * dell'albero. Ogni fase riceve l'output completo della precedente; un errore
 * interrompe la pipeline senza risultati parziali.
 *
 * OPERATORI SUPPORTATI (precedenza decrescente):
 * - "~" negazione
 * - "*" congiunzione
 * - "+" disgiunzione
 * - "&gt;" implicazione
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte il testo infisso in albero di espressione.
     *
     * @param expression formula infissa (non null)
     * @return radice dell'albero
     * @throws MalformedExpressionException se l'albero non può essere costruito
     */
    public static FormulaTree parse(String expression) {
        LOGGER.fine("Inizio parsing formula: " + expression);
        return TreeBuilder.build(toPrefix(expression));
    }

    /**
     * Converte il testo infisso in token prefissi.
     */
    public static List<String> toPrefix(String expression) {
        return InfixToPrefixConverter.toPrefix(expression);
    }

    /**
     * Rappresentazione testuale dei token prefissi separati da spazio, es. "&gt; p q".
     */
    public static String formatPrefix(List<String> prefix) {
        return String.join(" ", prefix);
    }
}
