package org.logic.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TOKENIZZATORE - Suddivisione del testo infisso in atomi, operatori e parentesi
 *
 * Delega la scansione al lexer ANTLR {@link FormulaLexer}: gli spazi vengono
 * scartati, ogni sequenza massimale di caratteri alfanumerici o underscore
 * forma un atomo, ogni altro carattere è un token singolo. Nessuna validazione
 * sintattica: simboli estranei passano come token e falliscono nelle fasi successive.
 */
public final class Tokenizer {

    private static final Logger LOGGER = Logger.getLogger(Tokenizer.class.getName());

    private Tokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Suddivide l'espressione in token testuali.
     *
     * @param expression espressione infissa (non null)
     * @return token nell'ordine del testo
     * @throws IllegalArgumentException se expression è null
     */
    public static List<String> tokenize(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Espressione da tokenizzare non può essere null");
        }

        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(expression));
        // La regola SYMBOL accetta qualsiasi carattere, il lexer non produce errori
        lexer.removeErrorListeners();

        List<String> tokens = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            tokens.add(token.getText());
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Token estratti da '" + expression + "': " + tokens);
        }
        return tokens;
    }

    /**
     * Un token è un operando (atomo) se inizia con lettera, cifra o underscore.
     */
    public static boolean isAtomToken(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        char first = token.charAt(0);
        return isAtomChar(first);
    }

    static boolean isAtomChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
