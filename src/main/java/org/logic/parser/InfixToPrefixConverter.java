package org.logic.parser;

import org.logic.support.FormulaTree.Type;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * CONVERTITORE INFISSO -> PREFISSO (notazione polacca)
 *
 * ALGORITMO:
 * 1. Inversione della sequenza di token
 * 2. Scambio di ogni "(" con ")" e viceversa
 * 3. Shunting-yard come per la notazione postfissa, estraendo dallo stack
 *    finché la precedenza in cima è strettamente maggiore di quella entrante
 * 4. Inversione dell'output
 *
 * Con la condizione di estrazione stretta, operatori con la stessa precedenza
 * restano sullo stack e vengono emessi insieme al termine del gruppo:
 * "p * q * r" diventa "* * p q r", cioè ((p * q) * r). Lo stesso vale per le
 * catene di implicazioni: "p > q > r" diventa "> > p q r".
 *
 * Parentesi sbilanciate sono tollerate: una chiusura senza apertura non ha
 * effetto, le aperture rimaste sullo stack vengono scartate.
 */
public final class InfixToPrefixConverter {

    private static final Logger LOGGER = Logger.getLogger(InfixToPrefixConverter.class.getName());

    private static final String OPEN = "(";
    private static final String CLOSE = ")";

    private InfixToPrefixConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Tokenizza e converte l'espressione infissa.
     *
     * @param expression espressione infissa (non null)
     * @return token in ordine prefisso
     */
    public static List<String> toPrefix(String expression) {
        return toPrefix(Tokenizer.tokenize(expression));
    }

    /**
     * Converte una sequenza di token infissi in ordine prefisso.
     *
     * @param infixTokens token infissi (non null)
     * @return nuova lista di token in ordine prefisso
     */
    public static List<String> toPrefix(List<String> infixTokens) {
        if (infixTokens == null) {
            throw new IllegalArgumentException("Lista token non può essere null");
        }

        List<String> reversed = new ArrayList<>(infixTokens.size());
        for (int i = infixTokens.size() - 1; i >= 0; i--) {
            reversed.add(swapParenthesis(infixTokens.get(i)));
        }

        Deque<String> operators = new ArrayDeque<>();
        List<String> output = new ArrayList<>();

        for (String token : reversed) {
            if (Tokenizer.isAtomToken(token)) {
                output.add(token);
            } else if (OPEN.equals(token)) {
                operators.push(token);
            } else if (CLOSE.equals(token)) {
                while (!operators.isEmpty() && !OPEN.equals(operators.peek())) {
                    output.add(operators.pop());
                }
                if (!operators.isEmpty()) {
                    operators.pop(); // apertura corrispondente
                }
            } else if (Type.fromSymbol(token) != null) {
                int incoming = precedence(token);
                while (!operators.isEmpty() && precedence(operators.peek()) > incoming) {
                    output.add(operators.pop());
                }
                operators.push(token);
            } else {
                LOGGER.warning("Simbolo non riconosciuto ignorato: '" + token + "'");
            }
        }

        while (!operators.isEmpty()) {
            String top = operators.pop();
            if (!OPEN.equals(top)) {
                output.add(top);
            }
        }

        Collections.reverse(output);
        LOGGER.fine("Conversione prefissa: " + infixTokens + " -> " + output);
        return output;
    }

    /** Precedenza del token, -1 per parentesi e non operatori. */
    static int precedence(String token) {
        Type type = Type.fromSymbol(token);
        return type == null ? -1 : type.precedence();
    }

    private static String swapParenthesis(String token) {
        if (OPEN.equals(token)) {
            return CLOSE;
        }
        if (CLOSE.equals(token)) {
            return OPEN;
        }
        return token;
    }
}
