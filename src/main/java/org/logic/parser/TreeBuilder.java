package org.logic.parser;

import org.logic.support.FormulaTree;
import org.logic.support.FormulaTree.Type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO - Da token prefissi ad albero di espressione binario
 *
 * Scorre i token dall'ultimo al primo mantenendo uno stack di sottoalberi:
 * - atomo: push di una nuova foglia
 * - "~": pop di un sottoalbero come figlio sinistro, push del nodo NOT
 * - operatore binario: primo pop = figlio sinistro, secondo pop = figlio destro
 *
 * Al termine deve restare esattamente un sottoalbero.
 */
public final class TreeBuilder {

    private static final Logger LOGGER = Logger.getLogger(TreeBuilder.class.getName());

    private TreeBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Costruisce l'albero dai token in ordine prefisso.
     *
     * @param prefix token prefissi (non null)
     * @return radice dell'albero costruito
     * @throws MalformedExpressionException se mancano operandi o non resta un solo albero
     */
    public static FormulaTree build(List<String> prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("Lista token prefissi non può essere null");
        }

        Deque<FormulaTree> stack = new ArrayDeque<>();

        for (int i = prefix.size() - 1; i >= 0; i--) {
            String token = prefix.get(i);
            Type type = Type.fromSymbol(token);

            if (type == null) {
                stack.push(FormulaTree.atom(token));
            } else if (type == Type.NOT) {
                if (stack.isEmpty()) {
                    throw failure("operando mancante per '~' in posizione " + i, prefix);
                }
                stack.push(FormulaTree.not(stack.pop()));
            } else {
                if (stack.size() < 2) {
                    throw failure("operandi insufficienti per '" + token + "' in posizione " + i, prefix);
                }
                FormulaTree left = stack.pop();
                FormulaTree right = stack.pop();
                stack.push(FormulaTree.binary(type, left, right));
            }
        }

        if (stack.size() != 1) {
            throw failure(stack.size() + " sottoalberi rimasti sullo stack invece di 1", prefix);
        }

        FormulaTree root = stack.pop();
        LOGGER.fine("Albero costruito: " + root);
        return root;
    }

    private static MalformedExpressionException failure(String reason, List<String> prefix) {
        LOGGER.fine("Costruzione albero fallita (" + reason + ") per " + prefix);
        return new MalformedExpressionException("Albero non costruibile: " + reason);
    }
}
