package org.logic.parser;

/**
 * Segnala che l'albero non può essere costruito dai token in notazione prefissa:
 * un operatore non trova abbastanza operandi oppure al termine non resta
 * esattamente un sottoalbero.
 */
public class MalformedExpressionException extends IllegalArgumentException {

    public MalformedExpressionException(String message) {
        super(message);
    }
}
