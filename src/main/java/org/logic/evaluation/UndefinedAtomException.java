package org.logic.evaluation;

/**
 * Segnala che l'assegnamento non contiene un valore per un atomo della formula.
 */
public class UndefinedAtomException extends RuntimeException {

    private final String atom;

    public UndefinedAtomException(String atom) {
        super("Atomo non definito nell'assegnamento: " + atom);
        this.atom = atom;
    }

    /** Nome dell'atomo mancante */
    public String getAtom() {
        return atom;
    }
}
