package org.logic.support;

import java.util.Objects;

/**
 * LETTERALE - Atomo eventualmente negato all'interno di una clausola CNF
 *
 * Prodotto solo durante l'estrazione delle clausole: un letterale negato
 * corrisponde esattamente a un nodo NOT posto direttamente sopra un atomo.
 * Forma testuale: "p" oppure "~p".
 */
public final class Literal {

    /** Prefisso testuale della negazione */
    public static final String NEGATION_PREFIX = "~";

    /** Nome dell'atomo referenziato */
    private final String atom;

    /** true se il letterale è negato */
    private final boolean negated;

    /**
     * @param atom nome dell'atomo (non null, non vuoto)
     * @param negated true per il letterale negativo
     * @throws IllegalArgumentException se atom null o vuoto
     */
    public Literal(String atom, boolean negated) {
        if (atom == null || atom.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome atomo del letterale non può essere null o vuoto");
        }
        this.atom = atom;
        this.negated = negated;
    }

    public static Literal positive(String atom) {
        return new Literal(atom, false);
    }

    public static Literal negative(String atom) {
        return new Literal(atom, true);
    }

    public String getAtom() {
        return atom;
    }

    public boolean isNegated() {
        return negated;
    }

    /** Letterale complementare: p &lt;-&gt; ~p */
    public Literal negate() {
        return new Literal(atom, !negated);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Literal other = (Literal) obj;
        return negated == other.negated && atom.equals(other.atom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(atom, negated);
    }

    @Override
    public String toString() {
        return negated ? NEGATION_PREFIX + atom : atom;
    }
}
