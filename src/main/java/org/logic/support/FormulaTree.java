package org.logic.support;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * ALBERO DI ESPRESSIONE - Rappresentazione immutabile di formule proposizionali
 *
 * Ogni nodo è un atomo (foglia con solo il nome) oppure l'applicazione di un
 * operatore: NOT possiede solo il figlio sinistro, AND/OR/IMPLIES possiedono
 * sempre entrambi i figli ordinati sinistro/destro.
 *
 * INVARIANTI MANTENUTE:
 * - Un nodo è foglia se e solo se il suo tipo è ATOM
 * - I nodi NOT hanno figlio sinistro e nessun figlio destro
 * - I nodi binari hanno entrambi i figli valorizzati
 * - I nodi sono immutabili: le trasformazioni costruiscono nuovi alberi
 */
public final class FormulaTree {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, con simbolo testuale e precedenza dell'operatore.
     * Precedenza (dalla più alta): NOT(3) > AND(2) > OR(1) > IMPLIES(0).
     */
    public enum Type {
        ATOM(null, -1),
        NOT("~", 3),
        AND("*", 2),
        OR("+", 1),
        IMPLIES(">", 0);

        private final String symbol;
        private final int precedence;

        Type(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        /** Simbolo dell'operatore nella notazione infissa, null per ATOM */
        public String symbol() {
            return symbol;
        }

        /** Livello di precedenza, -1 per ATOM */
        public int precedence() {
            return precedence;
        }

        public boolean isBinary() {
            return this == AND || this == OR || this == IMPLIES;
        }

        /**
         * Restituisce il tipo operatore corrispondente al token.
         *
         * @param token token testuale
         * @return tipo operatore, null se il token non è uno dei quattro operatori
         */
        public static Type fromSymbol(String token) {
            if (token == null) {
                return null;
            }
            for (Type type : values()) {
                if (token.equals(type.symbol)) {
                    return type;
                }
            }
            return null;
        }
    }

    /** Tipo del nodo */
    private final Type type;

    /** Nome dell'atomo (solo per nodi ATOM) */
    private final String atom;

    /** Figlio sinistro (operando unico per NOT) */
    private final FormulaTree left;

    /** Figlio destro (solo per nodi binari) */
    private final FormulaTree right;

    //endregion

    //region COSTRUZIONE

    private FormulaTree(Type type, String atom, FormulaTree left, FormulaTree right) {
        this.type = type;
        this.atom = atom;
        this.left = left;
        this.right = right;
    }

    /**
     * Costruisce una foglia per variabile atomica.
     *
     * @param name nome dell'atomo (non null, non vuoto)
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public static FormulaTree atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome atomo non può essere null o vuoto");
        }
        if (Type.fromSymbol(name) != null) {
            throw new IllegalArgumentException("Un operatore non può essere usato come atomo: " + name);
        }
        return new FormulaTree(Type.ATOM, name, null, null);
    }

    /**
     * Costruisce un nodo di negazione.
     *
     * @param operand sottoalbero negato (non null)
     */
    public static FormulaTree not(FormulaTree operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new FormulaTree(Type.NOT, null, operand, null);
    }

    public static FormulaTree and(FormulaTree left, FormulaTree right) {
        return binary(Type.AND, left, right);
    }

    public static FormulaTree or(FormulaTree left, FormulaTree right) {
        return binary(Type.OR, left, right);
    }

    public static FormulaTree implies(FormulaTree left, FormulaTree right) {
        return binary(Type.IMPLIES, left, right);
    }

    /**
     * Costruisce un nodo binario AND, OR o IMPLIES.
     *
     * @param type tipo binario
     * @param left figlio sinistro (non null)
     * @param right figlio destro (non null)
     * @throws IllegalArgumentException se il tipo non è binario o un figlio è null
     */
    public static FormulaTree binary(Type type, FormulaTree left, FormulaTree right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere AND, OR o IMPLIES per nodi binari: " + type);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi di " + type + " non possono essere null");
        }
        return new FormulaTree(type, null, left, right);
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    public String getAtom() {
        return atom;
    }

    public FormulaTree getLeft() {
        return left;
    }

    public FormulaTree getRight() {
        return right;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    /** Vero per un atomo o per una negazione diretta di un atomo. */
    public boolean isLiteral() {
        return type == Type.ATOM || (type == Type.NOT && left.type == Type.ATOM);
    }

    //endregion

    //region UTILITÀ E ANALISI

    /**
     * Calcola l'altezza dell'albero: numero di nodi del cammino più lungo
     * dalla radice a una foglia (una foglia ha altezza 1).
     */
    public int height() {
        return switch (type) {
            case ATOM -> 1;
            case NOT -> 1 + left.height();
            case AND, OR, IMPLIES -> 1 + Math.max(left.height(), right.height());
        };
    }

    /**
     * Raccoglie i nomi distinti degli atomi in ordine lessicografico.
     */
    public Set<String> collectAtoms() {
        Set<String> atoms = new TreeSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    private void collectAtoms(Set<String> atoms) {
        switch (type) {
            case ATOM -> atoms.add(atom);
            case NOT -> left.collectAtoms(atoms);
            case AND, OR, IMPLIES -> {
                left.collectAtoms(atoms);
                right.collectAtoms(atoms);
            }
        }
    }

    /**
     * Copia profonda del sottoalbero. Usata quando una riscrittura deve
     * collocare lo stesso sottoalbero sotto due genitori diversi.
     */
    public FormulaTree copy() {
        return switch (type) {
            case ATOM -> new FormulaTree(Type.ATOM, atom, null, null);
            case NOT -> new FormulaTree(Type.NOT, null, left.copy(), null);
            case AND, OR, IMPLIES -> new FormulaTree(type, null, left.copy(), right.copy());
        };
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rende l'albero in notazione infissa completamente parentesizzata.
     *
     * FORMATO OUTPUT:
     * - Atomi: nome (p, x1)
     * - Negazioni: (~operando)
     * - Binari: (sinistro op destro)
     *
     * @return stringa infissa non ambigua, indipendente dalle precedenze
     */
    public String toInfix() {
        StringBuilder builder = new StringBuilder();
        appendInfix(builder);
        return builder.toString();
    }

    private void appendInfix(StringBuilder builder) {
        switch (type) {
            case ATOM -> builder.append(atom);
            case NOT -> {
                builder.append("(~");
                left.appendInfix(builder);
                builder.append(')');
            }
            case AND, OR, IMPLIES -> {
                builder.append('(');
                left.appendInfix(builder);
                builder.append(' ').append(type.symbol()).append(' ');
                right.appendInfix(builder);
                builder.append(')');
            }
        }
    }

    @Override
    public String toString() {
        return toInfix();
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stesso tipo, stesso atomo, figli uguali nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        FormulaTree other = (FormulaTree) obj;
        return type == other.type
                && Objects.equals(atom, other.atom)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, atom, left, right);
    }

    //endregion
}
