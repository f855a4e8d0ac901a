package org.logic.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Disgiunzione ordinata di letterali
 *
 * L'ordine è quello di inserimento durante la visita dell'albero CNF e non ha
 * significato semantico. I duplicati sono ammessi e conservati.
 */
public final class Clause {

    /** Letterali in ordine di estrazione, lista immutabile */
    private final List<Literal> literals;

    /**
     * @param literals letterali della clausola (non null, senza elementi null)
     * @throws IllegalArgumentException se la lista è null o contiene null
     */
    public Clause(List<Literal> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        List<Literal> copy = new ArrayList<>(literals); // Copia difensiva
        if (copy.contains(null)) {
            throw new IllegalArgumentException("Lista letterali non può contenere elementi null");
        }
        this.literals = Collections.unmodifiableList(copy);
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    /**
     * Verifica se la clausola è tautologica.
     *
     * Scorre i letterali da sinistra a destra mantenendo l'insieme di quelli già
     * visti: la clausola è tautologica appena compare un letterale il cui
     * complementare è già presente. I duplicati da soli non bastano.
     *
     * @return true se la clausola contiene una coppia p / ~p
     */
    public boolean isTautology() {
        Set<Literal> seen = new HashSet<>();
        for (Literal literal : literals) {
            if (seen.contains(literal.negate())) {
                return true;
            }
            seen.add(literal);
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literals.equals(((Clause) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    /** Forma "(a + ~b + c)" */
    @Override
    public String toString() {
        return literals.stream()
                .map(Literal::toString)
                .collect(Collectors.joining(" + ", "(", ")"));
    }
}
