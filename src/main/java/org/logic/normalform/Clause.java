package org.logic.normalform;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Insieme ordinato di letterali estratto da una forma normale.
 *
 * In CNF rappresenta una disgiunzione (clausola), in DNF una congiunzione (termine):
 * il significato dipende dalla forma da cui è stato estratto.
 */
public record Clause(List<Literal> literals) {

    public Clause {
        if (literals == null || literals.isEmpty()) {
            throw new IllegalArgumentException("Una clausola deve contenere almeno un letterale");
        }
        literals = List.copyOf(literals);
    }

    public int size() {
        return literals.size();
    }

    /**
     * Vero se la clausola contiene sia P che ¬P per qualche variabile.
     */
    public boolean isComplementary() {
        return literals.stream().anyMatch(literal ->
                literals.contains(new Literal(literal.variable(), !literal.negated())));
    }

    @Override
    public String toString() {
        return literals.stream().map(Literal::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
