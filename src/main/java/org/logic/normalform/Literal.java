package org.logic.normalform;

/**
 * Letterale: variabile proposizionale, eventualmente negata.
 */
public record Literal(String variable, boolean negated) {

    public Literal {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("Variabile del letterale non può essere null o vuota");
        }
    }

    public static Literal positive(String variable) {
        return new Literal(variable, false);
    }

    public static Literal negative(String variable) {
        return new Literal(variable, true);
    }

    @Override
    public String toString() {
        return negated ? "¬" + variable : variable;
    }
}
