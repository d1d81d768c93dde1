package org.logic.normalform;

/**
 * Forme normali supportate.
 */
public enum NormalForm {
    NNF("Forma Normale Negativa"),
    CNF("Forma Normale Congiuntiva"),
    DNF("Forma Normale Disgiuntiva");

    private final String description;

    NormalForm(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
