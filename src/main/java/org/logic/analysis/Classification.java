package org.logic.analysis;

/**
 * Classificazione semantica di una formula.
 */
public enum Classification {
    /** Vera sotto ogni assegnamento */
    TAUTOLOGY,
    /** Falsa sotto ogni assegnamento */
    CONTRADICTION,
    /** Vera sotto alcuni assegnamenti e falsa sotto altri */
    CONTINGENT
}
