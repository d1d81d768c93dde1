package org.logic.grading;

/**
 * Difficoltà indicativa di un tipo di esercizio.
 */
public enum ExerciseDifficulty {
    EASY,
    MEDIUM,
    HARD
}
