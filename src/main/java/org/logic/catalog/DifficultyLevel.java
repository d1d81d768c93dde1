package org.logic.catalog;

/**
 * Livello didattico di un operatore.
 */
public enum DifficultyLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT
}
