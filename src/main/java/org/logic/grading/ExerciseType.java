package org.logic.grading;

/**
 * TIPI DI ESERCIZIO - Le nove interazioni supportate dal correttore
 *
 * Ogni tipo porta i metadati mostrati agli autori: nome, descrizione, difficoltà,
 * se richiede un'interfaccia interattiva e se ammette punteggio parziale.
 */
public enum ExerciseType {
    EQUIVALENCE("Equivalenza",
            "Scrivi una formula logicamente equivalente a quella data.",
            ExerciseDifficulty.MEDIUM, false, false),
    MULTIPLE_CHOICE("Scelta multipla",
            "Seleziona la risposta o le risposte corrette.",
            ExerciseDifficulty.EASY, false, true),
    SYMBOL_ARRANGEMENT("Composizione di simboli",
            "Componi una formula usando i simboli disponibili.",
            ExerciseDifficulty.MEDIUM, true, false),
    FORMULATION("Formalizzazione",
            "Traduci un enunciato in linguaggio naturale in una formula.",
            ExerciseDifficulty.HARD, false, true),
    VALIDATION("Validità di un argomento",
            "Stabilisci se la conclusione segue dalle premesse.",
            ExerciseDifficulty.HARD, false, true),
    TRUTH_TABLE("Tabella di verità",
            "Completa le celle nascoste della tabella di verità.",
            ExerciseDifficulty.MEDIUM, true, true),
    PROOF("Dimostrazione",
            "Deriva la conclusione dalle premesse passo dopo passo.",
            ExerciseDifficulty.HARD, true, true),
    NORMAL_FORM("Forma normale",
            "Converti la formula nella forma normale richiesta.",
            ExerciseDifficulty.MEDIUM, false, false),
    IDENTIFY_FALLACY("Riconosci la fallacia",
            "Individua la fallacia presente nell'argomento.",
            ExerciseDifficulty.MEDIUM, false, false);

    private final String displayName;
    private final String description;
    private final ExerciseDifficulty difficulty;
    private final boolean interactive;
    private final boolean partialCredit;

    ExerciseType(String displayName, String description, ExerciseDifficulty difficulty,
                 boolean interactive, boolean partialCredit) {
        this.displayName = displayName;
        this.description = description;
        this.difficulty = difficulty;
        this.interactive = interactive;
        this.partialCredit = partialCredit;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public ExerciseDifficulty getDifficulty() {
        return difficulty;
    }

    public boolean isInteractive() {
        return interactive;
    }

    public boolean supportsPartialCredit() {
        return partialCredit;
    }
}
