package org.logic.grading;

import org.logic.grading.ExerciseModels.Content;
import org.logic.grading.ExerciseModels.Solution;

/**
 * Esercizio pronto per la correzione: tipo, contenuto e soluzione già decodificati.
 *
 * La coerenza fra tipo e varianti viene controllata dal correttore, che segnala
 * un esercizio incoerente come configurazione non valida.
 *
 * @param explanation spiegazione dell'autore, null se assente
 */
public record Exercise(ExerciseType type, Content content, Solution solution, String explanation) {

    public Exercise {
        if (type == null) {
            throw new IllegalArgumentException("Tipo di esercizio obbligatorio");
        }
        if (content == null || solution == null) {
            throw new IllegalArgumentException("Contenuto e soluzione sono obbligatori per " + type);
        }
    }
}
