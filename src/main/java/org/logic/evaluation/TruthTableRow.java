package org.logic.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Riga di una tabella di verità: assegnamento completo e valore della formula.
 *
 * L'assegnamento è immutabile e ordinato come le variabili della tabella.
 */
public record TruthTableRow(Map<String, Boolean> assignment, boolean result) {

    public TruthTableRow {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento della riga non può essere null");
        }
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /**
     * Valore assegnato alla variabile in questa riga (false se assente).
     */
    public boolean valueOf(String variable) {
        return Boolean.TRUE.equals(assignment.get(variable));
    }
}
