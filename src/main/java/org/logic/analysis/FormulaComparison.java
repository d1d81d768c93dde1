package org.logic.analysis;

import org.logic.formula.Formula;

import java.util.List;
import java.util.Map;

/**
 * Confronto semantico tra due formule.
 *
 * @param differingAssignments assegnamenti (sull'unione delle variabili) in cui le formule
 *                             hanno valori diversi; vuoto se equivalenti
 */
public record FormulaComparison(Formula first,
                                Formula second,
                                boolean equivalent,
                                boolean firstImpliesSecond,
                                boolean secondImpliesFirst,
                                List<Map<String, Boolean>> differingAssignments) {

    public FormulaComparison {
        differingAssignments = List.copyOf(differingAssignments);
    }
}
