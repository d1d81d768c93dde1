package org.logic.analysis;

import org.logic.formula.Formula;

import java.util.List;
import java.util.Map;

/**
 * Analisi completa di una formula: classificazione, modelli, struttura e forme normali.
 */
public record FormulaReport(Formula formula,
                            Classification classification,
                            boolean satisfiable,
                            List<String> variables,
                            List<Map<String, Boolean>> models,
                            List<Formula> subformulas,
                            int depth,
                            int connectiveCount,
                            Formula nnf,
                            Formula cnf,
                            Formula dnf) {

    public FormulaReport {
        variables = List.copyOf(variables);
        models = List.copyOf(models);
        subformulas = List.copyOf(subformulas);
    }

    public int modelCount() {
        return models.size();
    }
}
