package org.logic.grading;

import org.logic.analysis.FormulaAnalyzer;
import org.logic.evaluation.FormulaEvaluator;
import org.logic.evaluation.TruthTable;
import org.logic.formula.Formula;
import org.logic.grading.ExerciseModels.TruthTableSolution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Genera la soluzione di un esercizio TRUTH_TABLE per gli autori.
 *
 * Colonne nell'ordine di visualizzazione: variabili in ordine lessicografico, colonne
 * intermedie delle sottoformule composte (post-ordine), infine {@value #RESULT_COLUMN}.
 */
public final class TruthTableSolutionBuilder {

    /** Nome della colonna con il valore della formula intera */
    public static final String RESULT_COLUMN = "result";

    private TruthTableSolutionBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static TruthTableSolution build(Formula formula) {
        TruthTable table = FormulaEvaluator.generateTruthTable(formula);

        Map<String, List<Boolean>> columns = new LinkedHashMap<>();
        for (String variable : table.getVariables()) {
            columns.put(variable, table.column(variable));
        }
        columns.putAll(FormulaAnalyzer.getSubformulaColumns(formula));
        columns.put(RESULT_COLUMN, table.results());

        return new TruthTableSolution(columns);
    }
}
