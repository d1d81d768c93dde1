package org.logic.evaluation;

import org.junit.jupiter.api.Test;
import org.logic.formula.Formula;
import org.logic.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaEvaluatorTest {

    @Test
    void collectsDistinctVariables() {
        Set<String> variables = FormulaEvaluator.getVariables(FormulaParser.parse("Q & (P | Q) -> ~R"));
        assertEquals(Set.of("P", "Q", "R"), variables);
    }

    @Test
    void evaluatesEveryConnective() {
        Map<String, Boolean> assignment = Map.of("P", true, "Q", false);
        assertFalse(FormulaEvaluator.evaluate(FormulaParser.parse("P & Q"), assignment));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("P | Q"), assignment));
        assertFalse(FormulaEvaluator.evaluate(FormulaParser.parse("P -> Q"), assignment));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("Q -> P"), assignment));
        assertFalse(FormulaEvaluator.evaluate(FormulaParser.parse("P <-> Q"), assignment));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("~Q"), assignment));
    }

    @Test
    void missingVariablesEvaluateToFalse() {
        assertFalse(FormulaEvaluator.evaluate(Formula.atom("P"), Map.of()));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("P -> Q"), Map.of("Q", true)));
    }

    @Test
    void rowsDescendFromAllTrueToAllFalse() {
        TruthTable table = FormulaEvaluator.generateTruthTable(FormulaParser.parse("Q | P"));

        assertEquals(List.of("P", "Q"), table.getVariables());
        assertEquals(4, table.rowCount());
        assertEquals(Map.of("P", true, "Q", true), table.getRow(0).assignment());
        assertEquals(Map.of("P", true, "Q", false), table.getRow(1).assignment());
        assertEquals(Map.of("P", false, "Q", true), table.getRow(2).assignment());
        assertEquals(Map.of("P", false, "Q", false), table.getRow(3).assignment());
        assertEquals(List.of(true, true, true, false), table.results());
        assertEquals(List.of(true, true, false, false), table.column("P"));
    }

    @Test
    void implicationOverConjunctionHasEightRows() {
        TruthTable table = FormulaEvaluator.generateTruthTable(FormulaParser.parse("P -> (Q & R)"));

        assertEquals(List.of("P", "Q", "R"), table.getVariables());
        assertEquals(8, table.rowCount());
        assertEquals(List.of(true, false, false, false, true, true, true, true), table.results());
        assertFalse(table.allTrue());
        assertFalse(table.allFalse());
    }

    @Test
    void rowCountIsTwoToTheNumberOfVariables() {
        for (String text : List.of("A", "A & B", "A | B | C | D", "(A -> B) <-> (C & D & E)")) {
            Formula formula = FormulaParser.parse(text);
            int variables = FormulaEvaluator.getVariables(formula).size();
            assertEquals(1 << variables, FormulaEvaluator.generateTruthTable(formula).rowCount(), text);
        }
    }

    @Test
    void tableOverCallerVariablesIncludesExtraColumns() {
        TruthTable table = FormulaEvaluator.generateTruthTable(Formula.atom("P"), List.of("R", "P", "Q", "P"));

        assertEquals(List.of("P", "Q", "R"), table.getVariables());
        assertEquals(8, table.rowCount());
        assertEquals(4, table.models().size());
        assertEquals(4, table.counterModels().size());
    }

    @Test
    void rejectsVariablesThatDoNotCoverTheFormula() {
        assertThrows(IllegalArgumentException.class,
                () -> FormulaEvaluator.generateTruthTable(FormulaParser.parse("P & Q"), List.of("P")));
    }

    @Test
    void rejectsTablesBeyondTheHardLimit() {
        List<String> variables = new ArrayList<>();
        for (int i = 0; i <= FormulaEvaluator.MAX_TABLE_VARIABLES; i++) {
            variables.add("V" + i);
        }
        assertThrows(IllegalArgumentException.class,
                () -> FormulaEvaluator.generateTruthTable(Formula.atom("V0"), variables));
    }

    @Test
    void unknownColumnIsRejected() {
        TruthTable table = FormulaEvaluator.generateTruthTable(Formula.atom("P"));
        assertThrows(IllegalArgumentException.class, () -> table.column("Q"));
    }
}
