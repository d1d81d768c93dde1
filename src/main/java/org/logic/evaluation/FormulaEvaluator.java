package org.logic.evaluation;

import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * VALUTATORE - Semantica vero-funzionale delle formule proposizionali
 *
 * OPERAZIONI:
 * • getVariables: variabili distinte della formula
 * • evaluate: valore di verità sotto un assegnamento
 * • generateTruthTable: enumerazione completa dei 2^n assegnamenti
 *
 * Un atomo assente dall'assegnamento vale false: i chiamanti forniscono sempre
 * assegnamenti completi ricavati da getVariables, e il confronto di formule con
 * insiemi di variabili diversi si appoggia all'unione delle variabili.
 *
 * Nessuna memoizzazione: costo O(2^n · |f|), adeguato alle formule degli esercizi.
 */
public final class FormulaEvaluator {

    private static final Logger LOGGER = Logger.getLogger(FormulaEvaluator.class.getName());

    /** Oltre questa soglia la tabella non è rappresentabile in memoria */
    public static final int MAX_TABLE_VARIABLES = 30;

    private FormulaEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VARIABILI

    /**
     * Raccoglie le variabili distinte della formula (ordine di prima apparizione).
     *
     * @param formula formula da esaminare
     * @return insieme dei nomi delle variabili
     */
    public static Set<String> getVariables(Formula formula) {
        Set<String> variables = new LinkedHashSet<>();
        collectVariables(formula, variables);
        return variables;
    }

    private static void collectVariables(Formula formula, Set<String> variables) {
        switch (formula.getType()) {
            case ATOM -> variables.add(formula.getName());
            case NOT -> collectVariables(formula.getOperand(), variables);
            case BINARY -> {
                collectVariables(formula.getLeft(), variables);
                collectVariables(formula.getRight(), variables);
            }
        }
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Calcola il valore di verità della formula.
     *
     * @param formula formula da valutare
     * @param assignment valori delle variabili; le variabili mancanti valgono false
     * @return valore di verità
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> assignment) {
        return switch (formula.getType()) {
            case ATOM -> Boolean.TRUE.equals(assignment.get(formula.getName()));

            case NOT -> !evaluate(formula.getOperand(), assignment);

            case BINARY -> {
                boolean left = evaluate(formula.getLeft(), assignment);
                boolean right = evaluate(formula.getRight(), assignment);

                yield switch (formula.getConnective()) {
                    case AND -> left && right;
                    case OR -> left || right;
                    case IMPLIES -> !left || right;
                    case IFF -> left == right;
                };
            }
        };
    }

    //endregion

    //region TABELLE DI VERITÀ

    /**
     * Genera la tabella di verità sulle variabili della formula.
     *
     * @param formula formula da tabulare
     * @return tabella con 2^n righe, variabili in ordine lessicografico
     */
    public static TruthTable generateTruthTable(Formula formula) {
        return generateTruthTable(formula, getVariables(formula));
    }

    /**
     * Genera la tabella di verità su un insieme di variabili scelto dal chiamante.
     *
     * Utile per confrontare formule con variabili diverse sulla stessa enumerazione.
     *
     * @param formula formula da tabulare
     * @param variables variabili della tabella; devono includere tutte quelle della formula
     * @return tabella con 2^n righe, variabili ordinate e senza duplicati
     * @throws IllegalArgumentException se mancano variabili della formula o sono troppe
     */
    public static TruthTable generateTruthTable(Formula formula, Collection<String> variables) {
        List<String> sortedVariables = new ArrayList<>(new TreeSet<>(variables));

        if (!sortedVariables.containsAll(getVariables(formula))) {
            throw new IllegalArgumentException("Le variabili della tabella non coprono la formula " + formula);
        }
        if (sortedVariables.size() > MAX_TABLE_VARIABLES) {
            throw new IllegalArgumentException("Tabella di verità non rappresentabile: "
                    + sortedVariables.size() + " variabili (massimo " + MAX_TABLE_VARIABLES + ")");
        }

        int variableCount = sortedVariables.size();
        int rowCount = 1 << variableCount;
        List<TruthTableRow> rows = new ArrayList<>(rowCount);

        for (int i = 0; i < rowCount; i++) {
            // Contatore decrescente: la riga 0 è "tutto vero", l'ultima "tutto falso"
            int counter = rowCount - 1 - i;
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int j = 0; j < variableCount; j++) {
                assignment.put(sortedVariables.get(j), ((counter >> (variableCount - 1 - j)) & 1) == 1);
            }
            rows.add(new TruthTableRow(assignment, evaluate(formula, assignment)));
        }

        LOGGER.finest("Tabella generata: " + rowCount + " righe per " + formula);
        return new TruthTable(sortedVariables, rows);
    }

    //endregion
}
