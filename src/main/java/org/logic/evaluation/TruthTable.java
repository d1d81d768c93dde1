package org.logic.evaluation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * TABELLA DI VERITÀ - Enumerazione completa degli assegnamenti
 *
 * Variabili in ordine lessicografico; righe in ordine deterministico da "tutto vero"
 * a "tutto falso", come un contatore binario decrescente in cui la variabile 0 è
 * il bit più significativo. L'indice di riga identifica sempre lo stesso
 * assegnamento: interfaccia ed esercizi sulle tabelle si basano su questo ordine.
 *
 * INVARIANTE: rows.size() == 2^variables.size() (una sola riga senza variabili).
 */
public final class TruthTable {

    private final List<String> variables;
    private final List<TruthTableRow> rows;

    TruthTable(List<String> variables, List<TruthTableRow> rows) {
        if (rows.size() != 1 << variables.size()) {
            throw new IllegalArgumentException("Tabella incoerente: " + rows.size()
                    + " righe per " + variables.size() + " variabili");
        }
        this.variables = List.copyOf(variables);
        this.rows = List.copyOf(rows);
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public TruthTableRow getRow(int index) {
        return rows.get(index);
    }

    /**
     * Colonna dei risultati della formula, riga per riga.
     */
    public List<Boolean> results() {
        List<Boolean> results = new ArrayList<>(rows.size());
        for (TruthTableRow row : rows) {
            results.add(row.result());
        }
        return results;
    }

    /**
     * Colonna dei valori di una variabile, riga per riga.
     *
     * @throws IllegalArgumentException se la variabile non appartiene alla tabella
     */
    public List<Boolean> column(String variable) {
        if (!variables.contains(variable)) {
            throw new IllegalArgumentException("Variabile non presente nella tabella: " + variable);
        }
        List<Boolean> values = new ArrayList<>(rows.size());
        for (TruthTableRow row : rows) {
            values.add(row.valueOf(variable));
        }
        return values;
    }

    /** Assegnamenti che rendono vera la formula */
    public List<Map<String, Boolean>> models() {
        return assignmentsWithResult(true);
    }

    /** Assegnamenti che rendono falsa la formula */
    public List<Map<String, Boolean>> counterModels() {
        return assignmentsWithResult(false);
    }

    public boolean allTrue() {
        return rows.stream().allMatch(TruthTableRow::result);
    }

    public boolean allFalse() {
        return rows.stream().noneMatch(TruthTableRow::result);
    }

    public boolean anyTrue() {
        return rows.stream().anyMatch(TruthTableRow::result);
    }

    private List<Map<String, Boolean>> assignmentsWithResult(boolean expected) {
        List<Map<String, Boolean>> assignments = new ArrayList<>();
        for (TruthTableRow row : rows) {
            if (row.result() == expected) {
                assignments.add(row.assignment());
            }
        }
        return assignments;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(String.join(" ", variables)).append(" | risultato\n");
        for (TruthTableRow row : rows) {
            for (String variable : variables) {
                builder.append(row.valueOf(variable) ? 'V' : 'F').append(' ');
            }
            builder.append("| ").append(row.result() ? 'V' : 'F').append('\n');
        }
        return builder.toString();
    }
}
