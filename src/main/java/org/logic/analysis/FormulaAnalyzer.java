package org.logic.analysis;

import org.logic.evaluation.FormulaEvaluator;
import org.logic.evaluation.TruthTable;
import org.logic.evaluation.TruthTableRow;
import org.logic.formula.Formula;
import org.logic.formula.FormulaPrinter;
import org.logic.normalform.NormalFormConverter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ANALIZZATORE SEMANTICO - Proprietà delle formule derivate dalla tabella di verità
 *
 * Ogni proprietà semantica (classificazione, soddisfacibilità, modelli, equivalenza,
 * conseguenza logica) viene letta da una sola tabella di verità per formula, o per
 * coppia di formule confrontate: mai da visite ad hoc che potrebbero divergere dal
 * valutatore.
 *
 * L'equivalenza è il criterio canonico di correttezza: f1 e f2 sono equivalenti
 * se f1 ↔ f2 è una tautologia. L'uguaglianza strutturale non viene mai usata.
 */
public final class FormulaAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(FormulaAnalyzer.class.getName());

    private FormulaAnalyzer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region CLASSIFICAZIONE E MODELLI

    /**
     * Classifica la formula: TAUTOLOGY se ogni riga è vera, CONTRADICTION se ogni riga
     * è falsa, CONTINGENT altrimenti.
     */
    public static Classification classifyFormula(Formula formula) {
        return classify(FormulaEvaluator.generateTruthTable(formula));
    }

    private static Classification classify(TruthTable table) {
        if (table.allTrue()) return Classification.TAUTOLOGY;
        if (table.allFalse()) return Classification.CONTRADICTION;
        return Classification.CONTINGENT;
    }

    public static boolean isTautology(Formula formula) {
        return classifyFormula(formula) == Classification.TAUTOLOGY;
    }

    public static boolean isContradiction(Formula formula) {
        return classifyFormula(formula) == Classification.CONTRADICTION;
    }

    /**
     * Vero se esiste almeno un assegnamento che rende vera la formula.
     */
    public static boolean isSatisfiable(Formula formula) {
        return FormulaEvaluator.generateTruthTable(formula).anyTrue();
    }

    /**
     * Assegnamenti che soddisfano la formula, nell'ordine della tabella.
     */
    public static List<Map<String, Boolean>> getModels(Formula formula) {
        return FormulaEvaluator.generateTruthTable(formula).models();
    }

    /**
     * Assegnamenti che falsificano la formula, nell'ordine della tabella.
     */
    public static List<Map<String, Boolean>> getCounterModels(Formula formula) {
        return FormulaEvaluator.generateTruthTable(formula).counterModels();
    }

    //endregion

    //region EQUIVALENZA E CONSEGUENZA LOGICA

    /**
     * Equivalenza logica: f1 ↔ f2 è una tautologia.
     * La tabella è costruita sull'unione delle variabili delle due formule.
     */
    public static boolean areEquivalent(Formula first, Formula second) {
        return isTautology(Formula.iff(first, second));
    }

    /**
     * Conseguenza logica: f1 → f2 è una tautologia.
     */
    public static boolean implies(Formula first, Formula second) {
        return isTautology(Formula.implies(first, second));
    }

    /**
     * Confronto completo tra due formule.
     *
     * @return equivalenza, conseguenze nei due versi e assegnamenti in cui differiscono
     */
    public static FormulaComparison compare(Formula first, Formula second) {
        TruthTable table = FormulaEvaluator.generateTruthTable(Formula.iff(first, second));
        boolean equivalent = table.allTrue();

        LOGGER.fine("Confronto " + first + " con " + second + ": "
                + (equivalent ? "equivalenti" : table.counterModels().size() + " assegnamenti discordanti"));

        return new FormulaComparison(first, second, equivalent,
                implies(first, second), implies(second, first), table.counterModels());
    }

    /**
     * Verifica la validità di un argomento: le premesse implicano la conclusione se
     * (p1 ∧ ... ∧ pn) → c è una tautologia; senza premesse conta solo la conclusione.
     *
     * @param premises premesse dell'argomento (anche vuote)
     * @param conclusion conclusione
     * @return esito con il primo controesempio se l'argomento è invalido
     */
    public static ArgumentCheck checkArgument(List<Formula> premises, Formula conclusion) {
        Formula argument = conclusion;
        if (!premises.isEmpty()) {
            Formula conjunction = premises.get(0);
            for (int i = 1; i < premises.size(); i++) {
                conjunction = Formula.and(conjunction, premises.get(i));
            }
            argument = Formula.implies(conjunction, conclusion);
        }

        List<Map<String, Boolean>> counterModels = FormulaEvaluator.generateTruthTable(argument).counterModels();
        Map<String, Boolean> counterexample = counterModels.isEmpty() ? null : counterModels.get(0);
        return new ArgumentCheck(premises, conclusion, counterexample == null, counterexample);
    }

    //endregion

    //region STRUTTURA

    /**
     * Tutte le sottoformule in pre-ordine, radice inclusa.
     * Le ripetizioni restano: l'identità è la posizione nell'albero.
     */
    public static List<Formula> getSubformulas(Formula formula) {
        List<Formula> subformulas = new ArrayList<>();
        collectPreOrder(formula, subformulas);
        return subformulas;
    }

    private static void collectPreOrder(Formula formula, List<Formula> collector) {
        collector.add(formula);
        switch (formula.getType()) {
            case ATOM -> { /* Caso base: solo nodo corrente */ }
            case NOT -> collectPreOrder(formula.getOperand(), collector);
            case BINARY -> {
                collectPreOrder(formula.getLeft(), collector);
                collectPreOrder(formula.getRight(), collector);
            }
        }
    }

    /**
     * Stampa Unicode con parentesi minime, rileggibile dal parser.
     */
    public static String formulaToString(Formula formula) {
        return FormulaPrinter.print(formula);
    }

    /**
     * Profondità dell'albero: 0 per un atomo.
     */
    public static int getFormulaDepth(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> 0;
            case NOT -> 1 + getFormulaDepth(formula.getOperand());
            case BINARY -> 1 + Math.max(getFormulaDepth(formula.getLeft()), getFormulaDepth(formula.getRight()));
        };
    }

    /**
     * Numero di connettivi, negazioni comprese.
     */
    public static int countConnectives(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> 0;
            case NOT -> 1 + countConnectives(formula.getOperand());
            case BINARY -> 1 + countConnectives(formula.getLeft()) + countConnectives(formula.getRight());
        };
    }

    //endregion

    //region COLONNE INTERMEDIE E REPORT

    /**
     * Colonne della tabella di verità per ogni sottoformula composta distinta.
     *
     * Le colonne seguono il post-ordine (prima i figli, poi il padre, per ultima la
     * formula intera); la chiave è la stampa della sottoformula.
     *
     * @return mappa ordinata stampa -> valori riga per riga
     */
    public static Map<String, List<Boolean>> getSubformulaColumns(Formula formula) {
        Set<Formula> composites = new LinkedHashSet<>();
        collectCompositesPostOrder(formula, composites);

        TruthTable table = FormulaEvaluator.generateTruthTable(formula);
        Map<String, List<Boolean>> columns = new LinkedHashMap<>();
        for (Formula composite : composites) {
            List<Boolean> values = new ArrayList<>(table.rowCount());
            for (TruthTableRow row : table.getRows()) {
                values.add(FormulaEvaluator.evaluate(composite, row.assignment()));
            }
            columns.put(formulaToString(composite), values);
        }
        return columns;
    }

    private static void collectCompositesPostOrder(Formula formula, Set<Formula> collector) {
        switch (formula.getType()) {
            case ATOM -> { return; }
            case NOT -> collectCompositesPostOrder(formula.getOperand(), collector);
            case BINARY -> {
                collectCompositesPostOrder(formula.getLeft(), collector);
                collectCompositesPostOrder(formula.getRight(), collector);
            }
        }
        collector.add(formula);
    }

    /**
     * Analisi completa per il pannello di studio di una formula.
     */
    public static FormulaReport analyze(Formula formula) {
        TruthTable table = FormulaEvaluator.generateTruthTable(formula);

        return new FormulaReport(formula,
                classify(table),
                table.anyTrue(),
                table.getVariables(),
                table.models(),
                getSubformulas(formula),
                getFormulaDepth(formula),
                countConnectives(formula),
                NormalFormConverter.toNNF(formula),
                NormalFormConverter.toCNF(formula),
                NormalFormConverter.toDNF(formula));
    }

    //endregion
}
