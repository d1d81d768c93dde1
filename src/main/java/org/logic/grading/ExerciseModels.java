package org.logic.grading;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.logic.normalform.NormalForm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MODELLI ESERCIZIO - Contenuti, soluzioni e risposte tipizzati per ogni tipo
 *
 * Il contenuto e la soluzione di un esercizio arrivano come JSON con una forma diversa
 * per ogni {@link ExerciseType}; {@link ExerciseDecoder} li traduce nelle varianti
 * qui sotto prima della correzione, così il correttore non vede mai dati non tipizzati.
 *
 * I nomi delle proprietà JSON seguono lo schema degli esercizi salvati.
 */
public final class ExerciseModels {

    private ExerciseModels() {
        throw new UnsupportedOperationException("Classe contenitore non istanziabile");
    }

    /** Contenuto mostrato allo studente */
    public interface Content {
    }

    /** Soluzione inserita dall'autore */
    public interface Solution {
    }

    /** Risposta inviata dallo studente */
    public interface Answer {
    }

    //region CONTENUTI

    public record EquivalenceContent(String targetFormula, String instruction) implements Content {
        public EquivalenceContent {
            requireText(targetFormula, "targetFormula");
        }
    }

    public record ChoiceOption(String id, String text, @JsonProperty("isFormula") boolean formula) {
        public ChoiceOption {
            requireText(id, "id");
        }
    }

    public record MultipleChoiceContent(String question,
                                        List<ChoiceOption> options,
                                        boolean allowMultiple,
                                        boolean randomizeOrder) implements Content {
        public MultipleChoiceContent {
            options = copyOrEmpty(options);
        }
    }

    public record AvailableSymbol(String id, String symbol, Integer count) {
    }

    public record SymbolArrangementContent(String instruction,
                                           List<AvailableSymbol> availableSymbols,
                                           String targetDescription) implements Content {
        public SymbolArrangementContent {
            availableSymbols = copyOrEmpty(availableSymbols);
        }
    }

    /**
     * @param variables legenda lettera -> significato in linguaggio naturale
     */
    public record FormulationContent(String naturalLanguage,
                                     Map<String, String> variables,
                                     String hint) implements Content {
        public FormulationContent {
            variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }
    }

    public record ValidationContent(List<String> premises,
                                    String conclusion,
                                    String argumentInNaturalLanguage) implements Content {
        public ValidationContent {
            premises = copyOrEmpty(premises);
        }
    }

    /**
     * Cella da completare: indice di riga (0 = tutto vero) e nome della colonna.
     */
    public record HiddenCell(int row, String column) {
        public HiddenCell {
            if (row < 0) {
                throw new IllegalArgumentException("Indice di riga negativo: " + row);
            }
            requireText(column, "column");
        }
    }

    public record TruthTableContent(String formula,
                                    List<HiddenCell> hiddenCells,
                                    boolean showIntermediateColumns) implements Content {
        public TruthTableContent {
            requireText(formula, "formula");
            hiddenCells = copyOrEmpty(hiddenCells);
        }
    }

    public record NormalFormContent(String formula, NormalForm targetForm) implements Content {
        public NormalFormContent {
            requireText(formula, "formula");
            if (targetForm == null) {
                throw new IllegalArgumentException("Forma normale richiesta mancante");
            }
        }
    }

    /**
     * @param maxSteps numero massimo di passi ammessi; null se illimitato
     */
    public record ProofContent(List<String> premises,
                               String conclusion,
                               List<String> allowedRules,
                               Integer maxSteps) implements Content {
        public ProofContent {
            requireText(conclusion, "conclusion");
            premises = copyOrEmpty(premises);
            allowedRules = copyOrEmpty(allowedRules);
            if (maxSteps != null && maxSteps < 1) {
                throw new IllegalArgumentException("maxSteps deve essere positivo: " + maxSteps);
            }
        }
    }

    public record FallacyOption(String id, String name, String description) {
        public FallacyOption {
            requireText(id, "id");
        }
    }

    public record FallacyContent(String argument, List<FallacyOption> options) implements Content {
        public FallacyContent {
            options = copyOrEmpty(options);
        }
    }

    //endregion

    //region SOLUZIONI

    /**
     * Gli esercizi di equivalenza non hanno soluzione: il riferimento è la formula del contenuto.
     */
    public record EquivalenceSolution() implements Solution {
    }

    /**
     * @param explanations spiegazione per opzione, chiave = id dell'opzione
     */
    public record MultipleChoiceSolution(List<String> correctOptionIds,
                                         Map<String, String> explanations) implements Solution {
        public MultipleChoiceSolution {
            correctOptionIds = copyOrEmpty(correctOptionIds);
            explanations = explanations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(explanations));
        }
    }

    /**
     * Formule accettate per composizione, formalizzazione e forma normale.
     */
    public record AcceptedFormulasSolution(List<String> correctFormulas) implements Solution {
        public AcceptedFormulasSolution {
            correctFormulas = copyOrEmpty(correctFormulas);
        }
    }

    /**
     * @param counterexample assegnamento che invalida l'argomento, solo se non valido
     */
    public record ValidationSolution(@JsonProperty("isValid") Boolean valid,
                                     String explanation,
                                     Map<String, Boolean> counterexample) implements Solution {
        public ValidationSolution {
            if (valid == null) {
                throw new IllegalArgumentException("Proprietà obbligatoria mancante: isValid");
            }
            counterexample = counterexample == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(counterexample));
        }
    }

    /**
     * @param values colonna -> valori riga per riga, nell'ordine della tabella di verità
     */
    public record TruthTableSolution(Map<String, List<Boolean>> values) implements Solution {
        public TruthTableSolution {
            values = copyColumns(values);
        }
    }

    public record ProofStep(String formula, String justification, List<Integer> lineRefs) {
        public ProofStep {
            requireText(formula, "formula");
            lineRefs = copyOrEmpty(lineRefs);
        }
    }

    /**
     * Dimostrazione di riferimento dell'autore: dato consultivo, mai verificato.
     */
    public record ProofSolution(List<ProofStep> proofSteps) implements Solution {
        public ProofSolution {
            proofSteps = copyOrEmpty(proofSteps);
        }
    }

    public record FallacySolution(String correctFallacyId, String explanation) implements Solution {
        public FallacySolution {
            requireText(correctFallacyId, "correctFallacyId");
        }
    }

    //endregion

    //region RISPOSTE

    /**
     * Testo di una formula: equivalenza, composizione, formalizzazione, forma normale.
     */
    public record FormulaAnswer(String formula) implements Answer {
    }

    public record OptionSelectionAnswer(List<String> selectedOptionIds) implements Answer {
        public OptionSelectionAnswer {
            selectedOptionIds = copyOrEmpty(selectedOptionIds);
        }
    }

    /**
     * @param valid verdetto dello studente; null se non espresso
     */
    public record ValidityAnswer(Boolean valid, String justification) implements Answer {
    }

    /**
     * @param values colonna -> valori riga per riga; null indica una cella non compilata
     */
    public record TruthTableAnswer(Map<String, List<Boolean>> values) implements Answer {
        public TruthTableAnswer {
            values = copyColumns(values);
        }
    }

    public record FallacyAnswer(String fallacyId) implements Answer {
    }

    /**
     * Formule dei passi della dimostrazione, in ordine.
     */
    public record ProofAnswer(List<String> steps) implements Answer {
        public ProofAnswer {
            steps = copyOrEmpty(steps);
        }
    }

    //endregion

    //region SUPPORTO

    private static void requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Proprietà obbligatoria mancante: " + property);
        }
    }

    private static <T> List<T> copyOrEmpty(List<T> values) {
        if (values == null) {
            return List.of();
        }
        // contains(null) lancia NullPointerException sulle liste immutabili del JDK
        for (T value : values) {
            if (value == null) {
                throw new IllegalArgumentException("Elementi null non ammessi");
            }
        }
        return List.copyOf(values);
    }

    // Le celle null restano: in una risposta indicano celle non compilate
    private static Map<String, List<Boolean>> copyColumns(Map<String, List<Boolean>> columns) {
        Map<String, List<Boolean>> copy = new LinkedHashMap<>();
        if (columns != null) {
            columns.forEach((column, values) -> copy.put(column,
                    values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values))));
        }
        return Collections.unmodifiableMap(copy);
    }

    //endregion
}
