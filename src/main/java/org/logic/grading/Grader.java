package org.logic.grading;

import org.logic.analysis.FormulaAnalyzer;
import org.logic.analysis.FormulaComparison;
import org.logic.evaluation.FormulaEvaluator;
import org.logic.formula.Formula;
import org.logic.formula.FormulaPrinter;
import org.logic.grading.ExerciseModels.AcceptedFormulasSolution;
import org.logic.grading.ExerciseModels.Answer;
import org.logic.grading.ExerciseModels.EquivalenceContent;
import org.logic.grading.ExerciseModels.FallacyAnswer;
import org.logic.grading.ExerciseModels.FallacySolution;
import org.logic.grading.ExerciseModels.FormulaAnswer;
import org.logic.grading.ExerciseModels.HiddenCell;
import org.logic.grading.ExerciseModels.MultipleChoiceContent;
import org.logic.grading.ExerciseModels.MultipleChoiceSolution;
import org.logic.grading.ExerciseModels.NormalFormContent;
import org.logic.grading.ExerciseModels.OptionSelectionAnswer;
import org.logic.grading.ExerciseModels.ProofAnswer;
import org.logic.grading.ExerciseModels.ProofContent;
import org.logic.grading.ExerciseModels.ProofSolution;
import org.logic.grading.ExerciseModels.TruthTableAnswer;
import org.logic.grading.ExerciseModels.TruthTableContent;
import org.logic.grading.ExerciseModels.TruthTableSolution;
import org.logic.grading.ExerciseModels.ValidationSolution;
import org.logic.grading.ExerciseModels.ValidityAnswer;
import org.logic.normalform.NormalFormConverter;
import org.logic.parser.FormulaParser;
import org.logic.parser.FormulaSyntaxException;
import org.logic.parser.ParseResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CORRETTORE - Smistamento della correzione per tipo di esercizio
 *
 * Funzione pura grade(esercizio, risposta) -> esito, senza stato fra una chiamata e
 * l'altra. La correttezza delle formule è sempre semantica (equivalenza tramite tabella
 * di verità), mai l'uguaglianza dei testi o degli alberi.
 *
 * GESTIONE ERRORI:
 * • risposta sintatticamente errata: esito negativo con il messaggio di sintassi
 * • esercizio configurato male, oltre il limite di variabili o formula troppo lunga: GradingException
 * • GradingException ed eccezioni inattese vengono convertite in esito negativo
 *   al confine del metodo grade, che non propaga mai eccezioni
 */
public final class Grader {

    private static final Logger LOGGER = Logger.getLogger(Grader.class.getName());

    private final GraderConfiguration configuration;
    private final ExerciseDecoder decoder;

    public Grader() {
        this(GraderConfiguration.defaults());
    }

    public Grader(GraderConfiguration configuration) {
        this(configuration, new ExerciseDecoder());
    }

    public Grader(GraderConfiguration configuration, ExerciseDecoder decoder) {
        if (configuration == null || decoder == null) {
            throw new IllegalArgumentException("Configurazione e decodificatore sono obbligatori");
        }
        this.configuration = configuration;
        this.decoder = decoder;
    }

    public GraderConfiguration getConfiguration() {
        return configuration;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Corregge la risposta dello studente.
     *
     * @param exercise esercizio con contenuto e soluzione decodificati
     * @param answer risposta nella variante del tipo di esercizio
     * @return esito della correzione; mai null, mai un'eccezione
     */
    public GradingResult grade(Exercise exercise, Answer answer) {
        if (exercise == null) {
            return GradingResult.failure("Esercizio mancante: impossibile correggere");
        }
        LOGGER.fine("Correzione esercizio " + exercise.type());

        try {
            if (answer == null) {
                throw new GradingException("Nessuna risposta inviata");
            }
            return switch (exercise.type()) {
                case EQUIVALENCE -> gradeEquivalence(exercise, answer);
                case MULTIPLE_CHOICE -> gradeMultipleChoice(exercise, answer);
                case SYMBOL_ARRANGEMENT, FORMULATION -> gradeAcceptedFormulas(exercise, answer);
                case NORMAL_FORM -> gradeNormalForm(exercise, answer);
                case VALIDATION -> gradeValidation(exercise, answer);
                case TRUTH_TABLE -> gradeTruthTable(exercise, answer);
                case IDENTIFY_FALLACY -> gradeFallacy(exercise, answer);
                case PROOF -> gradeProof(exercise, answer);
            };
        } catch (GradingException e) {
            LOGGER.warning("Correzione " + exercise.type() + " interrotta: " + e.getMessage());
            return GradingResult.failure("Impossibile correggere la risposta: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore inatteso durante la correzione " + exercise.type(), e);
            return GradingResult.failure("Errore durante la correzione: " + e.getMessage());
        } catch (StackOverflowError e) {
            LOGGER.log(Level.SEVERE, "Formula troppo annidata durante la correzione " + exercise.type(), e);
            return GradingResult.failure("Impossibile correggere la risposta: formula troppo annidata");
        }
    }

    /**
     * Decodifica esercizio e risposta dal JSON e li corregge.
     * Gli errori di decodifica producono un esito negativo come ogni altro errore.
     */
    public GradingResult gradeJson(ExerciseType type, String contentJson, String solutionJson,
                                   String explanation, String answerJson) {
        if (type == null) {
            return GradingResult.failure("Tipo di esercizio mancante: impossibile correggere");
        }
        Exercise exercise;
        Answer answer;
        try {
            exercise = decoder.decodeExercise(type, contentJson, solutionJson, explanation);
            answer = decoder.decodeAnswer(type, answerJson);
        } catch (GradingException e) {
            LOGGER.warning("Decodifica esercizio " + type + " fallita: " + e.getMessage());
            return GradingResult.failure("Impossibile correggere la risposta: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore inatteso durante la decodifica " + type, e);
            return GradingResult.failure("Errore durante la correzione: " + e.getMessage());
        }
        return grade(exercise, answer);
    }

    //endregion

    //region EQUIVALENZA

    private GradingResult gradeEquivalence(Exercise exercise, Answer rawAnswer) throws GradingException {
        EquivalenceContent content = expect(exercise.content(), EquivalenceContent.class, exercise);
        FormulaAnswer answer = expect(rawAnswer, FormulaAnswer.class, exercise);

        Formula target = parseAuthored(content.targetFormula(), "formula obiettivo");
        ParseResult parsed = parseText(answer.formula());
        if (!parsed.isSuccess()) {
            return syntaxError(parsed.getError(), explanationOf(exercise));
        }

        Formula submitted = parsed.getFormula();
        requireWithinVariableLimit(target, submitted);

        FormulaComparison comparison = FormulaAnalyzer.compare(submitted, target);
        if (comparison.equivalent()) {
            return GradingResult.correct("Corretto! La tua formula è logicamente equivalente.",
                    explanationOf(exercise), Map.of("formula", FormulaPrinter.print(submitted)));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("formula", FormulaPrinter.print(submitted));
        if (configuration.revealCounterexamples()) {
            details.put("controesempio", comparison.differingAssignments().get(0));
        }
        return GradingResult.incorrect("Non corretto: la tua formula non è equivalente. Controlla la tabella di verità.",
                explanationOf(exercise), details);
    }

    //endregion

    //region SCELTA MULTIPLA

    /**
     * Scelta singola: insieme selezionato uguale all'insieme corretto.
     * Scelta multipla: punteggio max(0, (giuste - sbagliate) / totale giuste).
     */
    private GradingResult gradeMultipleChoice(Exercise exercise, Answer rawAnswer) throws GradingException {
        MultipleChoiceContent content = expect(exercise.content(), MultipleChoiceContent.class, exercise);
        MultipleChoiceSolution solution = expect(exercise.solution(), MultipleChoiceSolution.class, exercise);
        OptionSelectionAnswer answer = expect(rawAnswer, OptionSelectionAnswer.class, exercise);

        Set<String> correctIds = new LinkedHashSet<>(solution.correctOptionIds());
        if (correctIds.isEmpty()) {
            throw new GradingException("Esercizio senza opzioni corrette");
        }
        Set<String> selected = new LinkedHashSet<>(answer.selectedOptionIds());

        int correctSelected = 0;
        int incorrectSelected = 0;
        Map<String, String> optionExplanations = new LinkedHashMap<>();
        for (String id : selected) {
            if (correctIds.contains(id)) {
                correctSelected++;
            } else {
                incorrectSelected++;
            }
            String optionExplanation = solution.explanations().get(id);
            if (optionExplanation != null) {
                optionExplanations.put(id, optionExplanation);
            }
        }
        int totalCorrect = correctIds.size();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("correctSelected", correctSelected);
        details.put("incorrectSelected", incorrectSelected);
        details.put("totalCorrect", totalCorrect);
        if (!optionExplanations.isEmpty()) {
            details.put("spiegazioniOpzioni", optionExplanations);
        }

        if (!content.allowMultiple()) {
            if (selected.equals(correctIds)) {
                return GradingResult.correct("Corretto!", explanationOf(exercise), details);
            }
            return GradingResult.incorrect("Non corretto: la risposta selezionata è sbagliata.", explanationOf(exercise), details);
        }

        if (correctSelected == totalCorrect && incorrectSelected == 0) {
            return GradingResult.correct("Corretto! Hai selezionato tutte e sole le risposte giuste.",
                    explanationOf(exercise), details);
        }
        double score = Math.max(0.0, (double) (correctSelected - incorrectSelected) / totalCorrect);
        if (score == 0.0) {
            return GradingResult.incorrect("Non corretto: " + correctSelected + " risposte giuste su " + totalCorrect
                    + ", " + incorrectSelected + " sbagliate.", explanationOf(exercise), details);
        }
        return GradingResult.partial(score, "Parzialmente corretto: " + correctSelected + " risposte giuste su "
                + totalCorrect + ", " + incorrectSelected + " sbagliate.", explanationOf(exercise), details);
    }

    //endregion

    //region FORMULE ACCETTATE (COMPOSIZIONE, FORMALIZZAZIONE, FORMA NORMALE)

    private GradingResult gradeAcceptedFormulas(Exercise exercise, Answer rawAnswer) throws GradingException {
        AcceptedFormulasSolution solution = expect(exercise.solution(), AcceptedFormulasSolution.class, exercise);
        FormulaAnswer answer = expect(rawAnswer, FormulaAnswer.class, exercise);

        if (solution.correctFormulas().isEmpty()) {
            throw new GradingException("Esercizio senza formule accettate");
        }
        return matchAcceptedFormulas(exercise, answer.formula(), solution.correctFormulas(), new LinkedHashMap<>());
    }

    /**
     * Come le formule accettate; senza formule nella soluzione si accetta la conversione
     * della formula del contenuto nella forma richiesta. I dettagli indicano se la
     * risposta ha già la forma richiesta, a solo titolo informativo.
     */
    private GradingResult gradeNormalForm(Exercise exercise, Answer rawAnswer) throws GradingException {
        NormalFormContent content = expect(exercise.content(), NormalFormContent.class, exercise);
        AcceptedFormulasSolution solution = expect(exercise.solution(), AcceptedFormulasSolution.class, exercise);
        FormulaAnswer answer = expect(rawAnswer, FormulaAnswer.class, exercise);

        List<String> accepted = solution.correctFormulas();
        if (accepted.isEmpty()) {
            Formula source = parseAuthored(content.formula(), "formula da convertire");
            requireWithinVariableLimit(source);
            accepted = List.of(FormulaPrinter.print(NormalFormConverter.convert(source, content.targetForm())));
            LOGGER.fine("Forma " + content.targetForm() + " derivata: " + accepted.get(0));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("formaRichiesta", content.targetForm().name());
        ParseResult parsed = parseText(answer.formula());
        if (parsed.isSuccess()) {
            details.put("formaRispettata", NormalFormConverter.isInForm(parsed.getFormula(), content.targetForm()));
        }
        return matchAcceptedFormulas(exercise, answer.formula(), accepted, details);
    }

    /**
     * Accetta la risposta se coincide, dopo la normalizzazione, con una formula accettata
     * o se è equivalente a una di esse. Le formule accettate non analizzabili, troppo lunghe
     * o che portano la coppia oltre il limite di variabili vengono saltate.
     */
    private GradingResult matchAcceptedFormulas(Exercise exercise, String answerText, List<String> accepted,
                                                Map<String, Object> details) throws GradingException {
        for (String candidate : accepted) {
            if (AnswerNormalizer.matches(answerText, candidate)) {
                details.put("corrispondenza", "testuale");
                return GradingResult.correct("Corretto!", explanationOf(exercise), details);
            }
        }

        ParseResult parsed = parseText(answerText);
        if (!parsed.isSuccess()) {
            return syntaxError(parsed.getError(), explanationOf(exercise));
        }
        Formula submitted = parsed.getFormula();
        requireWithinVariableLimit(submitted);

        for (String candidate : accepted) {
            ParseResult acceptedFormula;
            try {
                acceptedFormula = parseText(candidate);
            } catch (GradingException e) {
                LOGGER.warning("Formula accettata ignorata: " + e.getMessage());
                continue;
            }
            if (!acceptedFormula.isSuccess()) {
                LOGGER.warning("Formula accettata non analizzabile, ignorata: " + candidate);
                continue;
            }
            if (!withinVariableLimit(submitted, acceptedFormula.getFormula())) {
                LOGGER.warning("Formula accettata oltre il limite di variabili, ignorata: " + candidate);
                continue;
            }
            if (FormulaAnalyzer.areEquivalent(submitted, acceptedFormula.getFormula())) {
                details.put("corrispondenza", "semantica");
                return GradingResult.correct("Corretto! La tua formula è equivalente a una soluzione attesa.",
                        explanationOf(exercise), details);
            }
        }
        return GradingResult.incorrect("Non corretto: la formula non corrisponde a nessuna soluzione attesa.",
                explanationOf(exercise), details);
    }

    //endregion

    //region VALIDITÀ

    /**
     * Il verdetto dell'autore è vincolante: la validità non viene ricalcolata.
     */
    private GradingResult gradeValidation(Exercise exercise, Answer rawAnswer) throws GradingException {
        ValidationSolution solution = expect(exercise.solution(), ValidationSolution.class, exercise);
        ValidityAnswer answer = expect(rawAnswer, ValidityAnswer.class, exercise);

        if (answer.valid() == null) {
            throw new GradingException("Nessun verdetto di validità nella risposta");
        }

        String explanation = explanationOf(exercise, solution.explanation());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("valido", solution.valid());
        if (configuration.revealCounterexamples() && solution.counterexample() != null) {
            details.put("controesempio", solution.counterexample());
        }

        if (answer.valid().equals(solution.valid())) {
            return GradingResult.correct(solution.valid()
                    ? "Corretto! L'argomento è valido."
                    : "Corretto! L'argomento non è valido.", explanation, details);
        }
        return GradingResult.incorrect(solution.valid()
                ? "Non corretto: la conclusione segue dalle premesse."
                : "Non corretto: esiste un caso con premesse vere e conclusione falsa.", explanation, details);
    }

    //endregion

    //region TABELLA DI VERITÀ

    /**
     * Confronto cella per cella sulle sole celle nascoste; punteggio = giuste / totali.
     * Una cella non compilata conta come sbagliata.
     */
    private GradingResult gradeTruthTable(Exercise exercise, Answer rawAnswer) throws GradingException {
        TruthTableContent content = expect(exercise.content(), TruthTableContent.class, exercise);
        TruthTableSolution solution = expect(exercise.solution(), TruthTableSolution.class, exercise);
        TruthTableAnswer answer = expect(rawAnswer, TruthTableAnswer.class, exercise);

        List<HiddenCell> hiddenCells = content.hiddenCells();
        if (hiddenCells.isEmpty()) {
            throw new GradingException("Esercizio senza celle da completare");
        }

        int correctCells = 0;
        List<String> wrongCells = new ArrayList<>();
        for (HiddenCell cell : hiddenCells) {
            Boolean expected = cellValue(solution.values(), cell);
            if (expected == null) {
                throw new GradingException("Soluzione priva del valore per la cella " + describe(cell));
            }
            if (expected.equals(cellValue(answer.values(), cell))) {
                correctCells++;
            } else {
                wrongCells.add(describe(cell));
            }
        }
        int totalCells = hiddenCells.size();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("correctCells", correctCells);
        details.put("totalCells", totalCells);
        details.put("wrongCells", wrongCells);

        if (correctCells == totalCells) {
            return GradingResult.correct("Corretto! Tutte le celle sono giuste.", explanationOf(exercise), details);
        }
        String feedback = "Celle corrette: " + correctCells + " su " + totalCells + ".";
        if (correctCells == 0) {
            return GradingResult.incorrect("Non corretto. " + feedback, explanationOf(exercise), details);
        }
        return GradingResult.partial((double) correctCells / totalCells, "Parzialmente corretto. " + feedback,
                explanationOf(exercise), details);
    }

    private static Boolean cellValue(Map<String, List<Boolean>> columns, HiddenCell cell) {
        List<Boolean> column = columns.get(cell.column());
        if (column == null || cell.row() >= column.size()) {
            return null;
        }
        return column.get(cell.row());
    }

    private static String describe(HiddenCell cell) {
        return cell.column() + "[" + cell.row() + "]";
    }

    //endregion

    //region FALLACIA

    private GradingResult gradeFallacy(Exercise exercise, Answer rawAnswer) throws GradingException {
        FallacySolution solution = expect(exercise.solution(), FallacySolution.class, exercise);
        FallacyAnswer answer = expect(rawAnswer, FallacyAnswer.class, exercise);

        String explanation = explanationOf(exercise, solution.explanation());
        if (solution.correctFallacyId().equals(answer.fallacyId())) {
            return GradingResult.correct("Corretto! Hai riconosciuto la fallacia.", explanation, null);
        }
        return GradingResult.incorrect("Non corretto: la fallacia presente è un'altra.", explanation, null);
    }

    //endregion

    //region DIMOSTRAZIONE

    /**
     * I passi non vengono verificati con regole di inferenza: la dimostrazione è accettata
     * se ogni passo è una formula valida, il numero di passi rispetta il massimo e
     * l'ultimo passo è equivalente alla conclusione.
     */
    private GradingResult gradeProof(Exercise exercise, Answer rawAnswer) throws GradingException {
        ProofContent content = expect(exercise.content(), ProofContent.class, exercise);
        ProofSolution solution = expect(exercise.solution(), ProofSolution.class, exercise);
        ProofAnswer answer = expect(rawAnswer, ProofAnswer.class, exercise);

        Formula conclusion = parseAuthored(content.conclusion(), "conclusione");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stepCount", answer.steps().size());
        details.put("referenceStepCount", solution.proofSteps().size());

        if (answer.steps().isEmpty()) {
            return GradingResult.incorrect("Non corretto: la dimostrazione non contiene passi.", explanationOf(exercise), details);
        }
        if (content.maxSteps() != null && answer.steps().size() > content.maxSteps()) {
            return GradingResult.incorrect("Non corretto: la dimostrazione supera il massimo di "
                    + content.maxSteps() + " passi.", explanationOf(exercise), details);
        }

        Formula lastStep = null;
        for (int i = 0; i < answer.steps().size(); i++) {
            ParseResult step = parseText(answer.steps().get(i));
            if (!step.isSuccess()) {
                details.put("invalidStep", i + 1);
                return GradingResult.incorrect("Errore di sintassi al passo " + (i + 1) + ": "
                        + step.getError().getMessage(), explanationOf(exercise), details);
            }
            lastStep = step.getFormula();
        }

        requireWithinVariableLimit(lastStep, conclusion);
        FormulaComparison comparison = FormulaAnalyzer.compare(lastStep, conclusion);
        if (comparison.equivalent()) {
            return GradingResult.correct("Corretto! L'ultimo passo coincide con la conclusione.",
                    explanationOf(exercise), details);
        }
        if (configuration.revealCounterexamples()) {
            details.put("controesempio", comparison.differingAssignments().get(0));
        }
        return GradingResult.incorrect("Non corretto: l'ultimo passo non è equivalente alla conclusione "
                + FormulaPrinter.print(conclusion) + ".", explanationOf(exercise), details);
    }

    //endregion

    //region SUPPORTO

    private static <T> T expect(Object value, Class<T> type, Exercise exercise) throws GradingException {
        if (!type.isInstance(value)) {
            throw new GradingException("Dati non coerenti con un esercizio " + exercise.type() + ": atteso "
                    + type.getSimpleName() + ", trovato " + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    /**
     * Analizza una formula scritta dall'autore: un errore qui è un esercizio configurato male.
     */
    private Formula parseAuthored(String text, String role) throws GradingException {
        ParseResult parsed = parseText(text);
        if (!parsed.isSuccess()) {
            throw new GradingException("Configurazione esercizio non valida, " + role + " malformata: "
                    + parsed.getError().getMessage());
        }
        return parsed.getFormula();
    }

    /**
     * Rifiuta formule (o coppie di formule) con più variabili distinte del limite configurato,
     * prima che venga costruita qualsiasi tabella di verità.
     */
    private void requireWithinVariableLimit(Formula... formulas) throws GradingException {
        int count = countVariables(formulas);
        if (count > configuration.maxVariables()) {
            throw new GradingException("Troppe variabili distinte: " + count
                    + " (massimo " + configuration.maxVariables() + ")");
        }
    }

    private boolean withinVariableLimit(Formula... formulas) {
        return countVariables(formulas) <= configuration.maxVariables();
    }

    private static int countVariables(Formula... formulas) {
        Set<String> variables = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            variables.addAll(FormulaEvaluator.getVariables(formula));
        }
        return variables.size();
    }

    /**
     * Analizza un testo di formula dopo averne controllato la lunghezza: il limite
     * tiene l'annidamento lontano dalla profondità massima dello stack.
     */
    private ParseResult parseText(String text) throws GradingException {
        if (text != null && text.length() > configuration.maxFormulaLength()) {
            throw new GradingException("Formula troppo lunga: " + text.length()
                    + " caratteri (massimo " + configuration.maxFormulaLength() + ")");
        }
        return FormulaParser.tryParse(text);
    }

    private static GradingResult syntaxError(FormulaSyntaxException error, String explanation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("position", error.getPosition());
        details.put("tokenType", error.getTokenType());
        return GradingResult.incorrect("Errore di sintassi: " + error.getMessage(), explanation, details);
    }

    private static String explanationOf(Exercise exercise) {
        return explanationOf(exercise, null);
    }

    /**
     * Spiegazione dell'esercizio se presente, altrimenti quella della soluzione.
     */
    private static String explanationOf(Exercise exercise, String solutionExplanation) {
        if (exercise.explanation() != null && !exercise.explanation().isBlank()) {
            return exercise.explanation();
        }
        return solutionExplanation;
    }

    //endregion
}
