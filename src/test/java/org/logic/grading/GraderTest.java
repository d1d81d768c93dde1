package org.logic.grading;

import org.junit.jupiter.api.Test;
import org.logic.formula.Formula;
import org.logic.grading.ExerciseModels.AcceptedFormulasSolution;
import org.logic.grading.ExerciseModels.ChoiceOption;
import org.logic.grading.ExerciseModels.EquivalenceContent;
import org.logic.grading.ExerciseModels.EquivalenceSolution;
import org.logic.grading.ExerciseModels.FallacyAnswer;
import org.logic.grading.ExerciseModels.FallacyContent;
import org.logic.grading.ExerciseModels.FallacyOption;
import org.logic.grading.ExerciseModels.FallacySolution;
import org.logic.grading.ExerciseModels.FormulaAnswer;
import org.logic.grading.ExerciseModels.FormulationContent;
import org.logic.grading.ExerciseModels.HiddenCell;
import org.logic.grading.ExerciseModels.MultipleChoiceContent;
import org.logic.grading.ExerciseModels.MultipleChoiceSolution;
import org.logic.grading.ExerciseModels.NormalFormContent;
import org.logic.grading.ExerciseModels.OptionSelectionAnswer;
import org.logic.grading.ExerciseModels.ProofAnswer;
import org.logic.grading.ExerciseModels.ProofContent;
import org.logic.grading.ExerciseModels.ProofSolution;
import org.logic.grading.ExerciseModels.ProofStep;
import org.logic.grading.ExerciseModels.SymbolArrangementContent;
import org.logic.grading.ExerciseModels.TruthTableAnswer;
import org.logic.grading.ExerciseModels.TruthTableContent;
import org.logic.grading.ExerciseModels.ValidationContent;
import org.logic.grading.ExerciseModels.ValidationSolution;
import org.logic.grading.ExerciseModels.ValidityAnswer;
import org.logic.normalform.NormalForm;
import org.logic.parser.FormulaParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraderTest {

    private final Grader grader = new Grader();

    //region EQUIVALENCE

    @Test
    void equivalentFormulaIsCorrect() {
        GradingResult result = grader.grade(equivalence("P -> Q", "Contrapposizione"), new FormulaAnswer("~Q -> ~P"));

        assertTrue(result.isCorrect());
        assertEquals(1.0, result.getScore());
        assertEquals("Contrapposizione", result.getExplanation());
    }

    @Test
    void nonEquivalentFormulaIsIncorrectWithCounterexample() {
        GradingResult result = grader.grade(equivalence("P -> Q", null), new FormulaAnswer("Q -> P"));

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
        assertEquals(Map.of("P", true, "Q", false), result.getDetails().get("controesempio"));
    }

    @Test
    void counterexampleIsHiddenWhenDisabled() {
        Grader quiet = new Grader(new GraderConfiguration(16, false));
        GradingResult result = quiet.grade(equivalence("P -> Q", null), new FormulaAnswer("Q -> P"));

        assertFalse(result.isCorrect());
        assertFalse(result.getDetails().containsKey("controesempio"));
    }

    @Test
    void syntaxErrorInAnswerIsIncorrectNotFatal() {
        GradingResult result = grader.grade(equivalence("P -> Q", null), new FormulaAnswer("P ->"));

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
        assertTrue(result.getFeedback().startsWith("Errore di sintassi"));
        assertEquals("EOF", result.getDetails().get("tokenType"));
        assertEquals(4, result.getDetails().get("position"));
    }

    @Test
    void malformedTargetFormulaIsAFailure() {
        GradingResult result = grader.grade(equivalence("P &", null), new FormulaAnswer("P"));

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
        assertTrue(result.getFeedback().contains("Configurazione esercizio non valida"));
    }

    @Test
    void formulasBeyondTheVariableLimitAreRejected() {
        Grader strict = new Grader(new GraderConfiguration(2, true));
        GradingResult result = strict.grade(equivalence("P & Q", null), new FormulaAnswer("P & Q & R"));

        assertFalse(result.isCorrect());
        assertTrue(result.getFeedback().contains("Troppe variabili"));
    }

    @Test
    void deeplyNestedAnswerIsAFailureNotACrash() {
        GradingResult negations = grader.grade(equivalence("P", null), new FormulaAnswer("~".repeat(200_000) + "P"));
        assertFalse(negations.isCorrect());
        assertEquals(0.0, negations.getScore());
        assertTrue(negations.getFeedback().contains("Formula troppo lunga"));

        String parentheses = "(".repeat(50_000) + "P" + ")".repeat(50_000);
        GradingResult nested = grader.grade(equivalence("P", null), new FormulaAnswer(parentheses));
        assertFalse(nested.isCorrect());
        assertEquals(0.0, nested.getScore());
    }

    @Test
    void nestingWithinTheLengthLimitIsGraded() {
        String parentheses = "(".repeat(100) + "P" + ")".repeat(100);
        assertTrue(grader.grade(equivalence("P", null), new FormulaAnswer(parentheses)).isCorrect());
        assertTrue(grader.grade(equivalence("P", null), new FormulaAnswer("~".repeat(500) + "P")).isCorrect());
    }

    @Test
    void formulaLengthLimitIsConfigurable() {
        Grader strict = new Grader(new GraderConfiguration(16, true, 10));
        GradingResult result = strict.grade(equivalence("P -> Q", null), new FormulaAnswer("~P |    Q   "));

        assertFalse(result.isCorrect());
        assertTrue(result.getFeedback().contains("Formula troppo lunga"));
        assertTrue(strict.grade(equivalence("P -> Q", null), new FormulaAnswer("~P | Q")).isCorrect());
    }

    @Test
    void wrongAnswerVariantIsAFailure() {
        GradingResult result = grader.grade(equivalence("P", null), new OptionSelectionAnswer(List.of("a")));

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
    }

    @Test
    void missingAnswerIsAFailure() {
        GradingResult result = grader.grade(equivalence("P", null), null);
        assertFalse(result.isCorrect());
        assertFalse(grader.grade(null, new FormulaAnswer("P")).isCorrect());
    }

    //endregion

    //region MULTIPLE_CHOICE

    @Test
    void multiSelectGivesPartialCredit() {
        Exercise exercise = multipleChoice(true, List.of("a", "b", "c"));
        GradingResult result = grader.grade(exercise, new OptionSelectionAnswer(List.of("a", "b", "d")));

        assertFalse(result.isCorrect());
        assertEquals(1.0 / 3.0, result.getScore(), 1e-9);
        assertEquals(2, result.getDetails().get("correctSelected"));
        assertEquals(1, result.getDetails().get("incorrectSelected"));
        assertEquals(3, result.getDetails().get("totalCorrect"));
    }

    @Test
    void multiSelectScoreNeverGoesNegative() {
        Exercise exercise = multipleChoice(true, List.of("a", "b"));
        GradingResult result = grader.grade(exercise, new OptionSelectionAnswer(List.of("a", "c", "d")));

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
    }

    @Test
    void multiSelectRequiresAllAndOnlyCorrectOptions() {
        Exercise exercise = multipleChoice(true, List.of("a", "c"));

        assertTrue(grader.grade(exercise, new OptionSelectionAnswer(List.of("c", "a"))).isCorrect());
        GradingResult missing = grader.grade(exercise, new OptionSelectionAnswer(List.of("a")));
        assertFalse(missing.isCorrect());
        assertEquals(0.5, missing.getScore());
    }

    @Test
    void singleSelectIsAllOrNothing() {
        Exercise exercise = multipleChoice(false, List.of("b"));

        assertTrue(grader.grade(exercise, new OptionSelectionAnswer(List.of("b"))).isCorrect());
        GradingResult wrong = grader.grade(exercise, new OptionSelectionAnswer(List.of("a")));
        assertFalse(wrong.isCorrect());
        assertEquals(0.0, wrong.getScore());
        assertEquals("La a è falsa", ((Map<?, ?>) wrong.getDetails().get("spiegazioniOpzioni")).get("a"));
    }

    @Test
    void multipleChoiceWithoutCorrectOptionsIsAFailure() {
        GradingResult result = grader.grade(multipleChoice(true, List.of()), new OptionSelectionAnswer(List.of("a")));
        assertFalse(result.isCorrect());
        assertTrue(result.getFeedback().contains("senza opzioni corrette"));
    }

    //endregion

    //region FORMULE ACCETTATE

    @Test
    void symbolArrangementAcceptsNormalizedTextualMatch() {
        Exercise exercise = symbolArrangement(List.of("P ∧ Q → R"));
        GradingResult result = grader.grade(exercise, new FormulaAnswer("P&Q->R"));

        assertTrue(result.isCorrect());
        assertEquals("testuale", result.getDetails().get("corrispondenza"));
    }

    @Test
    void formulationAcceptsEquivalentFormula() {
        Exercise exercise = new Exercise(ExerciseType.FORMULATION,
                new FormulationContent("Se piove, la strada è bagnata", Map.of("P", "piove", "Q", "strada bagnata"), null),
                new AcceptedFormulasSolution(List.of("P -> Q")), null);
        GradingResult result = grader.grade(exercise, new FormulaAnswer("~P | Q"));

        assertTrue(result.isCorrect());
        assertEquals("semantica", result.getDetails().get("corrispondenza"));
    }

    @Test
    void acceptedFormulasBeyondTheVariableLimitAreSkipped() {
        Grader strict = new Grader(new GraderConfiguration(2, true));
        Exercise exercise = symbolArrangement(List.of("P & Q & R", "Q & P"));

        GradingResult result = strict.grade(exercise, new FormulaAnswer("P & Q"));
        assertTrue(result.isCorrect());
        assertEquals("semantica", result.getDetails().get("corrispondenza"));

        GradingResult wrong = strict.grade(exercise, new FormulaAnswer("P | Q"));
        assertFalse(wrong.isCorrect());
        assertEquals("Non corretto: la formula non corrisponde a nessuna soluzione attesa.", wrong.getFeedback());
    }

    @Test
    void unparsableAcceptedFormulasAreSkipped() {
        Exercise exercise = symbolArrangement(List.of("P ->", "P | Q"));

        assertTrue(grader.grade(exercise, new FormulaAnswer("Q | P")).isCorrect());
        assertFalse(grader.grade(exercise, new FormulaAnswer("P & Q")).isCorrect());
    }

    @Test
    void acceptedFormulaSyntaxErrorInAnswer() {
        GradingResult result = grader.grade(symbolArrangement(List.of("P")), new FormulaAnswer("P $"));
        assertFalse(result.isCorrect());
        assertEquals("UNKNOWN", result.getDetails().get("tokenType"));
    }

    @Test
    void normalFormAcceptsAnyEquivalentAnswer() {
        Exercise exercise = normalForm("P -> Q & R", NormalForm.CNF, List.of("(~P | Q) & (~P | R)"));

        GradingResult inForm = grader.grade(exercise, new FormulaAnswer("(~P | R) & (~P | Q)"));
        assertTrue(inForm.isCorrect());
        assertEquals(true, inForm.getDetails().get("formaRispettata"));

        GradingResult notInForm = grader.grade(exercise, new FormulaAnswer("P -> Q & R"));
        assertTrue(notInForm.isCorrect());
        assertEquals(false, notInForm.getDetails().get("formaRispettata"));
    }

    @Test
    void normalFormDerivesTheAcceptedFormulaWhenNoneIsGiven() {
        Exercise exercise = normalForm("~(P | Q)", NormalForm.NNF, List.of());

        assertTrue(grader.grade(exercise, new FormulaAnswer("~P & ~Q")).isCorrect());
        assertFalse(grader.grade(exercise, new FormulaAnswer("~P | ~Q")).isCorrect());
    }

    @Test
    void formulationWithoutAcceptedFormulasIsAFailure() {
        Exercise exercise = new Exercise(ExerciseType.FORMULATION, new FormulationContent("", null, null),
                new AcceptedFormulasSolution(List.of()), null);
        assertFalse(grader.grade(exercise, new FormulaAnswer("P")).isCorrect());
    }

    //endregion

    //region VALIDATION

    @Test
    void validationComparesWithAuthoredVerdict() {
        Exercise exercise = new Exercise(ExerciseType.VALIDATION,
                new ValidationContent(List.of("P -> Q", "Q"), "P", "Affermazione del conseguente"),
                new ValidationSolution(false, "Q vera e P falsa rende vere le premesse", Map.of("P", false, "Q", true)),
                null);

        GradingResult right = grader.grade(exercise, new ValidityAnswer(false, "controesempio P=F, Q=V"));
        assertTrue(right.isCorrect());
        assertEquals("Q vera e P falsa rende vere le premesse", right.getExplanation());
        assertEquals(Map.of("P", false, "Q", true), right.getDetails().get("controesempio"));

        GradingResult wrong = grader.grade(exercise, new ValidityAnswer(true, null));
        assertFalse(wrong.isCorrect());
        assertEquals(0.0, wrong.getScore());
    }

    @Test
    void exerciseExplanationTakesPrecedence() {
        Exercise exercise = new Exercise(ExerciseType.VALIDATION,
                new ValidationContent(List.of("P"), "P", null),
                new ValidationSolution(true, "dalla soluzione", null), "dall'esercizio");
        assertEquals("dall'esercizio", grader.grade(exercise, new ValidityAnswer(true, null)).getExplanation());
    }

    @Test
    void missingVerdictIsAFailure() {
        Exercise exercise = new Exercise(ExerciseType.VALIDATION,
                new ValidationContent(List.of("P"), "P", null), new ValidationSolution(true, null, null), null);
        assertFalse(grader.grade(exercise, new ValidityAnswer(null, "non so")).isCorrect());
    }

    //endregion

    //region TRUTH_TABLE

    @Test
    void truthTableScoresHiddenCells() {
        Exercise exercise = truthTable("P & Q", List.of(
                new HiddenCell(0, "result"), new HiddenCell(1, "result"),
                new HiddenCell(2, "result"), new HiddenCell(3, "result")));

        GradingResult result = grader.grade(exercise,
                new TruthTableAnswer(Map.of("result", Arrays.asList(true, false, true, null))));

        assertFalse(result.isCorrect());
        assertEquals(0.5, result.getScore());
        assertEquals(List.of("result[2]", "result[3]"), result.getDetails().get("wrongCells"));
    }

    @Test
    void truthTableFullyCorrect() {
        Exercise exercise = truthTable("P -> Q", List.of(new HiddenCell(1, "P → Q"), new HiddenCell(3, "Q")));

        GradingResult result = grader.grade(exercise, new TruthTableAnswer(Map.of(
                "P → Q", Arrays.asList(null, false, null, null),
                "Q", Arrays.asList(null, null, null, false))));

        assertTrue(result.isCorrect());
        assertEquals(2, result.getDetails().get("correctCells"));
    }

    @Test
    void truthTableMissingColumnCountsAsWrong() {
        Exercise exercise = truthTable("P", List.of(new HiddenCell(0, "result")));
        GradingResult result = grader.grade(exercise, new TruthTableAnswer(Map.of()));

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
    }

    @Test
    void truthTableWithoutHiddenCellsIsAFailure() {
        assertFalse(grader.grade(truthTable("P", List.of()), new TruthTableAnswer(Map.of())).isCorrect());
    }

    @Test
    void truthTableCellOutsideTheSolutionIsAFailure() {
        Exercise exercise = truthTable("P", List.of(new HiddenCell(5, "result")));
        GradingResult result = grader.grade(exercise, new TruthTableAnswer(Map.of("result", List.of(true))));

        assertFalse(result.isCorrect());
        assertTrue(result.getFeedback().contains("result[5]"));
    }

    //endregion

    //region IDENTIFY_FALLACY

    @Test
    void fallacyIsExactIdMatch() {
        Exercise exercise = new Exercise(ExerciseType.IDENTIFY_FALLACY,
                new FallacyContent("Se piove la strada è bagnata; la strada è bagnata, quindi piove.", List.of(
                        new FallacyOption("affirming", "Affermazione del conseguente", null),
                        new FallacyOption("denying", "Negazione dell'antecedente", null))),
                new FallacySolution("affirming", "Il conseguente può essere vero per altre cause."), null);

        GradingResult right = grader.grade(exercise, new FallacyAnswer("affirming"));
        assertTrue(right.isCorrect());
        assertEquals("Il conseguente può essere vero per altre cause.", right.getExplanation());

        assertFalse(grader.grade(exercise, new FallacyAnswer("denying")).isCorrect());
        assertFalse(grader.grade(exercise, new FallacyAnswer(null)).isCorrect());
    }

    //endregion

    //region PROOF

    @Test
    void proofEndingInTheConclusionIsAccepted() {
        GradingResult result = grader.grade(proof(null), new ProofAnswer(List.of("P -> Q", "P", "Q")));

        assertTrue(result.isCorrect());
        assertEquals(3, result.getDetails().get("stepCount"));
        assertEquals(3, result.getDetails().get("referenceStepCount"));
    }

    @Test
    void proofLastStepOnlyNeedsToBeEquivalent() {
        assertTrue(grader.grade(proof(null), new ProofAnswer(List.of("P", "~~Q"))).isCorrect());
    }

    @Test
    void proofEndingElsewhereIsRejected() {
        GradingResult result = grader.grade(proof(null), new ProofAnswer(List.of("P -> Q", "P")));

        assertFalse(result.isCorrect());
        assertEquals(Map.of("P", true, "Q", false), result.getDetails().get("controesempio"));
    }

    @Test
    void proofStepsMustParse() {
        GradingResult result = grader.grade(proof(null), new ProofAnswer(List.of("P -> Q", "P &", "Q")));

        assertFalse(result.isCorrect());
        assertEquals(2, result.getDetails().get("invalidStep"));
    }

    @Test
    void proofRespectsMaxSteps() {
        assertFalse(grader.grade(proof(2), new ProofAnswer(List.of("P -> Q", "P", "Q"))).isCorrect());
        assertTrue(grader.grade(proof(2), new ProofAnswer(List.of("P", "Q"))).isCorrect());
    }

    @Test
    void emptyProofIsRejected() {
        assertFalse(grader.grade(proof(null), new ProofAnswer(List.of())).isCorrect());
    }

    //endregion

    //region JSON

    @Test
    void gradesJsonMultipleChoiceScenario() {
        GradingResult result = grader.gradeJson(ExerciseType.MULTIPLE_CHOICE,
                "{\"question\":\"Quali sono tautologie?\",\"options\":[{\"id\":\"a\",\"text\":\"P ∨ ¬P\",\"isFormula\":true},"
                        + "{\"id\":\"b\",\"text\":\"P → P\",\"isFormula\":true},{\"id\":\"c\",\"text\":\"¬(P ∧ ¬P)\",\"isFormula\":true},"
                        + "{\"id\":\"d\",\"text\":\"P ∧ ¬P\",\"isFormula\":true}],\"allowMultiple\":true}",
                "{\"correctOptionIds\":[\"a\",\"b\",\"c\"]}",
                null,
                "[\"a\",\"b\",\"d\"]");

        assertFalse(result.isCorrect());
        assertEquals(1.0 / 3.0, result.getScore(), 1e-9);
    }

    @Test
    void gradesJsonEquivalence() {
        GradingResult result = grader.gradeJson(ExerciseType.EQUIVALENCE,
                "{\"targetFormula\":\"P -> Q\"}", null, "Legge dell'implicazione materiale", "\"~P | Q\"");

        assertTrue(result.isCorrect());
        assertEquals("Legge dell'implicazione materiale", result.getExplanation());
    }

    @Test
    void malformedJsonBecomesAFailure() {
        GradingResult result = grader.gradeJson(ExerciseType.TRUTH_TABLE, "{\"formula\":", "{}", null, "{}");

        assertFalse(result.isCorrect());
        assertEquals(0.0, result.getScore());
    }

    @Test
    void contentOfTheWrongShapeBecomesAFailure() {
        GradingResult result = grader.gradeJson(ExerciseType.NORMAL_FORM,
                "{\"formula\":\"P\",\"targetForm\":\"XNF\"}", "{\"correctFormulas\":[]}", null, "\"P\"");
        assertFalse(result.isCorrect());
        assertFalse(grader.gradeJson(null, "{}", "{}", null, "\"P\"").isCorrect());
    }

    //endregion

    //region FIXTURE

    private static Exercise equivalence(String target, String explanation) {
        return new Exercise(ExerciseType.EQUIVALENCE, new EquivalenceContent(target, null),
                new EquivalenceSolution(), explanation);
    }

    private static Exercise multipleChoice(boolean allowMultiple, List<String> correctIds) {
        List<ChoiceOption> options = new ArrayList<>();
        for (String id : List.of("a", "b", "c", "d")) {
            options.add(new ChoiceOption(id, "Opzione " + id, false));
        }
        Map<String, String> explanations = new HashMap<>();
        explanations.put("a", "La a è falsa");
        return new Exercise(ExerciseType.MULTIPLE_CHOICE,
                new MultipleChoiceContent("Domanda", options, allowMultiple, false),
                new MultipleChoiceSolution(correctIds, explanations), null);
    }

    private static Exercise symbolArrangement(List<String> accepted) {
        return new Exercise(ExerciseType.SYMBOL_ARRANGEMENT,
                new SymbolArrangementContent("Componi la formula", List.of(), null),
                new AcceptedFormulasSolution(accepted), null);
    }

    private static Exercise normalForm(String formula, NormalForm form, List<String> accepted) {
        return new Exercise(ExerciseType.NORMAL_FORM, new NormalFormContent(formula, form),
                new AcceptedFormulasSolution(accepted), null);
    }

    private static Exercise truthTable(String formula, List<HiddenCell> hiddenCells) {
        Formula parsed = FormulaParser.parse(formula);
        return new Exercise(ExerciseType.TRUTH_TABLE, new TruthTableContent(formula, hiddenCells, true),
                TruthTableSolutionBuilder.build(parsed), null);
    }

    private static Exercise proof(Integer maxSteps) {
        return new Exercise(ExerciseType.PROOF,
                new ProofContent(List.of("P -> Q", "P"), "Q", List.of("MP"), maxSteps),
                new ProofSolution(List.of(
                        new ProofStep("P -> Q", "Premessa", List.of()),
                        new ProofStep("P", "Premessa", List.of()),
                        new ProofStep("Q", "Modus ponens", List.of(1, 2)))), null);
    }

    //endregion
}
