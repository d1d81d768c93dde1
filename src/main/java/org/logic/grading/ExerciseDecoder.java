package org.logic.grading;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.logic.grading.ExerciseModels.AcceptedFormulasSolution;
import org.logic.grading.ExerciseModels.Answer;
import org.logic.grading.ExerciseModels.Content;
import org.logic.grading.ExerciseModels.EquivalenceContent;
import org.logic.grading.ExerciseModels.EquivalenceSolution;
import org.logic.grading.ExerciseModels.FallacyAnswer;
import org.logic.grading.ExerciseModels.FallacyContent;
import org.logic.grading.ExerciseModels.FallacySolution;
import org.logic.grading.ExerciseModels.FormulaAnswer;
import org.logic.grading.ExerciseModels.FormulationContent;
import org.logic.grading.ExerciseModels.MultipleChoiceContent;
import org.logic.grading.ExerciseModels.MultipleChoiceSolution;
import org.logic.grading.ExerciseModels.NormalFormContent;
import org.logic.grading.ExerciseModels.OptionSelectionAnswer;
import org.logic.grading.ExerciseModels.ProofAnswer;
import org.logic.grading.ExerciseModels.ProofContent;
import org.logic.grading.ExerciseModels.ProofSolution;
import org.logic.grading.ExerciseModels.Solution;
import org.logic.grading.ExerciseModels.SymbolArrangementContent;
import org.logic.grading.ExerciseModels.TruthTableAnswer;
import org.logic.grading.ExerciseModels.TruthTableContent;
import org.logic.grading.ExerciseModels.TruthTableSolution;
import org.logic.grading.ExerciseModels.ValidationContent;
import org.logic.grading.ExerciseModels.ValidationSolution;
import org.logic.grading.ExerciseModels.ValidityAnswer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * DECODIFICATORE ESERCIZI - Dal JSON salvato ai modelli tipizzati
 *
 * Contenuto e soluzione vengono letti con Jackson nella variante del tipo di esercizio;
 * le risposte degli studenti accettano anche forme compatte (una stringa per le formule,
 * un array per le opzioni selezionate).
 *
 * Ogni errore di decodifica (JSON malformato, proprietà obbligatoria mancante, valore del
 * tipo sbagliato) diventa una {@link GradingException}.
 */
public final class ExerciseDecoder {

    private static final Logger LOGGER = Logger.getLogger(ExerciseDecoder.class.getName());

    private final ObjectMapper objectMapper;

    public ExerciseDecoder() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ExerciseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    //region ESERCIZIO

    /**
     * Decodifica un esercizio completo.
     *
     * @param explanation spiegazione dell'autore, può essere null
     */
    public Exercise decodeExercise(ExerciseType type, String contentJson, String solutionJson, String explanation)
            throws GradingException {
        return new Exercise(type, decodeContent(type, contentJson), decodeSolution(type, solutionJson), explanation);
    }

    public Content decodeContent(ExerciseType type, String json) throws GradingException {
        JsonNode node = readTree(json, "contenuto");
        Class<? extends Content> target = switch (type) {
            case EQUIVALENCE -> EquivalenceContent.class;
            case MULTIPLE_CHOICE -> MultipleChoiceContent.class;
            case SYMBOL_ARRANGEMENT -> SymbolArrangementContent.class;
            case FORMULATION -> FormulationContent.class;
            case VALIDATION -> ValidationContent.class;
            case TRUTH_TABLE -> TruthTableContent.class;
            case PROOF -> ProofContent.class;
            case NORMAL_FORM -> NormalFormContent.class;
            case IDENTIFY_FALLACY -> FallacyContent.class;
        };
        return convert(node, target, type, "contenuto");
    }

    /**
     * Decodifica la soluzione; per EQUIVALENCE il testo viene ignorato.
     */
    public Solution decodeSolution(ExerciseType type, String json) throws GradingException {
        if (type == ExerciseType.EQUIVALENCE) {
            return new EquivalenceSolution();
        }
        JsonNode node = readTree(json, "soluzione");
        Class<? extends Solution> target = switch (type) {
            case MULTIPLE_CHOICE -> MultipleChoiceSolution.class;
            case SYMBOL_ARRANGEMENT, FORMULATION, NORMAL_FORM -> AcceptedFormulasSolution.class;
            case VALIDATION -> ValidationSolution.class;
            case TRUTH_TABLE -> TruthTableSolution.class;
            case PROOF -> ProofSolution.class;
            case IDENTIFY_FALLACY -> FallacySolution.class;
            case EQUIVALENCE -> throw new IllegalStateException("Tipo già gestito: " + type);
        };
        return convert(node, target, type, "soluzione");
    }

    //endregion

    //region RISPOSTE

    /**
     * Decodifica la risposta dello studente.
     *
     * FORME ACCETTATE:
     * • formule: "P -> Q" oppure {"formula": "P -> Q"}
     * • scelta multipla: ["a", "c"], "a" oppure {"selectedOptionIds": [...]}
     * • validità: true oppure {"isValid": true, "justification": "..."}
     * • tabella di verità: {"colonna": [true, null, ...]} oppure {"values": {...}}
     * • fallacia: "id" oppure {"fallacyId": "id"}
     * • dimostrazione: ["P", "P → Q", "Q"] oppure {"steps": [...]}
     */
    public Answer decodeAnswer(ExerciseType type, String json) throws GradingException {
        JsonNode node = readTree(json, "risposta");
        return switch (type) {
            case EQUIVALENCE, SYMBOL_ARRANGEMENT, FORMULATION, NORMAL_FORM ->
                    new FormulaAnswer(requireText(unwrap(node, "formula"), "formula"));
            case MULTIPLE_CHOICE -> new OptionSelectionAnswer(readStrings(unwrap(node, "selectedOptionIds"), "selectedOptionIds"));
            case VALIDATION -> decodeValidityAnswer(node);
            case TRUTH_TABLE -> new TruthTableAnswer(readColumns(node.has("values") ? node.get("values") : node));
            case IDENTIFY_FALLACY -> new FallacyAnswer(requireText(unwrap(node, "fallacyId"), "fallacyId"));
            case PROOF -> new ProofAnswer(readStrings(unwrap(node, "steps"), "steps"));
        };
    }

    private ValidityAnswer decodeValidityAnswer(JsonNode node) throws GradingException {
        if (node.isBoolean()) {
            return new ValidityAnswer(node.booleanValue(), null);
        }
        if (!node.isObject()) {
            throw new GradingException("Risposta di validità non interpretabile: " + node);
        }
        JsonNode verdict = node.get("isValid");
        if (verdict != null && !verdict.isNull() && !verdict.isBoolean()) {
            throw new GradingException("isValid deve essere un booleano: " + verdict);
        }
        JsonNode justification = node.get("justification");
        return new ValidityAnswer(
                verdict == null || verdict.isNull() ? null : verdict.booleanValue(),
                justification == null || justification.isNull() ? null : justification.asText());
    }

    private static JsonNode unwrap(JsonNode node, String property) {
        return node.isObject() && node.has(property) ? node.get(property) : node;
    }

    private static String requireText(JsonNode node, String property) throws GradingException {
        if (!node.isTextual()) {
            throw new GradingException("Valore testuale atteso per " + property + ": " + node);
        }
        return node.textValue();
    }

    private static List<String> readStrings(JsonNode node, String property) throws GradingException {
        List<String> values = new ArrayList<>();
        if (node.isTextual()) {
            values.add(node.textValue());
            return values;
        }
        if (!node.isArray()) {
            throw new GradingException("Lista di stringhe attesa per " + property + ": " + node);
        }
        for (JsonNode item : node) {
            values.add(requireText(item, property));
        }
        return values;
    }

    private static Map<String, List<Boolean>> readColumns(JsonNode node) throws GradingException {
        if (!node.isObject()) {
            throw new GradingException("Oggetto colonna -> valori atteso: " + node);
        }
        Map<String, List<Boolean>> columns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                throw new GradingException("Valori della colonna " + field.getKey() + " non in forma di lista");
            }
            List<Boolean> values = new ArrayList<>();
            for (JsonNode cell : field.getValue()) {
                if (cell.isNull()) {
                    values.add(null);
                } else if (cell.isBoolean()) {
                    values.add(cell.booleanValue());
                } else {
                    throw new GradingException("Cella non booleana nella colonna " + field.getKey() + ": " + cell);
                }
            }
            columns.put(field.getKey(), values);
        }
        return columns;
    }

    //endregion

    //region JACKSON

    private JsonNode readTree(String json, String role) throws GradingException {
        if (json == null || json.isBlank()) {
            throw new GradingException("JSON del " + role + " mancante");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOGGER.warning("JSON del " + role + " malformato: " + e.getOriginalMessage());
            throw new GradingException("JSON del " + role + " malformato: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> target, ExerciseType type, String role) throws GradingException {
        if (!node.isObject()) {
            throw new GradingException("Il " + role + " di un esercizio " + type + " deve essere un oggetto JSON");
        }
        try {
            return objectMapper.treeToValue(node, target);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String reason = e instanceof JsonProcessingException processing ? processing.getOriginalMessage() : e.getMessage();
            LOGGER.warning("Decodifica del " + role + " " + type + " fallita: " + reason);
            throw new GradingException("Il " + role + " non rispetta lo schema di " + type + ": " + reason, e);
        }
    }

    //endregion
}
