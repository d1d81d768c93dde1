package org.logic.grading;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RISULTATO DI CORREZIONE - Esito immutabile di una singola consegna
 *
 * COMPONENTI:
 * • Verdetto: corretto / non corretto
 * • Punteggio: credito parziale in [0, 1]
 * • Feedback: messaggio per lo studente
 * • Spiegazione: testo dell'autore, opzionale
 * • Dettagli: dati strutturati specifici del tipo (conteggi, controesempi, ...)
 *
 * INVARIANTE: un risultato corretto ha sempre punteggio pieno.
 */
public final class GradingResult {

    private final boolean correct;
    private final double score;
    private final String feedback;
    private final String explanation;
    private final Map<String, Object> details;

    /**
     * @throws IllegalArgumentException se il punteggio è fuori da [0, 1], se un
     *         risultato corretto non ha punteggio pieno o se manca il feedback
     */
    public GradingResult(boolean correct, double score, String feedback, String explanation, Map<String, Object> details) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Punteggio fuori intervallo [0, 1]: " + score);
        }
        if (correct && score != 1.0) {
            throw new IllegalArgumentException("Un risultato corretto richiede punteggio 1, trovato " + score);
        }
        if (feedback == null || feedback.isBlank()) {
            throw new IllegalArgumentException("Feedback obbligatorio");
        }

        this.correct = correct;
        this.score = score;
        this.feedback = feedback;
        this.explanation = explanation == null || explanation.isBlank() ? null : explanation;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    //region FACTORY

    public static GradingResult correct(String feedback, String explanation, Map<String, Object> details) {
        return new GradingResult(true, 1.0, feedback, explanation, details);
    }

    public static GradingResult incorrect(String feedback, String explanation, Map<String, Object> details) {
        return new GradingResult(false, 0.0, feedback, explanation, details);
    }

    /**
     * Credito parziale: mai corretto, anche con punteggio 1 ottenuto per arrotondamento.
     */
    public static GradingResult partial(double score, String feedback, String explanation, Map<String, Object> details) {
        return new GradingResult(false, score, feedback, explanation, details);
    }

    /**
     * Esito di una correzione interrotta da un errore: non corretto, punteggio 0, nessun dettaglio.
     */
    public static GradingResult failure(String feedback) {
        return new GradingResult(false, 0.0, feedback, null, null);
    }

    //endregion

    //region ACCESSO

    public boolean isCorrect() {
        return correct;
    }

    public double getScore() {
        return score;
    }

    public String getFeedback() {
        return feedback;
    }

    /** @return spiegazione dell'autore, null se assente */
    public String getExplanation() {
        return explanation;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    //endregion

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof GradingResult that)) return false;
        return correct == that.correct
                && Double.compare(score, that.score) == 0
                && feedback.equals(that.feedback)
                && Objects.equals(explanation, that.explanation)
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correct, score, feedback, explanation, details);
    }

    @Override
    public String toString() {
        return String.format("GradingResult[%s, punteggio=%.3f, feedback=%s]",
                correct ? "CORRETTO" : "NON CORRETTO", score, feedback);
    }
}
