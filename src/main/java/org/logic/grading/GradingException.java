package org.logic.grading;

/**
 * Errore durante la correzione di un esercizio specifico.
 *
 * Segnala esercizi configurati male, dati che non rispettano lo schema del tipo o
 * formule oltre il limite di variabili. Il correttore la converte sempre in un
 * esito negativo: non raggiunge mai il chiamante di {@link Grader#grade}.
 */
public class GradingException extends Exception {

    public GradingException(String message) {
        super(message);
    }

    public GradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
