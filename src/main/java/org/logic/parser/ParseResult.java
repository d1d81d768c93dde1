package org.logic.parser;

import org.logic.formula.Formula;

/**
 * RISULTATO DI PARSING - Esito esplicito senza eccezioni
 *
 * Contiene la formula riconosciuta oppure l'errore di sintassi, mai entrambi.
 * Usato dove un testo malformato è un esito atteso (risposte degli studenti)
 * e non un guasto da propagare.
 */
public final class ParseResult {

    private final Formula formula;
    private final FormulaSyntaxException error;

    private ParseResult(Formula formula, FormulaSyntaxException error) {
        if ((formula == null) == (error == null)) {
            throw new IllegalArgumentException("Un risultato di parsing richiede esattamente una tra formula ed errore");
        }
        this.formula = formula;
        this.error = error;
    }

    public static ParseResult success(Formula formula) {
        return new ParseResult(formula, null);
    }

    public static ParseResult failure(FormulaSyntaxException error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * @return la formula riconosciuta
     * @throws IllegalStateException se il parsing è fallito
     */
    public Formula getFormula() {
        if (formula == null) {
            throw new IllegalStateException("Parsing fallito: " + error.getMessage());
        }
        return formula;
    }

    /**
     * @return l'errore di sintassi
     * @throws IllegalStateException se il parsing è riuscito
     */
    public FormulaSyntaxException getError() {
        if (error == null) {
            throw new IllegalStateException("Parsing riuscito, nessun errore disponibile");
        }
        return error;
    }

    /**
     * Restituisce la formula o rilancia l'errore di sintassi originale.
     */
    public Formula orElseThrow() {
        if (error != null) {
            throw error;
        }
        return formula;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[formula=" + formula + "]" : "ParseResult[errore=" + error.getMessage() + "]";
    }
}
