package org.logic.parser;

/**
 * Errore di sintassi in un testo di formula.
 *
 * Riporta il tipo del token che ha causato l'errore (nome simbolico della
 * grammatica, {@code EOF} per la fine dell'input, {@code UNKNOWN} per un
 * carattere non riconosciuto, {@code TOO_DEEP} per un annidamento oltre lo stack
 * disponibile) e la sua posizione assoluta nel testo (0-based).
 */
public class FormulaSyntaxException extends RuntimeException {

    public static final String END_OF_INPUT = "EOF";
    public static final String UNKNOWN_TOKEN = "UNKNOWN";
    public static final String TOO_DEEP = "TOO_DEEP";

    private final String tokenType;
    private final int position;

    public FormulaSyntaxException(String message, String tokenType, int position) {
        super(message);
        this.tokenType = tokenType;
        this.position = position;
    }

    public String getTokenType() {
        return tokenType;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Vero se l'errore è stato rilevato alla fine dell'input (formula incompleta).
     */
    public boolean isEndOfInput() {
        return END_OF_INPUT.equals(tokenType);
    }
}
