package org.logic.grading;

/**
 * Forma canonica del testo di una formula per il confronto testuale delle risposte.
 *
 * Rimuove ogni spazio e sostituisce le grafie ASCII con il simbolo Unicode del
 * connettivo. Le sequenze a tre caratteri vengono sostituite prima di quelle a
 * due: "<->" non deve diventare "<→".
 */
public final class AnswerNormalizer {

    private AnswerNormalizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param text testo della risposta (null equivale alla stringa vuota)
     * @return testo senza spazi con i connettivi in Unicode
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", "")
                .replace("<->", "↔")
                .replace("<=>", "↔")
                .replace("->", "→")
                .replace("=>", "→")
                .replace("~", "¬")
                .replace("!", "¬")
                .replace("&", "∧")
                .replace("^", "∧")
                .replace("|", "∨");
    }

    /**
     * Uguaglianza dopo la normalizzazione.
     */
    public static boolean matches(String first, String second) {
        return normalize(first).equals(normalize(second));
    }
}
