package org.logic.catalog;

import java.util.List;

/**
 * Voce del catalogo degli operatori.
 *
 * @param altSymbols   grafie alternative che gli utenti possono incontrare
 * @param arity        0 costante, 1 unario, 2 binario
 * @param precedence   più alto = lega più forte
 * @param inputSymbols simboli da accettare in input per l'operatore
 */
public record LogicOperator(String id,
                            String symbol,
                            List<String> altSymbols,
                            String name,
                            LogicType type,
                            int arity,
                            int precedence,
                            String description,
                            String example,
                            DifficultyLevel difficulty,
                            List<String> inputSymbols) {

    public LogicOperator {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identificativo operatore non può essere vuoto");
        }
        if (arity < 0 || arity > 2) {
            throw new IllegalArgumentException("Arietà non valida per " + id + ": " + arity);
        }
        altSymbols = List.copyOf(altSymbols);
        inputSymbols = List.copyOf(inputSymbols);
    }

    /**
     * Vero se il simbolo corrisponde alla grafia principale, a una alternativa o a un simbolo di input.
     */
    public boolean matchesSymbol(String candidate) {
        return symbol.equals(candidate) || altSymbols.contains(candidate) || inputSymbols.contains(candidate);
    }
}
