package org.logic.formula;

/**
 * Connettivi binari della logica proposizionale.
 *
 * La precedenza cresce con il legame: IFF è il più debole, AND il più forte.
 * L'implicazione è l'unico connettivo associativo a destra.
 */
public enum Connective {
    AND("∧", "&", 4),
    OR("∨", "|", 3),
    IMPLIES("→", "->", 2),
    IFF("↔", "<->", 1);

    private final String symbol;
    private final String asciiSymbol;
    private final int precedence;

    Connective(String symbol, String asciiSymbol, int precedence) {
        this.symbol = symbol;
        this.asciiSymbol = asciiSymbol;
        this.precedence = precedence;
    }

    /** Simbolo Unicode canonico (∧, ∨, →, ↔) */
    public String getSymbol() {
        return symbol;
    }

    /** Grafia ASCII accettata dal parser (&, |, ->, <->) */
    public String getAsciiSymbol() {
        return asciiSymbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == IMPLIES;
    }
}
