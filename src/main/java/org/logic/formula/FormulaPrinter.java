package org.logic.formula;

/**
 * STAMPA FORMULE - Serializzazione testuale con parentesi minime
 *
 * Un figlio binario riceve le parentesi quando la sua precedenza è:
 * • minore di quella del padre, se è il figlio sinistro
 * • minore o uguale a quella del padre, se è il figlio destro
 *
 * L'asimmetria rispecchia l'associatività a sinistra di IFF, OR e AND.
 * L'implicazione è associativa a destra: un'implicazione figlia sinistra di
 * un'implicazione va sempre racchiusa tra parentesi, altrimenti (A → B) → C
 * verrebbe riletta come A → (B → C).
 *
 * La negazione di un nodo binario è sempre racchiusa: ¬(P ∧ Q), ¬¬P.
 */
public final class FormulaPrinter {

    /**
     * Notazioni di output supportate.
     */
    public enum Notation {
        UNICODE("¬"),
        ASCII("!");

        private final String negation;

        Notation(String negation) {
            this.negation = negation;
        }

        String symbolOf(Connective connective) {
            return this == UNICODE ? connective.getSymbol() : connective.getAsciiSymbol();
        }
    }

    private FormulaPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Stampa la formula in notazione Unicode (¬, ∧, ∨, →, ↔).
     */
    public static String print(Formula formula) {
        return print(formula, Notation.UNICODE);
    }

    /**
     * Stampa la formula nella notazione richiesta.
     *
     * @param formula formula da serializzare (non null)
     * @param notation notazione dei connettivi
     * @return testo rileggibile dal parser
     */
    public static String print(Formula formula, Notation notation) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da stampare non può essere null");
        }
        StringBuilder builder = new StringBuilder();
        append(builder, formula, notation);
        return builder.toString();
    }

    private static void append(StringBuilder builder, Formula formula, Notation notation) {
        switch (formula.getType()) {
            case ATOM -> builder.append(formula.getName());

            case NOT -> {
                builder.append(notation.negation);
                Formula operand = formula.getOperand();
                appendWrapped(builder, operand, notation, operand.isBinary());
            }

            case BINARY -> {
                Connective connective = formula.getConnective();
                Formula left = formula.getLeft();
                Formula right = formula.getRight();

                appendWrapped(builder, left, notation, needsLeftParentheses(connective, left));
                builder.append(' ').append(notation.symbolOf(connective)).append(' ');
                appendWrapped(builder, right, notation, needsRightParentheses(connective, right));
            }
        }
    }

    private static void appendWrapped(StringBuilder builder, Formula formula, Notation notation, boolean wrap) {
        if (wrap) {
            builder.append('(');
            append(builder, formula, notation);
            builder.append(')');
        } else {
            append(builder, formula, notation);
        }
    }

    private static boolean needsLeftParentheses(Connective parent, Formula child) {
        if (!child.isBinary()) {
            return false;
        }
        Connective connective = child.getConnective();
        if (parent.isRightAssociative() && connective == parent) {
            return true;
        }
        return connective.getPrecedence() < parent.getPrecedence();
    }

    private static boolean needsRightParentheses(Connective parent, Formula child) {
        return child.isBinary() && child.getConnective().getPrecedence() <= parent.getPrecedence();
    }
}
