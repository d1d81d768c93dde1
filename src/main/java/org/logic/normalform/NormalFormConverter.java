package org.logic.normalform;

import org.logic.formula.Connective;
import org.logic.formula.Formula;

import java.util.logging.Logger;

/**
 * CONVERTITORE FORME NORMALI - Riscritture NNF, CNF e DNF
 *
 * Tre passi di riscrittura componibili, ciascuno una funzione pura Formula -> Formula
 * che preserva l'equivalenza logica:
 *
 * 1. eliminateImplications: A → B ~ ¬A ∨ B, A ↔ B ~ (¬A ∨ B) ∧ (¬B ∨ A)
 * 2. pushNegationsInward: ¬¬A ~ A e leggi di De Morgan, fino a negazioni solo su atomi
 * 3. distributeOrOverAnd (CNF) / distributeAndOverOr (DNF)
 *
 * TERMINAZIONE: ogni passo riduce strettamente una misura (numero di implicazioni e
 * biimplicazioni, poi profondità delle negazioni, poi distanza dalla forma CNF/DNF).
 */
public final class NormalFormConverter {

    private static final Logger LOGGER = Logger.getLogger(NormalFormConverter.class.getName());

    private NormalFormConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Converte la formula nella forma normale richiesta.
     */
    public static Formula convert(Formula formula, NormalForm form) {
        return switch (form) {
            case NNF -> toNNF(formula);
            case CNF -> toCNF(formula);
            case DNF -> toDNF(formula);
        };
    }

    /**
     * Forma Normale Negativa: solo ∧, ∨ e negazioni applicate ad atomi.
     */
    public static Formula toNNF(Formula formula) {
        Formula result = eliminateImplications(formula);
        LOGGER.finest("Dopo eliminazione implicazioni: " + result);

        result = pushNegationsInward(result);
        LOGGER.fine("NNF: " + result);
        return result;
    }

    /**
     * Forma Normale Congiuntiva: congiunzione di clausole (disgiunzioni di letterali).
     */
    public static Formula toCNF(Formula formula) {
        Formula result = distributeOrOverAnd(toNNF(formula));
        LOGGER.fine("CNF: " + result);
        return result;
    }

    /**
     * Forma Normale Disgiuntiva: disgiunzione di termini (congiunzioni di letterali).
     */
    public static Formula toDNF(Formula formula) {
        Formula result = distributeAndOverOr(toNNF(formula));
        LOGGER.fine("DNF: " + result);
        return result;
    }

    //endregion

    //region ELIMINAZIONE IMPLICAZIONI

    /**
     * Riscrive implicazioni e biimplicazioni dal basso verso l'alto.
     *
     * TRASFORMAZIONI APPLICATE:
     * • A → B -> ¬A ∨ B
     * • A ↔ B -> (¬A ∨ B) ∧ (¬B ∨ A)
     *
     * @return formula equivalente che usa solo ¬, ∧, ∨
     */
    public static Formula eliminateImplications(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> formula;

            case NOT -> Formula.not(eliminateImplications(formula.getOperand()));

            case BINARY -> {
                Formula left = eliminateImplications(formula.getLeft());
                Formula right = eliminateImplications(formula.getRight());

                yield switch (formula.getConnective()) {
                    case IMPLIES -> Formula.or(Formula.not(left), right);
                    case IFF -> Formula.and(
                            Formula.or(Formula.not(left), right),
                            Formula.or(Formula.not(right), left));
                    case AND, OR -> Formula.binary(formula.getConnective(), left, right);
                };
            }
        };
    }

    //endregion

    //region NORMALIZZAZIONE NEGAZIONI (LEGGI DI DE MORGAN)

    /**
     * Spinge le negazioni verso le foglie.
     *
     * TRASFORMAZIONI APPLICATE:
     * • ¬¬A -> A
     * • ¬(A ∧ B) -> ¬A ∨ ¬B
     * • ¬(A ∨ B) -> ¬A ∧ ¬B
     * • ¬P rimane ¬P
     *
     * @param formula formula senza implicazioni né biimplicazioni
     * @return formula in NNF
     * @throws IllegalArgumentException se incontra una negazione di → o ↔
     */
    public static Formula pushNegationsInward(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> formula;

            case NOT -> applyNegationTransformation(formula.getOperand());

            case BINARY -> Formula.binary(formula.getConnective(),
                    pushNegationsInward(formula.getLeft()),
                    pushNegationsInward(formula.getRight()));
        };
    }

    /**
     * Applica la negazione all'operando secondo la sua forma.
     */
    private static Formula applyNegationTransformation(Formula operand) {
        return switch (operand.getType()) {
            case ATOM -> Formula.not(operand);

            case NOT -> pushNegationsInward(operand.getOperand());

            case BINARY -> switch (operand.getConnective()) {
                case AND -> Formula.or(
                        pushNegationsInward(Formula.not(operand.getLeft())),
                        pushNegationsInward(Formula.not(operand.getRight())));
                case OR -> Formula.and(
                        pushNegationsInward(Formula.not(operand.getLeft())),
                        pushNegationsInward(Formula.not(operand.getRight())));
                case IMPLIES, IFF -> throw new IllegalArgumentException(
                        "Negazione di " + operand.getConnective() + " non eliminata: " + operand);
            };
        };
    }

    //endregion

    //region DISTRIBUZIONE (FORMA CANONICA)

    /**
     * Distribuisce ∨ su ∧ in una formula NNF.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * • A ∨ (B ∧ C) -> (A ∨ B) ∧ (A ∨ C)
     * • (A ∧ B) ∨ C -> (A ∨ C) ∧ (B ∨ C)
     *
     * @param formula formula in NNF
     * @return formula in CNF
     */
    public static Formula distributeOrOverAnd(Formula formula) {
        return distribute(formula, Connective.OR, Connective.AND);
    }

    /**
     * Distribuisce ∧ su ∨ in una formula NNF.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * • A ∧ (B ∨ C) -> (A ∧ B) ∨ (A ∧ C)
     * • (A ∨ B) ∧ C -> (A ∧ C) ∨ (B ∧ C)
     *
     * @param formula formula in NNF
     * @return formula in DNF
     */
    public static Formula distributeAndOverOr(Formula formula) {
        return distribute(formula, Connective.AND, Connective.OR);
    }

    /**
     * Porta la formula nella forma "outer di inner" applicando la distributività
     * di inner su outer, dal basso verso l'alto.
     */
    private static Formula distribute(Formula formula, Connective inner, Connective outer) {
        if (!formula.isBinary()) {
            // Letterali: in NNF la negazione è solo su atomi
            return formula;
        }

        Formula left = distribute(formula.getLeft(), inner, outer);
        Formula right = distribute(formula.getRight(), inner, outer);

        if (formula.getConnective() == inner) {
            return distributeNode(left, right, inner, outer);
        }
        return Formula.binary(formula.getConnective(), left, right);
    }

    /**
     * Combina due operandi già in forma canonica sotto il connettivo inner.
     * Ogni nuovo sottoalbero viene ridistribuito: un passo può esporne un altro.
     */
    private static Formula distributeNode(Formula left, Formula right, Connective inner, Connective outer) {
        if (right.isBinary(outer)) {
            return Formula.binary(outer,
                    distributeNode(left, right.getLeft(), inner, outer),
                    distributeNode(left, right.getRight(), inner, outer));
        }

        if (left.isBinary(outer)) {
            return Formula.binary(outer,
                    distributeNode(left.getLeft(), right, inner, outer),
                    distributeNode(left.getRight(), right, inner, outer));
        }

        return Formula.binary(inner, left, right);
    }

    //endregion

    //region VERIFICA DELLA FORMA

    /**
     * Vero se la formula usa solo ∧, ∨ e negazioni di atomi.
     */
    public static boolean isNNF(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> true;
            case NOT -> formula.getOperand().isAtom();
            case BINARY -> (formula.getConnective() == Connective.AND || formula.getConnective() == Connective.OR)
                    && isNNF(formula.getLeft())
                    && isNNF(formula.getRight());
        };
    }

    /**
     * Vero se la formula è una congiunzione di disgiunzioni di letterali.
     */
    public static boolean isCNF(Formula formula) {
        return hasCanonicalShape(formula, Connective.AND, Connective.OR);
    }

    /**
     * Vero se la formula è una disgiunzione di congiunzioni di letterali.
     */
    public static boolean isDNF(Formula formula) {
        return hasCanonicalShape(formula, Connective.OR, Connective.AND);
    }

    /**
     * Verifica la forma richiesta.
     */
    public static boolean isInForm(Formula formula, NormalForm form) {
        return switch (form) {
            case NNF -> isNNF(formula);
            case CNF -> isCNF(formula);
            case DNF -> isDNF(formula);
        };
    }

    private static boolean hasCanonicalShape(Formula formula, Connective outer, Connective inner) {
        if (formula.isBinary(outer)) {
            return hasCanonicalShape(formula.getLeft(), outer, inner)
                    && hasCanonicalShape(formula.getRight(), outer, inner);
        }
        return isFlatOver(formula, inner);
    }

    private static boolean isFlatOver(Formula formula, Connective connective) {
        if (formula.isBinary(connective)) {
            return isFlatOver(formula.getLeft(), connective) && isFlatOver(formula.getRight(), connective);
        }
        return formula.isLiteral();
    }

    //endregion
}
