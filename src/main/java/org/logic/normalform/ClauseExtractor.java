package org.logic.normalform;

import org.logic.formula.Connective;
import org.logic.formula.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * ESTRAZIONE CLAUSOLE - Da forma normale ad albero a lista di clausole
 *
 * CNF: la formula viene convertita, spezzata sulle congiunzioni esterne e ogni
 * congiunto viene letto come disgiunzione di letterali.
 * DNF: simmetricamente sulle disgiunzioni esterne, con termini congiuntivi.
 */
public final class ClauseExtractor {

    private ClauseExtractor() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Clausole della CNF della formula, nell'ordine da sinistra a destra.
     */
    public static List<Clause> extractCnfClauses(Formula formula) {
        return extract(NormalFormConverter.toCNF(formula), Connective.AND, Connective.OR);
    }

    /**
     * Termini della DNF della formula, nell'ordine da sinistra a destra.
     */
    public static List<Clause> extractDnfClauses(Formula formula) {
        return extract(NormalFormConverter.toDNF(formula), Connective.OR, Connective.AND);
    }

    private static List<Clause> extract(Formula normalForm, Connective outer, Connective inner) {
        List<Formula> parts = new ArrayList<>();
        flatten(normalForm, outer, parts);

        List<Clause> clauses = new ArrayList<>(parts.size());
        for (Formula part : parts) {
            List<Formula> literalNodes = new ArrayList<>();
            flatten(part, inner, literalNodes);

            List<Literal> literals = new ArrayList<>(literalNodes.size());
            for (Formula node : literalNodes) {
                literals.add(toLiteral(node));
            }
            clauses.add(new Clause(literals));
        }
        return clauses;
    }

    private static void flatten(Formula formula, Connective connective, List<Formula> collector) {
        if (formula.isBinary(connective)) {
            flatten(formula.getLeft(), connective, collector);
            flatten(formula.getRight(), connective, collector);
        } else {
            collector.add(formula);
        }
    }

    private static Literal toLiteral(Formula node) {
        if (node.isAtom()) {
            return Literal.positive(node.getName());
        }
        if (node.isLiteral()) {
            return Literal.negative(node.getOperand().getName());
        }
        throw new IllegalStateException("Nodo non letterale in forma normale: " + node);
    }
}
