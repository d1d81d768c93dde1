package org.logic.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.logic.antlr.LogicFormulaBaseVisitor;
import org.logic.antlr.LogicFormulaParser.AndContext;
import org.logic.antlr.LogicFormulaParser.FormulaContext;
import org.logic.antlr.LogicFormulaParser.IffContext;
import org.logic.antlr.LogicFormulaParser.ImpliesContext;
import org.logic.antlr.LogicFormulaParser.NotContext;
import org.logic.antlr.LogicFormulaParser.OrContext;
import org.logic.antlr.LogicFormulaParser.ParContext;
import org.logic.antlr.LogicFormulaParser.VariableContext;
import org.logic.formula.Connective;
import org.logic.formula.Formula;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE AST - Visitor dall'albero sintattico ANTLR a {@link Formula}
 *
 * Ogni metodo visit gestisce un livello di precedenza della grammatica LogicFormula
 * e restituisce il sottoalbero corrispondente, senza alcuna trasformazione semantica:
 * le implicazioni e le biimplicazioni restano tali nell'AST.
 *
 * ASSOCIATIVITÀ:
 * - Biimplicazione, disgiunzione, congiunzione: a sinistra, ((A op B) op C)
 * - Implicazione: a destra, A → (B → C), tramite la ricorsione della regola
 * - Negazione: prefissa e ricorsiva, ¬¬A
 */
class FormulaBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region CONNETTIVI BINARI

    /**
     * Catena di biimplicazioni: A ↔ B ↔ C diventa (A ↔ B) ↔ C.
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        if (ctx.IFF().isEmpty()) {
            return visit(ctx.implication(0));
        }

        LOGGER.finest("Elaborazione catena biimplicazioni: " + ctx.IFF().size() + " operatori");
        return foldLeft(Connective.IFF, ctx.implication());
    }

    /**
     * Implicazione associativa a destra: il conseguente è a sua volta un'implicazione.
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }

        Formula consequent = visit(ctx.implication());
        return Formula.implies(antecedent, consequent);
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }

        LOGGER.finest("Elaborazione disgiunzione con " + ctx.conjunction().size() + " operandi");
        return foldLeft(Connective.OR, ctx.conjunction());
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }

        LOGGER.finest("Elaborazione congiunzione con " + ctx.negation().size() + " operandi");
        return foldLeft(Connective.AND, ctx.negation());
    }

    //endregion

    //region NEGAZIONI, VARIABILI E PARENTESI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVariable(VariableContext ctx) {
        return Formula.atom(ctx.ATOM().getText());
    }

    /**
     * Le parentesi ripartono dal livello di precedenza più basso e non lasciano traccia nell'AST.
     */
    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    /**
     * Combina gli operandi da sinistra: [A, B, C] diventa (A op B) op C.
     */
    private Formula foldLeft(Connective connective, List<? extends ParserRuleContext> operands) {
        Formula result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = Formula.binary(connective, result, visit(operands.get(i)));
        }
        return result;
    }
}
