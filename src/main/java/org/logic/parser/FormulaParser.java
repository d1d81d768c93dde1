package org.logic.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.logic.antlr.LogicFormulaLexer;
import org.logic.antlr.LogicFormulaParser;
import org.logic.formula.Formula;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Dal testo all'albero sintattico {@link Formula}
 *
 * PIPELINE:
 * 1. Lexing con LogicFormulaLexer (spazi ignorati, grafie ASCII e Unicode equivalenti)
 * 2. Parsing a discesa ricorsiva con LogicFormulaParser, una regola per livello di precedenza
 * 3. Costruzione dell'AST tramite {@link FormulaBuilder}
 *
 * SIMBOLI ACCETTATI:
 * - Negazione: ~ ! ¬
 * - Congiunzione: & ^ ∧
 * - Disgiunzione: | ∨
 * - Implicazione: -> => →
 * - Biimplicazione: <-> <=> ↔
 * - Variabili: [A-Za-z][A-Za-z0-9_]*
 *
 * Il parsing è referenzialmente trasparente: lo stesso testo produce sempre
 * un albero strutturalmente uguale. Il primo errore interrompe l'analisi.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza il testo e costruisce la formula.
     *
     * @param text testo della formula (null equivale alla stringa vuota)
     * @return albero sintattico della formula
     * @throws FormulaSyntaxException su carattere sconosciuto, token inatteso,
     *         parentesi non chiusa, input residuo dopo una formula completa o
     *         annidamento più profondo dello stack disponibile
     */
    public static Formula parse(String text) {
        String input = text == null ? "" : text;
        LOGGER.finest("Parsing formula: " + input);

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(input));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        Formula formula;
        try {
            formula = new FormulaBuilder().visit(parser.formula());
        } catch (StackOverflowError e) {
            // Discesa ricorsiva e costruzione dell'AST usano un frame per livello di annidamento
            LOGGER.warning("Formula troppo annidata, " + input.length() + " caratteri");
            throw new FormulaSyntaxException("Formula troppo annidata per essere analizzata",
                    FormulaSyntaxException.TOO_DEEP, 0);
        }
        LOGGER.fine("Formula riconosciuta: " + formula);
        return formula;
    }

    /**
     * Variante senza eccezioni di {@link #parse(String)}.
     *
     * @param text testo della formula
     * @return successo con la formula, oppure fallimento con l'errore di sintassi
     */
    public static ParseResult tryParse(String text) {
        try {
            return ParseResult.success(parse(text));
        } catch (FormulaSyntaxException e) {
            LOGGER.fine("Formula rifiutata: " + e.getMessage());
            return ParseResult.failure(e);
        }
    }
}
