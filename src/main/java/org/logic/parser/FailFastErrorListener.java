package org.logic.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Listener ANTLR che interrompe lexing e parsing al primo errore.
 *
 * Sostituisce il listener di console predefinito: nessun tentativo di recupero,
 * il primo errore diventa una {@link FormulaSyntaxException} con tipo del token
 * e posizione assoluta nel testo.
 */
class FailFastErrorListener extends BaseErrorListener {

    static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        if (offendingSymbol instanceof Token) {
            throw unexpectedToken(recognizer, (Token) offendingSymbol, charPositionInLine);
        }
        throw unknownCharacter(recognizer, charPositionInLine);
    }

    private FormulaSyntaxException unexpectedToken(Recognizer<?, ?> recognizer, Token token, int charPositionInLine) {
        int position = token.getStartIndex() >= 0 ? token.getStartIndex() : charPositionInLine;

        if (token.getType() == Token.EOF) {
            return new FormulaSyntaxException(
                    "Formula incompleta: fine dell'input inattesa alla posizione " + position,
                    FormulaSyntaxException.END_OF_INPUT, position);
        }

        String tokenType = recognizer.getVocabulary().getSymbolicName(token.getType());
        return new FormulaSyntaxException(
                "Simbolo inatteso '" + token.getText() + "' (" + tokenType + ") alla posizione " + position,
                tokenType, position);
    }

    private FormulaSyntaxException unknownCharacter(Recognizer<?, ?> recognizer, int charPositionInLine) {
        if (!(recognizer instanceof Lexer)) {
            return new FormulaSyntaxException("Errore di sintassi alla posizione " + charPositionInLine,
                    FormulaSyntaxException.UNKNOWN_TOKEN, charPositionInLine);
        }

        Lexer lexer = (Lexer) recognizer;
        int position = lexer._tokenStartCharIndex;
        String text = lexer._input.getText(Interval.of(position, lexer._input.index()));
        return new FormulaSyntaxException(
                "Carattere non riconosciuto '" + text + "' alla posizione " + position,
                FormulaSyntaxException.UNKNOWN_TOKEN, position);
    }
}
