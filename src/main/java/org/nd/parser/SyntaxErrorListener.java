package org.nd.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

import java.util.logging.Logger;

/**
 * Listener ANTLR che trasforma il primo errore lessicale o sintattico in
 * {@link FormulaSyntaxException}, interrompendo immediatamente il parsing.
 *
 * La posizione riportata è l'indice assoluto del carattere nel testo di input:
 * - errori lessicali: inizio del token non riconosciuto
 * - errori sintattici: inizio del token inatteso (per EOF, la lunghezza dell'input)
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private static final Logger LOGGER = Logger.getLogger(SyntaxErrorListener.class.getName());

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        int position = resolvePosition(recognizer, offendingSymbol, charPositionInLine);
        LOGGER.fine(String.format("Errore rilevato alla posizione %d (riga %d): %s", position, line, msg));
        throw new FormulaSyntaxException(position, msg, e);
    }

    private static int resolvePosition(Recognizer<?, ?> recognizer, Object offendingSymbol, int charPositionInLine) {
        if (offendingSymbol instanceof Token token && token.getStartIndex() >= 0) {
            return token.getStartIndex();
        }
        if (recognizer instanceof Lexer lexer) {
            return lexer._tokenStartCharIndex;
        }
        return charPositionInLine;
    }
}
