package org.morkdb.syntax;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import org.morkdb.syntax.antlr.MorkLexer;
import org.morkdb.syntax.antlr.MorkParser;
import org.morkdb.syntax.antlr.MorkSyntaxBuilder;

/**
 * Parses Mork text into a {@link MorkDocument} using the ANTLR-generated
 * lexer and parser.
 *
 * Parsing is purely syntactic: references stay symbolic and escapes stay in
 * the literal text. Resolution is the job of the database builder.
 */
public final class MorkSyntaxParser {

    private MorkSyntaxParser() {
        // Static utility class
    }

    /**
     * Parses a complete Mork store.
     *
     * @param source The Mork text, including its header comment
     * @return The syntax tree
     * @throws MorkParseException if the text is not well-formed Mork
     */
    public static MorkDocument parse(String source) {
        MorkLexer lexer = new MorkLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        MorkParser parser = new MorkParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        MorkParser.DatabaseContext tree = parser.database();
        return new MorkSyntaxBuilder().visitDatabase(tree);
    }

    /**
     * Error listener that converts ANTLR errors to MorkParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new MorkParseException(msg, line, charPositionInLine);
        }
    }
}
