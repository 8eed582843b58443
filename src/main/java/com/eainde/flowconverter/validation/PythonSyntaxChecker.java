package com.eainde.flowconverter.validation;

import com.eainde.flowconverter.validation.grammar.Python3Lexer;
import com.eainde.flowconverter.validation.grammar.Python3Parser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a piece of source is a well-formed Python 3 module.
 *
 * <p>The source is run through the ANTLR-generated {@code Python3Lexer} and
 * {@code Python3Parser}; every error either of them reports becomes a
 * {@link ValidationIssue.Check#SYNTAX} issue on the line it was found. The
 * parser recovers after an error, so one mistake may produce several issues;
 * the first is the one to show.</p>
 */
public final class PythonSyntaxChecker {

    private PythonSyntaxChecker() {}

    public static List<ValidationIssue> check(String source) {
        SyntaxErrorListener errors = new SyntaxErrorListener();

        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        Python3Parser parser = new Python3Parser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        parser.file_input();

        return errors.issues;
    }

    public static boolean isValid(String source) {
        return check(source).isEmpty();
    }

    /** Collects lexer and parser errors in the order they are reported. */
    private static class SyntaxErrorListener extends BaseErrorListener {

        private final List<ValidationIssue> issues = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            issues.add(ValidationIssue.syntax(line, "column " + charPositionInLine + ": " + msg));
        }
    }
}
