package com.vidnyan.flowchart.adapter.out.parser;

import com.vidnyan.flowchart.adapter.out.parser.antlr.PythonLexer;
import com.vidnyan.flowchart.adapter.out.parser.antlr.PythonParser;
import com.vidnyan.flowchart.application.port.out.SourceCodeParser;
import com.vidnyan.flowchart.domain.syntax.Module;
import com.vidnyan.flowchart.domain.syntax.SourceSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.springframework.stereotype.Component;

/**
 * ANTLR based Python front-end.
 * Lexes and parses the whole source, then maps the parse tree onto the domain syntax tree.
 */
@Slf4j
@Component
public class AntlrPythonParser implements SourceCodeParser {

    @Override
    public Module parse(String source) {
        long startTime = System.currentTimeMillis();
        String text = source.endsWith("\n") ? source : source + "\n";

        PythonLexer lexer = new PythonLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingErrorListener.INSTANCE);

        PythonParser parser = new PythonParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingErrorListener.INSTANCE);

        PythonParser.FileInputContext tree;
        try {
            tree = parser.fileInput();
        } catch (ParseCancellationException e) {
            throw new SourceSyntaxException(0, 0, e.getMessage(), e);
        }

        Module module = new PythonAstBuilder().build(tree);
        log.debug("Parsed {} characters in {}ms", source.length(), System.currentTimeMillis() - startTime);
        return module;
    }

    /**
     * Turns the first lexer or parser error into a {@link SourceSyntaxException}.
     */
    private static final class FailingErrorListener extends BaseErrorListener {

        static final FailingErrorListener INSTANCE = new FailingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new SourceSyntaxException(line, charPositionInLine, msg, e);
        }
    }
}
