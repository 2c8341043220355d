package com.vidnyan.flowchart.adapter.out.parser.antlr;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;

/**
 * Lexer superclass that turns Python's significant whitespace into
 * NEWLINE, INDENT and DEDENT tokens.
 * Newlines inside brackets, blank lines and comment-only lines are dropped.
 */
public abstract class PythonLexerBase extends Lexer {

    private static final int TAB_SIZE = 8;

    private final LinkedList<Token> pending = new LinkedList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    /** Depth of open (, [ and { brackets; maintained by lexer actions. */
    protected int opened = 0;

    private Token lastToken = null;

    protected PythonLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
    }

    @Override
    public Token nextToken() {
        if (_input.LA(1) == EOF && !indents.isEmpty()) {
            pending.removeIf(token -> token.getType() == EOF);
            emit(commonToken(PythonLexer.NEWLINE, "\n"));
            while (!indents.isEmpty()) {
                emit(createDedent());
                indents.pop();
            }
            emit(commonToken(EOF, "<EOF>"));
        }

        Token next = super.nextToken();
        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = next;
        }
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        super.reset();
        pending.clear();
        indents.clear();
        opened = 0;
        lastToken = null;
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    /**
     * Called by the NEWLINE rule. Emits the logical newline followed by the
     * INDENT or DEDENT tokens implied by the next line's leading whitespace.
     */
    protected void onNewLine() {
        String text = getText();
        String newLine = text.replaceAll("[^\r\n\f]+", "");
        String spaces = text.replaceAll("[\r\n\f]+", "");

        int next = _input.LA(1);
        int nextNext = _input.LA(2);
        boolean blankOrComment = nextNext != EOF
                && (next == '\r' || next == '\n' || next == '\f' || next == '#');

        if (opened > 0 || blankOrComment) {
            skip();
            return;
        }

        emit(commonToken(PythonLexer.NEWLINE, newLine));
        int indent = indentationOf(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(commonToken(PythonLexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(createDedent());
                indents.pop();
            }
            int restored = indents.isEmpty() ? 0 : indents.peek();
            if (restored != indent) {
                getErrorListenerDispatch().syntaxError(this, null, getLine(), getCharPositionInLine(),
                        "unindent does not match any outer indentation level", null);
            }
        }
    }

    private Token createDedent() {
        CommonToken dedent = commonToken(PythonLexer.DEDENT, "");
        if (lastToken != null) {
            dedent.setLine(lastToken.getLine());
        }
        return dedent;
    }

    private CommonToken commonToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        return token;
    }

    static int indentationOf(String whitespace) {
        int count = 0;
        for (char ch : whitespace.toCharArray()) {
            if (ch == '\t') {
                count += TAB_SIZE - (count % TAB_SIZE);
            } else {
                count++;
            }
        }
        return count;
    }
}
