package com.vidnyan.xref.adapter.out.parser;

import com.vidnyan.xref.domain.cst.PythonDialect;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Superclass of the generated {@code Python2to3Lexer}. Turns the physical token stream into the
 * logical one the grammar expects.
 *
 * <ul>
 *   <li>INDENT and DEDENT tokens from the leading whitespace of each logical line; a tab
 *       advances to the next multiple of eight</li>
 *   <li>no NEWLINE for blank or comment-only lines, or inside brackets</li>
 *   <li>{@code async}, {@code await}, {@code print} and {@code exec} retyped where they act as
 *       keywords</li>
 *   <li>a final NEWLINE and the pending DEDENTs before EOF</li>
 * </ul>
 */
public abstract class PythonLexerBase extends Lexer {

    private static final int TAB_SIZE = 8;

    private final List<Token> lookahead = new ArrayList<>();
    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private PythonDialect dialect = PythonDialect.PY3;
    private boolean atLineStart = true;
    private int opened;

    protected PythonLexerBase(CharStream input) {
        super(input);
        indents.push(0);
    }

    public void setDialect(PythonDialect dialect) {
        this.dialect = dialect;
    }

    public PythonDialect getDialect() {
        return dialect;
    }

    @Override
    public Token nextToken() {
        while (pending.isEmpty()) {
            layout(pollPhysical());
        }
        return pending.poll();
    }

    @Override
    public void reset() {
        lookahead.clear();
        pending.clear();
        indents.clear();
        indents.push(0);
        atLineStart = true;
        opened = 0;
        super.reset();
    }

    private void layout(Token token) {
        int type = token.getType();
        if (type == Token.EOF) {
            endOfFile(token);
            return;
        }
        if (atLineStart) {
            Token whitespace = null;
            if (type == Python2to3Lexer.WS) {
                whitespace = token;
                token = pollPhysical();
                type = token.getType();
            }
            if (type == Token.EOF) {
                endOfFile(token);
                return;
            }
            if (type == Python2to3Lexer.NEWLINE) {
                return;
            }
            atLineStart = false;
            indent(whitespace, token);
        } else if (type == Python2to3Lexer.WS) {
            return;
        }

        switch (type) {
            case Python2to3Lexer.NEWLINE -> {
                if (opened > 0) {
                    return;
                }
                atLineStart = true;
            }
            case Python2to3Lexer.LPAR, Python2to3Lexer.LSQB, Python2to3Lexer.LBRACE -> opened++;
            case Python2to3Lexer.RPAR, Python2to3Lexer.RSQB, Python2to3Lexer.RBRACE ->
                    opened = Math.max(0, opened - 1);
            case Python2to3Lexer.NAME -> retype((CommonToken) token);
            default -> {
            }
        }
        pending.add(token);
    }

    private void indent(Token whitespace, Token first) {
        int width = whitespace == null ? 0 : width(whitespace.getText());
        if (width > indents.peek()) {
            indents.push(width);
            pending.add(synthetic(Python2to3Lexer.INDENT, whitespace, whitespace.getStartIndex(),
                    whitespace.getStopIndex(), whitespace.getText()));
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            pending.add(synthetic(Python2to3Lexer.DEDENT, first, first.getStartIndex(),
                    first.getStartIndex() - 1, ""));
        }
        if (width != indents.peek()) {
            getErrorListenerDispatch().syntaxError(this, first, first.getLine(), first.getCharPositionInLine(),
                    "unindent does not match any outer indentation level", null);
        }
    }

    private void endOfFile(Token eof) {
        if (!atLineStart) {
            atLineStart = true;
            pending.add(synthetic(Python2to3Lexer.NEWLINE, eof, eof.getStartIndex(), eof.getStartIndex() - 1, ""));
        }
        while (indents.peek() > 0) {
            indents.pop();
            pending.add(synthetic(Python2to3Lexer.DEDENT, eof, eof.getStartIndex(), eof.getStartIndex() - 1, ""));
        }
        pending.add(eof);
    }

    private void retype(CommonToken token) {
        switch (token.getText()) {
            case "async" -> {
                int next = peekSignificant().getType();
                if (next == Python2to3Lexer.DEF || next == Python2to3Lexer.FOR || next == Python2to3Lexer.WITH) {
                    token.setType(Python2to3Lexer.ASYNC);
                }
            }
            case "await" -> {
                if (dialect == PythonDialect.PY3 && startsAtom(peekSignificant().getType())) {
                    token.setType(Python2to3Lexer.AWAIT);
                }
            }
            case "print" -> {
                if (dialect.hasPrintStatement()) {
                    token.setType(Python2to3Lexer.PRINT);
                }
            }
            case "exec" -> {
                if (dialect.hasPrintStatement()) {
                    token.setType(Python2to3Lexer.EXEC);
                }
            }
            default -> {
            }
        }
    }

    private static boolean startsAtom(int type) {
        return switch (type) {
            case Python2to3Lexer.NAME, Python2to3Lexer.NUMBER, Python2to3Lexer.STRING, Python2to3Lexer.ELLIPSIS,
                    Python2to3Lexer.LPAR, Python2to3Lexer.LSQB, Python2to3Lexer.LBRACE -> true;
            default -> false;
        };
    }

    private static int width(String whitespace) {
        int width = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            switch (whitespace.charAt(i)) {
                case '\t' -> width = (width / TAB_SIZE + 1) * TAB_SIZE;
                case '\f' -> width = 0;
                default -> width++;
            }
        }
        return width;
    }

    private Token synthetic(int type, Token at, int start, int stop, String text) {
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setLine(at.getLine());
        token.setCharPositionInLine(at.getCharPositionInLine());
        token.setText(text);
        return token;
    }

    private Token pollPhysical() {
        if (lookahead.isEmpty()) {
            return super.nextToken();
        }
        return lookahead.remove(0);
    }

    private Token peekSignificant() {
        for (int i = 0; ; i++) {
            while (lookahead.size() <= i) {
                lookahead.add(super.nextToken());
            }
            Token token = lookahead.get(i);
            if (token.getType() != Python2to3Lexer.WS) {
                return token;
            }
        }
    }
}
