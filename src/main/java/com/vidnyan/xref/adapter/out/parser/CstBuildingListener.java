package com.vidnyan.xref.adapter.out.parser;

import com.vidnyan.xref.domain.cst.CstNode;
import com.vidnyan.xref.domain.cst.Reduction;
import com.vidnyan.xref.domain.cst.SourceSpan;
import com.vidnyan.xref.domain.cst.Symbol;
import com.vidnyan.xref.domain.cst.TokenType;
import com.vidnyan.xref.domain.cst.TreeBuilder;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks an ANTLR parse tree and reports every rule and token to the {@link TreeBuilder} as a
 * {@link Reduction}, children first.
 */
final class CstBuildingListener extends Python2to3ParserBaseListener {

    private static final Symbol[] SYMBOLS = symbols(Python2to3Parser.ruleNames);
    private static final TokenType[] LEAF_TYPES = leafTypes(Python2to3Lexer.VOCABULARY);

    private final TreeBuilder treeBuilder;
    private final SourceOffsets offsets;
    private final Deque<List<CstNode>> children = new ArrayDeque<>();

    private CstBuildingListener(TreeBuilder treeBuilder, SourceOffsets offsets) {
        this.treeBuilder = treeBuilder;
        this.offsets = offsets;
        children.push(new ArrayList<>());
    }

    static CstNode build(ParseTree tree, TreeBuilder treeBuilder, SourceOffsets offsets) {
        CstBuildingListener listener = new CstBuildingListener(treeBuilder, offsets);
        ParseTreeWalker.DEFAULT.walk(listener, tree);
        return listener.children.pop().get(0);
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
        children.push(new ArrayList<>());
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        List<CstNode> nodes = children.pop();
        Symbol symbol = SYMBOLS[ctx.getRuleIndex()];
        children.peek().add(treeBuilder.build(Reduction.symbol(symbol, nodes)));
    }

    @Override
    public void visitTerminal(TerminalNode node) {
        Token token = node.getSymbol();
        int start = token.getStartIndex();
        if (token.getType() == Python2to3Lexer.ELLIPSIS) {
            // lib2to3 spells the ellipsis as three DOT leaves
            for (int i = 0; i < 3; i++) {
                leaf(TokenType.DOT, ".", new SourceSpan(offsets.byteAt(start + i), offsets.byteAt(start + i + 1),
                        token.getLine(), token.getCharPositionInLine() + i));
            }
            return;
        }
        SourceSpan span = new SourceSpan(offsets.byteAt(start), offsets.byteAt(token.getStopIndex() + 1),
                token.getLine(), token.getCharPositionInLine());
        if (token.getType() == Token.EOF) {
            leaf(TokenType.ENDMARKER, "", span);
        } else {
            leaf(leafType(token), token.getText(), span);
        }
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
        throw new IllegalStateException("Parse tree contains an error node: " + node.getText());
    }

    private void leaf(TokenType type, String value, SourceSpan span) {
        children.peek().add(treeBuilder.build(Reduction.token(type, value, span)));
    }

    private static TokenType leafType(Token token) {
        TokenType type = token.getType() < LEAF_TYPES.length ? LEAF_TYPES[token.getType()] : null;
        if (type == null) {
            throw new IllegalStateException("No leaf type for token " + Python2to3Lexer.VOCABULARY
                    .getDisplayName(token.getType()));
        }
        return type;
    }

    private static Symbol[] symbols(String[] ruleNames) {
        Symbol[] symbols = new Symbol[ruleNames.length];
        for (int i = 0; i < ruleNames.length; i++) {
            String name = ruleNames[i];
            symbols[i] = Symbol.forGrammarName(name)
                    .orElseThrow(() -> new IllegalStateException("Grammar rule without a symbol: " + name));
        }
        return symbols;
    }

    /**
     * Keywords, and print or exec where they are statements, are NAME leaves; every other token is
     * named after its TokenType.
     */
    private static TokenType[] leafTypes(Vocabulary vocabulary) {
        Map<String, TokenType> byName = new HashMap<>();
        for (TokenType type : TokenType.values()) {
            byName.put(type.name(), type);
        }
        TokenType[] types = new TokenType[vocabulary.getMaxTokenType() + 1];
        for (int i = 1; i < types.length; i++) {
            String symbolic = vocabulary.getSymbolicName(i);
            String literal = vocabulary.getLiteralName(i);
            if (literal != null && literal.matches("'[a-z]+'")
                    || Python2to3Lexer.PRINT == i || Python2to3Lexer.EXEC == i) {
                types[i] = TokenType.NAME;
            } else if (symbolic != null) {
                types[i] = byName.get(symbolic);
            }
        }
        return types;
    }
}
