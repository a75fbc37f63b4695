package com.vidnyan.xref.domain.cst;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    private static final SourceSpan SPAN = new SourceSpan(0, 1, 1, 0);

    @Test
    void build_ShouldCreateLeafForToken() {
        // Arrange
        TreeBuilder builder = new TreeBuilder();

        // Act
        CstNode node = builder.build(Reduction.token(TokenType.NAME, "x", SPAN));

        // Assert
        CstLeaf leaf = assertInstanceOf(CstLeaf.class, node);
        assertEquals(TokenType.NAME, leaf.type());
        assertEquals("x", leaf.value());
        assertEquals(SPAN, leaf.span());
    }

    @Test
    void build_ShouldKeepSingleChildNodesByDefault() {
        // Arrange
        TreeBuilder builder = new TreeBuilder();
        CstNode name = builder.build(Reduction.token(TokenType.NAME, "x", SPAN));

        // Act
        CstNode atom = builder.build(Reduction.symbol(Symbol.ATOM, List.of(name)));

        // Assert
        CstComposite composite = assertInstanceOf(CstComposite.class, atom);
        assertEquals(Symbol.ATOM, composite.type());
        assertSame(name, composite.child(0));
        assertEquals(SPAN, composite.span());
    }

    @Test
    void build_ShouldCollapseConfiguredSymbolWithOneChild() {
        // Arrange
        TreeBuilder builder = new TreeBuilder(Set.of(Symbol.ATOM));
        CstNode name = builder.build(Reduction.token(TokenType.NAME, "x", SPAN));

        // Act
        CstNode atom = builder.build(Reduction.symbol(Symbol.ATOM, List.of(name)));
        CstNode power = builder.build(Reduction.symbol(Symbol.POWER, List.of(atom)));

        // Assert
        assertSame(name, atom);
        assertTrue(power.is(Symbol.POWER));
        assertEquals(Set.of(Symbol.ATOM), builder.collapsible());
    }

    @Test
    void build_ShouldNotCollapseConfiguredSymbolWithSeveralChildren() {
        // Arrange
        TreeBuilder builder = new TreeBuilder(Set.of(Symbol.ARITH_EXPR));
        CstNode a = builder.build(Reduction.token(TokenType.NAME, "a", new SourceSpan(0, 1, 1, 0)));
        CstNode plus = builder.build(Reduction.token(TokenType.PLUS, "+", new SourceSpan(2, 3, 1, 2)));
        CstNode b = builder.build(Reduction.token(TokenType.NAME, "b", new SourceSpan(4, 5, 1, 4)));

        // Act
        CstNode sum = builder.build(Reduction.symbol(Symbol.ARITH_EXPR, List.of(a, plus, b)));

        // Assert
        CstComposite composite = assertInstanceOf(CstComposite.class, sum);
        assertEquals(3, composite.size());
        assertEquals(0, composite.span().startByte());
        assertEquals(5, composite.span().endByte());
    }

    @Test
    void build_ShouldNeverCollapseStartSymbols() {
        // Arrange
        TreeBuilder builder = new TreeBuilder(EnumSet.allOf(Symbol.class));
        CstNode end = builder.build(Reduction.token(TokenType.ENDMARKER, "", new SourceSpan(0, 0, 1, 0)));

        // Act
        CstNode root = builder.build(Reduction.symbol(Symbol.FILE_INPUT, List.of(end)));

        // Assert
        CstComposite composite = assertInstanceOf(CstComposite.class, root);
        assertEquals(Symbol.FILE_INPUT, composite.type());
        assertSame(end, composite.child(0));
        assertFalse(builder.collapsible().contains(Symbol.FILE_INPUT));
        assertFalse(builder.collapsible().contains(Symbol.EVAL_INPUT));
        assertTrue(builder.collapsible().contains(Symbol.ATOM));
    }

    @Test
    void build_ShouldRejectTokenWithChildren() {
        TreeBuilder builder = new TreeBuilder();
        CstNode name = builder.build(Reduction.token(TokenType.NAME, "x", SPAN));
        Reduction broken = new Reduction(TokenType.NAME, "x", List.of(name), SPAN);

        assertThrows(IllegalArgumentException.class, () -> builder.build(broken));
    }

    @Test
    void withTrailingNewline_ShouldAppendOnlyWhenMissing() {
        assertEquals("x = 1\n", TreeBuilder.withTrailingNewline("x = 1"));
        assertEquals("x = 1\n", TreeBuilder.withTrailingNewline("x = 1\n"));
        assertEquals("", TreeBuilder.withTrailingNewline(""));
    }

    @Test
    void forGrammarName_ShouldResolveConfiguredNames() {
        assertEquals(Symbol.AND_EXPR, Symbol.forGrammarName("and_expr").orElseThrow());
        assertEquals(Symbol.TESTLIST_GEXP, Symbol.forGrammarName(" Testlist_Gexp ").orElseThrow());
        assertTrue(Symbol.forGrammarName("no_such_rule").isEmpty());
        assertTrue(Symbol.forGrammarName(null).isEmpty());
    }
}
