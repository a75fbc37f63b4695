package com.vidnyan.xref.adapter.out.parser;

import com.vidnyan.xref.application.port.out.SyntaxTreeParser.ParsedSource;
import com.vidnyan.xref.domain.cst.CstComposite;
import com.vidnyan.xref.domain.cst.CstLeaf;
import com.vidnyan.xref.domain.cst.CstNode;
import com.vidnyan.xref.domain.cst.PythonDialect;
import com.vidnyan.xref.domain.cst.Symbol;
import com.vidnyan.xref.domain.cst.TokenType;
import com.vidnyan.xref.domain.cst.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PythonSyntaxTreeParserTest {

    private final PythonSyntaxTreeParser parser = new PythonSyntaxTreeParser(new TreeBuilder());

    private CstComposite parse(String source, PythonDialect dialect) {
        ParsedSource parsed = parser.parse(source.getBytes(StandardCharsets.UTF_8), dialect);
        return (CstComposite) parsed.root();
    }

    private CstComposite parse(String source) {
        return parse(source, PythonDialect.PY3);
    }

    /**
     * The first node of the given symbol, depth first.
     */
    private static CstComposite find(CstNode node, Symbol symbol) {
        if (node.is(symbol)) {
            return (CstComposite) node;
        }
        if (node instanceof CstComposite composite) {
            for (CstNode child : composite.children()) {
                CstComposite found = find(child, symbol);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static List<CstComposite> findAll(CstNode node, Symbol symbol) {
        List<CstComposite> found = new ArrayList<>();
        collect(node, symbol, found);
        return found;
    }

    private static void collect(CstNode node, Symbol symbol, List<CstComposite> found) {
        if (node instanceof CstComposite composite) {
            if (composite.type() == symbol) {
                found.add(composite);
            }
            for (CstNode child : composite.children()) {
                collect(child, symbol, found);
            }
        }
    }

    @Test
    void parse_ShouldBuildFullWrapperChainForAssignment() {
        // Act
        CstComposite root = parse("x = 1\n");

        // Assert
        assertEquals(Symbol.FILE_INPUT, root.type());
        assertTrue(root.last().is(TokenType.ENDMARKER));
        CstComposite stmt = (CstComposite) root.child(0);
        assertEquals(Symbol.STMT, stmt.type());
        CstComposite simple = (CstComposite) stmt.child(0);
        assertEquals(Symbol.SIMPLE_STMT, simple.type());
        CstComposite small = (CstComposite) simple.child(0);
        assertEquals(Symbol.SMALL_STMT, small.type());
        CstComposite exprStmt = (CstComposite) small.child(0);
        assertEquals(Symbol.EXPR_STMT, exprStmt.type());
        assertEquals(3, exprStmt.size());
        assertTrue(exprStmt.child(0).is(Symbol.TESTLIST_STAR_EXPR));
        assertTrue(exprStmt.child(1).is(TokenType.EQUAL));

        CstComposite power = find(exprStmt.child(0), Symbol.POWER);
        assertNotNull(power);
        assertTrue(power.child(0).is(Symbol.ATOM));
        assertEquals("x", ((CstLeaf) ((CstComposite) power.child(0)).child(0)).value());
    }

    @Test
    void parse_ShouldCollapseConfiguredSymbols() {
        // Arrange
        PythonSyntaxTreeParser collapsing = new PythonSyntaxTreeParser(new TreeBuilder(Set.of(Symbol.ATOM)));

        // Act
        CstNode root = collapsing.parse("x\n".getBytes(StandardCharsets.UTF_8), PythonDialect.PY3).root();

        // Assert
        CstComposite power = find(root, Symbol.POWER);
        assertNotNull(power);
        assertTrue(power.child(0).is(TokenType.NAME));
        assertNull(find(root, Symbol.ATOM));
    }

    @Test
    void parse_ShouldAcceptSourceWithoutTrailingNewline() {
        CstComposite root = parse("x = 1");

        assertNotNull(find(root, Symbol.EXPR_STMT));
    }

    @Test
    void parse_ShouldAcceptEmptySource() {
        CstComposite root = parse("");

        assertEquals(1, root.size());
        assertTrue(root.child(0).is(TokenType.ENDMARKER));
    }

    @Test
    void parse_ShouldBuildFunctionDefinition() {
        // Act
        CstComposite root = parse("def f(a, b: int = 2, *args, c, **kw) -> str:\n    return a\n");

        // Assert
        CstComposite funcdef = find(root, Symbol.FUNCDEF);
        assertNotNull(funcdef);
        assertEquals("f", ((CstLeaf) funcdef.child(1)).value());
        assertTrue(funcdef.child(2).is(Symbol.PARAMETERS));
        assertTrue(funcdef.child(3).is(TokenType.RARROW));
        assertTrue(funcdef.last().is(Symbol.SUITE));
        CstComposite args = find(funcdef, Symbol.TYPEDARGSLIST);
        assertNotNull(args);
        assertNotNull(find(args, Symbol.TNAME));
        assertTrue(args.children().stream().anyMatch(c -> c.is(TokenType.DOUBLESTAR)));
    }

    @Test
    void parse_ShouldBuildCompoundStatements() {
        // Arrange
        String source = String.join("\n",
                "if a:",
                "    pass",
                "elif b:",
                "    pass",
                "else:",
                "    pass",
                "while c:",
                "    break",
                "for i, j in pairs:",
                "    continue",
                "try:",
                "    pass",
                "except ValueError as e:",
                "    raise",
                "except:",
                "    pass",
                "finally:",
                "    pass",
                "with open(p) as f, lock:",
                "    pass",
                "class C(Base, metaclass=M):",
                "    x = 1",
                "@decorator(1)",
                "def g(): pass",
                "");

        // Act
        CstComposite root = parse(source);

        // Assert
        assertEquals(11, find(root, Symbol.IF_STMT).size());
        assertNotNull(find(root, Symbol.WHILE_STMT));
        assertTrue(find(root, Symbol.FOR_STMT).child(1).is(Symbol.EXPRLIST));
        assertEquals(12, find(root, Symbol.TRY_STMT).size());
        assertEquals(4, find(root, Symbol.EXCEPT_CLAUSE).size());
        assertEquals(3, find(root, Symbol.WITH_ITEM).size());
        assertNotNull(find(root, Symbol.CLASSDEF));
        assertNotNull(find(root, Symbol.DECORATORS));
    }

    @Test
    void parse_ShouldBuildExpressions() {
        // Arrange
        String source = String.join("\n",
                "v = a if b else lambda x, *y: x",
                "w = not a or b and c < d <= e is not f not in g",
                "z = -x ** 2 + y[1:2, ::3] @ m.attr(*args, k=v, **kw)",
                "s = 'a' \"b\"",
                "e = ...",
                "c = [i for i in r if i] + {k: v for k, v in d} + {*s, 1} + (g for g in h)",
                "");

        // Act
        CstComposite root = parse(source);

        // Assert
        assertTrue(findAll(root, Symbol.TEST).stream().anyMatch(t -> t.size() == 5), "conditional expression");
        assertNotNull(find(root, Symbol.LAMBDEF));
        CstComposite comparison = findAll(root, Symbol.COMPARISON).stream()
                .filter(c -> c.size() > 1)
                .findFirst()
                .orElseThrow();
        assertEquals(9, comparison.size());
        assertEquals(2, ((CstComposite) comparison.child(5)).size(), "is not");
        assertEquals(2, ((CstComposite) comparison.child(7)).size(), "not in");
        assertNotNull(find(root, Symbol.SLICEOP));
        assertEquals(5, find(root, Symbol.ARGLIST).size());
        assertTrue(findAll(root, Symbol.ATOM).stream()
                .anyMatch(a -> a.size() == 2 && a.child(0).is(TokenType.STRING) && a.child(1).is(TokenType.STRING)));
        assertTrue(findAll(root, Symbol.ATOM).stream()
                .anyMatch(a -> a.size() == 3 && a.children().stream().allMatch(c -> c.is(TokenType.DOT))));
        assertNotNull(find(root, Symbol.COMP_IF));
        assertEquals(4, find(root, Symbol.DICTSETMAKER).size(), "dict comprehension");
        assertEquals(2, find(root, Symbol.TESTLIST_GEXP).size(), "generator expression");
    }

    @Test
    void parse_ShouldBuildImports() {
        CstComposite root = parse("import a.b as c, d\nfrom ..pkg import (x as y, z,)\nfrom . import *\n");

        assertEquals(3, find(root, Symbol.DOTTED_AS_NAMES).size());
        CstComposite importFrom = find(root, Symbol.IMPORT_FROM);
        assertTrue(importFrom.child(1).is(TokenType.DOT));
        assertTrue(importFrom.child(2).is(TokenType.DOT));
        assertTrue(importFrom.child(3).is(Symbol.DOTTED_NAME));
        assertEquals(4, find(importFrom, Symbol.IMPORT_AS_NAMES).size());
    }

    @Test
    void parse_ShouldTreatPrintAsStatementOnlyInPython2() {
        // Act
        CstComposite py2 = parse("print >>sys.stderr, 'x',\n", PythonDialect.PY2);
        CstComposite py3 = parse("print('x')\n", PythonDialect.PY3);

        // Assert
        CstComposite printStmt = find(py2, Symbol.PRINT_STMT);
        assertNotNull(printStmt);
        assertTrue(printStmt.child(1).is(TokenType.RIGHTSHIFT));
        assertTrue(printStmt.last().is(TokenType.COMMA));
        assertNull(find(py3, Symbol.PRINT_STMT));
        assertNotNull(find(py3, Symbol.TRAILER));
    }

    @Test
    void parse_ShouldAcceptPython2OnlySyntax() {
        CstComposite root = parse("exec code in ns\nx = `y`\ndef f((a, b)):\n    pass\nraise E, 'msg'\n",
                PythonDialect.PY2);

        assertNotNull(find(root, Symbol.EXEC_STMT));
        assertNotNull(find(root, Symbol.TESTLIST1));
        assertNotNull(find(root, Symbol.TFPLIST));
        assertEquals(4, find(root, Symbol.RAISE_STMT).size());
    }

    @Test
    void parse_ShouldMarkAsyncAndAwait() {
        CstComposite root = parse("async def f():\n    await g()\n    async with a as b:\n        pass\n");

        CstComposite asyncStmt = find(root, Symbol.ASYNC_STMT);
        assertNotNull(asyncStmt);
        assertTrue(asyncStmt.child(0).is(TokenType.ASYNC));
        assertTrue(find(root, Symbol.POWER).child(0).is(TokenType.AWAIT));
    }

    @Test
    void parse_ShouldReportSyntaxErrorPosition() {
        PythonSyntaxException e = assertThrows(PythonSyntaxException.class, () -> parse("x = 1\ny = = 2\n"));

        assertEquals(2, e.getLine());
        assertEquals(4, e.getColumn());
    }

    @Test
    void parse_ShouldRejectKeywordAsName() {
        assertThrows(PythonSyntaxException.class, () -> parse("class = 1\n"));
        assertThrows(PythonSyntaxException.class, () -> parse("print x\n", PythonDialect.PY3));
    }

    @Test
    void parse_ShouldRejectUnexpectedIndent() {
        assertThrows(PythonSyntaxException.class, () -> parse("x = 1\n    y = 2\n"));
    }

    @Test
    void parse_ShouldRejectUnclosedBracket() {
        assertThrows(PythonSyntaxException.class, () -> parse("f(a,\n"));
    }

    @Test
    void parse_ShouldKeepFileInputWhenEverySymbolCollapses() {
        // Arrange
        PythonSyntaxTreeParser collapsing = new PythonSyntaxTreeParser(new TreeBuilder(EnumSet.allOf(Symbol.class)));

        // Act
        CstNode root = collapsing.parse("# only a comment\n".getBytes(StandardCharsets.UTF_8), PythonDialect.PY3)
                .root();

        // Assert
        CstComposite fileInput = assertInstanceOf(CstComposite.class, root);
        assertEquals(Symbol.FILE_INPUT, fileInput.type());
        assertTrue(fileInput.child(0).is(TokenType.ENDMARKER));
    }

    private static CstLeaf name(CstNode root, String value) {
        return findLeaves(root).stream()
                .filter(leaf -> leaf.is(TokenType.NAME) && leaf.value().equals(value))
                .findFirst()
                .orElseThrow();
    }

    private static List<CstLeaf> findLeaves(CstNode node) {
        List<CstLeaf> leaves = new ArrayList<>();
        if (node instanceof CstLeaf leaf) {
            leaves.add(leaf);
        } else if (node instanceof CstComposite composite) {
            composite.children().forEach(child -> leaves.addAll(findLeaves(child)));
        }
        return leaves;
    }

    private static String slice(byte[] source, CstLeaf leaf, Charset charset) {
        return new String(Arrays.copyOfRange(source, leaf.span().startByte(), leaf.span().endByte()), charset);
    }

    @Test
    void parse_ShouldCountUtf8BytesAndCodePointColumns() {
        // Arrange
        byte[] source = "é = ü\n".getBytes(StandardCharsets.UTF_8);

        // Act
        CstNode root = parser.parse(source, PythonDialect.PY3).root();

        // Assert
        CstLeaf first = name(root, "é");
        CstLeaf second = name(root, "ü");
        assertEquals(0, first.span().startByte());
        assertEquals(2, first.span().endByte());
        assertEquals(5, second.span().startByte());
        assertEquals(4, second.span().column(), "columns count characters");
        assertEquals("ü", slice(source, second, StandardCharsets.UTF_8));
    }

    @Test
    void parse_ShouldOffsetSpansPastByteOrderMark() throws Exception {
        // Arrange
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
        bytes.write("y = 1\n".getBytes(StandardCharsets.UTF_8));
        byte[] source = bytes.toByteArray();

        // Act
        CstNode root = parser.parse(source, PythonDialect.PY3).root();

        // Assert
        CstLeaf y = name(root, "y");
        assertEquals(3, y.span().startByte());
        assertEquals("y", slice(source, y, StandardCharsets.UTF_8));
        assertEquals(0, y.span().column());
    }

    @Test
    void parse_ShouldMeasureSpansInDeclaredEncoding() {
        // Arrange
        byte[] source = "# -*- coding: latin-1 -*-\ns = 'éé'; y = 1\n".getBytes(StandardCharsets.ISO_8859_1);

        // Act
        ParsedSource parsed = parser.parse(source, PythonDialect.PY3);

        // Assert
        assertEquals(StandardCharsets.ISO_8859_1, parsed.encoding());
        CstLeaf y = name(parsed.root(), "y");
        assertEquals("y", slice(source, y, StandardCharsets.ISO_8859_1));
        CstLeaf string = findLeaves(parsed.root()).stream().filter(l -> l.is(TokenType.STRING)).findFirst()
                .orElseThrow();
        assertEquals("'éé'", slice(source, string, StandardCharsets.ISO_8859_1));
    }

    @Test
    void parse_ShouldClampSpanOfAppendedNewlineToFileLength() {
        // Arrange
        byte[] source = "x = 1".getBytes(StandardCharsets.UTF_8);

        // Act
        CstNode root = parser.parse(source, PythonDialect.PY3).root();

        // Assert
        CstLeaf newline = findLeaves(root).stream().filter(l -> l.is(TokenType.NEWLINE)).findFirst().orElseThrow();
        assertEquals(source.length, newline.span().endByte());
        assertEquals(source.length, ((CstComposite) root).last().span().startByte());
    }
}
