package com.vidnyan.xref.adapter.out.parser;

import com.vidnyan.xref.adapter.out.parser.SourceDecoder.DecodedSource;
import com.vidnyan.xref.application.port.out.SyntaxTreeParser;
import com.vidnyan.xref.domain.cst.CstNode;
import com.vidnyan.xref.domain.cst.PythonDialect;
import com.vidnyan.xref.domain.cst.TreeBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.springframework.stereotype.Component;

/**
 * ANTLR implementation of SyntaxTreeParser.
 * Decodes the source, parses it with the lib2to3 grammar and rebuilds the parse tree as a CST.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PythonSyntaxTreeParser implements SyntaxTreeParser {

    private final TreeBuilder treeBuilder;

    @Override
    public ParsedSource parse(byte[] source, PythonDialect dialect) {
        DecodedSource decoded = SourceDecoder.decode(source);
        String text = TreeBuilder.withTrailingNewline(decoded.text());

        Python2to3Lexer lexer = new Python2to3Lexer(CharStreams.fromString(text));
        lexer.setDialect(dialect);
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        Python2to3Parser parser = new Python2to3Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        Python2to3Parser.File_inputContext tree = parser.file_input();
        log.debug("Parsed {} characters into {} tokens", text.length(), tokens.size());

        SourceOffsets offsets = SourceOffsets.of(text, decoded.charset(), decoded.byteOffset(), source.length);
        CstNode root = CstBuildingListener.build(tree, treeBuilder, offsets);
        return new ParsedSource(root, decoded.charset());
    }
}
