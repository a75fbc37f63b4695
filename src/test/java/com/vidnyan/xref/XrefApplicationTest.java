package com.vidnyan.xref;

import com.vidnyan.xref.application.port.in.ConvertSourceUseCase;
import com.vidnyan.xref.application.port.out.CookedAstWriter;
import com.vidnyan.xref.application.port.out.SyntaxTreeParser;
import com.vidnyan.xref.domain.cst.PythonDialect;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "xref.python-version=2",
        "xref.kythe.corpus=test-corpus"
})
class XrefApplicationTest {

    @Autowired
    private ConvertSourceUseCase convertSourceUseCase;

    @Autowired
    private SyntaxTreeParser syntaxTreeParser;

    @Autowired
    private CookedAstWriter cookedAstWriter;

    @Autowired
    private XrefProperties properties;

    @Test
    void contextLoads_ShouldWireConverterWithoutSourcePath() {
        assertNotNull(convertSourceUseCase);
        assertNotNull(syntaxTreeParser);
        assertNotNull(cookedAstWriter);
        assertEquals(PythonDialect.PY2, properties.dialect());
        assertEquals("test-corpus", properties.getKythe().getCorpus());
        assertTrue(properties.getParser().getCollapsibleSymbols().isEmpty());
    }
}
