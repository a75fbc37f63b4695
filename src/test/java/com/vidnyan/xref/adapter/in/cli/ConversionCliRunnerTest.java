package com.vidnyan.xref.adapter.in.cli;

import com.vidnyan.xref.XrefProperties;
import com.vidnyan.xref.adapter.out.json.JsonCookedAstWriter;
import com.vidnyan.xref.adapter.out.parser.PythonSyntaxTreeParser;
import com.vidnyan.xref.application.service.ConversionApplicationService;
import com.vidnyan.xref.config.XrefConfiguration;
import com.vidnyan.xref.domain.convert.CstConverter;
import com.vidnyan.xref.domain.cst.TreeBuilder;
import com.vidnyan.xref.scanner.SourceScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.support.StaticApplicationContext;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConversionCliRunnerTest {

    @TempDir
    Path tempDir;

    private ConversionCliRunner runner(Path srcPath, String module, Path out) {
        XrefProperties properties = new XrefProperties();
        StaticApplicationContext context = new StaticApplicationContext();
        context.refresh();
        ConversionCliRunner runner = new ConversionCliRunner(
                new ConversionApplicationService(
                        new PythonSyntaxTreeParser(new TreeBuilder()), new CstConverter(), properties),
                new JsonCookedAstWriter(new XrefConfiguration().objectMapper()),
                new SourceScanner(),
                properties,
                context);
        ReflectionTestUtils.setField(runner, "srcPath", srcPath.toString());
        ReflectionTestUtils.setField(runner, "module", module);
        ReflectionTestUtils.setField(runner, "out", out == null ? "" : out.toString());
        return runner;
    }

    @Test
    void run_ShouldSucceedForDirectoryWithoutSources() throws Exception {
        // Arrange
        Path empty = Files.createDirectories(tempDir.resolve("empty"));
        Files.writeString(empty.resolve("notes.txt"), "nothing here");
        ConversionCliRunner runner = runner(empty, "", null);

        // Act
        runner.run();

        // Assert
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void run_ShouldNameRootInitAfterModulePrefix() throws Exception {
        // Arrange
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("__init__.py"), "VERSION = 1\n");
        Files.writeString(src.resolve("mod.py"), "def f():\n    pass\n");
        Path out = tempDir.resolve("out");
        ConversionCliRunner runner = runner(src, "pkg", out);

        // Act
        runner.run();

        // Assert
        assertEquals(0, runner.getExitCode());
        assertTrue(Files.exists(out.resolve("pkg.json")));
        assertTrue(Files.exists(out.resolve("pkg.mod.json")));
        assertFalse(Files.exists(out.resolve("pkg.__init__.json")));
    }

    @Test
    void run_ShouldFailForSingleFileWithoutModule() throws Exception {
        // Arrange
        Path file = tempDir.resolve("mod.py");
        Files.writeString(file, "x = 1\n");
        ConversionCliRunner runner = runner(file, "", null);

        // Act
        runner.run();

        // Assert
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void run_ShouldFailWhenAnyFileHasSyntaxErrors() throws Exception {
        // Arrange
        Path src = Files.createDirectories(tempDir.resolve("broken"));
        Files.writeString(src.resolve("good.py"), "x = 1\n");
        Files.writeString(src.resolve("bad.py"), "def (:\n");
        ConversionCliRunner runner = runner(src, "", null);

        // Act
        runner.run();

        // Assert
        assertEquals(1, runner.getExitCode());
    }
}
