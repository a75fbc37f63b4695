package com.vidnyan.xref.adapter.in.cli;

import com.vidnyan.xref.XrefProperties;
import com.vidnyan.xref.application.port.in.ConvertSourceUseCase;
import com.vidnyan.xref.application.port.in.ConvertSourceUseCase.ConversionRequest;
import com.vidnyan.xref.application.port.in.ConvertSourceUseCase.ConversionResult;
import com.vidnyan.xref.application.port.in.ConvertSourceUseCase.FileOutcome;
import com.vidnyan.xref.application.port.out.CookedAstWriter;
import com.vidnyan.xref.domain.cst.PythonDialect;
import com.vidnyan.xref.scanner.SourceScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI Runner for standalone conversion.
 * Runs when xref.convert.srcpath is set: a single file (with xref.convert.module) or a
 * directory whose .py files are converted with module names derived from their paths.
 * The exit code is 0 when every file converted, including when a directory holds none.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ConvertSourceUseCase convertSourceUseCase;
    private final CookedAstWriter cookedAstWriter;
    private final SourceScanner sourceScanner;
    private final XrefProperties properties;
    private final ConfigurableApplicationContext context;

    @Value("${xref.convert.srcpath:}")
    private String srcPath;

    @Value("${xref.convert.module:}")
    private String module;

    @Value("${xref.convert.out:}")
    private String out;

    private int exitCode;

    @Override
    public void run(String... args) throws Exception {
        if (srcPath == null || srcPath.isBlank()) {
            log.info("No source path specified. Set xref.convert.srcpath property.");
            return;
        }

        exitCode = 1;
        try {
            PythonDialect dialect = properties.dialect();
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           XREF - Python cooked AST converter                  ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Converting: {}", truncatePath(srcPath, 50));
            log.info("║ Dialect:    {}", dialect);
            log.info("╚══════════════════════════════════════════════════════════════╝");

            Path source = Path.of(srcPath);
            List<ConversionRequest> requests = requestsFor(source, dialect);
            if (requests.isEmpty()) {
                exitCode = Files.isDirectory(source) ? 0 : 1;
                return;
            }

            List<FileOutcome> outcomes = convertSourceUseCase.convertAll(requests);
            printResults(outcomes);

            if (out != null && !out.isBlank()) {
                writeResults(Path.of(out), Files.isDirectory(source), outcomes);
            }

            exitCode = outcomes.stream().allMatch(FileOutcome::succeeded) ? 0 : 1;
            log.info("");
            log.info("Conversion complete!");
        } finally {
            SpringApplication.exit(context, this);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private List<ConversionRequest> requestsFor(Path source, PythonDialect dialect) throws Exception {
        if (Files.isDirectory(source)) {
            List<ConversionRequest> requests = new ArrayList<>();
            for (Path file : sourceScanner.scanSourceFiles(source)) {
                String name = sourceScanner.moduleName(source, file, module);
                requests.add(new ConversionRequest(file, name, dialect));
            }
            if (requests.isEmpty()) {
                log.warn("No Python files under {}; nothing to convert", source);
            } else {
                log.info("Found {} Python files under {}", requests.size(), source);
            }
            return requests;
        }
        if (module == null || module.isBlank()) {
            log.error("No module specified for {}. Set xref.convert.module property.", source);
            return List.of();
        }
        return List.of(new ConversionRequest(source, module, dialect));
    }

    private void writeResults(Path target, boolean directory, List<FileOutcome> outcomes) {
        for (FileOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                continue;
            }
            ConversionResult result = outcome.result();
            Path file = directory ? target.resolve(result.module() + ".json") : target;
            cookedAstWriter.write(file, result.meta(), result.root());
        }
    }

    private void printResults(List<FileOutcome> outcomes) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CONVERSION RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");

        int failed = 0;
        for (FileOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                ConvertSourceUseCase.ConversionStats stats = outcome.result().stats();
                log.info(" ✅ {} ({} scopes, {} bindings, {} references, {}ms)",
                        outcome.result().module(), stats.scopes(), stats.bindings(),
                        stats.references(), stats.durationMs());
            } else {
                failed++;
                log.info(" 🔴 {}", outcome.request().srcPath());
                log.info("    Error: {}", outcome.error());
            }
        }

        log.info("───────────────────────────────────────────────────────────────");
        log.info(" Files converted: {}", outcomes.size() - failed);
        log.info(" Files failed:    {}", failed);
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
