package com.vidnyan.xref.application.service;

import com.vidnyan.xref.XrefProperties;
import com.vidnyan.xref.application.port.in.ConvertSourceUseCase;
import com.vidnyan.xref.application.port.out.SyntaxTreeParser;
import com.vidnyan.xref.application.port.out.SyntaxTreeParser.ParsedSource;
import com.vidnyan.xref.domain.convert.CstConverter;
import com.vidnyan.xref.domain.cooked.ClassDefStmt;
import com.vidnyan.xref.domain.cooked.CookedNode;
import com.vidnyan.xref.domain.cooked.CookedTree;
import com.vidnyan.xref.domain.cooked.FileInput;
import com.vidnyan.xref.domain.cooked.FuncDefStmt;
import com.vidnyan.xref.domain.cooked.LambdaNode;
import com.vidnyan.xref.domain.cooked.NameNode;
import com.vidnyan.xref.domain.model.FileMeta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application service that reads, parses and converts Python files.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionApplicationService implements ConvertSourceUseCase {

    private final SyntaxTreeParser syntaxTreeParser;
    private final CstConverter cstConverter;
    private final XrefProperties properties;

    @Override
    public ConversionResult convert(ConversionRequest request) {
        Instant startTime = Instant.now();
        log.info("Converting {} (module {}, {})", request.srcPath(), request.module(), request.dialect());

        // Step 1: Read and parse
        byte[] contents = read(request);
        ParsedSource parsed = syntaxTreeParser.parse(contents, request.dialect());
        log.debug("Parsed {} as {}", request.srcPath(), parsed.encoding());

        // Step 2: Convert
        FileInput root = cstConverter.convertModule(parsed.root());

        FileMeta meta = FileMeta.of(
                properties.getKythe().getCorpus(),
                properties.getKythe().getRoot(),
                request.srcPath().toString(),
                contents,
                parsed.encoding());

        ConversionStats stats = statsOf(root, Duration.between(startTime, Instant.now()));
        log.info("Converted {}: {} scopes, {} bindings, {} references in {}ms",
                request.srcPath(), stats.scopes(), stats.bindings(), stats.references(), stats.durationMs());
        return new ConversionResult(request.module(), meta, root, stats);
    }

    @Override
    public List<FileOutcome> convertAll(List<ConversionRequest> requests) {
        boolean parallel = properties.getConversion().isParallel();
        log.info("Converting {} files{}", requests.size(), parallel ? " in parallel" : "");

        Stream<ConversionRequest> stream = parallel ? requests.parallelStream() : requests.stream();
        List<FileOutcome> outcomes = stream.map(this::convertIsolated).toList();

        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        if (failed > 0) {
            log.warn("{} of {} files failed to convert", failed, outcomes.size());
        } else {
            log.info("All {} files converted", outcomes.size());
        }
        return outcomes;
    }

    private FileOutcome convertIsolated(ConversionRequest request) {
        try {
            return FileOutcome.success(request, convert(request));
        } catch (RuntimeException e) {
            log.error("Error converting {}: {}", request.srcPath(), e.getMessage());
            return FileOutcome.failure(request, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private byte[] read(ConversionRequest request) {
        try {
            return Files.readAllBytes(request.srcPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + request.srcPath(), e);
        }
    }

    private ConversionStats statsOf(FileInput root, Duration duration) {
        int scopes = 0;
        int bindings = 0;
        int references = 0;
        for (CookedNode node : CookedTree.stream(root).toList()) {
            if (node instanceof FileInput || node instanceof FuncDefStmt
                    || node instanceof LambdaNode || node instanceof ClassDefStmt) {
                scopes++;
            } else if (node instanceof NameNode name) {
                if (name.binds()) {
                    bindings++;
                } else {
                    references++;
                }
            }
        }
        return new ConversionStats(scopes, bindings, references, duration.toMillis());
    }
}
