package com.vidnyan.xref.adapter.out.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.xref.application.port.out.CookedAstWriter;
import com.vidnyan.xref.domain.cooked.FileInput;
import com.vidnyan.xref.domain.model.FileMeta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jackson based cooked AST writer.
 * Writes one JSON document per file: the metadata followed by the tree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCookedAstWriter implements CookedAstWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(Path target, FileMeta meta, FileInput root) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), new CookedAstDocument(meta, root));
            log.info("Wrote cooked AST for {} to {}", meta.path(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    record CookedAstDocument(
        FileMeta meta,
        FileInput root
    ) {}
}
