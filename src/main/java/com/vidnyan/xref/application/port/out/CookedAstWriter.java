package com.vidnyan.xref.application.port.out;

import com.vidnyan.xref.domain.cooked.FileInput;
import com.vidnyan.xref.domain.model.FileMeta;

import java.nio.file.Path;

/**
 * Port for persisting a converted file for the next pass.
 */
public interface CookedAstWriter {

    /**
     * Write the file's metadata followed by its cooked AST.
     * @param target output file; parent directories are created as needed
     */
    void write(Path target, FileMeta meta, FileInput root);
}
