package com.vidnyan.xref.application.port.in;

import com.vidnyan.xref.domain.cooked.FileInput;
import com.vidnyan.xref.domain.cst.PythonDialect;
import com.vidnyan.xref.domain.model.FileMeta;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: convert Python source files into cooked ASTs.
 */
public interface ConvertSourceUseCase {

    /**
     * Convert a single file. Failures propagate to the caller.
     * @param request what to convert
     * @return metadata, cooked tree and statistics
     */
    ConversionResult convert(ConversionRequest request);

    /**
     * Convert several files independently. A file that fails does not stop the others.
     * @return one outcome per request, in request order
     */
    List<FileOutcome> convertAll(List<ConversionRequest> requests);

    /**
     * Conversion request parameters.
     */
    record ConversionRequest(
        Path srcPath,
        String module,       // FQN of the module, e.g. pkg.sub.mod
        PythonDialect dialect
    ) {
        public static ConversionRequest of(Path srcPath, String module) {
            return new ConversionRequest(srcPath, module, PythonDialect.PY3);
        }
    }

    /**
     * Conversion result.
     */
    record ConversionResult(
        String module,
        FileMeta meta,
        FileInput root,
        ConversionStats stats
    ) {}

    /**
     * Conversion statistics.
     */
    record ConversionStats(
        int scopes,
        int bindings,
        int references,
        long durationMs
    ) {}

    /**
     * Outcome of one file in a batch: either a result or the reason it failed.
     */
    record FileOutcome(
        ConversionRequest request,
        ConversionResult result,
        String error
    ) {
        public static FileOutcome success(ConversionRequest request, ConversionResult result) {
            return new FileOutcome(request, result, null);
        }

        public static FileOutcome failure(ConversionRequest request, String error) {
            return new FileOutcome(request, null, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }
}
