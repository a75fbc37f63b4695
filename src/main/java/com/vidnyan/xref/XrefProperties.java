package com.vidnyan.xref;

import com.vidnyan.xref.domain.cst.PythonDialect;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the cross-reference front end.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "xref")
public class XrefProperties {

    /**
     * Major version of the analyzed Python source: 2 or 3.
     */
    private int pythonVersion = 3;

    private Parser parser = new Parser();

    private Conversion conversion = new Conversion();

    private Kythe kythe = new Kythe();

    public PythonDialect dialect() {
        return PythonDialect.forVersion(pythonVersion);
    }

    @Data
    public static class Parser {
        /**
         * Grammar symbols (e.g. {@code and_expr}) whose single-child nodes are replaced by
         * the child while the tree is built. Empty by default.
         */
        private List<String> collapsibleSymbols = new ArrayList<>();
    }

    @Data
    public static class Conversion {
        /**
         * Convert the files of a batch in parallel. Each file is still converted on one thread.
         */
        private boolean parallel = false;
    }

    @Data
    public static class Kythe {
        /**
         * Value of "corpus" in the file metadata.
         */
        private String corpus = "";

        /**
         * Value of "root" in the file metadata.
         */
        private String root = "";
    }
}
