package com.vidnyan.xref;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * XREF - Python cross-reference front end
 *
 * Parses Python source and converts it into a binding-annotated cooked AST.
 */
@SpringBootApplication
public class XrefApplication {

    public static void main(String[] args) {
        SpringApplication.run(XrefApplication.class, args);
    }
}
