package com.vidnyan.xref.architecture;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
                .withImportOption(new ImportOption.DoNotIncludeTests())
                .importPackages("com.vidnyan.xref");
    }

    @Test
    void domain_ShouldNotDependOnOuterLayers() {
        noClasses().that().resideInAPackage("com.vidnyan.xref.domain..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("com.vidnyan.xref.adapter..", "com.vidnyan.xref.application..",
                        "com.vidnyan.xref.config..", "org.springframework..")
                .check(classes);
    }

    @Test
    void application_ShouldNotDependOnAdapters() {
        noClasses().that().resideInAPackage("com.vidnyan.xref.application..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("com.vidnyan.xref.adapter..", "com.vidnyan.xref.scanner..")
                .check(classes);
    }
}
