package com.vidnyan.rva;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    private final JavaClasses classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.vidnyan.rva");

    @Test
    void domain_ShouldNotDependOnAdaptersOrFrameworks() {
        noClasses().that().resideInAPackage("com.vidnyan.rva.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.vidnyan.rva.adapter..",
                        "com.vidnyan.rva.application..",
                        "com.vidnyan.rva.config..",
                        "org.springframework..",
                        "com.github.javaparser..")
                .check(classes);
    }

    @Test
    void application_ShouldNotDependOnAdapters() {
        noClasses().that().resideInAPackage("com.vidnyan.rva.application..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.vidnyan.rva.adapter..",
                        "com.github.javaparser..")
                .check(classes);
    }
}
