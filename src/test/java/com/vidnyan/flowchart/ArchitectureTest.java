package com.vidnyan.flowchart;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Hexagonal layering: the domain knows nothing of ports, adapters or frameworks,
 * and the application layer reaches adapters only through its ports.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.vidnyan.flowchart");
    }

    @Test
    void domain_ShouldNotDependOnOuterLayers() {
        noClasses().that().resideInAPackage("..flowchart.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..flowchart.application..",
                        "..flowchart.adapter..",
                        "..flowchart.config..",
                        "org.springframework..",
                        "org.antlr..",
                        "picocli..")
                .check(classes);
    }

    @Test
    void application_ShouldNotDependOnAdapters() {
        noClasses().that().resideInAPackage("..flowchart.application..")
                .should().dependOnClassesThat().resideInAPackage("..flowchart.adapter..")
                .check(classes);
    }

    @Test
    void parserRuntime_ShouldStayInTheParserAdapter() {
        noClasses().that().resideOutsideOfPackage("..flowchart.adapter.out.parser..")
                .should().dependOnClassesThat().resideInAPackage("org.antlr..")
                .check(classes);
    }
}
