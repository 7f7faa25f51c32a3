package com.specharvest.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The parser works on paragraphs only and never touches files or the network</li>
 *   <li>Renderers depend on the model, not on how documents were obtained</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.specharvest.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the parser performs no I/O and does not know about document sources or outputs.
     */
    @Test
    void parser_shouldNotDependOnIo() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "java.nio.file..",
                "java.net..",
                "..core.document..",
                "..core.fetch..",
                "..core.convert..",
                "..core.output..",
                "..core.pipeline..",
                "org.apache.poi..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldNotDependOnDocumentAcquisition() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.document..",
                "..core.fetch..",
                "..core.convert..",
                "..core.pipeline..");

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on other layers.
     */
    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.renderer..", "..core.output..", "..core.pipeline..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.model..", "..core.parser..", "..core.pipeline..");

        rule.check(classes);
    }
}
