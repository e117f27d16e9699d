package com.structdesign.core;

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
 *   <li>Models do not depend on the engine, renderers, configuration or I/O</li>
 *   <li>The design engine performs no file or console I/O of its own</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.structdesign.core");
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
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the engine, renderers, configuration or I/O.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..design..", "..renderer..", "..config..", "..io..");

        rule.check(classes);
    }

    /**
     * Verifies the design engine does not render or read files.
     */
    @Test
    void design_shouldNotDependOnRenderersOrIo() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..design..")
            .should().dependOnClassesThat().resideInAnyPackage("..renderer..", "..io..")
            .orShould().dependOnClassesThat().haveFullyQualifiedName("com.structdesign.core.config.ConfigLoader");

        rule.check(classes);
    }

    /**
     * Verifies the design engine holds no mutable static state other than loggers and constants.
     */
    @Test
    void design_fieldsShouldBeFinal() {
        ArchRule rule = fields()
            .that().areDeclaredInClassesThat().resideInAPackage("..design..")
            .should().beFinal();

        rule.check(classes);
    }
}
