package com.codescore.core;

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
 *   <li>Metrics only see parse results, never a concrete parser tier</li>
 *   <li>The native tree-sitter binding stays behind the AST tier</li>
 *   <li>The model layer depends on nothing else in the project</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codescore.core");
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
     * Verifies metrics work on parse results alone, whichever tier produced them.
     */
    @Test
    void metrics_shouldNotDependOnParserTiers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..metrics..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser.ast..", "..parser.pattern..", "..parser.generic..");

        rule.check(classes);
    }

    /**
     * Verifies only the parser package chooses between parser tiers.
     */
    @Test
    void parserTiers_shouldOnlyBeReachedThroughParserPackage() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..parser..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser.ast..", "..parser.pattern..", "..parser.generic..");

        rule.check(classes);
    }

    /**
     * Verifies the native tree-sitter binding is confined to the AST tier.
     */
    @Test
    void treeSitter_shouldOnlyBeUsedByAstTier() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..parser.ast..")
            .should().dependOnClassesThat().resideInAPackage("org.treesitter..");

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the rest of the engine.
     */
    @Test
    void models_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..metrics..", "..scoring..", "..analyzer..", "..config..");

        rule.check(classes);
    }
}
