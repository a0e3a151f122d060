package dev.verity.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.verity", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Pipeline stages must not reach back into the orchestrator
    @ArchTest
    static final ArchRule stages_should_not_depend_on_pipeline =
        noClasses().that().resideInAnyPackage(
                "..retrieval..", "..scoring..", "..gate..", "..generation..",
                "..verification..", "..decision..", "..index.."
            )
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

    // Retrieval is storage-agnostic: it sees the index only through VectorSearch
    @ArchTest
    static final ArchRule retrieval_should_not_depend_on_index =
        noClasses().that().resideInAPackage("..retrieval..")
            .should().dependOnClassesThat().resideInAPackage("..index..");

    // Config package should not depend on feature packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..retrieval..", "..scoring..", "..gate..", "..generation..",
                "..verification..", "..decision..", "..pipeline..", "..index.."
            );

    // Scoring is pure arithmetic over retrieval results
    @ArchTest
    static final ArchRule scoring_should_not_call_models =
        noClasses().that().resideInAPackage("..scoring..")
            .should().dependOnClassesThat().resideInAPackage("dev.langchain4j..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.verity.(*)..").should().beFreeOfCycles();
}
