package io.github.hide212131.langchain4j.mentor.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
        packages = "io.github.hide212131.langchain4j.mentor",
        importOptions = ImportOption.DoNotIncludeTests.class)
class LayeredArchitectureTest {

    private static final String APP = "io.github.hide212131.langchain4j.mentor.app..";
    private static final String RUNTIME = "io.github.hide212131.langchain4j.mentor.runtime..";
    private static final String INFRA = "io.github.hide212131.langchain4j.mentor.infra..";

    @ArchTest
    static final ArchRule appModuleShouldOnlyDependOnAllowedLayers =
            classes()
                    .that()
                    .resideInAPackage(APP)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(APP, RUNTIME, INFRA, "java..", "javax..", "picocli..");

    @ArchTest
    static final ArchRule runtimeModuleShouldNotDependOnApp =
            classes()
                    .that()
                    .resideInAPackage(RUNTIME)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "dev.langchain4j..",
                            "io.opentelemetry..",
                            "io.github.cdimascio..",
                            "com.fasterxml.jackson..");

    @ArchTest
    static final ArchRule infraModuleShouldBeLeafLayer =
            classes()
                    .that()
                    .resideInAPackage(INFRA)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(INFRA, "java..", "javax..", "org.slf4j..", "io.opentelemetry..", "org.yaml..");
}
