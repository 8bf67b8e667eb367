package io.latexium.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Layering of the core packages and the logging facade boundary. */
@AnalyzeClasses(
        packages = "io.latexium.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule astIsTheBottomLayer = noClasses()
            .that()
            .resideInAPackage("io.latexium.core.ast..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.latexium.core.parser..",
                    "io.latexium.core.render..",
                    "io.latexium.core.simplify..",
                    "io.latexium.core.integrate..",
                    "io.latexium.core.model..")
            .because("the tree types are shared by every stage and must not know about them");

    @ArchTest
    static final ArchRule errorsAreSelfContained = classes()
            .that()
            .resideInAPackage("io.latexium.core.error..")
            .should()
            .onlyDependOnClassesThat()
            .resideInAnyPackage("io.latexium.core.error..", "java..")
            .because("exception types are thrown from every package");

    @ArchTest
    static final ArchRule noLogbackInCore = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..")
            .because("core logs through SLF4J only; the backend belongs to the application");

    @ArchTest
    static final ArchRule noCliDependency = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.latexium.cli..")
            .because("core must be usable as a library without the command line");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..");

    @ArchTest
    static final ArchRule facadeHasOnlyFinalFields = classes()
            .that()
            .haveSimpleName("Latexium")
            .should()
            .haveOnlyFinalFields()
            .because("one instance is shared between threads");
}
