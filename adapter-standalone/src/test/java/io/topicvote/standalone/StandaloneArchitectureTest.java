package io.topicvote.standalone;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Module boundaries of the standalone host. */
@AnalyzeClasses(packages = "io.topicvote.standalone", importOptions = ImportOption.DoNotIncludeTests.class)
class StandaloneArchitectureTest {

    @ArchTest
    static final ArchRule usesEngineFacadeOnly = noClasses()
            .that()
            .resideInAPackage("io.topicvote.standalone..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.topicvote.core.parser..", "io.topicvote.core.engine.jexl..")
            .because("the host parses and evaluates through VotingEngine");

    @ArchTest
    static final ArchRule configIsSelfContained = noClasses()
            .that()
            .resideInAPackage("io.topicvote.standalone.config..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.topicvote.core..", "ch.qos.logback..")
            .because("configuration loading needs only Jackson YAML");

    @ArchTest
    static final ArchRule onlyConfiguratorTouchesLogback = noClasses()
            .that()
            .resideInAPackage("io.topicvote.standalone..")
            .and()
            .doNotHaveSimpleName("LogbackConfigurator")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("ch.qos.logback..")
            .because("everything else logs through SLF4J");
}
