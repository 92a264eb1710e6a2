package com.predicate.adapter.spring;

import com.predicate.config.PredicateParser;
import com.predicate.config.PredicateRegistry;
import com.predicate.evaluation.DefaultPredicateEvaluator;
import com.predicate.evaluation.PredicateEvaluator;
import com.predicate.json.JsonValues;
import com.predicate.spring.EnablePredicates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PredicateAutoConfiguration.
 */
class PredicateAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PredicateAutoConfiguration.class));

    @Test
    @DisplayName("Should create evaluator and parser beans by default")
    void shouldCreateDefaultBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(PredicateEvaluator.class));
            assertEquals(PredicateParser.DEFAULT_MAX_DEPTH, context.getBean(PredicateParser.class).getMaxDepth());
            assertTrue(context.getBeansOfType(PredicateRegistry.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Should load named predicates when a config path is set")
    void shouldCreateRegistry() {
        contextRunner
                .withPropertyValues("predicates.config-path=classpath:predicates.yaml")
                .run(context -> {
                    PredicateRegistry registry = context.getBean(PredicateRegistry.class);
                    assertEquals(3, registry.names().size());
                    assertTrue(registry.matches("owned-by-platform",
                            JsonValues.parse("{\"spec\": {\"owner\": \"TEAM-B\"}}")));
                });
    }

    @Test
    @DisplayName("Should read named predicates from a custom section")
    void shouldUseCustomSection() {
        contextRunner
                .withPropertyValues(
                        "predicates.config-path=classpath:predicates.yaml",
                        "predicates.section=catalog")
                .run(context -> {
                    PredicateRegistry registry = context.getBean(PredicateRegistry.class);
                    assertEquals(1, registry.names().size());
                    assertTrue(registry.find("filter").isPresent());
                });
    }

    @Test
    @DisplayName("Should apply the configured maximum depth")
    void shouldApplyMaxDepth() {
        contextRunner
                .withPropertyValues("predicates.max-depth=8")
                .run(context -> assertEquals(8, context.getBean(PredicateParser.class).getMaxDepth()));
    }

    @Test
    @DisplayName("Should fail startup on an invalid predicate file")
    void shouldFailOnInvalidFile() {
        contextRunner
                .withPropertyValues(
                        "predicates.config-path=classpath:invalid-predicates.yaml",
                        "predicates.section=")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("predicates.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(PredicateEvaluator.class).isEmpty()));
    }

    @Test
    @DisplayName("Should keep a user-defined evaluator")
    void shouldKeepUserEvaluator() {
        contextRunner
                .withUserConfiguration(CustomEvaluatorConfiguration.class)
                .run(context -> assertSame(CustomEvaluatorConfiguration.EVALUATOR,
                        context.getBean(PredicateEvaluator.class)));
    }

    @Test
    @DisplayName("Should import the configuration through @EnablePredicates")
    void shouldImportThroughAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(EnabledApplication.class)
                .run(context -> assertNotNull(context.getBean(PredicateEvaluator.class)));
    }

    @Configuration
    static class CustomEvaluatorConfiguration {

        static final PredicateEvaluator EVALUATOR = new DefaultPredicateEvaluator();

        @Bean
        PredicateEvaluator customEvaluator() {
            return EVALUATOR;
        }
    }

    @Configuration
    @EnablePredicates
    static class EnabledApplication {
    }
}
