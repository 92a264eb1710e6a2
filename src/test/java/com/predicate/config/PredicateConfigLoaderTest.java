package com.predicate.config;

import com.predicate.evaluation.DefaultPredicateEvaluator;
import com.predicate.evaluation.PredicateEvaluator;
import com.predicate.exception.ConfigurationException;
import com.predicate.exception.InvalidPredicateException;
import com.predicate.json.JsonValues;
import com.predicate.model.FilterPredicate;
import com.predicate.model.PredicateType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PredicateConfigLoader.
 */
class PredicateConfigLoaderTest {

    private final PredicateConfigLoader loader = new PredicateConfigLoader();
    private final PredicateEvaluator evaluator = new DefaultPredicateEvaluator();

    private final Object javaComponent = JsonValues.parse("""
            {"kind": "Component", "metadata": {"name": "payments", "tags": ["java", "kafka"]}}
            """);

    @Test
    @DisplayName("Should load a predicate from a YAML section")
    void shouldLoadFromYamlSection() {
        FilterPredicate predicate = loader.load("classpath:predicates.yaml", "catalog.filter");

        assertEquals(PredicateType.ALL, predicate.getType());
        assertTrue(evaluator.evaluate(predicate, javaComponent));
        assertFalse(evaluator.evaluate(predicate, JsonValues.parse("{\"kind\": \"API\"}")));
    }

    @Test
    @DisplayName("Should load a whole JSON file as one predicate")
    void shouldLoadWholeJsonFile() {
        FilterPredicate predicate = loader.load("classpath:scm-events.json");

        assertEquals(PredicateType.ANY, predicate.getType());
        assertTrue(evaluator.evaluate(predicate,
                JsonValues.parse("{\"type\": \"push\", \"repository\": {\"private\": false}}")));
        assertTrue(evaluator.evaluate(predicate,
                JsonValues.parse("{\"type\": \"pull_request\", \"action\": \"Reopened\"}")));
        assertFalse(evaluator.evaluate(predicate,
                JsonValues.parse("{\"type\": \"pull_request\", \"action\": \"closed\"}")));
    }

    @Test
    @DisplayName("Should load named predicates in file order")
    void shouldLoadNamedPredicates() {
        Map<String, FilterPredicate> predicates = loader.loadAll("classpath:predicates.yaml", "predicates");

        assertEquals(List.of("java-components", "owned-by-platform", "has-description"),
                List.copyOf(predicates.keySet()));
        assertEquals(PredicateType.FIELDS, predicates.get("owned-by-platform").getType());
    }

    @Test
    @DisplayName("Should return empty for a missing optional predicate")
    void shouldReturnEmptyForMissingOptional() {
        assertEquals(Optional.empty(), loader.loadOptional("classpath:predicates.yaml", "catalog.missing"));
        assertTrue(loader.loadOptional("classpath:predicates.yaml", "catalog.filter").isPresent());
    }

    @Test
    @DisplayName("Should fail when a required predicate is missing")
    void shouldFailForMissingRequired() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.load("classpath:predicates.yaml", "events.filter"));
        assertTrue(e.getMessage().contains("events.filter"));
    }

    @Test
    @DisplayName("Should fail fast on an invalid predicate")
    void shouldFailOnInvalidPredicate() {
        InvalidPredicateException e = assertThrows(InvalidPredicateException.class,
                () -> loader.load("classpath:invalid-predicates.yaml", "filter"));

        assertTrue(e.getMessage().startsWith("Invalid predicate in config at 'filter'"));
        assertEquals("$.kind", e.getPath());
    }

    @Test
    @DisplayName("Should fail when the file does not exist")
    void shouldFailForMissingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.load("classpath:does-not-exist.yaml"));
        assertTrue(e.getMessage().contains("does-not-exist.yaml"));
    }

    @Test
    @DisplayName("Should load from the file system")
    void shouldLoadFromFileSystem(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("subscription.yaml");
        Files.writeString(file, """
                subscription:
                  filter:
                    type: push
                    ref:
                      $in: [refs/heads/main, refs/heads/master]
                """);

        FilterPredicate predicate = loader.load(file.toString(), "subscription.filter");

        assertTrue(evaluator.evaluate(predicate, Map.of("type", "push", "ref", "refs/heads/main")));
        assertFalse(evaluator.evaluate(predicate, Map.of("type", "push", "ref", "refs/heads/feature")));
    }

    @Test
    @DisplayName("Should read unquoted YAML dates as strings")
    void shouldReadUnquotedDatesAsStrings(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("releases.yaml");
        Files.writeString(file, """
                filter:
                  metadata.annotations.created: 2024-01-01
                  spec.lifecycle:
                    $in: [2023-12-31, 2024-01-01T10:15:30Z]
                """);

        FilterPredicate predicate = loader.load(file.toString(), "filter");

        Map<String, Object> entity = Map.of(
                "metadata", Map.of("annotations", Map.of("created", "2024-01-01")),
                "spec", Map.of("lifecycle", "2023-12-31"));
        assertTrue(evaluator.evaluate(predicate, entity));
        assertFalse(evaluator.evaluate(predicate, Map.of(
                "metadata", Map.of("annotations", Map.of("created", "2024-01-02")),
                "spec", Map.of("lifecycle", "2023-12-31"))));
    }

    @Test
    @DisplayName("Should fail on malformed YAML")
    void shouldFailOnMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yaml");
        Files.writeString(file, "filter: [unclosed\n");

        assertThrows(ConfigurationException.class, () -> loader.load(file.toString(), "filter"));
    }

    @Test
    @DisplayName("Should read from already loaded configuration")
    void shouldReadFromLoadedConfig() {
        Map<String, Object> config = Map.of("app", Map.of("filter", Map.of("kind", "Component")));

        Optional<FilterPredicate> predicate = loader.read(config, "app.filter");
        assertTrue(predicate.isPresent());
        assertTrue(evaluator.evaluate(predicate.get(), javaComponent));
        assertTrue(loader.read(config, "app.filter.kind.deeper").isEmpty());
    }

    @Test
    @DisplayName("Should reject a section that is not a map of predicates")
    void shouldRejectNonMapSection() {
        assertThrows(ConfigurationException.class, () -> loader.loadAll("classpath:predicates.yaml", "catalog.filter.$all"));
    }
}
