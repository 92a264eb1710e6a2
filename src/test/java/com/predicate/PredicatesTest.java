package com.predicate;

import com.predicate.exception.InvalidPredicateException;
import com.predicate.json.JsonValues;
import com.predicate.model.FilterPredicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Predicates facade.
 */
class PredicatesTest {

    @Test
    @DisplayName("Should parse a JSON predicate and evaluate it")
    void shouldParseAndEvaluate() {
        FilterPredicate predicate = Predicates.parse("{\"owner\": {\"$in\": [\"team-a\", \"team-b\"]}}");

        assertTrue(Predicates.evaluate(predicate, Map.of("owner", "TEAM-A")));
        assertFalse(Predicates.evaluate(predicate, Map.of("owner", "team-c")));
    }

    @Test
    @DisplayName("Should filter a collection, keeping order")
    void shouldFilterCollection() {
        FilterPredicate predicate = Predicates.parse("""
                {"$all": [{"kind": "Component"}, {"tags": {"$contains": "java"}}]}
                """);
        List<Object> entities = List.of(
                JsonValues.parse("{\"kind\": \"Component\", \"tags\": [\"java\", \"go\"], \"name\": \"a\"}"),
                JsonValues.parse("{\"kind\": \"Component\", \"tags\": [\"go\"], \"name\": \"b\"}"),
                JsonValues.parse("{\"kind\": \"API\", \"tags\": [\"java\"], \"name\": \"c\"}"),
                JsonValues.parse("{\"kind\": \"component\", \"tags\": [\"JAVA\"], \"name\": \"d\"}"));

        List<Object> matching = Predicates.filter(entities, predicate);

        assertEquals(List.of(entities.get(0), entities.get(3)), matching);
    }

    @Test
    @DisplayName("Should filter event payloads with a shared filter function")
    void shouldFilterEvents() {
        java.util.function.Predicate<Object> filter = Predicates.toFilterFunction(
                Predicates.parse("{\"type\": \"push\", \"commits\": {\"$contains\": {\"modified\": {\"$contains\": \"catalog-info.yaml\"}}}}"));

        assertTrue(filter.test(JsonValues.parse("""
                {"type": "push", "commits": [
                  {"modified": ["README.md"]},
                  {"modified": ["src/App.java", "catalog-info.yaml"]}
                ]}
                """)));
        assertFalse(filter.test(JsonValues.parse("""
                {"type": "push", "commits": [{"modified": ["README.md"]}]}
                """)));
    }

    @Test
    @DisplayName("Should reject invalid predicates at parse time")
    void shouldRejectInvalidPredicates() {
        assertThrows(InvalidPredicateException.class, () -> Predicates.parse("{\"$foo\": 1}"));
        assertThrows(IllegalArgumentException.class, () -> Predicates.parse("{not json"));
    }
}
