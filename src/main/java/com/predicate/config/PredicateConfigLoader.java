package com.predicate.config;

import com.predicate.exception.ConfigurationException;
import com.predicate.exception.InvalidPredicateException;
import com.predicate.json.JsonValues;
import com.predicate.model.FilterPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads predicates from YAML or JSON configuration files.
 * <p>
 * Locations support the {@code classpath:} prefix; anything else is a file
 * path. Files ending in {@code .json} are read with Jackson, everything else
 * with SnakeYAML. An optional dotted key selects a nested section, e.g.
 * {@code catalog.filter}.
 * <p>
 * Predicates are validated strictly: a shape error fails fast with an
 * {@link InvalidPredicateException}. Unquoted YAML timestamps such as
 * {@code 2024-01-01} are read as strings, the way a JSON file carries them.
 */
public class PredicateConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PredicateConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final PredicateParser parser;

    public PredicateConfigLoader() {
        this(new PredicateParser());
    }

    public PredicateConfigLoader(PredicateParser parser) {
        this.parser = parser;
    }

    /**
     * Load the predicate making up a whole configuration file.
     *
     * @param location Path to the configuration file
     * @return Validated predicate
     */
    public FilterPredicate load(String location) {
        return load(location, null);
    }

    /**
     * Load a required predicate.
     *
     * @param location Path to the configuration file
     * @param key      Dotted key of the predicate, or null for the whole file
     * @return Validated predicate
     * @throws ConfigurationException if the file cannot be read or the key is missing
     * @throws InvalidPredicateException if the predicate is malformed
     */
    public FilterPredicate load(String location, String key) {
        Object config = readConfig(location);
        return read(config, key)
                .orElseThrow(() -> new ConfigurationException(key == null
                        ? "No predicate configured in " + location
                        : "Missing required predicate at '" + key + "' in " + location));
    }

    /**
     * Load an optional predicate.
     *
     * @param location Path to the configuration file
     * @param key      Dotted key of the predicate, or null for the whole file
     * @return Validated predicate, or empty if nothing is configured at the key
     */
    public Optional<FilterPredicate> loadOptional(String location, String key) {
        return read(readConfig(location), key);
    }

    /**
     * Load a map of named predicates, e.g. a {@code predicates} section.
     *
     * @param location Path to the configuration file
     * @param key      Dotted key of the section, or null for the whole file
     * @return Predicates by name, in file order; empty if the section is missing
     */
    @SuppressWarnings("unchecked")
    public Map<String, FilterPredicate> loadAll(String location, String key) {
        Object section = lookup(readConfig(location), key);
        if (section == null) {
            log.warn("No predicates configured at '{}' in {}", key, location);
            return Map.of();
        }
        if (!(section instanceof Map<?, ?>)) {
            throw new ConfigurationException("Expected a map of named predicates at '" + key + "' in " + location);
        }

        Map<String, FilterPredicate> predicates = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) section).entrySet()) {
            String name = String.valueOf(entry.getKey());
            predicates.put(name, parse(entry.getValue(), name));
            log.debug("Parsed predicate '{}': {}", name, predicates.get(name));
        }
        log.info("Loaded {} named predicates from: {}", predicates.size(), location);
        return predicates;
    }

    /**
     * Read a predicate from already loaded configuration.
     *
     * @param config Configuration tree (maps, lists and scalars)
     * @param key    Dotted key of the predicate, or null for the whole tree
     * @return Validated predicate, or empty if nothing is configured at the key
     */
    public Optional<FilterPredicate> read(Object config, String key) {
        Object raw = lookup(config, key);
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(parse(raw, key));
    }

    private FilterPredicate parse(Object raw, String key) {
        try {
            return parser.parse(raw, ParseMode.STRICT);
        } catch (InvalidPredicateException e) {
            String where = key == null ? "config" : "config at '" + key + "'";
            throw new InvalidPredicateException("Invalid predicate in " + where, e);
        }
    }

    private Object readConfig(String location) {
        log.info("Loading predicate configuration from: {}", location);

        Resource resource = getResource(location);
        try (InputStream inputStream = resource.getInputStream()) {
            if (location.endsWith(".json")) {
                return JsonValues.read(inputStream);
            }
            return new Yaml(new TimestampAsTextConstructor()).load(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load predicate configuration from: " + location, e);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to parse predicate configuration from: " + location, e);
        }
    }

    private static Resource getResource(String location) {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(location);
    }

    private static Object lookup(Object config, String key) {
        if (key == null || key.isEmpty()) {
            return config;
        }
        Object current = config;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    /**
     * Safe constructor that keeps timestamps as their source text.
     */
    private static final class TimestampAsTextConstructor extends SafeConstructor {

        TimestampAsTextConstructor() {
            super(new LoaderOptions());
            this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
        }
    }
}
