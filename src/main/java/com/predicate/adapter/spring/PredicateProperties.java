package com.predicate.adapter.spring;

import com.predicate.config.PredicateParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the predicates library.
 */
@ConfigurationProperties(prefix = "predicates")
public class PredicateProperties {

    /**
     * Whether the predicate beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to a YAML or JSON file of named predicates.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath;

    /**
     * Key of the named predicates section within the file.
     */
    private String section = "predicates";

    /**
     * Maximum nesting depth accepted when parsing predicates.
     */
    private int maxDepth = PredicateParser.DEFAULT_MAX_DEPTH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getSection() {
        return section;
    }

    public void setSection(String section) {
        this.section = section;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
}
