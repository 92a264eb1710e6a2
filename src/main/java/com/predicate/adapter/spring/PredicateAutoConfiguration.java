package com.predicate.adapter.spring;

import com.predicate.config.PredicateConfigLoader;
import com.predicate.config.PredicateParser;
import com.predicate.config.PredicateRegistry;
import com.predicate.evaluation.DefaultPredicateEvaluator;
import com.predicate.evaluation.PredicateEvaluator;
import com.predicate.model.FilterPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Spring Boot auto-configuration for the predicates library.
 */
@Configuration
@ConditionalOnProperty(prefix = "predicates", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PredicateProperties.class)
public class PredicateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PredicateAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PredicateEvaluator predicateEvaluator() {
        return new DefaultPredicateEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public PredicateParser predicateParser(PredicateProperties properties) {
        return new PredicateParser(properties.getMaxDepth());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "predicates", name = "config-path")
    public PredicateRegistry predicateRegistry(PredicateProperties properties,
                                               PredicateParser parser,
                                               PredicateEvaluator evaluator) {
        log.info("Loading named predicates from: {}", properties.getConfigPath());
        Map<String, FilterPredicate> predicates = new PredicateConfigLoader(parser)
                .loadAll(properties.getConfigPath(), properties.getSection());
        return new PredicateRegistry(predicates, evaluator);
    }
}
