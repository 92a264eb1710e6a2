package com.predicate.spring;

import com.predicate.adapter.spring.PredicateAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the predicate beans in a Spring application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnablePredicates
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PredicateAutoConfiguration.class)
public @interface EnablePredicates {
}
