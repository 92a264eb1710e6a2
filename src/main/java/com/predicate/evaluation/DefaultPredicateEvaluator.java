package com.predicate.evaluation;

import com.predicate.equality.DefaultValueComparator;
import com.predicate.equality.ValueComparator;
import com.predicate.model.FilterPredicate;
import com.predicate.model.FilterPredicateValue;
import com.predicate.model.Operators;
import com.predicate.model.impl.AllPredicate;
import com.predicate.model.impl.AnyPredicate;
import com.predicate.model.impl.ContainsValue;
import com.predicate.model.impl.ExistsValue;
import com.predicate.model.impl.FieldsPredicate;
import com.predicate.model.impl.InValue;
import com.predicate.model.impl.LiteralPredicate;
import com.predicate.model.impl.LiteralValue;
import com.predicate.model.impl.NotPredicate;
import com.predicate.path.DefaultPathResolver;
import com.predicate.path.PathResolver;
import com.predicate.path.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of PredicateEvaluator.
 * <p>
 * Combinators are interpreted by shape, in fixed priority: {@code $all},
 * {@code $any}, {@code $not}, then the field map. A field map holding any key
 * in operator position fails closed as a whole.
 */
public class DefaultPredicateEvaluator implements PredicateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultPredicateEvaluator.class);

    private final PathResolver pathResolver;
    private final ValueComparator comparator;

    public DefaultPredicateEvaluator() {
        this(DefaultPathResolver.INSTANCE, DefaultValueComparator.INSTANCE);
    }

    public DefaultPredicateEvaluator(PathResolver pathResolver, ValueComparator comparator) {
        this.pathResolver = pathResolver;
        this.comparator = comparator;
    }

    @Override
    public boolean evaluate(FilterPredicate predicate, Object value) {
        if (predicate == null || predicate.getType() == null) {
            return false;
        }

        return switch (predicate.getType()) {
            case LITERAL -> comparator.equal(value, ((LiteralPredicate) predicate).value());
            case ALL -> evaluateAll(((AllPredicate) predicate).predicates(), value);
            case ANY -> evaluateAny(((AnyPredicate) predicate).predicates(), value);
            case NOT -> !evaluate(((NotPredicate) predicate).predicate(), value);
            case FIELDS -> evaluateFields(((FieldsPredicate) predicate).fields(), value);
        };
    }

    @Override
    public boolean evaluateValue(FilterPredicateValue filter, Projection projected) {
        if (filter == null || filter.getType() == null || projected == null) {
            return false;
        }

        return switch (filter.getType()) {
            case LITERAL -> projected.isPresent()
                    && comparator.equal(projected.get(), ((LiteralValue) filter).value());
            case CONTAINS -> evaluateContains((ContainsValue) filter, projected);
            case IN -> evaluateIn(((InValue) filter).candidates(), projected);
            case EXISTS -> ((ExistsValue) filter).exists() == projected.isPresent();
            case UNRECOGNIZED -> false;
        };
    }

    private boolean evaluateAll(List<FilterPredicate> predicates, Object value) {
        for (FilterPredicate predicate : predicates) {
            if (!evaluate(predicate, value)) {
                return false;
            }
        }
        return true; // Empty $all is true
    }

    private boolean evaluateAny(List<FilterPredicate> predicates, Object value) {
        for (FilterPredicate predicate : predicates) {
            if (evaluate(predicate, value)) {
                return true;
            }
        }
        return false; // Empty $any is false
    }

    private boolean evaluateFields(Map<String, FilterPredicateValue> fields, Object value) {
        for (Map.Entry<String, FilterPredicateValue> entry : fields.entrySet()) {
            String path = entry.getKey();
            if (Operators.isOperator(path)) {
                log.debug("Unknown operator '{}' in predicate, treating as no match", path);
                return false;
            }
            if (!evaluateValue(entry.getValue(), pathResolver.resolve(value, path))) {
                return false;
            }
        }
        return true;
    }

    private boolean evaluateContains(ContainsValue filter, Projection projected) {
        if (projected.isAbsent()) {
            return false;
        }
        Object value = projected.get();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (evaluate(filter.predicate(), element)) {
                    return true;
                }
            }
            return false;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (evaluate(filter.predicate(), Array.get(value, i))) {
                    return true;
                }
            }
        }
        return false; // Not an array
    }

    private boolean evaluateIn(List<Object> candidates, Projection projected) {
        if (projected.isAbsent()) {
            return false;
        }
        Object value = projected.get();
        for (Object candidate : candidates) {
            if (comparator.equal(value, candidate)) {
                return true;
            }
        }
        return false;
    }
}
