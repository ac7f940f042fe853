package io.github.drompincen.annostore.runtime.query;

import io.github.drompincen.annostore.runtime.config.StoreSettings;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles a declarative annotation query into aggregation pipeline stages.
 *
 * <p>Every top-level entry becomes one {@code $match} stage, in input order:
 * <ul>
 *   <li>{@code "field": value} matches {@code annotation.field} by equality; an array value
 *       means membership;</li>
 *   <li>{@code "field": {":op": param, ...}} combines the named {@link FieldOperator}s in one stage;</li>
 *   <li>{@code ":function": {...}} applies a query function such as
 *       {@code :overlapsWithTextAnchorRange}.</li>
 * </ul>
 * Compilation never touches storage, and compiling equal queries yields equal stages.
 */
@Component
public class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    static final String SENTINEL = ":";
    static final String OVERLAPS_WITH_TEXT_ANCHOR_RANGE = ":overlapsWithTextAnchorRange";
    static final String IS_WITHIN_TEXT_ANCHOR_RANGE = ":isWithinTextAnchorRange";

    private static final String ANNOTATION_PREFIX = "annotation.";
    private static final String TARGET_SOURCE = "annotation.target.source";
    private static final String SELECTOR_TYPE = "annotation.target.selector.type";
    private static final String SELECTOR_START = "annotation.target.selector.start";
    private static final String SELECTOR_END = "annotation.target.selector.end";

    private final String rangeSelectorType;

    public QueryCompiler(StoreSettings settings) {
        this.rangeSelectorType = settings.rangeSelectorType();
    }

    public List<AggregationOperation> compile(Map<String, Object> query) {
        if (query == null || query.isEmpty()) {
            throw new ValidationException("Query must contain at least one field or function");
        }
        List<AggregationOperation> stages = new ArrayList<>(query.size());
        for (Map.Entry<String, Object> entry : query.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new ValidationException("Query field names must not be empty");
            }
            Criteria criteria = key.startsWith(SENTINEL)
                    ? functionCriteria(key, entry.getValue())
                    : fieldCriteria(key, entry.getValue());
            stages.add(Aggregation.match(criteria));
        }
        log.debug("Compiled query with {} field(s) into {} stage(s)", query.size(), stages.size());
        return List.copyOf(stages);
    }

    // ---- fields ----

    private Criteria fieldCriteria(String field, Object value) {
        String path = ANNOTATION_PREFIX + field;
        if (value instanceof Collection<?> values) {
            return Criteria.where(path).in(new ArrayList<>(values));
        }
        if (value instanceof Map<?, ?> map && isOperatorObject(field, map)) {
            return operatorCriteria(field, path, map);
        }
        return Criteria.where(path).is(value);
    }

    private static boolean isOperatorObject(String field, Map<?, ?> map) {
        long operatorKeys = map.keySet().stream()
                .filter(k -> k instanceof String s && s.startsWith(SENTINEL))
                .count();
        if (operatorKeys > 0 && operatorKeys < map.size()) {
            throw new ValidationException("Field '" + field + "' mixes operators and plain keys");
        }
        return operatorKeys > 0;
    }

    private Criteria operatorCriteria(String field, String path, Map<?, ?> operators) {
        if (operators.size() > 1 && operators.containsKey(FieldOperator.IS_EQUAL_TO.key())) {
            throw new ValidationException(FieldOperator.IS_EQUAL_TO.key() + " on field '" + field
                    + "' cannot be combined with other operators");
        }
        Criteria criteria = Criteria.where(path);
        for (Map.Entry<?, ?> entry : operators.entrySet()) {
            String key = (String) entry.getKey();
            FieldOperator operator = FieldOperator.fromKey(key)
                    .orElseThrow(() -> new ValidationException("Unknown operator '" + key + "' on field '" + field + "'"));
            Object parameter = checkParameter(field, operator, entry.getValue());
            switch (operator) {
                case IS_EQUAL_TO -> criteria.is(parameter);
                case IS_NOT_EQUAL_TO -> criteria.ne(parameter);
                case IS_LESS_THAN -> criteria.lt(parameter);
                case IS_LESS_THAN_OR_EQUAL_TO -> criteria.lte(parameter);
                case IS_GREATER_THAN -> criteria.gt(parameter);
                case IS_GREATER_THAN_OR_EQUAL_TO -> criteria.gte(parameter);
                case IS_IN -> criteria.in((Collection<?>) parameter);
                case IS_NOT_IN -> criteria.nin((Collection<?>) parameter);
            }
        }
        return criteria;
    }

    private static Object checkParameter(String field, FieldOperator operator, Object parameter) {
        switch (operator.parameter()) {
            case ARRAY -> {
                if (!(parameter instanceof Collection<?> values)) {
                    throw new ValidationException(operator.key() + " on field '" + field + "' expects an array");
                }
                return new ArrayList<>(values);
            }
            case SCALAR -> {
                if (parameter == null || parameter instanceof Collection<?> || parameter instanceof Map<?, ?>) {
                    throw new ValidationException(operator.key() + " on field '" + field + "' expects a single value");
                }
                return parameter;
            }
            default -> {
                return parameter;
            }
        }
    }

    // ---- functions ----

    private Criteria functionCriteria(String function, Object parameter) {
        if (OVERLAPS_WITH_TEXT_ANCHOR_RANGE.equals(function)) {
            TextRange range = textRange(function, parameter);
            return rangeBase(range)
                    .and(SELECTOR_START).lt(range.end())
                    .and(SELECTOR_END).gt(range.start());
        }
        if (IS_WITHIN_TEXT_ANCHOR_RANGE.equals(function)) {
            TextRange range = textRange(function, parameter);
            return rangeBase(range)
                    .and(SELECTOR_START).gte(range.start())
                    .and(SELECTOR_END).lte(range.end());
        }
        throw new ValidationException("Unknown query function '" + function + "'");
    }

    private Criteria rangeBase(TextRange range) {
        return Criteria.where(TARGET_SOURCE).is(range.source())
                .and(SELECTOR_TYPE).is(rangeSelectorType);
    }

    private static TextRange textRange(String function, Object parameter) {
        if (!(parameter instanceof Map<?, ?> params)) {
            throw new ValidationException(function + " expects an object with source, start and end");
        }
        if (!(params.get("source") instanceof String source)) {
            throw new ValidationException(function + ": 'source' must be a string");
        }
        Number start = number(function, params, "start");
        Number end = number(function, params, "end");
        if (start.doubleValue() > end.doubleValue()) {
            throw new ValidationException(function + ": 'start' must not be greater than 'end'");
        }
        return new TextRange(source, start, end);
    }

    private static Number number(String function, Map<?, ?> params, String name) {
        if (!(params.get(name) instanceof Number value)) {
            throw new ValidationException(function + ": '" + name + "' must be a number");
        }
        return value;
    }

    private record TextRange(String source, Number start, Number end) {}
}
