package io.github.drompincen.annostore.runtime.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators accepted inside a field's operator object, e.g. {@code {"body.type": {":isNotIn": ["Line"]}}}.
 */
enum FieldOperator {

    IS_EQUAL_TO(":isEqualTo", Parameter.ANY),
    IS_NOT_EQUAL_TO(":isNotEqualTo", Parameter.ANY),
    IS_LESS_THAN(":isLessThan", Parameter.SCALAR),
    IS_LESS_THAN_OR_EQUAL_TO(":isLessThanOrEqualTo", Parameter.SCALAR),
    IS_GREATER_THAN(":isGreaterThan", Parameter.SCALAR),
    IS_GREATER_THAN_OR_EQUAL_TO(":isGreaterThanOrEqualTo", Parameter.SCALAR),
    IS_IN(":isIn", Parameter.ARRAY),
    IS_NOT_IN(":isNotIn", Parameter.ARRAY);

    enum Parameter { ANY, SCALAR, ARRAY }

    private final String key;
    private final Parameter parameter;

    FieldOperator(String key, Parameter parameter) {
        this.key = key;
        this.parameter = parameter;
    }

    String key() { return key; }

    Parameter parameter() { return parameter; }

    static Optional<FieldOperator> fromKey(String key) {
        return Arrays.stream(values()).filter(op -> op.key.equals(key)).findFirst();
    }
}
