package io.github.drompincen.annostore.protocol.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Secondary index kinds supported on annotation fields.
 * The suffix is what MongoDB appends to the field path when it names the index.
 */
public enum IndexType {
    HASHED("hashed"),
    ASCENDING("1"),
    DESCENDING("-1"),
    TEXT("text");

    private final String mongoSuffix;

    IndexType(String mongoSuffix) {
        this.mongoSuffix = mongoSuffix;
    }

    public String mongoSuffix() {
        return mongoSuffix;
    }

    /** Lower-case name as used in URLs. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<IndexType> fromString(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    public static Optional<IndexType> fromMongoSuffix(String suffix) {
        return Arrays.stream(values())
                .filter(t -> t.mongoSuffix.equals(suffix))
                .findFirst();
    }

    public static String validLabels() {
        return Arrays.stream(values()).map(IndexType::label).collect(Collectors.joining(", "));
    }
}
