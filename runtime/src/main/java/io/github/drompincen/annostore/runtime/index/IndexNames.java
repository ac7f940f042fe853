package io.github.drompincen.annostore.runtime.index;

import io.github.drompincen.annostore.protocol.api.IndexType;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import org.bson.Document;

import java.util.Optional;

/**
 * Physical index naming: an index on annotation field {@code f} of type {@code t} is called
 * {@code annotation.f_<suffix>}, the name MongoDB itself would give it.
 */
public final class IndexNames {

    private static final String PREFIX = "annotation.";

    private IndexNames() {}

    public static IndexType parseType(String type) {
        return IndexType.fromString(type).orElseThrow(() -> new ValidationException(
                "Unknown index type '" + type + "', valid types are: " + IndexType.validLabels()));
    }

    public static String indexName(String field, IndexType type) {
        return PREFIX + field + "_" + type.mongoSuffix();
    }

    public static Document indexKeys(String field, IndexType type) {
        Object direction = switch (type) {
            case HASHED -> "hashed";
            case ASCENDING -> 1;
            case DESCENDING -> -1;
            case TEXT -> "text";
        };
        return new Document(PREFIX + field, direction);
    }

    /** Reverses {@link #indexName}; empty for names this store did not create, such as {@code _id_}. */
    public static Optional<ParsedIndex> parse(String indexName) {
        if (indexName == null || !indexName.startsWith(PREFIX)) {
            return Optional.empty();
        }
        int separator = indexName.lastIndexOf('_');
        if (separator <= PREFIX.length()) {
            return Optional.empty();
        }
        String field = indexName.substring(PREFIX.length(), separator);
        return IndexType.fromMongoSuffix(indexName.substring(separator + 1))
                .map(type -> new ParsedIndex(field, type));
    }

    public record ParsedIndex(String field, IndexType type) {}
}
