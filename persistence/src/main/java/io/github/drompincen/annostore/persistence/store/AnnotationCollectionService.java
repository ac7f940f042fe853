package io.github.drompincen.annostore.persistence.store;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndReplaceOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.index.CompoundIndexDefinition;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Document-store primitives over the per-container annotation collections.
 * Every annotation is kept in an envelope {@code {annotation_name, annotation, etag}}.
 */
@Service
public class AnnotationCollectionService {

    public static final String ANNOTATION_NAME_FIELD = "annotation_name";
    public static final String ANNOTATION_FIELD = "annotation";
    public static final String ETAG_FIELD = "etag";

    private static final Logger log = LoggerFactory.getLogger(AnnotationCollectionService.class);
    private static final String NAME_INDEX = "annotation_name_unique";

    private final MongoTemplate mongoTemplate;

    public AnnotationCollectionService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    // ---- Collections ----

    public boolean collectionExists(String containerName) {
        return mongoTemplate.collectionExists(containerName);
    }

    public Set<String> collectionNames() {
        return mongoTemplate.getCollectionNames();
    }

    public void createCollection(String containerName) {
        mongoTemplate.createCollection(containerName);
        collection(containerName).createIndex(Indexes.ascending(ANNOTATION_NAME_FIELD),
                new IndexOptions().name(NAME_INDEX).unique(true));
        log.debug("Created collection {}", containerName);
    }

    public void dropCollection(String containerName) {
        mongoTemplate.dropCollection(containerName);
    }

    public long countDocuments(String containerName) {
        return collection(containerName).countDocuments();
    }

    // ---- Annotations ----

    public boolean annotationExists(String containerName, String annotationName) {
        return collection(containerName).countDocuments(byName(annotationName)) > 0;
    }

    public AnnotationEnvelope insert(String containerName, String annotationName, Map<String, Object> annotation) {
        Document envelope = envelope(annotationName, annotation, newEtag());
        collection(containerName).insertOne(envelope);
        return toEnvelope(envelope);
    }

    public List<AnnotationEnvelope> insertAll(String containerName, Map<String, Map<String, Object>> annotationsByName) {
        if (annotationsByName.isEmpty()) return List.of();
        List<Document> envelopes = new ArrayList<>();
        annotationsByName.forEach((name, annotation) -> envelopes.add(envelope(name, annotation, newEtag())));
        collection(containerName).insertMany(envelopes);
        return envelopes.stream().map(this::toEnvelope).toList();
    }

    public Optional<AnnotationEnvelope> find(String containerName, String annotationName) {
        return Optional.ofNullable(collection(containerName).find(byName(annotationName)).first())
                .map(this::toEnvelope);
    }

    /**
     * Replaces the annotation body only when the stored etag still equals {@code expectedEtag}.
     * Returns the new envelope, or empty when the annotation is gone or the etag no longer matches.
     */
    public Optional<AnnotationEnvelope> replace(String containerName, String annotationName,
                                                Map<String, Object> annotation, String expectedEtag) {
        Bson filter = Filters.and(byName(annotationName), Filters.eq(ETAG_FIELD, expectedEtag));
        Document replaced = collection(containerName).findOneAndReplace(filter,
                envelope(annotationName, annotation, newEtag()),
                new FindOneAndReplaceOptions().returnDocument(ReturnDocument.AFTER));
        return Optional.ofNullable(replaced).map(this::toEnvelope);
    }

    public Optional<AnnotationEnvelope> delete(String containerName, String annotationName) {
        return Optional.ofNullable(collection(containerName).findOneAndDelete(byName(annotationName)))
                .map(this::toEnvelope);
    }

    // ---- Aggregation ----

    public long count(String containerName, List<AggregationOperation> stages) {
        List<AggregationOperation> pipeline = new ArrayList<>(stages);
        pipeline.add(Aggregation.count().as("count"));
        Document result = mongoTemplate
                .aggregate(Aggregation.newAggregation(pipeline), containerName, Document.class)
                .getUniqueMappedResult();
        // $count emits nothing at all when no document matched
        if (result == null) return 0L;
        return ((Number) result.get("count")).longValue();
    }

    public List<AnnotationEnvelope> aggregate(String containerName, List<AggregationOperation> stages) {
        return mongoTemplate.aggregate(Aggregation.newAggregation(stages), containerName, Document.class)
                .getMappedResults().stream()
                .map(this::toEnvelope)
                .toList();
    }

    /** Distinct values of {@code annotation.<field>} across the container. */
    public List<Object> distinctValues(String containerName, String field) {
        return mongoTemplate.findDistinct(new Query(), ANNOTATION_FIELD + "." + field, containerName, Object.class);
    }

    // ---- Indexes ----

    /** Blocks until the server has built the index. */
    public void createIndex(String containerName, String indexName, Document keys) {
        mongoTemplate.indexOps(containerName)
                .ensureIndex(new CompoundIndexDefinition(keys).named(indexName));
    }

    public List<String> indexNames(String containerName) {
        return mongoTemplate.indexOps(containerName).getIndexInfo().stream()
                .map(IndexInfo::getName)
                .toList();
    }

    /** Returns false when no index of that name exists. */
    public boolean dropIndex(String containerName, String indexName) {
        if (!indexNames(containerName).contains(indexName)) {
            return false;
        }
        mongoTemplate.indexOps(containerName).dropIndex(indexName);
        return true;
    }

    private MongoCollection<Document> collection(String containerName) {
        return mongoTemplate.getCollection(containerName);
    }

    private static Bson byName(String annotationName) {
        return Filters.eq(ANNOTATION_NAME_FIELD, annotationName);
    }

    private static Document envelope(String name, Map<String, Object> annotation, String etag) {
        return new Document(ANNOTATION_NAME_FIELD, name)
                .append(ANNOTATION_FIELD, new Document(annotation))
                .append(ETAG_FIELD, etag);
    }

    private AnnotationEnvelope toEnvelope(Document document) {
        Document annotation = document.get(ANNOTATION_FIELD, Document.class);
        Map<String, Object> body = annotation != null ? new LinkedHashMap<>(annotation) : new LinkedHashMap<>();
        return new AnnotationEnvelope(document.getString(ANNOTATION_NAME_FIELD), body, document.getString(ETAG_FIELD));
    }

    private static String newEtag() {
        return UUID.randomUUID().toString();
    }
}
