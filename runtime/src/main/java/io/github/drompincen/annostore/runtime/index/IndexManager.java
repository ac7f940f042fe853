package io.github.drompincen.annostore.runtime.index;

import io.github.drompincen.annostore.persistence.store.AnnotationCollectionService;
import io.github.drompincen.annostore.protocol.api.IndexConfig;
import io.github.drompincen.annostore.protocol.api.IndexType;
import io.github.drompincen.annostore.runtime.config.StoreSettings;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry of index chores, at most one live chore per (container, field, type).
 */
@Service
public class IndexManager {

    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);

    private final AnnotationCollectionService store;
    private final Executor executor;
    private final StoreSettings settings;
    private final UriFactory uriFactory;
    private final Clock clock;
    private final Map<IndexKey, IndexChore> chores = new ConcurrentHashMap<>();

    public IndexManager(AnnotationCollectionService store,
                        @Qualifier("backgroundTaskExecutor") Executor executor,
                        StoreSettings settings,
                        UriFactory uriFactory,
                        Clock clock) {
        this.store = store;
        this.executor = executor;
        this.settings = settings;
        this.uriFactory = uriFactory;
        this.clock = clock;
    }

    /**
     * Returns the live chore for the key if there is one; otherwise registers a new chore, hands it
     * to the background pool and returns it without waiting.
     */
    public IndexChore startIndexCreation(String containerName, String field, String type) {
        IndexType indexType = IndexNames.parseType(type);
        if (field == null || field.isBlank()) {
            throw new ValidationException("Index field must not be empty");
        }
        IndexKey key = new IndexKey(containerName, field, indexType);
        AtomicBoolean created = new AtomicBoolean();
        IndexChore chore = chores.compute(key, (k, existing) -> {
            if (existing != null && !existing.isFinished()) {
                return existing;
            }
            created.set(true);
            return new IndexChore(store, containerName, field, indexType, settings.taskTtl(), clock);
        });
        if (created.get()) {
            submit(chore);
        } else {
            log.debug("Index chore for {} already in progress: {}", key, chore.getId());
        }
        return chore;
    }

    public Optional<IndexChore> getIndexChore(String containerName, String field, String type) {
        IndexKey key = new IndexKey(containerName, field, IndexNames.parseType(type));
        IndexChore chore = chores.computeIfPresent(key, (k, c) -> c.isExpired() ? null : c);
        return Optional.ofNullable(chore);
    }

    /** Drops the physical index. A missing index is not an error. */
    public void deleteIndex(String containerName, String field, String type) {
        IndexType indexType = IndexNames.parseType(type);
        String indexName = IndexNames.indexName(field, indexType);
        boolean dropped = store.dropIndex(containerName, indexName);
        chores.computeIfPresent(new IndexKey(containerName, field, indexType), (k, c) -> c.isFinished() ? null : c);
        log.info("Index {} on container {} {}", indexName, containerName, dropped ? "dropped" : "was not present");
    }

    public List<IndexConfig> listIndexes(String containerName) {
        return store.indexNames(containerName).stream()
                .map(IndexNames::parse)
                .flatMap(Optional::stream)
                .map(p -> new IndexConfig(p.field(), p.type(), uriFactory.indexUrl(containerName, p.field(), p.type())))
                .toList();
    }

    /** The definition of an existing index; empty when it has not been built. */
    public Optional<IndexConfig> getIndexConfig(String containerName, String field, String type) {
        IndexType indexType = IndexNames.parseType(type);
        return listIndexes(containerName).stream()
                .filter(c -> c.field().equals(field) && c.type() == indexType)
                .findFirst();
    }

    /** Forgets the finished chores of a deleted container. */
    public void forgetContainer(String containerName) {
        chores.entrySet().removeIf(e -> e.getKey().containerName().equals(containerName) && e.getValue().isFinished());
    }

    private void submit(IndexChore chore) {
        try {
            executor.execute(chore);
            log.debug("Queued index chore {} for {} on container {}", chore.getId(), chore.getIndexName(), chore.getContainerName());
        } catch (RejectedExecutionException e) {
            log.warn("Background pool rejected index chore {}: {}", chore.getId(), e.getMessage());
            chore.abort("Background task pool is full, index creation was not started");
        }
    }

    record IndexKey(String containerName, String field, IndexType type) {}
}
