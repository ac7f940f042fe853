package io.github.drompincen.annostore.runtime.index;

import io.github.drompincen.annostore.persistence.store.AnnotationCollectionService;
import io.github.drompincen.annostore.protocol.api.IndexChoreStatus;
import io.github.drompincen.annostore.protocol.api.IndexType;
import io.github.drompincen.annostore.runtime.task.BackgroundTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds one secondary index in the background.
 */
public class IndexChore extends BackgroundTask {

    private static final Logger log = LoggerFactory.getLogger(IndexChore.class);

    private final AnnotationCollectionService store;
    private final String containerName;
    private final String field;
    private final IndexType type;
    private final String indexName;

    IndexChore(AnnotationCollectionService store, String containerName, String field, IndexType type,
               Duration timeToLive, Clock clock) {
        super(timeToLive, clock);
        this.store = store;
        this.containerName = containerName;
        this.field = field;
        this.type = type;
        this.indexName = IndexNames.indexName(field, type);
    }

    @Override
    protected void execute(Progress progress) {
        progress.addTotalUnits(1);
        log.info("Building index {} on container {}", indexName, containerName);
        store.createIndex(containerName, indexName, IndexNames.indexKeys(field, type));
        progress.unitProcessed();
        log.info("Index {} on container {} is ready", indexName, containerName);
    }

    public IndexChoreStatus status() {
        return new IndexChoreStatus(containerName, field, type, indexName, summary());
    }

    public String getContainerName() { return containerName; }

    public String getField() { return field; }

    public IndexType getType() { return type; }

    public String getIndexName() { return indexName; }
}
