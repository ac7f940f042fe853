package io.github.drompincen.annostore.runtime.search;

import io.github.drompincen.annostore.persistence.store.AnnotationCollectionService;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.task.BackgroundTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs one compiled query against a list of containers, one container per unit of work.
 * A container that cannot be searched adds an error and the others are still searched.
 */
public class ContainerSearchTask extends BackgroundTask {

    private static final Logger log = LoggerFactory.getLogger(ContainerSearchTask.class);

    private final AnnotationCollectionService store;
    private final UriFactory uriFactory;
    private final UserPrincipal owner;
    private final Map<String, Object> query;
    private final List<AggregationOperation> stages;
    private final List<String> containerNames;

    public ContainerSearchTask(AnnotationCollectionService store, UriFactory uriFactory, UserPrincipal owner,
                               Map<String, Object> query, List<AggregationOperation> stages,
                               List<String> containerNames, Duration timeToLive, Clock clock) {
        super(timeToLive, clock);
        this.store = store;
        this.uriFactory = uriFactory;
        this.owner = owner;
        this.query = query;
        this.stages = List.copyOf(stages);
        this.containerNames = List.copyOf(containerNames);
    }

    @Override
    protected void execute(Progress progress) {
        log.debug("Searching {} container(s) for {}", containerNames.size(), query);
        forEachUnit(containerNames, (containerName, p) -> p.addResults(
                store.aggregate(containerName, stages).stream()
                        .map(envelope -> AnnotationItems.toItem(uriFactory, containerName, envelope))
                        .toList()));
        log.info("Global search {} done: {} hit(s) in {} container(s)", getId(), summary().resultCount(),
                containerNames.size());
    }

    public UserPrincipal getOwner() { return owner; }

    public Map<String, Object> getQuery() { return query; }

    public List<String> getContainerNames() { return containerNames; }
}
