package io.github.drompincen.annostore.runtime.search;

import io.github.drompincen.annostore.persistence.document.ContainerMetadataDocument;
import io.github.drompincen.annostore.persistence.repository.ContainerMetadataRepository;
import io.github.drompincen.annostore.persistence.store.AnnotationCollectionService;
import io.github.drompincen.annostore.protocol.api.AnnotationPage;
import io.github.drompincen.annostore.protocol.api.GlobalSearchStatus;
import io.github.drompincen.annostore.runtime.access.ContainerUserService;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.config.StoreSettings;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import io.github.drompincen.annostore.runtime.error.NotFoundException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import io.github.drompincen.annostore.runtime.query.QueryCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Searches every container the caller can read, in the background.
 */
@Service
public class GlobalSearchService {

    private static final Logger log = LoggerFactory.getLogger(GlobalSearchService.class);

    private final QueryCompiler queryCompiler;
    private final AnnotationCollectionService store;
    private final ContainerMetadataRepository containerMetadataRepository;
    private final ContainerUserService containerUserService;
    private final Executor executor;
    private final StoreSettings settings;
    private final UriFactory uriFactory;
    private final Clock clock;
    private final Map<String, ContainerSearchTask> tasks = new ConcurrentHashMap<>();

    public GlobalSearchService(QueryCompiler queryCompiler,
                               AnnotationCollectionService store,
                               ContainerMetadataRepository containerMetadataRepository,
                               ContainerUserService containerUserService,
                               @Qualifier("backgroundTaskExecutor") Executor executor,
                               StoreSettings settings,
                               UriFactory uriFactory,
                               Clock clock) {
        this.queryCompiler = queryCompiler;
        this.store = store;
        this.containerMetadataRepository = containerMetadataRepository;
        this.containerUserService = containerUserService;
        this.executor = executor;
        this.settings = settings;
        this.uriFactory = uriFactory;
        this.clock = clock;
    }

    public ContainerSearchTask startGlobalSearch(UserPrincipal principal, Map<String, Object> query) {
        if (principal == null) {
            throw new NotAuthorizedException("No authentication found");
        }
        List<AggregationOperation> stages = queryCompiler.compile(query);
        purgeExpired();
        ContainerSearchTask task = new ContainerSearchTask(store, uriFactory, principal, query, stages,
                readableContainers(principal), settings.taskTtl(), clock);
        tasks.put(task.getId(), task);
        try {
            executor.execute(task);
            log.info("Started global search {} over {} container(s) for {}", task.getId(),
                    task.getContainerNames().size(), principal.name());
        } catch (RejectedExecutionException e) {
            log.warn("Background pool rejected global search {}: {}", task.getId(), e.getMessage());
            task.abort("Background task pool is full, search was not started");
        }
        return task;
    }

    public GlobalSearchStatus getStatus(UserPrincipal principal, String searchId) {
        ContainerSearchTask task = lookup(principal, searchId);
        return new GlobalSearchStatus(task.getQuery(), task.summary());
    }

    /** Pages the results gathered so far; a running search may still add more. */
    public AnnotationPage getResultPage(UserPrincipal principal, String searchId, int page) {
        if (page < 0) {
            throw new ValidationException("Page number must not be negative: " + page);
        }
        ContainerSearchTask task = lookup(principal, searchId);
        List<Map<String, Object>> results = task.results();
        int pageSize = settings.pageSize();
        long startIndex = (long) page * pageSize;
        int from = (int) Math.min(startIndex, results.size());
        int to = (int) Math.min(startIndex + pageSize, results.size());
        List<Map<String, Object>> items = results.subList(from, to);

        String searchUrl = uriFactory.globalSearchUrl(searchId);
        String prev = page > 0 ? UriFactory.pageUrl(searchUrl, page - 1) : null;
        String next = to < results.size() ? UriFactory.pageUrl(searchUrl, page + 1) : null;
        return new AnnotationPage(UriFactory.pageUrl(searchUrl, page), searchUrl, startIndex, items, prev, next);
    }

    private ContainerSearchTask lookup(UserPrincipal principal, String searchId) {
        if (principal == null) {
            throw new NotAuthorizedException("No authentication found");
        }
        purgeExpired();
        ContainerSearchTask task = tasks.get(searchId);
        // principals compare by variant, so a user named "root" is not the superuser
        boolean visible = task != null
                && (principal instanceof UserPrincipal.Root || task.getOwner().equals(principal));
        if (!visible) {
            throw new NotFoundException("No search found with id " + searchId);
        }
        return task;
    }

    private List<String> readableContainers(UserPrincipal principal) {
        if (principal instanceof UserPrincipal.Root) {
            return containerMetadataRepository.findAllByOrderByNameAsc().stream()
                    .map(ContainerMetadataDocument::getName)
                    .toList();
        }
        return containerUserService.getContainersByRole(principal.name()).values().stream()
                .flatMap(Collection::stream)
                .distinct()
                .sorted()
                .toList();
    }

    private void purgeExpired() {
        tasks.values().removeIf(ContainerSearchTask::isExpired);
    }
}
