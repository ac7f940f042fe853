package io.github.drompincen.annostore.runtime.search;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.github.drompincen.annostore.persistence.store.AnnotationCollectionService;
import io.github.drompincen.annostore.protocol.api.AnnotationPage;
import io.github.drompincen.annostore.protocol.api.SearchInfo;
import io.github.drompincen.annostore.runtime.config.StoreSettings;
import io.github.drompincen.annostore.runtime.config.UriFactory;
import io.github.drompincen.annostore.runtime.error.NotFoundException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import io.github.drompincen.annostore.runtime.query.QueryCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Holds compiled searches and serves their result pages.
 *
 * <p>Entries expire a fixed time after their last access and the cache never holds more than the
 * configured number of searches; beyond that the least recently used one is evicted. A single
 * segment keeps that order exact.
 */
@Service
public class SearchCacheService {

    private static final Logger log = LoggerFactory.getLogger(SearchCacheService.class);

    private final QueryCompiler queryCompiler;
    private final AnnotationCollectionService store;
    private final UriFactory uriFactory;
    private final Clock clock;
    private final int pageSize;
    private final Cache<String, CompiledSearch> searches;

    @Autowired
    public SearchCacheService(QueryCompiler queryCompiler,
                              AnnotationCollectionService store,
                              StoreSettings settings,
                              UriFactory uriFactory,
                              Clock clock) {
        this(queryCompiler, store, settings, uriFactory, clock, Ticker.systemTicker());
    }

    SearchCacheService(QueryCompiler queryCompiler,
                       AnnotationCollectionService store,
                       StoreSettings settings,
                       UriFactory uriFactory,
                       Clock clock,
                       Ticker ticker) {
        if (settings.pageSize() < 1) {
            throw new IllegalArgumentException("page size must be positive: " + settings.pageSize());
        }
        this.queryCompiler = queryCompiler;
        this.store = store;
        this.uriFactory = uriFactory;
        this.clock = clock;
        this.pageSize = settings.pageSize();
        this.searches = CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumSize(settings.searchCacheMaxSize())
                .expireAfterAccess(settings.searchCacheTtl())
                .ticker(ticker)
                .build();
    }

    public CompiledSearch create(String containerName, Map<String, Object> query) {
        List<AggregationOperation> stages = queryCompiler.compile(query);
        if (!store.collectionExists(containerName)) {
            throw new NotFoundException("Container '" + containerName + "' not found");
        }
        long hits = store.count(containerName, stages);
        CompiledSearch search = new CompiledSearch(UUID.randomUUID().toString(), containerName,
                query, stages, hits, clock.instant());
        searches.put(search.id(), search);
        log.debug("Search {} on container {} found {} hit(s)", search.id(), containerName, hits);
        return search;
    }

    public AnnotationPage getPage(String containerName, String searchId, int page) {
        if (page < 0) {
            throw new ValidationException("Page number must not be negative: " + page);
        }
        CompiledSearch search = lookup(containerName, searchId);
        long startIndex = (long) page * pageSize;
        List<AggregationOperation> pipeline = new ArrayList<>(search.stages());
        pipeline.add(Aggregation.skip(startIndex));
        pipeline.add(Aggregation.limit(pageSize));
        List<Map<String, Object>> items = store.aggregate(containerName, pipeline).stream()
                .map(envelope -> AnnotationItems.toItem(uriFactory, containerName, envelope))
                .toList();

        String searchUrl = uriFactory.searchUrl(containerName, searchId);
        String prev = page > 0 ? UriFactory.pageUrl(searchUrl, page - 1) : null;
        String next = startIndex + items.size() < search.totalHits() ? UriFactory.pageUrl(searchUrl, page + 1) : null;
        return new AnnotationPage(UriFactory.pageUrl(searchUrl, page), searchUrl, startIndex, items, prev, next);
    }

    public SearchInfo getInfo(String containerName, String searchId) {
        CompiledSearch search = lookup(containerName, searchId);
        return new SearchInfo(search.query(), search.totalHits());
    }

    /** Number of live entries, after pending evictions have been applied. */
    public long size() {
        searches.cleanUp();
        return searches.size();
    }

    private CompiledSearch lookup(String containerName, String searchId) {
        CompiledSearch search = searches.getIfPresent(searchId);
        if (search == null || !search.containerName().equals(containerName)) {
            throw new NotFoundException("No search found with id " + searchId);
        }
        return search;
    }
}
