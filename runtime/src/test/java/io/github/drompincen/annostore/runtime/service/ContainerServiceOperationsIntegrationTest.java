package io.github.drompincen.annostore.runtime.service;

import io.github.drompincen.annostore.protocol.api.AnnotationDto;
import io.github.drompincen.annostore.protocol.api.AnnotationIdentifier;
import io.github.drompincen.annostore.protocol.api.AnnotationPage;
import io.github.drompincen.annostore.protocol.api.ContainerDto;
import io.github.drompincen.annostore.protocol.api.ContainerUserEntry;
import io.github.drompincen.annostore.protocol.api.CreateContainerRequest;
import io.github.drompincen.annostore.protocol.api.IndexChoreStatus;
import io.github.drompincen.annostore.protocol.api.IndexConfig;
import io.github.drompincen.annostore.protocol.api.IndexType;
import io.github.drompincen.annostore.protocol.api.Role;
import io.github.drompincen.annostore.protocol.api.SearchCreated;
import io.github.drompincen.annostore.protocol.api.TaskState;
import io.github.drompincen.annostore.runtime.AbstractMongoIntegrationTest;
import io.github.drompincen.annostore.runtime.access.UserPrincipal;
import io.github.drompincen.annostore.runtime.error.NotAuthorizedException;
import io.github.drompincen.annostore.runtime.error.PreconditionFailedException;
import io.github.drompincen.annostore.runtime.error.ValidationException;
import io.github.drompincen.annostore.runtime.search.ContainerSearchTask;
import io.github.drompincen.annostore.runtime.search.GlobalSearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainerServiceOperationsIntegrationTest extends AbstractMongoIntegrationTest {

    private static final UserPrincipal ALICE = UserPrincipal.named("alice");
    private static final UserPrincipal BOB = UserPrincipal.named("bob");

    @Autowired private ContainerServiceOperations operations;
    @Autowired private GlobalSearchService globalSearchService;

    private String container;

    @BeforeEach
    void createLetters() {
        ContainerDto created = operations.createContainer(ALICE, new CreateContainerRequest("letters", "Letters", false));
        container = created.name();
        operations.addContainerUsers(ALICE, container, List.of(new ContainerUserEntry("bob", Role.GUEST)));

        List<Map<String, Object>> batch = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            batch.add(Map.of("type", "Annotation", "body", Map.of("type", "Page", "n", i)));
        }
        for (int i = 0; i < 2; i++) {
            batch.add(Map.of("type", "Annotation", "body", Map.of("type", "Line", "n", i)));
        }
        List<AnnotationIdentifier> ids = operations.batchUpload(ALICE, container, batch);
        assertThat(ids).hasSize(5);
    }

    @Test
    void creatorBecomesAdminOfTheNamedContainer() {
        assertThat(container).isEqualTo("letters");
        assertThat(operations.getContainerUsers(ALICE, container))
                .containsExactly(new ContainerUserEntry("alice", Role.ADMIN), new ContainerUserEntry("bob", Role.GUEST));
        assertThat(operations.getAccessibleContainers(BOB)).containsEntry(Role.GUEST, List.of("letters"));
    }

    @Test
    void takenContainerNameIsRegenerated() {
        ContainerDto second = operations.createContainer(BOB, new CreateContainerRequest("letters", null, false));

        assertThat(second.name()).isNotEqualTo("letters");
        assertThat(second.size()).isZero();
        assertThat(operations.getContainer(BOB, second.name()).name()).isEqualTo(second.name());
    }

    @Test
    void searchForPagesPagesThroughTheFrozenTotal() {
        SearchCreated search = operations.createSearch(BOB, container, Map.of("body.type", "Page"));
        assertThat(search.hits()).isEqualTo(3);

        AnnotationPage first = operations.getSearchResultPage(BOB, container, search.id(), 0);
        assertThat(first.items()).hasSize(2);
        assertThat(first.prev()).isNull();
        assertThat(first.next()).endsWith("?page=1");
        assertThat(first.items()).allSatisfy(item -> {
            assertThat(item).containsEntry("type", "Annotation");
            assertThat((String) item.get("id")).startsWith("http://localhost:8080/w3c/letters/");
        });

        AnnotationPage second = operations.getSearchResultPage(BOB, container, search.id(), 1);
        assertThat(second.items()).hasSize(1);
        assertThat(second.prev()).endsWith("?page=0");
        assertThat(second.next()).isNull();

        assertThat(operations.getSearchInfo(BOB, container, search.id()).query())
                .containsEntry("body.type", "Page");
    }

    @Test
    void singleHitAndZeroHitSearchesOnAFreshContainer() {
        String fresh = operations.createContainer(ALICE, new CreateContainerRequest("pages-and-lines", "", false)).name();
        AnnotationDto page = operations.createAnnotation(ALICE, fresh, "page-1", Map.of("body", Map.of("type", "Page")));
        operations.createAnnotation(ALICE, fresh, "line-1", Map.of("body", Map.of("type", "Line")));

        SearchCreated pages = operations.createSearch(ALICE, fresh, Map.of("body", Map.of("type", "Page")));
        assertThat(pages.hits()).isEqualTo(1);
        AnnotationPage only = operations.getSearchResultPage(ALICE, fresh, pages.id(), 0);
        assertThat(only.startIndex()).isZero();
        assertThat(only.prev()).isNull();
        assertThat(only.next()).isNull();
        assertThat(only.items()).singleElement().satisfies(item -> {
            assertThat(item.get("id")).isEqualTo(page.annotation().get("id"));
            assertThat(item.get("id")).isEqualTo("http://localhost:8080/w3c/pages-and-lines/page-1");
        });

        SearchCreated lines = operations.createSearch(ALICE, fresh, Map.of("body", Map.of("type", "Line")));
        assertThat(lines.hits()).isEqualTo(1);
        assertThat(operations.getSearchResultPage(ALICE, fresh, lines.id(), 0).items()).singleElement()
                .satisfies(item -> assertThat(item.get("id")).isEqualTo("http://localhost:8080/w3c/pages-and-lines/line-1"));

        SearchCreated none = operations.createSearch(ALICE, fresh, Map.of("body.type", "Chapter"));
        assertThat(none.hits()).isZero();
        AnnotationPage empty = operations.getSearchResultPage(ALICE, fresh, none.id(), 0);
        assertThat(empty.items()).isEmpty();
        assertThat(empty.prev()).isNull();
        assertThat(empty.next()).isNull();
    }

    @Test
    void negatedMembershipFindsTheLines() {
        SearchCreated search = operations.createSearch(ALICE, container,
                Map.of("body.type", Map.of(":isNotIn", List.of("Page"))));

        assertThat(search.hits()).isEqualTo(2);
    }

    @Test
    void comparisonOperatorsFilterNumbers() {
        SearchCreated search = operations.createSearch(ALICE, container,
                Map.of("body.type", "Page", "body.n", Map.of(":isGreaterThanOrEqualTo", 1)));

        assertThat(search.hits()).isEqualTo(2);
    }

    @Test
    void textAnchorRangeFunctions() {
        operations.createAnnotation(ALICE, container, "a1", anchored("urn:text", 10, 20));
        operations.createAnnotation(ALICE, container, "a2", anchored("urn:text", 30, 40));
        operations.createAnnotation(ALICE, container, "a3", anchored("urn:other", 10, 20));

        assertThat(operations.createSearch(ALICE, container, Map.of(":overlapsWithTextAnchorRange",
                Map.of("source", "urn:text", "start", 15, "end", 35))).hits()).isEqualTo(2);
        assertThat(operations.createSearch(ALICE, container, Map.of(":overlapsWithTextAnchorRange",
                Map.of("source", "urn:text", "start", 20, "end", 30))).hits()).isZero();
        assertThat(operations.createSearch(ALICE, container, Map.of(":isWithinTextAnchorRange",
                Map.of("source", "urn:text", "start", 0, "end", 25))).hits()).isEqualTo(1);
    }

    @Test
    void guestSearchesButCannotIndex() {
        assertThatCode(() -> operations.createSearch(BOB, container, Map.of("body.type", "Line")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> operations.addIndex(BOB, container, "body.type", "hashed"))
                .isInstanceOf(NotAuthorizedException.class);
        assertThatThrownBy(() -> operations.createSearch(UserPrincipal.named("mallory"), container, Map.of("a", 1)))
                .isInstanceOf(NotAuthorizedException.class);
    }

    @Test
    void indexLifecycle() {
        IndexChoreStatus status = operations.addIndex(ALICE, container, "body.type", "hashed");
        assertThat(status.indexName()).isEqualTo("annotation.body.type_hashed");
        assertThat(status.status().state()).isEqualTo(TaskState.DONE);
        assertThat(operations.getIndexStatus(ALICE, container, "body.type", "hashed").status().state())
                .isEqualTo(TaskState.DONE);

        assertThat(operations.listIndexes(BOB, container)).containsExactly(new IndexConfig("body.type",
                IndexType.HASHED, "http://localhost:8080/services/letters/indexes/body.type/hashed"));
        assertThat(operations.getIndex(ALICE, container, "body.type", "hashed").type()).isEqualTo(IndexType.HASHED);
        assertThat(operations.getMetadata(BOB, container).indexes()).hasSize(1);

        operations.deleteIndex(ALICE, container, "body.type", "hashed");
        assertThat(operations.listIndexes(ALICE, container)).isEmpty();
        assertThatCode(() -> operations.deleteIndex(ALICE, container, "body.type", "hashed"))
                .doesNotThrowAnyException();

        IndexChoreStatus rebuilt = operations.addIndex(ALICE, container, "body.type", "hashed");
        assertThat(rebuilt.status().id()).isNotEqualTo(status.status().id());
    }

    @Test
    void fieldCountsFollowCreateReplaceAndDelete() {
        assertThat(operations.getFieldCounts(BOB, container))
                .containsEntry("body", 5).containsEntry("body.type", 5).containsEntry("body.n", 5).containsEntry("type", 5);

        AnnotationDto created = operations.createAnnotation(ALICE, container, null,
                Map.of("@context", "http://www.w3.org/ns/anno.jsonld", "motivation", "tagging"));
        assertThat(operations.getFieldCounts(BOB, container)).containsEntry("motivation", 1).doesNotContainKey("@context");

        AnnotationDto replaced = operations.replaceAnnotation(ALICE, container, created.annotationName(),
                created.etag(), Map.of("purpose", "x"));
        assertThat(operations.getFieldCounts(BOB, container)).containsEntry("purpose", 1).doesNotContainKey("motivation");

        operations.deleteAnnotation(ALICE, container, replaced.annotationName(), replaced.etag());
        assertThat(operations.getFieldCounts(BOB, container)).doesNotContainKey("purpose");
    }

    @Test
    void replaceNeedsTheCurrentEtag() {
        AnnotationDto created = operations.createAnnotation(ALICE, container, "note", Map.of("value", 1));

        assertThatThrownBy(() -> operations.replaceAnnotation(ALICE, container, "note", "stale", Map.of("value", 2)))
                .isInstanceOf(PreconditionFailedException.class);

        AnnotationDto replaced = operations.replaceAnnotation(ALICE, container, "note", created.etag(), Map.of("value", 2));
        assertThat(replaced.etag()).isNotEqualTo(created.etag());
        assertThat(operations.getAnnotation(BOB, container, "note").annotation()).containsEntry("value", 2);
    }

    @Test
    void takenAnnotationNameIsRegenerated() {
        AnnotationDto first = operations.createAnnotation(ALICE, container, "note", Map.of("value", 1));
        AnnotationDto second = operations.createAnnotation(ALICE, container, "note", Map.of("value", 2));

        assertThat(first.annotationName()).isEqualTo("note");
        assertThat(second.annotationName()).isNotEqualTo("note");
    }

    @Test
    void onlyEmptyContainersCanBeDeleted() {
        assertThatThrownBy(() -> operations.deleteContainer(ALICE, container))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> operations.deleteContainer(BOB, container))
                .isInstanceOf(NotAuthorizedException.class);

        ContainerDto empty = operations.createContainer(ALICE, new CreateContainerRequest("scratch", "", false));
        operations.deleteContainer(ALICE, empty.name());
        assertThat(operations.getAccessibleContainers(ALICE).get(Role.ADMIN)).containsExactly("letters");
    }

    @Test
    void globalSearchCoversReadableContainers() {
        ContainerDto diaries = operations.createContainer(UserPrincipal.root(), new CreateContainerRequest("diaries", "", false));
        operations.createAnnotation(UserPrincipal.root(), diaries.name(), null, Map.of("body", Map.of("type", "Page")));

        ContainerSearchTask forBob = globalSearchService.startGlobalSearch(BOB, Map.of("body.type", "Page"));
        ContainerSearchTask forRoot = globalSearchService.startGlobalSearch(UserPrincipal.root(), Map.of("body.type", "Page"));

        assertThat(globalSearchService.getStatus(BOB, forBob.getId()).status().resultCount()).isEqualTo(3);
        assertThat(globalSearchService.getStatus(UserPrincipal.root(), forRoot.getId()).status().resultCount()).isEqualTo(4);
        assertThat(globalSearchService.getResultPage(BOB, forBob.getId(), 0).items()).hasSize(2);
    }

    private static Map<String, Object> anchored(String source, int start, int end) {
        return Map.of("target", Map.of("source", source,
                "selector", Map.of("type", "TextAnchorSelector", "start", start, "end", end)));
    }
}
