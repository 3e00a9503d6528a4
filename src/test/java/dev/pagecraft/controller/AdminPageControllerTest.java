package dev.pagecraft.controller;

import dev.pagecraft.dto.ComponentResponse;
import dev.pagecraft.dto.PageCreateRequest;
import dev.pagecraft.dto.PageMoveRequest;
import dev.pagecraft.dto.PageResponse;
import dev.pagecraft.dto.PageTreeNode;
import dev.pagecraft.dto.PageUpdateRequest;
import dev.pagecraft.dto.VersionStatusResponse;
import dev.pagecraft.exception.CycleDetectedException;
import dev.pagecraft.exception.InvalidOperationException;
import dev.pagecraft.exception.ResourceNotFoundException;
import dev.pagecraft.metrics.ContentMetrics;
import dev.pagecraft.service.ComponentStore;
import dev.pagecraft.service.PageTree;
import dev.pagecraft.service.VersionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminPageControllerTest {

    @Mock
    private PageTree pageTree;

    @Mock
    private ComponentStore componentStore;

    @Mock
    private VersionManager versionManager;

    @Mock
    private ContentMetrics contentMetrics;

    @InjectMocks
    private AdminPageController controller;

    private PageResponse buildPage(Long id, String slug, String path) {
        return PageResponse.builder()
                .id(String.valueOf(id))
                .parentId("1")
                .slug(slug)
                .title(slug)
                .template("default")
                .path(path)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
    }

    @Nested
    @DisplayName("GET /api/v1/admin/pages")
    class Reads {

        @Test
        @DisplayName("Should return the page tree")
        void shouldReturnTree() {
            PageTreeNode root = PageTreeNode.builder().page(buildPage(1L, "home", "/")).build();
            when(pageTree.listTree()).thenReturn(root);

            StepVerifier.create(controller.getTree())
                    .assertNext(node -> assertThat(node.getPage().getPath()).isEqualTo("/"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should read the engine off the calling thread")
        void shouldReadOnBoundedElastic() {
            AtomicReference<String> engineThread = new AtomicReference<>();
            when(pageTree.get(2L)).thenAnswer(invocation -> {
                engineThread.set(Thread.currentThread().getName());
                return buildPage(2L, "about", "/about");
            });

            StepVerifier.create(controller.getPage(2L))
                    .assertNext(page -> assertThat(page.getSlug()).isEqualTo("about"))
                    .verifyComplete();
            assertThat(engineThread.get()).startsWith("boundedElastic");
        }

        @Test
        @DisplayName("Should resolve a page by path")
        void shouldResolveByPath() {
            when(pageTree.getByPath("/about")).thenReturn(buildPage(2L, "about", "/about"));

            StepVerifier.create(controller.getPageByPath("/about"))
                    .assertNext(page -> assertThat(page.getId()).isEqualTo("2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should propagate not found as an error signal")
        void shouldPropagateNotFound() {
            when(pageTree.get(99L)).thenThrow(new ResourceNotFoundException("Page", "id", 99L));

            StepVerifier.create(controller.getPage(99L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should list children in order")
        void shouldListChildren() {
            when(pageTree.children(1L)).thenReturn(List.of(buildPage(2L, "a", "/a"), buildPage(3L, "b", "/b")));

            StepVerifier.create(controller.getChildren(1L))
                    .assertNext(children -> assertThat(children).extracting(PageResponse::getSlug).containsExactly("a", "b"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Page mutations")
    class Mutations {

        @Test
        @DisplayName("Should create a page with 201 and count it")
        void shouldCreatePage() {
            PageCreateRequest request = PageCreateRequest.builder().parentPageId(1L).title("About").build();
            when(pageTree.create(1L, "About", null, null, null)).thenReturn(buildPage(2L, "about", "/about"));

            StepVerifier.create(controller.createPage(request))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                        assertThat(response.getBody().getSlug()).isEqualTo("about");
                    })
                    .verifyComplete();
            verify(contentMetrics).incrementPageCreated();
        }

        @Test
        @DisplayName("Should update a page")
        void shouldUpdatePage() {
            PageUpdateRequest request = PageUpdateRequest.builder().title("Renamed").slug("renamed").build();
            when(pageTree.update(2L, "Renamed", null, "renamed")).thenReturn(buildPage(2L, "renamed", "/renamed"));

            StepVerifier.create(controller.updatePage(2L, request))
                    .assertNext(page -> assertThat(page.getPath()).isEqualTo("/renamed"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should not count a rejected move")
        void shouldNotCountRejectedMove() {
            PageMoveRequest request = PageMoveRequest.builder().newParentId(3L).build();
            when(pageTree.move(2L, 3L, null)).thenThrow(new CycleDetectedException(2L, 3L));

            StepVerifier.create(controller.movePage(2L, request))
                    .expectError(CycleDetectedException.class)
                    .verify();
            verifyNoInteractions(contentMetrics);
        }

        @Test
        @DisplayName("Should delete a page with 204")
        void shouldDeletePage() {
            when(pageTree.delete(2L)).thenReturn(List.of(2L, 5L, 6L));

            StepVerifier.create(controller.deletePage(2L))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT))
                    .verifyComplete();
            verify(contentMetrics).incrementPagesDeleted(3);
        }

        @Test
        @DisplayName("Should refuse to delete the root")
        void shouldRefuseRootDelete() {
            when(pageTree.delete(1L)).thenThrow(new InvalidOperationException("The root page cannot be deleted"));

            StepVerifier.create(controller.deletePage(1L))
                    .expectError(InvalidOperationException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Content and versions")
    class Versions {

        @Test
        @DisplayName("Should publish and count")
        void shouldPublish() {
            VersionStatusResponse status = VersionStatusResponse.builder()
                    .pageId("2").hasPublished(true).publishedVersion(1).build();
            when(versionManager.publish(2L)).thenReturn(status);

            StepVerifier.create(controller.publish(2L))
                    .assertNext(result -> assertThat(result.getPublishedVersion()).isEqualTo(1))
                    .verifyComplete();
            verify(contentMetrics).incrementDraftPublished();
        }

        @Test
        @DisplayName("Should discard and return the version status")
        void shouldDiscard() {
            VersionStatusResponse status = VersionStatusResponse.builder()
                    .pageId("2").hasPublished(true).publishedVersion(3).draftComponentCount(2).build();
            when(versionManager.discardDraft(2L)).thenReturn(status);

            StepVerifier.create(controller.discard(2L))
                    .assertNext(result -> {
                        assertThat(result.getPageId()).isEqualTo("2");
                        assertThat(result.getPublishedVersion()).isEqualTo(3);
                        assertThat(result.getDraftComponentCount()).isEqualTo(2);
                    })
                    .verifyComplete();
            verify(contentMetrics).incrementDraftDiscarded();
        }

        @Test
        @DisplayName("Should return draft and published content")
        void shouldReturnContent() {
            ComponentResponse component = ComponentResponse.builder().id("10").pageId("2").body("hi").build();
            when(versionManager.getDraft(2L)).thenReturn(List.of(component));
            when(versionManager.getPublished(2L)).thenReturn(List.of());
            when(componentStore.list(2L)).thenReturn(List.of(component));

            StepVerifier.create(controller.getDraft(2L))
                    .assertNext(draft -> assertThat(draft).hasSize(1))
                    .verifyComplete();
            StepVerifier.create(controller.getPublished(2L))
                    .assertNext(published -> assertThat(published).isEmpty())
                    .verifyComplete();
            StepVerifier.create(controller.listComponents(2L))
                    .assertNext(components -> assertThat(components).extracting(ComponentResponse::getBody).containsExactly("hi"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return version status")
        void shouldReturnStatus() {
            when(versionManager.status(2L)).thenReturn(VersionStatusResponse.builder().pageId("2").hasDraftChanges(true).build());

            StepVerifier.create(controller.getVersionStatus(2L))
                    .assertNext(status -> assertThat(status.isHasDraftChanges()).isTrue())
                    .verifyComplete();
        }
    }
}
