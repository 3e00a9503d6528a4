package dev.pagecraft.controller;

import dev.pagecraft.dto.ComponentResponse;
import dev.pagecraft.dto.PageCreateRequest;
import dev.pagecraft.dto.PageMoveRequest;
import dev.pagecraft.dto.PageResponse;
import dev.pagecraft.dto.PageTreeNode;
import dev.pagecraft.dto.PageUpdateRequest;
import dev.pagecraft.dto.VersionStatusResponse;
import dev.pagecraft.metrics.ContentMetrics;
import dev.pagecraft.service.ComponentStore;
import dev.pagecraft.service.PageTree;
import dev.pagecraft.service.VersionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/pages")
@RequiredArgsConstructor
@Tag(name = "Admin - Pages", description = "Page tree management and publishing")
@Slf4j
public class AdminPageController {

    private final PageTree pageTree;
    private final ComponentStore componentStore;
    private final VersionManager versionManager;
    private final ContentMetrics contentMetrics;

    @GetMapping
    @Operation(summary = "Get page tree", description = "Get the whole page hierarchy starting at the root")
    public Mono<PageTreeNode> getTree() {
        log.debug("Fetching page tree");
        return Mono.fromCallable(pageTree::listTree)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get page by ID")
    public Mono<PageResponse> getPage(@PathVariable Long id) {
        log.debug("Fetching page id={}", id);
        return Mono.fromCallable(() -> pageTree.get(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/by-path")
    @Operation(summary = "Get page by path", description = "Resolve a root-relative path such as /about/team")
    public Mono<PageResponse> getPageByPath(
            @Parameter(description = "Root-relative path, '/' for the root")
            @RequestParam String path) {
        log.debug("Resolving page path={}", path);
        return Mono.fromCallable(() -> pageTree.getByPath(path))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/children")
    @Operation(summary = "Get child pages", description = "Direct children of a page in sibling order")
    public Mono<List<PageResponse>> getChildren(@PathVariable Long id) {
        return Mono.fromCallable(() -> pageTree.children(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    @Operation(summary = "Create page")
    public Mono<ResponseEntity<PageResponse>> createPage(@Valid @RequestBody PageCreateRequest request) {
        log.info("Creating page '{}' under parent={}", request.getTitle(), request.getParentPageId());
        return Mono.fromCallable(() -> pageTree.create(request.getParentPageId(), request.getTitle(),
                        request.getSlug(), request.getTemplate(), request.getPosition()))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(page -> contentMetrics.incrementPageCreated())
                .map(page -> ResponseEntity.status(HttpStatus.CREATED).body(page));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update page", description = "Change title, template or slug; omitted fields are kept")
    public Mono<PageResponse> updatePage(@PathVariable Long id, @Valid @RequestBody PageUpdateRequest request) {
        log.info("Updating page id={}", id);
        return Mono.fromCallable(() -> pageTree.update(id, request.getTitle(), request.getTemplate(), request.getSlug()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/move")
    @Operation(summary = "Move page", description = "Re-parent a page with its subtree or reorder it among its siblings")
    public Mono<PageResponse> movePage(@PathVariable Long id, @Valid @RequestBody PageMoveRequest request) {
        log.info("Moving page id={} to parent={} position={}", id, request.getNewParentId(), request.getPosition());
        return Mono.fromCallable(() -> pageTree.move(id, request.getNewParentId(), request.getPosition()))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(page -> contentMetrics.incrementPageMoved());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete page", description = "Delete a page, its descendants and all their content")
    public Mono<ResponseEntity<Void>> deletePage(@PathVariable Long id) {
        log.info("Deleting page id={}", id);
        return Mono.fromCallable(() -> pageTree.delete(id))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(removed -> contentMetrics.incrementPagesDeleted(removed.size()))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    // ==================== CONTENT ====================

    @GetMapping("/{id}/components")
    @Operation(summary = "List draft components")
    public Mono<List<ComponentResponse>> listComponents(@PathVariable Long id) {
        return Mono.fromCallable(() -> componentStore.list(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/draft")
    @Operation(summary = "Get draft content")
    public Mono<List<ComponentResponse>> getDraft(@PathVariable Long id) {
        return Mono.fromCallable(() -> versionManager.getDraft(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/published")
    @Operation(summary = "Get published content", description = "Empty when the page was never published")
    public Mono<List<ComponentResponse>> getPublished(@PathVariable Long id) {
        return Mono.fromCallable(() -> versionManager.getPublished(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/versions")
    @Operation(summary = "Get version status")
    public Mono<VersionStatusResponse> getVersionStatus(@PathVariable Long id) {
        return Mono.fromCallable(() -> versionManager.status(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/publish")
    @Operation(summary = "Publish draft", description = "Copy the current draft into the published snapshot")
    public Mono<VersionStatusResponse> publish(@PathVariable Long id) {
        log.info("Publishing page id={}", id);
        return Mono.fromCallable(() -> versionManager.publish(id))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(status -> contentMetrics.incrementDraftPublished());
    }

    @PostMapping("/{id}/discard")
    @Operation(summary = "Discard draft", description = "Restore the draft from the published snapshot")
    public Mono<VersionStatusResponse> discard(@PathVariable Long id) {
        log.info("Discarding draft of page id={}", id);
        return Mono.fromCallable(() -> versionManager.discardDraft(id))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(status -> contentMetrics.incrementDraftDiscarded());
    }
}
