package dev.pagecraft.service;

import dev.pagecraft.dto.ComponentResponse;
import dev.pagecraft.dto.VersionStatusResponse;
import dev.pagecraft.entity.PageComponent;
import dev.pagecraft.entity.PublishedSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the last published snapshot of each page next to its live draft.
 *
 * <p>Publishing copies the draft and leaves it in place; discarding restores
 * the draft from the snapshot with the original component ids.</p>
 */
@Slf4j
public class VersionManager implements PageRemovalListener {

    private final ContentLock lock;
    private final PageTree pageTree;
    private final ComponentStore componentStore;

    private final Map<Long, PublishedSnapshot> snapshots = new HashMap<>();

    public VersionManager(ContentLock lock, PageTree pageTree, ComponentStore componentStore) {
        this.lock = lock;
        this.pageTree = pageTree;
        this.componentStore = componentStore;
    }

    public List<ComponentResponse> getDraft(Long pageId) {
        return componentStore.list(pageId);
    }

    /**
     * Empty when the page has never been published.
     */
    public List<ComponentResponse> getPublished(Long pageId) {
        return lock.read(() -> {
            pageTree.requireExists(pageId);
            PublishedSnapshot snapshot = snapshots.get(pageId);
            if (snapshot == null) {
                return List.<ComponentResponse>of();
            }
            return snapshot.components().stream()
                    .map(ComponentResponse::fromEntity)
                    .toList();
        });
    }

    public VersionStatusResponse publish(Long pageId) {
        return lock.write(() -> {
            pageTree.requireExists(pageId);
            PublishedSnapshot previous = snapshots.get(pageId);
            int version = previous == null ? 1 : previous.versionNumber() + 1;
            PublishedSnapshot snapshot = new PublishedSnapshot(
                    pageId, version, componentStore.snapshotDraft(pageId), LocalDateTime.now());
            snapshots.put(pageId, snapshot);
            log.info("Page {} published as version {} ({} components)",
                    pageId, version, snapshot.components().size());
            return buildStatus(pageId);
        });
    }

    public VersionStatusResponse discardDraft(Long pageId) {
        return lock.write(() -> {
            pageTree.requireExists(pageId);
            PublishedSnapshot snapshot = snapshots.get(pageId);
            componentStore.replaceDraft(pageId, snapshot == null ? List.of() : snapshot.components());
            log.info("Draft of page {} discarded (restored version {})",
                    pageId, snapshot == null ? 0 : snapshot.versionNumber());
            return buildStatus(pageId);
        });
    }

    public VersionStatusResponse status(Long pageId) {
        return lock.read(() -> {
            pageTree.requireExists(pageId);
            return buildStatus(pageId);
        });
    }

    public int publishedCount() {
        return lock.read(snapshots::size);
    }

    @Override
    public void onPagesRemoved(Collection<Long> pageIds) {
        pageIds.forEach(snapshots::remove);
    }

    private VersionStatusResponse buildStatus(Long pageId) {
        List<PageComponent> draft = componentStore.snapshotDraft(pageId);
        PublishedSnapshot snapshot = snapshots.get(pageId);
        return VersionStatusResponse.builder()
                .pageId(String.valueOf(pageId))
                .hasPublished(snapshot != null)
                .hasDraftChanges(hasDraftChanges(draft, snapshot))
                .publishedVersion(snapshot == null ? 0 : snapshot.versionNumber())
                .publishedAt(snapshot == null ? null : snapshot.publishedAt())
                .draftComponentCount(draft.size())
                .publishedComponentCount(snapshot == null ? 0 : snapshot.components().size())
                .build();
    }

    private static boolean hasDraftChanges(List<PageComponent> draft, PublishedSnapshot snapshot) {
        if (snapshot == null) {
            return !draft.isEmpty();
        }
        List<PageComponent> published = snapshot.components();
        if (draft.size() != published.size()) {
            return true;
        }
        for (int i = 0; i < draft.size(); i++) {
            if (!draft.get(i).contentEquals(published.get(i))) {
                return true;
            }
        }
        return false;
    }
}
