package dev.pagecraft.entity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Content of a page as of its last publish. The component list is an
 * unmodifiable list of copies, detached from the draft.
 */
public record PublishedSnapshot(
        Long pageId,
        int versionNumber,
        List<PageComponent> components,
        LocalDateTime publishedAt
) {
    public PublishedSnapshot {
        components = List.copyOf(components);
    }
}
