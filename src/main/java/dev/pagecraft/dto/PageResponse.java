package dev.pagecraft.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Snapshot of a page as seen at the time of the call. {@code path} is derived
 * from the current ancestry: {@code /} for the root, otherwise the slugs of the
 * non-root ancestors and the page itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse {
    private String id;
    private String parentId;
    private String slug;
    private String title;
    private String template;
    private int position;
    private String path;
    private boolean hasChildren;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
