package dev.pagecraft.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A node of the page tree. Only {@code PageTree} mutates instances; everything
 * handed out to callers is a {@code PageResponse} snapshot.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Page {

    public static final String DEFAULT_TEMPLATE = "default";

    private Long id;

    // null only for the root
    private Long parentId;

    private String slug;
    private String title;

    @Builder.Default
    private String template = DEFAULT_TEMPLATE;

    private int position;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isRoot() {
        return parentId == null;
    }
}
