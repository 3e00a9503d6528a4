package dev.pagecraft.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * An ordered content block of a page's draft. Published snapshots hold
 * independent copies made through {@link #copy()}.
 */
@Getter
@Setter
@ToString(exclude = "body")
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PageComponent {

    private Long id;
    private Long pageId;

    @Builder.Default
    private ComponentType componentType = ComponentType.MARKDOWN;

    private int position;
    private String title;
    private String body;

    @Builder.Default
    private String template = Page.DEFAULT_TEMPLATE;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public PageComponent copy() {
        return toBuilder().build();
    }

    /**
     * Compares what a reader would see: type, title, body and template. Ids and
     * timestamps are ignored.
     */
    public boolean contentEquals(PageComponent other) {
        return other != null
                && componentType == other.componentType
                && Objects.equals(title, other.title)
                && Objects.equals(body, other.body)
                && Objects.equals(template, other.template);
    }
}
