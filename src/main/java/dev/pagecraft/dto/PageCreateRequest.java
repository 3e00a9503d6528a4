package dev.pagecraft.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageCreateRequest {

    @NotNull(message = "Parent page id is required")
    private Long parentPageId;

    // empty is allowed and yields the slug "untitled"
    @NotNull(message = "Title is required")
    @Size(max = 500, message = "Title must be at most 500 characters")
    private String title;

    @Size(max = 255, message = "Slug must be at most 255 characters")
    private String slug;

    @Size(max = 100, message = "Template must be at most 100 characters")
    private String template;

    // clamped into range by the engine
    private Integer position;
}
