package dev.pagecraft.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial page update; null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageUpdateRequest {

    @Size(max = 500, message = "Title must be at most 500 characters")
    private String title;

    @Size(max = 100, message = "Template must be at most 100 characters")
    private String template;

    @Size(max = 255, message = "Slug must be at most 255 characters")
    private String slug;
}
