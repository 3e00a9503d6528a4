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
public class ComponentRequest {

    @NotNull(message = "Page id is required")
    private Long pageId;

    @NotNull(message = "Body is required")
    @Size(max = 1_048_576, message = "Body must be at most 1 MB")
    private String body;

    @Size(max = 500, message = "Title must be at most 500 characters")
    private String title;

    @Size(max = 100, message = "Template must be at most 100 characters")
    private String template;

    @Size(max = 50, message = "Component type must be at most 50 characters")
    private String componentType;

    private Integer position;
}
