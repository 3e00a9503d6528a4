package dev.pagecraft.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageMoveRequest {

    @NotNull(message = "New parent id is required")
    private Long newParentId;

    // clamped into the sibling range; null appends
    private Integer position;
}
