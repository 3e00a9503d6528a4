package dev.pagecraft.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exactly one of the three targets must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentMoveRequest {
    private Integer position;
    private Long beforeComponentId;
    private Long afterComponentId;
}
