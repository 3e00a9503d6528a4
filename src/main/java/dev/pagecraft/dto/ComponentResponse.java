package dev.pagecraft.dto;

import dev.pagecraft.entity.PageComponent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentResponse {
    private String id;
    private String pageId;
    private String componentType;
    private int position;
    private String title;
    private String body;
    private String template;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ComponentResponse fromEntity(PageComponent component) {
        return ComponentResponse.builder()
                .id(String.valueOf(component.getId()))
                .pageId(String.valueOf(component.getPageId()))
                .componentType(component.getComponentType().getValue())
                .position(component.getPosition())
                .title(component.getTitle())
                .body(component.getBody())
                .template(component.getTemplate())
                .createdAt(component.getCreatedAt())
                .updatedAt(component.getUpdatedAt())
                .build();
    }
}
