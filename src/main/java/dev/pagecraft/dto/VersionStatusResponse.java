package dev.pagecraft.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionStatusResponse {
    private String pageId;
    private boolean hasPublished;
    private boolean hasDraftChanges;
    // 0 until the first publish
    private int publishedVersion;
    private LocalDateTime publishedAt;
    private int draftComponentCount;
    private int publishedComponentCount;
}
