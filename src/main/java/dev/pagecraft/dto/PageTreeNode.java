package dev.pagecraft.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageTreeNode {
    private PageResponse page;
    @Builder.Default
    private List<PageTreeNode> children = new ArrayList<>();
}
