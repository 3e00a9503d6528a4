package dev.pagecraft.service;

import dev.pagecraft.dto.ComponentResponse;
import dev.pagecraft.entity.ComponentType;
import dev.pagecraft.entity.Page;
import dev.pagecraft.entity.PageComponent;
import dev.pagecraft.exception.InvalidOperationException;
import dev.pagecraft.exception.ResourceNotFoundException;
import dev.pagecraft.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Draft components of every page, kept as one ordered list per page plus an
 * index from component id to owning page.
 */
@Slf4j
public class ComponentStore implements PageRemovalListener {

    private final ContentLock lock;
    private final PageTree pageTree;
    private final IdService idService;

    private final Map<Long, List<PageComponent>> drafts = new HashMap<>();
    private final Map<Long, Long> owners = new HashMap<>();

    public ComponentStore(ContentLock lock, PageTree pageTree, IdService idService) {
        this.lock = lock;
        this.pageTree = pageTree;
        this.idService = idService;
    }

    public ComponentResponse create(Long pageId, String body, String title, String template,
                                    String componentType, Integer position) {
        if (body == null) {
            throw new ValidationException("Body is required");
        }
        ComponentType type = resolveType(componentType);
        validateTemplate(template);

        return lock.write(() -> {
            pageTree.requireExists(pageId);
            List<PageComponent> draft = drafts.computeIfAbsent(pageId, id -> new ArrayList<>());

            LocalDateTime now = LocalDateTime.now();
            PageComponent component = PageComponent.builder()
                    .id(idService.nextId())
                    .pageId(pageId)
                    .componentType(type)
                    .title(title)
                    .body(body)
                    .template(template != null ? template : Page.DEFAULT_TEMPLATE)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            draft.add(clamp(position, draft.size()), component);
            owners.put(component.getId(), pageId);
            renumber(draft);

            log.info("Component created: {} on page {} (type={}, position={})",
                    component.getId(), pageId, type.getValue(), component.getPosition());
            return ComponentResponse.fromEntity(component);
        });
    }

    public ComponentResponse get(Long componentId) {
        return lock.read(() -> ComponentResponse.fromEntity(require(componentId)));
    }

    /**
     * Only non-null fields are applied.
     */
    public ComponentResponse update(Long componentId, String title, String body, String template) {
        if (template != null) {
            validateTemplate(template);
        }
        return lock.write(() -> {
            PageComponent component = require(componentId);
            boolean changed = false;
            if (title != null) {
                component.setTitle(title);
                changed = true;
            }
            if (body != null) {
                component.setBody(body);
                changed = true;
            }
            if (template != null) {
                component.setTemplate(template);
                changed = true;
            }
            if (changed) {
                component.setUpdatedAt(LocalDateTime.now());
                log.info("Component updated: {}", componentId);
            }
            return ComponentResponse.fromEntity(component);
        });
    }

    public void delete(Long componentId) {
        lock.execute(() -> {
            PageComponent component = require(componentId);
            List<PageComponent> draft = drafts.get(component.getPageId());
            draft.remove(component);
            owners.remove(componentId);
            renumber(draft);
            log.info("Component deleted: {} from page {}", componentId, component.getPageId());
        });
    }

    public List<ComponentResponse> list(Long pageId) {
        return lock.read(() -> {
            pageTree.requireExists(pageId);
            return drafts.getOrDefault(pageId, List.of()).stream()
                    .map(ComponentResponse::fromEntity)
                    .toList();
        });
    }

    // ==================== REORDERING ====================

    public ComponentResponse move(Long componentId, Integer position) {
        if (position == null) {
            throw new ValidationException("Position is required");
        }
        return lock.write(() -> {
            PageComponent component = require(componentId);
            List<PageComponent> draft = drafts.get(component.getPageId());
            draft.remove(component);
            draft.add(clamp(position, draft.size()), component);
            return reordered(component, draft);
        });
    }

    public ComponentResponse moveBefore(Long componentId, Long targetId) {
        return moveRelative(componentId, targetId, 0);
    }

    public ComponentResponse moveAfter(Long componentId, Long targetId) {
        return moveRelative(componentId, targetId, 1);
    }

    private ComponentResponse moveRelative(Long componentId, Long targetId, int offset) {
        return lock.write(() -> {
            PageComponent component = require(componentId);
            PageComponent target = require(targetId);
            if (component.getId().equals(target.getId())) {
                throw new InvalidOperationException("A component cannot be moved relative to itself");
            }
            if (!component.getPageId().equals(target.getPageId())) {
                throw new InvalidOperationException(
                        "Component " + componentId + " and target " + targetId + " belong to different pages");
            }
            List<PageComponent> draft = drafts.get(component.getPageId());
            draft.remove(component);
            draft.add(draft.indexOf(target) + offset, component);
            return reordered(component, draft);
        });
    }

    private ComponentResponse reordered(PageComponent component, List<PageComponent> draft) {
        renumber(draft);
        component.setUpdatedAt(LocalDateTime.now());
        log.info("Component moved: {} to position {} on page {}",
                component.getId(), component.getPosition(), component.getPageId());
        return ComponentResponse.fromEntity(component);
    }

    public int count() {
        return lock.read(owners::size);
    }

    // ==================== VERSIONING SUPPORT (callers hold the lock) ====================

    /**
     * Detached copies of the page's draft in order.
     */
    List<PageComponent> snapshotDraft(Long pageId) {
        return drafts.getOrDefault(pageId, List.of()).stream()
                .map(PageComponent::copy)
                .toList();
    }

    /**
     * Replace the page's draft with copies of {@code components}, keeping their ids.
     */
    void replaceDraft(Long pageId, List<PageComponent> components) {
        List<PageComponent> previous = drafts.remove(pageId);
        if (previous != null) {
            previous.forEach(component -> owners.remove(component.getId()));
        }
        List<PageComponent> restored = new ArrayList<>(components.size());
        for (PageComponent component : components) {
            PageComponent copy = component.copy();
            restored.add(copy);
            owners.put(copy.getId(), pageId);
        }
        renumber(restored);
        drafts.put(pageId, restored);
    }

    @Override
    public void onPagesRemoved(Collection<Long> pageIds) {
        int removed = 0;
        for (Long pageId : pageIds) {
            List<PageComponent> draft = drafts.remove(pageId);
            if (draft != null) {
                draft.forEach(component -> owners.remove(component.getId()));
                removed += draft.size();
            }
        }
        log.debug("Dropped {} draft components of {} removed pages", removed, pageIds.size());
    }

    // ==================== INTERNALS ====================

    private PageComponent require(Long componentId) {
        Long pageId = componentId == null ? null : owners.get(componentId);
        if (pageId == null) {
            throw new ResourceNotFoundException("Component", "id", componentId);
        }
        for (PageComponent component : drafts.get(pageId)) {
            if (component.getId().equals(componentId)) {
                return component;
            }
        }
        throw new IllegalStateException("Component index out of sync for " + componentId);
    }

    private static void renumber(List<PageComponent> draft) {
        for (int i = 0; i < draft.size(); i++) {
            draft.get(i).setPosition(i);
        }
    }

    private static int clamp(Integer position, int size) {
        if (position == null) {
            return size;
        }
        return Math.max(0, Math.min(position, size));
    }

    private static ComponentType resolveType(String componentType) {
        if (componentType == null) {
            return ComponentType.MARKDOWN;
        }
        return ComponentType.fromValue(componentType)
                .orElseThrow(() -> new ValidationException("Unknown component type: " + componentType));
    }

    private static void validateTemplate(String template) {
        if (template != null && template.isBlank()) {
            throw new ValidationException("Template must not be blank");
        }
    }
}
