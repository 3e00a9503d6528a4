package dev.pagecraft.service;

import dev.pagecraft.dto.PageResponse;
import dev.pagecraft.dto.PageTreeNode;
import dev.pagecraft.entity.Page;
import dev.pagecraft.exception.CycleDetectedException;
import dev.pagecraft.exception.InvalidOperationException;
import dev.pagecraft.exception.ResourceNotFoundException;
import dev.pagecraft.exception.SlugConflictException;
import dev.pagecraft.exception.ValidationException;
import dev.pagecraft.util.SlugGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the page hierarchy: an arena of pages indexed by id, each non-root page
 * carrying its parent id, plus an ordered list of child ids per page.
 *
 * <p>Invariants kept under the {@link ContentLock}:</p>
 * <ul>
 *   <li>exactly one page has no parent, and it can be neither moved nor deleted;</li>
 *   <li>no page is its own ancestor;</li>
 *   <li>slugs are unique among the children of a parent;</li>
 *   <li>sibling positions form a dense 0-based sequence.</li>
 * </ul>
 *
 * <p>Materialized paths are derived on every read from the current ancestry,
 * so a move never leaves stale paths behind in the moved subtree.</p>
 */
@Slf4j
public class PageTree {

    private final ContentLock lock;
    private final IdService idService;

    private final Map<Long, Page> pages = new HashMap<>();
    private final Map<Long, List<Long>> children = new HashMap<>();
    private final List<PageRemovalListener> removalListeners = new CopyOnWriteArrayList<>();

    private final Long rootId;

    public PageTree(ContentLock lock, IdService idService, String rootTitle, String rootSlug, String rootTemplate) {
        this.lock = lock;
        this.idService = idService;

        LocalDateTime now = LocalDateTime.now();
        Page root = Page.builder()
                .id(idService.nextId())
                .slug(SlugGenerator.generate(rootTitle, rootSlug, Set.of()))
                .title(rootTitle)
                .template(templateOrDefault(rootTemplate))
                .position(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        pages.put(root.getId(), root);
        children.put(root.getId(), new ArrayList<>());
        this.rootId = root.getId();
        log.info("Page tree initialized with root page {} (slug={})", rootId, root.getSlug());
    }

    public void addRemovalListener(PageRemovalListener listener) {
        removalListeners.add(listener);
    }

    public Long getRootId() {
        return rootId;
    }

    // ==================== READS ====================

    public PageResponse get(Long pageId) {
        return lock.read(() -> toResponse(require(pageId)));
    }

    /**
     * Resolve a root-relative path such as {@code /about/team}. Leading and
     * trailing slashes are ignored; {@code /} and the empty path denote the root.
     */
    public PageResponse getByPath(String path) {
        if (path == null) {
            throw new ValidationException("Path is required");
        }
        String trimmed = path.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '/') {
            start++;
        }
        while (end > start && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        String relative = trimmed.substring(start, end);
        String[] segments = relative.isEmpty() ? new String[0] : relative.split("/", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new ValidationException("Path contains an empty segment: " + path);
            }
        }

        return lock.read(() -> {
            Page current = pages.get(rootId);
            for (String segment : segments) {
                current = findChildBySlug(current.getId(), segment);
                if (current == null) {
                    throw new ResourceNotFoundException("Page not found at path: " + path);
                }
            }
            return toResponse(current);
        });
    }

    public List<PageResponse> children(Long pageId) {
        return lock.read(() -> {
            require(pageId);
            return children.get(pageId).stream()
                    .map(pages::get)
                    .map(this::toResponse)
                    .toList();
        });
    }

    /**
     * The whole hierarchy from the root, children in sibling order.
     */
    public PageTreeNode listTree() {
        return lock.read(() -> buildNode(rootId));
    }

    public boolean exists(Long pageId) {
        return lock.read(() -> pageId != null && pages.containsKey(pageId));
    }

    /**
     * @throws ResourceNotFoundException if the page does not exist
     */
    public void requireExists(Long pageId) {
        lock.read(() -> require(pageId));
    }

    public int count() {
        return lock.read(pages::size);
    }

    // ==================== MUTATIONS ====================

    /**
     * Create a page under {@code parentId}. A slug derived from the title is
     * made unique among the parent's current children; an explicit slug is only
     * sanitized and must not already be taken by a sibling.
     *
     * @throws SlugConflictException if a sibling already uses the explicit slug

     * @param position insert index, clamped into {@code [0, siblingCount]}; null appends
     */
    public PageResponse create(Long parentId, String title, String explicitSlug, String template, Integer position) {
        if (title == null) {
            throw new ValidationException("Title is required");
        }
        validateTemplate(template);

        return lock.write(() -> {
            Page parent = requireParent(parentId);
            List<Long> siblings = children.get(parent.getId());

            String slug;
            if (explicitSlug != null && !explicitSlug.isBlank()) {
                slug = SlugGenerator.sanitize(explicitSlug);
                if (findChildBySlug(parent.getId(), slug) != null) {
                    throw new SlugConflictException(slug, parent.getId());
                }
            } else {
                slug = SlugGenerator.generate(title, null, siblingSlugs(parent.getId()));
            }
            LocalDateTime now = LocalDateTime.now();
            Page page = Page.builder()
                    .id(idService.nextId())
                    .parentId(parent.getId())
                    .slug(slug)
                    .title(title)
                    .template(templateOrDefault(template))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            pages.put(page.getId(), page);
            children.put(page.getId(), new ArrayList<>());
            siblings.add(clamp(position, siblings.size()), page.getId());
            renumber(siblings);

            log.info("Page created: {} (slug={}, parent={})", page.getId(), slug, parent.getId());
            return toResponse(page);
        });
    }

    /**
     * Update title, template and, when {@code newSlug} is given, the slug. A
     * title change alone never touches the slug.
     */
    public PageResponse update(Long pageId, String title, String template, String newSlug) {
        if (template != null) {
            validateTemplate(template);
        }

        return lock.write(() -> {
            Page page = require(pageId);
            boolean changed = false;

            if (newSlug != null) {
                String slug = SlugGenerator.sanitize(newSlug);
                if (!slug.equals(page.getSlug())) {
                    if (!page.isRoot() && findChildBySlug(page.getParentId(), slug) != null) {
                        throw new SlugConflictException(slug, page.getParentId());
                    }
                    page.setSlug(slug);
                    changed = true;
                }
            }
            if (title != null && !title.equals(page.getTitle())) {
                page.setTitle(title);
                changed = true;
            }
            if (template != null && !template.equals(page.getTemplate())) {
                page.setTemplate(template);
                changed = true;
            }

            if (changed) {
                page.setUpdatedAt(LocalDateTime.now());
                log.info("Page updated: {} (slug={})", page.getId(), page.getSlug());
            }
            return toResponse(page);
        });
    }

    /**
     * Re-parent a page with its whole subtree. Moving within the same parent
     * reorders it.
     *
     * @param position insert index among the new siblings (the page itself not
     *                 counted), clamped into range; null appends
     */
    public PageResponse move(Long pageId, Long newParentId, Integer position) {
        return lock.write(() -> {
            Page page = require(pageId);
            if (page.isRoot()) {
                throw new InvalidOperationException("The root page cannot be moved");
            }
            Page newParent = requireParent(newParentId);
            if (isSelfOrDescendant(newParent.getId(), page.getId())) {
                throw new CycleDetectedException(pageId, newParentId);
            }
            Page clash = findChildBySlug(newParent.getId(), page.getSlug());
            if (clash != null && !clash.getId().equals(page.getId())) {
                throw new SlugConflictException(page.getSlug(), newParent.getId());
            }

            Long oldParentId = page.getParentId();
            List<Long> oldSiblings = children.get(oldParentId);
            oldSiblings.remove(page.getId());
            renumber(oldSiblings);

            List<Long> newSiblings = children.get(newParent.getId());
            newSiblings.add(clamp(position, newSiblings.size()), page.getId());
            page.setParentId(newParent.getId());
            page.setUpdatedAt(LocalDateTime.now());
            renumber(newSiblings);

            log.info("Page moved: {} from parent {} to parent {} at position {}",
                    page.getId(), oldParentId, newParent.getId(), page.getPosition());
            return toResponse(page);
        });
    }

    /**
     * Delete a page and its entire subtree. Registered {@link PageRemovalListener}s
     * drop the content of every removed page before the write lock is released.
     *
     * @return ids of all removed pages, the requested page first
     */
    public List<Long> delete(Long pageId) {
        return lock.write(() -> {
            Page page = require(pageId);
            if (page.isRoot()) {
                throw new InvalidOperationException("The root page cannot be deleted");
            }

            List<Long> removed = collectSubtree(page.getId());

            List<Long> siblings = children.get(page.getParentId());
            siblings.remove(page.getId());
            renumber(siblings);
            for (Long id : removed) {
                pages.remove(id);
                children.remove(id);
            }

            List<Long> removedView = Collections.unmodifiableList(removed);
            removalListeners.forEach(listener -> listener.onPagesRemoved(removedView));

            log.info("Page deleted: {} (slug={}, {} pages removed)", page.getId(), page.getSlug(), removed.size());
            return removedView;
        });
    }

    // ==================== INTERNALS (callers hold the lock) ====================

    private Page require(Long pageId) {
        Page page = pageId == null ? null : pages.get(pageId);
        if (page == null) {
            throw new ResourceNotFoundException("Page", "id", pageId);
        }
        return page;
    }

    private Page requireParent(Long parentId) {
        Page parent = parentId == null ? null : pages.get(parentId);
        if (parent == null) {
            throw new ResourceNotFoundException("Parent page", "id", parentId);
        }
        return parent;
    }

    private Page findChildBySlug(Long parentId, String slug) {
        for (Long childId : children.get(parentId)) {
            Page child = pages.get(childId);
            if (child.getSlug().equals(slug)) {
                return child;
            }
        }
        return null;
    }

    private Set<String> siblingSlugs(Long parentId) {
        Set<String> slugs = new HashSet<>();
        for (Long childId : children.get(parentId)) {
            slugs.add(pages.get(childId).getSlug());
        }
        return slugs;
    }

    /**
     * Walk from {@code candidateId} up to the root; true if {@code ancestorId} is met.
     */
    private boolean isSelfOrDescendant(Long candidateId, Long ancestorId) {
        Long current = candidateId;
        while (current != null) {
            if (current.equals(ancestorId)) {
                return true;
            }
            current = pages.get(current).getParentId();
        }
        return false;
    }

    private List<Long> collectSubtree(Long pageId) {
        List<Long> collected = new ArrayList<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.push(pageId);
        while (!pending.isEmpty()) {
            Long id = pending.pop();
            collected.add(id);
            List<Long> childIds = children.get(id);
            for (int i = childIds.size() - 1; i >= 0; i--) {
                pending.push(childIds.get(i));
            }
        }
        return collected;
    }

    private void renumber(List<Long> siblings) {
        for (int i = 0; i < siblings.size(); i++) {
            pages.get(siblings.get(i)).setPosition(i);
        }
    }

    private String pathOf(Page page) {
        if (page.isRoot()) {
            return "/";
        }
        Deque<String> segments = new ArrayDeque<>();
        Page current = page;
        while (!current.isRoot()) {
            segments.addFirst(current.getSlug());
            current = pages.get(current.getParentId());
        }
        return "/" + String.join("/", segments);
    }

    private PageTreeNode buildNode(Long pageId) {
        List<PageTreeNode> childNodes = new ArrayList<>();
        for (Long childId : children.get(pageId)) {
            childNodes.add(buildNode(childId));
        }
        return PageTreeNode.builder()
                .page(toResponse(pages.get(pageId)))
                .children(childNodes)
                .build();
    }

    private PageResponse toResponse(Page page) {
        return PageResponse.builder()
                .id(String.valueOf(page.getId()))
                .parentId(page.getParentId() != null ? String.valueOf(page.getParentId()) : null)
                .slug(page.getSlug())
                .title(page.getTitle())
                .template(page.getTemplate())
                .position(page.getPosition())
                .path(pathOf(page))
                .hasChildren(!children.get(page.getId()).isEmpty())
                .createdAt(page.getCreatedAt())
                .updatedAt(page.getUpdatedAt())
                .build();
    }

    private static int clamp(Integer position, int size) {
        if (position == null) {
            return size;
        }
        return Math.max(0, Math.min(position, size));
    }

    private static void validateTemplate(String template) {
        if (template != null && template.isBlank()) {
            throw new ValidationException("Template must not be blank");
        }
    }

    private static String templateOrDefault(String template) {
        return template == null ? Page.DEFAULT_TEMPLATE : template;
    }
}
