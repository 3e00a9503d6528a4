package dev.pagecraft.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pagecraft.dto.MessageResponse;
import dev.pagecraft.dto.OperationResponse;
import dev.pagecraft.dto.PageResponse;
import dev.pagecraft.exception.PageEngineException;
import dev.pagecraft.exception.ValidationException;
import dev.pagecraft.metrics.ContentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Routes named operations with JSON arguments to the page engine and wraps the
 * outcome in an {@link OperationResponse}. Engine errors become failure
 * envelopes; anything else propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationDispatcher {

    private final PageTree pageTree;
    private final ComponentStore componentStore;
    private final VersionManager versionManager;
    private final IdService idService;
    private final ContentMetrics contentMetrics;

    private final Map<String, Function<OperationArguments, Object>> handlers = registerHandlers();

    private Map<String, Function<OperationArguments, Object>> registerHandlers() {
        Map<String, Function<OperationArguments, Object>> map = new LinkedHashMap<>();
        map.put("create_page", this::createPage);
        map.put("update_page", this::updatePage);
        map.put("move_page", this::movePage);
        map.put("delete_page", this::deletePage);
        map.put("get_page", args -> pageTree.get(args.requiredId("page_id")));
        map.put("get_page_by_path", args -> pageTree.getByPath(args.requiredString("path")));
        map.put("list_pages", args -> pageTree.listTree());

        map.put("create_component", this::createComponent);
        map.put("update_component", this::updateComponent);
        map.put("delete_component", this::deleteComponent);
        map.put("list_components", args -> componentStore.list(args.requiredId("page_id")));
        map.put("get_component", args -> componentStore.get(args.requiredId("component_id")));
        map.put("move_component", args -> componentStore.move(
                args.requiredId("component_id"), args.requiredInt("position")));
        map.put("move_component_before", args -> componentStore.moveBefore(
                args.requiredId("component_id"), args.requiredId("target_component_id")));
        map.put("move_component_after", args -> componentStore.moveAfter(
                args.requiredId("component_id"), args.requiredId("target_component_id")));

        map.put("get_draft_content", args -> versionManager.getDraft(args.requiredId("page_id")));
        map.put("get_published_content", args -> versionManager.getPublished(args.requiredId("page_id")));
        map.put("publish_draft", this::publishDraft);
        map.put("discard_draft", this::discardDraft);
        map.put("get_version_status", args -> versionManager.status(args.requiredId("page_id")));
        return Collections.unmodifiableMap(map);
    }

    public Set<String> operations() {
        return handlers.keySet();
    }

    public OperationResponse dispatch(String operation, JsonNode arguments) {
        try {
            Function<OperationArguments, Object> handler = handlers.get(operation);
            if (handler == null) {
                throw new ValidationException("Unknown operation: " + operation);
            }
            Object result = handler.apply(new OperationArguments(arguments, idService));
            contentMetrics.recordOperation(operation, ContentMetrics.OUTCOME_SUCCESS);
            log.debug("Operation {} succeeded", operation);
            return OperationResponse.success(operation, result);
        } catch (PageEngineException e) {
            contentMetrics.recordOperation(operation, e.getKind().getCode());
            log.warn("Operation {} rejected ({}): {}", operation, e.getKind().getCode(), e.getMessage());
            return OperationResponse.failure(operation, e);
        }
    }

    // ==================== PAGES ====================

    private PageResponse createPage(OperationArguments args) {
        PageResponse page = pageTree.create(
                args.requiredId("parent_page_id"),
                args.requiredString("title"),
                args.optionalString("slug"),
                args.optionalString("template"),
                args.optionalInt("position"));
        contentMetrics.incrementPageCreated();
        return page;
    }

    private PageResponse updatePage(OperationArguments args) {
        return pageTree.update(
                args.requiredId("page_id"),
                args.optionalString("title"),
                args.optionalString("template"),
                args.optionalString("slug"));
    }

    private PageResponse movePage(OperationArguments args) {
        PageResponse page = pageTree.move(
                args.requiredId("page_id"),
                args.requiredId("new_parent_id"),
                args.optionalInt("position"));
        contentMetrics.incrementPageMoved();
        return page;
    }

    private MessageResponse deletePage(OperationArguments args) {
        Long pageId = args.requiredId("page_id");
        List<Long> removed = pageTree.delete(pageId);
        contentMetrics.incrementPagesDeleted(removed.size());
        return MessageResponse.of("Deleted page " + pageId + " and " + (removed.size() - 1) + " descendants");
    }

    // ==================== COMPONENTS ====================

    private Object createComponent(OperationArguments args) {
        return componentStore.create(
                args.requiredId("page_id"),
                args.requiredString("body"),
                args.optionalString("title"),
                args.optionalString("template"),
                args.optionalString("component_type"),
                args.optionalInt("position"));
    }

    private Object updateComponent(OperationArguments args) {
        return componentStore.update(
                args.requiredId("component_id"),
                args.optionalString("title"),
                args.optionalString("body"),
                args.optionalString("template"));
    }

    private MessageResponse deleteComponent(OperationArguments args) {
        Long componentId = args.requiredId("component_id");
        componentStore.delete(componentId);
        return MessageResponse.of("Deleted component " + componentId);
    }

    // ==================== VERSIONS ====================

    private MessageResponse publishDraft(OperationArguments args) {
        Long pageId = args.requiredId("page_id");
        int version = versionManager.publish(pageId).getPublishedVersion();
        contentMetrics.incrementDraftPublished();
        return MessageResponse.of("Published page " + pageId + " as version " + version);
    }

    private MessageResponse discardDraft(OperationArguments args) {
        Long pageId = args.requiredId("page_id");
        versionManager.discardDraft(pageId);
        contentMetrics.incrementDraftDiscarded();
        return MessageResponse.of("Discarded draft of page " + pageId);
    }
}
