package dev.pagecraft.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagecraft.dto.ComponentResponse;
import dev.pagecraft.dto.MessageResponse;
import dev.pagecraft.dto.OperationResponse;
import dev.pagecraft.dto.PageResponse;
import dev.pagecraft.dto.PageTreeNode;
import dev.pagecraft.dto.VersionStatusResponse;
import dev.pagecraft.exception.ErrorKind;
import dev.pagecraft.metrics.ContentMetrics;
import dev.pagecraft.util.SnowflakeId;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OperationDispatcher")
class OperationDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SimpleMeterRegistry meterRegistry;
    private PageTree tree;
    private OperationDispatcher dispatcher;
    private String rootId;

    @BeforeEach
    void setUp() {
        ContentLock lock = new ContentLock();
        IdService idService = new IdService(new SnowflakeId(1));
        tree = new PageTree(lock, idService, "Home", "home", "default");
        ComponentStore store = new ComponentStore(lock, tree, idService);
        VersionManager versions = new VersionManager(lock, tree, store);
        tree.addRemovalListener(store);
        tree.addRemovalListener(versions);

        meterRegistry = new SimpleMeterRegistry();
        ContentMetrics metrics = new ContentMetrics(meterRegistry, tree, store, versions);
        metrics.init();
        dispatcher = new OperationDispatcher(tree, store, versions, idService, metrics);
        rootId = String.valueOf(tree.getRootId());
    }

    private OperationResponse call(String operation, Map<String, Object> arguments) {
        return dispatcher.dispatch(operation, objectMapper.valueToTree(arguments));
    }

    private String createPage(String parentId, String title) {
        OperationResponse response = call("create_page", Map.of("parent_page_id", parentId, "title", title));
        assertThat(response.isSuccess()).isTrue();
        return ((PageResponse) response.getResult()).getId();
    }

    private String createComponent(String pageId, String body) {
        OperationResponse response = call("create_component", Map.of("page_id", pageId, "body", body));
        assertThat(response.isSuccess()).isTrue();
        return ((ComponentResponse) response.getResult()).getId();
    }

    @Test
    @DisplayName("should expose every operation name")
    void shouldExposeOperations() {
        assertThat(dispatcher.operations()).contains(
                "create_page", "update_page", "move_page", "delete_page", "get_page", "get_page_by_path",
                "list_pages", "create_component", "update_component", "delete_component", "list_components",
                "get_component", "get_draft_content", "get_published_content", "publish_draft", "discard_draft",
                "move_component", "move_component_before", "move_component_after", "get_version_status");
    }

    @Nested
    @DisplayName("Pages")
    class Pages {

        @Test
        @DisplayName("should create and resolve pages by id and path")
        void shouldCreateAndResolve() {
            String about = createPage(rootId, "About Us");
            createPage(about, "Team");

            OperationResponse byId = call("get_page", Map.of("page_id", about));
            OperationResponse byPath = call("get_page_by_path", Map.of("path", "/about-us/team"));

            assertThat(((PageResponse) byId.getResult()).getPath()).isEqualTo("/about-us");
            assertThat(((PageResponse) byPath.getResult()).getTitle()).isEqualTo("Team");
        }

        @Test
        @DisplayName("should accept numeric ids as well as decimal strings")
        void shouldAcceptNumericIds() {
            String page = createPage(rootId, "Numeric");

            OperationResponse response = call("get_page", Map.of("page_id", Long.parseLong(page)));

            assertThat(response.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should pass optional slug, template and position through")
        void shouldPassOptionalArguments() {
            createPage(rootId, "First");
            OperationResponse response = call("create_page", Map.of(
                    "parent_page_id", rootId, "title", "Second", "slug", "Custom Slug",
                    "template", "landing", "position", 0));

            PageResponse page = (PageResponse) response.getResult();
            assertThat(page.getSlug()).isEqualTo("custom-slug");
            assertThat(page.getTemplate()).isEqualTo("landing");
            assertThat(page.getPosition()).isZero();
        }

        @Test
        @DisplayName("should move, rename and delete pages")
        void shouldMoveRenameAndDelete() {
            String a = createPage(rootId, "A");
            String b = createPage(rootId, "B");
            createPage(a, "Leaf");

            OperationResponse moved = call("move_page", Map.of("page_id", a, "new_parent_id", b));
            OperationResponse renamed = call("update_page", Map.of("page_id", b, "slug", "bee"));
            OperationResponse leaf = call("get_page_by_path", Map.of("path", "bee/a/leaf"));
            OperationResponse deleted = call("delete_page", Map.of("page_id", b));

            assertThat(moved.isSuccess()).isTrue();
            assertThat(((PageResponse) renamed.getResult()).getPath()).isEqualTo("/bee");
            assertThat(leaf.isSuccess()).isTrue();
            assertThat(((MessageResponse) deleted.getResult()).getMessage()).contains("2 descendants");
            assertThat(tree.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should list the tree")
        void shouldListTree() {
            createPage(rootId, "Only Child");

            PageTreeNode root = (PageTreeNode) call("list_pages", Map.of()).getResult();

            assertThat(root.getChildren()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Content")
    class Content {

        @Test
        @DisplayName("should publish and discard drafts")
        void shouldPublishAndDiscard() {
            String page = createPage(rootId, "Landing");
            String component = createComponent(page, "hello");

            OperationResponse published = call("publish_draft", Map.of("page_id", page));
            call("update_component", Map.of("component_id", component, "body", "changed"));
            VersionStatusResponse dirty = (VersionStatusResponse) call("get_version_status", Map.of("page_id", page)).getResult();
            call("discard_draft", Map.of("page_id", page));

            @SuppressWarnings("unchecked")
            List<ComponentResponse> draft = (List<ComponentResponse>) call("get_draft_content", Map.of("page_id", page)).getResult();
            @SuppressWarnings("unchecked")
            List<ComponentResponse> live = (List<ComponentResponse>) call("get_published_content", Map.of("page_id", page)).getResult();

            assertThat(((MessageResponse) published.getResult()).getMessage()).contains("version 1");
            assertThat(dirty.isHasDraftChanges()).isTrue();
            assertThat(draft).extracting(ComponentResponse::getBody).containsExactly("hello");
            assertThat(live).extracting(ComponentResponse::getBody).containsExactly("hello");
        }

        @Test
        @DisplayName("should reorder components")
        void shouldReorderComponents() {
            String page = createPage(rootId, "Landing");
            String a = createComponent(page, "a");
            String b = createComponent(page, "b");
            String c = createComponent(page, "c");

            call("move_component", Map.of("component_id", c, "position", 0));
            call("move_component_after", Map.of("component_id", a, "target_component_id", b));
            call("move_component_before", Map.of("component_id", b, "target_component_id", c));

            @SuppressWarnings("unchecked")
            List<ComponentResponse> components = (List<ComponentResponse>) call("list_components", Map.of("page_id", page)).getResult();
            assertThat(components).extracting(ComponentResponse::getBody).containsExactly("b", "c", "a");
        }

        @Test
        @DisplayName("should get and delete a component")
        void shouldGetAndDeleteComponent() {
            String page = createPage(rootId, "Landing");
            String component = createComponent(page, "x");

            assertThat(call("get_component", Map.of("component_id", component)).isSuccess()).isTrue();
            assertThat(call("delete_component", Map.of("component_id", component)).isSuccess()).isTrue();
            assertThat(call("get_component", Map.of("component_id", component)).getError().getKind())
                    .isEqualTo(ErrorKind.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("should wrap engine errors in a failure envelope")
        void shouldWrapEngineErrors() {
            OperationResponse response = call("delete_page", Map.of("page_id", rootId));

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getResult()).isNull();
            assertThat(response.getError().getKind()).isEqualTo(ErrorKind.INVALID_OPERATION);
            assertThat(response.getOperation()).isEqualTo("delete_page");
        }

        @Test
        @DisplayName("should report a cycle")
        void shouldReportCycle() {
            String parent = createPage(rootId, "Parent");
            String child = createPage(parent, "Child");

            OperationResponse response = call("move_page", Map.of("page_id", parent, "new_parent_id", child));

            assertThat(response.getError().getKind()).isEqualTo(ErrorKind.CYCLE_DETECTED);
        }

        @Test
        @DisplayName("should report a slug conflict for a taken explicit slug")
        void shouldReportSlugConflict() {
            call("create_page", Map.of("parent_page_id", rootId, "title", "First Page", "slug", "duplicate"));

            OperationResponse response = call("create_page",
                    Map.of("parent_page_id", rootId, "title", "Second Page", "slug", "duplicate"));

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getError().getKind()).isEqualTo(ErrorKind.SLUG_CONFLICT);
            assertThat(response.getError().getMessage()).contains("duplicate");
            assertThat(tree.children(Long.valueOf(rootId))).hasSize(1);
        }

        @Test
        @DisplayName("should reject unknown operations, missing and malformed arguments")
        void shouldRejectBadRequests() {
            assertThat(call("explode", Map.of()).getError().getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(call("get_page", Map.of()).getError().getMessage()).contains("page_id");
            assertThat(call("get_page", Map.of("page_id", "abc")).getError().getKind())
                    .isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(call("create_page", Map.of("parent_page_id", rootId, "title", 5)).getError().getKind())
                    .isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(call("move_component", Map.of("component_id", "1", "position", "first")).getError().getKind())
                    .isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("should reject non-object arguments")
        void shouldRejectNonObjectArguments() {
            JsonNode array = objectMapper.createArrayNode().add(1);

            OperationResponse response = dispatcher.dispatch("list_pages", array);

            assertThat(response.getError().getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("should treat absent arguments as an empty object")
        void shouldAcceptNullArguments() {
            assertThat(dispatcher.dispatch("list_pages", null).isSuccess()).isTrue();
        }
    }

    @Test
    @DisplayName("should count operations by outcome")
    void shouldCountOperations() {
        createPage(rootId, "Counted");
        call("get_page", Map.of("page_id", "999"));

        assertThat(meterRegistry.get("cms.operations").tag("operation", "create_page").tag("outcome", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("cms.operations").tag("operation", "get_page").tag("outcome", "NotFound")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("cms.pages.created").counter().count()).isEqualTo(1.0);
    }
}
