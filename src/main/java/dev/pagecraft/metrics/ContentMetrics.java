package dev.pagecraft.metrics;

import dev.pagecraft.service.ComponentStore;
import dev.pagecraft.service.PageTree;
import dev.pagecraft.service.VersionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ContentMetrics {

    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry meterRegistry;
    private final PageTree pageTree;
    private final ComponentStore componentStore;
    private final VersionManager versionManager;

    private Counter pagesCreatedCounter;
    private Counter pagesDeletedCounter;
    private Counter pagesMovedCounter;
    private Counter draftsPublishedCounter;
    private Counter draftsDiscardedCounter;

    @PostConstruct
    public void init() {
        // Gauges read the engine on scrape, no refresh job needed
        Gauge.builder("cms.pages.total", pageTree, tree -> tree.count())
                .description("Total number of pages including the root")
                .register(meterRegistry);

        Gauge.builder("cms.components.draft.total", componentStore, store -> store.count())
                .description("Number of draft components across all pages")
                .register(meterRegistry);

        Gauge.builder("cms.pages.published", versionManager, versions -> versions.publishedCount())
                .description("Number of pages with a published snapshot")
                .tag("status", "published")
                .register(meterRegistry);

        pagesCreatedCounter = meterRegistry.counter("cms.pages.created");
        pagesDeletedCounter = meterRegistry.counter("cms.pages.deleted");
        pagesMovedCounter = meterRegistry.counter("cms.pages.moved");
        draftsPublishedCounter = meterRegistry.counter("cms.drafts.published");
        draftsDiscardedCounter = meterRegistry.counter("cms.drafts.discarded");
        log.debug("Content metrics registered");
    }

    public void incrementPageCreated() {
        pagesCreatedCounter.increment();
    }

    /**
     * @param removedPages size of the removed subtree, the page itself included
     */
    public void incrementPagesDeleted(int removedPages) {
        pagesDeletedCounter.increment(removedPages);
    }

    public void incrementPageMoved() {
        pagesMovedCounter.increment();
    }

    public void incrementDraftPublished() {
        draftsPublishedCounter.increment();
    }

    public void incrementDraftDiscarded() {
        draftsDiscardedCounter.increment();
    }

    /**
     * Count one named operation call; {@code outcome} is {@value #OUTCOME_SUCCESS}
     * or the error kind code.
     */
    public void recordOperation(String operation, String outcome) {
        meterRegistry.counter("cms.operations", "operation", operation, "outcome", outcome).increment();
    }
}
