package dev.pagecraft.config;

import dev.pagecraft.service.ComponentStore;
import dev.pagecraft.service.ContentLock;
import dev.pagecraft.service.IdService;
import dev.pagecraft.service.PageTree;
import dev.pagecraft.service.VersionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory page engine. The three stores share one {@link ContentLock};
 * page deletion cascades into components and snapshots through removal listeners.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(PageEngineProperties.class)
@Slf4j
public class PageEngineConfig {

    @Bean
    public ContentLock contentLock() {
        return new ContentLock();
    }

    @Bean
    public PageTree pageTree(ContentLock contentLock, IdService idService, PageEngineProperties properties) {
        return new PageTree(contentLock, idService,
                properties.rootTitle(), properties.rootSlug(), properties.rootTemplate());
    }

    @Bean
    public ComponentStore componentStore(ContentLock contentLock, PageTree pageTree, IdService idService) {
        ComponentStore store = new ComponentStore(contentLock, pageTree, idService);
        pageTree.addRemovalListener(store);
        return store;
    }

    @Bean
    public VersionManager versionManager(ContentLock contentLock, PageTree pageTree, ComponentStore componentStore) {
        VersionManager versionManager = new VersionManager(contentLock, pageTree, componentStore);
        pageTree.addRemovalListener(versionManager);
        log.debug("Page engine wired (root page {})", pageTree.getRootId());
        return versionManager;
    }
}
