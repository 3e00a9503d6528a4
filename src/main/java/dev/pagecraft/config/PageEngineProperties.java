package dev.pagecraft.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the page tree created at startup.
 *
 * @param rootTitle    title of the root page
 * @param rootSlug     slug of the root page; sanitized like any other slug
 * @param rootTemplate template of the root page
 */
@ConfigurationProperties(prefix = "app.pages")
public record PageEngineProperties(
        @DefaultValue("Home") String rootTitle,
        @DefaultValue("home") String rootSlug,
        @DefaultValue("default") String rootTemplate
) {
}
