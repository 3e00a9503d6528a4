package dev.pagecraft.config;

import dev.pagecraft.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Id generator for pages and components.
 *
 * <p>The node id comes from {@code app.snowflake.node-id} (or the
 * {@code SNOWFLAKE_NODE_ID} environment variable through relaxed binding);
 * without it, the low 10 bits of the hostname hash are used.</p>
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Snowflake id generator using node id {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            return configuredNodeId;
        }
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            long nodeId = hostname.hashCode() & SnowflakeId.MAX_NODE_ID;
            log.debug("Derived node id {} from hostname '{}'", nodeId, hostname);
            return nodeId;
        } catch (UnknownHostException e) {
            log.warn("Could not resolve hostname, using node id 0: {}", e.getMessage());
            return 0;
        }
    }
}
