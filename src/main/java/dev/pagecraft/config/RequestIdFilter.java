package dev.pagecraft.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every exchange with a request id, taken from {@code X-Request-ID} when
 * the caller sends a well-formed one, and echoes it on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String external = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = sanitizeId(external);
        if (requestId == null) {
            if (external != null && !external.isBlank()) {
                log.warn("Rejected malformed external request id");
            }
            requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }

        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        log.debug("{} {} [{}]", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), requestId);
        return chain.filter(exchange)
                .contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, requestId));
    }

    static String sanitizeId(String value) {
        if (value == null || value.isBlank() || value.length() > MAX_ID_LENGTH) {
            return null;
        }
        return VALID_ID_PATTERN.matcher(value).matches() ? value : null;
    }
}
