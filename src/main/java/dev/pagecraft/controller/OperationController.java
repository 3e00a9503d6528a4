package dev.pagecraft.controller;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pagecraft.dto.OperationResponse;
import dev.pagecraft.service.OperationDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Set;

/**
 * Named-operation endpoint. Engine errors come back inside the envelope with
 * HTTP 200; only malformed requests and unexpected failures use error statuses.
 */
@RestController
@RequestMapping("/api/v1/operations")
@RequiredArgsConstructor
@Tag(name = "Operations", description = "Invoke engine operations by name")
@Slf4j
public class OperationController {

    private final OperationDispatcher dispatcher;

    @GetMapping
    @Operation(summary = "List operations")
    public Mono<Set<String>> listOperations() {
        return Mono.just(dispatcher.operations());
    }

    @PostMapping("/{operation}")
    @Operation(summary = "Invoke operation", description = "Arguments are passed as a JSON object")
    public Mono<OperationResponse> invoke(
            @Parameter(description = "Operation name, e.g. create_page")
            @PathVariable String operation,
            @RequestBody(required = false) JsonNode arguments) {
        log.debug("Invoking operation {}", operation);
        return Mono.fromCallable(() -> dispatcher.dispatch(operation, arguments))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
