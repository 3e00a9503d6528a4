package dev.pagecraft.controller;

import dev.pagecraft.dto.ComponentMoveRequest;
import dev.pagecraft.dto.ComponentRequest;
import dev.pagecraft.dto.ComponentResponse;
import dev.pagecraft.dto.ComponentUpdateRequest;
import dev.pagecraft.exception.ValidationException;
import dev.pagecraft.service.ComponentStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.stream.Stream;

@RestController
@RequestMapping("/api/v1/admin/components")
@RequiredArgsConstructor
@Tag(name = "Admin - Components", description = "Draft component management")
@Slf4j
public class AdminComponentController {

    private final ComponentStore componentStore;

    @PostMapping
    @Operation(summary = "Create component", description = "Add a component to a page draft")
    public Mono<ResponseEntity<ComponentResponse>> createComponent(@Valid @RequestBody ComponentRequest request) {
        log.info("Creating {} component on page={}", request.getComponentType(), request.getPageId());
        return Mono.fromCallable(() -> componentStore.create(request.getPageId(), request.getBody(),
                        request.getTitle(), request.getTemplate(), request.getComponentType(), request.getPosition()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(component -> ResponseEntity.status(HttpStatus.CREATED).body(component));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get component by ID")
    public Mono<ComponentResponse> getComponent(@PathVariable Long id) {
        log.debug("Fetching component id={}", id);
        return Mono.fromCallable(() -> componentStore.get(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update component", description = "Omitted fields are kept")
    public Mono<ComponentResponse> updateComponent(@PathVariable Long id,
                                                   @Valid @RequestBody ComponentUpdateRequest request) {
        log.info("Updating component id={}", id);
        return Mono.fromCallable(() -> componentStore.update(id, request.getTitle(), request.getBody(),
                request.getTemplate()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete component")
    public Mono<ResponseEntity<Void>> deleteComponent(@PathVariable Long id) {
        log.info("Deleting component id={}", id);
        return Mono.fromRunnable(() -> componentStore.delete(id))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @PostMapping("/{id}/move")
    @Operation(summary = "Reorder component",
            description = "Move to a position, or before or after another component of the same page")
    public Mono<ComponentResponse> moveComponent(@PathVariable Long id, @RequestBody ComponentMoveRequest request) {
        long targets = Stream.of(request.getPosition(), request.getBeforeComponentId(), request.getAfterComponentId())
                .filter(Objects::nonNull)
                .count();
        if (targets != 1) {
            return Mono.error(new ValidationException(
                    "Exactly one of position, before_component_id or after_component_id is required"));
        }
        log.info("Moving component id={}", id);
        return Mono.fromCallable(() -> {
            if (request.getBeforeComponentId() != null) {
                return componentStore.moveBefore(id, request.getBeforeComponentId());
            }
            if (request.getAfterComponentId() != null) {
                return componentStore.moveAfter(id, request.getAfterComponentId());
            }
            return componentStore.move(id, request.getPosition());
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
