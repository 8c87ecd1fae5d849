/**
 * REST endpoints for resolving titles to canonical URLs.
 */
package net.findmymedia.controller;

import lombok.extern.slf4j.Slf4j;
import net.findmymedia.controller.dto.ResolvedEntityDto;
import net.findmymedia.model.EntityType;
import net.findmymedia.service.EntityResolutionOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/resolve")
@Slf4j
public class EntityResolutionController {

    private final EntityResolutionOrchestrator orchestrator;

    public EntityResolutionController(EntityResolutionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Resolves a title of any supported type.
     *
     * @param query title to resolve
     * @param type entity type wire name, e.g. {@code movie} or {@code physical_game}
     * @return the resolved entity; 404 when unresolved, 400 for a blank query or unknown type
     */
    @GetMapping
    public Mono<ResolvedEntityDto> resolve(@RequestParam String query, @RequestParam String type) {
        if (!StringUtils.hasText(query)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query must not be blank");
        }
        EntityType entityType = EntityType.fromValue(type)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Invalid type parameter: Supported values: " + supportedTypes()));
        return orchestrator.resolveEntity(query, entityType)
            .map(ResolvedEntityDto::from)
            .switchIfEmpty(Mono.error(() -> notResolved(query, entityType)));
    }

    /**
     * Resolves a book, optionally narrowed by author.
     */
    @GetMapping("/book")
    public Mono<ResolvedEntityDto> resolveBook(@RequestParam String title,
                                               @RequestParam(required = false) String author) {
        if (!StringUtils.hasText(title)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "title must not be blank");
        }
        return orchestrator.resolveBook(title, author)
            .map(ResolvedEntityDto::from)
            .switchIfEmpty(Mono.error(() -> notResolved(title, EntityType.BOOK)));
    }

    private static ResponseStatusException notResolved(String query, EntityType type) {
        log.debug("No entity resolved for '{}' ({})", query, type.getWireName());
        return new ResponseStatusException(HttpStatus.NOT_FOUND,
            "No " + type.getWireName() + " found for '" + query.trim() + "'");
    }

    private static String supportedTypes() {
        return Arrays.stream(EntityType.values())
            .map(EntityType::getWireName)
            .collect(Collectors.joining(", "));
    }
}
