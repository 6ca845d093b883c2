package dev.blogplatform.controller;

import dev.blogplatform.dto.TagRequest;
import dev.blogplatform.dto.TagResponse;
import dev.blogplatform.security.AuthenticatedUser;
import dev.blogplatform.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tags")
@RequiredArgsConstructor
@Validated
@io.swagger.v3.oas.annotations.tags.Tag(name = "Tags", description = "Post tags")
@Slf4j
public class TagController {

    private final TagService tagService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a tag", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<TagResponse> createTag(@AuthenticationPrincipal AuthenticatedUser principal,
                                       @Valid @RequestBody TagRequest request) {
        return tagService.createTag(request, principal.userId());
    }

    @GetMapping
    @Operation(summary = "List tags")
    public Mono<List<TagResponse>> getTags(
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") @Min(0) int skip,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        log.debug("Fetching tags skip={}, limit={}", skip, limit);
        return tagService.getTags(skip, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get tag by ID")
    public Mono<TagResponse> getTag(@Parameter(description = "Tag ID", required = true) @PathVariable Long id) {
        return tagService.getTagById(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a tag", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<Void> deleteTag(@AuthenticationPrincipal AuthenticatedUser principal, @PathVariable Long id) {
        return tagService.deleteTag(id, principal.userId());
    }
}
