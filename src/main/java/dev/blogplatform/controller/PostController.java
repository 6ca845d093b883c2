package dev.blogplatform.controller;

import dev.blogplatform.dto.PostRequest;
import dev.blogplatform.dto.PostResponse;
import dev.blogplatform.dto.PostUpdateRequest;
import dev.blogplatform.security.AuthenticatedUser;
import dev.blogplatform.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Posts", description = "Blog posts")
@Slf4j
public class PostController {

    private final PostService postService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a post", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<PostResponse> createPost(@AuthenticationPrincipal AuthenticatedUser principal,
                                         @Valid @RequestBody PostRequest request) {
        return postService.createPost(request, principal.userId());
    }

    @GetMapping
    @Operation(summary = "List published posts", description = "Newest first, optionally filtered by category and/or tag")
    public Mono<List<PostResponse>> getPosts(
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @Parameter(description = "Category ID filter") @RequestParam(name = "category_id", required = false) Long categoryId,
            @Parameter(description = "Tag ID filter") @RequestParam(name = "tag_id", required = false) Long tagId) {
        log.debug("Fetching posts skip={}, limit={}, category={}, tag={}", skip, limit, categoryId, tagId);
        return postService.getPosts(skip, limit, categoryId, tagId);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get post by ID", description = "Counts a view")
    public Mono<PostResponse> getPost(@PathVariable Long id) {
        return postService.getPostById(id);
    }

    @GetMapping("/slug/{slug}")
    @Operation(summary = "Get post by slug", description = "Counts a view")
    public Mono<PostResponse> getPostBySlug(@PathVariable String slug) {
        return postService.getPostBySlug(slug);
    }

    @GetMapping("/search/{query}")
    @Operation(summary = "Search published posts", description = "Case-insensitive match on title, content and excerpt")
    public Mono<List<PostResponse>> searchPosts(
            @PathVariable @Size(min = 1, max = 200) String query,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return postService.searchPosts(query, skip, limit);
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "List a user's posts")
    public Mono<List<PostResponse>> getPostsByUser(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return postService.getPostsByUser(userId, skip, limit);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a post", description = "Author only", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<PostResponse> updatePost(@AuthenticationPrincipal AuthenticatedUser principal,
                                         @PathVariable Long id,
                                         @Valid @RequestBody PostUpdateRequest request) {
        return postService.updatePost(id, request, principal.userId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a post", description = "Author only; soft delete", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<Void> deletePost(@AuthenticationPrincipal AuthenticatedUser principal, @PathVariable Long id) {
        return postService.deletePost(id, principal.userId());
    }
}
