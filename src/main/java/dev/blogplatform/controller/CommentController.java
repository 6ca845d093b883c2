package dev.blogplatform.controller;

import dev.blogplatform.dto.CommentRequest;
import dev.blogplatform.dto.CommentResponse;
import dev.blogplatform.dto.CommentUpdateRequest;
import dev.blogplatform.security.AuthenticatedUser;
import dev.blogplatform.service.CommentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
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
@RequestMapping("/api/v1/comments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Comments", description = "Post comments")
public class CommentController {

    private final CommentService commentService;

    @PostMapping("/post/{postId}")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Comment on a post", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<CommentResponse> createComment(@AuthenticationPrincipal AuthenticatedUser principal,
                                               @PathVariable Long postId,
                                               @Valid @RequestBody CommentRequest request) {
        return commentService.createComment(postId, request, principal.userId());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get comment by ID")
    public Mono<CommentResponse> getComment(@PathVariable Long id) {
        return commentService.getCommentById(id);
    }

    @GetMapping("/post/{postId}")
    @Operation(summary = "List approved comments of a post")
    public Mono<List<CommentResponse>> getCommentsForPost(
            @PathVariable Long postId,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        return commentService.getCommentsForPost(postId, skip, limit);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit a comment", description = "Author only", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<CommentResponse> updateComment(@AuthenticationPrincipal AuthenticatedUser principal,
                                               @PathVariable Long id,
                                               @Valid @RequestBody CommentUpdateRequest request) {
        return commentService.updateComment(id, request, principal.userId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a comment", description = "Author only; soft delete", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<Void> deleteComment(@AuthenticationPrincipal AuthenticatedUser principal, @PathVariable Long id) {
        return commentService.deleteComment(id, principal.userId());
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve a comment", description = "Author of the post only", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<CommentResponse> approveComment(@AuthenticationPrincipal AuthenticatedUser principal,
                                                @PathVariable Long id) {
        return commentService.approveComment(id, principal.userId());
    }
}
