package dev.blogplatform.service;

import dev.blogplatform.dto.CommentRequest;
import dev.blogplatform.dto.CommentResponse;
import dev.blogplatform.dto.CommentUpdateRequest;
import dev.blogplatform.dto.UserResponse;
import dev.blogplatform.entity.Comment;
import dev.blogplatform.entity.Post;
import dev.blogplatform.entity.User;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.metrics.BlogMetrics;
import dev.blogplatform.repository.CommentRepository;
import dev.blogplatform.repository.PostRepository;
import dev.blogplatform.repository.UserRepository;
import dev.blogplatform.security.AuthorizationGuard;
import dev.blogplatform.security.OwnershipPolicy;
import dev.blogplatform.util.IdParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Comments start unapproved; only approved ones are listed under a post.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    static final OwnershipPolicy<Comment> OWNERSHIP = OwnershipPolicy.authoredBy(Comment::getAuthorId);
    static final OwnershipPolicy<Post> POST_AUTHOR = OwnershipPolicy.authoredBy(Post::getAuthorId);

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final UserRepository userRepository;
    private final AuthorizationGuard authorizationGuard;
    private final IdService idService;
    private final BlogMetrics blogMetrics;

    @Transactional
    public Mono<CommentResponse> createComment(Long postId, CommentRequest request, Long authorId) {
        Long parentId = IdParser.parseNullable(request.parentCommentId(), "parent_comment_id");

        return authorizationGuard.resolveIdentity(authorId)
                .flatMap(author -> postRepository.findActiveById(postId))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", postId)))
                .flatMap(post -> requireParent(parentId, postId))
                .flatMap(ignored -> {
                    Comment comment = Comment.builder()
                            .id(idService.nextId())
                            .content(request.content())
                            .postId(postId)
                            .authorId(authorId)
                            .parentCommentId(parentId)
                            .build();
                    comment.stampCreated(authorId, LocalDateTime.now());
                    return commentRepository.save(comment);
                })
                .doOnSuccess(comment -> {
                    log.info("Comment created: id={}, post={}, author={}", comment.getId(), postId, authorId);
                    blogMetrics.incrementCommentCreated();
                })
                .flatMap(this::toResponse);
    }

    public Mono<CommentResponse> getCommentById(Long id) {
        return findComment(id).flatMap(this::toResponse);
    }

    public Mono<List<CommentResponse>> getCommentsForPost(Long postId, int skip, int limit) {
        return postRepository.findActiveById(postId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", postId)))
                .flatMap(post -> commentRepository.findApprovedByPostId(postId, limit, skip).collectList())
                .flatMap(this::toResponses);
    }

    @Transactional
    public Mono<CommentResponse> updateComment(Long id, CommentUpdateRequest request, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findComment(id))
                .flatMap(comment -> authorizationGuard.requireOwner(comment, actorId, OWNERSHIP, "update this comment"))
                .flatMap(comment -> {
                    comment.setContent(request.content());
                    comment.stampUpdated(actorId, LocalDateTime.now());
                    return commentRepository.save(comment);
                })
                .doOnSuccess(comment -> log.info("Comment updated: id={}", id))
                .flatMap(this::toResponse);
    }

    @Transactional
    public Mono<Void> deleteComment(Long id, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findComment(id))
                .flatMap(comment -> authorizationGuard.requireOwner(comment, actorId, OWNERSHIP, "delete this comment"))
                .flatMap(comment -> {
                    comment.markDeleted(actorId, LocalDateTime.now());
                    return commentRepository.save(comment);
                })
                .doOnSuccess(comment -> log.info("Comment deleted: id={}, by={}", id, actorId))
                .then();
    }

    /**
     * Only the author of the post the comment belongs to may approve it.
     */
    @Transactional
    public Mono<CommentResponse> approveComment(Long id, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findComment(id))
                .flatMap(comment -> postRepository.findActiveById(comment.getPostId())
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", comment.getPostId())))
                        .flatMap(post -> authorizationGuard.requireOwner(post, actorId, POST_AUTHOR,
                                "approve comments on this post"))
                        .flatMap(post -> {
                            comment.setApproved(true);
                            comment.stampUpdated(actorId, LocalDateTime.now());
                            return commentRepository.save(comment);
                        }))
                .doOnSuccess(comment -> log.info("Comment approved: id={}, by={}", id, actorId))
                .flatMap(this::toResponse);
    }

    private Mono<Comment> findComment(Long id) {
        return commentRepository.findActiveById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Comment", "id", id)));
    }

    private Mono<Boolean> requireParent(Long parentId, Long postId) {
        if (parentId == null) {
            return Mono.just(true);
        }
        return commentRepository.findActiveById(parentId)
                .filter(parent -> postId.equals(parent.getPostId()))
                .map(parent -> true)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("error.invalid_parent_comment")));
    }

    private Mono<CommentResponse> toResponse(Comment comment) {
        return toResponses(List.of(comment)).map(responses -> responses.get(0));
    }

    private Mono<List<CommentResponse>> toResponses(List<Comment> comments) {
        if (comments.isEmpty()) {
            return Mono.just(List.of());
        }
        Set<Long> authorIds = comments.stream().map(Comment::getAuthorId).collect(Collectors.toSet());
        return userRepository.findAllById(authorIds)
                .collectMap(User::getId)
                .map(authors -> comments.stream()
                        .map(comment -> withAuthor(comment, authors))
                        .toList());
    }

    private static CommentResponse withAuthor(Comment comment, Map<Long, User> authors) {
        CommentResponse response = CommentResponse.fromEntity(comment);
        User author = authors.get(comment.getAuthorId());
        if (author != null) {
            response.setAuthor(UserResponse.fromEntity(author));
        }
        return response;
    }
}
