package dev.blogplatform.service;

import dev.blogplatform.dto.CommentRequest;
import dev.blogplatform.dto.CommentUpdateRequest;
import dev.blogplatform.entity.Comment;
import dev.blogplatform.entity.Post;
import dev.blogplatform.entity.User;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.metrics.BlogMetrics;
import dev.blogplatform.repository.CommentRepository;
import dev.blogplatform.repository.PostRepository;
import dev.blogplatform.repository.UserRepository;
import dev.blogplatform.security.AuthorizationGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

    private static final Long POST_AUTHOR_ID = 1L;
    private static final Long COMMENTER_ID = 2L;

    @Mock private CommentRepository commentRepository;
    @Mock private PostRepository postRepository;
    @Mock private UserRepository userRepository;
    @Mock private IdService idService;
    @Mock private BlogMetrics blogMetrics;

    private CommentService commentService;
    private Post post;
    private Comment comment;

    @BeforeEach
    void setUp() {
        commentService = new CommentService(commentRepository, postRepository, userRepository,
                new AuthorizationGuard(userRepository), idService, blogMetrics);

        post = Post.builder().id(10L).authorId(POST_AUTHOR_ID).title("Post").slug("post").build();
        comment = Comment.builder().id(20L).postId(10L).authorId(COMMENTER_ID).content("Nice post").build();
        comment.setNewRecord(false);

        User commenter = User.builder().id(COMMENTER_ID).username("bob").email("bob@example.com").build();
        lenient().when(userRepository.findAllById(anyIterable())).thenReturn(Flux.just(commenter));
        // Every token subject resolves to a live user unless a test says otherwise
        lenient().when(userRepository.findActiveById(anyLong()))
                .thenAnswer(inv -> Mono.just(User.builder().id(inv.getArgument(0)).build()));
    }

    @Nested
    @DisplayName("createComment")
    class CreateComment {

        @Test
        @DisplayName("New comment should start unapproved and carry its author")
        void shouldCreateUnapprovedComment() {
            when(postRepository.findActiveById(10L)).thenReturn(Mono.just(post));
            when(idService.nextId()).thenReturn(21L);
            when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(commentService.createComment(10L, new CommentRequest("Great read", null), COMMENTER_ID))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("21");
                        assertThat(response.getPostId()).isEqualTo("10");
                        assertThat(response.getIsApproved()).isFalse();
                        assertThat(response.getParentCommentId()).isNull();
                        assertThat(response.getAuthor().getUsername()).isEqualTo("bob");
                    })
                    .verifyComplete();

            verify(blogMetrics).incrementCommentCreated();
        }

        @Test
        @DisplayName("Reply should reference a parent on the same post")
        void shouldAcceptReply() {
            when(postRepository.findActiveById(10L)).thenReturn(Mono.just(post));
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.just(comment));
            when(idService.nextId()).thenReturn(22L);
            when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(commentService.createComment(10L, new CommentRequest("Agreed", "20"), COMMENTER_ID))
                    .assertNext(response -> assertThat(response.getParentCommentId()).isEqualTo("20"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Parent on another post should be rejected")
        void shouldRejectForeignParent() {
            Comment foreign = Comment.builder().id(30L).postId(99L).authorId(COMMENTER_ID).build();
            when(postRepository.findActiveById(10L)).thenReturn(Mono.just(post));
            when(commentRepository.findActiveById(30L)).thenReturn(Mono.just(foreign));

            StepVerifier.create(commentService.createComment(10L, new CommentRequest("Hm", "30"), COMMENTER_ID))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(IllegalArgumentException.class)
                            .hasMessage("error.invalid_parent_comment"))
                    .verify();

            verify(commentRepository, never()).save(any());
        }

        @Test
        @DisplayName("Commenting on a missing post should be 404")
        void shouldFailForMissingPost() {
            when(postRepository.findActiveById(10L)).thenReturn(Mono.empty());

            StepVerifier.create(commentService.createComment(10L, new CommentRequest("Hello", null), COMMENTER_ID))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Listing should return approved comments for the requested window")
    void listingPassesWindow() {
        comment.setApproved(true);
        when(postRepository.findActiveById(10L)).thenReturn(Mono.just(post));
        when(commentRepository.findApprovedByPostId(10L, 20, 40)).thenReturn(Flux.just(comment));

        StepVerifier.create(commentService.getCommentsForPost(10L, 40, 20))
                .assertNext(list -> {
                    assertThat(list).hasSize(1);
                    assertThat(list.get(0).getIsApproved()).isTrue();
                })
                .verifyComplete();
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        @Test
        @DisplayName("Author should be able to edit the comment")
        void authorCanEdit() {
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.just(comment));
            when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(commentService.updateComment(20L, new CommentUpdateRequest("Edited"), COMMENTER_ID))
                    .assertNext(response -> assertThat(response.getContent()).isEqualTo("Edited"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Post author should not edit someone else's comment")
        void othersCannotEdit() {
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.just(comment));

            StepVerifier.create(commentService.updateComment(20L, new CommentUpdateRequest("Edited"), POST_AUTHOR_ID))
                    .expectErrorMessage("Not authorized to update this comment")
                    .verify();
        }

        @Test
        @DisplayName("Author delete should soft-delete")
        void authorCanDelete() {
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.just(comment));
            when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(commentService.deleteComment(20L, COMMENTER_ID)).verifyComplete();

            assertThat(comment.getDeletedAt()).isNotNull();
        }

        @Test
        @DisplayName("Post author should approve comments on the post")
        void postAuthorCanApprove() {
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.just(comment));
            when(postRepository.findActiveById(10L)).thenReturn(Mono.just(post));
            when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(commentService.approveComment(20L, POST_AUTHOR_ID))
                    .assertNext(response -> assertThat(response.getIsApproved()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Comment author should not approve their own comment")
        void commenterCannotApprove() {
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.just(comment));
            when(postRepository.findActiveById(10L)).thenReturn(Mono.just(post));

            StepVerifier.create(commentService.approveComment(20L, COMMENTER_ID))
                    .expectError(AccessDeniedException.class)
                    .verify();

            assertThat(comment.getApproved()).isFalse();
        }

        @Test
        @DisplayName("Missing comment should be 404")
        void missingComment() {
            when(commentRepository.findActiveById(20L)).thenReturn(Mono.empty());

            StepVerifier.create(commentService.getCommentById(20L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("writes by a deleted user")
    class DeletedActor {

        private static final Long GHOST_ID = 99L;

        @BeforeEach
        void userIsGone() {
            when(userRepository.findActiveById(GHOST_ID)).thenReturn(Mono.empty());
        }

        @Test
        @DisplayName("Create should be 404 before the post is looked up")
        void createIsRejected() {
            StepVerifier.create(commentService.createComment(10L, new CommentRequest("Boo", null), GHOST_ID))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(ResourceNotFoundException.class)
                            .hasMessage("User not found"))
                    .verify();

            verify(postRepository, never()).findActiveById(any());
            verify(commentRepository, never()).save(any());
        }

        @Test
        @DisplayName("Update, delete and approve should be 404")
        void mutationsAreRejected() {
            StepVerifier.create(commentService.updateComment(20L, new CommentUpdateRequest("Edited"), GHOST_ID))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
            StepVerifier.create(commentService.deleteComment(20L, GHOST_ID))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
            StepVerifier.create(commentService.approveComment(20L, GHOST_ID))
                    .expectError(ResourceNotFoundException.class)
                    .verify();

            verify(commentRepository, never()).save(any());
        }
    }
}
