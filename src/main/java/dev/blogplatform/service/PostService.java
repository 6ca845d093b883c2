package dev.blogplatform.service;

import dev.blogplatform.dto.CategoryResponse;
import dev.blogplatform.dto.PostRequest;
import dev.blogplatform.dto.PostResponse;
import dev.blogplatform.dto.PostUpdateRequest;
import dev.blogplatform.dto.TagResponse;
import dev.blogplatform.dto.UserResponse;
import dev.blogplatform.entity.Category;
import dev.blogplatform.entity.Post;
import dev.blogplatform.entity.Tag;
import dev.blogplatform.entity.User;
import dev.blogplatform.exception.DuplicateResourceException;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.metrics.BlogMetrics;
import dev.blogplatform.repository.CategoryRepository;
import dev.blogplatform.repository.PostQueryRepository;
import dev.blogplatform.repository.PostRepository;
import dev.blogplatform.repository.PostSearchCriteria;
import dev.blogplatform.repository.PostTagLink;
import dev.blogplatform.repository.PostTagRepository;
import dev.blogplatform.repository.TagRepository;
import dev.blogplatform.repository.UserRepository;
import dev.blogplatform.security.AuthorizationGuard;
import dev.blogplatform.security.OwnershipPolicy;
import dev.blogplatform.util.IdParser;
import dev.blogplatform.util.SlugUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PostService {

    static final OwnershipPolicy<Post> OWNERSHIP = OwnershipPolicy.authoredBy(Post::getAuthorId);

    private final PostRepository postRepository;
    private final PostQueryRepository postQueryRepository;
    private final PostTagRepository postTagRepository;
    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;
    private final AuthorizationGuard authorizationGuard;
    private final IdService idService;
    private final BlogMetrics blogMetrics;

    @Transactional
    public Mono<PostResponse> createPost(PostRequest request, Long authorId) {
        String slug = SlugUtils.slugOrDerive(request.getSlug(), request.getTitle());
        if (slug.isEmpty()) {
            return Mono.error(new IllegalArgumentException("error.invalid_slug"));
        }
        Long categoryId = IdParser.parseNullable(request.getCategoryId(), "category_id");
        List<Long> requestedTagIds = IdParser.parseAll(request.getTagIds(), "tag_ids");

        return authorizationGuard.resolveIdentity(authorId)
                .flatMap(author -> postRepository.existsBySlug(slug))
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<Boolean>error(new DuplicateResourceException("Post", "slug", slug));
                    }
                    return requireCategory(categoryId);
                })
                .flatMap(ignored -> {
                    LocalDateTime now = LocalDateTime.now();
                    Post post = Post.builder()
                            .id(idService.nextId())
                            .title(request.getTitle().trim())
                            .slug(slug)
                            .content(request.getContent())
                            .excerpt(request.getExcerpt())
                            .authorId(authorId)
                            .categoryId(categoryId)
                            .featuredImageUrl(request.getFeaturedImageUrl())
                            .build();
                    post.applyPublished(Boolean.TRUE.equals(request.getIsPublished()), now);
                    post.stampCreated(authorId, now);
                    return postRepository.save(post);
                })
                .flatMap(post -> resolveTagIds(requestedTagIds)
                        .flatMap(tagIds -> postTagRepository.replaceTags(post.getId(), tagIds))
                        .thenReturn(post))
                .doOnSuccess(post -> {
                    log.info("Post created: id={}, slug={}, author={}", post.getId(), post.getSlug(), authorId);
                    blogMetrics.incrementPostCreated();
                })
                .flatMap(this::toResponse);
    }

    /**
     * Also counts a view; the counter update never fails the read.
     */
    public Mono<PostResponse> getPostById(Long id) {
        return postRepository.findActiveById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", id)))
                .flatMap(this::recordView)
                .flatMap(this::toResponse);
    }

    public Mono<PostResponse> getPostBySlug(String slug) {
        return postRepository.findActiveBySlug(slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "slug", slug)))
                .flatMap(this::recordView)
                .flatMap(this::toResponse);
    }

    /**
     * Published posts, newest first, optionally narrowed to one category and/or tag.
     */
    public Mono<List<PostResponse>> getPosts(int skip, int limit, Long categoryId, Long tagId) {
        PostSearchCriteria criteria = PostSearchCriteria.builder()
                .categoryId(categoryId)
                .tagId(tagId)
                .publishedOnly(true)
                .offset(skip)
                .limit(limit)
                .build();
        return postQueryRepository.findByCriteria(criteria)
                .collectList()
                .flatMap(this::toResponses);
    }

    public Mono<List<PostResponse>> searchPosts(String query, int skip, int limit) {
        PostSearchCriteria criteria = PostSearchCriteria.builder()
                .query(query)
                .publishedOnly(true)
                .offset(skip)
                .limit(limit)
                .build();
        return postQueryRepository.findByCriteria(criteria)
                .collectList()
                .flatMap(this::toResponses);
    }

    /**
     * Every non-deleted post of the user, drafts included.
     */
    public Mono<List<PostResponse>> getPostsByUser(Long userId, int skip, int limit) {
        return userRepository.findActiveById(userId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", userId)))
                .flatMap(user -> postQueryRepository.findByCriteria(PostSearchCriteria.builder()
                                .authorId(userId)
                                .publishedOnly(false)
                                .offset(skip)
                                .limit(limit)
                                .build())
                        .collectList())
                .flatMap(this::toResponses);
    }

    @Transactional
    public Mono<PostResponse> updatePost(Long id, PostUpdateRequest request, Long actorId) {
        Long categoryId = IdParser.parseNullable(request.getCategoryId(), "category_id");
        List<Long> requestedTagIds = request.getTagIds() != null
                ? IdParser.parseAll(request.getTagIds(), "tag_ids")
                : null;

        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findPost(id))
                .flatMap(post -> authorizationGuard.requireOwner(post, actorId, OWNERSHIP, "update this post"))
                .flatMap(post -> applySlugChange(post, request.getSlug()))
                .flatMap(post -> requireCategory(categoryId).thenReturn(post))
                .flatMap(post -> {
                    LocalDateTime now = LocalDateTime.now();
                    if (request.getTitle() != null) {
                        post.setTitle(request.getTitle().trim());
                    }
                    if (request.getContent() != null) {
                        post.setContent(request.getContent());
                    }
                    if (request.getExcerpt() != null) {
                        post.setExcerpt(request.getExcerpt());
                    }
                    if (categoryId != null) {
                        post.setCategoryId(categoryId);
                    }
                    if (request.getIsPublished() != null) {
                        post.applyPublished(request.getIsPublished(), now);
                    }
                    if (request.getFeaturedImageUrl() != null) {
                        post.setFeaturedImageUrl(request.getFeaturedImageUrl());
                    }
                    post.stampUpdated(actorId, now);
                    return postRepository.save(post);
                })
                .flatMap(post -> {
                    if (requestedTagIds == null) {
                        return Mono.just(post);
                    }
                    return resolveTagIds(requestedTagIds)
                            .flatMap(tagIds -> postTagRepository.replaceTags(post.getId(), tagIds))
                            .thenReturn(post);
                })
                .doOnSuccess(post -> log.info("Post updated: id={}", post.getId()))
                .flatMap(this::toResponse);
    }

    /**
     * Soft delete; tag links stay so the row can be inspected later.
     */
    @Transactional
    public Mono<Void> deletePost(Long id, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findPost(id))
                .flatMap(post -> authorizationGuard.requireOwner(post, actorId, OWNERSHIP, "delete this post"))
                .flatMap(post -> {
                    post.markDeleted(actorId, LocalDateTime.now());
                    return postRepository.save(post);
                })
                .doOnSuccess(post -> log.info("Post deleted: id={}, by={}", id, actorId))
                .then();
    }

    private Mono<Post> findPost(Long id) {
        return postRepository.findActiveById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", id)));
    }

    private Mono<Post> recordView(Post post) {
        return postRepository.incrementViewCount(post.getId())
                .doOnNext(rows -> {
                    if (rows > 0) {
                        post.setViewCount((post.getViewCount() == null ? 0L : post.getViewCount()) + 1);
                        blogMetrics.incrementPostViews();
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Failed to increment view count for post {}: {}", post.getId(), e.getMessage());
                    return Mono.just(0);
                })
                .thenReturn(post);
    }

    private Mono<Post> applySlugChange(Post post, String requestedSlug) {
        if (requestedSlug == null) {
            return Mono.just(post);
        }
        String slug = SlugUtils.slugify(requestedSlug);
        if (slug.isEmpty()) {
            return Mono.error(new IllegalArgumentException("error.invalid_slug"));
        }
        if (slug.equals(post.getSlug())) {
            return Mono.just(post);
        }
        return postRepository.existsBySlug(slug)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<Post>error(new DuplicateResourceException("Post", "slug", slug));
                    }
                    post.setSlug(slug);
                    return Mono.just(post);
                });
    }

    private Mono<Boolean> requireCategory(Long categoryId) {
        if (categoryId == null) {
            return Mono.just(true);
        }
        return categoryRepository.findActiveById(categoryId)
                .map(category -> true)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("error.category_not_found")));
    }

    /**
     * Keeps only ids of existing, non-deleted tags; unknown ids are dropped.
     */
    private Mono<List<Long>> resolveTagIds(List<Long> requested) {
        if (requested.isEmpty()) {
            return Mono.just(List.of());
        }
        return tagRepository.findByIdInAndDeletedAtIsNull(requested)
                .map(Tag::getId)
                .collect(Collectors.toSet())
                .map(found -> requested.stream().filter(found::contains).toList());
    }

    private Mono<PostResponse> toResponse(Post post) {
        return toResponses(List.of(post)).map(responses -> responses.get(0));
    }

    /**
     * Loads authors, categories and tags for the whole page in three batched queries.
     */
    private Mono<List<PostResponse>> toResponses(List<Post> posts) {
        if (posts.isEmpty()) {
            return Mono.just(List.of());
        }
        Set<Long> postIds = posts.stream().map(Post::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        Set<Long> authorIds = posts.stream().map(Post::getAuthorId).filter(Objects::nonNull).collect(Collectors.toSet());
        Set<Long> categoryIds = posts.stream().map(Post::getCategoryId).filter(Objects::nonNull).collect(Collectors.toSet());

        Mono<Map<Long, User>> authors = authorIds.isEmpty()
                ? Mono.just(Map.of())
                : userRepository.findAllById(authorIds).collectMap(User::getId);
        Mono<Map<Long, Category>> categories = categoryIds.isEmpty()
                ? Mono.just(Map.of())
                : categoryRepository.findAllById(categoryIds)
                        .filter(category -> !category.lifecycle().isDeleted())
                        .collectMap(Category::getId);
        Mono<Map<Long, List<Tag>>> tags = loadTags(postIds);

        return Mono.zip(authors, categories, tags)
                .map(tuple -> posts.stream()
                        .map(post -> {
                            PostResponse response = PostResponse.fromEntity(post);
                            User author = tuple.getT1().get(post.getAuthorId());
                            if (author != null) {
                                response.setAuthor(UserResponse.fromEntity(author));
                            }
                            Category category = post.getCategoryId() != null ? tuple.getT2().get(post.getCategoryId()) : null;
                            if (category != null) {
                                response.setCategory(CategoryResponse.fromEntity(category));
                            }
                            response.setTags(tuple.getT3().getOrDefault(post.getId(), List.of()).stream()
                                    .map(TagResponse::fromEntity)
                                    .toList());
                            return response;
                        })
                        .toList());
    }

    private Mono<Map<Long, List<Tag>>> loadTags(Collection<Long> postIds) {
        return postTagRepository.findLinksByPostIds(postIds)
                .collectList()
                .flatMap(links -> {
                    if (links.isEmpty()) {
                        return Mono.just(Map.<Long, List<Tag>>of());
                    }
                    Set<Long> tagIds = links.stream().map(PostTagLink::tagId).collect(Collectors.toSet());
                    return tagRepository.findByIdInAndDeletedAtIsNull(tagIds)
                            .collectMap(Tag::getId)
                            .map(tagsById -> {
                                Map<Long, List<Tag>> byPost = new HashMap<>();
                                for (PostTagLink link : links) {
                                    Tag tag = tagsById.get(link.tagId());
                                    if (tag != null) {
                                        byPost.computeIfAbsent(link.postId(), k -> new ArrayList<>()).add(tag);
                                    }
                                }
                                return byPost;
                            });
                });
    }
}
