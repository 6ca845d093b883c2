package dev.blogplatform.service;

import dev.blogplatform.dto.TagRequest;
import dev.blogplatform.dto.TagResponse;
import dev.blogplatform.entity.Tag;
import dev.blogplatform.exception.DuplicateResourceException;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.repository.TagRepository;
import dev.blogplatform.security.AuthorizationGuard;
import dev.blogplatform.security.OwnershipPolicy;
import dev.blogplatform.util.SlugUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    static final OwnershipPolicy<Tag> OWNERSHIP = OwnershipPolicy.anyAuthenticatedUser();

    private final TagRepository tagRepository;
    private final AuthorizationGuard authorizationGuard;
    private final IdService idService;

    @Transactional
    public Mono<TagResponse> createTag(TagRequest request, Long actorId) {
        String name = request.getName().trim();
        String slug = SlugUtils.slugOrDerive(request.getSlug(), name);
        if (slug.isEmpty()) {
            return Mono.error(new IllegalArgumentException("error.invalid_slug"));
        }
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> tagRepository.existsByName(name))
                .flatMap(nameTaken -> {
                    if (nameTaken) {
                        return Mono.<Boolean>error(new DuplicateResourceException("Tag", "name", name));
                    }
                    return tagRepository.existsBySlug(slug);
                })
                .flatMap(slugTaken -> {
                    if (slugTaken) {
                        return Mono.<Tag>error(new DuplicateResourceException("Tag", "slug", slug));
                    }
                    Tag tag = Tag.builder()
                            .id(idService.nextId())
                            .name(name)
                            .slug(slug)
                            .build();
                    tag.stampCreated(actorId, LocalDateTime.now());
                    return tagRepository.save(tag);
                })
                .doOnSuccess(tag -> log.info("Tag created: id={}, slug={}", tag.getId(), tag.getSlug()))
                .map(TagResponse::fromEntity);
    }

    public Mono<TagResponse> getTagById(Long id) {
        return findTag(id).map(TagResponse::fromEntity);
    }

    public Mono<List<TagResponse>> getTags(int skip, int limit) {
        return tagRepository.findAllActive(limit, skip)
                .map(TagResponse::fromEntity)
                .collectList();
    }

    @Transactional
    public Mono<Void> deleteTag(Long id, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findTag(id))
                .flatMap(tag -> authorizationGuard.requireOwner(tag, actorId, OWNERSHIP, "delete this tag"))
                .flatMap(tag -> {
                    tag.markDeleted(actorId, LocalDateTime.now());
                    return tagRepository.save(tag);
                })
                .doOnSuccess(tag -> log.info("Tag deleted: id={}, by={}", id, actorId))
                .then();
    }

    private Mono<Tag> findTag(Long id) {
        return tagRepository.findActiveById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)));
    }
}
