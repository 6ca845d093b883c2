package dev.blogplatform.service;

import dev.blogplatform.dto.CategoryRequest;
import dev.blogplatform.dto.CategoryResponse;
import dev.blogplatform.dto.CategoryUpdateRequest;
import dev.blogplatform.entity.Category;
import dev.blogplatform.exception.DuplicateResourceException;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.repository.CategoryRepository;
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
public class CategoryService {

    // Categories are shared; any signed-in user may edit or remove them.
    static final OwnershipPolicy<Category> OWNERSHIP = OwnershipPolicy.anyAuthenticatedUser();

    private final CategoryRepository categoryRepository;
    private final AuthorizationGuard authorizationGuard;
    private final IdService idService;

    @Transactional
    public Mono<CategoryResponse> createCategory(CategoryRequest request, Long actorId) {
        String name = request.getName().trim();
        String slug = SlugUtils.slugOrDerive(request.getSlug(), name);
        if (slug.isEmpty()) {
            return Mono.error(new IllegalArgumentException("error.invalid_slug"));
        }
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> categoryRepository.existsByName(name))
                .flatMap(nameTaken -> {
                    if (nameTaken) {
                        return Mono.<Boolean>error(new DuplicateResourceException("Category", "name", name));
                    }
                    return categoryRepository.existsBySlug(slug);
                })
                .flatMap(slugTaken -> {
                    if (slugTaken) {
                        return Mono.<Category>error(new DuplicateResourceException("Category", "slug", slug));
                    }
                    Category category = Category.builder()
                            .id(idService.nextId())
                            .name(name)
                            .slug(slug)
                            .description(request.getDescription())
                            .build();
                    category.stampCreated(actorId, LocalDateTime.now());
                    return categoryRepository.save(category);
                })
                .doOnSuccess(category -> log.info("Category created: id={}, slug={}", category.getId(), category.getSlug()))
                .map(CategoryResponse::fromEntity);
    }

    public Mono<CategoryResponse> getCategoryById(Long id) {
        return findCategory(id).map(CategoryResponse::fromEntity);
    }

    public Mono<List<CategoryResponse>> getCategories(int skip, int limit) {
        return categoryRepository.findAllActive(limit, skip)
                .map(CategoryResponse::fromEntity)
                .collectList();
    }

    @Transactional
    public Mono<CategoryResponse> updateCategory(Long id, CategoryUpdateRequest request, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findCategory(id))
                .flatMap(category -> authorizationGuard.requireOwner(category, actorId, OWNERSHIP, "update this category"))
                .flatMap(category -> applyName(category, request.getName()))
                .flatMap(category -> applySlug(category, request.getSlug()))
                .flatMap(category -> {
                    if (request.getDescription() != null) {
                        category.setDescription(request.getDescription());
                    }
                    category.stampUpdated(actorId, LocalDateTime.now());
                    return categoryRepository.save(category);
                })
                .doOnSuccess(category -> log.info("Category updated: id={}", id))
                .map(CategoryResponse::fromEntity);
    }

    @Transactional
    public Mono<Void> deleteCategory(Long id, Long actorId) {
        return authorizationGuard.resolveIdentity(actorId)
                .flatMap(actor -> findCategory(id))
                .flatMap(category -> authorizationGuard.requireOwner(category, actorId, OWNERSHIP, "delete this category"))
                .flatMap(category -> {
                    category.markDeleted(actorId, LocalDateTime.now());
                    return categoryRepository.save(category);
                })
                .doOnSuccess(category -> log.info("Category deleted: id={}, by={}", id, actorId))
                .then();
    }

    private Mono<Category> findCategory(Long id) {
        return categoryRepository.findActiveById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)));
    }

    private Mono<Category> applyName(Category category, String requestedName) {
        if (requestedName == null || requestedName.trim().equals(category.getName())) {
            return Mono.just(category);
        }
        String name = requestedName.trim();
        return categoryRepository.existsByNameAndIdNot(name, category.getId())
                .flatMap(taken -> {
                    if (taken) {
                        return Mono.<Category>error(new DuplicateResourceException("Category", "name", name));
                    }
                    category.setName(name);
                    return Mono.just(category);
                });
    }

    private Mono<Category> applySlug(Category category, String requestedSlug) {
        if (requestedSlug == null) {
            return Mono.just(category);
        }
        String slug = SlugUtils.slugify(requestedSlug);
        if (slug.isEmpty()) {
            return Mono.error(new IllegalArgumentException("error.invalid_slug"));
        }
        return categoryRepository.existsBySlugAndIdNot(slug, category.getId())
                .flatMap(taken -> {
                    if (taken) {
                        return Mono.<Category>error(new DuplicateResourceException("Category", "slug", slug));
                    }
                    category.setSlug(slug);
                    return Mono.just(category);
                });
    }
}
