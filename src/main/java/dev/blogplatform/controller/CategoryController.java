package dev.blogplatform.controller;

import dev.blogplatform.dto.CategoryRequest;
import dev.blogplatform.dto.CategoryResponse;
import dev.blogplatform.dto.CategoryUpdateRequest;
import dev.blogplatform.security.AuthenticatedUser;
import dev.blogplatform.service.CategoryService;
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
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
@Validated
@Tag(name = "Categories")
public class CategoryController {

    private final CategoryService categoryService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a category", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<CategoryResponse> createCategory(@AuthenticationPrincipal AuthenticatedUser principal,
                                                 @Valid @RequestBody CategoryRequest request) {
        return categoryService.createCategory(request, principal.userId());
    }

    @GetMapping
    @Operation(summary = "List categories")
    public Mono<List<CategoryResponse>> getCategories(
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        return categoryService.getCategories(skip, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get category by ID")
    public Mono<CategoryResponse> getCategory(@PathVariable Long id) {
        return categoryService.getCategoryById(id);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a category", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<CategoryResponse> updateCategory(@AuthenticationPrincipal AuthenticatedUser principal,
                                                 @PathVariable Long id,
                                                 @Valid @RequestBody CategoryUpdateRequest request) {
        return categoryService.updateCategory(id, request, principal.userId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a category", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<Void> deleteCategory(@AuthenticationPrincipal AuthenticatedUser principal, @PathVariable Long id) {
        return categoryService.deleteCategory(id, principal.userId());
    }
}
