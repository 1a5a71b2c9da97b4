package com.paideia.backend.support;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.paideia.backend.modules.category.domain.CourseCategory;
import com.paideia.backend.modules.category.infrastructure.persistence.CourseCategoryRepository;

/**
 * Backs the read side of a mocked {@link CourseCategoryRepository} with a map, so parent
 * walks behave like the database without a Spring context.
 */
public final class InMemoryCategories {

    private final Map<Long, CourseCategory> categories = new LinkedHashMap<>();

    private InMemoryCategories(CourseCategoryRepository repository) {
        lenient().when(repository.findById(anyLong()))
                .thenAnswer(invocation -> Optional.ofNullable(categories.get(invocation.<Long>getArgument(0))));
        lenient().when(repository.existsById(anyLong()))
                .thenAnswer(invocation -> categories.containsKey(invocation.<Long>getArgument(0)));
        lenient().when(repository.findChildIds(anyCollection()))
                .thenAnswer(invocation -> childIds(invocation.getArgument(0)));
        lenient().when(repository.countByParentId(anyLong()))
                .thenAnswer(invocation -> (long) childIds(List.of(invocation.<Long>getArgument(0))).size());
        lenient().when(repository.existsByParentId(anyLong()))
                .thenAnswer(invocation -> !childIds(List.of(invocation.<Long>getArgument(0))).isEmpty());
        lenient().when(repository.findAllOrderByName())
                .thenAnswer(invocation -> sortedByName());
        lenient().when(repository.findByIdForUpdate(anyLong()))
                .thenAnswer(invocation -> Optional.ofNullable(categories.get(invocation.<Long>getArgument(0))));
        lenient().when(repository.lockParentLinks(anyCollection()))
                .thenAnswer(invocation -> parentLinks(invocation.getArgument(0)));
        lenient().when(repository.save(any(CourseCategory.class)))
                .thenAnswer(invocation -> {
                    CourseCategory saved = invocation.getArgument(0);
                    if (saved.getId() == null) {
                        TestEntities.withId(saved, nextId());
                    }
                    categories.put(saved.getId(), saved);
                    return saved;
                });
    }

    public static InMemoryCategories backing(CourseCategoryRepository repository) {
        return new InMemoryCategories(repository);
    }

    public CourseCategory add(long id, String name, CourseCategory parent) {
        CourseCategory category = TestEntities.category(id, name, parent);
        categories.put(id, category);
        return category;
    }

    public CourseCategory get(long id) {
        return categories.get(id);
    }

    private long nextId() {
        return categories.keySet().stream().mapToLong(Long::longValue).max().orElse(0L) + 1;
    }

    private List<Long> childIds(Collection<Long> parentIds) {
        List<Long> ids = new ArrayList<>();
        for (CourseCategory category : categories.values()) {
            if (category.getParentId() != null && parentIds.contains(category.getParentId())) {
                ids.add(category.getId());
            }
        }
        return ids;
    }

    private List<Object[]> parentLinks(Collection<Long> ids) {
        return ids.stream()
                .sorted()
                .map(categories::get)
                .filter(Objects::nonNull)
                .map(category -> new Object[] {category.getId(), category.getParentId()})
                .toList();
    }

    private List<CourseCategory> sortedByName() {
        return categories.values().stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing((CourseCategory category) -> category.getName().toLowerCase())
                        .thenComparing(CourseCategory::getId))
                .toList();
    }
}
