package com.paideia.backend.modules.category;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.category.application.CategoryHierarchyNavigator;
import com.paideia.backend.modules.category.application.CategoryHierarchySettings;
import com.paideia.backend.modules.category.application.CategoryService;
import com.paideia.backend.modules.category.application.CategoryService.UpdateCategoryCommand;
import com.paideia.backend.modules.category.domain.CategoryHierarchyNode;
import com.paideia.backend.modules.category.domain.CourseCategory;
import com.paideia.backend.modules.category.infrastructure.persistence.CourseCategoryRepository;
import com.paideia.backend.modules.categoryrole.infrastructure.persistence.CategoryRoleAssignmentRepository;
import com.paideia.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.paideia.backend.support.InMemoryCategories;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private CourseCategoryRepository categoryRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private CategoryRoleAssignmentRepository roleAssignmentRepository;

    private InMemoryCategories categories;

    @BeforeEach
    void setUp() {
        categories = InMemoryCategories.backing(categoryRepository);
    }

    private CategoryService service(CategoryHierarchySettings settings) {
        return new CategoryService(
                categoryRepository,
                courseRepository,
                roleAssignmentRepository,
                new CategoryHierarchyNavigator(categoryRepository),
                settings
        );
    }

    @Test
    @DisplayName("blank names are rejected before anything is saved")
    void createRejectsBlankName() {
        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited()).create("  ", null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.INVALID_ARGUMENT));
        verify(categoryRepository, never()).save(any());
    }

    @Test
    void createRejectsUnknownParent() {
        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited()).create("Physics", 99L))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("category.parent_not_found");
                });
    }

    @Test
    void createTrimsNameAndLinksParent() {
        CourseCategory science = categories.add(1L, "Science", null);

        CourseCategory physics = service(CategoryHierarchySettings.unlimited()).create("  Physics ", science.getId());

        assertThat(physics.getName()).isEqualTo("Physics");
        assertThat(physics.getParentId()).isEqualTo(1L);
        assertThat(physics.getId()).isNotNull();
    }

    @Test
    @DisplayName("max depth 2 allows a root and its child but not a grandchild")
    void createEnforcesMaxDepthInLevels() {
        CategoryService service = service(CategoryHierarchySettings.withMaxDepth(2));

        CourseCategory level1 = service.create("Level 1", null);
        CourseCategory level2 = service.create("Level 2", level1.getId());

        assertThatThrownBy(() -> service.create("Level 3", level2.getId()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.DEPTH_LIMIT_EXCEEDED);
                    assertThat(ex.getDetailMessage()).contains("2");
                });
    }

    @Test
    void updateRejectsSelfParenting() {
        categories.add(1L, "Science", null);

        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited())
                .update(1L, UpdateCategoryCommand.moveUnder(1L)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.CIRCULAR_REFERENCE));
    }

    @Test
    @DisplayName("moving a category under its own descendant is a circular reference")
    void updateRejectsMovingUnderDescendant() {
        CourseCategory grandparent = categories.add(1L, "Grandparent", null);
        CourseCategory parent = categories.add(2L, "Parent", grandparent);
        categories.add(3L, "Child", parent);

        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited())
                .update(1L, UpdateCategoryCommand.moveUnder(3L)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("category.circular_reference"));
        assertThat(categories.get(1L).getParentId()).isNull();
    }

    @Test
    void updateRejectsMoveThatPushesDescendantsPastDepthLimit() {
        CourseCategory a = categories.add(1L, "A", null);
        CourseCategory b = categories.add(2L, "B", null);
        categories.add(3L, "B child", b);

        assertThatThrownBy(() -> service(CategoryHierarchySettings.withMaxDepth(2))
                .update(2L, UpdateCategoryCommand.moveUnder(a.getId())))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.DEPTH_LIMIT_EXCEEDED));
    }

    @Test
    @DisplayName("the cycle check reads the parent chain as committed once the rows are locked")
    void updateDetectsCycleCommittedByConcurrentMove() {
        categories.add(1L, "A", null);
        categories.add(2L, "B", null);
        // B was moved under A by another transaction after this one loaded B
        when(categoryRepository.lockParentLinks(anyCollection())).thenReturn(List.<Object[]>of(
                new Object[] {1L, null},
                new Object[] {2L, 1L}
        ));

        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited())
                .update(1L, UpdateCategoryCommand.moveUnder(2L)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("category.circular_reference"));
        assertThat(categories.get(1L).isRoot()).isTrue();
        verify(categoryRepository, never()).save(any());
    }

    @Test
    void structuralChecksRunOnLockedRows() {
        CourseCategory parent = categories.add(1L, "Parent", null);
        categories.add(2L, "Child", null);

        service(CategoryHierarchySettings.unlimited()).update(2L, UpdateCategoryCommand.moveUnder(parent.getId()));
        service(CategoryHierarchySettings.unlimited()).create("Grandchild", 2L);

        verify(categoryRepository, times(2)).lockParentLinks(List.of(1L, 2L));
    }

    @Test
    void missingIdsAreRejectedAsInvalidArguments() {
        CategoryService service = service(CategoryHierarchySettings.unlimited());

        assertThatThrownBy(() -> service.getCategory(null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.INVALID_ARGUMENT));
        assertThatThrownBy(() -> service.delete(null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("category.id_required"));
        assertThatThrownBy(() -> service.getDepth(null)).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> service.update(null, UpdateCategoryCommand.rename("X")))
                .isInstanceOf(ProblemException.class);
        verify(categoryRepository, never()).findById(any());
    }

    @Test
    void updateMovesCategoryUnderNewParent() {
        CourseCategory parent1 = categories.add(1L, "Parent 1", null);
        categories.add(2L, "Parent 2", null);
        categories.add(3L, "Child", parent1);

        CourseCategory moved = service(CategoryHierarchySettings.unlimited())
                .update(3L, UpdateCategoryCommand.moveUnder(2L));

        assertThat(moved.getParentId()).isEqualTo(2L);
    }

    @Test
    void updateMovesCategoryToRoot() {
        CourseCategory parent = categories.add(1L, "Parent", null);
        categories.add(2L, "Child", parent);

        CourseCategory moved = service(CategoryHierarchySettings.unlimited())
                .update(2L, UpdateCategoryCommand.moveToRootLevel());

        assertThat(moved.isRoot()).isTrue();
    }

    @Test
    @DisplayName("renaming never re-checks depth or cycles")
    void renameSkipsStructuralChecks() {
        CourseCategory root = categories.add(1L, "Root", null);
        CourseCategory child = categories.add(2L, "Child", root);
        categories.add(3L, "Grandchild", child);

        CourseCategory renamed = service(CategoryHierarchySettings.withMaxDepth(2))
                .update(3L, UpdateCategoryCommand.rename("Renamed"));

        assertThat(renamed.getName()).isEqualTo("Renamed");
        verify(categoryRepository, never()).findChildIds(any());
    }

    @Test
    void updateRejectsUnknownCategory() {
        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited())
                .update(42L, UpdateCategoryCommand.rename("Anything")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.NOT_FOUND));
    }

    @Test
    void deleteRejectsCategoryWithSubcategories() {
        CourseCategory parent = categories.add(1L, "Parent", null);
        categories.add(2L, "Child", parent);

        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited()).delete(1L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.HAS_SUBCATEGORIES));
        verify(categoryRepository, never()).delete(any());
    }

    @Test
    void deleteRejectsCategoryWithCourses() {
        categories.add(1L, "Leaf", null);
        when(courseRepository.existsByCategoryId(1L)).thenReturn(true);

        assertThatThrownBy(() -> service(CategoryHierarchySettings.unlimited()).delete(1L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProblemKind.HAS_COURSES));
        verify(roleAssignmentRepository, never()).deleteByCategoryId(any());
    }

    @Test
    void deleteRemovesEmptyCategoryAndItsAssignments() {
        CourseCategory leaf = categories.add(1L, "Leaf", null);
        when(courseRepository.existsByCategoryId(1L)).thenReturn(false);
        when(roleAssignmentRepository.deleteByCategoryId(1L)).thenReturn(2);

        service(CategoryHierarchySettings.unlimited()).delete(1L);

        verify(roleAssignmentRepository).deleteByCategoryId(1L);
        verify(categoryRepository).delete(leaf);
    }

    @Test
    void getAncestorsRunsFromRootToSelf() {
        CourseCategory science = categories.add(1L, "Science", null);
        CourseCategory physics = categories.add(2L, "Physics", science);
        categories.add(3L, "Quantum", physics);

        List<CourseCategory> ancestors = service(CategoryHierarchySettings.unlimited()).getAncestors(3L);

        assertThat(ancestors).extracting(CourseCategory::getName)
                .containsExactly("Science", "Physics", "Quantum");
        assertThat(service(CategoryHierarchySettings.unlimited()).getDepth(3L)).isEqualTo(2);
    }

    @Test
    void getTreeNestsChildrenUnderRoots() {
        CourseCategory science = categories.add(1L, "Science", null);
        categories.add(2L, "Physics", science);
        categories.add(3L, "Chemistry", science);
        categories.add(4L, "Arts", null);

        List<CategoryHierarchyNode> tree = service(CategoryHierarchySettings.unlimited()).getTree();

        assertThat(tree).extracting(CategoryHierarchyNode::name).containsExactly("Arts", "Science");
        assertThat(tree.get(1).children()).extracting(CategoryHierarchyNode::name)
                .containsExactly("Chemistry", "Physics");
    }
}
