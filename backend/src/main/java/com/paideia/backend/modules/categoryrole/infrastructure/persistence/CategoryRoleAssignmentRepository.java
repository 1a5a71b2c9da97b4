package com.paideia.backend.modules.categoryrole.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.paideia.backend.modules.categoryrole.domain.CategoryRoleAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CategoryRoleAssignmentRepository extends JpaRepository<CategoryRoleAssignment, Long> {

    Optional<CategoryRoleAssignment> findByUserIdAndCategoryId(Long userId, Long categoryId);

    List<CategoryRoleAssignment> findByUserId(Long userId);

    List<CategoryRoleAssignment> findByCategoryId(Long categoryId);

    @Query("""
            select a
              from CategoryRoleAssignment a
             where a.userId = :userId
               and a.categoryId in :categoryIds
            """)
    List<CategoryRoleAssignment> findByUserIdAndCategoryIds(
            @Param("userId") Long userId,
            @Param("categoryIds") Collection<Long> categoryIds
    );

    @Modifying
    @Query("delete from CategoryRoleAssignment a where a.categoryId = :categoryId")
    int deleteByCategoryId(@Param("categoryId") Long categoryId);
}
