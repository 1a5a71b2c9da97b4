package com.paideia.backend.modules.category.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.paideia.backend.modules.category.domain.CourseCategory;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseCategoryRepository extends JpaRepository<CourseCategory, Long> {

    @Query("select c from CourseCategory c order by lower(c.name) asc, c.id asc")
    List<CourseCategory> findAllOrderByName();

    @Query("select c from CourseCategory c where c.parentId is null order by lower(c.name) asc, c.id asc")
    List<CourseCategory> findRoots();

    @Query("select c from CourseCategory c where c.parentId = :parentId order by lower(c.name) asc, c.id asc")
    List<CourseCategory> findChildren(@Param("parentId") Long parentId);

    @Query("select c.id from CourseCategory c where c.parentId in :parentIds")
    List<Long> findChildIds(@Param("parentIds") Collection<Long> parentIds);

    long countByParentId(Long parentId);

    boolean existsByParentId(Long parentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CourseCategory c where c.id = :id")
    Optional<CourseCategory> findByIdForUpdate(@Param("id") Long id);

    /**
     * Locks the rows and returns {@code [id, parent_id]} as committed, bypassing the persistence
     * context. Rows are locked in id order.
     */
    @Query(value = """
            select id, parent_id
              from course_category
             where id in (:ids)
             order by id
               for update
            """, nativeQuery = true)
    List<Object[]> lockParentLinks(@Param("ids") Collection<Long> ids);
}
