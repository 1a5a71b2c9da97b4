package com.paideia.backend.modules.course.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.paideia.backend.modules.course.domain.Course;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseRepository extends JpaRepository<Course, Long> {

    long countByCategoryId(Long categoryId);

    boolean existsByCategoryId(Long categoryId);

    @Query("""
            select c.categoryId, count(c)
              from Course c
             where c.categoryId is not null
             group by c.categoryId
            """)
    List<Object[]> countGroupedByCategory();

    @Query("select c from Course c where c.categoryId in :categoryIds")
    List<Course> findByCategoryIdIn(@Param("categoryIds") Collection<Long> categoryIds);

    @Query("select c.id from Course c order by c.id asc")
    List<Long> findAllIds();
}
