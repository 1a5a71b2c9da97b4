package com.paideia.backend.modules.course.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.paideia.backend.modules.course.domain.Enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    @Query("""
            select e
              from Enrollment e
             where e.userId = :userId
               and e.courseId = :courseId
               and e.status = com.paideia.backend.modules.course.domain.EnrollmentStatus.ACTIVE
            """)
    Optional<Enrollment> findActiveEnrollment(@Param("userId") Long userId, @Param("courseId") Long courseId);

    @Query("""
            select e
              from Enrollment e
             where e.userId = :userId
               and e.status = com.paideia.backend.modules.course.domain.EnrollmentStatus.ACTIVE
            """)
    List<Enrollment> findActiveEnrollments(@Param("userId") Long userId);
}
