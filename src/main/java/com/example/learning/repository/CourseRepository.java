package com.example.learning.repository;

import com.example.learning.entity.Course;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseRepository extends JpaRepository<Course, Long> {

	List<Course> findByPublishedTrueOrderByCreatedAtDesc();

	List<Course> findAllByOrderByCreatedAtDesc();

	List<Course> findByPublishedTrueAndFreeTrueOrderByCreatedAtDesc();

	List<Course> findByPublishedTrueAndFreeFalseOrderByCreatedAtDesc();

	// 모듈 생성/재정렬/삭제를 코스 단위로 직렬화하기 위한 행 잠금
	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@Query("SELECT c FROM Course c WHERE c.id = :id")
	Optional<Course> findByIdForUpdate(@Param("id") Long id);

	@Modifying
	@Query("UPDATE Course c SET c.studentCount = c.studentCount + 1 WHERE c.id = :courseId")
	int incrementStudentCount(@Param("courseId") Long courseId);
}
