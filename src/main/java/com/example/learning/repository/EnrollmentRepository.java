package com.example.learning.repository;

import com.example.learning.entity.Enrollment;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

	boolean existsByUserIdAndCourseId(String userId, Long courseId);

	@Query("SELECT e.courseId FROM Enrollment e WHERE e.userId = :userId ORDER BY e.enrolledAt DESC, e.id DESC")
	List<Long> findCourseIdsByUserId(@Param("userId") String userId);

	@Query("SELECT e.id FROM Enrollment e WHERE e.courseId = :courseId")
	List<Long> findIdsByCourseId(@Param("courseId") Long courseId);

	@Query("SELECT e.id FROM Enrollment e WHERE e.progressStale = true")
	List<Long> findStaleIds();

	// (user, course) 단위 진행률 갱신을 직렬화하기 위한 행 잠금
	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@Query("SELECT e FROM Enrollment e WHERE e.userId = :userId AND e.courseId = :courseId")
	Optional<Enrollment> findForUpdate(@Param("userId") String userId, @Param("courseId") Long courseId);

	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@Query("SELECT e FROM Enrollment e WHERE e.id = :id")
	Optional<Enrollment> findByIdForUpdate(@Param("id") Long id);

	// 코스 구조 변경 시 해당 코스의 모든 수강 진행률을 무효화
	@Modifying
	@Query("UPDATE Enrollment e SET e.progressStale = true WHERE e.courseId = :courseId")
	int markProgressStale(@Param("courseId") Long courseId);
}
