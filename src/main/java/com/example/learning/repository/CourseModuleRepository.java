package com.example.learning.repository;

import com.example.learning.entity.CourseModule;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CourseModuleRepository extends JpaRepository<CourseModule, Long> {

	List<CourseModule> findByCourseIdOrderByOrderIndexAsc(Long courseId);

	// 엔티티를 영속성 컨텍스트에 올리지 않고 부모 id 만 조회
	@Query("SELECT m.courseId FROM CourseModule m WHERE m.id = :id")
	Optional<Long> findCourseIdById(@Param("id") Long id);

	// 레슨 생성/재정렬/삭제를 모듈 단위로 직렬화하기 위한 행 잠금
	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@Query("SELECT m FROM CourseModule m WHERE m.id = :id")
	Optional<CourseModule> findByIdForUpdate(@Param("id") Long id);
}
