package com.example.learning.repository;

import com.example.learning.entity.Lesson;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LessonRepository extends JpaRepository<Lesson, Long> {

	List<Lesson> findByModuleIdOrderByOrderIndexAsc(Long moduleId);

	List<Lesson> findByModuleIdInOrderByOrderIndexAsc(Collection<Long> moduleIds);

	@Query("SELECT l.moduleId FROM Lesson l WHERE l.id = :id")
	Optional<Long> findModuleIdById(@Param("id") Long id);

	@Query("SELECT l.id FROM Lesson l WHERE l.moduleId = :moduleId")
	List<Long> findIdsByModuleId(@Param("moduleId") Long moduleId);

	@Modifying
	@Query("DELETE FROM Lesson l WHERE l.moduleId = :moduleId")
	int deleteByModuleId(@Param("moduleId") Long moduleId);
}
