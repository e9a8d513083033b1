package com.example.learning.repository;

import com.example.learning.entity.LessonCompletion;
import java.util.Collection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LessonCompletionRepository extends JpaRepository<LessonCompletion, Long> {

	boolean existsByUserIdAndLessonId(String userId, Long lessonId);

	long countByUserIdAndLessonIdIn(String userId, Collection<Long> lessonIds);

	@Modifying
	@Query("DELETE FROM LessonCompletion lc WHERE lc.userId = :userId AND lc.lessonId = :lessonId")
	int deleteByUserIdAndLessonId(@Param("userId") String userId, @Param("lessonId") Long lessonId);

	@Modifying
	@Query("DELETE FROM LessonCompletion lc WHERE lc.lessonId IN :lessonIds")
	int deleteByLessonIdIn(@Param("lessonIds") Collection<Long> lessonIds);
}
