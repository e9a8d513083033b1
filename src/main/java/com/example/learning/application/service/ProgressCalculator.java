package com.example.learning.application.service;

import com.example.learning.application.content.ContentVisibilityFilter;
import com.example.learning.application.content.CourseTree;
import com.example.learning.application.content.CourseTreeLoader;
import com.example.learning.entity.Course;
import com.example.learning.repository.LessonCompletionRepository;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 현재 게시된 레슨 집합을 분모로 진도율을 계산한다.
 * 게시된 레슨이 하나도 없으면 0 이다.
 */
@Component
@RequiredArgsConstructor
public class ProgressCalculator {

	private final CourseTreeLoader courseTreeLoader;
	private final ContentVisibilityFilter visibilityFilter;
	private final LessonCompletionRepository completionRepository;

	public int calculate(String userId, Course course) {
		CourseTree tree = courseTreeLoader.load(course);
		Set<Long> publishedLessonIds = visibilityFilter.publishedLessonIds(tree);
		if (publishedLessonIds.isEmpty()) {
			return 0;
		}
		long completed = completionRepository.countByUserIdAndLessonIdIn(userId, publishedLessonIds);
		return percentage(completed, publishedLessonIds.size());
	}

	static int percentage(long completed, int total) {
		if (total == 0) {
			return 0;
		}
		if (completed < 0 || completed > total) {
			throw new IllegalStateException("completed lessons out of range: " + completed + "/" + total);
		}
		return (int) Math.round(100.0 * completed / total);
	}
}
