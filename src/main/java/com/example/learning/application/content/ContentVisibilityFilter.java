package com.example.learning.application.content;

import com.example.learning.application.access.AccessTier;
import com.example.learning.entity.Course;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Lesson;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * 접근 등급에 따라 코스 구조를 걸러낸다.
 *
 * - ADMIN_PREVIEW: 전체 구조를 그대로 반환 (미게시 항목은 draft 로 표시)
 * - NO_ACCESS: 모듈/레슨 없이 코스 메타데이터만 반환
 * - 그 외: 게시된 모듈과, 그 안의 게시된 레슨만 반환. 게시된 레슨이 없는 게시 모듈도 빈 모듈로 포함한다.
 */
@Component
public class ContentVisibilityFilter {

	public FilteredTree filterTree(CourseTree tree, AccessTier accessTier) {
		Course course = tree.getCourse();
		if (!accessTier.grantsAccess()) {
			return new FilteredTree(course.getId(), course.getTitle(), course.getDescription(), accessTier, List.of());
		}

		boolean includeDrafts = accessTier.includesDrafts();
		List<FilteredTree.ModuleEntry> modules = new ArrayList<>();
		for (CourseTree.ModuleNode node : tree.getModules()) {
			CourseModule module = node.getModule();
			if (!includeDrafts && !module.isPublished()) {
				continue;
			}
			List<FilteredTree.LessonEntry> lessons = new ArrayList<>();
			for (Lesson lesson : node.getLessons()) {
				if (!includeDrafts && !lesson.isPublished()) {
					continue;
				}
				lessons.add(new FilteredTree.LessonEntry(
					lesson.getId(),
					lesson.getTitle(),
					lesson.getContentType(),
					lesson.getOrderIndex(),
					lesson.getDuration(),
					lesson.isPublished(),
					!isVisible(module, lesson)));
			}
			modules.add(new FilteredTree.ModuleEntry(
				module.getId(),
				module.getTitle(),
				module.getDescription(),
				module.getOrderIndex(),
				module.isPublished(),
				!module.isPublished(),
				lessons));
		}
		return new FilteredTree(course.getId(), course.getTitle(), course.getDescription(), accessTier, modules);
	}

	/**
	 * 진도율 계산의 분모가 되는, 게시된 모듈 안의 게시된 레슨 id 집합.
	 */
	public Set<Long> publishedLessonIds(CourseTree tree) {
		Set<Long> ids = new LinkedHashSet<>();
		for (CourseTree.ModuleNode node : tree.getModules()) {
			for (Lesson lesson : node.getLessons()) {
				if (isVisible(node.getModule(), lesson)) {
					ids.add(lesson.getId());
				}
			}
		}
		return ids;
	}

	public boolean isVisible(CourseModule module, Lesson lesson) {
		return module.isPublished() && lesson.isPublished();
	}
}
