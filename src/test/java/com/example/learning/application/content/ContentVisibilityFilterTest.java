package com.example.learning.application.content;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.learning.application.access.AccessTier;
import com.example.learning.entity.Course;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Lesson;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentVisibilityFilterTest {

	private final ContentVisibilityFilter filter = new ContentVisibilityFilter();

	private CourseTree tree;

	@BeforeEach
	void setUp() {
		Course course = new Course();
		course.setId(1L);
		course.setTitle("Java 입문");
		course.setFree(true);

		// 모듈 10 (게시): 레슨 100 (게시), 101 (미게시)
		// 모듈 11 (미게시): 레슨 110 (게시)
		// 모듈 12 (게시): 레슨 없음
		tree = new CourseTree(course, List.of(
			new CourseTree.ModuleNode(module(10L, 0, true), List.of(lesson(100L, 10L, 0, true), lesson(101L, 10L, 1, false))),
			new CourseTree.ModuleNode(module(11L, 1, false), List.of(lesson(110L, 11L, 0, true))),
			new CourseTree.ModuleNode(module(12L, 2, true), List.of())
		));
	}

	// 시나리오 A: 게시 모듈만 노출
	@Test
	void testFilterTree_freePreviewShowsOnlyPublished() {
		FilteredTree filtered = filter.filterTree(tree, AccessTier.FREE_PREVIEW);

		assertEquals(List.of(10L, 12L), moduleIds(filtered));
		assertEquals(List.of(100L), lessonIds(filtered));
		assertTrue(filtered.getModules().get(1).getLessons().isEmpty());
	}

	@Test
	void testFilterTree_noAccessHidesStructure() {
		FilteredTree filtered = filter.filterTree(tree, AccessTier.NO_ACCESS);

		assertEquals(1L, filtered.getCourseId());
		assertEquals("Java 입문", filtered.getTitle());
		assertTrue(filtered.getModules().isEmpty());
	}

	// ADMIN_PREVIEW 는 원본 구조와 같은 id 집합을 돌려준다
	@Test
	void testFilterTree_adminPreviewRoundTrip() {
		FilteredTree filtered = filter.filterTree(tree, AccessTier.ADMIN_PREVIEW);

		assertEquals(List.of(10L, 11L, 12L), moduleIds(filtered));
		assertEquals(List.of(100L, 101L, 110L), lessonIds(filtered));
	}

	@Test
	void testFilterTree_adminPreviewMarksDrafts() {
		FilteredTree filtered = filter.filterTree(tree, AccessTier.ADMIN_PREVIEW);

		FilteredTree.ModuleEntry published = filtered.getModules().get(0);
		FilteredTree.ModuleEntry draftModule = filtered.getModules().get(1);
		assertFalse(published.isDraft());
		assertFalse(published.getLessons().get(0).isDraft());
		assertTrue(published.getLessons().get(1).isDraft());
		assertTrue(draftModule.isDraft());
		// 게시된 레슨이라도 미게시 모듈 안에 있으면 draft
		assertTrue(draftModule.getLessons().get(0).isDraft());
	}

	@Test
	void testPublishedLessonIds_excludesLessonsInDraftModules() {
		Set<Long> ids = filter.publishedLessonIds(tree);

		assertEquals(Set.of(100L), ids);
	}

	private List<Long> moduleIds(FilteredTree filtered) {
		return filtered.getModules().stream().map(FilteredTree.ModuleEntry::getId).collect(Collectors.toList());
	}

	private List<Long> lessonIds(FilteredTree filtered) {
		return filtered.getModules().stream()
			.flatMap(m -> m.getLessons().stream())
			.map(FilteredTree.LessonEntry::getId)
			.collect(Collectors.toList());
	}

	static CourseModule module(Long id, int orderIndex, boolean published) {
		CourseModule module = new CourseModule();
		module.setId(id);
		module.setCourseId(1L);
		module.setTitle("module-" + id);
		module.setOrderIndex(orderIndex);
		module.setPublished(published);
		return module;
	}

	static Lesson lesson(Long id, Long moduleId, int orderIndex, boolean published) {
		Lesson lesson = new Lesson();
		lesson.setId(id);
		lesson.setModuleId(moduleId);
		lesson.setTitle("lesson-" + id);
		lesson.setOrderIndex(orderIndex);
		lesson.setPublished(published);
		return lesson;
	}
}
