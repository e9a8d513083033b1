package com.example.learning.application.content;

import com.example.learning.application.exception.BusinessException;
import com.example.learning.entity.Course;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Lesson;
import com.example.learning.repository.CourseModuleRepository;
import com.example.learning.repository.CourseRepository;
import com.example.learning.repository.LessonRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class CourseTreeLoader {

	private final CourseRepository courseRepository;
	private final CourseModuleRepository moduleRepository;
	private final LessonRepository lessonRepository;

	@Transactional(readOnly = true)
	public CourseTree load(Long courseId) {
		Course course = courseRepository.findById(courseId)
			.orElseThrow(() -> BusinessException.notFound("코스", courseId));
		return load(course);
	}

	@Transactional(readOnly = true)
	public CourseTree load(Course course) {
		List<CourseModule> modules = moduleRepository.findByCourseIdOrderByOrderIndexAsc(course.getId());
		if (modules.isEmpty()) {
			return new CourseTree(course, List.of());
		}
		List<Long> moduleIds = modules.stream().map(CourseModule::getId).collect(Collectors.toList());
		Map<Long, List<Lesson>> lessonsByModule = lessonRepository.findByModuleIdInOrderByOrderIndexAsc(moduleIds)
			.stream()
			.collect(Collectors.groupingBy(Lesson::getModuleId));

		List<CourseTree.ModuleNode> nodes = new ArrayList<>(modules.size());
		for (CourseModule module : modules) {
			nodes.add(new CourseTree.ModuleNode(module, lessonsByModule.getOrDefault(module.getId(), List.of())));
		}
		return new CourseTree(course, nodes);
	}
}
