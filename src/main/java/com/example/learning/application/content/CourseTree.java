package com.example.learning.application.content;

import com.example.learning.entity.Course;
import com.example.learning.entity.CourseModule;
import com.example.learning.entity.Lesson;
import java.util.List;
import lombok.Value;

/**
 * 게시 여부와 무관하게 저장소에 있는 그대로의 코스 구조. 모듈과 레슨은 orderIndex 순으로 정렬되어 있다.
 */
@Value
public class CourseTree {

	Course course;

	List<ModuleNode> modules;

	@Value
	public static class ModuleNode {
		CourseModule module;
		List<Lesson> lessons;
	}
}
