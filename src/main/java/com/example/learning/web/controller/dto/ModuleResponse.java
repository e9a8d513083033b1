package com.example.learning.web.controller.dto;

import com.example.learning.entity.CourseModule;
import lombok.Value;

@Value
public class ModuleResponse {
	Long id;
	Long courseId;
	String title;
	String description;
	int orderIndex;
	boolean published;

	public static ModuleResponse from(CourseModule module) {
		return new ModuleResponse(module.getId(), module.getCourseId(), module.getTitle(),
			module.getDescription(), module.getOrderIndex(), module.isPublished());
	}
}
