package com.example.learning.web.controller.dto;

import com.example.learning.entity.Course;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CourseResponse {
	Long id;
	String title;
	String description;
	String category;
	String level;
	BigDecimal price;
	boolean free;
	boolean published;
	int studentCount;
	LocalDateTime createdAt;

	public static CourseResponse from(Course course) {
		return CourseResponse.builder()
			.id(course.getId())
			.title(course.getTitle())
			.description(course.getDescription())
			.category(course.getCategory())
			.level(course.getLevel())
			.price(course.getPrice())
			.free(course.isFree())
			.published(course.isPublished())
			.studentCount(course.getStudentCount())
			.createdAt(course.getCreatedAt())
			.build();
	}
}
